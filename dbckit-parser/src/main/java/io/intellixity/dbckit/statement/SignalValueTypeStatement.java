package io.intellixity.dbckit.statement;

/** {@code SIG_VALTYPE_ id signal : code} with code 0 (integer), 1 (float) or 2 (double). */
public record SignalValueTypeStatement(int line, long encodedId, String signalName, int code) implements DbcStatement {
  @Override
  public StatementKind kind() {
    return StatementKind.SIGNAL_VALUE_TYPE;
  }
}
