package io.intellixity.dbckit.statement;

/** {@code BO_ id name : size transmitter}; transmitter is null when omitted. */
public record MessageStatement(int line, long encodedId, String name, int size, String transmitter) implements DbcStatement {
  @Override
  public StatementKind kind() {
    return StatementKind.MESSAGE;
  }
}
