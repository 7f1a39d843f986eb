package io.intellixity.dbckit.statement;

import java.util.List;

/** {@code SIG_GROUP_ id name repetitions : signal ...} */
public record SignalGroupStatement(int line, long encodedId, String name, int repetitions, List<String> signalNames) implements DbcStatement {
  @Override
  public StatementKind kind() {
    return StatementKind.SIGNAL_GROUP;
  }
}
