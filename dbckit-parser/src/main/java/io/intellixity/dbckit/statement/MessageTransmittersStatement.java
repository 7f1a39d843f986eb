package io.intellixity.dbckit.statement;

import java.util.List;

/** {@code BO_TX_BU_ id : node, node} */
public record MessageTransmittersStatement(int line, long encodedId, List<String> transmitters) implements DbcStatement {
  @Override
  public StatementKind kind() {
    return StatementKind.MESSAGE_TRANSMITTERS;
  }
}
