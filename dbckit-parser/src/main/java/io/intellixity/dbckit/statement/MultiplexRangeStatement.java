package io.intellixity.dbckit.statement;

import io.intellixity.dbckit.model.SwitchRange;

import java.util.List;

/** {@code SG_MUL_VAL_ id signal switch from-to, ...} */
public record MultiplexRangeStatement(int line, long encodedId, String signalName, String switchName, List<SwitchRange.Range> ranges) implements DbcStatement {
  @Override
  public StatementKind kind() {
    return StatementKind.MULTIPLEX_RANGE;
  }
}
