package io.intellixity.dbckit.statement;

import io.intellixity.dbckit.model.BitTiming;

/** {@code BS_: [baudrate : btr1 , btr2]} */
public record BitTimingStatement(int line, BitTiming timing) implements DbcStatement {
  @Override
  public StatementKind kind() {
    return StatementKind.BIT_TIMING;
  }
}
