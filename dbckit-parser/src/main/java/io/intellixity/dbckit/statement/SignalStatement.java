package io.intellixity.dbckit.statement;

import io.intellixity.dbckit.model.ByteOrder;
import io.intellixity.dbckit.model.MultiplexRole;
import io.intellixity.dbckit.model.ValueType;

import java.util.List;

/**
 * {@code SG_ name [mux] : start|length@order sign (factor,offset) [min|max] "unit" receivers}
 * <p>
 * Belongs to the closest preceding {@code BO_}; the grammar does not know which one.
 */
public record SignalStatement(
    int line,
    String name,
    MultiplexRole multiplex,
    int startBit,
    int length,
    ByteOrder byteOrder,
    ValueType valueType,
    double factor,
    double offset,
    double minimum,
    double maximum,
    String unit,
    List<String> receivers
) implements DbcStatement {
  public SignalStatement {
    receivers = receivers == null ? List.of() : List.copyOf(receivers);
  }

  @Override
  public StatementKind kind() {
    return StatementKind.SIGNAL;
  }
}
