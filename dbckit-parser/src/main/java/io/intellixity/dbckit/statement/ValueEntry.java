package io.intellixity.dbckit.statement;

/** One {@code value "label"} pair of {@code VAL_TABLE_} or {@code VAL_}. */
public record ValueEntry(long value, String label) {
}
