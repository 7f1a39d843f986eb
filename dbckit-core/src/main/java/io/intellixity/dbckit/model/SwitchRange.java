package io.intellixity.dbckit.model;

import java.util.List;
import java.util.Objects;

/**
 * Extended multiplexing entry ({@code SG_MUL_VAL_}): the multiplexor a signal depends on and the
 * multiplexor values, as inclusive ranges, for which the signal is present.
 */
public record SwitchRange(String switchName, List<Range> ranges) {
  public record Range(long from, long to) {
    public Range {
      if (from > to) throw new IllegalArgumentException("Range start " + from + " is after end " + to);
    }

    public boolean contains(long v) {
      return v >= from && v <= to;
    }
  }

  public SwitchRange {
    Objects.requireNonNull(switchName, "switchName");
    ranges = ranges == null ? List.of() : List.copyOf(ranges);
  }

  public boolean contains(long switchValue) {
    for (Range r : ranges) {
      if (r.contains(switchValue)) return true;
    }
    return false;
  }
}
