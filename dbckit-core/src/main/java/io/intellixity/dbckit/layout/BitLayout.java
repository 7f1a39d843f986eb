package io.intellixity.dbckit.layout;

import io.intellixity.dbckit.model.ByteOrder;

import java.util.List;
import java.util.Objects;

/**
 * Absolute bit positions a signal occupies in its message payload.
 * <p>
 * A position is {@code byteIndex * 8 + bitInByte} with bit 0 the least significant bit of the byte.
 * {@link #bits()} is ordered from the signal's least significant bit to its most significant bit.
 */
public record BitLayout(ByteOrder byteOrder, int startBit, int length, List<Integer> bits) {
  public BitLayout {
    Objects.requireNonNull(byteOrder, "byteOrder");
    bits = List.copyOf(bits);
    if (bits.size() != length) {
      throw new IllegalStateException("layout has " + bits.size() + " positions for length " + length);
    }
  }

  /** Position of the signal's least significant bit. */
  public int lsb() { return bits.get(0); }

  /** Position of the signal's most significant bit. */
  public int msb() { return bits.get(bits.size() - 1); }

  public int minBit() {
    int min = Integer.MAX_VALUE;
    for (int b : bits) min = Math.min(min, b);
    return min;
  }

  public int maxBit() {
    int max = Integer.MIN_VALUE;
    for (int b : bits) max = Math.max(max, b);
    return max;
  }

  /** Smallest payload, in bytes, that holds every bit of the signal. */
  public int requiredBytes() {
    return maxBit() / 8 + 1;
  }

  public boolean fitsIn(int sizeBytes) {
    return minBit() >= 0 && maxBit() < sizeBytes * 8;
  }

  /**
   * Start bit as CANdb++ displays it: the declared start bit for Intel signals, the position of the
   * least significant bit for Motorola signals.
   */
  public int displayStartBit() {
    return byteOrder == ByteOrder.LITTLE_ENDIAN ? startBit : lsb();
  }

  public boolean overlaps(BitLayout other) {
    for (int b : bits) {
      if (other.bits.contains(b)) return true;
    }
    return false;
  }
}
