package io.intellixity.dbckit.layout;

import io.intellixity.dbckit.model.ByteOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Maps a signal's declared start bit, length and byte order to the absolute bit positions it occupies.
 * <p>
 * Intel (little endian): the start bit is the signal's LSB and further bits follow at increasing
 * positions, crossing into the next byte after bit 7.
 * <p>
 * Motorola (big endian): the start bit is the signal's MSB. Less significant bits are found by
 * counting down inside the byte; after bit 0 of a byte the walk continues at bit 7 of the next byte.
 * This is the numbering every DBC tool uses, e.g. start bit 7 with length 16 covers all of bytes 0
 * and 1 with byte 0 holding the high half.
 */
public final class BitLayoutResolver {
  public static final int MAX_LENGTH = 64;

  private BitLayoutResolver() {}

  public static BitLayout resolve(int startBit, int length, ByteOrder byteOrder) {
    Objects.requireNonNull(byteOrder, "byteOrder");
    if (length <= 0 || length > MAX_LENGTH) {
      throw new BitLayoutException("bit length " + length + " outside 1.." + MAX_LENGTH);
    }
    if (startBit < 0) {
      throw new BitLayoutException("start bit " + startBit + " is negative");
    }

    List<Integer> bits = new ArrayList<>(length);
    if (byteOrder == ByteOrder.LITTLE_ENDIAN) {
      for (int i = 0; i < length; i++) bits.add(startBit + i);
    } else {
      // walk MSB -> LSB, then flip so the list reads LSB -> MSB like the Intel case
      int pos = startBit;
      for (int i = 0; i < length; i++) {
        bits.add(pos);
        pos = (pos % 8 == 0) ? pos + 15 : pos - 1;
      }
      Collections.reverse(bits);
    }
    return new BitLayout(byteOrder, startBit, length, bits);
  }

  /** Resolve and require every bit to lie inside a payload of {@code sizeBytes} bytes. */
  public static BitLayout resolve(int startBit, int length, ByteOrder byteOrder, int sizeBytes) {
    BitLayout layout = resolve(startBit, length, byteOrder);
    if (!layout.fitsIn(sizeBytes)) {
      throw new BitLayoutException("bits " + layout.minBit() + ".." + layout.maxBit()
          + " (start " + startBit + ", length " + length + ", " + byteOrder.displayName()
          + ") exceed message size of " + sizeBytes + " bytes");
    }
    return layout;
  }
}
