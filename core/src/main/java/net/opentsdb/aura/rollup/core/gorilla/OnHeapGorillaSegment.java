/*
 * This file is part of OpenTSDB.
 * Copyright (C) 2021  Yahoo.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.opentsdb.aura.rollup.core.gorilla;

/**
 * Read cursor over an encoded chunk. The buffer is never written, so any
 * number of cursors can walk the same array.
 */
public class OnHeapGorillaSegment {

  private final byte[] buffer;
  private final int startingOffset;
  private final long lengthBits;

  private long bitIndex;

  public OnHeapGorillaSegment(final byte[] buffer, final int startingOffset, final int length) {
    if (startingOffset < 0 || length < 0 || startingOffset + length > buffer.length) {
      throw new IllegalArgumentException(
          "Invalid range offset: " + startingOffset + " length: " + length
              + " buffer: " + buffer.length);
    }
    this.buffer = buffer;
    this.startingOffset = startingOffset;
    this.lengthBits = (long) length * Byte.SIZE;
  }

  public long read(final int bitsToRead) {
    if (bitsToRead < 1 || bitsToRead > 64) {
      throw new IllegalArgumentException(
          String.format("Invalid bitsToRead %d. Expected between %d to %d", bitsToRead, 1, 64));
    }
    if (bitIndex + bitsToRead > lengthBits) {
      throw new DecodeCorruptionException(
          "Truncated chunk: need " + bitsToRead + " bits at bit " + bitIndex
              + " of " + lengthBits);
    }

    long result = 0;
    int remaining = bitsToRead;
    while (remaining > 0) {
      int byteIndex = startingOffset + (int) (bitIndex >>> 3);
      int available = Byte.SIZE - (int) (bitIndex & 7);
      int n = Math.min(available, remaining);
      int bits = ((buffer[byteIndex] & 0xFF) >>> (available - n)) & ((1 << n) - 1);
      result = (result << n) | bits;
      remaining -= n;
      bitIndex += n;
    }
    return result;
  }

  /**
   * Counts leading one bits up to {@code limit}, consuming the terminating
   * zero if there is one.
   */
  public int readControlPrefix(final int limit) {
    int bits = 0;
    while (bits < limit) {
      if (read(1) == 0) {
        return bits;
      }
      bits++;
    }
    return bits;
  }

  public long getBitIndex() {
    return bitIndex;
  }

  public long remainingBits() {
    return lengthBits - bitIndex;
  }
}
