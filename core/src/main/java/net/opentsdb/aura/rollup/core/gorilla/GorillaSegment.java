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

import net.opentsdb.aura.rollup.core.data.BufferPool;

import java.util.Arrays;

/**
 * Append only bit stream over a pooled byte array. Bits are written most
 * significant first. The array grows by claiming a bigger one from the pool and
 * returning the old one.
 */
public class GorillaSegment {

  static final int INITIAL_CAPACITY_BYTES = 64;

  private final BufferPool pool;
  private byte[] buffer;
  private int bitIndex;

  public GorillaSegment(final BufferPool pool) {
    this(pool, INITIAL_CAPACITY_BYTES);
  }

  public GorillaSegment(final BufferPool pool, final int initialCapacityBytes) {
    this.pool = pool;
    this.buffer = pool.acquire(initialCapacityBytes);
  }

  public void write(final long value, final int bitsToWrite) {
    if (bitsToWrite < 1 || bitsToWrite > 64) {
      throw new IllegalArgumentException(
          String.format("Invalid bitsToWrite %d. Expected between %d to %d", bitsToWrite, 1, 64));
    }
    if (buffer == null) {
      throw new IllegalStateException("Segment was released");
    }
    ensureCapacity(bitIndex + bitsToWrite);

    int remaining = bitsToWrite;
    while (remaining > 0) {
      int byteIndex = bitIndex >>> 3;
      int free = Byte.SIZE - (bitIndex & 7);
      int n = Math.min(free, remaining);
      int bits = (int) (value >>> (remaining - n)) & ((1 << n) - 1);
      buffer[byteIndex] |= (byte) (bits << (free - n));
      remaining -= n;
      bitIndex += n;
    }
  }

  public int getBitIndex() {
    return bitIndex;
  }

  public int lengthBytes() {
    return (bitIndex + 7) >>> 3;
  }

  /** @return a compact copy of the written bytes, trailing bits zero padded. */
  public byte[] toByteArray() {
    return Arrays.copyOf(buffer, lengthBytes());
  }

  /** @return an independent copy backed by {@code target}. */
  public GorillaSegment copy(final BufferPool target) {
    GorillaSegment copy = new GorillaSegment(target, Math.max(buffer.length, 1));
    System.arraycopy(buffer, 0, copy.buffer, 0, lengthBytes());
    copy.bitIndex = bitIndex;
    return copy;
  }

  /** Hands the backing array back to the pool. The segment is unusable afterwards. */
  public void release() {
    if (buffer != null) {
      pool.release(buffer);
      buffer = null;
    }
  }

  private void ensureCapacity(final int bits) {
    int bytes = (bits + 7) >>> 3;
    if (bytes <= buffer.length) {
      return;
    }
    byte[] grown = pool.acquire(Math.max(bytes, buffer.length << 1));
    System.arraycopy(buffer, 0, grown, 0, lengthBytes());
    pool.release(buffer);
    buffer = grown;
  }
}
