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

import java.util.concurrent.TimeUnit;

/**
 * Header layout of a chunk. Both profiles share the delta-of-delta and XOR
 * payload; they differ in the width of the first delta, in whether the point
 * count lives in the header and in the delta-of-delta group table.
 *
 * <p>Group table rows are {value bits, control value, control bits}.
 */
public enum ChunkProfile {

  /**
   * 14 bit first delta, chunk offsets up to {@link #BOUNDED_MAX_OFFSET}. The
   * stream is closed with an end marker so no count is stored.
   */
  BOUNDED(
      (byte) 1,
      14,
      false,
      new int[][] {{7, 0b10, 2}, {9, 0b110, 3}, {12, 0b1110, 4}, {32, 0b1111, 4}}),

  /**
   * 32 bit first delta and a point count in the header. The extra 64 bit group
   * takes any jump between unsigned 32 bit timestamps.
   */
  UNBOUNDED(
      (byte) 2,
      32,
      true,
      new int[][] {
        {7, 0b10, 2}, {9, 0b110, 3}, {12, 0b1110, 4}, {32, 0b11110, 5}, {64, 0b11111, 5}
      });

  public static final long MAX_TIMESTAMP = 0xFFFFFFFFL;

  /** All ones in the first delta of a bounded chunk marks it empty. */
  public static final long BOUNDED_EMPTY_MARKER = (1L << 14) - 1;
  public static final long BOUNDED_MAX_OFFSET = BOUNDED_EMPTY_MARKER - 1;

  /** Encoded value of the 32 bit group that closes a bounded stream. */
  public static final long BOUNDED_END_MARKER = 0xFFFFFFFFL;

  /** Widest chunk span that always fits the bounded profile. */
  public static final int BOUNDED_MAX_SPAN = (int) TimeUnit.HOURS.toSeconds(4);

  public static final int TIMESTAMP_BITS = 32;
  public static final int COUNT_BITS = 32;

  private final byte id;
  private final int firstDeltaBits;
  private final boolean countInHeader;
  private final int[][] timestampEncodings;

  ChunkProfile(
      final byte id,
      final int firstDeltaBits,
      final boolean countInHeader,
      final int[][] timestampEncodings) {
    this.id = id;
    this.firstDeltaBits = firstDeltaBits;
    this.countInHeader = countInHeader;
    this.timestampEncodings = timestampEncodings;
  }

  public byte getId() {
    return id;
  }

  public int getFirstDeltaBits() {
    return firstDeltaBits;
  }

  public boolean isCountInHeader() {
    return countInHeader;
  }

  /** @return number of delta-of-delta groups, also the longest control prefix. */
  public int getGroupCount() {
    return timestampEncodings.length;
  }

  int valueBits(final int group) {
    return timestampEncodings[group][0];
  }

  int controlValue(final int group) {
    return timestampEncodings[group][1];
  }

  int controlBits(final int group) {
    return timestampEncodings[group][2];
  }

  /** @return header length in bytes: t0 and, when present, the count. */
  public int headerBytes() {
    return (TIMESTAMP_BITS + (countInHeader ? COUNT_BITS : 0)) / Byte.SIZE;
  }

  /** @return the largest {@code ts - t0} a point may have in this profile. */
  public long maxOffset() {
    return countInHeader ? MAX_TIMESTAMP : BOUNDED_MAX_OFFSET;
  }

  /** Picks the tighter profile when every offset of the span fits it. */
  public static ChunkProfile forSpan(final int chunkSpan) {
    return chunkSpan <= BOUNDED_MAX_SPAN ? BOUNDED : UNBOUNDED;
  }

  public static ChunkProfile getById(final byte id) {
    for (ChunkProfile profile : values()) {
      if (profile.id == id) {
        return profile;
      }
    }
    throw new DecodeCorruptionException("Unknown chunk profile id " + id);
  }
}
