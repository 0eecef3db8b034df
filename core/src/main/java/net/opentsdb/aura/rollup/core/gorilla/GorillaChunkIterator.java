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

import net.opentsdb.aura.rollup.core.data.ByteArrays;

import static net.opentsdb.aura.rollup.core.gorilla.ChunkProfile.BOUNDED_EMPTY_MARKER;
import static net.opentsdb.aura.rollup.core.gorilla.ChunkProfile.BOUNDED_END_MARKER;
import static net.opentsdb.aura.rollup.core.gorilla.ChunkProfile.MAX_TIMESTAMP;
import static net.opentsdb.aura.rollup.core.gorilla.GorillaChunk.LEADING_ZERO_LENGTH_BITS;
import static net.opentsdb.aura.rollup.core.gorilla.GorillaChunk.MEANINGFUL_BIT_LENGTH_BITS;

/**
 * Decodes a chunk produced by {@link GorillaChunk#bytes()}. The predictive
 * state (last delta, last value and its zero block) is rebuilt from the stream,
 * so each iterator is independent of the encoder and of other iterators.
 */
public class GorillaChunkIterator implements ChunkIterator {

  private final ChunkProfile profile;
  private OnHeapGorillaSegment segment;
  private long t0;
  private long count = -1;

  private long dataPoints;
  private long lastTimestamp;
  private long lastTimestampDelta;
  private long lastValue;
  private int lastValueLeadingZeros = 64;
  private int lastValueTrailingZeros = 64;

  private long timestamp;
  private double value;
  private boolean done;
  private DecodeCorruptionException error;

  public static GorillaChunkIterator of(final byte[] bytes, final ChunkProfile profile) {
    return new GorillaChunkIterator(bytes, 0, bytes.length, profile);
  }

  public GorillaChunkIterator(
      final byte[] buffer, final int offset, final int length, final ChunkProfile profile) {
    this.profile = profile;
    int headerBytes = profile.headerBytes();
    if (length < headerBytes) {
      fail(new DecodeCorruptionException(
          "Chunk of " + length + " bytes is shorter than its " + headerBytes + " byte header"));
      return;
    }
    this.t0 = ByteArrays.getUnsignedInt(buffer, offset);
    if (profile.isCountInHeader()) {
      this.count = ByteArrays.getUnsignedInt(buffer, offset + Integer.BYTES);
    }
    this.segment =
        new OnHeapGorillaSegment(buffer, offset + headerBytes, length - headerBytes);
  }

  @Override
  public boolean next() {
    if (done) {
      return false;
    }
    try {
      if (dataPoints == count) {
        done = true;
        return false;
      }
      if (dataPoints == 0) {
        if (!readFirst()) {
          done = true;
          return false;
        }
      } else {
        if (!readNextTimestamp()) {
          done = true;
          return false;
        }
        readNextValue();
      }
      if (timestamp > MAX_TIMESTAMP) {
        throw new DecodeCorruptionException(
            "Decoded timestamp " + timestamp + " is outside the 32 bit range");
      }
      lastTimestamp = timestamp;
      value = Double.longBitsToDouble(lastValue);
      dataPoints++;
      return true;
    } catch (DecodeCorruptionException e) {
      fail(e);
      return false;
    }
  }

  @Override
  public long timestamp() {
    return timestamp;
  }

  @Override
  public double value() {
    return value;
  }

  @Override
  public DecodeCorruptionException error() {
    return error;
  }

  public long getT0() {
    return t0;
  }

  private boolean readFirst() {
    long delta = segment.read(profile.getFirstDeltaBits());
    if (!profile.isCountInHeader() && delta == BOUNDED_EMPTY_MARKER) {
      return false;
    }
    timestamp = t0 + delta;
    lastTimestampDelta = delta;
    lastValue = segment.read(Long.SIZE);
    lastValueLeadingZeros = 64;
    lastValueTrailingZeros = 64;
    return true;
  }

  private boolean readNextTimestamp() {
    int groupCount = profile.getGroupCount();
    int type = segment.readControlPrefix(groupCount);
    if (type > 0) {
      int group = type - 1;
      int valueBits = profile.valueBits(group);
      long encodedValue = segment.read(valueBits);
      if (!profile.isCountInHeader()
          && group == groupCount - 1
          && encodedValue == BOUNDED_END_MARKER) {
        return false;
      }
      long deltaOfDelta = encodedValue - (1L << (valueBits - 1));
      if (deltaOfDelta >= 0) {
        deltaOfDelta++;
      }
      lastTimestampDelta += deltaOfDelta;
    }
    if (lastTimestampDelta <= 0 || lastTimestampDelta > MAX_TIMESTAMP) {
      throw new DecodeCorruptionException(
          "Invalid timestamp delta " + lastTimestampDelta + " at point " + dataPoints);
    }
    timestamp = lastTimestamp + lastTimestampDelta;
    return true;
  }

  private void readNextValue() {
    if (segment.read(1) == 0) {
      return; // same as the previous value
    }
    long xor;
    if (segment.read(1) == 0) {
      if (lastValueLeadingZeros + lastValueTrailingZeros >= Long.SIZE) {
        throw new DecodeCorruptionException(
            "Point " + dataPoints + " reuses a value block that was never written");
      }
      int bitsToRead = Long.SIZE - lastValueLeadingZeros - lastValueTrailingZeros;
      xor = segment.read(bitsToRead) << lastValueTrailingZeros;
    } else {
      int leadingZeros = (int) segment.read(LEADING_ZERO_LENGTH_BITS);
      int blockSize = (int) segment.read(MEANINGFUL_BIT_LENGTH_BITS);
      if (blockSize < 1 || leadingZeros + blockSize > Long.SIZE) {
        throw new DecodeCorruptionException(
            "Invalid value block leading: " + leadingZeros + " size: " + blockSize);
      }
      int trailingZeros = Long.SIZE - blockSize - leadingZeros;
      xor = segment.read(blockSize) << trailingZeros;
      lastValueLeadingZeros = leadingZeros;
      lastValueTrailingZeros = trailingZeros;
    }
    lastValue ^= xor;
  }

  private void fail(final DecodeCorruptionException e) {
    error = e;
    done = true;
  }
}
