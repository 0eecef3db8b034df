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

import com.google.common.annotations.VisibleForTesting;
import net.opentsdb.aura.rollup.core.data.BufferPool;
import net.opentsdb.aura.rollup.core.data.ByteArrays;

import java.util.Arrays;

import static net.opentsdb.aura.rollup.core.gorilla.ChunkProfile.BOUNDED_EMPTY_MARKER;
import static net.opentsdb.aura.rollup.core.gorilla.ChunkProfile.BOUNDED_END_MARKER;
import static net.opentsdb.aura.rollup.core.gorilla.ChunkProfile.COUNT_BITS;
import static net.opentsdb.aura.rollup.core.gorilla.ChunkProfile.MAX_TIMESTAMP;
import static net.opentsdb.aura.rollup.core.gorilla.ChunkProfile.TIMESTAMP_BITS;

/**
 * A Gorilla compressed run of points for one series, anchored at {@code t0}.
 *
 * <p>While open the chunk is owned by a single writer and backed by a pooled
 * buffer. {@link #finish()} compacts the stream into an exact size array and
 * returns the pooled one; from then on the chunk is immutable and can be read
 * by any number of {@link ChunkIterator}s.
 *
 * <p>Layout: {@code t0} (32 bits), the point count (32 bits, {@link
 * ChunkProfile#UNBOUNDED} only), the first delta at the profile's width, the
 * raw first value, then per point a delta-of-delta group and an XOR value
 * block. Bounded chunks end with the {@code 1111} group carrying
 * {@link ChunkProfile#BOUNDED_END_MARKER}.
 *
 * <p>Not thread safe while open.
 */
public class GorillaChunk {

  static final int LEADING_ZERO_LENGTH_BITS = 7;
  static final int MEANINGFUL_BIT_LENGTH_BITS = 7;

  private static final int SERIALIZATION_HEADER_BYTES = 1 + Integer.BYTES;

  private final long t0;
  private final ChunkProfile profile;

  private GorillaSegment segment;
  private byte[] data;

  private int dataPoints;
  private long lastTimestamp = -1;
  private long lastTimestampDelta;
  private long lastValue;
  private byte lastValueLeadingZeros = 64;
  private byte lastValueTrailingZeros = 64;
  private boolean finished;

  public GorillaChunk(final long t0, final ChunkProfile profile, final BufferPool pool) {
    if (t0 < 0 || t0 > MAX_TIMESTAMP) {
      throw new IllegalArgumentException("t0 " + t0 + " is not an unsigned 32 bit timestamp");
    }
    this.t0 = t0;
    this.profile = profile;
    this.segment = new GorillaSegment(pool);
    segment.write(t0, TIMESTAMP_BITS);
    if (profile.isCountInHeader()) {
      segment.write(0, COUNT_BITS); // patched when the bytes are handed out
    }
  }

  private GorillaChunk(
      final long t0, final ChunkProfile profile, final int dataPoints, final byte[] data) {
    this.t0 = t0;
    this.profile = profile;
    this.dataPoints = dataPoints;
    this.data = data;
    this.finished = true;
  }

  /**
   * Appends a point. The first timestamp may equal {@code t0}, every later one
   * must be greater than the previous.
   *
   * @throws EncodingContractViolationException if the chunk is finished or
   *     the timestamp is out of order or out of the profile's range.
   */
  public void push(final long timestamp, final double value) {
    if (finished) {
      throw new EncodingContractViolationException(
          "Push of " + timestamp + " to a finished chunk at " + t0);
    }
    if (timestamp < 0 || timestamp > MAX_TIMESTAMP) {
      throw new EncodingContractViolationException(
          "Timestamp " + timestamp + " is not an unsigned 32 bit value");
    }
    if (dataPoints == 0) {
      if (timestamp < t0) {
        throw new EncodingContractViolationException(
            "First timestamp " + timestamp + " is before the chunk start " + t0);
      }
    } else if (timestamp <= lastTimestamp) {
      throw new EncodingContractViolationException(
          "Timestamp " + timestamp + " is not after the previous one " + lastTimestamp);
    }
    if (timestamp - t0 > profile.maxOffset()) {
      throw new EncodingContractViolationException(
          "Timestamp " + timestamp + " is " + (timestamp - t0)
              + "s past the chunk start, more than the " + profile + " profile holds");
    }
    if (dataPoints == Integer.MAX_VALUE) {
      throw new EncodingContractViolationException(
          "Chunk has reached the capacity of " + Integer.MAX_VALUE + " data points.");
    }

    appendTimeStamp(timestamp);
    appendValue(value);
    dataPoints++;
  }

  /**
   * Closes the chunk. Writes the end marker where the profile needs one,
   * compacts the stream and returns the pooled buffer. Idempotent.
   */
  public void finish() {
    if (finished) {
      return;
    }
    writeTrailer(segment);
    data = toBytes(segment);
    segment.release();
    segment = null;
    finished = true;
  }

  /**
   * @return the encoded chunk. Before {@link #finish()} this is a finished
   *     snapshot copy and the chunk stays open; the result is byte identical to
   *     what {@link #finish()} would produce at this point.
   */
  public byte[] bytes() {
    if (finished) {
      return data;
    }
    GorillaSegment snapshot = segment.copy(BufferPool.HEAP);
    writeTrailer(snapshot);
    return toBytes(snapshot);
  }

  public ChunkIterator iterator() {
    return GorillaChunkIterator.of(bytes(), profile);
  }

  public long getT0() {
    return t0;
  }

  public ChunkProfile getProfile() {
    return profile;
  }

  public int getNumDataPoints() {
    return dataPoints;
  }

  /**
   * @return the timestamp of the last point, -1 if there is none. Restored
   *     chunks decode their stream once to find it.
   */
  public long getLastTimestamp() {
    if (dataPoints > 0 && lastTimestamp < 0) {
      ChunkIterator iterator = iterator();
      while (iterator.next()) {
        lastTimestamp = iterator.timestamp();
      }
    }
    return lastTimestamp;
  }

  public boolean isFinished() {
    return finished;
  }

  /** @return the bytes {@link #serialize(byte[], int)} writes. */
  public int serializationLength() {
    return SERIALIZATION_HEADER_BYTES + bytes().length;
  }

  /**
   * Writes {@code [profile id][point count][chunk bytes]} into the buffer.
   *
   * @return the number of bytes written.
   */
  public int serialize(final byte[] buffer, final int offset) {
    byte[] bytes = bytes();
    int length = SERIALIZATION_HEADER_BYTES + bytes.length;
    if (offset < 0 || offset + length > buffer.length) {
      throw new IllegalArgumentException(
          "Buffer of " + buffer.length + " bytes can't hold " + length + " at " + offset);
    }
    buffer[offset] = profile.getId();
    ByteArrays.putInt(dataPoints, buffer, offset + 1);
    System.arraycopy(bytes, 0, buffer, offset + SERIALIZATION_HEADER_BYTES, bytes.length);
    return length;
  }

  public byte[] serialize() {
    byte[] buffer = new byte[serializationLength()];
    serialize(buffer, 0);
    return buffer;
  }

  /**
   * Restores a finished, read only chunk. Only the header is checked here, the
   * payload is validated by the iterators as they decode it.
   *
   * @throws DecodeCorruptionException if the header is malformed.
   */
  public static GorillaChunk deserialize(final byte[] buffer, final int offset, final int length) {
    if (offset < 0 || length < 0 || offset + length > buffer.length) {
      throw new IllegalArgumentException(
          "Invalid range offset: " + offset + " length: " + length + " buffer: " + buffer.length);
    }
    if (length < SERIALIZATION_HEADER_BYTES) {
      throw new DecodeCorruptionException("Serialized chunk of " + length + " bytes is too short");
    }
    ChunkProfile profile = ChunkProfile.getById(buffer[offset]);
    int dataPoints = ByteArrays.getInt(buffer, offset + 1);
    if (dataPoints < 0) {
      throw new DecodeCorruptionException("Negative point count " + dataPoints);
    }
    int dataLength = length - SERIALIZATION_HEADER_BYTES;
    if (dataLength < profile.headerBytes()) {
      throw new DecodeCorruptionException(
          "Chunk of " + dataLength + " bytes is shorter than its header");
    }
    byte[] data =
        Arrays.copyOfRange(
            buffer, offset + SERIALIZATION_HEADER_BYTES, offset + length);
    if (profile.isCountInHeader()
        && ByteArrays.getUnsignedInt(data, Integer.BYTES) != dataPoints) {
      throw new DecodeCorruptionException(
          "Point count " + dataPoints + " does not match the chunk header "
              + ByteArrays.getUnsignedInt(data, Integer.BYTES));
    }
    return new GorillaChunk(ByteArrays.getUnsignedInt(data, 0), profile, dataPoints, data);
  }

  public static GorillaChunk deserialize(final byte[] buffer) {
    return deserialize(buffer, 0, buffer.length);
  }

  private void appendTimeStamp(final long timestamp) {
    if (dataPoints == 0) { // first write
      long delta = timestamp - t0;
      segment.write(delta, profile.getFirstDeltaBits());
      lastTimestampDelta = delta;
    } else {
      long delta = timestamp - lastTimestamp;
      long deltaOfDelta = delta - lastTimestampDelta;

      if (deltaOfDelta == 0) {
        segment.write(0, 1); // writes a zero bit
      } else {
        if (deltaOfDelta > 0) {
          // There are no zeros. Shift by one to fit in x number of bits
          deltaOfDelta--;
        }

        long absValue = Math.abs(deltaOfDelta);
        int groups = profile.getGroupCount();
        for (int i = 0; i < groups; i++) {
          int valueBits = profile.valueBits(i);
          long mask = 1L << (valueBits - 1);
          if (valueBits == Long.SIZE || absValue < mask) {
            segment.write(profile.controlValue(i), profile.controlBits(i));
            // stores the signed value [-2^(n-1) to 2^(n-1)) in [0 to 2^n - 1]
            segment.write(deltaOfDelta + mask, valueBits);
            break;
          }
        }
      }
      lastTimestampDelta = delta;
    }
    lastTimestamp = timestamp;
  }

  private void appendValue(final double value) {
    long newValue = Double.doubleToRawLongBits(value);

    if (dataPoints == 0) { // append first value
      segment.write(newValue, Long.SIZE);
      lastValueLeadingZeros = 64;
      lastValueTrailingZeros = 64;
    } else {
      long xor = newValue ^ lastValue;

      // Equal values cost a single zero bit. Otherwise a one bit is followed by
      // either a zero and the meaningful bits, when the leading and trailing
      // zero counts match the previous block, or a one, the leading zero count,
      // the meaningful bit length and the meaningful bits.
      if (xor == 0) {
        segment.write(0, 1);
      } else {
        byte leadingZeros = (byte) Long.numberOfLeadingZeros(xor);
        byte trailingZeros = (byte) Long.numberOfTrailingZeros(xor);
        byte meaningFullBits = (byte) (64 - leadingZeros - trailingZeros);

        if (leadingZeros == lastValueLeadingZeros && trailingZeros == lastValueTrailingZeros) {
          segment.write(0b10, 2); // writes 1,0. Control bit for using last block information.
          segment.write(xor >>> trailingZeros, meaningFullBits);
        } else {
          segment.write(0b11, 2); // writes 1,1. Control bit for not using last block information.
          segment.write(leadingZeros, LEADING_ZERO_LENGTH_BITS);
          segment.write(meaningFullBits, MEANINGFUL_BIT_LENGTH_BITS);
          segment.write(xor >>> trailingZeros, meaningFullBits);

          lastValueLeadingZeros = leadingZeros;
          lastValueTrailingZeros = trailingZeros;
        }
      }
    }
    lastValue = newValue;
  }

  private void writeTrailer(final GorillaSegment target) {
    if (profile.isCountInHeader()) {
      return;
    }
    if (dataPoints == 0) {
      target.write(BOUNDED_EMPTY_MARKER, profile.getFirstDeltaBits());
    } else {
      int last = profile.getGroupCount() - 1;
      target.write(profile.controlValue(last), profile.controlBits(last));
      target.write(BOUNDED_END_MARKER, profile.valueBits(last));
    }
  }

  private byte[] toBytes(final GorillaSegment source) {
    byte[] bytes = source.toByteArray();
    if (profile.isCountInHeader()) {
      ByteArrays.putInt(dataPoints, bytes, Integer.BYTES);
    }
    return bytes;
  }

  @VisibleForTesting
  long getLastTimestampDelta() {
    return lastTimestampDelta;
  }

  @VisibleForTesting
  byte getLastValueLeadingZeros() {
    return lastValueLeadingZeros;
  }

  @VisibleForTesting
  byte getLastValueTrailingZeros() {
    return lastValueTrailingZeros;
  }
}
