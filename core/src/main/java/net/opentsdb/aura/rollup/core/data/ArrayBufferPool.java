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

package net.opentsdb.aura.rollup.core.data;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.LongAdder;

/**
 * A {@link BufferPool} keeping a bounded free list per power of two size class.
 * Requests larger than the biggest class are allocated on the heap and left to
 * the GC on release so the pooled footprint stays fixed.
 */
public class ArrayBufferPool implements BufferPool {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArrayBufferPool.class);

  public static final int MIN_BUFFER_SIZE = 16;

  private final int maxBufferSize;
  private final ArrayBlockingQueue<byte[]>[] freeLists;

  private final LongAdder allocated = new LongAdder();
  private final LongAdder recycled = new LongAdder();
  private final LongAdder dropped = new LongAdder();

  @SuppressWarnings("unchecked")
  public ArrayBufferPool(final int maxBufferSize, final int buffersPerSize) {
    Preconditions.checkArgument(
        maxBufferSize >= MIN_BUFFER_SIZE && Integer.bitCount(maxBufferSize) == 1,
        "maxBufferSize must be a power of two >= %s, got %s",
        MIN_BUFFER_SIZE,
        maxBufferSize);
    Preconditions.checkArgument(
        buffersPerSize > 0, "buffersPerSize must be positive, got %s", buffersPerSize);
    this.maxBufferSize = maxBufferSize;
    int classes = sizeClass(maxBufferSize) + 1;
    this.freeLists = new ArrayBlockingQueue[classes];
    for (int i = 0; i < classes; i++) {
      freeLists[i] = new ArrayBlockingQueue<>(buffersPerSize);
    }
  }

  @Override
  public byte[] acquire(final int minCapacity) {
    Preconditions.checkArgument(minCapacity >= 0, "Negative capacity %s", minCapacity);
    if (minCapacity > maxBufferSize) {
      allocated.increment();
      return new byte[minCapacity];
    }
    int sizeClass = sizeClass(minCapacity);
    byte[] buffer = freeLists[sizeClass].poll();
    if (buffer == null) {
      allocated.increment();
      return new byte[MIN_BUFFER_SIZE << sizeClass];
    }
    recycled.increment();
    return buffer;
  }

  @Override
  public void release(final byte[] buffer) {
    if (buffer == null) {
      return;
    }
    int length = buffer.length;
    if (length < MIN_BUFFER_SIZE || length > maxBufferSize || Integer.bitCount(length) != 1) {
      // not one of ours
      dropped.increment();
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug("Dropping buffer of {} bytes outside the pooled size classes", length);
      }
      return;
    }
    Arrays.fill(buffer, (byte) 0);
    if (!freeLists[sizeClass(length)].offer(buffer)) {
      dropped.increment();
    }
  }

  public int getMaxBufferSize() {
    return maxBufferSize;
  }

  /** @return the number of arrays created by this pool. */
  public long getAllocatedCount() {
    return allocated.sum();
  }

  /** @return the number of acquires served from a free list. */
  public long getRecycledCount() {
    return recycled.sum();
  }

  /** @return the number of released arrays that were not kept. */
  public long getDroppedCount() {
    return dropped.sum();
  }

  @VisibleForTesting
  int freeCount(final int bufferSize) {
    return freeLists[sizeClass(bufferSize)].size();
  }

  @VisibleForTesting
  static int sizeClass(final int capacity) {
    if (capacity <= MIN_BUFFER_SIZE) {
      return 0;
    }
    int rounded = Integer.highestOneBit(capacity - 1) << 1;
    return Integer.numberOfTrailingZeros(rounded) - Integer.numberOfTrailingZeros(MIN_BUFFER_SIZE);
  }
}
