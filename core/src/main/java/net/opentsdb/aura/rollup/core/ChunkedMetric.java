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

package net.opentsdb.aura.rollup.core;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import net.opentsdb.aura.rollup.core.coordination.ClusterStatus;
import net.opentsdb.aura.rollup.core.data.BufferPool;
import net.opentsdb.aura.rollup.core.downsample.Aggregator;
import net.opentsdb.aura.rollup.core.downsample.OrderingViolationException;
import net.opentsdb.aura.rollup.core.gorilla.ChunkIterator;
import net.opentsdb.aura.rollup.core.gorilla.ChunkProfile;
import net.opentsdb.aura.rollup.core.gorilla.GorillaChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A series kept as a ring of {@code numChunks} Gorilla chunks, each covering
 * {@code chunkSpan} seconds starting at a multiple of the span. Used both for
 * raw series, which also feed their rollup {@link Aggregator}s, and as the
 * sink of a rollup.
 *
 * <p>The chunk still being written is only served while the node is primary
 * per the shared {@link ClusterStatus}.
 */
public class ChunkedMetric implements Metric {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkedMetric.class);

  private final String key;
  private final int chunkSpan;
  private final int numChunks;
  private final ChunkProfile profile;
  private final BufferPool pool;
  private final ClusterStatus clusterStatus;
  private final GorillaChunk[] chunks;
  private final List<Aggregator> aggregators = new CopyOnWriteArrayList<>();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  private int currentIndex = -1;
  private long lastTimestamp = -1;

  public ChunkedMetric(
      final String key,
      final int chunkSpan,
      final int numChunks,
      final BufferPool pool,
      final ClusterStatus clusterStatus) {
    Preconditions.checkArgument(chunkSpan > 0, "chunkSpan must be positive, got %s", chunkSpan);
    Preconditions.checkArgument(numChunks > 0, "numChunks must be positive, got %s", numChunks);
    this.key = key;
    this.chunkSpan = chunkSpan;
    this.numChunks = numChunks;
    this.profile = ChunkProfile.forSpan(chunkSpan);
    this.pool = Preconditions.checkNotNull(pool, "pool");
    this.clusterStatus = Preconditions.checkNotNull(clusterStatus, "clusterStatus");
    this.chunks = new GorillaChunk[numChunks];
  }

  /** Feeds every raw point of this series into {@code aggregator} as well. */
  public void addAggregator(final Aggregator aggregator) {
    aggregators.add(aggregator);
  }

  public List<Aggregator> getAggregators() {
    return Collections.unmodifiableList(aggregators);
  }

  /**
   * Stores the point and feeds it to every rollup. The point is checked against
   * the series and all rollups first, so a rejected point leaves every one of
   * them untouched.
   *
   * @throws OrderingViolationException if the series or one of its rollups
   *     can't take the timestamp.
   */
  @Override
  public void add(final long timestamp, final double value) {
    lock.writeLock().lock();
    try {
      checkTimestamp(timestamp);
      for (Aggregator aggregator : aggregators) {
        if (!aggregator.accepts(timestamp)) {
          if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(
                "Rejecting ts {} for {}, rollup span {} already committed bucket {}",
                timestamp, key, aggregator.getSpan(), aggregator.getCurrentBoundary());
          }
          throw new OrderingViolationException(
              "Timestamp " + timestamp + " for " + key + " falls in committed bucket "
                  + aggregator.getCurrentBoundary() + " of the " + aggregator.getSpan()
                  + "s rollup");
        }
      }
      push(timestamp, value);
    } finally {
      lock.writeLock().unlock();
    }
    for (Aggregator aggregator : aggregators) {
      aggregator.add(timestamp, value);
    }
  }

  @Override
  public List<ChunkIterator> get(final long from, final long to) {
    List<ChunkIterator> iterators = new ArrayList<>();
    if (from >= to) {
      return iterators;
    }
    boolean includeOpen = clusterStatus.isPrimary();
    lock.readLock().lock();
    try {
      if (currentIndex < 0) {
        return iterators;
      }
      for (int i = 1; i <= numChunks; i++) {
        GorillaChunk chunk = chunks[(currentIndex + i) % numChunks];
        if (chunk == null) {
          continue;
        }
        long t0 = chunk.getT0();
        if (t0 >= to || t0 + chunkSpan <= from) {
          continue;
        }
        if (!chunk.isFinished() && !includeOpen) {
          continue;
        }
        iterators.add(new RangeChunkIterator(chunk.iterator(), from, to));
      }
    } finally {
      lock.readLock().unlock();
    }
    return iterators;
  }

  /** Commits the open bucket of every rollup of this series. */
  public void flush() {
    for (Aggregator aggregator : aggregators) {
      aggregator.flush();
    }
  }

  @Override
  public String getKey() {
    return key;
  }

  public int getChunkSpan() {
    return chunkSpan;
  }

  public int getNumChunks() {
    return numChunks;
  }

  public ChunkProfile getProfile() {
    return profile;
  }

  public long getLastTimestamp() {
    lock.readLock().lock();
    try {
      return lastTimestamp;
    } finally {
      lock.readLock().unlock();
    }
  }

  @VisibleForTesting
  GorillaChunk getCurrentChunk() {
    return currentIndex < 0 ? null : chunks[currentIndex];
  }

  private void checkTimestamp(final long timestamp) {
    if (timestamp < 0 || timestamp > ChunkProfile.MAX_TIMESTAMP) {
      throw new IllegalArgumentException(
          "Timestamp " + timestamp + " is not an unsigned 32 bit value");
    }
    if (currentIndex >= 0 && timestamp <= lastTimestamp) {
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug("Rejecting ts {} for {}, last ts is {}", timestamp, key, lastTimestamp);
      }
      throw new OrderingViolationException(
          "Timestamp " + timestamp + " for " + key + " is not after " + lastTimestamp);
    }
  }

  private void push(final long timestamp, final double value) {
    long t0 = timestamp - (timestamp % chunkSpan);
    if (currentIndex < 0) {
      currentIndex = 0;
      chunks[currentIndex] = new GorillaChunk(t0, profile, pool);
    } else {
      GorillaChunk current = chunks[currentIndex];
      if (t0 > current.getT0()) {
        current.finish();
        currentIndex = (currentIndex + 1) % numChunks;
        chunks[currentIndex] = new GorillaChunk(t0, profile, pool);
        if (LOGGER.isDebugEnabled()) {
          LOGGER.debug(
              "Finished chunk {} of {} with {} points, opened {}",
              current.getT0(), key, current.getNumDataPoints(), t0);
        }
      }
    }
    chunks[currentIndex].push(timestamp, value);
    lastTimestamp = timestamp;
  }
}
