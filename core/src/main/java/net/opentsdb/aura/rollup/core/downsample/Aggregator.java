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

package net.opentsdb.aura.rollup.core.downsample;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consolidates one strictly increasing raw stream into fixed width buckets and
 * commits min, max, sum, count, last and sum of squares of every closed bucket
 * to one {@link DataPointSink} each.
 *
 * <p>A point belongs to the bucket whose boundary is the smallest multiple of
 * the span that is {@code >= ts}, so a point right on a multiple belongs to
 * that bucket and, as no later point can, closes it. A bucket is committed
 * once it is proven closed: by a point on its boundary, by a point for a later
 * boundary, or on {@link #flush()}. Buckets that saw no points are skipped.
 *
 * <p>Single writer, no locking.
 */
public class Aggregator {

  private static final Logger LOGGER = LoggerFactory.getLogger(Aggregator.class);

  private final String key;
  private final int span;
  private final DataPointSink[] sinks;
  private final Bucket bucket = new Bucket();

  private long currentBoundary;
  private boolean started;
  private boolean open;

  /**
   * @param key name of the raw series.
   * @param span bucket width in seconds.
   * @param chunkSpan chunk width handed to the sinks.
   * @param numChunks chunk count handed to the sinks.
   * @param sinkFactory creates one sink per reducer.
   */
  public Aggregator(
      final String key,
      final int span,
      final int chunkSpan,
      final int numChunks,
      final SinkFactory sinkFactory) {
    Preconditions.checkArgument(span > 0, "span must be positive, got %s", span);
    this.key = key;
    this.span = span;
    this.sinks = new DataPointSink[AggregatorType.count()];
    for (AggregatorType type : AggregatorType.values()) {
      DataPointSink sink = sinkFactory.create(sinkName(key, type, span), type, chunkSpan, numChunks);
      this.sinks[type.ordinal()] = Preconditions.checkNotNull(sink, "No sink for %s", type);
    }
  }

  /** @return the closing boundary of the bucket holding {@code timestamp}. */
  public static long boundary(final long timestamp, final long span) {
    long remainder = timestamp % span;
    if (remainder == 0) {
      return timestamp;
    }
    return timestamp + (span - remainder);
  }

  public static String sinkName(final String key, final AggregatorType type, final int span) {
    return key + "_" + type.name() + "_" + span;
  }

  /**
   * Folds a point into the open bucket, committing the previous bucket first
   * when the point belongs to a later one. A point right on its boundary
   * commits its bucket at once.
   *
   * @throws OrderingViolationException if the point maps to a bucket before
   *     the open one, or to one already committed. Nothing changes.
   */
  public void add(final long timestamp, final double value) {
    Preconditions.checkArgument(timestamp >= 0, "Negative timestamp %s", timestamp);
    long boundary = boundary(timestamp, span);

    if (!accepts(timestamp)) {
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug(
            "Rejecting ts {} for {} span {}: bucket {} is before the current {}",
            timestamp, key, span, boundary, currentBoundary);
      }
      throw new OrderingViolationException(
          "Timestamp " + timestamp + " maps to bucket " + boundary + " of " + key
              + " but bucket " + currentBoundary + " is " + (open ? "open" : "committed"));
    }
    if (!started) {
      started = true;
      openBucket(boundary);
    } else if (boundary > currentBoundary) {
      if (open) {
        commit();
      }
      openBucket(boundary);
    }
    bucket.apply(value);
    if (timestamp == boundary) {
      close();
    }
  }

  /**
   * @return true if {@link #add(long, double)} would take a point at
   *     {@code timestamp}: the first point, one for the open bucket or one for
   *     a later bucket. Does not change any state.
   */
  public boolean accepts(final long timestamp) {
    if (!started) {
      return true;
    }
    long boundary = boundary(timestamp, span);
    return boundary > currentBoundary || (open && boundary == currentBoundary);
  }

  /**
   * Commits the open bucket, if any, without waiting for a later point. The
   * bucket stays closed: later points must map to a later boundary.
   *
   * @return true if a bucket was committed.
   */
  public boolean flush() {
    if (!open) {
      return false;
    }
    close();
    return true;
  }

  public DataPointSink getSink(final AggregatorType type) {
    return sinks[type.ordinal()];
  }

  public String getKey() {
    return key;
  }

  public int getSpan() {
    return span;
  }

  /** @return the boundary of the open or last committed bucket, 0 before any point. */
  public long getCurrentBoundary() {
    return currentBoundary;
  }

  public boolean isOpen() {
    return open;
  }

  @VisibleForTesting
  Bucket getBucket() {
    return bucket;
  }

  private void openBucket(final long boundary) {
    bucket.reset();
    currentBoundary = boundary;
    open = true;
  }

  private void close() {
    commit();
    bucket.reset();
    open = false;
  }

  private void commit() {
    for (int i = 0; i < sinks.length; i++) {
      sinks[i].append(currentBoundary, bucket.get(AggregatorType.getByOrdinal(i)));
    }
  }
}
