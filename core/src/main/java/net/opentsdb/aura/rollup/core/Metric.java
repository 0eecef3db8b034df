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

import net.opentsdb.aura.rollup.core.downsample.DataPointSink;
import net.opentsdb.aura.rollup.core.gorilla.ChunkIterator;

import java.util.List;

/** A series that stores its points and serves them back by time range. */
public interface Metric extends DataPointSink {

  String getKey();

  /**
   * Stores a point. Timestamps must be strictly increasing.
   *
   * @throws net.opentsdb.aura.rollup.core.downsample.OrderingViolationException
   *     if the timestamp is not after the last stored one.
   */
  void add(long timestamp, double value);

  @Override
  default void append(final long timestamp, final double value) {
    add(timestamp, value);
  }

  /**
   * @param from inclusive start, in seconds.
   * @param to exclusive end, in seconds.
   * @return one iterator per chunk overlapping the range, oldest first. The
   *     iterators only return points inside the range.
   */
  List<ChunkIterator> get(long from, long to);
}
