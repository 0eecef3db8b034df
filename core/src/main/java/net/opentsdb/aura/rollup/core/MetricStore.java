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

import com.google.common.base.Preconditions;
import net.opentsdb.aura.rollup.core.coordination.ClusterStatus;
import net.opentsdb.aura.rollup.core.data.ArrayBufferPool;
import net.opentsdb.aura.rollup.core.data.BufferPool;
import net.opentsdb.aura.rollup.core.downsample.Aggregator;
import net.opentsdb.aura.rollup.core.downsample.AggregatorType;
import net.opentsdb.aura.rollup.core.downsample.DataPointSink;
import net.opentsdb.aura.rollup.core.downsample.SinkFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Raw series by key. A series is created on its first point together with one
 * {@link Aggregator} per configured rollup, each writing into rollup series
 * named {@code key_reducer_span} that can be looked up here as well.
 */
public class MetricStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(MetricStore.class);

  private final StoreConfig config;
  private final BufferPool pool;
  private final ClusterStatus clusterStatus;
  private final Map<String, ChunkedMetric> metrics = new ConcurrentHashMap<>();
  private final Map<String, ChunkedMetric> rollups = new ConcurrentHashMap<>();
  private final SinkFactory rollupFactory;

  public MetricStore(final StoreConfig config) {
    this(
        config,
        new ArrayBufferPool(config.poolMaxBufferSize, config.poolBuffersPerSize),
        new ClusterStatus(config.nodeName, config.primary));
  }

  public MetricStore(
      final StoreConfig config, final BufferPool pool, final ClusterStatus clusterStatus) {
    config.validate();
    this.config = config;
    this.pool = Preconditions.checkNotNull(pool, "pool");
    this.clusterStatus = Preconditions.checkNotNull(clusterStatus, "clusterStatus");
    this.rollupFactory = this::createRollup;
  }

  /**
   * Appends a raw point to {@code key}, creating the series on first use.
   *
   * @throws net.opentsdb.aura.rollup.core.downsample.OrderingViolationException
   *     if {@code timestamp} is not after the last one of the series.
   */
  public void add(final String key, final long timestamp, final double value) {
    metrics.computeIfAbsent(key, this::createRaw).add(timestamp, value);
  }

  /** @return the raw or rollup series named {@code key}, or null. */
  public ChunkedMetric get(final String key) {
    ChunkedMetric metric = metrics.get(key);
    return metric != null ? metric : rollups.get(key);
  }

  /** @return the number of raw series. */
  public int size() {
    return metrics.size();
  }

  public int rollupCount() {
    return rollups.size();
  }

  /** Commits the open rollup bucket of every raw series. */
  public void flush() {
    for (ChunkedMetric metric : metrics.values()) {
      metric.flush();
    }
  }

  public ClusterStatus getClusterStatus() {
    return clusterStatus;
  }

  public BufferPool getPool() {
    return pool;
  }

  private ChunkedMetric createRaw(final String key) {
    ChunkedMetric metric =
        new ChunkedMetric(key, config.chunkSpan, config.numChunks, pool, clusterStatus);
    for (AggregationConfig aggregation : config.aggregations) {
      metric.addAggregator(
          new Aggregator(
              key, aggregation.span, aggregation.chunkSpan, aggregation.numChunks, rollupFactory));
    }
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Created series {} with {} rollups", key, config.aggregations.size());
    }
    return metric;
  }

  private DataPointSink createRollup(
      final String name,
      final AggregatorType type,
      final int chunkSpan,
      final int numChunks) {
    ChunkedMetric rollup = new ChunkedMetric(name, chunkSpan, numChunks, pool, clusterStatus);
    ChunkedMetric existing = rollups.putIfAbsent(name, rollup);
    return existing == null ? rollup : existing;
  }
}
