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

import net.opentsdb.aura.rollup.core.coordination.ClusterStatus;
import net.opentsdb.aura.rollup.core.data.ArrayBufferPool;
import net.opentsdb.aura.rollup.core.downsample.OrderingViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static net.opentsdb.aura.rollup.core.ChunkedMetricTest.read;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MetricStoreTest {

  private static final long SEGMENT_TIMESTAMP = 1620237600L;

  private StoreConfig config;
  private ClusterStatus clusterStatus;
  private MetricStore store;

  @BeforeEach
  void before() {
    config = new StoreConfig();
    config.aggregations.add(new AggregationConfig(60, 21_600, 4));
    config.aggregations.add(new AggregationConfig(3600, 86_400, 2));
    clusterStatus = new ClusterStatus("test", true);
    store = new MetricStore(config, new ArrayBufferPool(4096, 16), clusterStatus);
  }

  @Test
  void createsSeriesWithRollups() {
    store.add("sys.cpu", SEGMENT_TIMESTAMP + 1, 1);
    assertEquals(1, store.size());
    assertEquals(12, store.rollupCount());

    ChunkedMetric raw = store.get("sys.cpu");
    assertNotNull(raw);
    assertEquals(2, raw.getAggregators().size());
    assertEquals(7200, raw.getChunkSpan());

    ChunkedMetric rollup = store.get("sys.cpu_max_60");
    assertNotNull(rollup);
    assertEquals(21_600, rollup.getChunkSpan());
    assertNotNull(store.get("sys.cpu_sumofsquare_3600"));
    assertNull(store.get("sys.mem"));
  }

  @Test
  void rollupsReceiveClosedBuckets() {
    store.add("sys.cpu", SEGMENT_TIMESTAMP + 1, 1);
    store.add("sys.cpu", SEGMENT_TIMESTAMP + 30, 5);
    store.add("sys.cpu", SEGMENT_TIMESTAMP + 61, 2);

    List<long[]> max = read(store.get("sys.cpu_max_60").get(0, Long.MAX_VALUE));
    assertEquals(1, max.size());
    assertEquals(SEGMENT_TIMESTAMP + 60, max.get(0)[0]);
    assertEquals(Double.doubleToRawLongBits(5), max.get(0)[1]);
    assertTrue(read(store.get("sys.cpu_max_3600").get(0, Long.MAX_VALUE)).isEmpty());

    store.flush();
    assertEquals(2, read(store.get("sys.cpu_max_60").get(0, Long.MAX_VALUE)).size());
    List<long[]> count = read(store.get("sys.cpu_count_3600").get(0, Long.MAX_VALUE));
    assertEquals(1, count.size());
    assertEquals(SEGMENT_TIMESTAMP + 3600, count.get(0)[0]);
    assertEquals(Double.doubleToRawLongBits(3), count.get(0)[1]);
  }

  @Test
  void seriesAreIndependent() {
    store.add("a", SEGMENT_TIMESTAMP + 100, 1);
    store.add("b", SEGMENT_TIMESTAMP + 10, 1);
    assertThrows(OrderingViolationException.class, () -> store.add("a", SEGMENT_TIMESTAMP + 50, 2));
    store.add("b", SEGMENT_TIMESTAMP + 50, 2);

    assertEquals(2, store.size());
    assertEquals(2, read(store.get("b").get(0, Long.MAX_VALUE)).size());
  }

  @Test
  void sharesTheClusterStatus() {
    store.add("sys.cpu", SEGMENT_TIMESTAMP + 1, 1);
    assertSame(clusterStatus, store.getClusterStatus());
    clusterStatus.setPrimary(false);
    assertTrue(store.get("sys.cpu").get(0, Long.MAX_VALUE).isEmpty());
  }

  @Test
  void invalidConfigIsRejected() {
    StoreConfig bad = new StoreConfig();
    bad.aggregations.add(new AggregationConfig(0, 600, 1));
    assertThrows(IllegalArgumentException.class, () -> new MetricStore(bad));
  }

  @Test
  void buildsPoolFromConfig() {
    StoreConfig small = new StoreConfig();
    small.poolMaxBufferSize = 1024;
    small.nodeName = "node-1";
    small.primary = false;
    MetricStore fromConfig = new MetricStore(small);
    assertEquals(1024, ((ArrayBufferPool) fromConfig.getPool()).getMaxBufferSize());
    assertEquals("node-1", fromConfig.getClusterStatus().getNodeName());
    assertFalse(fromConfig.getClusterStatus().isPrimary());
  }
}
