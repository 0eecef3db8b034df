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


package net.opentsdb.aura.rollup.core.coordination;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ClusterStatusTest {

  @Test
  void flipsRole() {
    ClusterStatus status = new ClusterStatus("node-1", false);
    assertEquals("node-1", status.getNodeName());
    assertFalse(status.isPrimary());

    status.setPrimary(true);
    assertTrue(status.isPrimary());
    status.setPrimary(true);
    assertTrue(status.isPrimary());
    assertEquals("ClusterStatus node: node-1 primary: true", status.toString());

    status.setPrimary(false);
    assertFalse(status.isPrimary());
  }

  @Test
  void writeIsSeenByOtherThreads() throws InterruptedException {
    ClusterStatus status = new ClusterStatus("node-1", false);
    CountDownLatch started = new CountDownLatch(1);
    AtomicBoolean seen = new AtomicBoolean();
    Thread reader =
        new Thread(
            () -> {
              started.countDown();
              long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
              while (!status.isPrimary() && System.nanoTime() < deadline) {
                Thread.onSpinWait();
              }
              seen.set(status.isPrimary());
            });
    reader.start();
    assertTrue(started.await(10, TimeUnit.SECONDS));
    status.setPrimary(true);
    reader.join(TimeUnit.SECONDS.toMillis(10));
    assertTrue(seen.get());
  }
}
