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

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ArrayBufferPoolTest {

  @Test
  void sizeClasses() {
    assertEquals(0, ArrayBufferPool.sizeClass(0));
    assertEquals(0, ArrayBufferPool.sizeClass(16));
    assertEquals(1, ArrayBufferPool.sizeClass(17));
    assertEquals(1, ArrayBufferPool.sizeClass(32));
    assertEquals(2, ArrayBufferPool.sizeClass(33));
    assertEquals(2, ArrayBufferPool.sizeClass(64));
    assertEquals(12, ArrayBufferPool.sizeClass(65_536));
  }

  @Test
  void acquireRoundsUp() {
    ArrayBufferPool pool = new ArrayBufferPool(1024, 4);
    assertEquals(16, pool.acquire(1).length);
    assertEquals(64, pool.acquire(64).length);
    assertEquals(128, pool.acquire(65).length);
    assertEquals(3, pool.getAllocatedCount());
  }

  @Test
  void recyclesZeroedBuffers() {
    ArrayBufferPool pool = new ArrayBufferPool(1024, 4);
    byte[] buffer = pool.acquire(100);
    buffer[0] = 42;
    buffer[127] = 7;
    pool.release(buffer);
    assertEquals(1, pool.freeCount(128));

    byte[] again = pool.acquire(128);
    assertSame(buffer, again);
    assertEquals(0, again[0]);
    assertEquals(0, again[127]);
    assertEquals(1, pool.getRecycledCount());
    assertEquals(0, pool.freeCount(128));
  }

  @Test
  void oversizedBuffersAreNotPooled() {
    ArrayBufferPool pool = new ArrayBufferPool(1024, 4);
    byte[] big = pool.acquire(5000);
    assertEquals(5000, big.length);
    pool.release(big);
    pool.release(new byte[100]);
    pool.release(null);
    assertEquals(2, pool.getDroppedCount());
    assertNotSame(big, pool.acquire(5000));
  }

  @Test
  void freeListIsBounded() {
    ArrayBufferPool pool = new ArrayBufferPool(1024, 2);
    for (int i = 0; i < 3; i++) {
      pool.release(new byte[32]);
    }
    assertEquals(2, pool.freeCount(32));
    assertEquals(1, pool.getDroppedCount());
  }

  @Test
  void invalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new ArrayBufferPool(1000, 4));
    assertThrows(IllegalArgumentException.class, () -> new ArrayBufferPool(8, 4));
    assertThrows(IllegalArgumentException.class, () -> new ArrayBufferPool(1024, 0));
    assertThrows(IllegalArgumentException.class, () -> new ArrayBufferPool(1024, 4).acquire(-1));
  }

  @Test
  void heapPoolAlwaysAllocates() {
    byte[] buffer = BufferPool.HEAP.acquire(10);
    assertEquals(10, buffer.length);
    BufferPool.HEAP.release(buffer);
    assertNotSame(buffer, BufferPool.HEAP.acquire(10));
  }

  @Test
  void concurrentAcquireAndRelease() throws InterruptedException {
    ArrayBufferPool pool = new ArrayBufferPool(1024, 64);
    int threads = 4;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch done = new CountDownLatch(threads);
    for (int t = 0; t < threads; t++) {
      executor.submit(
          () -> {
            try {
              for (int i = 0; i < 1000; i++) {
                byte[] buffer = pool.acquire(64);
                buffer[0] = 1;
                pool.release(buffer);
              }
            } finally {
              done.countDown();
            }
          });
    }
    assertTrue(done.await(10, TimeUnit.SECONDS));
    executor.shutdown();
    assertEquals(4000, pool.getAllocatedCount() + pool.getRecycledCount());
    assertEquals(0, pool.getDroppedCount());
    assertTrue(pool.freeCount(64) <= threads);
  }

  @Test
  void byteArrays() {
    byte[] buffer = new byte[8];
    ByteArrays.putInt(-2, buffer, 2);
    assertEquals(0xFFFFFFFEL, ByteArrays.getUnsignedInt(buffer, 2));
    assertEquals(-2, ByteArrays.getInt(buffer, 2));
    ByteArrays.putInt(1 << 20, buffer, 0);
    assertEquals(1 << 20, ByteArrays.getInt(buffer, 0));
  }
}
