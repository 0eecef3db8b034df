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

/**
 * Source of the byte arrays backing open chunks. A chunk claims a buffer when
 * it opens or grows and hands it back once it has been compacted.
 *
 * <p>Implementations shared between series must be thread safe.
 */
public interface BufferPool {

  /** A pool that never recycles. Every call allocates. */
  BufferPool HEAP =
      new BufferPool() {
        @Override
        public byte[] acquire(final int minCapacity) {
          return new byte[minCapacity];
        }

        @Override
        public void release(final byte[] buffer) {}
      };

  /**
   * Claims a buffer.
   *
   * @param minCapacity The minimum length of the returned array.
   * @return A zero filled, non-null array of at least {@code minCapacity} bytes.
   */
  byte[] acquire(int minCapacity);

  /**
   * Returns a buffer to the pool. The caller must not touch the array after
   * this call.
   *
   * @param buffer A buffer obtained from {@link #acquire(int)}. Null is ignored.
   */
  void release(byte[] buffer);
}
