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

import net.opentsdb.aura.rollup.core.gorilla.ChunkIterator;
import net.opentsdb.aura.rollup.core.gorilla.DecodeCorruptionException;

/** Limits a chunk iterator to {@code [from, to)}. */
public class RangeChunkIterator implements ChunkIterator {

  private final ChunkIterator delegate;
  private final long from;
  private final long to;
  private boolean done;

  public RangeChunkIterator(final ChunkIterator delegate, final long from, final long to) {
    this.delegate = delegate;
    this.from = from;
    this.to = to;
  }

  @Override
  public boolean next() {
    while (!done && delegate.next()) {
      long timestamp = delegate.timestamp();
      if (timestamp >= to) {
        done = true;
        return false;
      }
      if (timestamp >= from) {
        return true;
      }
    }
    done = true;
    return false;
  }

  @Override
  public long timestamp() {
    return delegate.timestamp();
  }

  @Override
  public double value() {
    return delegate.value();
  }

  @Override
  public DecodeCorruptionException error() {
    return delegate.error();
  }
}
