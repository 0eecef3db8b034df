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

package net.opentsdb.aura.rollup.core.gorilla;

/**
 * Forward only cursor over the points of a chunk.
 *
 * <pre>
 *   while (it.next()) {
 *     consume(it.timestamp(), it.value());
 *   }
 *   if (it.error() != null) { ... }
 * </pre>
 */
public interface ChunkIterator {

  /**
   * Advances to the next point.
   *
   * @return false at the end of the chunk or when the data is corrupt, see
   *     {@link #error()}.
   */
  boolean next();

  /** @return the unsigned 32 bit timestamp of the current point, in seconds. */
  long timestamp();

  /** @return the value of the current point. */
  double value();

  /** @return the decode failure that stopped the iteration, or null. */
  DecodeCorruptionException error();
}
