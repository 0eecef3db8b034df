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

/** Creates the downstream sink of one reducer of an {@link Aggregator}. */
@FunctionalInterface
public interface SinkFactory {

  /**
   * @param name series name of the rollup, {@code <key>_<reducer>_<span>}.
   * @param type the reducer feeding the sink.
   * @param chunkSpan chunk width for the sink's storage, in seconds.
   * @param numChunks number of chunks the sink keeps.
   */
  DataPointSink create(String name, AggregatorType type, int chunkSpan, int numChunks);
}
