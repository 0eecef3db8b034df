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

/** One rollup of every raw series: bucket width plus the layout of its chunks. */
public class AggregationConfig {

  public int span = 60;
  public int chunkSpan = 21_600;
  public int numChunks = 4;

  public AggregationConfig() {
  }

  public AggregationConfig(final int span, final int chunkSpan, final int numChunks) {
    this.span = span;
    this.chunkSpan = chunkSpan;
    this.numChunks = numChunks;
  }

  @Override
  public String toString() {
    return "span: " + span + " chunkSpan: " + chunkSpan + " numChunks: " + numChunks;
  }
}
