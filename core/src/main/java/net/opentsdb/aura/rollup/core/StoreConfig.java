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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class StoreConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(StoreConfig.class);

  public int chunkSpan = 7200;
  public int numChunks = 5;
  public List<AggregationConfig> aggregations = new ArrayList<>();

  public int poolMaxBufferSize = 65_536;
  public int poolBuffersPerSize = 1024;

  public String nodeName = "localhost";
  public boolean primary = true;

  /**
   * Reads a YAML document onto the defaults and validates it. Unknown keys
   * fail the load.
   *
   * @throws IOException if the stream can't be read or parsed.
   * @throws IllegalArgumentException if a value is out of range.
   */
  public static StoreConfig load(final InputStream stream) throws IOException {
    ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    mapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    StoreConfig config = mapper.readValue(stream, StoreConfig.class);
    if (config == null) {
      config = new StoreConfig();
    }
    config.validate();
    LOGGER.info("Loaded store config {}", config);
    return config;
  }

  public void validate() {
    checkPositive("chunkSpan", chunkSpan);
    checkPositive("numChunks", numChunks);
    checkPositive("poolMaxBufferSize", poolMaxBufferSize);
    checkPositive("poolBuffersPerSize", poolBuffersPerSize);
    if (aggregations == null) {
      aggregations = new ArrayList<>();
    }
    Set<Integer> spans = new HashSet<>();
    for (AggregationConfig aggregation : aggregations) {
      if (aggregation == null) {
        throw new IllegalArgumentException("Empty aggregation entry");
      }
      checkPositive("aggregations.span", aggregation.span);
      checkPositive("aggregations.chunkSpan", aggregation.chunkSpan);
      checkPositive("aggregations.numChunks", aggregation.numChunks);
      // rollup series are named after the span
      if (!spans.add(aggregation.span)) {
        throw new IllegalArgumentException(
            "Duplicate aggregation span " + aggregation.span);
      }
    }
  }

  private static void checkPositive(final String name, final int value) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be positive, got " + value);
    }
  }

  @Override
  public String toString() {
    return "chunkSpan: " + chunkSpan
        + " numChunks: " + numChunks
        + " aggregations: " + aggregations
        + " poolMaxBufferSize: " + poolMaxBufferSize
        + " poolBuffersPerSize: " + poolBuffersPerSize
        + " nodeName: " + nodeName
        + " primary: " + primary;
  }
}
