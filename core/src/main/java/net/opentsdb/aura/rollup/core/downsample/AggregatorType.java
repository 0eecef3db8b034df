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

/** The reducers of a rollup. The ordinal indexes the per reducer arrays. */
public enum AggregatorType {
  min((byte) 0b1),
  max((byte) 0b10),
  sum((byte) 0b100),
  count((byte) 0b1000),
  last((byte) 0b10000),
  sumofsquare((byte) 0b100000);

  /** Ids of all reducers or'ed together. */
  public static final byte ALL_IDS = 0b111111;

  private static final AggregatorType[] VALUES = values();

  private final byte id;

  AggregatorType(final byte id) {
    this.id = id;
  }

  public byte getId() {
    return id;
  }

  public static int count() {
    return VALUES.length;
  }

  public static AggregatorType getByOrdinal(final int ordinal) {
    return VALUES[ordinal];
  }

  /** Case insensitive lookup by name, e.g. {@code "SumOfSquare"}. */
  public static AggregatorType forName(final String name) {
    try {
      return valueOf(name.toLowerCase());
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("No aggregator found for " + name);
    }
  }
}
