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

/**
 * Running state of all six reducers for the open bucket. One flat struct
 * updated in a single call per point.
 */
public class Bucket {

  private double min;
  private double max;
  private double sum;
  private double count;
  private double last;
  private double sumOfSquares;

  public Bucket() {
    reset();
  }

  public void reset() {
    min = Double.MAX_VALUE;
    max = -Double.MAX_VALUE;
    sum = 0.0;
    count = 0.0;
    last = Double.NaN;
    sumOfSquares = 0.0;
  }

  public void apply(final double value) {
    if (count == 0 || value < min) {
      min = value;
    }
    if (count == 0 || value > max) {
      max = value;
    }
    sum += value;
    count++;
    last = value;
    sumOfSquares += value * value;
  }

  public double get(final AggregatorType type) {
    switch (type) {
      case min:
        return min;
      case max:
        return max;
      case sum:
        return sum;
      case count:
        return count;
      case last:
        return last;
      case sumofsquare:
        return sumOfSquares;
      default:
        throw new IllegalArgumentException("Unknown aggregator " + type);
    }
  }

  public boolean isEmpty() {
    return count == 0;
  }

  public long getCount() {
    return (long) count;
  }
}
