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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Readiness flag of this node. Readers on the query path check it to decide
 * whether the chunks still being written are visible; the role manager flips
 * it on ownership transitions. One instance is shared by every series of the
 * node and handed to them explicitly.
 */
public class ClusterStatus {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClusterStatus.class);

  private final String nodeName;
  private final AtomicBoolean primary;

  public ClusterStatus(final String nodeName, final boolean primary) {
    this.nodeName = nodeName;
    this.primary = new AtomicBoolean(primary);
  }

  public boolean isPrimary() {
    return primary.getAcquire();
  }

  public void setPrimary(final boolean primary) {
    boolean previous = this.primary.getAcquire();
    this.primary.setRelease(primary);
    if (previous != primary) {
      LOGGER.info("Node {} is now {}", nodeName, primary ? "primary" : "secondary");
    }
  }

  public String getNodeName() {
    return nodeName;
  }

  @Override
  public String toString() {
    return "ClusterStatus node: " + nodeName + " primary: " + isPrimary();
  }
}
