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
 * Thrown when a chunk encoder is misused: a push after {@link GorillaChunk#finish()},
 * a timestamp that does not move forward, or one the chunk's profile cannot
 * represent. The encoder keeps its last valid state.
 */
public class EncodingContractViolationException extends IllegalStateException {

  public EncodingContractViolationException(final String message) {
    super(message);
  }
}
