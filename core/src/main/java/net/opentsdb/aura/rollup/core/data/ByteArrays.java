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

/** Big endian helpers for the chunk headers. */
public interface ByteArrays {

  /**
   * @param offset offset in the buffer, inclusive
   */
  static void putInt(final int i, final byte[] buf, final int offset) {
    buf[offset] = (byte) (i >> 24);
    buf[offset + 1] = (byte) (i >> 16);
    buf[offset + 2] = (byte) (i >> 8);
    buf[offset + 3] = (byte) (i);
  }

  /**
   * @param offset offset from to read an int, inclusive
   */
  static int getInt(final byte[] buf, final int offset) {
    return (((int) buf[offset] & 0xff) << 24)
        | (((int) buf[offset + 1] & 0xff) << 16)
        | (((int) buf[offset + 2] & 0xff) << 8)
        | (((int) buf[offset + 3] & 0xff));
  }

  /** Reads 4 bytes as an unsigned 32 bit value. */
  static long getUnsignedInt(final byte[] buf, final int offset) {
    return getInt(buf, offset) & 0xFFFFFFFFL;
  }
}
