/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.catvec.vector.dictionary;

import java.io.ByteArrayOutputStream;

import org.apache.arrow.vector.VarCharVector;
import org.apache.commons.codec.digest.MurmurHash3;

/**
 * 128-bit fingerprint of an ordered list of categories. Two local mappings with the same hash are
 * treated as the same encoding.
 */
public final class CategoriesHash {

  private final long high;
  private final long low;

  CategoriesHash(long high, long low) {
    this.high = high;
    this.low = low;
  }

  /**
   * Hashes the categories in order. Each value is prefixed with its length so that
   * ["ab", "c"] and ["a", "bc"] differ.
   */
  public static CategoriesHash of(VarCharVector categories) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (int i = 0; i < categories.getValueCount(); i++) {
      byte[] value = categories.get(i);
      writeInt(out, value.length);
      out.write(value, 0, value.length);
    }
    byte[] bytes = out.toByteArray();
    long[] hash = MurmurHash3.hash128x64(bytes, 0, bytes.length, 0);
    return new CategoriesHash(hash[0], hash[1]);
  }

  private static void writeInt(ByteArrayOutputStream out, int value) {
    out.write(value >>> 24);
    out.write(value >>> 16);
    out.write(value >>> 8);
    out.write(value);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof CategoriesHash)) {
      return false;
    }
    CategoriesHash that = (CategoriesHash) obj;
    return high == that.high && low == that.low;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(high) * 31 + Long.hashCode(low);
  }

  @Override
  public String toString() {
    return String.format("%016x%016x", high, low);
  }
}
