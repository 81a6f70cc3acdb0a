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

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.VarCharVector;

/**
 * A mapping whose codes are positions in its own categories.
 */
public final class LocalMapping extends ReverseMapping {

  private final CategoriesHash hash;

  private LocalMapping(VarCharVector categories) {
    super(categories);
    this.hash = CategoriesHash.of(categories);
  }

  /**
   * Builds a mapping that takes ownership of {@code categories}. The values must be non-null;
   * they are expected to be distinct.
   */
  public static LocalMapping build(VarCharVector categories) {
    try {
      return new LocalMapping(categories);
    } catch (RuntimeException e) {
      categories.close();
      throw e;
    }
  }

  /**
   * Builds a mapping from Java strings, in the given order.
   */
  public static LocalMapping fromStrings(BufferAllocator allocator, List<String> values) {
    Preconditions.checkNotNull(values, "values");
    VarCharVector categories = new VarCharVector("categories", allocator);
    try {
      categories.allocateNew(values.size());
      for (int i = 0; i < values.size(); i++) {
        String value = Preconditions.checkNotNull(values.get(i), "category %s is null", i);
        categories.setSafe(i, value.getBytes(StandardCharsets.UTF_8));
      }
      categories.setValueCount(values.size());
    } catch (RuntimeException e) {
      categories.close();
      throw e;
    }
    return build(categories);
  }

  public CategoriesHash getHash() {
    return hash;
  }

  @Override
  public Kind getKind() {
    return Kind.LOCAL;
  }

  @Override
  public int toPosition(int code) {
    return code;
  }

  @Override
  public LocalMapping retain() {
    super.retain();
    return this;
  }

  @Override
  public boolean isSameSource(ReverseMapping other) {
    if (other == this) {
      return true;
    }
    return other instanceof LocalMapping && hash.equals(((LocalMapping) other).hash);
  }

  @Override
  public String toString() {
    return "LocalMapping{size=" + size() + ", hash=" + hash + "}";
  }
}
