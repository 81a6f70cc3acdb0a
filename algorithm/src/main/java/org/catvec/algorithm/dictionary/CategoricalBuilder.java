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

package org.catvec.algorithm.dictionary;

import java.util.HashMap;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.util.ArrowBufPointer;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.VarCharVector;
import org.catvec.vector.ChunkedIndexVector;
import org.catvec.vector.categorical.CategoricalVector;
import org.catvec.vector.dictionary.LocalMapping;
import org.catvec.vector.dictionary.StringCache;
import org.catvec.vector.types.CategoricalOrdering;

/**
 * Dictionary encodes a string vector into a {@link CategoricalVector}. Categories are numbered in
 * order of first appearance.
 */
public class CategoricalBuilder {

  private CategoricalBuilder() {
  }

  /**
   * Builds a locally encoded categorical. The source is only read; the result is allocated from
   * its allocator and has the fast-unique flag set.
   */
  public static CategoricalVector fromStrings(VarCharVector source, CategoricalOrdering ordering) {
    BufferAllocator allocator = source.getAllocator();
    int count = source.getValueCount();

    // keys point into the source, which outlives the map
    HashMap<ArrowBufPointer, Integer> codes = new HashMap<>();
    ArrowBufPointer probe = new ArrowBufPointer();

    VarCharVector categories = new VarCharVector("categories", allocator);
    UInt4Vector indices = new UInt4Vector(source.getName(), allocator);
    try {
      categories.allocateNew();
      indices.allocateNew(count);
      for (int i = 0; i < count; i++) {
        if (source.isNull(i)) {
          indices.setNull(i);
          continue;
        }
        source.getDataPointer(i, probe);
        Integer code = codes.get(probe);
        if (code == null) {
          code = codes.size();
          codes.put(probe, code);
          probe = new ArrowBufPointer();
          categories.copyFromSafe(i, code, source);
        }
        indices.set(i, code);
      }
      categories.setValueCount(codes.size());
      indices.setValueCount(count);
    } catch (RuntimeException e) {
      categories.close();
      indices.close();
      throw e;
    }

    try (LocalMapping mapping = LocalMapping.build(categories)) {
      return CategoricalVector.fromIndicesAndMappingUnchecked(
          ChunkedIndexVector.of(indices), mapping, false, ordering).withFastUnique(true);
    }
  }

  /**
   * Builds a globally encoded categorical when {@code cache} is enabled, a local one otherwise.
   */
  public static CategoricalVector fromStrings(VarCharVector source, CategoricalOrdering ordering,
      StringCache cache) {
    CategoricalVector local = fromStrings(source, ordering);
    if (cache == null || !cache.isEnabled()) {
      return local;
    }
    try {
      return local.toGlobal(cache);
    } finally {
      local.close();
    }
  }
}
