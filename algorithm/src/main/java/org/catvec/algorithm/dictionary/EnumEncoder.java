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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

import org.apache.arrow.memory.util.ArrowBufPointer;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.VarCharVector;
import org.catvec.vector.CastOptions;
import org.catvec.vector.ChunkedIndexVector;
import org.catvec.vector.categorical.CategoricalVector;
import org.catvec.vector.dictionary.LocalMapping;
import org.catvec.vector.types.CategoricalOrdering;
import org.catvec.vector.util.ComputeException;

/**
 * Encodes strings against a fixed vocabulary, producing an enum.
 */
public class EnumEncoder {

  private static final int MAX_REPORTED_FAILURES = 10;

  /**
   * The vocabulary.
   */
  private final LocalMapping vocabulary;

  /**
   * Maps a pointer to a vocabulary element to its code.
   */
  private final HashMap<ArrowBufPointer, Integer> hashMap = new HashMap<>();

  private final ArrowBufPointer reusablePointer = new ArrowBufPointer();

  /**
   * Constructs an encoder. The vocabulary must stay open while the encoder is used.
   */
  public EnumEncoder(LocalMapping vocabulary) {
    this.vocabulary = vocabulary;
    VarCharVector categories = vocabulary.getCategories();
    for (int i = 0; i < categories.getValueCount(); i++) {
      hashMap.put(categories.getDataPointer(i), i);
    }
  }

  /**
   * Encodes {@code source}. Values outside the vocabulary become null, or fail the whole call
   * when {@code options} is {@link CastOptions#STRICT}.
   */
  public CategoricalVector encode(VarCharVector source, CategoricalOrdering ordering,
      CastOptions options) {
    int count = source.getValueCount();
    List<String> failures = new ArrayList<>();
    int failureCount = 0;
    UInt4Vector indices = new UInt4Vector(source.getName(), source.getAllocator());
    try {
      indices.allocateNew(count);
      for (int i = 0; i < count; i++) {
        if (source.isNull(i)) {
          indices.setNull(i);
          continue;
        }
        source.getDataPointer(i, reusablePointer);
        Integer code = hashMap.get(reusablePointer);
        if (code != null) {
          indices.set(i, code);
        } else {
          indices.setNull(i);
          failureCount++;
          if (failures.size() < MAX_REPORTED_FAILURES) {
            failures.add("\"" + new String(source.get(i), StandardCharsets.UTF_8) + "\"");
          }
        }
      }
      indices.setValueCount(count);
      if (failureCount > 0 && options == CastOptions.STRICT) {
        throw new ComputeException(String.format(
            "conversion from `str` to `enum` failed in column '%s' for %d out of %d values: %s",
            source.getName(), failureCount, count, failures));
      }
    } catch (RuntimeException e) {
      indices.close();
      throw e;
    }
    return CategoricalVector.fromIndicesAndMappingUnchecked(
        ChunkedIndexVector.of(indices), vocabulary, true, ordering);
  }

  public CategoricalVector encode(VarCharVector source) {
    return encode(source, CategoricalOrdering.DEFAULT, CastOptions.DEFAULT);
  }
}
