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

package org.catvec.algorithm;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VarCharVector;
import org.catvec.vector.Column;
import org.catvec.vector.FieldColumn;
import org.catvec.vector.categorical.CategoricalStringIterator;
import org.catvec.vector.categorical.CategoricalVector;
import org.catvec.vector.types.DataType;

/**
 * Helpers shared by the algorithm tests.
 */
public class AlgorithmTestUtils {

  private AlgorithmTestUtils() {
  }

  public static VarCharVector newVarCharVector(String name, BufferAllocator allocator,
      String... values) {
    VarCharVector vector = new VarCharVector(name, allocator);
    vector.allocateNew(values.length);
    for (int i = 0; i < values.length; i++) {
      if (values[i] == null) {
        vector.setNull(i);
      } else {
        vector.setSafe(i, values[i].getBytes(StandardCharsets.UTF_8));
      }
    }
    vector.setValueCount(values.length);
    return vector;
  }

  public static List<String> toList(VarCharVector vector) {
    List<String> values = new ArrayList<>();
    for (int i = 0; i < vector.getValueCount(); i++) {
      values.add(vector.isNull(i) ? null : new String(vector.get(i), StandardCharsets.UTF_8));
    }
    return values;
  }

  public static List<String> toList(CategoricalVector vector) {
    List<String> values = new ArrayList<>();
    CategoricalStringIterator it = vector.iterStr();
    while (it.hasNext()) {
      values.add(it.next());
    }
    return values;
  }

  /**
   * Decodes through the string cast rather than the iterator.
   */
  public static List<String> castToStrings(CategoricalVector vector) {
    try (Column strings = vector.cast(DataType.UTF8, null)) {
      return toList((VarCharVector) ((FieldColumn) strings).getVector());
    }
  }

  public static List<Integer> codes(CategoricalVector vector) {
    List<Integer> values = new ArrayList<>();
    for (int i = 0; i < vector.getValueCount(); i++) {
      values.add(vector.getCode(i));
    }
    return values;
  }
}
