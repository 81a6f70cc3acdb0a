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

package org.catvec.algorithm.unique;

import java.util.BitSet;

import org.apache.arrow.vector.UInt4Vector;
import org.catvec.vector.ChunkedIndexVector;
import org.catvec.vector.categorical.CategoricalVector;
import org.catvec.vector.dictionary.GlobalMapping;
import org.catvec.vector.dictionary.ReverseMapping;

/**
 * Counts and extracts the distinct values of a {@link CategoricalVector}.
 */
public class CategoricalUniqueCounter {

  private CategoricalUniqueCounter() {
  }

  /**
   * Number of distinct non-null values. Reads the mapping size when the vector can prove every
   * category occurs, scans the codes otherwise.
   */
  public static int nUnique(CategoricalVector vector) {
    ReverseMapping mapping = vector.getReverseMapping();
    if (vector.canFastUnique()) {
      return mapping.size();
    }
    return seenPositions(vector).cardinality();
  }

  private static BitSet seenPositions(CategoricalVector vector) {
    ReverseMapping mapping = vector.getReverseMapping();
    BitSet seen = new BitSet(mapping.size());
    vector.getPhysical().forEachNonNull((index, code) -> seen.set(mapping.toPosition(code)));
    return seen;
  }

  /**
   * Distinct values of {@code vector}, each once, in order of first appearance. A null, if
   * present, is kept once. The result shares the mapping.
   */
  public static CategoricalVector unique(CategoricalVector vector) {
    ReverseMapping mapping = vector.getReverseMapping();
    ChunkedIndexVector physical = vector.getPhysical();
    UInt4Vector codes = new UInt4Vector(vector.getName(), physical.getAllocator());
    boolean fast = vector.canFastUnique();
    try {
      if (fast) {
        int size = mapping.size();
        int[] positionToCode = mapping.isGlobal() ? ((GlobalMapping) mapping).localToCode() : null;
        codes.allocateNew(size);
        for (int i = 0; i < size; i++) {
          codes.set(i, positionToCode == null ? i : positionToCode[i]);
        }
        codes.setValueCount(size);
      } else {
        BitSet seen = new BitSet(mapping.size());
        boolean seenNull = false;
        int count = 0;
        codes.allocateNew(Math.min(physical.getValueCount(), mapping.size() + 1));
        for (int i = 0; i < physical.getValueCount(); i++) {
          Integer code = physical.getObject(i);
          if (code == null) {
            if (!seenNull) {
              seenNull = true;
              codes.setNull(count++);
            }
            continue;
          }
          int position = mapping.toPosition(code);
          if (!seen.get(position)) {
            seen.set(position);
            codes.setSafe(count++, code);
          }
        }
        codes.setValueCount(count);
      }
    } catch (RuntimeException e) {
      codes.close();
      throw e;
    }
    return CategoricalVector.fromIndicesAndTypeUnchecked(ChunkedIndexVector.of(codes),
        vector.getDataType()).withFastUnique(fast);
  }
}
