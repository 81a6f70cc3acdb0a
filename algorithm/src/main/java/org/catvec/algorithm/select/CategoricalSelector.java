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

package org.catvec.algorithm.select;

import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.UInt4Vector;
import org.catvec.vector.ChunkedIndexVector;
import org.catvec.vector.IsSorted;
import org.catvec.vector.categorical.CategoricalVector;

/**
 * Row selection on categorical vectors. Results share the mapping of the source and never carry
 * the fast-unique flag, since a subset need not contain every category.
 */
public class CategoricalSelector {

  private CategoricalSelector() {
  }

  /**
   * Zero-copy range of {@code length} rows starting at {@code offset}. The sorted flag is kept.
   */
  public static CategoricalVector slice(CategoricalVector vector, int offset, int length) {
    ChunkedIndexVector sliced = vector.getPhysical().slice(offset, length);
    return CategoricalVector.fromIndicesAndTypeUnchecked(sliced, vector.getDataType());
  }

  /**
   * Gathers the rows at {@code positions}, in that order.
   *
   * @throws IndexOutOfBoundsException if a position is out of range
   */
  public static CategoricalVector take(CategoricalVector vector, int[] positions) {
    ChunkedIndexVector physical = vector.getPhysical();
    UInt4Vector codes = new UInt4Vector(vector.getName(), physical.getAllocator());
    try {
      codes.allocateNew(positions.length);
      for (int i = 0; i < positions.length; i++) {
        Integer code = physical.getObject(positions[i]);
        if (code == null) {
          codes.setNull(i);
        } else {
          codes.set(i, code);
        }
      }
      codes.setValueCount(positions.length);
    } catch (RuntimeException e) {
      codes.close();
      throw e;
    }
    return CategoricalVector.fromIndicesAndTypeUnchecked(ChunkedIndexVector.of(codes),
        vector.getDataType());
  }

  /**
   * Gathers the rows at {@code positions}; a null position yields a null row.
   */
  public static CategoricalVector take(CategoricalVector vector, UInt4Vector positions) {
    ChunkedIndexVector physical = vector.getPhysical();
    int count = positions.getValueCount();
    UInt4Vector codes = new UInt4Vector(vector.getName(), physical.getAllocator());
    try {
      codes.allocateNew(count);
      for (int i = 0; i < count; i++) {
        Integer code = positions.isNull(i) ? null : physical.getObject(positions.get(i));
        if (code == null) {
          codes.setNull(i);
        } else {
          codes.set(i, code);
        }
      }
      codes.setValueCount(count);
    } catch (RuntimeException e) {
      codes.close();
      throw e;
    }
    return CategoricalVector.fromIndicesAndTypeUnchecked(ChunkedIndexVector.of(codes),
        vector.getDataType());
  }

  /**
   * Keeps the rows whose mask bit is set; a null mask bit drops the row. Row order, and so the
   * sorted flag, is kept.
   */
  public static CategoricalVector filter(CategoricalVector vector, BitVector mask) {
    ChunkedIndexVector physical = vector.getPhysical();
    Preconditions.checkArgument(mask.getValueCount() == physical.getValueCount(),
        "mask length %s does not match vector length %s", mask.getValueCount(),
        physical.getValueCount());
    UInt4Vector codes = new UInt4Vector(vector.getName(), physical.getAllocator());
    try {
      codes.allocateNew(physical.getValueCount());
      int count = 0;
      for (int i = 0; i < mask.getValueCount(); i++) {
        if (mask.isNull(i) || mask.get(i) == 0) {
          continue;
        }
        Integer code = physical.getObject(i);
        if (code == null) {
          codes.setNull(count);
        } else {
          codes.set(count, code);
        }
        count++;
      }
      codes.setValueCount(count);
    } catch (RuntimeException e) {
      codes.close();
      throw e;
    }
    CategoricalVector filtered = CategoricalVector.fromIndicesAndTypeUnchecked(
        ChunkedIndexVector.of(codes), vector.getDataType());
    IsSorted sorted = vector.getSortedFlag();
    filtered.setSortedFlag(sorted);
    return filtered;
  }
}
