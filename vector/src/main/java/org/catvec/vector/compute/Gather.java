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

package org.catvec.vector.compute;

import static org.apache.arrow.memory.util.LargeMemoryUtil.checkedCastToInt;

import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.catvec.vector.ChunkedIndexVector;

/**
 * Gathers values of a vector at given positions. Null positions produce nulls.
 *
 * <p>Positions are trusted to be in bounds of the source; nothing beyond Arrow's own bounds
 * checking validates them.</p>
 */
public final class Gather {

  private Gather() {
  }

  /**
   * Gathers {@code source} at the positions held by {@code indices}.
   */
  public static FieldVector takeUnchecked(FieldVector source, ChunkedIndexVector indices,
      String name) {
    int count = indices.getValueCount();
    FieldVector target = newTarget(source, name, count);
    try {
      int position = 0;
      for (UInt4Vector chunk : indices.getChunks()) {
        for (int i = 0; i < chunk.getValueCount(); i++, position++) {
          if (!chunk.isNull(i)) {
            target.copyFromSafe(chunk.get(i), position, source);
          }
        }
      }
      target.setValueCount(count);
    } catch (RuntimeException e) {
      target.close();
      throw e;
    }
    return target;
  }

  /**
   * Gathers with 64-bit positions.
   */
  public static FieldVector takeUnchecked(FieldVector source, UInt8Vector indices, String name) {
    int count = indices.getValueCount();
    FieldVector target = newTarget(source, name, count);
    try {
      for (int i = 0; i < count; i++) {
        if (!indices.isNull(i)) {
          target.copyFromSafe(checkedCastToInt(indices.get(i)), i, source);
        }
      }
      target.setValueCount(count);
    } catch (RuntimeException e) {
      target.close();
      throw e;
    }
    return target;
  }

  private static FieldVector newTarget(FieldVector source, String name, int capacity) {
    FieldVector target = FieldType.nullable(source.getField().getType())
        .createNewSingleVector(name, source.getAllocator(), null);
    target.setInitialCapacity(capacity);
    target.allocateNew();
    return target;
  }
}
