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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.FloatingPointVector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.catvec.vector.CastOptions;
import org.catvec.vector.ChunkedIndexVector;
import org.catvec.vector.util.ComputeException;

/**
 * Casts of the two vector kinds a categorical is made of: the unsigned codes and the string
 * categories. Supported targets are integers, floating point, booleans and UTF-8 strings.
 */
public final class VectorCasts {

  /** Number of failing values quoted in a strict cast error. */
  private static final int MAX_REPORTED_FAILURES = 10;

  private VectorCasts() {
  }

  /**
   * Casts unsigned 32-bit codes into a new single vector of {@code targetType}. Values that do not
   * fit the target are handled according to {@code options}.
   */
  public static FieldVector castIndices(ChunkedIndexVector indices, ArrowType targetType,
      CastOptions options) {
    if (!isSupported(targetType)) {
      throw new ComputeException("cannot cast UInt32 to " + targetType);
    }
    int count = indices.getValueCount();
    FieldVector target = newVector(indices.getName(), targetType, count,
        indices.getAllocator());
    try {
      int position = 0;
      for (UInt4Vector chunk : indices.getChunks()) {
        for (int i = 0; i < chunk.getValueCount(); i++, position++) {
          if (!chunk.isNull(i)) {
            setIndex(target, position, Integer.toUnsignedLong(chunk.get(i)), options);
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

  private static void setIndex(FieldVector target, int index, long value, CastOptions options) {
    switch (target.getField().getType().getTypeID()) {
      case Int:
        ArrowType.Int intType = (ArrowType.Int) target.getField().getType();
        if (!fits(value, false, intType)) {
          if (options == CastOptions.STRICT) {
            throw new ComputeException(
                "conversion from `u32` to `" + intType + "` failed for value " + value);
          }
          if (options == CastOptions.NON_STRICT) {
            return;
          }
        }
        ((BaseIntVector) target).setWithPossibleTruncate(index, value);
        break;
      case FloatingPoint:
        ((FloatingPointVector) target).setWithPossibleTruncate(index, (double) value);
        break;
      case Bool:
        ((BitVector) target).setSafe(index, value != 0 ? 1 : 0);
        break;
      case Utf8:
        ((VarCharVector) target).setSafe(index,
            Long.toString(value).getBytes(StandardCharsets.UTF_8));
        break;
      default:
        throw new ComputeException("cannot cast UInt32 to " + target.getField().getType());
    }
  }

  /**
   * Parses strings into a new numeric vector of {@code targetType}, allocated from {@code allocator}.
   * Unparseable values become null, unless {@code options} is {@link CastOptions#STRICT}, in
   * which case the cast fails and lists them.
   */
  public static FieldVector castStrings(VarCharVector source, ArrowType targetType,
      CastOptions options, BufferAllocator allocator) {
    if (!isNumeric(targetType)) {
      throw new ComputeException("cannot cast str to " + targetType);
    }
    int count = source.getValueCount();
    FieldVector target = newVector(source.getName(), targetType, count, allocator);
    List<String> failures = new ArrayList<>();
    int failureCount = 0;
    try {
      for (int i = 0; i < count; i++) {
        if (source.isNull(i)) {
          continue;
        }
        String value = new String(source.get(i), StandardCharsets.UTF_8);
        if (!setParsed(target, i, value, options)) {
          failureCount++;
          if (failures.size() < MAX_REPORTED_FAILURES) {
            failures.add(value);
          }
        }
      }
      target.setValueCount(count);
      if (failureCount > 0 && options == CastOptions.STRICT) {
        throw new ComputeException(String.format(
            "conversion from `str` to `%s` failed in column '%s' for %d out of %d values: %s",
            targetType, source.getName(), failureCount, count,
            failures.stream().map(f -> "\"" + f + "\"").collect(Collectors.joining(", ", "[", "]"))));
      }
    } catch (RuntimeException e) {
      target.close();
      throw e;
    }
    return target;
  }

  private static boolean setParsed(FieldVector target, int index, String value,
      CastOptions options) {
    ArrowType type = target.getField().getType();
    switch (type.getTypeID()) {
      case Int: {
        ArrowType.Int intType = (ArrowType.Int) type;
        boolean unsigned = !intType.getIsSigned() && intType.getBitWidth() == 64 &&
            !value.startsWith("-");
        long parsed;
        try {
          parsed = unsigned ? Long.parseUnsignedLong(value) : Long.parseLong(value);
        } catch (NumberFormatException e) {
          return false;
        }
        if (!fits(parsed, unsigned, intType) && options != CastOptions.OVERFLOWING) {
          return false;
        }
        ((BaseIntVector) target).setWithPossibleTruncate(index, parsed);
        return true;
      }
      case FloatingPoint: {
        double parsed;
        try {
          parsed = Double.parseDouble(value);
        } catch (NumberFormatException e) {
          return false;
        }
        ((FloatingPointVector) target).setWithPossibleTruncate(index, parsed);
        return true;
      }
      default:
        throw new ComputeException("cannot cast str to " + type);
    }
  }

  /**
   * Whether {@code value} is representable in {@code type}. With {@code valueUnsigned} the value
   * holds the bits of an unsigned 64-bit integer.
   */
  static boolean fits(long value, boolean valueUnsigned, ArrowType.Int type) {
    int bitWidth = type.getBitWidth();
    if (valueUnsigned && value < 0) {
      return !type.getIsSigned() && bitWidth == 64;
    }
    if (type.getIsSigned()) {
      if (bitWidth == 64) {
        return true;
      }
      long max = (1L << (bitWidth - 1)) - 1;
      return value >= -max - 1 && value <= max;
    }
    return value >= 0 && (bitWidth == 64 || value < (1L << bitWidth));
  }

  static boolean isNumeric(ArrowType type) {
    switch (type.getTypeID()) {
      case Int:
        return true;
      case FloatingPoint:
        return ((ArrowType.FloatingPoint) type).getPrecision() != FloatingPointPrecision.HALF;
      default:
        return false;
    }
  }

  static boolean isSupported(ArrowType type) {
    switch (type.getTypeID()) {
      case Int:
      case Bool:
      case Utf8:
        return true;
      default:
        return isNumeric(type);
    }
  }

  private static FieldVector newVector(String name, ArrowType type, int capacity,
      BufferAllocator allocator) {
    FieldVector vector = FieldType.nullable(type).createNewSingleVector(name, allocator, null);
    vector.setInitialCapacity(capacity);
    vector.allocateNew();
    return vector;
  }
}
