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

package org.catvec.vector.categorical;

import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.ArrowType.ArrowTypeID;
import org.catvec.vector.CastOptions;
import org.catvec.vector.ChunkedIndexVector;
import org.catvec.vector.Column;
import org.catvec.vector.FieldColumn;
import org.catvec.vector.IndexWidthOption;
import org.catvec.vector.compute.Gather;
import org.catvec.vector.compute.VectorCasts;
import org.catvec.vector.dictionary.LocalMapping;
import org.catvec.vector.dictionary.ReverseMapping;
import org.catvec.vector.dictionary.StringCache;
import org.catvec.vector.types.DataType;
import org.catvec.vector.util.ComputeException;

/**
 * Casts a {@link CategoricalVector} to the visited type. Every result is a new column owned by
 * the caller; the source is left untouched.
 */
class CategoricalCaster implements DataType.DataTypeVisitor<Column> {

  private final CategoricalVector source;
  private final CastOptions options;
  private final StringCache cache;
  private final boolean largeIndex;

  CategoricalCaster(CategoricalVector source, CastOptions options, StringCache cache) {
    this(source, options, cache, IndexWidthOption.LARGE_INDEX_ENABLED);
  }

  CategoricalCaster(CategoricalVector source, CastOptions options, StringCache cache,
      boolean largeIndex) {
    this.source = source;
    this.options = options;
    this.cache = cache;
    this.largeIndex = largeIndex;
  }

  @Override
  public Column visit(DataType.Primitive type) {
    ArrowType arrowType = type.getArrowType();
    if (arrowType.getTypeID() == ArrowTypeID.Utf8) {
      return new FieldColumn(toStrings());
    }
    if (arrowType.equals(ChunkedIndexVector.INDEX_TYPE)) {
      return source.getPhysical().duplicate();
    }
    if (type.isNumeric()) {
      return new FieldColumn(castCategories(arrowType));
    }
    return new FieldColumn(source.getPhysical().castWithOptions(arrowType, options));
  }

  private VarCharVector toStrings() {
    ChunkedIndexVector physical = source.getPhysical();
    ReverseMapping mapping = source.getReverseMapping();
    int count = physical.getValueCount();
    VarCharVector target = new VarCharVector(source.getName(), physical.getAllocator());
    try {
      target.allocateNew(count);
      int position = 0;
      if (!physical.hasNulls()) {
        for (UInt4Vector chunk : physical.getChunks()) {
          for (int i = 0; i < chunk.getValueCount(); i++) {
            target.setSafe(position++, mapping.resolveBytesUnchecked(chunk.get(i)));
          }
        }
      } else {
        for (UInt4Vector chunk : physical.getChunks()) {
          for (int i = 0; i < chunk.getValueCount(); i++, position++) {
            if (chunk.isNull(i)) {
              target.setNull(position);
            } else {
              target.setSafe(position, mapping.resolveBytesUnchecked(chunk.get(i)));
            }
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
   * Casts the categories, then gathers them by code.
   */
  private FieldVector castCategories(ArrowType arrowType) {
    try (CategoricalVector local = source.toLocal();
         FieldVector categories = VectorCasts.castStrings(
             local.getReverseMapping().getCategories(), arrowType, options,
             local.getPhysical().getAllocator())) {
      if (largeIndex) {
        try (UInt8Vector wide = (UInt8Vector) local.getPhysical()
            .castWithOptions(DataType.UINT64.getArrowType(), CastOptions.OVERFLOWING)) {
          return Gather.takeUnchecked(categories, wide, source.getName());
        }
      }
      return Gather.takeUnchecked(categories, local.getPhysical(), source.getName());
    }
  }

  @Override
  public Column visit(DataType.Categorical type) {
    CategoricalVector result;
    if (source.isEnum() && !type.hasReverseMapping()) {
      boolean useCache = cache != null && cache.isEnabled();
      result = useCache ? source.toGlobal(cache) : source.toLocal();
    } else {
      result = source.duplicate();
    }
    return result.setOrdering(type.getOrdering(), true);
  }

  @Override
  public Column visit(DataType.Enum type) {
    if (!type.hasReverseMapping()) {
      throw new ComputeException("cannot cast to enum without categories present");
    }
    if (type.getReverseMapping().isGlobal()) {
      throw new ComputeException("cannot cast to enum with a global mapping");
    }
    return source.toEnum((LocalMapping) type.getReverseMapping())
        .setOrdering(type.getOrdering(), true);
  }
}
