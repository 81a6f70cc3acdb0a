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

import java.util.HashMap;
import java.util.Map;

import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.util.Text;
import org.catvec.vector.CastOptions;
import org.catvec.vector.ChunkedIndexVector;
import org.catvec.vector.Column;
import org.catvec.vector.InvariantChecking;
import org.catvec.vector.IsSorted;
import org.catvec.vector.dictionary.GlobalMapping;
import org.catvec.vector.dictionary.LocalMapping;
import org.catvec.vector.dictionary.ReverseMapping;
import org.catvec.vector.dictionary.StringCache;
import org.catvec.vector.types.CategoricalOrdering;
import org.catvec.vector.types.DataType;
import org.catvec.vector.types.DataType.DictionaryType;
import org.catvec.vector.util.ComputeException;
import org.catvec.vector.util.IntIntHashMap;
import org.catvec.vector.util.SharedVectors;
import org.catvec.vector.util.StringCacheMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dictionary encoded string column: unsigned 32-bit codes plus a {@link ReverseMapping} that
 * turns each code back into its category.
 *
 * <p>Every non-null code resolves through the mapping. The checked factory verifies this; the
 * unchecked ones trust the caller and only verify when invariant checking is on
 * (see {@link InvariantChecking}).</p>
 *
 * <p>A vector owns its codes and one reference to its mapping, both released by
 * {@link #close()}. Conversions never modify a mapping; they return new vectors. Only the
 * ordering, the sorted flag and the fast-unique flag change in place.</p>
 */
public class CategoricalVector implements Column {
  private static final Logger logger = LoggerFactory.getLogger(CategoricalVector.class);

  /** Set when every category occurs exactly once, so the unique count is the mapping size. */
  static final int ORIGINAL = 0x01;

  private final ChunkedIndexVector physical;
  private DictionaryType dataType;
  private int bitSettings;
  private boolean closed;

  /**
   * Adopts {@code physical} and the reference to the mapping held by {@code dataType}.
   */
  private CategoricalVector(ChunkedIndexVector physical, DictionaryType dataType, int bitSettings) {
    this.physical = physical;
    this.dataType = dataType;
    this.bitSettings = bitSettings;
    if (dataType.getOrdering() == CategoricalOrdering.LEXICAL) {
      physical.setSortedFlag(IsSorted.NOT);
    }
  }

  /**
   * Creates a vector after verifying every code against {@code mapping}. Takes ownership of
   * {@code indices}, also on failure, and retains {@code mapping}.
   *
   * @throws ComputeException if a code does not resolve, or an enum gets a global mapping
   */
  public static CategoricalVector fromIndicesAndMapping(ChunkedIndexVector indices,
      ReverseMapping mapping, boolean isEnum, CategoricalOrdering ordering) {
    Preconditions.checkNotNull(mapping, "mapping");
    String violation = findViolation(indices, mapping, isEnum);
    if (violation != null) {
      indices.close();
      throw new ComputeException(violation);
    }
    return new CategoricalVector(indices, newType(mapping.retain(), isEnum, ordering), 0);
  }

  /**
   * Creates a vector without verifying the codes. The caller guarantees that every non-null code
   * resolves through {@code mapping} and that an enum gets a local mapping. Takes ownership of
   * {@code indices} and retains {@code mapping}.
   */
  public static CategoricalVector fromIndicesAndMappingUnchecked(ChunkedIndexVector indices,
      ReverseMapping mapping, boolean isEnum, CategoricalOrdering ordering) {
    if (InvariantChecking.INVARIANT_CHECKING_ENABLED) {
      String violation = findViolation(indices, mapping, isEnum);
      Preconditions.checkState(violation == null, "invariant violated: %s", violation);
    }
    return new CategoricalVector(indices, newType(mapping.retain(), isEnum, ordering), 0);
  }

  /**
   * Same as {@link #fromIndicesAndMappingUnchecked} with mapping, kind and ordering taken from a
   * resolved type.
   */
  public static CategoricalVector fromIndicesAndTypeUnchecked(ChunkedIndexVector indices,
      DictionaryType dataType) {
    Preconditions.checkArgument(dataType.hasReverseMapping(), "type %s is unresolved", dataType);
    return fromIndicesAndMappingUnchecked(indices, dataType.getReverseMapping(),
        dataType instanceof DataType.Enum, dataType.getOrdering());
  }

  private static DictionaryType newType(ReverseMapping mapping, boolean isEnum,
      CategoricalOrdering ordering) {
    return isEnum ? new DataType.Enum(mapping, ordering) : new DataType.Categorical(mapping, ordering);
  }

  private static String findViolation(ChunkedIndexVector indices, ReverseMapping mapping,
      boolean isEnum) {
    if (isEnum && !mapping.isLocal()) {
      return "an enum requires a local mapping";
    }
    int size = mapping.size();
    for (int c = 0; c < indices.getChunkCount(); c++) {
      UInt4Vector chunk = indices.getChunk(c);
      for (int i = 0; i < chunk.getValueCount(); i++) {
        if (chunk.isNull(i)) {
          continue;
        }
        int code = chunk.get(i);
        int position = mapping.toPosition(code);
        if (position < 0 || position >= size) {
          return "code " + Integer.toUnsignedString(code) + " is not part of the " +
              mapping.getKind().name().toLowerCase() + " mapping of size " + size;
        }
      }
    }
    return null;
  }

  @Override
  public String getName() {
    return physical.getName();
  }

  @Override
  public int getValueCount() {
    return physical.getValueCount();
  }

  @Override
  public int getNullCount() {
    return physical.getNullCount();
  }

  public boolean isEmpty() {
    return physical.getValueCount() == 0;
  }

  /**
   * The codes. Owned by this vector.
   */
  public ChunkedIndexVector getPhysical() {
    return physical;
  }

  @Override
  public DictionaryType getDataType() {
    return dataType;
  }

  public boolean isEnum() {
    return dataType instanceof DataType.Enum;
  }

  public CategoricalOrdering getOrdering() {
    return dataType.getOrdering();
  }

  public boolean usesLexicalOrdering() {
    return dataType.getOrdering() == CategoricalOrdering.LEXICAL;
  }

  /**
   * The mapping of this vector. Callers that keep it beyond the lifetime of the vector must
   * {@link ReverseMapping#retain()} it.
   */
  public ReverseMapping getReverseMapping() {
    ReverseMapping mapping = dataType.getReverseMapping();
    if (mapping == null) {
      throw new IllegalStateException("implementation error: " + dataType + " has no mapping");
    }
    return mapping;
  }

  /**
   * Whether the unique values can be read from the mapping without scanning the codes.
   */
  public boolean canFastUnique() {
    return isFastUniqueFlagSet() && physical.getChunkCount() == 1 && physical.getNullCount() == 0;
  }

  public boolean isFastUniqueFlagSet() {
    return (bitSettings & ORIGINAL) != 0;
  }

  /**
   * Sets or clears the fast-unique flag. Setting it asserts that every category of the mapping
   * occurs exactly once among the codes.
   */
  public CategoricalVector withFastUnique(boolean fastUnique) {
    if (fastUnique) {
      bitSettings |= ORIGINAL;
    } else {
      bitSettings &= ~ORIGINAL;
    }
    return this;
  }

  public IsSorted getSortedFlag() {
    return physical.getSortedFlag();
  }

  /**
   * Records the physical sort order. A lexically ordered vector never carries one.
   */
  public void setSortedFlag(IsSorted sorted) {
    physical.setSortedFlag(usesLexicalOrdering() ? IsSorted.NOT : sorted);
  }

  /**
   * Changes the ordering. Clears the fast-unique flag unless {@code keepFastUnique}, and the
   * sorted flag when switching to lexical ordering.
   */
  public CategoricalVector setOrdering(CategoricalOrdering ordering, boolean keepFastUnique) {
    dataType = dataType.withOrdering(ordering);
    if (!keepFastUnique) {
      withFastUnique(false);
    }
    if (ordering == CategoricalOrdering.LEXICAL) {
      physical.setSortedFlag(IsSorted.NOT);
    }
    return this;
  }

  /**
   * Replaces the mapping. The caller guarantees that every code resolves through the new one.
   */
  public CategoricalVector setReverseMapping(ReverseMapping mapping, boolean keepFastUnique) {
    Preconditions.checkNotNull(mapping, "mapping");
    Preconditions.checkArgument(!isEnum() || mapping.isLocal(), "an enum requires a local mapping");
    ReverseMapping previous = dataType.getReverseMapping();
    dataType = dataType.withReverseMapping(mapping.retain());
    if (previous != null) {
      previous.close();
    }
    if (!keepFastUnique) {
      withFastUnique(false);
    }
    return this;
  }

  /**
   * Converts to a locally encoded categorical. Codes of a global vector are rewritten to
   * positions; a local vector or enum is shared without copying.
   */
  public CategoricalVector toLocal() {
    ReverseMapping mapping = getReverseMapping();
    if (mapping.isLocal()) {
      return new CategoricalVector(physical.duplicate(),
          new DataType.Categorical(mapping.retain(), getOrdering()), bitSettings);
    }
    GlobalMapping global = (GlobalMapping) mapping;
    LocalMapping local = LocalMapping.build(SharedVectors.share(global.getCategories(), "categories"));
    ChunkedIndexVector remapped;
    try {
      remapped = physical.remap(global::toPosition);
    } catch (RuntimeException e) {
      local.close();
      throw e;
    }
    logger.debug("converted '{}' from global to local, {} categories", getName(), local.size());
    return new CategoricalVector(remapped, new DataType.Categorical(local, getOrdering()),
        bitSettings);
  }

  /**
   * Converts to a globally encoded categorical, interning the categories in {@code cache}. A
   * global vector of the cache's current generation is shared without copying.
   *
   * @throws StringCacheMismatchException if the cache is disabled
   */
  public CategoricalVector toGlobal(StringCache cache) {
    Preconditions.checkNotNull(cache, "cache");
    if (!cache.isEnabled()) {
      throw new StringCacheMismatchException(
          "cannot convert '" + getName() + "' to a global categorical: the string cache is disabled");
    }
    ReverseMapping mapping = getReverseMapping();
    if (mapping.isGlobal()) {
      if (((GlobalMapping) mapping).getCacheGeneration() == cache.getGeneration()) {
        return new CategoricalVector(physical.duplicate(),
            new DataType.Categorical(mapping.retain(), getOrdering()), bitSettings);
      }
      // codes of an older generation are meaningless to this cache
      try (CategoricalVector local = toLocal()) {
        return local.toGlobal(cache);
      }
    }
    GlobalMapping global = cache.internAll(mapping.getCategories());
    ChunkedIndexVector remapped;
    try {
      int[] localToCode = global.localToCode();
      remapped = physical.remap(position -> localToCode[position]);
    } catch (RuntimeException e) {
      global.close();
      throw e;
    }
    logger.debug("converted '{}' from local to global, generation {}", getName(),
        global.getCacheGeneration());
    return new CategoricalVector(remapped, new DataType.Categorical(global, getOrdering()),
        bitSettings);
  }

  /**
   * Converts to an enum over {@code target}. Values missing from the target vocabulary become
   * null. When the local mapping of this vector hashes equal to {@code target}, the codes are
   * shared without copying.
   */
  public CategoricalVector toEnum(LocalMapping target) {
    Preconditions.checkNotNull(target, "target");
    ReverseMapping mapping = getReverseMapping();
    if (mapping.isLocal() && ((LocalMapping) mapping).getHash().equals(target.getHash())) {
      return new CategoricalVector(physical.duplicate(),
          new DataType.Enum(mapping.retain(), getOrdering()), bitSettings);
    }

    VarCharVector targetCategories = target.getCategories();
    Map<Text, Integer> newCodes = new HashMap<>();
    for (int i = 0; i < targetCategories.getValueCount(); i++) {
      newCodes.put(targetCategories.getObject(i), i);
    }
    VarCharVector categories = mapping.getCategories();
    int[] oldCodes = mapping.isGlobal() ? ((GlobalMapping) mapping).localToCode() : null;
    IntIntHashMap oldToNew = new IntIntHashMap(categories.getValueCount());
    for (int i = 0; i < categories.getValueCount(); i++) {
      Integer newCode = newCodes.get(categories.getObject(i));
      if (newCode != null) {
        oldToNew.put(oldCodes == null ? i : oldCodes[i], newCode);
      }
    }
    ChunkedIndexVector remapped = physical.remapToNullable(getName(), oldToNew::get);
    logger.debug("converted '{}' to an enum of {} categories, {} matched", getName(),
        target.size(), oldToNew.size());
    return new CategoricalVector(remapped, new DataType.Enum(target.retain(), getOrdering()), 0);
  }

  /**
   * Casts to {@code targetType}. {@code cache} may be null when no string cache is in use.
   */
  public Column castWithOptions(DataType targetType, CastOptions options, StringCache cache) {
    return targetType.accept(new CategoricalCaster(this, options, cache));
  }

  public Column cast(DataType targetType, StringCache cache) {
    return castWithOptions(targetType, CastOptions.DEFAULT, cache);
  }

  /**
   * Iterates the values as strings, nulls included.
   */
  public CategoricalStringIterator iterStr() {
    return new CategoricalStringIterator(this, 0);
  }

  public CategoricalStringIterator iterStr(int index) {
    return new CategoricalStringIterator(this, index);
  }

  /**
   * Gets the value at {@code index}, or null.
   *
   * @throws IndexOutOfBoundsException if {@code index} is out of range
   */
  public String getString(int index) {
    Integer code = physical.getObject(index);
    return code == null ? null : getReverseMapping().resolveUnchecked(code);
  }

  public Integer getCode(int index) {
    return physical.getObject(index);
  }

  /**
   * Zero-copy copy sharing codes and mapping, flags included.
   */
  public CategoricalVector duplicate() {
    return new CategoricalVector(physical.duplicate(),
        dataType.withReverseMapping(getReverseMapping().retain()), bitSettings);
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    physical.close();
    ReverseMapping mapping = dataType.getReverseMapping();
    if (mapping != null) {
      mapping.close();
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getName()).append(": ").append(dataType).append(" [");
    int count = Math.min(getValueCount(), 10);
    for (int i = 0; i < count; i++) {
      if (i > 0) {
        sb.append(", ");
      }
      String value = getString(i);
      sb.append(value == null ? "null" : "\"" + value + "\"");
    }
    if (getValueCount() > count) {
      sb.append(", ...");
    }
    return sb.append("]").toString();
  }
}
