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

package org.catvec.vector.types;

import java.util.Objects;

import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.ArrowType.ArrowTypeID;
import org.catvec.vector.dictionary.ReverseMapping;

/**
 * Logical type of a column. Every non-categorical type is a {@link Primitive} wrapping an Arrow
 * type; dictionary encoded columns are either {@link Categorical} or {@link Enum}.
 *
 * <p>A type refers to its {@link ReverseMapping} without owning a reference to it: whoever built
 * the mapping keeps it open for as long as the type is used as a cast target.</p>
 */
public abstract class DataType {

  public static final Primitive UTF8 = new Primitive(ArrowType.Utf8.INSTANCE);
  public static final Primitive BOOL = new Primitive(ArrowType.Bool.INSTANCE);
  public static final Primitive INT32 = new Primitive(new ArrowType.Int(32, true));
  public static final Primitive INT64 = new Primitive(new ArrowType.Int(64, true));
  public static final Primitive UINT32 = new Primitive(new ArrowType.Int(32, false));
  public static final Primitive UINT64 = new Primitive(new ArrowType.Int(64, false));
  public static final Primitive FLOAT32 =
      new Primitive(new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE));
  public static final Primitive FLOAT64 =
      new Primitive(new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE));

  public enum DataTypeID {
    Primitive,
    Categorical,
    Enum
  }

  DataType() {
  }

  public abstract DataTypeID getTypeID();

  public abstract <T> T accept(DataTypeVisitor<T> visitor);

  /**
   * Whether this type is dictionary encoded, i.e. {@link Categorical} or {@link Enum}.
   */
  public boolean isDictionaryEncoded() {
    return false;
  }

  public static Primitive of(ArrowType arrowType) {
    return new Primitive(arrowType);
  }

  /**
   * to visit the DataTypes
   * <code>
   *   type.accept(new DataTypeVisitor&lt;Column&gt;() {
   *   ...
   *   });
   * </code>
   */
  public interface DataTypeVisitor<T> {
    T visit(Primitive type);

    T visit(Categorical type);

    T visit(Enum type);
  }

  /**
   * A plain Arrow type.
   */
  public static final class Primitive extends DataType {
    private final ArrowType arrowType;

    public Primitive(ArrowType arrowType) {
      Preconditions.checkNotNull(arrowType, "arrowType");
      Preconditions.checkArgument(!(arrowType instanceof ArrowType.ExtensionType),
          "extension types are not supported: %s", arrowType);
      this.arrowType = arrowType;
    }

    public ArrowType getArrowType() {
      return arrowType;
    }

    /**
     * True for integer and floating point types.
     */
    public boolean isNumeric() {
      ArrowTypeID id = arrowType.getTypeID();
      return id == ArrowTypeID.Int || id == ArrowTypeID.FloatingPoint;
    }

    @Override
    public DataTypeID getTypeID() {
      return DataTypeID.Primitive;
    }

    @Override
    public <T> T accept(DataTypeVisitor<T> visitor) {
      return visitor.visit(this);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Primitive)) {
        return false;
      }
      return arrowType.equals(((Primitive) obj).arrowType);
    }

    @Override
    public int hashCode() {
      return arrowType.hashCode();
    }

    @Override
    public String toString() {
      return arrowType.toString();
    }
  }

  /**
   * Common state of the dictionary encoded types: an optional reverse mapping and an ordering.
   */
  public abstract static class DictionaryType extends DataType {
    private final ReverseMapping reverseMapping;
    private final CategoricalOrdering ordering;

    DictionaryType(ReverseMapping reverseMapping, CategoricalOrdering ordering) {
      this.reverseMapping = reverseMapping;
      this.ordering = Preconditions.checkNotNull(ordering, "ordering");
    }

    /**
     * The mapping, or null when the type is unresolved.
     */
    public ReverseMapping getReverseMapping() {
      return reverseMapping;
    }

    public boolean hasReverseMapping() {
      return reverseMapping != null;
    }

    public CategoricalOrdering getOrdering() {
      return ordering;
    }

    public abstract DictionaryType withOrdering(CategoricalOrdering ordering);

    public abstract DictionaryType withReverseMapping(ReverseMapping reverseMapping);

    @Override
    public boolean isDictionaryEncoded() {
      return true;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (obj == null || getClass() != obj.getClass()) {
        return false;
      }
      DictionaryType that = (DictionaryType) obj;
      if (ordering != that.ordering) {
        return false;
      }
      if (reverseMapping == null || that.reverseMapping == null) {
        return reverseMapping == that.reverseMapping;
      }
      return reverseMapping.isSameSource(that.reverseMapping);
    }

    @Override
    public int hashCode() {
      return Objects.hash(getTypeID(), ordering);
    }

    @Override
    public String toString() {
      String mapping = reverseMapping == null ? "unresolved" : reverseMapping.getKind().name().toLowerCase();
      return getTypeID() + "(" + mapping + ", " + ordering + ")";
    }
  }

  /**
   * Categorical type: a local, a global or, as a cast target only, no mapping.
   */
  public static final class Categorical extends DictionaryType {

    public Categorical(ReverseMapping reverseMapping, CategoricalOrdering ordering) {
      super(reverseMapping, ordering);
    }

    /**
     * A categorical cast target that lets the cast choose the mapping.
     */
    public static Categorical unresolved(CategoricalOrdering ordering) {
      return new Categorical(null, ordering);
    }

    @Override
    public Categorical withOrdering(CategoricalOrdering ordering) {
      return new Categorical(getReverseMapping(), ordering);
    }

    @Override
    public Categorical withReverseMapping(ReverseMapping reverseMapping) {
      return new Categorical(reverseMapping, getOrdering());
    }

    @Override
    public DataTypeID getTypeID() {
      return DataTypeID.Categorical;
    }

    @Override
    public <T> T accept(DataTypeVisitor<T> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Enum type: a fixed vocabulary that is always locally encoded once resolved.
   */
  public static final class Enum extends DictionaryType {

    public Enum(ReverseMapping reverseMapping, CategoricalOrdering ordering) {
      super(reverseMapping, ordering);
    }

    /**
     * An enum without categories. Only meaningful as a transient state; casts reject it.
     */
    public static Enum unresolved(CategoricalOrdering ordering) {
      return new Enum(null, ordering);
    }

    public boolean isResolved() {
      return hasReverseMapping();
    }

    @Override
    public Enum withOrdering(CategoricalOrdering ordering) {
      return new Enum(getReverseMapping(), ordering);
    }

    @Override
    public Enum withReverseMapping(ReverseMapping reverseMapping) {
      return new Enum(reverseMapping, getOrdering());
    }

    @Override
    public DataTypeID getTypeID() {
      return DataTypeID.Enum;
    }

    @Override
    public <T> T accept(DataTypeVisitor<T> visitor) {
      return visitor.visit(this);
    }
  }
}
