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

package org.catvec.vector.dictionary;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.VarCharVector;

/**
 * Maps the physical codes of a categorical column back to their string values.
 *
 * <p>The categories are held in a {@link VarCharVector} without nulls. A mapping is shared by
 * every column and type derived from the same encoding, so it is reference counted: each holder
 * calls {@link #retain()} when it takes a reference and {@link #close()} when it is done. The
 * categories are released when the count drops to zero.</p>
 */
public abstract class ReverseMapping implements AutoCloseable {

  /**
   * How physical codes are interpreted.
   */
  public enum Kind {
    /** The code is the position in the categories. */
    LOCAL,
    /** The code is a string cache id, translated to a position through a map. */
    GLOBAL
  }

  private final AtomicInteger refCount = new AtomicInteger(1);
  private final VarCharVector categories;

  ReverseMapping(VarCharVector categories) {
    Preconditions.checkNotNull(categories, "categories");
    Preconditions.checkArgument(categories.getNullCount() == 0,
        "categories must not contain nulls");
    this.categories = categories;
  }

  public abstract Kind getKind();

  public boolean isLocal() {
    return getKind() == Kind.LOCAL;
  }

  public boolean isGlobal() {
    return getKind() == Kind.GLOBAL;
  }

  /**
   * Number of distinct categories.
   */
  public int size() {
    return categories.getValueCount();
  }

  /**
   * The category vector. It is owned by this mapping and must not be closed by the caller.
   */
  public VarCharVector getCategories() {
    return categories;
  }

  public BufferAllocator getAllocator() {
    return categories.getAllocator();
  }

  /**
   * Translates a physical code to a position in the categories, or -1 if the code is unknown.
   */
  public abstract int toPosition(int code);

  /**
   * Resolves a physical code to its string.
   *
   * @throws IndexOutOfBoundsException if the code is not part of this mapping
   */
  public String resolve(int code) {
    int position = toPosition(code);
    if (position < 0 || position >= size()) {
      throw new IndexOutOfBoundsException("code " + Integer.toUnsignedString(code) +
          " is not part of a mapping of size " + size());
    }
    return new String(categories.get(position), StandardCharsets.UTF_8);
  }

  /**
   * Resolves a code known to be valid.
   */
  public String resolveUnchecked(int code) {
    return new String(resolveBytesUnchecked(code), StandardCharsets.UTF_8);
  }

  /**
   * Returns the UTF-8 bytes of a code known to be valid.
   */
  public byte[] resolveBytesUnchecked(int code) {
    return categories.get(toPosition(code));
  }

  /**
   * Whether both mappings come from the same encoding, so their codes are interchangeable.
   */
  public abstract boolean isSameSource(ReverseMapping other);

  /**
   * Copies the categories into a list, in position order.
   */
  public List<String> toList() {
    List<String> values = new ArrayList<>(size());
    for (int i = 0; i < size(); i++) {
      values.add(new String(categories.get(i), StandardCharsets.UTF_8));
    }
    return values;
  }

  /**
   * Takes another reference to this mapping.
   */
  public ReverseMapping retain() {
    while (true) {
      int count = refCount.get();
      Preconditions.checkState(count > 0, "mapping has already been released");
      if (refCount.compareAndSet(count, count + 1)) {
        return this;
      }
    }
  }

  public int getRefCount() {
    return refCount.get();
  }

  /**
   * Releases one reference. The categories are freed with the last one.
   */
  @Override
  public void close() {
    while (true) {
      int count = refCount.get();
      Preconditions.checkState(count > 0, "RefCnt has gone negative");
      if (refCount.compareAndSet(count, count - 1)) {
        if (count == 1) {
          categories.close();
        }
        return;
      }
    }
  }
}
