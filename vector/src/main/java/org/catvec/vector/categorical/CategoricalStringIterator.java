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

import java.util.ListIterator;
import java.util.NoSuchElementException;

import org.apache.arrow.util.Preconditions;
import org.catvec.vector.ChunkedIndexVector;
import org.catvec.vector.dictionary.ReverseMapping;

/**
 * Bidirectional iterator decoding the values of a {@link CategoricalVector}, null for null
 * slots. It reads the vector in place, which must stay open while iterating.
 */
public class CategoricalStringIterator implements ListIterator<String> {

  private final ChunkedIndexVector physical;
  private final ReverseMapping mapping;
  private final int size;
  private int cursor;

  CategoricalStringIterator(CategoricalVector vector, int index) {
    this.physical = vector.getPhysical();
    this.mapping = vector.getReverseMapping();
    this.size = physical.getValueCount();
    Preconditions.checkPositionIndex(index, size);
    this.cursor = index;
  }

  public int size() {
    return size;
  }

  /**
   * Number of values left in forward direction.
   */
  public int remaining() {
    return size - cursor;
  }

  private String decode(int index) {
    if (physical.isNull(index)) {
      return null;
    }
    return mapping.resolveUnchecked(physical.get(index));
  }

  @Override
  public boolean hasNext() {
    return cursor < size;
  }

  @Override
  public String next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    return decode(cursor++);
  }

  @Override
  public boolean hasPrevious() {
    return cursor > 0;
  }

  @Override
  public String previous() {
    if (!hasPrevious()) {
      throw new NoSuchElementException();
    }
    return decode(--cursor);
  }

  @Override
  public int nextIndex() {
    return cursor;
  }

  @Override
  public int previousIndex() {
    return cursor - 1;
  }

  @Override
  public void remove() {
    throw new UnsupportedOperationException();
  }

  @Override
  public void set(String value) {
    throw new UnsupportedOperationException();
  }

  @Override
  public void add(String value) {
    throw new UnsupportedOperationException();
  }
}
