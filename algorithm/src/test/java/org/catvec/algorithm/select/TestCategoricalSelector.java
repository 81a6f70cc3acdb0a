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

import static org.catvec.algorithm.AlgorithmTestUtils.newVarCharVector;
import static org.catvec.algorithm.AlgorithmTestUtils.toList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.VarCharVector;
import org.catvec.algorithm.dictionary.CategoricalBuilder;
import org.catvec.vector.IsSorted;
import org.catvec.vector.categorical.CategoricalVector;
import org.catvec.vector.types.CategoricalOrdering;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Test cases for {@link CategoricalSelector}.
 */
public class TestCategoricalSelector {
  private BufferAllocator allocator;

  @BeforeEach
  public void prepare() {
    allocator = new RootAllocator(Long.MAX_VALUE);
  }

  @AfterEach
  public void shutdown() {
    allocator.close();
  }

  private CategoricalVector build(String... values) {
    try (VarCharVector source = newVarCharVector("a", allocator, values)) {
      return CategoricalBuilder.fromStrings(source, CategoricalOrdering.PHYSICAL);
    }
  }

  @Test
  public void testSliceKeepsSortedFlag() {
    try (CategoricalVector vector = build("a", "a", "b", "c")) {
      vector.setSortedFlag(IsSorted.ASCENDING);
      try (CategoricalVector sliced = CategoricalSelector.slice(vector, 1, 2)) {
        assertEquals(Arrays.asList("a", "b"), toList(sliced));
        assertEquals(IsSorted.ASCENDING, sliced.getSortedFlag());
        assertSame(vector.getReverseMapping(), sliced.getReverseMapping());
        assertFalse(sliced.isFastUniqueFlagSet());
      }
    }
  }

  @Test
  public void testTake() {
    try (CategoricalVector vector = build("a", null, "b", "c")) {
      vector.setSortedFlag(IsSorted.ASCENDING);
      try (CategoricalVector taken = CategoricalSelector.take(vector, new int[] {3, 1, 0, 3})) {
        assertEquals(Arrays.asList("c", null, "a", "c"), toList(taken));
        assertEquals(IsSorted.NOT, taken.getSortedFlag());
      }
      assertThrows(IndexOutOfBoundsException.class,
          () -> CategoricalSelector.take(vector, new int[] {4}));
    }
  }

  @Test
  public void testTakeWithNullablePositions() {
    try (CategoricalVector vector = build("a", "b", "c");
         UInt4Vector positions = new UInt4Vector("p", allocator)) {
      positions.allocateNew(3);
      positions.set(0, 2);
      positions.setNull(1);
      positions.set(2, 0);
      positions.setValueCount(3);
      try (CategoricalVector taken = CategoricalSelector.take(vector, positions)) {
        assertEquals(Arrays.asList("c", null, "a"), toList(taken));
      }
    }
  }

  @Test
  public void testFilter() {
    try (CategoricalVector vector = build("a", "b", null, "c");
         BitVector mask = new BitVector("mask", allocator)) {
      vector.setSortedFlag(IsSorted.DESCENDING);
      mask.allocateNew(4);
      mask.set(0, 1);
      mask.setNull(1);
      mask.set(2, 1);
      mask.set(3, 1);
      mask.setValueCount(4);
      try (CategoricalVector filtered = CategoricalSelector.filter(vector, mask)) {
        assertEquals(Arrays.asList("a", null, "c"), toList(filtered));
        assertEquals(IsSorted.DESCENDING, filtered.getSortedFlag());
      }
    }
  }

  @Test
  public void testFilterLengthMismatch() {
    try (CategoricalVector vector = build("a", "b");
         BitVector mask = new BitVector("mask", allocator)) {
      mask.allocateNew(1);
      mask.set(0, 1);
      mask.setValueCount(1);
      assertThrows(IllegalArgumentException.class, () -> CategoricalSelector.filter(vector, mask));
    }
  }
}
