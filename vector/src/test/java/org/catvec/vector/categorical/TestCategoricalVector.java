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

import static org.catvec.vector.VectorTestUtils.codes;
import static org.catvec.vector.VectorTestUtils.fooBar;
import static org.catvec.vector.VectorTestUtils.newCategorical;
import static org.catvec.vector.VectorTestUtils.newIndices;
import static org.catvec.vector.VectorTestUtils.toList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.util.Arrays;
import java.util.List;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.VarCharVector;
import org.catvec.vector.ChunkedIndexVector;
import org.catvec.vector.InvariantChecking;
import org.catvec.vector.IsSorted;
import org.catvec.vector.VectorTestUtils;
import org.catvec.vector.dictionary.GlobalMapping;
import org.catvec.vector.dictionary.LocalMapping;
import org.catvec.vector.dictionary.ReverseMapping;
import org.catvec.vector.dictionary.StringCache;
import org.catvec.vector.types.CategoricalOrdering;
import org.catvec.vector.types.DataType;
import org.catvec.vector.util.ComputeException;
import org.catvec.vector.util.StringCacheMismatchException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TestCategoricalVector {
  private static final List<String> FOO_BAR = Arrays.asList("foo", null, "bar", "foo", "foo", "bar");

  private BufferAllocator allocator;

  @BeforeEach
  public void init() {
    allocator = new RootAllocator(Long.MAX_VALUE);
  }

  @AfterEach
  public void terminate() throws Exception {
    allocator.close();
  }

  @Test
  public void testAccessors() {
    try (CategoricalVector vector = fooBar(allocator)) {
      assertEquals("a", vector.getName());
      assertEquals(6, vector.getValueCount());
      assertEquals(1, vector.getNullCount());
      assertFalse(vector.isEmpty());
      assertFalse(vector.isEnum());
      assertTrue(vector.getDataType() instanceof DataType.Categorical);
      assertEquals(CategoricalOrdering.PHYSICAL, vector.getOrdering());
      assertEquals(FOO_BAR, toList(vector));
      assertNull(vector.getString(1));
      assertEquals("bar", vector.getString(2));
      assertEquals(0, (int) vector.getCode(0));
      assertThrows(IndexOutOfBoundsException.class, () -> vector.getString(6));
      assertTrue(vector.toString().contains("\"foo\""));
    }
  }

  @Test
  public void testCheckedFactoryRejectsUnknownCode() {
    try (LocalMapping mapping = LocalMapping.fromStrings(allocator, Arrays.asList("x", "y"))) {
      ChunkedIndexVector indices = newIndices("a", allocator, 0, 2);
      ComputeException e = assertThrows(ComputeException.class,
          () -> CategoricalVector.fromIndicesAndMapping(indices, mapping, false,
              CategoricalOrdering.PHYSICAL));
      assertTrue(e.getMessage().contains("code 2"));
      assertEquals(1, mapping.getRefCount());
    }
  }

  @Test
  public void testEnumRequiresLocalMapping() {
    StringCache cache = new StringCache(true);
    try (VarCharVector categories = VectorTestUtils.newVarCharVector("c", allocator, "x");
         GlobalMapping global = cache.internAll(categories)) {
      assertThrows(ComputeException.class,
          () -> CategoricalVector.fromIndicesAndMapping(newIndices("a", allocator, 0), global,
              true, CategoricalOrdering.PHYSICAL));
    }
  }

  @Test
  public void testUncheckedFactoryVerifiesWhenChecking() {
    assumeTrue(InvariantChecking.INVARIANT_CHECKING_ENABLED);
    try (LocalMapping mapping = LocalMapping.fromStrings(allocator, Arrays.asList("x"));
         ChunkedIndexVector indices = newIndices("a", allocator, 5)) {
      assertThrows(IllegalStateException.class,
          () -> CategoricalVector.fromIndicesAndMappingUnchecked(indices, mapping, false,
              CategoricalOrdering.PHYSICAL));
    }
  }

  @Test
  public void testFastUniqueFlag() {
    try (CategoricalVector withNulls = fooBar(allocator);
         CategoricalVector dense = newCategorical("b", allocator, Arrays.asList("x", "y"), 1, 0)) {
      assertFalse(withNulls.isFastUniqueFlagSet());
      withNulls.withFastUnique(true);
      // nulls disable the shortcut even when the flag is set
      assertFalse(withNulls.canFastUnique());

      dense.withFastUnique(true);
      assertTrue(dense.canFastUnique());
      dense.setOrdering(CategoricalOrdering.PHYSICAL, true);
      assertTrue(dense.canFastUnique());
      dense.setOrdering(CategoricalOrdering.PHYSICAL, false);
      assertFalse(dense.canFastUnique());
    }
  }

  @Test
  public void testLexicalOrderingClearsSortedFlag() {
    try (CategoricalVector vector = newCategorical("a", allocator, Arrays.asList("x", "y"), 0, 0, 1)) {
      vector.setSortedFlag(IsSorted.ASCENDING);
      assertEquals(IsSorted.ASCENDING, vector.getSortedFlag());

      vector.setOrdering(CategoricalOrdering.LEXICAL, true);
      assertTrue(vector.usesLexicalOrdering());
      assertEquals(IsSorted.NOT, vector.getSortedFlag());

      vector.setSortedFlag(IsSorted.ASCENDING);
      assertEquals(IsSorted.NOT, vector.getSortedFlag());
    }
  }

  @Test
  public void testSetReverseMapping() {
    try (CategoricalVector vector = fooBar(allocator);
         LocalMapping upper = LocalMapping.fromStrings(allocator, Arrays.asList("FOO", "BAR"))) {
      vector.withFastUnique(true);
      vector.setReverseMapping(upper, false);
      assertEquals(2, upper.getRefCount());
      assertEquals("BAR", vector.getString(2));
      assertFalse(vector.isFastUniqueFlagSet());
    }
  }

  @Test
  public void testDuplicateSharesMapping() {
    try (CategoricalVector vector = fooBar(allocator)) {
      ReverseMapping mapping = vector.getReverseMapping();
      try (CategoricalVector duplicate = vector.duplicate()) {
        assertSame(mapping, duplicate.getReverseMapping());
        assertEquals(2, mapping.getRefCount());
        assertEquals(FOO_BAR, toList(duplicate));
      }
      assertEquals(1, mapping.getRefCount());
    }
  }

  @Test
  public void testGlobalRoundTrip() {
    StringCache cache = new StringCache(true);
    cache.intern("bar");
    try (CategoricalVector vector = fooBar(allocator);
         CategoricalVector global = vector.toGlobal(cache);
         CategoricalVector local = global.toLocal()) {
      assertTrue(global.getReverseMapping().isGlobal());
      assertEquals(Arrays.asList(1, null, 0, 1, 1, 0), codes(global.getPhysical()));
      assertEquals(FOO_BAR, toList(global));

      assertTrue(local.getReverseMapping().isLocal());
      assertEquals(Arrays.asList(0, null, 1, 0, 0, 1), codes(local.getPhysical()));
      assertEquals(FOO_BAR, toList(local));
    }
  }

  @Test
  public void testModeConversionKeepsFastUnique() {
    StringCache cache = new StringCache(true);
    try (CategoricalVector vector =
             newCategorical("a", allocator, Arrays.asList("x", "y"), 1, 0).withFastUnique(true);
         CategoricalVector global = vector.toGlobal(cache);
         CategoricalVector local = global.toLocal()) {
      assertTrue(global.canFastUnique());
      assertTrue(local.canFastUnique());
    }
  }

  @Test
  public void testToGlobalWithDisabledCacheFails() {
    StringCache cache = new StringCache();
    try (CategoricalVector vector = fooBar(allocator)) {
      assertThrows(StringCacheMismatchException.class, () -> vector.toGlobal(cache));
      assertEquals(0, cache.size());
      assertEquals(1, vector.getReverseMapping().getRefCount());
      assertEquals(Arrays.asList(0, null, 1, 0, 0, 1), codes(vector.getPhysical()));
    }
  }

  @Test
  public void testToGlobalReusesCurrentGeneration() {
    StringCache cache = new StringCache(true);
    try (CategoricalVector vector = fooBar(allocator);
         CategoricalVector global = vector.toGlobal(cache)) {
      try (CategoricalVector again = global.toGlobal(cache)) {
        assertSame(global.getReverseMapping(), again.getReverseMapping());
      }
      cache.reset();
      cache.intern("other");
      try (CategoricalVector reencoded = global.toGlobal(cache)) {
        GlobalMapping mapping = (GlobalMapping) reencoded.getReverseMapping();
        assertEquals(cache.getGeneration(), mapping.getCacheGeneration());
        assertEquals(Arrays.asList(1, null, 2, 1, 1, 2), codes(reencoded.getPhysical()));
        assertEquals(FOO_BAR, toList(reencoded));
      }
    }
  }

  @Test
  public void testToEnumFastAndGeneralPathsAgree() {
    StringCache cache = new StringCache(true);
    cache.intern("unrelated");
    try (CategoricalVector vector = fooBar(allocator);
         LocalMapping target = LocalMapping.fromStrings(allocator, Arrays.asList("foo", "bar"));
         CategoricalVector fast = vector.toEnum(target);
         CategoricalVector global = vector.toGlobal(cache);
         CategoricalVector general = global.toEnum(target)) {
      assertTrue(fast.isEnum());
      assertSame(vector.getReverseMapping(), fast.getReverseMapping());
      assertSame(target, general.getReverseMapping());
      assertEquals(codes(fast.getPhysical()), codes(general.getPhysical()));
      assertEquals(FOO_BAR, toList(general));
    }
  }

  @Test
  public void testToEnumNullsOutMissingValues() {
    try (CategoricalVector vector = fooBar(allocator).withFastUnique(true);
         LocalMapping target = LocalMapping.fromStrings(allocator, Arrays.asList("bar", "baz"));
         CategoricalVector converted = vector.toEnum(target)) {
      assertTrue(converted.isEnum());
      assertEquals(Arrays.asList(null, null, 0, null, null, 0), codes(converted.getPhysical()));
      assertEquals(Arrays.asList(null, null, "bar", null, null, "bar"), toList(converted));
      assertFalse(converted.isFastUniqueFlagSet());
    }
  }

  @Test
  public void testToLocalOnEnumRetagsAsCategorical() {
    try (CategoricalVector vector = fooBar(allocator);
         LocalMapping target = LocalMapping.fromStrings(allocator, Arrays.asList("foo", "bar"));
         CategoricalVector converted = vector.toEnum(target);
         CategoricalVector local = converted.toLocal()) {
      assertFalse(local.isEnum());
      assertEquals(FOO_BAR, toList(local));
    }
  }
}
