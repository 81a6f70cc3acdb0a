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

package org.catvec.algorithm.dictionary;

import static org.catvec.algorithm.AlgorithmTestUtils.castToStrings;
import static org.catvec.algorithm.AlgorithmTestUtils.codes;
import static org.catvec.algorithm.AlgorithmTestUtils.newVarCharVector;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.VarCharVector;
import org.catvec.vector.categorical.CategoricalVector;
import org.catvec.vector.dictionary.StringCache;
import org.catvec.vector.types.CategoricalOrdering;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Test cases for {@link CategoricalBuilder}.
 */
public class TestCategoricalBuilder {
  private BufferAllocator allocator;

  @BeforeEach
  public void prepare() {
    allocator = new RootAllocator(Long.MAX_VALUE);
  }

  @AfterEach
  public void shutdown() {
    allocator.close();
  }

  @Test
  public void testBuildLocal() {
    try (VarCharVector source = newVarCharVector("a", allocator,
             "foo", null, "bar", "foo", "foo", "bar");
         CategoricalVector vector = CategoricalBuilder.fromStrings(source,
             CategoricalOrdering.PHYSICAL)) {
      assertEquals("a", vector.getName());
      assertEquals(Arrays.asList("foo", "bar"), vector.getReverseMapping().toList());
      assertEquals(Arrays.asList(0, null, 1, 0, 0, 1), codes(vector));
      assertTrue(vector.isFastUniqueFlagSet());
      assertFalse(vector.canFastUnique());
      assertEquals(Arrays.asList("foo", null, "bar", "foo", "foo", "bar"), castToStrings(vector));
    }
  }

  @Test
  public void testRoundTripEmptyAndAllNull() {
    try (VarCharVector empty = newVarCharVector("e", allocator);
         VarCharVector nulls = newVarCharVector("n", allocator, null, null, null);
         CategoricalVector fromEmpty = CategoricalBuilder.fromStrings(empty,
             CategoricalOrdering.PHYSICAL);
         CategoricalVector fromNulls = CategoricalBuilder.fromStrings(nulls,
             CategoricalOrdering.LEXICAL)) {
      assertTrue(fromEmpty.isEmpty());
      assertEquals(0, fromEmpty.getReverseMapping().size());
      assertEquals(Collections.emptyList(), castToStrings(fromEmpty));

      assertEquals(3, fromNulls.getNullCount());
      assertEquals(0, fromNulls.getReverseMapping().size());
      assertEquals(Arrays.asList(null, null, null), castToStrings(fromNulls));
      assertTrue(fromNulls.usesLexicalOrdering());
    }
  }

  @Test
  public void testEmptyStringIsACategory() {
    try (VarCharVector source = newVarCharVector("a", allocator, "", "x", "", null);
         CategoricalVector vector = CategoricalBuilder.fromStrings(source,
             CategoricalOrdering.PHYSICAL)) {
      assertEquals(Arrays.asList("", "x"), vector.getReverseMapping().toList());
      assertEquals(Arrays.asList("", "x", "", null), castToStrings(vector));
    }
  }

  @Test
  public void testBuildGlobal() {
    StringCache cache = new StringCache(true);
    cache.intern("bar");
    try (VarCharVector source = newVarCharVector("a", allocator, "foo", "bar", "foo");
         CategoricalVector vector = CategoricalBuilder.fromStrings(source,
             CategoricalOrdering.PHYSICAL, cache)) {
      assertTrue(vector.getReverseMapping().isGlobal());
      assertEquals(Arrays.asList(1, 0, 1), codes(vector));
      assertTrue(vector.isFastUniqueFlagSet());
      assertEquals(Arrays.asList("foo", "bar", "foo"), castToStrings(vector));
    }
  }

  @Test
  public void testDisabledCacheBuildsLocal() {
    try (VarCharVector source = newVarCharVector("a", allocator, "foo");
         CategoricalVector vector = CategoricalBuilder.fromStrings(source,
             CategoricalOrdering.PHYSICAL, new StringCache())) {
      assertTrue(vector.getReverseMapping().isLocal());
    }
  }
}
