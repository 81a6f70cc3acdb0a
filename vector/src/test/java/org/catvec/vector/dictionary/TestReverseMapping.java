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

import static org.catvec.vector.VectorTestUtils.newVarCharVector;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.VarCharVector;
import org.catvec.vector.util.IntIntHashMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TestReverseMapping {
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
  public void testLocalResolve() {
    try (LocalMapping mapping = LocalMapping.fromStrings(allocator, Arrays.asList("foo", "bar"))) {
      assertTrue(mapping.isLocal());
      assertEquals(2, mapping.size());
      assertEquals("foo", mapping.resolve(0));
      assertEquals("bar", mapping.resolveUnchecked(1));
      assertArrayEquals("bar".getBytes(StandardCharsets.UTF_8), mapping.resolveBytesUnchecked(1));
      assertEquals(Arrays.asList("foo", "bar"), mapping.toList());
      assertThrows(IndexOutOfBoundsException.class, () -> mapping.resolve(2));
      assertThrows(IndexOutOfBoundsException.class, () -> mapping.resolve(-1));
    }
  }

  @Test
  public void testLocalHashIdentity() {
    try (LocalMapping first = LocalMapping.fromStrings(allocator, Arrays.asList("a", "b"));
         LocalMapping second = LocalMapping.fromStrings(allocator, Arrays.asList("a", "b"));
         LocalMapping reordered = LocalMapping.fromStrings(allocator, Arrays.asList("b", "a"));
         LocalMapping left = LocalMapping.fromStrings(allocator, Arrays.asList("ab", "c"));
         LocalMapping right = LocalMapping.fromStrings(allocator, Arrays.asList("a", "bc"))) {
      assertEquals(first.getHash(), second.getHash());
      assertTrue(first.isSameSource(second));
      assertNotEquals(first.getHash(), reordered.getHash());
      assertFalse(first.isSameSource(reordered));
      assertNotEquals(left.getHash(), right.getHash());
    }
  }

  @Test
  public void testBuildRejectsNulls() {
    VarCharVector categories = newVarCharVector("categories", allocator, "a", null);
    // ownership passes to build, which releases the vector on failure
    assertThrows(IllegalArgumentException.class, () -> LocalMapping.build(categories));
  }

  @Test
  public void testReferenceCounting() {
    LocalMapping mapping = LocalMapping.fromStrings(allocator, Arrays.asList("x"));
    assertSame(mapping, mapping.retain());
    assertEquals(2, mapping.getRefCount());
    mapping.close();
    assertEquals("x", mapping.resolve(0));
    mapping.close();
    assertEquals(0, mapping.getRefCount());
    assertEquals(0, allocator.getAllocatedMemory());
    assertThrows(IllegalStateException.class, mapping::close);
    assertEquals(0, mapping.getRefCount());
    assertThrows(IllegalStateException.class, mapping::retain);
    // a refused retain must not revive the mapping
    assertEquals(0, mapping.getRefCount());
    assertThrows(IllegalStateException.class, mapping::retain);
  }

  @Test
  public void testGlobalResolve() {
    IntIntHashMap codeToLocal = new IntIntHashMap();
    codeToLocal.put(10, 0);
    codeToLocal.put(3, 1);
    VarCharVector categories = newVarCharVector("categories", allocator, "foo", "bar");
    try (GlobalMapping mapping = new GlobalMapping(codeToLocal, categories, 7L)) {
      assertTrue(mapping.isGlobal());
      assertEquals("foo", mapping.resolve(10));
      assertEquals("bar", mapping.resolveUnchecked(3));
      assertEquals(-1, mapping.toPosition(0));
      assertThrows(IndexOutOfBoundsException.class, () -> mapping.resolve(0));
      assertArrayEquals(new int[] {10, 3}, mapping.localToCode());
      assertTrue(mapping.containsCode(3));
      assertEquals(7L, mapping.getCacheGeneration());
    }
  }

  @Test
  public void testGlobalSameSource() {
    IntIntHashMap first = new IntIntHashMap();
    first.put(0, 0);
    IntIntHashMap second = new IntIntHashMap();
    second.put(1, 0);
    try (GlobalMapping a = new GlobalMapping(first, newVarCharVector("c", allocator, "x"), 1L);
         GlobalMapping b = new GlobalMapping(second, newVarCharVector("c", allocator, "y"), 1L);
         GlobalMapping c = new GlobalMapping(new IntIntHashMap(), newVarCharVector("c", allocator), 2L);
         LocalMapping local = LocalMapping.fromStrings(allocator, Arrays.asList("x"))) {
      assertTrue(a.isSameSource(b));
      assertFalse(a.isSameSource(c));
      assertFalse(a.isSameSource(local));
      assertFalse(local.isSameSource(a));
    }
  }
}
