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

import static org.catvec.vector.VectorTestUtils.fooBar;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.catvec.vector.VectorTestUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TestCategoricalStringIterator {
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
  public void testForwardAndBackward() {
    List<String> expected = Arrays.asList("foo", null, "bar", "foo", "foo", "bar");
    try (CategoricalVector vector = fooBar(allocator)) {
      CategoricalStringIterator it = vector.iterStr();
      assertEquals(6, it.size());
      assertEquals(6, it.remaining());
      List<String> forward = new ArrayList<>();
      while (it.hasNext()) {
        forward.add(it.next());
      }
      assertEquals(expected, forward);
      assertEquals(0, it.remaining());
      assertThrows(NoSuchElementException.class, it::next);

      List<String> backward = new ArrayList<>();
      while (it.hasPrevious()) {
        backward.add(it.previous());
      }
      List<String> reversed = new ArrayList<>(expected);
      Collections.reverse(reversed);
      assertEquals(reversed, backward);
      assertThrows(NoSuchElementException.class, it::previous);
    }
  }

  @Test
  public void testEachCallStartsFresh() {
    try (CategoricalVector vector = fooBar(allocator)) {
      CategoricalStringIterator first = vector.iterStr();
      first.next();
      first.next();
      CategoricalStringIterator second = vector.iterStr();
      assertEquals(0, second.nextIndex());
      assertEquals("foo", second.next());

      CategoricalStringIterator positioned = vector.iterStr(1);
      assertEquals(0, positioned.previousIndex());
      assertNull(positioned.next());
      assertEquals("bar", positioned.next());
      assertThrows(IndexOutOfBoundsException.class, () -> vector.iterStr(7));
    }
  }

  @Test
  public void testReadOnly() {
    try (CategoricalVector vector = fooBar(allocator)) {
      CategoricalStringIterator it = vector.iterStr();
      it.next();
      assertThrows(UnsupportedOperationException.class, it::remove);
      assertThrows(UnsupportedOperationException.class, () -> it.set("x"));
      assertThrows(UnsupportedOperationException.class, () -> it.add("x"));
    }
  }

  @Test
  public void testEmpty() {
    try (CategoricalVector vector =
             VectorTestUtils.newCategorical("e", allocator, Arrays.asList("x"))) {
      CategoricalStringIterator it = vector.iterStr();
      assertEquals(0, it.size());
      assertFalse(it.hasNext());
      assertFalse(it.hasPrevious());
      assertTrue(vector.isEmpty());
    }
  }
}
