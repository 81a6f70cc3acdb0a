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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Interns strings to dense codes assigned in insertion order. Buckets are chained through
 * arrays indexed by code, so an entry costs two ints besides the string itself.
 * Not thread-safe; {@link StringCache} guards it.
 */
class StringInternTable {

  static final int NULL_VALUE = -1;

  static final int DEFAULT_INITIAL_CAPACITY = 1 << 4;

  static final int MAXIMUM_CAPACITY = 1 << 30;

  static final float LOAD_FACTOR = 0.75f;

  /** First code of each bucket, or -1. */
  private int[] buckets;

  /** Next code in the same bucket, indexed by code. */
  private int[] next;

  private int[] hashes;

  private final List<String> values = new ArrayList<>();

  private int threshold;

  StringInternTable() {
    clear();
  }

  private static int hash(String value) {
    int h = value.hashCode();
    return h ^ (h >>> 16);
  }

  private static int indexFor(int h, int length) {
    return h & (length - 1);
  }

  /**
   * Returns the code of {@code value}, adding it if absent.
   */
  int intern(String value) {
    int hash = hash(value);
    int found = find(value, hash);
    if (found != NULL_VALUE) {
      return found;
    }
    int code = values.size();
    if (code >= threshold) {
      resize(buckets.length * 2);
    }
    if (code == next.length) {
      next = Arrays.copyOf(next, code * 2);
      hashes = Arrays.copyOf(hashes, code * 2);
    }
    int bucket = indexFor(hash, buckets.length);
    next[code] = buckets[bucket];
    hashes[code] = hash;
    buckets[bucket] = code;
    values.add(value);
    return code;
  }

  /**
   * Returns the code of {@code value}, or -1 if it was never interned.
   */
  int lookup(String value) {
    return find(value, hash(value));
  }

  private int find(String value, int hash) {
    for (int code = buckets[indexFor(hash, buckets.length)]; code != NULL_VALUE;
        code = next[code]) {
      if (hashes[code] == hash && values.get(code).equals(value)) {
        return code;
      }
    }
    return NULL_VALUE;
  }

  private void resize(int newCapacity) {
    if (buckets.length == MAXIMUM_CAPACITY) {
      threshold = Integer.MAX_VALUE;
      return;
    }
    buckets = new int[newCapacity];
    Arrays.fill(buckets, NULL_VALUE);
    for (int code = 0; code < values.size(); code++) {
      int bucket = indexFor(hashes[code], newCapacity);
      next[code] = buckets[bucket];
      buckets[bucket] = code;
    }
    threshold = (int) Math.min(newCapacity * LOAD_FACTOR, MAXIMUM_CAPACITY + 1);
  }

  String get(int code) {
    return values.get(code);
  }

  int size() {
    return values.size();
  }

  void clear() {
    buckets = new int[DEFAULT_INITIAL_CAPACITY];
    Arrays.fill(buckets, NULL_VALUE);
    next = new int[DEFAULT_INITIAL_CAPACITY];
    hashes = new int[DEFAULT_INITIAL_CAPACITY];
    values.clear();
    threshold = (int) (DEFAULT_INITIAL_CAPACITY * LOAD_FACTOR);
  }
}
