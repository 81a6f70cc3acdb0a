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

package org.catvec.vector.util;

/**
 * Chained hash map from int keys to int values, avoiding boxing when translating category codes.
 * Values are expected to be non-negative; -1 represents a missing value.
 */
public class IntIntHashMap {

  /**
   * Represents a missing value in map.
   */
  public static final int NULL_VALUE = -1;

  /**
   * The default initial capacity - MUST be a power of two.
   */
  static final int DEFAULT_INITIAL_CAPACITY = 1 << 4;

  /**
   * The maximum capacity, used if a higher value is implicitly specified
   * by either of the constructors with arguments.
   */
  static final int MAXIMUM_CAPACITY = 1 << 30;

  static final float DEFAULT_LOAD_FACTOR = 0.75f;

  static final Entry[] EMPTY_TABLE = {};

  /**
   * The table, initialized on first use, and resized as
   * necessary. When allocated, length is always a power of two.
   */
  Entry[] table = EMPTY_TABLE;

  int size;

  /**
   * The next size value at which to resize (capacity * load factor).
   */
  int threshold;

  final float loadFactor;

  /**
   * Constructs an empty map with the specified initial capacity and load factor.
   */
  public IntIntHashMap(int initialCapacity, float loadFactor) {
    if (initialCapacity < 0) {
      throw new IllegalArgumentException("Illegal initial capacity: " + initialCapacity);
    }
    if (initialCapacity > MAXIMUM_CAPACITY) {
      initialCapacity = MAXIMUM_CAPACITY;
    }
    if (loadFactor <= 0 || Float.isNaN(loadFactor)) {
      throw new IllegalArgumentException("Illegal load factor: " + loadFactor);
    }
    this.loadFactor = loadFactor;
    this.threshold = initialCapacity;
  }

  public IntIntHashMap(int initialCapacity) {
    this(initialCapacity, DEFAULT_LOAD_FACTOR);
  }

  public IntIntHashMap() {
    this(DEFAULT_INITIAL_CAPACITY, DEFAULT_LOAD_FACTOR);
  }

  private void inflateTable(int threshold) {
    int capacity = roundUpToPowerOf2(threshold);
    this.threshold = (int) Math.min(capacity * loadFactor, MAXIMUM_CAPACITY + 1);
    table = new Entry[capacity];
  }

  /**
   * Scrambles the key so that consecutive codes spread over the buckets.
   */
  static int hash(int key) {
    int h = key * 0x9E3779B9;
    return h ^ (h >>> 16);
  }

  static int indexFor(int h, int length) {
    return h & (length - 1);
  }

  static int roundUpToPowerOf2(int size) {
    int n = size - 1;
    n |= n >>> 1;
    n |= n >>> 2;
    n |= n >>> 4;
    n |= n >>> 8;
    n |= n >>> 16;
    return (n < 0) ? 1 : (n >= MAXIMUM_CAPACITY) ? MAXIMUM_CAPACITY : n + 1;
  }

  /**
   * Returns the value to which the specified key is mapped,
   * or -1 if this map contains no mapping for the key.
   */
  public int get(int key) {
    if (size == 0) {
      return NULL_VALUE;
    }
    int hash = hash(key);
    for (Entry e = table[indexFor(hash, table.length)]; e != null; e = e.next) {
      if (e.key == key) {
        return e.value;
      }
    }
    return NULL_VALUE;
  }

  public boolean containsKey(int key) {
    return get(key) != NULL_VALUE;
  }

  /**
   * Associates the specified value with the specified key in this map.
   * If the map previously contained a mapping for the key, the old value is replaced.
   *
   * @return the previous value associated with the key, or -1 if there was none.
   */
  public int put(int key, int value) {
    if (table == EMPTY_TABLE) {
      inflateTable(threshold);
    }

    int hash = hash(key);
    int i = indexFor(hash, table.length);
    for (Entry e = table[i]; e != null; e = e.next) {
      if (e.key == key) {
        int oldValue = e.value;
        e.value = value;
        return oldValue;
      }
    }

    addEntry(hash, key, value, i);
    return NULL_VALUE;
  }

  void addEntry(int hash, int key, int value, int bucketIndex) {
    if ((size >= threshold) && (null != table[bucketIndex])) {
      resize(2 * table.length);
      bucketIndex = indexFor(hash, table.length);
    }
    Entry e = table[bucketIndex];
    table[bucketIndex] = new Entry(hash, key, value, e);
    size++;
  }

  void resize(int newCapacity) {
    Entry[] oldTable = table;
    if (oldTable.length == MAXIMUM_CAPACITY) {
      threshold = Integer.MAX_VALUE;
      return;
    }

    Entry[] newTable = new Entry[newCapacity];
    for (Entry e : oldTable) {
      while (null != e) {
        Entry next = e.next;
        int i = indexFor(e.hash, newCapacity);
        e.next = newTable[i];
        newTable[i] = e;
        e = next;
      }
    }
    table = newTable;
    threshold = (int) Math.min(newCapacity * loadFactor, MAXIMUM_CAPACITY + 1);
  }

  /**
   * Visits every mapping; the visiting order is unspecified.
   */
  public void forEach(EntryConsumer consumer) {
    for (Entry e : table) {
      for (; e != null; e = e.next) {
        consumer.accept(e.key, e.value);
      }
    }
  }

  public int size() {
    return size;
  }

  /**
   * Receives the mappings of an {@link IntIntHashMap}.
   */
  @FunctionalInterface
  public interface EntryConsumer {
    void accept(int key, int value);
  }

  static class Entry {
    final int key;
    int value;
    Entry next;
    final int hash;

    Entry(int hash, int key, int value, Entry next) {
      this.key = key;
      this.value = value;
      this.hash = hash;
      this.next = next;
    }

    @Override
    public String toString() {
      return key + "=" + value;
    }
  }
}
