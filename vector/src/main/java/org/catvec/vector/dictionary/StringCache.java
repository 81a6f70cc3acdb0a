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
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.VarCharVector;
import org.catvec.vector.util.IntIntHashMap;
import org.catvec.vector.util.SharedVectors;
import org.catvec.vector.util.StringCacheMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interns category strings to codes that are stable across columns, so that globally encoded
 * columns can be compared and combined code by code.
 *
 * <p>Interning is thread-safe. Switching the cache on or off, or resetting it, is not
 * coordinated with conversions running on other threads: callers serialize those calls
 * themselves. Codes handed out before a {@link #disable()} or {@link #reset()} belong to an
 * older generation and must not be mixed with newer ones.</p>
 */
public class StringCache {
  private static final Logger logger = LoggerFactory.getLogger(StringCache.class);

  private static final AtomicLong GENERATIONS = new AtomicLong();

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final StringInternTable table = new StringInternTable();

  private volatile boolean enabled;
  private volatile long generation;

  /**
   * Creates a disabled cache.
   */
  public StringCache() {
    this(false);
  }

  public StringCache(boolean enabled) {
    this.enabled = enabled;
    this.generation = GENERATIONS.incrementAndGet();
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void enable() {
    enabled = true;
    logger.debug("string cache enabled, generation {}", generation);
  }

  /**
   * Turns the cache off and drops its contents.
   */
  public void disable() {
    lock.writeLock().lock();
    try {
      enabled = false;
      clearLocked();
    } finally {
      lock.writeLock().unlock();
    }
    logger.debug("string cache disabled");
  }

  /**
   * Drops the contents and starts a new generation. The enabled state is kept.
   */
  public void reset() {
    lock.writeLock().lock();
    try {
      clearLocked();
    } finally {
      lock.writeLock().unlock();
    }
    logger.debug("string cache reset, generation {}", generation);
  }

  private void clearLocked() {
    table.clear();
    generation = GENERATIONS.incrementAndGet();
  }

  public long getGeneration() {
    return generation;
  }

  public int size() {
    lock.readLock().lock();
    try {
      return table.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns the code of {@code value}, interning it if needed.
   *
   * @throws StringCacheMismatchException if the cache is disabled
   */
  public int intern(String value) {
    Preconditions.checkNotNull(value, "value");
    lock.writeLock().lock();
    try {
      checkEnabled();
      return table.intern(value);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Returns the code of {@code value}, or -1 if it has not been interned.
   */
  public int lookup(String value) {
    lock.readLock().lock();
    try {
      return table.lookup(value);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns the string interned under {@code code}.
   */
  public String getValue(int code) {
    lock.readLock().lock();
    try {
      Preconditions.checkElementIndex(code, table.size());
      return table.get(code);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Interns every category and returns a global mapping for them. The categories of the returned
   * mapping share their buffers with {@code categories}, which stays owned by the caller.
   *
   * @throws StringCacheMismatchException if the cache is disabled
   */
  public GlobalMapping internAll(VarCharVector categories) {
    int count = categories.getValueCount();
    IntIntHashMap codeToLocal = new IntIntHashMap(count);
    long mappingGeneration;
    lock.writeLock().lock();
    try {
      checkEnabled();
      for (int i = 0; i < count; i++) {
        Preconditions.checkArgument(!categories.isNull(i), "category %s is null", i);
        String value = new String(categories.get(i), StandardCharsets.UTF_8);
        codeToLocal.put(table.intern(value), i);
      }
      mappingGeneration = generation;
    } finally {
      lock.writeLock().unlock();
    }
    logger.trace("interned {} categories into generation {}", count, mappingGeneration);
    VarCharVector shared = SharedVectors.share(categories, "categories");
    try {
      return new GlobalMapping(codeToLocal, shared, mappingGeneration);
    } catch (RuntimeException e) {
      shared.close();
      throw e;
    }
  }

  private void checkEnabled() {
    if (!enabled) {
      throw new StringCacheMismatchException(
          "cannot use the string cache while it is disabled; enable it first");
    }
  }

  @Override
  public String toString() {
    return "StringCache{enabled=" + enabled + ", generation=" + generation + "}";
  }
}
