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

import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.VarCharVector;
import org.catvec.vector.util.IntIntHashMap;

/**
 * A mapping whose codes are string cache ids. The categories hold only the strings a column
 * uses; {@code codeToLocal} translates a cache id to their position.
 */
public final class GlobalMapping extends ReverseMapping {

  private final IntIntHashMap codeToLocal;
  private final long cacheGeneration;

  /**
   * Creates a mapping that takes ownership of {@code categories}.
   *
   * @param codeToLocal cache id to position, one entry per category
   * @param categories the strings, in position order
   * @param cacheGeneration generation of the cache the ids come from
   */
  public GlobalMapping(IntIntHashMap codeToLocal, VarCharVector categories, long cacheGeneration) {
    super(categories);
    Preconditions.checkArgument(codeToLocal.size() == categories.getValueCount(),
        "map size %s does not match category count %s", codeToLocal.size(),
        categories.getValueCount());
    this.codeToLocal = codeToLocal;
    this.cacheGeneration = cacheGeneration;
  }

  public long getCacheGeneration() {
    return cacheGeneration;
  }

  @Override
  public Kind getKind() {
    return Kind.GLOBAL;
  }

  @Override
  public int toPosition(int code) {
    return codeToLocal.get(code);
  }

  public boolean containsCode(int code) {
    return codeToLocal.containsKey(code);
  }

  /**
   * Position to cache id, the inverse of {@link #toPosition(int)}.
   */
  public int[] localToCode() {
    int[] codes = new int[size()];
    codeToLocal.forEach((code, position) -> codes[position] = code);
    return codes;
  }

  /**
   * Visits every (cache id, position) pair.
   */
  public void forEachCode(IntIntHashMap.EntryConsumer consumer) {
    codeToLocal.forEach(consumer);
  }

  @Override
  public GlobalMapping retain() {
    super.retain();
    return this;
  }

  @Override
  public boolean isSameSource(ReverseMapping other) {
    return other instanceof GlobalMapping &&
        cacheGeneration == ((GlobalMapping) other).cacheGeneration;
  }

  @Override
  public String toString() {
    return "GlobalMapping{size=" + size() + ", generation=" + cacheGeneration + "}";
  }
}
