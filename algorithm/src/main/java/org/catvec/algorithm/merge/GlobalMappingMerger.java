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

package org.catvec.algorithm.merge;

import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.VarCharVector;
import org.catvec.vector.dictionary.GlobalMapping;
import org.catvec.vector.util.IntIntHashMap;

/**
 * Unions two global mappings of the same cache generation.
 */
public class GlobalMappingMerger {

  private GlobalMappingMerger() {
  }

  /**
   * Returns a mapping holding the categories of {@code left} followed by those of {@code right}
   * that {@code left} lacks. When there are none, {@code left} itself is returned, retained.
   * The caller closes the result.
   */
  public static GlobalMapping merge(GlobalMapping left, GlobalMapping right) {
    Preconditions.checkArgument(left.getCacheGeneration() == right.getCacheGeneration(),
        "cannot merge mappings of cache generations %s and %s", left.getCacheGeneration(),
        right.getCacheGeneration());
    int[] rightCodes = right.localToCode();
    int missing = 0;
    for (int code : rightCodes) {
      if (!left.containsCode(code)) {
        missing++;
      }
    }
    if (missing == 0) {
      return left.retain();
    }

    int size = left.size() + missing;
    IntIntHashMap codeToLocal = new IntIntHashMap(size);
    left.forEachCode(codeToLocal::put);
    VarCharVector categories = new VarCharVector("categories", left.getAllocator());
    try {
      categories.allocateNew(size);
      VarCharVector leftCategories = left.getCategories();
      for (int i = 0; i < left.size(); i++) {
        categories.copyFromSafe(i, i, leftCategories);
      }
      int position = left.size();
      VarCharVector rightCategories = right.getCategories();
      for (int i = 0; i < rightCodes.length; i++) {
        if (!left.containsCode(rightCodes[i])) {
          categories.copyFromSafe(i, position, rightCategories);
          codeToLocal.put(rightCodes[i], position++);
        }
      }
      categories.setValueCount(size);
    } catch (RuntimeException e) {
      categories.close();
      throw e;
    }
    return new GlobalMapping(codeToLocal, categories, left.getCacheGeneration());
  }
}
