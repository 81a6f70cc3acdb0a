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

import org.catvec.vector.ChunkedIndexVector;
import org.catvec.vector.categorical.CategoricalVector;
import org.catvec.vector.dictionary.GlobalMapping;
import org.catvec.vector.dictionary.ReverseMapping;
import org.catvec.vector.util.ComputeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends categorical vectors whose codes are compatible. The result keeps the chunks of both
 * inputs and the type of the first one; it carries neither the fast-unique nor the sorted flag.
 */
public class CategoricalAppender {
  private static final Logger logger = LoggerFactory.getLogger(CategoricalAppender.class);

  private CategoricalAppender() {
  }

  /**
   * Appends {@code right} after {@code left} without copying codes.
   *
   * @throws ComputeException when the codes of both sides do not mean the same strings
   */
  public static CategoricalVector append(CategoricalVector left, CategoricalVector right) {
    if (left.isEnum() != right.isEnum()) {
      throw new ComputeException("cannot append an enum and a categorical");
    }
    ReverseMapping leftMapping = left.getReverseMapping();
    ReverseMapping rightMapping = right.getReverseMapping();

    if (leftMapping.isLocal() && leftMapping.isSameSource(rightMapping)) {
      logger.debug("appending '{}' and '{}' with the same local mapping", left.getName(),
          right.getName());
      return concatenate(left, right, leftMapping.retain());
    }
    if (leftMapping.isGlobal() && rightMapping.isGlobal()) {
      if (!leftMapping.isSameSource(rightMapping)) {
        throw new ComputeException("cannot append categoricals built under different string " +
            "cache generations; re-encode them with the current cache");
      }
      GlobalMapping merged = GlobalMappingMerger.merge((GlobalMapping) leftMapping,
          (GlobalMapping) rightMapping);
      logger.debug("appending '{}' and '{}', merged global mapping has {} categories",
          left.getName(), right.getName(), merged.size());
      return concatenate(left, right, merged);
    }
    if (left.isEnum()) {
      throw new ComputeException("cannot append enums with different categories");
    }
    throw new ComputeException("cannot append categoricals with different local mappings; " +
        "convert them to global ones with an enabled string cache first");
  }

  /**
   * Adopts the {@code mapping} reference.
   */
  private static CategoricalVector concatenate(CategoricalVector left, CategoricalVector right,
      ReverseMapping mapping) {
    try (ReverseMapping owned = mapping) {
      ChunkedIndexVector physical = left.getPhysical().append(right.getPhysical());
      return CategoricalVector.fromIndicesAndTypeUnchecked(physical,
          left.getDataType().withReverseMapping(owned));
    }
  }
}
