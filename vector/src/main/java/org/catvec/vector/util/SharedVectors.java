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

import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.util.TransferPair;

/**
 * Creates vectors that share the reference-counted buffers of an existing vector instead of
 * copying them. The source keeps its buffers; both vectors must be closed independently.
 */
public final class SharedVectors {

  private SharedVectors() {
  }

  /**
   * Shares {@code length} values of {@code source} starting at {@code startIndex}.
   */
  public static UInt4Vector share(UInt4Vector source, String name, int startIndex, int length) {
    if (length == 0) {
      return new UInt4Vector(name, source.getAllocator());
    }
    TransferPair transferPair = source.getTransferPair(name, source.getAllocator());
    transferPair.splitAndTransfer(startIndex, length);
    return (UInt4Vector) transferPair.getTo();
  }

  public static UInt4Vector share(UInt4Vector source, String name) {
    return share(source, name, 0, source.getValueCount());
  }

  /**
   * Shares all values of {@code source}. The data buffer is sliced, the offsets are rewritten.
   */
  public static VarCharVector share(VarCharVector source, String name) {
    if (source.getValueCount() == 0) {
      return new VarCharVector(name, source.getAllocator());
    }
    TransferPair transferPair = source.getTransferPair(name, source.getAllocator());
    transferPair.splitAndTransfer(0, source.getValueCount());
    return (VarCharVector) transferPair.getTo();
  }
}
