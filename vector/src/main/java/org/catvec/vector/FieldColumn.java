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

package org.catvec.vector;

import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.FieldVector;
import org.catvec.vector.types.DataType;

/**
 * Column backed by a single Arrow vector.
 */
public class FieldColumn implements Column {

  private final FieldVector vector;
  private final DataType dataType;

  /**
   * Wraps {@code vector}, taking ownership of it.
   */
  public FieldColumn(FieldVector vector) {
    this.vector = Preconditions.checkNotNull(vector, "vector");
    this.dataType = DataType.of(vector.getField().getType());
  }

  public FieldVector getVector() {
    return vector;
  }

  @Override
  public String getName() {
    return vector.getName();
  }

  @Override
  public int getValueCount() {
    return vector.getValueCount();
  }

  @Override
  public int getNullCount() {
    return vector.getNullCount();
  }

  @Override
  public DataType getDataType() {
    return dataType;
  }

  public boolean isNull(int index) {
    return vector.isNull(index);
  }

  public Object getObject(int index) {
    return vector.getObject(index);
  }

  @Override
  public void close() {
    vector.close();
  }

  @Override
  public String toString() {
    return "FieldColumn{" + vector.getName() + ": " + dataType + ", " + vector + "}";
  }
}
