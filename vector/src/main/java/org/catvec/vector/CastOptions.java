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

/**
 * Governs what happens to values that cannot be represented in the target type of a cast.
 */
public enum CastOptions {
  /**
   * Fail the cast when any value cannot be converted.
   */
  STRICT,

  /**
   * Values that cannot be converted become null.
   */
  NON_STRICT,

  /**
   * Integers that do not fit the target width are truncated; unparsable values become null.
   */
  OVERFLOWING;

  public static final CastOptions DEFAULT = NON_STRICT;
}
