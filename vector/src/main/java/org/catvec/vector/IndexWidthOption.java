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
 * Configuration class to determine the index width used when categorical values are gathered
 * from a casted categories vector.
 *
 * <p>
 * 32-bit indices are used by default. You can switch to 64-bit indices by setting either the
 * system property "catvec.large_index" or the environmental variable "CATVEC_LARGE_INDEX" to
 * "true". When both are set, the system property takes precedence.
 * </p>
 */
public class IndexWidthOption {

  public static final String LARGE_INDEX_PROPERTY_NAME = "catvec.large_index";

  public static final String LARGE_INDEX_ENV_NAME = "CATVEC_LARGE_INDEX";

  public static final boolean LARGE_INDEX_ENABLED;

  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(IndexWidthOption.class);

  static {
    String envValue = System.getenv(LARGE_INDEX_ENV_NAME);
    String propValue = System.getProperty(LARGE_INDEX_PROPERTY_NAME);

    String flagValue = propValue != null ? propValue : envValue;
    if (flagValue != null && !"true".equals(flagValue) && !"false".equals(flagValue)) {
      logger.warn("\"{}\" can be set to: true (64-bit gather) or false (32-bit gather, default), got \"{}\"",
          LARGE_INDEX_PROPERTY_NAME, flagValue);
    }
    LARGE_INDEX_ENABLED = "true".equals(flagValue);
  }

  private IndexWidthOption() {
  }
}
