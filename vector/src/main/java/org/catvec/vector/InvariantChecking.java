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

import org.apache.arrow.memory.util.AssertionUtil;

/**
 * Configuration class to determine if the invariants of the unchecked categorical constructors
 * should be verified.
 *
 * <p>
 * Checking is on whenever JVM assertions are enabled. It can also be turned on by setting either
 * the system property "catvec.enable_invariant_checks" or the environmental variable
 * "CATVEC_ENABLE_INVARIANT_CHECKS" to "true". The system property takes precedence.
 * </p>
 */
public class InvariantChecking {

  public static final String PROPERTY_NAME = "catvec.enable_invariant_checks";

  public static final String ENV_NAME = "CATVEC_ENABLE_INVARIANT_CHECKS";

  public static final boolean INVARIANT_CHECKING_ENABLED;

  static {
    String flagValue = System.getProperty(PROPERTY_NAME);
    if (flagValue == null) {
      flagValue = System.getenv(ENV_NAME);
    }
    INVARIANT_CHECKING_ENABLED = AssertionUtil.isAssertionsEnabled() || "true".equals(flagValue);
  }

  private InvariantChecking() {
  }
}
