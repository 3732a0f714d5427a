/*
 * Copyright 2026 The Membership Narrowing Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.narrowing;

/**
 * This interface defines what reversed abstract interpreters provide.
 *
 * <p>Abstract interpretation computes the types of a program instead of its values. A reverse
 * abstract interpreter knows the outcome of a condition and computes a preciser view of the types
 * than the one available without knowing that outcome.
 */
public interface ReverseAbstractInterpreter {
  /**
   * Calculates a precise version of the scope knowing the outcome of the condition.
   *
   * @param condition the membership test
   * @param blindScope the scope without knowledge about the outcome of the condition
   * @param outcome the outcome of the condition
   */
  FlowScope getPreciserScopeKnowingConditionOutcome(
      MembershipTest condition, FlowScope blindScope, boolean outcome);
}
