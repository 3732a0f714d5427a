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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.narrowing.types.Type;
import com.google.narrowing.types.TypeRegistry;
import org.jspecify.annotations.Nullable;

/** Chainable reverse abstract interpreter providing basic functionality. */
public abstract class ChainableReverseAbstractInterpreter implements ReverseAbstractInterpreter {
  protected final TypeRegistry typeRegistry;
  private ChainableReverseAbstractInterpreter firstLink;
  private @Nullable ChainableReverseAbstractInterpreter nextLink;

  /**
   * Constructs an interpreter, which is the only link in a chain. Interpreters can be appended
   * using {@link #append}.
   */
  protected ChainableReverseAbstractInterpreter(TypeRegistry typeRegistry) {
    this.typeRegistry = checkNotNull(typeRegistry);
    firstLink = this;
    nextLink = null;
  }

  /**
   * Appends a link to {@code this}, returning the updated last link.
   *
   * <p>The pattern {@code new X().append(new Y())...append(new Z())} forms a chain starting with
   * X, then Y, then ... Z.
   *
   * @param lastLink a chainable interpreter, with no next link
   * @return the updated last link
   */
  public ChainableReverseAbstractInterpreter append(ChainableReverseAbstractInterpreter lastLink) {
    checkArgument(lastLink.nextLink == null);
    this.nextLink = lastLink;
    lastLink.firstLink = this.firstLink;
    return lastLink;
  }

  /** Gets the first link of this chain. */
  public ChainableReverseAbstractInterpreter getFirst() {
    return firstLink;
  }

  /**
   * Delegates the calculation of the preciser scope to the next link. If there is no next link,
   * returns the blind scope.
   */
  protected FlowScope nextPreciserScopeKnowingConditionOutcome(
      MembershipTest condition, FlowScope blindScope, boolean outcome) {
    return nextLink != null
        ? nextLink.getPreciserScopeKnowingConditionOutcome(condition, blindScope, outcome)
        : blindScope;
  }

  /**
   * Returns the type of an operand in the given scope if the operand is a name whose type is
   * capable of being refined.
   *
   * @return The current type of the operand if it can be refined, null otherwise.
   */
  protected @Nullable Type getTypeIfRefinable(MembershipTest.Operand operand, FlowScope scope) {
    String name = operand.getName();
    if (name == null) {
      return null;
    }
    return scope.getSlotType(name);
  }

  /**
   * Declares a refined type in {@code scope} for the name represented by {@code operand}. It must
   * be possible to refine the type of the given operand in the given scope, as determined by
   * {@link #getTypeIfRefinable}.
   */
  protected FlowScope declareNameInScope(
      FlowScope scope, MembershipTest.Operand operand, Type type) {
    String name = operand.getName();
    if (name == null) {
      throw new IllegalArgumentException("Operand cannot be refined: " + operand);
    }
    return scope.inferSlotType(name, type);
  }
}
