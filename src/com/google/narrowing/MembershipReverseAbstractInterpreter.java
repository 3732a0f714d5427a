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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.narrowing.types.Type;
import com.google.narrowing.types.TypeRegistry;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A reverse abstract interpreter for {@code x in container} and {@code x not in container}, where
 * {@code x} is a name. The type of {@code x} is narrowed on both branches by the {@link
 * NarrowingEngine}. The next link then sees the narrowed scope, so the container may be narrowed
 * as well.
 */
public final class MembershipReverseAbstractInterpreter
    extends ChainableReverseAbstractInterpreter {
  private static final Logger logger =
      Logger.getLogger(MembershipReverseAbstractInterpreter.class.getName());

  private final ContainerElementExtractor extractor;
  private final NarrowingEngine engine;

  public MembershipReverseAbstractInterpreter(TypeRegistry typeRegistry, NarrowingOptions options) {
    this(
        typeRegistry,
        new ContainerElementExtractor(typeRegistry, options),
        new NarrowingEngine(typeRegistry, options));
  }

  /**
   * Creates the chain used by the flow analysis: membership narrowing of the tested name, then
   * TypedDict key narrowing of the container name.
   */
  public static ReverseAbstractInterpreter createDefaultChain(
      TypeRegistry typeRegistry, NarrowingOptions options) {
    return new MembershipReverseAbstractInterpreter(typeRegistry, options)
        .append(new TypedDictKeyReverseAbstractInterpreter(typeRegistry))
        .getFirst();
  }

  MembershipReverseAbstractInterpreter(
      TypeRegistry typeRegistry, ContainerElementExtractor extractor, NarrowingEngine engine) {
    super(typeRegistry);
    this.extractor = checkNotNull(extractor);
    this.engine = checkNotNull(engine);
  }

  @Override
  public FlowScope getPreciserScopeKnowingConditionOutcome(
      MembershipTest condition, FlowScope blindScope, boolean outcome) {
    MembershipTest.Operand left = condition.getLeft();
    Type leftType = getTypeIfRefinable(left, blindScope);
    if (leftType == null) {
      return nextPreciserScopeKnowingConditionOutcome(condition, blindScope, outcome);
    }

    MembershipTest.Operand right = condition.getRight();
    ElementSet elements = extractor.extract(right.getType(), right.getDisplay());
    NarrowingResult result = engine.narrow(leftType, elements, condition.isNegated());
    Type type = result.getType(outcome);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Knowing (" + condition + ") is " + outcome + ": " + left + " is " + type);
    }
    FlowScope narrowedScope = declareNameInScope(blindScope, left, type);
    return nextPreciserScopeKnowingConditionOutcome(condition, narrowedScope, outcome);
  }
}
