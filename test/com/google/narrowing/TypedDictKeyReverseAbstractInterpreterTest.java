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

import static com.google.common.truth.Truth.assertThat;
import static com.google.narrowing.testing.TypeSubject.assertType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.narrowing.MembershipTest.Operand;
import com.google.narrowing.types.Type;
import com.google.narrowing.types.TypedDictType;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TypedDictKeyReverseAbstractInterpreterTest extends NarrowingTestCase {
  private TypedDictKeyReverseAbstractInterpreter interpreter;
  private TypedDictType withName;
  private TypedDictType withOptionalName;
  private TypedDictType finalWithoutName;
  private TypedDictType openWithoutName;

  @Override
  @Before
  public void setUp() throws Exception {
    super.setUp();
    interpreter = new TypedDictKeyReverseAbstractInterpreter(registry);
    withName =
        registry.createTypedDictType(
            "Named",
            ImmutableMap.of("name", new TypedDictType.Entry(getNativeStrType(), true, false)),
            false);
    withOptionalName =
        registry.createTypedDictType(
            "MaybeNamed",
            ImmutableMap.of("name", new TypedDictType.Entry(getNativeStrType(), false, false)),
            false);
    finalWithoutName =
        registry.createTypedDictType(
            "Point",
            ImmutableMap.of("x", new TypedDictType.Entry(getNativeIntType(), true, false)),
            true);
    openWithoutName =
        registry.createTypedDictType(
            "Base",
            ImmutableMap.of("x", new TypedDictType.Entry(getNativeIntType(), true, false)),
            false);
  }

  @Test
  public void testKeyPresent() {
    Type type =
        createUnionType(withName, withOptionalName, finalWithoutName, openWithoutName);
    Type restricted = interpreter.getRestrictedByKey(type, "name", true);
    assertType(restricted)
        .isEqualTo(
            createUnionType(
                withName, withOptionalName.withEntryProvided("name"), openWithoutName));
  }

  @Test
  public void testKeyAbsent() {
    Type type =
        createUnionType(withName, withOptionalName, finalWithoutName, openWithoutName);
    Type restricted = interpreter.getRestrictedByKey(type, "name", false);
    assertType(restricted)
        .isEqualTo(createUnionType(withOptionalName, finalWithoutName, openWithoutName));
  }

  @Test
  public void testProvidedEntryIsRuledOutWhenAbsent() {
    TypedDictType provided = withOptionalName.withEntryProvided("name");
    assertThat(provided.getEntry("name").isProvided()).isTrue();
    assertThat(provided.getEntries().keySet()).containsExactly("name");
    assertType(interpreter.getRestrictedByKey(provided, "name", false)).isNever();
    assertType(interpreter.getRestrictedByKey(provided, "name", true)).isEqualTo(provided);
  }

  @Test
  public void testOtherMembersAreKept() {
    Type type = createOptionalType(withName);
    assertType(interpreter.getRestrictedByKey(type, "name", false))
        .isEqualTo(getNativeNoneType());
    assertType(interpreter.getRestrictedByKey(type, "name", true)).isEqualTo(type);
  }

  @Test
  public void testNotInNarrowsTheContainer() {
    FlowScope scope = LinkedFlowScope.createEntryLattice(ImmutableMap.of("d", withOptionalName));
    MembershipTest condition =
        MembershipTest.notIn(
            Operand.constant("name", literal("name")), Operand.reference("d", withOptionalName));

    FlowScope ifBranch =
        interpreter.getPreciserScopeKnowingConditionOutcome(condition, scope, true);
    FlowScope elseBranch =
        interpreter.getPreciserScopeKnowingConditionOutcome(condition, scope, false);
    assertType(ifBranch.getSlotType("d")).isEqualTo(withOptionalName);
    assertType(elseBranch.getSlotType("d")).isEqualTo(withOptionalName.withEntryProvided("name"));
  }

  @Test
  public void testKeyWithStrLiteralTypeNarrowsTheContainer() {
    FlowScope scope = LinkedFlowScope.createEntryLattice(ImmutableMap.of("d", withOptionalName));
    MembershipTest condition =
        MembershipTest.in(
            Operand.expression(literal("name")), Operand.reference("d", withOptionalName));
    assertType(
            interpreter
                .getPreciserScopeKnowingConditionOutcome(condition, scope, true)
                .getSlotType("d"))
        .isEqualTo(withOptionalName.withEntryProvided("name"));
  }

  @Test
  public void testKeyWithWiderTypeIsIgnored() {
    FlowScope scope = LinkedFlowScope.createEntryLattice(ImmutableMap.of("d", withOptionalName));
    for (Type keyType : ImmutableList.of(getNativeStrType(), literal("name", "title"))) {
      MembershipTest condition =
          MembershipTest.in(
              Operand.expression(keyType), Operand.reference("d", withOptionalName));
      assertThat(interpreter.getPreciserScopeKnowingConditionOutcome(condition, scope, true))
          .isSameInstanceAs(scope);
    }
  }

  @Test
  public void testProvidedEntriesArePrinted() {
    assertType(withOptionalName).hasString("MaybeNamed");
    assertType(withOptionalName.withEntryProvided("name")).hasString("MaybeNamed[name]");
    assertType(withOptionalName.withEntryProvided("name")).isNotEqualTo(withOptionalName);
  }

  @Test
  public void testNonStringKeysAreIgnored() {
    FlowScope scope = LinkedFlowScope.createEntryLattice(ImmutableMap.of("d", withName));
    MembershipTest condition =
        MembershipTest.in(Operand.constant(1, literal(1)), Operand.reference("d", withName));
    assertThat(interpreter.getPreciserScopeKnowingConditionOutcome(condition, scope, true))
        .isSameInstanceAs(scope);
  }
}
