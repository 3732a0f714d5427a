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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.narrowing.types.Type;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for LinkedFlowScope. */
@RunWith(JUnit4.class)
public final class LinkedFlowScopeTest extends NarrowingTestCase {
  private Type optionalInt;
  private Type optionalStr;
  private LinkedFlowScope entry;

  @Override
  @Before
  public void setUp() throws Exception {
    super.setUp();
    optionalInt = createOptionalType(getNativeIntType());
    optionalStr = createOptionalType(getNativeStrType());
    entry = LinkedFlowScope.createEntryLattice(ImmutableMap.of("x", optionalInt, "y", optionalStr));
  }

  @Test
  public void testEntryLatticeHasDeclaredTypes() {
    assertType(entry.getSlotType("x")).isEqualTo(optionalInt);
    assertType(entry.getDeclaredType("y")).isEqualTo(optionalStr);
    assertThat(entry.getSlotType("z")).isNull();
    assertThat(entry.getInferredSlots()).isEmpty();
  }

  @Test
  public void testInferSlotType() {
    LinkedFlowScope child = entry.inferSlotType("x", getNativeIntType());
    assertType(child.getSlotType("x")).isEqualTo(getNativeIntType());
    assertType(child.getDeclaredType("x")).isEqualTo(optionalInt);
    assertType(child.getSlotType("y")).isEqualTo(optionalStr);

    // The parent is not modified.
    assertType(entry.getSlotType("x")).isEqualTo(optionalInt);
  }

  @Test
  public void testLaterInferencesShadowEarlierOnes() {
    LinkedFlowScope scope =
        entry
            .inferSlotType("x", getNativeIntType())
            .inferSlotType("y", getNativeStrType())
            .inferSlotType("x", getNativeNoneType());
    assertType(scope.getSlotType("x")).isEqualTo(getNativeNoneType());
    assertThat(scope.getInferredSlots())
        .containsExactly("x", getNativeNoneType(), "y", getNativeStrType());
  }

  @Test
  public void testInferringTheSameTypeReturnsTheSameScope() {
    assertThat(entry.inferSlotType("x", optionalInt)).isSameInstanceAs(entry);
  }

  @Test
  public void testInferringUndeclaredSymbolFails() {
    assertThrows(
        IllegalArgumentException.class, () -> entry.inferSlotType("z", getNativeIntType()));
  }

  @Test
  public void testJoinKeepsAgreedSlots() {
    LinkedFlowScope a =
        entry.inferSlotType("x", getNativeIntType()).inferSlotType("y", getNativeStrType());
    LinkedFlowScope b = entry.inferSlotType("x", getNativeIntType());
    LinkedFlowScope joined = LinkedFlowScope.join(a, b);
    assertType(joined.getSlotType("x")).isEqualTo(getNativeIntType());
    assertType(joined.getSlotType("y")).isEqualTo(optionalStr);
  }

  @Test
  public void testJoinRevertsDisagreedSlotsToTheEntryType() {
    LinkedFlowScope a = entry.inferSlotType("x", getNativeIntType());
    LinkedFlowScope b = entry.inferSlotType("x", getNativeNoneType());
    LinkedFlowScope joined = LinkedFlowScope.join(a, b);
    assertType(joined.getSlotType("x")).isEqualTo(optionalInt);
    assertThat(joined).isEqualTo(entry);
  }

  @Test
  public void testJoinRestoresTheTypeBeforeTheBranches() {
    LinkedFlowScope declared =
        LinkedFlowScope.createEntryLattice(
            ImmutableMap.of(
                "x", createUnionType(getNativeIntType(), getNativeStrType(), getNativeNoneType())));
    Type intOrStr = createUnionType(getNativeIntType(), getNativeStrType());
    LinkedFlowScope narrowed = declared.inferSlotType("x", intOrStr);

    LinkedFlowScope joined =
        LinkedFlowScope.join(narrowed.inferSlotType("x", getNativeIntType()), narrowed);
    assertType(joined.getSlotType("x")).isEqualTo(intOrStr);

    joined =
        LinkedFlowScope.join(
            narrowed.inferSlotType("x", getNativeIntType()),
            narrowed.inferSlotType("x", getNativeStrType()));
    assertType(joined.getSlotType("x")).isEqualTo(intOrStr);
  }

  @Test
  public void testJoinUsesTheClosestCommonScope() {
    LinkedFlowScope branchPoint =
        entry.inferSlotType("y", getNativeStrType()).inferSlotType("x", getNativeIntType());
    LinkedFlowScope a = branchPoint.inferSlotType("x", getNativeNoneType());
    LinkedFlowScope b = branchPoint.inferSlotType("y", getNativeNoneType());
    LinkedFlowScope joined = LinkedFlowScope.join(a, b);
    assertType(joined.getSlotType("x")).isEqualTo(getNativeIntType());
    assertType(joined.getSlotType("y")).isEqualTo(getNativeStrType());
  }

  @Test
  public void testJoinOfDifferentFlowsFails() {
    LinkedFlowScope other =
        LinkedFlowScope.createEntryLattice(ImmutableMap.of("x", getNativeIntType()));
    assertThrows(IllegalArgumentException.class, () -> LinkedFlowScope.join(entry, other));
  }

  @Test
  public void testLongChainsAreFlattened() {
    LinkedFlowScope scope = entry;
    for (int i = 0; i < LinkedFlowScope.MAX_DEPTH * 3; i++) {
      scope = scope.inferSlotType("x", i % 2 == 0 ? getNativeIntType() : getNativeNoneType());
      scope = scope.inferSlotType("y", i % 2 == 0 ? getNativeStrType() : getNativeNoneType());
    }
    assertType(scope.getSlotType("x")).isEqualTo(getNativeNoneType());
    assertType(scope.getSlotType("y")).isEqualTo(getNativeNoneType());
    assertThat(scope)
        .isEqualTo(
            entry.inferSlotType("x", getNativeNoneType()).inferSlotType("y", getNativeNoneType()));
  }

  @Test
  public void testEquality() {
    LinkedFlowScope a = entry.inferSlotType("x", getNativeIntType());
    LinkedFlowScope b = entry.inferSlotType("x", getNativeIntType());
    assertThat(a).isEqualTo(b);
    assertThat(a.hashCode()).isEqualTo(b.hashCode());
    assertThat(a).isNotEqualTo(entry);
  }
}
