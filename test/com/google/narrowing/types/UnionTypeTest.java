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

package com.google.narrowing.types;

import static com.google.common.truth.Truth.assertThat;
import static com.google.narrowing.testing.TypeSubject.assertType;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for how types print in diagnostics. */
@RunWith(JUnit4.class)
public final class UnionTypeTest {
  private TypeRegistry registry;

  @Before
  public void setUp() {
    registry = new TypeRegistry();
  }

  @Test
  public void testLiteralsArePrintedTogether() {
    Type type =
        registry.createUnionType(
            registry.createIntLiteral(1),
            registry.createIntLiteral(2),
            registry.createStringLiteral("a"));
    assertType(type).hasString("Literal[1, 2, 'a']");
  }

  @Test
  public void testLiteralsArePrintedAtTheFirstLiteral() {
    Type type =
        registry.createUnionType(
            registry.getNativeType(NativeType.INT_TYPE),
            registry.createStringLiteral("a"),
            registry.getNativeType(NativeType.NONE_TYPE),
            registry.createIntLiteral(3));
    assertType(type).hasString("int | Literal['a', 3] | None");
  }

  @Test
  public void testNoneIsPrintedOnItsOwn() {
    Type type =
        registry.createUnionType(
            registry.createIntLiteral(1), registry.getNativeType(NativeType.NONE_TYPE));
    assertType(type).hasString("Literal[1] | None");
    assertType(registry.getNativeType(NativeType.NONE_TYPE)).hasString("None");
  }

  @Test
  public void testStringAndBytesLiteralsAreQuoted() {
    assertType(registry.createStringLiteral("it's")).hasString("Literal['it\\'s']");
    assertType(registry.createBytesLiteral(new byte[] {'a', 0})).hasString("Literal[b'a\\x00']");
    assertType(registry.createBoolLiteral(false)).hasString("Literal[False]");
  }

  @Test
  public void testInstancesPrintTheirTypeArguments() {
    Type str = registry.getNativeType(NativeType.STR_TYPE);
    assertType(registry.createInstanceType("dict", str, str)).hasString("dict[str, str]");
    assertType(registry.createHomogeneousTupleType(str)).hasString("tuple[str, ...]");
    assertType(registry.createTupleType(str, registry.createIntLiteral(1)))
        .hasString("tuple[str, Literal[1]]");
    assertType(registry.getNativeType(NativeType.NEVER_TYPE)).hasString("Never");
    assertType(registry.createTupleType()).hasString("tuple[()]");
    assertType(registry.createInstanceType("tuple")).hasString("tuple");
  }

  @Test
  public void testContains() {
    Type str = registry.getNativeType(NativeType.STR_TYPE);
    UnionType union =
        registry.createUnionType(str, registry.getNativeType(NativeType.NONE_TYPE)).toMaybeUnion();
    assertThat(union.contains(str)).isTrue();
    assertThat(union.contains(registry.getNativeType(NativeType.INT_TYPE))).isFalse();
  }
}
