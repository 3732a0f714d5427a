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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

/** A nominal class known to the {@link TypeRegistry}. */
public final class ClassInfo {
  private final String name;
  private final ImmutableList<Variance> typeParameters;
  private final ImmutableList<String> superclasses;

  ClassInfo(
      String name, ImmutableList<Variance> typeParameters, ImmutableList<String> superclasses) {
    this.name = checkNotNull(name);
    this.typeParameters = checkNotNull(typeParameters);
    this.superclasses = checkNotNull(superclasses);
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Variance> getTypeParameters() {
    return typeParameters;
  }

  /** Direct superclasses, in declaration order. */
  public ImmutableList<String> getSuperclasses() {
    return superclasses;
  }

  /**
   * Returns the variance of the type parameter at {@code index}. Arguments beyond the declared
   * parameters are treated as covariant.
   */
  Variance getVariance(int index) {
    return index < typeParameters.size() ? typeParameters.get(index) : Variance.COVARIANT;
  }

  @Override
  public String toString() {
    return name;
  }
}
