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

import com.google.narrowing.types.Type;
import org.jspecify.annotations.Nullable;

/**
 * A symbol table for flow-sensitive type information. Flow scopes are immutable: inferring the
 * type of a slot returns a new scope.
 */
public interface FlowScope {

  /** Returns the type of the symbol at this point of the flow, or null if it is not declared. */
  @Nullable Type getSlotType(String name);

  /** Returns the declared type of the symbol, or null if it is not declared. */
  @Nullable Type getDeclaredType(String name);

  /**
   * Returns a scope in which the symbol has the given type. The symbol must be declared.
   */
  FlowScope inferSlotType(String name, Type type);
}
