/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.cam.type;

import static java.util.Objects.requireNonNull;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A collection of types, and the generator of fresh type variables.
 *
 * <p>Each run of type inference should use a type system whose counter is in
 * a known state, either a new instance or one that has been {@link #reset()},
 * so that the same program is always assigned the same type variables.
 */
public class TypeSystem {
  private final Map<String, NamedType> namedTypes = new HashMap<>();

  private int nextOrdinal = 0;

  /** Creates a TypeSystem. */
  public TypeSystem() {
    lookup(NamedType.INT);
    lookup(NamedType.BOOL);
  }

  /** Returns the type constant with a given name, creating it if it does not
   * exist. */
  public NamedType lookup(String name) {
    requireNonNull(name);
    return namedTypes.computeIfAbsent(name, NamedType::new);
  }

  /** Returns the type of integers. */
  public NamedType intType() {
    return lookup(NamedType.INT);
  }

  /** Returns the type of booleans. */
  public NamedType boolType() {
    return lookup(NamedType.BOOL);
  }

  /** Creates a function type.
   *
   * <p>Function types are not interned; two function types with equal
   * components are equal but need not be the same object. */
  public FnType fnType(Type paramType, Type resultType) {
    return new FnType(requireNonNull(paramType), requireNonNull(resultType));
  }

  /** Creates a fresh type variable. */
  public TypeVar typeVariable() {
    return new TypeVar(nextOrdinal++);
  }

  /** Resets the counter of type variables, so that the next call to
   * {@link #typeVariable()} returns {@code 'a}. */
  public void reset() {
    nextOrdinal = 0;
  }

  /**
   * Renumbers the type variables of a type in order of first appearance.
   *
   * <p>Examples:
   *
   * <ul>
   *   <li>{@code 'c -> 'c} &rarr; {@code 'a -> 'a}
   *   <li>{@code 'd -> 'b -> 'd} &rarr; {@code 'a -> 'b -> 'a}
   * </ul>
   *
   * <p>Two types that are equal up to renaming of type variables have equal
   * unqualified types.
   */
  public Type unqualified(Type type) {
    return type.accept(
        new TypeShuttle(this) {
          final Map<Integer, TypeVar> map = new LinkedHashMap<>();

          @Override
          public Type visit(TypeVar typeVar) {
            return map.computeIfAbsent(
                typeVar.ordinal, i -> new TypeVar(map.size()));
          }
        });
  }
}

// End TypeSystem.java
