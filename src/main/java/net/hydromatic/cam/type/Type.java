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

import java.util.function.UnaryOperator;
import net.hydromatic.cam.ast.Op;

/** Type. */
public interface Type {
  /** Type operator. */
  Op op();

  /**
   * Copies this type, applying a given transform to component types, and
   * returning the original type if the component types are unchanged.
   */
  Type copy(TypeSystem typeSystem, UnaryOperator<Type> transform);

  <R> R accept(TypeVisitor<R> typeVisitor);

  /**
   * Writes a description of this type to a string builder.
   *
   * <p>{@code left} and {@code right} are the precedences of the operators
   * either side; the type is enclosed in parentheses if it binds less tightly
   * than they do.
   */
  StringBuilder describe(StringBuilder buf, int left, int right);

  /** Returns whether this type contains a given type variable. */
  default boolean contains(TypeVar typeVar) {
    return Boolean.TRUE.equals(
        accept(
            new TypeVisitor<Boolean>() {
              @Override
              public Boolean visit(TypeVar typeVar2) {
                return typeVar2.equals(typeVar);
              }

              @Override
              public Boolean visit(FnType fnType) {
                return fnType.paramType.accept(this)
                    || fnType.resultType.accept(this);
              }

              @Override
              public Boolean visit(NamedType namedType) {
                return false;
              }
            }));
  }
}

// End Type.java
