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

import java.util.function.UnaryOperator;
import net.hydromatic.cam.ast.Op;

/**
 * Type constant, such as {@code Int} or {@code Bool}.
 *
 * <p>Two named types are equal if and only if their names are equal.
 */
public class NamedType extends BaseType {
  /** Name of the type of integer literals. */
  public static final String INT = "Int";
  /** Name of the type of {@code true} and {@code false}. */
  public static final String BOOL = "Bool";

  public final String name;

  NamedType(String name) {
    super(Op.NAMED_TYPE);
    this.name = requireNonNull(name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof NamedType && name.equals(((NamedType) o).name);
  }

  @Override
  public StringBuilder describe(StringBuilder buf, int left, int right) {
    return buf.append(name);
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public Type copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    return this;
  }
}

// End NamedType.java
