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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.function.UnaryOperator;
import net.hydromatic.cam.ast.Op;

/** Type variable, such as {@code 'a}.
 *
 * <p>Two type variables are equal if they have the same ordinal. Ordinals are
 * assigned by {@link TypeSystem#typeVariable()}; see also
 * {@link TypeSystem#unqualified(Type)}. */
public class TypeVar implements Type {
  public final int ordinal;

  /** Creates a type variable with a given ordinal. */
  public TypeVar(int ordinal) {
    checkArgument(ordinal >= 0, "negative ordinal %s", ordinal);
    this.ordinal = ordinal;
  }

  /** Returns the name of the type variable with a given ordinal.
   *
   * <p>The letters are the digits of {@code ordinal} in base 26, so 0 is
   * {@code 'a}, 25 is {@code 'z} and 26 is {@code 'ba}. */
  static String name(int ordinal) {
    final StringBuilder b = new StringBuilder();
    int i = ordinal;
    do {
      b.insert(0, (char) ('a' + i % 26));
      i /= 26;
    } while (i > 0);
    return b.insert(0, '\'').toString();
  }

  @Override public Op op() {
    return Op.TY_VAR;
  }

  @Override public int hashCode() {
    return Integer.hashCode(ordinal);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof TypeVar && ordinal == ((TypeVar) o).ordinal;
  }

  @Override public String toString() {
    return name(ordinal);
  }

  @Override public StringBuilder describe(StringBuilder buf, int left,
      int right) {
    return buf.append(name(ordinal));
  }

  @Override public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override public Type copy(TypeSystem typeSystem,
      UnaryOperator<Type> transform) {
    return transform.apply(this);
  }
}

// End TypeVar.java
