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

import java.util.Objects;
import java.util.function.UnaryOperator;
import net.hydromatic.cam.ast.Op;

/** The type of a function value. */
public class FnType extends BaseType {
  public final Type paramType;
  public final Type resultType;

  FnType(Type paramType, Type resultType) {
    super(Op.FUNCTION_TYPE);
    this.paramType = paramType;
    this.resultType = resultType;
  }

  @Override
  public int hashCode() {
    return Objects.hash(paramType, resultType);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FnType
            && paramType.equals(((FnType) o).paramType)
            && resultType.equals(((FnType) o).resultType);
  }

  @Override
  public StringBuilder describe(StringBuilder buf, int left, int right) {
    if (left > op.left || op.right < right) {
      buf.append('(');
      describe(buf, 0, 0);
      return buf.append(')');
    }
    paramType.describe(buf, left, op.left);
    buf.append(op.padded);
    return resultType.describe(buf, op.right, right);
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public FnType copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    final Type paramType2 = transform.apply(paramType);
    final Type resultType2 = transform.apply(resultType);
    return paramType2 == paramType && resultType2 == resultType
        ? this
        : typeSystem.fnType(paramType2, resultType2);
  }
}

// End FnType.java
