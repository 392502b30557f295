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
package net.hydromatic.cam.ast;

import static net.hydromatic.cam.ast.AstBuilder.ast;

/** Visits and transforms syntax trees.
 *
 * <p>The default implementation of each method rebuilds the node from the
 * results of visiting its children, and returns the original node if no child
 * changed. */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {
  }

  // expressions

  protected Ast.Exp visit(Ast.Literal literal) {
    return literal; // leaf
  }

  protected Ast.Id visit(Ast.Id id) {
    return id; // leaf
  }

  protected Ast.Fn visit(Ast.Fn fn) {
    return fn.copy(fn.param, fn.body.accept(this));
  }

  protected Ast.Exp visit(Ast.Apply apply) {
    return apply.copy(apply.fn.accept(this), apply.arg.accept(this));
  }

  protected Ast.Exp visit(Ast.InfixCall infixCall) {
    return infixCall.copy(infixCall.a0.accept(this),
        infixCall.a1.accept(this));
  }

  // types

  protected Ast.Type visit(Ast.NamedType namedType) {
    return namedType; // leaf
  }

  protected Ast.Type visit(Ast.FunctionType functionType) {
    final Ast.Type paramType = functionType.paramType.accept(this);
    final Ast.Type resultType = functionType.resultType.accept(this);
    return paramType == functionType.paramType
        && resultType == functionType.resultType
        ? functionType
        : ast.functionType(functionType.pos, paramType, resultType);
  }
}

// End Shuttle.java
