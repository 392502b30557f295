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

import com.google.common.collect.ImmutableMap;

/** Sub-types of {@link AstNode}, and operators in types. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  INT_LITERAL(true),
  BOOL_LITERAL(true),
  /** Literal whose value is an arbitrary object, such as a symbol. Occurs in
   * programs built using {@link AstBuilder}, never in parsed programs. */
  VALUE_LITERAL(true),

  // value constructors
  FN(". ", 1, false),

  // types
  TY_VAR(true),
  NAMED_TYPE(true),
  FUNCTION_TYPE(" -> ", 6, false),

  TIMES(" * ", 7),
  PLUS(" + ", 6),
  APPLY(" ", 8);

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  /** Binary operators, keyed by the character that denotes them in the
   * surface syntax. */
  public static final ImmutableMap<Character, Op> BY_CHAR =
      ImmutableMap.of('+', PLUS, '*', TIMES);

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this operator is a binary arithmetic operator. */
  public boolean isArithmetic() {
    return this == PLUS || this == TIMES;
  }
}

// End Op.java
