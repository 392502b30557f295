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

/**
 * Context for writing an AST out as a string.
 *
 * <p>Every compound term is written in parentheses, as the surface syntax
 * requires, so the output of a writer can be parsed again.
 */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();
  private final boolean indexed;

  /** Creates an AstWriter that writes variables by name. */
  public AstWriter() {
    this(false);
  }

  private AstWriter(boolean indexed) {
    this.indexed = indexed;
  }

  /** Returns a writer that also writes the lexical index of each resolved
   * variable, for example "{@code x#0}". Its output cannot be parsed. */
  public AstWriter withIndexes() {
    return new AstWriter(true);
  }

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an identifier to the output. */
  public AstWriter id(String name, int index) {
    b.append(name);
    if (indexed && index >= 0) {
      b.append('#').append(index);
    }
    return this;
  }

  /** Appends a literal value to the output. */
  public AstWriter appendLiteral(Comparable<?> value) {
    b.append(value);
    return this;
  }

  /** Appends a call to an infix operator, such as "{@code (a + b)}" or the
   * application "{@code (f x)}". */
  public AstWriter infix(AstNode a0, Op op, AstNode a1) {
    append("(");
    a0.unparse(this, 0, op.left);
    append(op.padded);
    a1.unparse(this, op.right, 0);
    return append(")");
  }

  /** Appends a type, such as "{@code Int -> Bool}"; parentheses are added
   * only where precedence requires them. */
  public AstWriter type(int left, AstNode a0, Op op, AstNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").type(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  @Override public String toString() {
    return b.toString();
  }

  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }
}

// End AstWriter.java
