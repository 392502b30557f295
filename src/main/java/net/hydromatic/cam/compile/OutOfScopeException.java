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
package net.hydromatic.cam.compile;

import net.hydromatic.cam.ast.Ast;

/** Thrown when the compiler finds a variable whose lexical index does not
 * refer to an enclosing binder.
 *
 * <p>This happens if a tree is built by hand, or if an unresolved tree is
 * compiled. The compiler never clamps an index into range. */
public class OutOfScopeException extends CompileException {
  public final String name;
  public final int index;
  public final int depth;

  public OutOfScopeException(Ast.Id id, int depth) {
    super(id.isResolved()
            ? "variable " + id.name + " has index " + id.index
                + " but is enclosed by only " + depth + " binders"
            : "variable " + id.name + " has not been resolved",
        id.pos);
    this.name = id.name;
    this.index = id.index;
    this.depth = depth;
  }
}

// End OutOfScopeException.java
