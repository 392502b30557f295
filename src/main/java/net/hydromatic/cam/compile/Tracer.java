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
import net.hydromatic.cam.eval.Machine;
import net.hydromatic.cam.eval.Program;
import net.hydromatic.cam.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during compilation and evaluation. */
public interface Tracer {
  /** Called when text has been parsed. */
  void onParse(Ast.Exp exp);

  /** Called when the type of the expression has been deduced. */
  void onType(Type type);

  /** Called when variables have been resolved to lexical indices. */
  void onResolved(Ast.Exp exp);

  /** Called when code is generated. */
  void onPlan(Program program);

  /** Called before the machine executes each instruction. */
  void onStep(Machine.State state);

  /** Called on the result of an evaluation. */
  void onResult(Object o);

  /**
   * Called with the exception thrown during evaluation, or null if no exception
   * was thrown. Returns whether a handler was found.
   */
  boolean onException(@Nullable Throwable e);
}

// End Tracer.java
