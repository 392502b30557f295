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
package net.hydromatic.cam.eval;

import static java.util.Objects.requireNonNull;

/** Value that is sufficient for a function to bind its argument
 * and evaluate its body.
 *
 * <p>A closure is created by the {@code CLOSURE} instruction, and captures
 * the environment at that point. When the closure is applied, the body runs
 * in the captured environment plus the argument, never in the environment of
 * the caller. */
public final class Closure {
  /** Address of the first instruction of the body, which is always a
   * {@code GRAB}. */
  public final int entry;

  /** Environment for evaluation. Contains the variables "captured" from the
   * environment when the closure was created. */
  public final EvalEnv evalEnv;

  /** Not a public API. */
  public Closure(int entry, EvalEnv evalEnv) {
    this.entry = entry;
    this.evalEnv = requireNonNull(evalEnv);
  }

  @Override public String toString() {
    return "Closure(entry = " + entry + ", evalEnv = " + evalEnv + ")";
  }
}

// End Closure.java
