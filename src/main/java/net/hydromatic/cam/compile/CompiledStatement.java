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

import static java.util.Objects.requireNonNull;

import java.util.function.Consumer;
import net.hydromatic.cam.ast.Ast;
import net.hydromatic.cam.eval.Closure;
import net.hydromatic.cam.eval.Machine;
import net.hydromatic.cam.eval.MachineException;
import net.hydromatic.cam.eval.Program;
import net.hydromatic.cam.eval.Session;
import net.hydromatic.cam.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Statement that has been compiled and is ready to be run from the
 * REPL or a script.
 *
 * @see Compiles#prepareStatement */
public class CompiledStatement {
  /** The expression as parsed. */
  public final Ast.Exp exp;
  /** The expression with variables resolved to lexical indices. */
  public final Ast.Exp resolvedExp;
  /** The type of the expression, or null if it was not type-checked. Type
   * variables are numbered in order of appearance, starting at 'a. */
  public final @Nullable Type type;
  public final Program program;
  private final Environment env;
  private final Tracer tracer;

  CompiledStatement(Ast.Exp exp, Ast.Exp resolvedExp, @Nullable Type type,
      Program program, Environment env, Tracer tracer) {
    this.exp = requireNonNull(exp);
    this.resolvedExp = requireNonNull(resolvedExp);
    this.type = type;
    this.program = requireNonNull(program);
    this.env = requireNonNull(env);
    this.tracer = requireNonNull(tracer);
  }

  /** Runs the program, and returns its result.
   *
   * @throws MachineException if the machine fails */
  public Object run(Session session) {
    final Machine machine =
        Machine.create(program, session,
            tracer == Tracers.empty() ? null : tracer::onStep);
    final Object result = machine.run(env.evalEnv());
    tracer.onResult(result);
    return result;
  }

  /** Runs the program, and writes its result to {@code outLines} in the
   * form "{@code val it = 43 : Int}".
   *
   * <p>If the machine fails, and the tracer handles the exception, writes
   * nothing; if the tracer does not handle it, throws. */
  public void eval(Session session, Consumer<String> outLines) {
    final Object result;
    try {
      result = run(session);
    } catch (MachineException e) {
      if (tracer.onException(e)) {
        return;
      }
      throw e;
    }
    final StringBuilder buf = new StringBuilder("val it = ");
    describe(buf, result);
    if (type != null) {
      buf.append(" : ").append(type);
    }
    outLines.accept(buf.toString());
  }

  /** Writes a value. A closure is written as "fn". */
  public static StringBuilder describe(StringBuilder buf, Object value) {
    if (value instanceof Closure) {
      return buf.append("fn");
    }
    return buf.append(value);
  }
}

// End CompiledStatement.java
