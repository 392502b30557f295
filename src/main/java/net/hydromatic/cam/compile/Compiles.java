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
import net.hydromatic.cam.eval.Program;
import net.hydromatic.cam.eval.Session;
import net.hydromatic.cam.parse.CamParser;
import net.hydromatic.cam.type.Type;
import net.hydromatic.cam.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Helpers for {@link Compiler} and {@link TypeResolver}. */
public abstract class Compiles {
  private static final Logger LOGGER = LoggerFactory.getLogger(Compiles.class);

  private Compiles() {}

  /** Parses and prepares a statement. */
  public static CompiledStatement prepareStatement(TypeSystem typeSystem,
      Session session, Environment env, String text, Tracer tracer) {
    final Ast.Exp exp = new CamParser(text).program();
    tracer.onParse(exp);
    return prepareStatement(typeSystem, session, env, exp, tracer);
  }

  /** Validates and compiles a statement (expression), and returns a
   * {@link CompiledStatement} that can be run.
   *
   * <p>If the session's {@link net.hydromatic.cam.eval.Prop#TYPE_CHECK}
   * property is set, the type system's counter is reset and the type of the
   * expression is deduced first; so preparing the same expression twice
   * gives the same type. Type variables in the type are numbered in order of
   * appearance. */
  public static CompiledStatement prepareStatement(TypeSystem typeSystem,
      Session session, Environment env, Ast.Exp exp, Tracer tracer) {
    @Nullable Type type = null;
    if (session.typeCheck()) {
      typeSystem.reset();
      type = typeSystem.unqualified(
          TypeResolver.deduceType(typeSystem, env, exp,
              session.occursCheck()));
      tracer.onType(type);
    }
    final Ast.Exp resolvedExp = Resolver.resolve(env, exp);
    tracer.onResolved(resolvedExp);
    final Program program = Compiler.compile(env, resolvedExp);
    tracer.onPlan(program);
    LOGGER.debug("prepared [{}], {} instructions", exp, program.size());
    return new CompiledStatement(exp, resolvedExp, type, program, env,
        tracer);
  }

  /** Parses, compiles and runs an expression in an environment, with
   * default properties. */
  public static Object eval(Environment env, String text) {
    final TypeSystem typeSystem = new TypeSystem();
    final Session session = new Session();
    return prepareStatement(typeSystem, session, env, text, Tracers.empty())
        .run(session);
  }
}

// End Compiles.java
