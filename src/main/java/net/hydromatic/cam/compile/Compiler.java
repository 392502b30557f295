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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.cam.ast.Ast;
import net.hydromatic.cam.ast.Op;
import net.hydromatic.cam.eval.Instruction;
import net.hydromatic.cam.eval.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a resolved expression to a program for the abstract machine.
 *
 * <ul>
 *   <li>variable with index {@code i}: {@code ACCESS i}
 *   <li>literal: {@code CONST v}
 *   <li>lambda: {@code CLOSURE n}, followed by the {@code n} instructions
 *       {@code GRAB}, the body, {@code RETURN}
 *   <li>application: the argument, the function, {@code APPLY}
 *   <li>{@code a + b}: {@code a}, {@code b}, {@code ADD}; similarly
 *       {@code MUL}
 * </ul>
 *
 * <p>The program ends with {@code RETURN}.
 */
public class Compiler {
  private static final Logger LOGGER = LoggerFactory.getLogger(Compiler.class);

  private Compiler() {}

  /** Compiles an expression that has been resolved in a given
   * environment.
   *
   * @throws OutOfScopeException if a variable is unresolved or its index
   *   does not refer to an enclosing binder */
  public static Program compile(Environment env, Ast.Exp exp) {
    final List<Instruction> instructions = new ArrayList<>();
    new Compiler().compile(exp, env.size(), instructions);
    instructions.add(Instruction.RETURN);
    final Program program = Program.of(instructions);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("compiled [{}] to\n{}", exp, program.disassemble());
    }
    return program;
  }

  /** Appends the code for an expression at a given depth. */
  private void compile(Ast.Exp exp, int depth, List<Instruction> out) {
    switch (exp.op) {
    case ID:
      final Ast.Id id = (Ast.Id) exp;
      if (!id.isResolved() || id.index >= depth) {
        throw new OutOfScopeException(id, depth);
      }
      out.add(Instruction.access(id.index));
      return;

    case INT_LITERAL:
    case BOOL_LITERAL:
    case VALUE_LITERAL:
      out.add(Instruction.constant(value((Ast.Literal) exp)));
      return;

    case FN:
      final Ast.Fn fn = (Ast.Fn) exp;
      final List<Instruction> body = new ArrayList<>();
      body.add(Instruction.GRAB);
      compile(fn.body, depth + 1, body);
      body.add(Instruction.RETURN);
      out.add(Instruction.closure(body.size()));
      out.addAll(body);
      return;

    case APPLY:
      final Ast.Apply apply = (Ast.Apply) exp;
      compile(apply.arg, depth, out);
      compile(apply.fn, depth, out);
      out.add(Instruction.APPLY);
      return;

    case PLUS:
    case TIMES:
      final Ast.InfixCall infixCall = (Ast.InfixCall) exp;
      compile(infixCall.a0, depth, out);
      compile(infixCall.a1, depth, out);
      out.add(exp.op == Op.PLUS
          ? Instruction.ADD
          : Instruction.MUL);
      return;

    default:
      throw new AssertionError("unknown expression " + exp.op);
    }
  }

  /** Converts the value of a literal to the value that the machine
   * operates on. Integer literals become {@link Integer}. */
  static Object value(Ast.Literal literal) {
    if (literal.value instanceof BigDecimal) {
      return ((BigDecimal) literal.value).intValueExact();
    }
    return literal.value;
  }
}

// End Compiler.java
