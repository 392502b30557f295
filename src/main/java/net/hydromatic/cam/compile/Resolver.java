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

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.cam.ast.Ast;
import net.hydromatic.cam.ast.Shuttle;
import net.hydromatic.cam.type.Binding;

/**
 * Converts variable names into lexical (de Bruijn) indices.
 *
 * <p>The depth of a node is the number of binders that enclose it. The
 * bindings of the environment are binders at depths 0 through
 * {@code n - 1}, and each lambda adds one. A variable at depth {@code d}
 * that refers to the binder at depth {@code b} gets index
 * {@code d - b - 1}; so 0 means the nearest enclosing binder.
 *
 * <p>For example, in "{@code (lambda x. (lambda y. (x + y)))}" in an empty
 * environment, "x" has index 1 and "y" has index 0.
 *
 * <p>A resolver is immutable. Entering a lambda creates a new resolver
 * whose map shadows the outer binding of the parameter name.
 */
public class Resolver extends Shuttle {
  /** Map from each visible name to the depth of its binder. */
  private final ImmutableMap<String, Integer> depths;
  /** Number of binders enclosing the current node. */
  private final int depth;

  private Resolver(ImmutableMap<String, Integer> depths, int depth) {
    this.depths = requireNonNull(depths);
    this.depth = depth;
  }

  /** Creates a Resolver for expressions in a given environment. */
  public static Resolver create(Environment env) {
    final Map<String, Integer> map = new HashMap<>();
    final List<Binding> bindings = env.bindings();
    for (int i = 0; i < bindings.size(); i++) {
      // later bindings obscure earlier bindings of the same name
      map.put(bindings.get(i).name, i);
    }
    return new Resolver(ImmutableMap.copyOf(map), bindings.size());
  }

  /** Resolves every variable in an expression. Throws
   * {@link UnboundVariableException} if a variable is not bound. */
  public static Ast.Exp resolve(Environment env, Ast.Exp exp) {
    return exp.accept(create(env));
  }

  /** Creates a resolver for the body of a lambda whose parameter is
   * {@code name}. */
  private Resolver bind(String name) {
    final Map<String, Integer> map = new HashMap<>(depths);
    map.put(name, depth);
    return new Resolver(ImmutableMap.copyOf(map), depth + 1);
  }

  @Override protected Ast.Id visit(Ast.Id id) {
    final Integer bindingDepth = depths.get(id.name);
    if (bindingDepth == null) {
      throw new UnboundVariableException(id.name, id.pos);
    }
    return id.copy(depth - bindingDepth - 1);
  }

  @Override protected Ast.Fn visit(Ast.Fn fn) {
    return fn.copy(fn.param, fn.body.accept(bind(fn.param)));
  }
}

// End Resolver.java
