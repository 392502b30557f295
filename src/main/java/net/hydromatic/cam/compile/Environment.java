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

import static com.google.common.collect.Lists.reverse;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.cam.eval.EvalEnv;
import net.hydromatic.cam.type.Binding;
import net.hydromatic.cam.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Environment for validation and compilation.
 *
 * <p>An environment is a sequence of bindings. The position of a binding in
 * the sequence is significant: the {@code i}th binding (counting from 0, the
 * oldest) is the binder at depth {@code i}, and its value is the
 * corresponding entry of the {@link EvalEnv} that a program runs in. A later
 * binding of the same name obscures, but does not remove, an earlier one.
 *
 * <p>Environments are immutable; a binding creates a new environment. */
public abstract class Environment {
  /** Visits every binding in this environment, most recent first.
   * Bindings that are obscured by another binding of the same name are
   * visited too. */
  abstract void visit(Consumer<Binding> consumer);

  /** Returns the binding of {@code name} if bound, null if not. */
  public abstract @Nullable Binding getOpt(String name);

  /** Returns the number of bindings, which is the depth of the first binder
   * in a program compiled in this environment. */
  public abstract int size();

  /** Creates an environment that is this environment plus a binding of a
   * name to a value of a given type. */
  public Environment bind(String name, Type type, Object value) {
    return bind(Binding.of(name, type, value));
  }

  /** Creates an environment that is this environment plus a binding. */
  public Environment bind(Binding binding) {
    return new Environments.SubEnvironment(this, binding);
  }

  public final Environment bindAll(Iterable<Binding> bindings) {
    return Environments.bind(this, bindings);
  }

  /** Returns the bindings, oldest first. */
  public final List<Binding> bindings() {
    final List<Binding> bindingList = new ArrayList<>();
    visit(bindingList::add);
    return reverse(bindingList);
  }

  /** Creates the evaluation environment in which a program compiled in this
   * environment must run. */
  public EvalEnv evalEnv() {
    final List<Object> values = new ArrayList<>();
    for (Binding binding : bindings()) {
      values.add(binding.value);
    }
    return EvalEnv.of(values);
  }
}

// End Environment.java
