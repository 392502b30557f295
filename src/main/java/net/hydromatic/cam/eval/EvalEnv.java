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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluation environment.
 *
 * <p>Whereas {@link net.hydromatic.cam.compile.Environment} contains names,
 * types and values, because it is used for validation and compilation,
 * EvalEnv contains only values, addressed by position. Entry 0 is the most
 * recently bound.
 *
 * <p>An EvalEnv is immutable. Binding a value creates a new environment that
 * shares its tail with this one, so a closure can safely hold on to the
 * environment in which it was created.
 */
public final class EvalEnv {
  /** The empty environment. */
  public static final EvalEnv EMPTY = new EvalEnv(null, null, 0);

  private final @Nullable Object value;
  private final @Nullable EvalEnv parent;
  private final int size;

  private EvalEnv(@Nullable Object value, @Nullable EvalEnv parent, int size) {
    this.value = value;
    this.parent = parent;
    this.size = size;
  }

  /** Creates an environment whose entries are the given values, the last
   * value being entry 0. */
  public static EvalEnv of(List<?> values) {
    EvalEnv env = EMPTY;
    for (Object value : values) {
      env = env.bind(value);
    }
    return env;
  }

  /** Creates an environment that has the same content as this one, plus a
   * value that becomes entry 0. */
  public EvalEnv bind(Object value) {
    return new EvalEnv(requireNonNull(value), this, size + 1);
  }

  /** Returns the number of entries. */
  public int size() {
    return size;
  }

  /** Returns the {@code index}th entry; throws if the index is out of
   * range. */
  public Object get(int index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("index " + index
          + " out of range for environment of size " + size);
    }
    EvalEnv env = this;
    for (int i = 0; i < index; i++) {
      env = env.parent;
    }
    return env.value;
  }

  /** Returns the entries as a list, entry 0 first. */
  public List<Object> toList() {
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    for (EvalEnv env = this; env.size > 0; env = env.parent) {
      b.add(env.value);
    }
    return b.build();
  }

  @Override public String toString() {
    return toList().toString();
  }
}

// End EvalEnv.java
