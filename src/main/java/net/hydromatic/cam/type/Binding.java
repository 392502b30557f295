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
package net.hydromatic.cam.type;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Binding of a name to a type and a value.
 *
 * <p>Used in {@link net.hydromatic.cam.compile.Environment}. A binding
 * without a type is assigned a fresh type variable each time a program is
 * type-checked.
 */
public class Binding {
  public final String name;
  public final @Nullable Type type;
  public final Object value;

  private Binding(String name, @Nullable Type type, Object value) {
    this.name = requireNonNull(name);
    this.type = type;
    this.value = requireNonNull(value);
  }

  /** Creates a binding of a name to a symbolic value (the name itself), with
   * no declared type. */
  public static Binding of(String name) {
    return new Binding(name, null, name);
  }

  /** Creates a binding of a name to a value with a given type. */
  public static Binding of(String name, Type type, Object value) {
    return new Binding(name, requireNonNull(type), value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, value);
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || o instanceof Binding
            && name.equals(((Binding) o).name)
            && Objects.equals(type, ((Binding) o).type)
            && value.equals(((Binding) o).value);
  }

  @Override
  public String toString() {
    return type == null
        ? name + " = " + value
        : name + " = " + value + " : " + type;
  }
}

// End Binding.java
