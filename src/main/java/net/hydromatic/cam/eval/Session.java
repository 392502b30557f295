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

import java.util.LinkedHashMap;
import java.util.Map;

/** Session environment.
 *
 * <p>Holds the property values that control how programs are checked and
 * run. */
public class Session {
  /** Property values. */
  public final Map<Prop, Object> map;

  /** Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as is,
   * not copied. It may be immutable if the session is for a narrow, internal
   * use. Otherwise, it should probably be a {@link LinkedHashMap} to provide
   * deterministic iteration order.
   *
   * @param map Map that contains property values */
  public Session(Map<Prop, Object> map) {
    this.map = map;
  }

  /** Creates a Session with default property values. */
  public Session() {
    this(new LinkedHashMap<>());
  }

  /** Returns whether programs are type-checked before they are compiled. */
  public boolean typeCheck() {
    return Prop.TYPE_CHECK.booleanValue(map);
  }

  /** Returns whether unification performs the occurs check. */
  public boolean occursCheck() {
    return Prop.OCCURS_CHECK.booleanValue(map);
  }
}

// End Session.java
