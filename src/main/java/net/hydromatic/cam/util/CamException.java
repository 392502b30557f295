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
package net.hydromatic.cam.util;

import net.hydromatic.cam.ast.Pos;

/**
 * Exception that occurs while parsing, validating, compiling or running a
 * program.
 *
 * <p>Every such exception has a position, which may be {@link Pos#ZERO} if
 * the error did not arise from source text (for example, when running a
 * program that was assembled by hand).
 */
public interface CamException {
  /** Returns the position of the error in the source text. */
  Pos pos();

  /** Writes a description of the error, with position, to a buffer. */
  StringBuilder describeTo(StringBuilder buf);
}

// End CamException.java
