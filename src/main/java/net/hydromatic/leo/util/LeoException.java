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
package net.hydromatic.leo.util;

import net.hydromatic.leo.ast.Span;

/**
 * Contract common to all exceptions thrown by the Leo AST layer.
 *
 * <p>Each such exception knows where in the source it occurred (possibly
 * {@link Span#ZERO} if it is not related to a node) and can describe
 * itself in the "position Error: message" form used in diagnostics.
 */
public interface LeoException {
  /** Returns the position of the construct that caused this exception. */
  Span span();

  /** Appends a description of this exception to a buffer. */
  StringBuilder describeTo(StringBuilder buf);
}

// End LeoException.java
