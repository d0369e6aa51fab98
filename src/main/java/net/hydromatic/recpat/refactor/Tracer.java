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
package net.hydromatic.recpat.refactor;

import net.hydromatic.recpat.ast.AstNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events while a rewrite is being built. */
public interface Tracer {
  /** Called when an operand has been classified as a term. */
  void onTerm(Term term);

  /**
   * Called when no rewrite is possible, with the node that was being
   * considered (null if there was none) and a short reason.
   */
  void onNoRewrite(@Nullable AstNode node, String reason);

  /** Called when a rewrite has been built. */
  void onRewrite(Replacement replacement);
}

// End Tracer.java
