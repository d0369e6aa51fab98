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

import static java.util.Objects.requireNonNull;

import net.hydromatic.recpat.ast.AstNode;

/**
 * A rewrite that is ready to apply: replaces one node of a tree with
 * another.
 */
public class Replacement {
  /** Title for the user, such as "Use recursive patterns". */
  public final String title;
  /** Node to replace; identified by reference, not structure. */
  public final AstNode target;
  public final AstNode replacement;

  Replacement(String title, AstNode target, AstNode replacement) {
    this.title = requireNonNull(title);
    this.target = requireNonNull(target);
    this.replacement = requireNonNull(replacement);
  }

  /**
   * Returns a copy of a tree with the target replaced.
   *
   * @throws IllegalArgumentException if the tree does not contain the target
   */
  public AstNode apply(AstNode root) {
    return Replacer.replace(root, target, replacement);
  }

  @Override public String toString() {
    return title + ": replace '" + target + "' with '" + replacement + "'";
  }
}

// End Replacement.java
