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
import net.hydromatic.recpat.ast.Shuttle;

/**
 * Shuttle that replaces one node, identified by reference, with another.
 *
 * <p>Nodes on the path from the root to the replaced node are copied; all
 * other nodes are shared with the original tree.
 */
class Replacer extends Shuttle {
  private final AstNode target;
  private final AstNode replacement;
  private int count;

  private Replacer(AstNode target, AstNode replacement) {
    this.target = requireNonNull(target);
    this.replacement = requireNonNull(replacement);
  }

  /**
   * Replaces {@code target} within {@code root}.
   *
   * @throws IllegalArgumentException if {@code root} does not contain
   *   {@code target}
   */
  static AstNode replace(AstNode root, AstNode target, AstNode replacement) {
    final Replacer replacer = new Replacer(target, replacement);
    final AstNode result = replacer.accept(root);
    if (replacer.count == 0) {
      throw new IllegalArgumentException("node '" + target
          + "' not found in '" + root + "'");
    }
    return result;
  }

  /** As {@link #replace(AstNode, AstNode, AstNode)}, for a target within
   * a tree whose type the replacement preserves. */
  @SuppressWarnings("unchecked")
  static <E extends AstNode> E replaceWithin(E root, AstNode target,
      AstNode replacement) {
    return (E) replace(root, target, replacement);
  }

  @SuppressWarnings("unchecked")
  @Override protected <E extends AstNode> E accept(E node) {
    if (node == target) {
      ++count;
      return (E) replacement;
    }
    return super.accept(node);
  }
}

// End Replacer.java
