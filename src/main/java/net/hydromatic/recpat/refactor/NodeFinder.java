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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.recpat.ast.AstNode;
import net.hydromatic.recpat.ast.Pos;
import net.hydromatic.recpat.ast.Visitor;

/**
 * Finds the nodes of a tree whose span contains a position.
 *
 * <p>The innermost such node is the one whose own token is at the position;
 * for example, with the caret on {@code &&} in {@code a == 1 && b == 2}, it
 * is the "&amp;&amp;" expression, because neither operand contains the
 * caret.
 */
public class NodeFinder extends Visitor {
  private final Pos pos;
  private final List<AstNode> path = new ArrayList<>();

  private NodeFinder(Pos pos) {
    this.pos = requireNonNull(pos);
  }

  /** Returns the nodes that contain the start of a position, outermost
   * first; empty if even the root does not contain it. */
  public static List<AstNode> path(AstNode root, Pos pos) {
    final NodeFinder finder = new NodeFinder(pos);
    finder.accept(root);
    return ImmutableList.copyOf(finder.path);
  }

  @Override protected <E extends AstNode> void accept(E e) {
    if (e.pos.contains(pos)) {
      path.add(e);
      super.accept(e);
    }
  }
}

// End NodeFinder.java
