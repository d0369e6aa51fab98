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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import net.hydromatic.recpat.ast.Ast;
import net.hydromatic.recpat.ast.AstNode;
import net.hydromatic.recpat.ast.Visitor;
import net.hydromatic.recpat.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for variable designations. */
public abstract class Designations {
  private Designations() {}

  /** Returns the single designations within a node, in document order,
   * each paired with its parent. */
  public static List<Pair<Ast.SingleDesignation, AstNode>> list(
      AstNode node) {
    final Collector collector = new Collector();
    collector.accept(node);
    return ImmutableList.copyOf(collector.list);
  }

  /** Returns the first single designation with a given name, in document
   * order, paired with its parent; or null. */
  public static @Nullable Pair<Ast.SingleDesignation, AstNode> find(
      AstNode node, String name) {
    for (Pair<Ast.SingleDesignation, AstNode> pair : list(node)) {
      if (pair.left.name.equals(name)) {
        return pair;
      }
    }
    return null;
  }

  /** Returns the designation of a pattern that can hold one:
   * var, declaration or recursive pattern. */
  public static Ast.@Nullable Designation of(Ast.Pat pat) {
    switch (pat.op) {
    case VAR_PAT:
      return ((Ast.VarPat) pat).designation;
    case DECLARATION_PAT:
      return ((Ast.DeclarationPat) pat).designation;
    case RECURSIVE_PAT:
      return ((Ast.RecursivePat) pat).designation;
    default:
      throw new AssertionError("unexpected pattern " + pat.op);
    }
  }

  /** Returns whether a node contains a designation structurally equal to a
   * given designation. */
  public static boolean contains(AstNode node,
      Ast.Designation designation) {
    final Searcher searcher = new Searcher(designation);
    searcher.accept(node);
    return searcher.found;
  }

  /** Visitor that looks for a node equal to a given designation. */
  private static class Searcher extends Visitor {
    final Ast.Designation designation;
    boolean found;

    Searcher(Ast.Designation designation) {
      this.designation = designation;
    }

    @Override protected <E extends AstNode> void accept(E e) {
      if (!found) {
        if (e.equals(designation)) {
          found = true;
        } else {
          super.accept(e);
        }
      }
    }
  }

  /** Visitor that collects single designations and their parents. */
  private static class Collector extends Visitor {
    final List<Pair<Ast.SingleDesignation, AstNode>> list = new ArrayList<>();
    final Deque<AstNode> stack = new ArrayDeque<>();

    @Override protected <E extends AstNode> void accept(E e) {
      if (e instanceof Ast.SingleDesignation && !stack.isEmpty()) {
        list.add(Pair.of((Ast.SingleDesignation) e, stack.peek()));
      }
      stack.push(e);
      super.accept(e);
      stack.pop();
    }
  }
}

// End Designations.java
