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

import static net.hydromatic.recpat.ast.AstBuilder.ast;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.recpat.ast.Annotation;
import net.hydromatic.recpat.ast.Ast;
import net.hydromatic.recpat.ast.AstNode;
import net.hydromatic.recpat.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Merges a generated pattern into the pattern that declares the variable the
 * generated pattern is about.
 *
 * <p>For example, in {@code e is C c && c.P == 1}, the generated pattern
 * {@code 1} is about {@code c.P}; variable {@code c} is declared by
 * {@code C c}, and merging gives {@code C { P: 1 } c}.
 */
public class ContainingPatternMerger {
  private final SemanticModel model;
  private final boolean andPatternFallback;
  private final boolean checkBindings;

  public ContainingPatternMerger(SemanticModel model,
      boolean andPatternFallback, boolean checkBindings) {
    this.model = requireNonNull(model);
    this.andPatternFallback = andPatternFallback;
    this.checkBindings = checkBindings;
  }

  /**
   * Finds, within a pattern, the designation of the variable at the root of
   * an expression.
   *
   * <p>Returns null if the innermost receiver of the expression is not an
   * identifier, if the pattern does not designate that identifier, or if the
   * designation is not directly held by a var, declaration or recursive
   * pattern (for example {@code var (x, y)}).
   */
  public @Nullable Found find(Ast.Pat pat, Ast.Exp receiver) {
    final Chain chain = Chains.decompose(receiver, model);
    if (!(chain.receiver instanceof Ast.Id)) {
      return null;
    }
    final Pair<Ast.SingleDesignation, AstNode> pair =
        Designations.find(pat, ((Ast.Id) chain.receiver).name);
    if (pair == null) {
      return null;
    }
    switch (pair.right.op) {
    case VAR_PAT:
    case DECLARATION_PAT:
    case RECURSIVE_PAT:
      return new Found((Ast.Pat) pair.right, pair.left,
          chain.names(0));
    default:
      return null;
    }
  }

  /**
   * Rewrites the pattern found by {@link #find} so that it also applies the
   * generated pattern.
   *
   * <p>Returns null if the two cannot be combined: the container already has
   * a subpattern with the same name, or the shapes do not fit and the
   * {@code and} fallback is disabled.
   */
  public Ast.@Nullable Pat rewrite(Found found, Ast.Pat generated) {
    final Ast.Pat result = found.names.isEmpty()
        ? combine(found.container, generated)
        : addSubpattern(found.container,
            PatternSynthesizer.subpattern(found.names, generated));
    if (result == null) {
      return null;
    }
    if (checkBindings) {
      final Ast.Designation designation =
          requireNonNull(Designations.of(found.container));
      if (!Designations.contains(result, designation)) {
        throw new AssertionError("lost designation " + designation
            + " when rewriting " + found.container + " as " + result);
      }
    }
    return result.annotate(Annotation.FORMAT, Annotation.SIMPLIFY);
  }

  /** Combines a pattern with a generated pattern that tests the same
   * value. */
  private Ast.@Nullable Pat combine(Ast.Pat container, Ast.Pat generated) {
    if (container instanceof Ast.VarPat) {
      final Ast.VarPat varPat = (Ast.VarPat) container;
      if (generated instanceof Ast.RecursivePat
          && ((Ast.RecursivePat) generated).designation == null) {
        // "e is var x && e is { p: 1 }" becomes "e is { p: 1 } x"
        return ((Ast.RecursivePat) generated)
            .withDesignation(varPat.designation);
      }
      if (generated instanceof Ast.TypePat) {
        // "e is var x && e is C" becomes "e is C x"
        return ast.declarationPat(container.pos,
            ((Ast.TypePat) generated).type, varPat.designation);
      }
    } else if (container instanceof Ast.DeclarationPat) {
      final Ast.DeclarationPat declarationPat =
          (Ast.DeclarationPat) container;
      if (generated instanceof Ast.RecursivePat
          && ((Ast.RecursivePat) generated).type == null
          && ((Ast.RecursivePat) generated).designation == null) {
        // "is C x && x is { p: 1 }" becomes "is C { p: 1 } x"
        return ((Ast.RecursivePat) generated)
            .withType(declarationPat.type)
            .withDesignation(declarationPat.designation);
      }
    } else if (container instanceof Ast.RecursivePat) {
      final Ast.RecursivePat recursivePat = (Ast.RecursivePat) container;
      if (recursivePat.type == null && generated instanceof Ast.TypePat) {
        // "is { p: 1 } x && x is C" becomes "is C { p: 1 } x"
        return recursivePat.withType(((Ast.TypePat) generated).type);
      }
    }
    if (!andPatternFallback) {
      return null;
    }
    return ast.andPat(container.pos,
        ast.parenthesizedPat(container.pos, container),
        ast.parenthesizedPat(generated.pos, generated));
  }

  /** Adds a subpattern to a pattern. */
  private static Ast.@Nullable Pat addSubpattern(Ast.Pat container,
      Ast.Subpattern subpattern) {
    switch (container.op) {
    case VAR_PAT:
      // "case var x when x.p is 1" becomes "case { p: 1 } x"
      return ast.recursivePat(container.pos, null, null,
          ImmutableList.of(subpattern), ((Ast.VarPat) container).designation);

    case DECLARATION_PAT:
      // "case C x when x.p is 1" becomes "case C { p: 1 } x"
      final Ast.DeclarationPat declarationPat =
          (Ast.DeclarationPat) container;
      return ast.recursivePat(container.pos, declarationPat.type, null,
          ImmutableList.of(subpattern), declarationPat.designation);

    case RECURSIVE_PAT:
      // "case { p: 1 } x when x.q is 2" becomes "case { p: 1, q: 2 } x"
      final Ast.RecursivePat recursivePat = (Ast.RecursivePat) container;
      if (recursivePat.hasProperty(requireNonNull(subpattern.name).name)) {
        return null;
      }
      return recursivePat.addProperty(subpattern);

    default:
      throw new AssertionError("unexpected pattern " + container.op);
    }
  }

  /** Result of {@link #find}. */
  public static class Found {
    /** Pattern that directly holds the designation. */
    public final Ast.Pat container;
    public final Ast.SingleDesignation designation;
    /** Names between the variable and the tested value, root first; empty
     * if the generated pattern tests the variable itself. */
    public final ImmutableList<Ast.Id> names;

    Found(Ast.Pat container, Ast.SingleDesignation designation,
        ImmutableList<Ast.Id> names) {
      this.container = requireNonNull(container);
      this.designation = requireNonNull(designation);
      this.names = requireNonNull(names);
    }

    @Override public String toString() {
      return "found(" + designation + " in " + container + ", " + names + ")";
    }
  }
}

// End ContainingPatternMerger.java
