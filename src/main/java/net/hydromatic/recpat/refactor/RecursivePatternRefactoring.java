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
import static net.hydromatic.recpat.util.Static.last;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.recpat.ast.Annotation;
import net.hydromatic.recpat.ast.Ast;
import net.hydromatic.recpat.ast.AstNode;
import net.hydromatic.recpat.ast.Op;
import net.hydromatic.recpat.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rewrites a chain of boolean tests into a recursive pattern.
 *
 * <p>Two forms are handled:
 *
 * <ul>
 *   <li>"&amp;&amp;" of two tests of the same receiver; {@code a.b == 1 &&
 *       a.c == 2} becomes {@code a is { b: 1, c: 2 }}, and
 *       {@code e is C c && c.P == 1} becomes {@code e is C { P: 1 } c};
 *   <li>the leftmost operand of the guard of a case label or switch arm, if
 *       it tests a variable that the label's pattern declares;
 *       {@code case var v when v.Q == 1 && rest:} becomes
 *       {@code case { Q: 1 } v when rest:}.
 * </ul>
 *
 * <p>An instance holds only immutable configuration, and may be used from
 * several threads.
 */
public class RecursivePatternRefactoring {
  private final SemanticModel model;
  private final ImmutableMap<Prop, Object> propMap;
  private final Tracer tracer;

  private RecursivePatternRefactoring(SemanticModel model,
      ImmutableMap<Prop, Object> propMap, Tracer tracer) {
    this.model = requireNonNull(model);
    this.propMap = requireNonNull(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a RecursivePatternRefactoring. */
  public static RecursivePatternRefactoring of(SemanticModel model,
      Map<Prop, Object> propMap, Tracer tracer) {
    return new RecursivePatternRefactoring(model, ImmutableMap.copyOf(propMap),
        tracer);
  }

  /** Creates a RecursivePatternRefactoring with default properties that
   * traces nothing. */
  public static RecursivePatternRefactoring of(SemanticModel model) {
    return of(model, ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Builds a rewrite for the node at a position within a tree.
   *
   * @param root Root of the tree
   * @param pos Caret (an empty position) or selection
   * @return Replacement, or null if there is no rewrite
   */
  public @Nullable Replacement tryBuildRewrite(AstNode root, Pos pos) {
    if (!pos.isEmpty() && !Prop.ALLOW_SELECTION.booleanValue(propMap)) {
      return noRewrite(null, "selection is not empty");
    }
    final List<AstNode> path = NodeFinder.path(root, pos);
    if (path.isEmpty()) {
      return noRewrite(null, "position is outside the tree");
    }
    final AstNode node = last(path);
    final AstNode parent =
        path.size() < 2 ? null : path.get(path.size() - 2);
    return tryBuildRewrite(node, parent);
  }

  /**
   * Builds a rewrite for a given node.
   *
   * @param node Node at the caret
   * @param parent Parent of the node, or null if it is the root
   * @return Replacement, or null if there is no rewrite
   */
  public @Nullable Replacement tryBuildRewrite(AstNode node,
      @Nullable AstNode parent) {
    final Context cx = new Context(SemanticModels.checked(model));
    switch (node.op) {
    case AND_ALSO:
      return combineAndOperands(cx, (Ast.InfixCall) node);

    case CASE_LABEL:
      final Ast.CaseLabel caseLabel = (Ast.CaseLabel) node;
      if (caseLabel.whenClause != null) {
        return combineGuard(cx, caseLabel, caseLabel.pat,
            caseLabel.whenClause);
      }
      break;

    case SWITCH_ARM:
      final Ast.SwitchArm switchArm = (Ast.SwitchArm) node;
      if (switchArm.whenClause != null) {
        return combineGuard(cx, switchArm, switchArm.pat,
            switchArm.whenClause);
      }
      break;

    case WHEN_CLAUSE:
      if (parent instanceof Ast.CaseLabel) {
        return combineGuard(cx, parent, ((Ast.CaseLabel) parent).pat,
            (Ast.WhenClause) node);
      }
      if (parent instanceof Ast.SwitchArm) {
        return combineGuard(cx, parent, ((Ast.SwitchArm) parent).pat,
            (Ast.WhenClause) node);
      }
      break;

    default:
      break;
    }
    return noRewrite(node, "not '&&' or a guarded pattern");
  }

  /** Combines the operands of "&amp;&amp;". */
  private @Nullable Replacement combineAndOperands(Context cx,
      Ast.InfixCall andAlso) {
    // Only the operands next to the caret are combined; in
    // "x && (y && z)" or "x && (y && z) && w", y would be lost
    if (andAlso.a1.op == Op.AND_ALSO
        || andAlso.a0.op == Op.AND_ALSO
            && ((Ast.InfixCall) andAlso.a0).a1.op == Op.AND_ALSO) {
      return noRewrite(andAlso, "operand is a parenthesized '&&'");
    }
    final Term left = cx.classify(andAlso.a0, false);
    final Term right = cx.classify(andAlso.a1, false);
    if (left == null || right == null) {
      return noRewrite(andAlso, "operand is not a test of a receiver");
    }

    // "e is C c && c.P == 0" becomes "e is C { P: 0 } c"
    if (left.source instanceof Ast.IsPattern) {
      final Ast.IsPattern isPattern = (Ast.IsPattern) left.source;
      final ContainingPatternMerger.Found found =
          cx.merger.find(isPattern.pat, right.receiver);
      if (found != null) {
        final Ast.Pat generated = PatternSynthesizer.createPattern(right);
        if (cx.losesNull(right, generated)) {
          return noRewrite(andAlso, nullReason(right));
        }
        final Ast.Pat rewritten = cx.merger.rewrite(found, generated);
        if (rewritten == null) {
          return noRewrite(andAlso, "cannot merge into " + found.container);
        }
        final Ast.IsPattern replacement =
            isPattern.copy(isPattern.exp,
                Replacer.replaceWithin(isPattern.pat, found.container,
                    rewritten));
        return rewrite(andAlso, adjust(andAlso, replacement));
      }
    }

    final CommonReceiver common =
        Chains.commonReceiver(left.receiver, right.receiver, cx.model);
    if (common == null) {
      return noRewrite(andAlso, "operands have no common receiver");
    }
    final Ast.Pat leftPat = PatternSynthesizer.createPattern(left);
    if (cx.losesNull(left, leftPat)) {
      return noRewrite(andAlso, nullReason(left));
    }
    final Ast.Pat rightPat = PatternSynthesizer.createPattern(right);
    if (cx.losesNull(right, rightPat)) {
      return noRewrite(andAlso, nullReason(right));
    }
    final Ast.Subpattern leftSubpattern =
        PatternSynthesizer.subpattern(common.leftNames, leftPat);
    final Ast.Subpattern rightSubpattern =
        PatternSynthesizer.subpattern(common.rightNames, rightPat);
    if (requireNonNull(leftSubpattern.name)
        .equals(rightSubpattern.name)) {
      return noRewrite(andAlso,
          "both operands test '" + leftSubpattern.name + "'");
    }
    // If the receiver is implicit, "P == 1 && Q == 2" becomes
    // "this is { P: 1, Q: 2 }"
    final Ast.IsPattern replacement =
        ast.isPattern(andAlso.pos, common.receiverOrThis(),
            ast.propertyPat(Pos.ZERO,
                ImmutableList.of(leftSubpattern, rightSubpattern)));
    return rewrite(andAlso, adjust(andAlso, replacement));
  }

  /** If the left operand of "&amp;&amp;" is itself "&amp;&amp;", only its
   * right operand was combined; keeps its left operand in front, so that
   * {@code x && a.b == 1 && a.c == 2} becomes
   * {@code x && a is { b: 1, c: 2 }}. */
  private static Ast.Exp adjust(Ast.InfixCall andAlso, Ast.Exp replacement) {
    Ast.Exp exp = replacement;
    if (andAlso.a0.op == Op.AND_ALSO) {
      final Ast.InfixCall left = (Ast.InfixCall) andAlso.a0;
      exp = left.copy(left.a0, replacement);
    }
    return exp.annotate(Annotation.FORMAT);
  }

  /** Merges the leftmost operand of a guard into the pattern of its
   * label or arm. */
  private @Nullable Replacement combineGuard(Context cx, AstNode labelOrArm,
      Ast.Pat pat, Ast.WhenClause whenClause) {
    final Term term = cx.classify(whenClause.condition, true);
    if (term == null) {
      return noRewrite(whenClause, "operand is not a test of a receiver");
    }
    final ContainingPatternMerger.Found found =
        cx.merger.find(pat, term.receiver);
    if (found == null) {
      return noRewrite(whenClause,
          "'" + term.receiver + "' is not declared by pattern '" + pat + "'");
    }
    final Ast.Pat generated = PatternSynthesizer.createPattern(term);
    if (cx.losesNull(term, generated)) {
      return noRewrite(whenClause, nullReason(term));
    }
    final Ast.Pat rewritten = cx.merger.rewrite(found, generated);
    if (rewritten == null) {
      return noRewrite(whenClause, "cannot merge into " + found.container);
    }
    final Ast.Pat newPat =
        Replacer.replaceWithin(pat, found.container, rewritten);

    // "case { p: var v } when v.q == 1 && e:" becomes
    // "case { p: { q: 1 } v } when e:"; if nothing is left of the
    // condition, the "when" clause goes
    final Ast.Exp condition = removeLeftmost(whenClause.condition);
    final Ast.WhenClause newWhenClause =
        condition == null ? null : whenClause.copy(condition);

    final AstNode replacement;
    if (labelOrArm instanceof Ast.CaseLabel) {
      replacement = ((Ast.CaseLabel) labelOrArm).copy(newPat, newWhenClause);
    } else {
      final Ast.SwitchArm switchArm = (Ast.SwitchArm) labelOrArm;
      replacement = switchArm.copy(newPat, newWhenClause, switchArm.exp);
    }
    return rewrite(labelOrArm, replacement);
  }

  /** Returns a condition without its leftmost "&amp;&amp;" operand, or null
   * if the condition is not "&amp;&amp;". */
  static Ast.@Nullable Exp removeLeftmost(Ast.Exp condition) {
    if (condition.op != Op.AND_ALSO) {
      return null;
    }
    final Ast.InfixCall andAlso = (Ast.InfixCall) condition;
    if (andAlso.a0.op == Op.AND_ALSO) {
      return andAlso.copy(requireNonNull(removeLeftmost(andAlso.a0)),
          andAlso.a1);
    }
    return andAlso.a1;
  }

  private static String nullReason(Term term) {
    return "'" + term.source + "' is true when '?.' short-circuits";
  }

  private Replacement rewrite(AstNode target, AstNode replacement) {
    final Replacement r =
        new Replacement(Prop.TITLE.stringValue(propMap), target, replacement);
    tracer.onRewrite(r);
    return r;
  }

  private @Nullable Replacement noRewrite(@Nullable AstNode node,
      String reason) {
    tracer.onNoRewrite(node, reason);
    return null;
  }

  /** State of one request. */
  private class Context {
    final SemanticModel model;
    final TermClassifier classifier;
    final ContainingPatternMerger merger;

    Context(SemanticModel model) {
      this.model = model;
      this.classifier = new TermClassifier(model);
      this.merger =
          new ContainingPatternMerger(model,
              Prop.AND_PATTERN_FALLBACK.booleanValue(propMap),
              Prop.CHECK_BINDINGS.booleanValue(propMap));
    }

    /** Returns whether a term is true when a "?." in its receiver
     * short-circuits, but the pattern made from it is false; a property
     * pattern never matches the null that the "?." produces. */
    boolean losesNull(Term term, Ast.Pat pat) {
      return Chains.isNullConditional(term.receiver)
          && PatternSynthesizer.matchesNull(pat, model);
    }

    @Nullable Term classify(Ast.Exp exp, boolean inGuard) {
      final Term term = classifier.classify(exp, inGuard);
      if (term != null) {
        tracer.onTerm(term);
      }
      return term;
    }
  }
}

// End RecursivePatternRefactoring.java
