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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import net.hydromatic.recpat.ast.Ast;
import net.hydromatic.recpat.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Chain}. */
public abstract class Chains {
  private Chains() {}

  /**
   * Decomposes an expression into its innermost receiver and the names
   * accessed from it.
   *
   * <p>Only names that the model classifies as convertible members
   * ({@link Symbol#isConvertibleMember()}) are part of the chain; the walk
   * stops at anything else, and that is the receiver. A conditional access
   * {@code x?.w} is looked through if all of {@code w} is names; if {@code w}
   * has a receiver of its own, as in {@code x?.M().b}, the receiver is
   * {@code x?.M()}.
   */
  public static Chain decompose(Ast.Exp exp, SemanticModel model) {
    final List<Chain.Link> links = new ArrayList<>();
    final Ast.Exp receiver =
        new Decomposer(model, links).receiver(exp, o -> o);
    // Links were found leaf first.
    return new Chain(ImmutableList.copyOf(Lists.reverse(links)), receiver);
  }

  /**
   * Finds the receiver that two expressions share.
   *
   * <p>Returns null if either expression has no names, or if their innermost
   * receivers differ. Names that both chains share at the root are absorbed
   * into the receiver, so long as each side keeps at least one name;
   * {@code a.b.c} and {@code a.b.d} share receiver {@code a.b}.
   */
  public static @Nullable CommonReceiver commonReceiver(Ast.Exp left,
      Ast.Exp right, SemanticModel model) {
    final Chain leftChain = decompose(left, model);
    final Chain rightChain = decompose(right, model);
    if (leftChain.isEmpty()
        || rightChain.isEmpty()
        || !Objects.equals(leftChain.receiver, rightChain.receiver)) {
      return null;
    }
    int i = 0;
    while (i < leftChain.size() - 1
        && i < rightChain.size() - 1
        && leftChain.links.get(i).name.equals(rightChain.links.get(i).name)) {
      ++i;
    }
    return new CommonReceiver(leftChain.links.get(i).owner,
        leftChain.names(i), rightChain.names(i));
  }

  /** Converts a chain back to an expression, using plain member access;
   * {@code this} if the chain is empty and its receiver implicit. */
  public static Ast.Exp toExp(Chain chain) {
    Ast.Exp exp = chain.receiver;
    for (Chain.Link link : chain.links) {
      exp = exp == null
          ? link.name
          : ast.memberAccess(Pos.ZERO, exp, link.name);
    }
    return exp != null ? exp : ast.this_(Pos.ZERO);
  }

  /**
   * Returns whether a conditional access on the access path of an
   * expression can short-circuit it to null.
   *
   * <p>True for {@code a?.b}, {@code a?.b.c} and {@code a.b?.M().c}; false
   * for {@code a.b} and {@code M(a?.b)}.
   */
  public static boolean isNullConditional(Ast.Exp exp) {
    Ast.Exp e = exp;
    for (;;) {
      switch (e.op) {
      case CONDITIONAL_ACCESS:
        return true;
      case MEMBER_ACCESS:
        e = ((Ast.MemberAccess) e).exp;
        break;
      case CALL:
        e = ((Ast.Call) e).fn;
        break;
      default:
        return false;
      }
    }
  }

  /** Walks down an access chain, collecting names. */
  private static class Decomposer {
    private final SemanticModel model;
    private final List<Chain.Link> links;

    Decomposer(SemanticModel model, List<Chain.Link> links) {
      this.model = model;
      this.links = links;
    }

    /** Returns the receiver of an expression, adding its names to
     * {@link #links}.
     *
     * @param exp Expression
     * @param wrap Converts an expression within {@code exp} into the
     *   equivalent expression outside the enclosing conditional accesses;
     *   null means the innermost conditional access's own target
     */
    Ast.@Nullable Exp receiver(Ast.Exp exp,
        UnaryOperator<Ast.@Nullable Exp> wrap) {
      switch (exp.op) {
      case ID:
        final Ast.Id id = (Ast.Id) exp;
        if (isConvertible(id)) {
          // member of an implicit "this"
          links.add(new Chain.Link(id, wrap.apply(null)));
          return null;
        }
        return exp;

      case MEMBER_BINDING:
        final Ast.MemberBinding binding = (Ast.MemberBinding) exp;
        if (isConvertible(binding.name)) {
          links.add(new Chain.Link(binding.name, wrap.apply(null)));
          return null;
        }
        return exp;

      case MEMBER_ACCESS:
        final Ast.MemberAccess access = (Ast.MemberAccess) exp;
        if (isConvertible(access.name)) {
          links.add(new Chain.Link(access.name, wrap.apply(access.exp)));
          return receiver(access.exp, wrap);
        }
        return exp;

      case CONDITIONAL_ACCESS:
        final Ast.ConditionalAccess conditional =
            (Ast.ConditionalAccess) exp;
        final Ast.Exp right =
            receiver(conditional.whenNotNull, o ->
                o == null
                    ? wrap.apply(conditional.exp)
                    : wrap.apply(conditional.copy(conditional.exp, o)));
        if (right != null) {
          return conditional.copy(conditional.exp, right);
        }
        return receiver(conditional.exp, wrap);

      default:
        return exp;
      }
    }

    private boolean isConvertible(Ast.Id id) {
      final Symbol symbol = model.getSymbol(id);
      return symbol != null && symbol.isConvertibleMember();
    }
  }
}

// End Chains.java
