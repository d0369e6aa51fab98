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
package net.hydromatic.recpat.ast;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Visits and transforms syntax trees.
 *
 * <p>Every child is transformed via {@link #accept(AstNode)}, so a
 * sub-class can intercept the transformation of any node, whatever its
 * type, by overriding that one method. */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {
  }

  /** Transforms a child node. */
  protected <E extends AstNode> E accept(E node) {
    //noinspection unchecked
    return (E) node.accept(this);
  }

  /** Transforms a child node that may be absent. */
  protected <E extends AstNode> @Nullable E acceptNullable(@Nullable E node) {
    return node == null ? null : accept(node);
  }

  protected <E extends AstNode> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      list.add(accept(node));
    }
    return list;
  }

  protected <E extends AstNode> @Nullable List<E> visitNullableList(
      @Nullable List<E> nodes) {
    return nodes == null ? null : visitList(nodes);
  }

  // expressions

  protected Ast.Id visit(Ast.Id id) {
    return id; // leaf
  }

  protected Ast.Exp visit(Ast.This this_) {
    return this_; // leaf
  }

  protected Ast.Exp visit(Ast.Literal literal) {
    return literal; // leaf
  }

  protected Ast.Exp visit(Ast.MemberAccess memberAccess) {
    return memberAccess.copy(accept(memberAccess.exp),
        accept(memberAccess.name));
  }

  protected Ast.Exp visit(Ast.MemberBinding memberBinding) {
    return memberBinding; // leaf
  }

  protected Ast.Exp visit(Ast.ConditionalAccess conditionalAccess) {
    return conditionalAccess.copy(accept(conditionalAccess.exp),
        accept(conditionalAccess.whenNotNull));
  }

  protected Ast.Exp visit(Ast.Call call) {
    return call.copy(accept(call.fn), visitList(call.args));
  }

  protected Ast.Exp visit(Ast.PrefixCall prefixCall) {
    return prefixCall.copy(accept(prefixCall.a));
  }

  protected Ast.Exp visit(Ast.InfixCall infixCall) {
    return infixCall.copy(accept(infixCall.a0), accept(infixCall.a1));
  }

  protected Ast.Exp visit(Ast.IsType isType) {
    return isType.copy(accept(isType.exp), accept(isType.type));
  }

  protected Ast.Exp visit(Ast.IsPattern isPattern) {
    return isPattern.copy(accept(isPattern.exp), accept(isPattern.pat));
  }

  protected Ast.Exp visit(Ast.SwitchExp switchExp) {
    return switchExp.copy(accept(switchExp.exp), visitList(switchExp.arms));
  }

  // types

  protected Ast.Type visit(Ast.NamedType namedType) {
    return namedType; // leaf
  }

  // patterns

  protected Ast.Pat visit(Ast.VarPat varPat) {
    return varPat.copy(accept(varPat.designation));
  }

  protected Ast.Pat visit(Ast.DeclarationPat declarationPat) {
    return declarationPat.copy(accept(declarationPat.type),
        accept(declarationPat.designation));
  }

  protected Ast.Pat visit(Ast.RecursivePat recursivePat) {
    return recursivePat.copy(acceptNullable(recursivePat.type),
        visitNullableList(recursivePat.positional),
        visitNullableList(recursivePat.properties),
        acceptNullable(recursivePat.designation));
  }

  protected Ast.Subpattern visit(Ast.Subpattern subpattern) {
    return subpattern.copy(acceptNullable(subpattern.name),
        accept(subpattern.pat));
  }

  protected Ast.Pat visit(Ast.ConstantPat constantPat) {
    return constantPat; // leaf
  }

  protected Ast.Pat visit(Ast.RelationalPat relationalPat) {
    return relationalPat; // leaf
  }

  protected Ast.Pat visit(Ast.TypePat typePat) {
    return typePat; // leaf
  }

  protected Ast.Pat visit(Ast.NotPat notPat) {
    return notPat.copy(accept(notPat.pat));
  }

  protected Ast.Pat visit(Ast.InfixPat infixPat) {
    return infixPat.copy(accept(infixPat.p0), accept(infixPat.p1));
  }

  protected Ast.Pat visit(Ast.ParenthesizedPat parenthesizedPat) {
    return parenthesizedPat.copy(accept(parenthesizedPat.pat));
  }

  // designations

  protected Ast.Designation visit(Ast.SingleDesignation singleDesignation) {
    return singleDesignation; // leaf
  }

  protected Ast.Designation visit(
      Ast.ParenthesizedDesignation parenthesizedDesignation) {
    return parenthesizedDesignation.copy(
        visitList(parenthesizedDesignation.designations));
  }

  // switch

  protected Ast.WhenClause visit(Ast.WhenClause whenClause) {
    return whenClause.copy(accept(whenClause.condition));
  }

  protected Ast.Label visit(Ast.CaseLabel caseLabel) {
    return caseLabel.copy(accept(caseLabel.pat),
        acceptNullable(caseLabel.whenClause));
  }

  protected Ast.Label visit(Ast.DefaultLabel defaultLabel) {
    return defaultLabel; // leaf
  }

  protected Ast.SwitchArm visit(Ast.SwitchArm switchArm) {
    return switchArm.copy(accept(switchArm.pat),
        acceptNullable(switchArm.whenClause), accept(switchArm.exp));
  }

  // statements

  protected Ast.Stmt visit(Ast.SwitchStmt switchStmt) {
    return switchStmt.copy(accept(switchStmt.exp),
        visitList(switchStmt.sections));
  }

  protected Ast.SwitchSection visit(Ast.SwitchSection switchSection) {
    return switchSection.copy(visitList(switchSection.labels),
        visitList(switchSection.stmts));
  }

  protected Ast.Stmt visit(Ast.ExpStmt expStmt) {
    return expStmt.copy(accept(expStmt.exp));
  }

  protected Ast.Stmt visit(Ast.Return return_) {
    return return_.copy(acceptNullable(return_.exp));
  }

  protected Ast.Stmt visit(Ast.Break break_) {
    return break_; // leaf
  }

  protected Ast.Stmt visit(Ast.If if_) {
    return if_.copy(accept(if_.condition), accept(if_.ifTrue),
        acceptNullable(if_.ifFalse));
  }

  protected Ast.Stmt visit(Ast.Block block) {
    return block.copy(visitList(block.stmts));
  }
}

// End Shuttle.java
