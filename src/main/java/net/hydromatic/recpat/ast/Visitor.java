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

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Visits syntax trees.
 *
 * <p>Every child is visited via {@link #accept(AstNode)}. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  private void acceptNullable(@Nullable AstNode e) {
    if (e != null) {
      accept(e);
    }
  }

  private void acceptAll(@Nullable List<? extends AstNode> nodes) {
    if (nodes != null) {
      nodes.forEach(this::accept);
    }
  }

  // expressions

  protected void visit(Ast.Id id) {}

  protected void visit(Ast.This this_) {}

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.MemberAccess memberAccess) {
    accept(memberAccess.exp);
    accept(memberAccess.name);
  }

  protected void visit(Ast.MemberBinding memberBinding) {
    accept(memberBinding.name);
  }

  protected void visit(Ast.ConditionalAccess conditionalAccess) {
    accept(conditionalAccess.exp);
    accept(conditionalAccess.whenNotNull);
  }

  protected void visit(Ast.Call call) {
    accept(call.fn);
    acceptAll(call.args);
  }

  protected void visit(Ast.PrefixCall prefixCall) {
    accept(prefixCall.a);
  }

  protected void visit(Ast.InfixCall infixCall) {
    accept(infixCall.a0);
    accept(infixCall.a1);
  }

  protected void visit(Ast.IsType isType) {
    accept(isType.exp);
    accept(isType.type);
  }

  protected void visit(Ast.IsPattern isPattern) {
    accept(isPattern.exp);
    accept(isPattern.pat);
  }

  protected void visit(Ast.SwitchExp switchExp) {
    accept(switchExp.exp);
    acceptAll(switchExp.arms);
  }

  // types

  protected void visit(Ast.NamedType namedType) {}

  // patterns

  protected void visit(Ast.VarPat varPat) {
    accept(varPat.designation);
  }

  protected void visit(Ast.DeclarationPat declarationPat) {
    accept(declarationPat.type);
    accept(declarationPat.designation);
  }

  protected void visit(Ast.RecursivePat recursivePat) {
    acceptNullable(recursivePat.type);
    acceptAll(recursivePat.positional);
    acceptAll(recursivePat.properties);
    acceptNullable(recursivePat.designation);
  }

  protected void visit(Ast.Subpattern subpattern) {
    acceptNullable(subpattern.name);
    accept(subpattern.pat);
  }

  protected void visit(Ast.ConstantPat constantPat) {
    accept(constantPat.exp);
  }

  protected void visit(Ast.RelationalPat relationalPat) {
    accept(relationalPat.exp);
  }

  protected void visit(Ast.TypePat typePat) {
    accept(typePat.type);
  }

  protected void visit(Ast.NotPat notPat) {
    accept(notPat.pat);
  }

  protected void visit(Ast.InfixPat infixPat) {
    accept(infixPat.p0);
    accept(infixPat.p1);
  }

  protected void visit(Ast.ParenthesizedPat parenthesizedPat) {
    accept(parenthesizedPat.pat);
  }

  // designations

  protected void visit(Ast.SingleDesignation singleDesignation) {}

  protected void visit(Ast.ParenthesizedDesignation parenthesizedDesignation) {
    acceptAll(parenthesizedDesignation.designations);
  }

  // switch

  protected void visit(Ast.WhenClause whenClause) {
    accept(whenClause.condition);
  }

  protected void visit(Ast.CaseLabel caseLabel) {
    accept(caseLabel.pat);
    acceptNullable(caseLabel.whenClause);
  }

  protected void visit(Ast.DefaultLabel defaultLabel) {}

  protected void visit(Ast.SwitchArm switchArm) {
    accept(switchArm.pat);
    acceptNullable(switchArm.whenClause);
    accept(switchArm.exp);
  }

  // statements

  protected void visit(Ast.SwitchStmt switchStmt) {
    accept(switchStmt.exp);
    acceptAll(switchStmt.sections);
  }

  protected void visit(Ast.SwitchSection switchSection) {
    acceptAll(switchSection.labels);
    acceptAll(switchSection.stmts);
  }

  protected void visit(Ast.ExpStmt expStmt) {
    accept(expStmt.exp);
  }

  protected void visit(Ast.Return return_) {
    acceptNullable(return_.exp);
  }

  protected void visit(Ast.Break break_) {}

  protected void visit(Ast.If if_) {
    accept(if_.condition);
    accept(if_.ifTrue);
    acceptNullable(if_.ifFalse);
  }

  protected void visit(Ast.Block block) {
    acceptAll(block.stmts);
  }
}

// End Visitor.java
