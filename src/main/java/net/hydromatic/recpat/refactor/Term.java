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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import net.hydromatic.recpat.ast.Ast;
import net.hydromatic.recpat.ast.AstNode;

/**
 * An operand of "&amp;&amp;" or of a guard, read as a test of a receiver
 * against a target.
 *
 * <p>For example, {@code a.b == 1} is receiver {@code a.b}, target {@code 1};
 * {@code 1 == a.b} is the same but {@link #flipped}; {@code e is C c} is
 * receiver {@code e}, target the pattern {@code C c}.
 */
public class Term {
  /** Expression that is being tested. */
  public final Ast.Exp receiver;
  /** What the receiver is tested against: a constant expression, a type, or
   * a pattern. */
  public final AstNode target;
  /** Whether the constant was on the left of the comparison. */
  public final boolean flipped;
  /** Expression the term was read from. */
  public final Ast.Exp source;

  Term(Ast.Exp receiver, AstNode target, boolean flipped, Ast.Exp source) {
    this.receiver = requireNonNull(receiver);
    this.target = requireNonNull(target);
    this.flipped = flipped;
    this.source = requireNonNull(source);
    checkArgument(target instanceof Ast.Exp
        || target instanceof Ast.Type
        || target instanceof Ast.Pat);
  }

  @Override public String toString() {
    return "term(" + receiver + ", " + target
        + (flipped ? ", flipped" : "") + ")";
  }
}

// End Term.java
