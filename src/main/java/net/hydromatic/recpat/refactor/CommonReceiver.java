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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.recpat.ast.Ast;
import net.hydromatic.recpat.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Receiver shared by two access chains, and the names that remain on each
 * side after it.
 *
 * @see Chains#commonReceiver */
public class CommonReceiver {
  /** Shared receiver; null means implicit {@code this}. */
  public final Ast.@Nullable Exp receiver;
  public final ImmutableList<Ast.Id> leftNames;
  public final ImmutableList<Ast.Id> rightNames;

  CommonReceiver(Ast.@Nullable Exp receiver, ImmutableList<Ast.Id> leftNames,
      ImmutableList<Ast.Id> rightNames) {
    this.receiver = receiver;
    this.leftNames = requireNonNull(leftNames);
    this.rightNames = requireNonNull(rightNames);
    checkArgument(!leftNames.isEmpty() && !rightNames.isEmpty());
  }

  /** Returns the receiver, or a {@code this} expression if it is
   * implicit. */
  public Ast.Exp receiverOrThis() {
    return receiver != null ? receiver : ast.this_(Pos.ZERO);
  }

  @Override public String toString() {
    return "common(" + receiver + ", " + leftNames + ", " + rightNames + ")";
  }
}

// End CommonReceiver.java
