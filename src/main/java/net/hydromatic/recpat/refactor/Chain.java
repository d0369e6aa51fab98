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

import static net.hydromatic.recpat.util.Static.skip;
import static net.hydromatic.recpat.util.Static.transformEager;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.recpat.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of decomposing an access chain such as {@code a.b.c} into its
 * innermost receiver ({@code a}) and the names accessed from it
 * ({@code b}, {@code c}).
 *
 * @see Chains#decompose
 */
public class Chain {
  /** Names, root first; for {@code a.b.c}, [b, c]. May be empty. */
  public final ImmutableList<Link> links;
  /** Innermost receiver; null means implicit {@code this}. */
  public final Ast.@Nullable Exp receiver;

  Chain(ImmutableList<Link> links, Ast.@Nullable Exp receiver) {
    this.links = requireNonNull(links);
    this.receiver = receiver;
  }

  /** Returns the names, root first. */
  public List<Ast.Id> names() {
    return names(0);
  }

  /** Returns the names starting at a given index. */
  public ImmutableList<Ast.Id> names(int start) {
    return transformEager(skip(links, start), link -> link.name);
  }

  public boolean isEmpty() {
    return links.isEmpty();
  }

  public int size() {
    return links.size();
  }

  @Override public String toString() {
    return "chain(" + receiver + ", " + names() + ")";
  }

  /** A name in a chain, and the expression on which it is accessed. */
  public static class Link {
    public final Ast.Id name;
    /** Expression whose member {@link #name} is; null means implicit
     * {@code this}. For {@code c} in {@code a?.b.c}, it is {@code a?.b}. */
    public final Ast.@Nullable Exp owner;

    Link(Ast.Id name, Ast.@Nullable Exp owner) {
      this.name = requireNonNull(name);
      this.owner = owner;
    }

    @Override public String toString() {
      return name + (owner == null ? "" : " of " + owner);
    }
  }
}

// End Chain.java
