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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.recpat.ast.AstNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each term,
   * then calls the underlying tracer. */
  public static Tracer withOnTerm(Tracer tracer, Consumer<Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onTerm(Term term) {
        consumer.accept(term);
        super.onTerm(term);
      }
    };
  }

  /** Returns a tracer that performs the given action when there is no
   * rewrite, then calls the underlying tracer. */
  public static Tracer withOnNoRewrite(Tracer tracer,
      BiConsumer<@Nullable AstNode, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onNoRewrite(@Nullable AstNode node,
          String reason) {
        consumer.accept(node, reason);
        super.onNoRewrite(node, reason);
      }
    };
  }

  public static Tracer withOnRewrite(Tracer tracer,
      Consumer<Replacement> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRewrite(Replacement replacement) {
        consumer.accept(replacement);
        super.onRewrite(replacement);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onTerm(Term term) {
    }

    @Override public void onNoRewrite(@Nullable AstNode node, String reason) {
    }

    @Override public void onRewrite(Replacement replacement) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onTerm(Term term) {
      tracer.onTerm(term);
    }

    @Override public void onNoRewrite(@Nullable AstNode node, String reason) {
      tracer.onNoRewrite(node, reason);
    }

    @Override public void onRewrite(Replacement replacement) {
      tracer.onRewrite(replacement);
    }
  }
}

// End Tracers.java
