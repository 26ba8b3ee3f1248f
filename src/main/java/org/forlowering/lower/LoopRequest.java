/*
 * Copyright 2025 The Forlowering Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.forlowering.lower;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import org.forlowering.ast.Expr;
import org.forlowering.ast.IndexPattern;
import org.forlowering.ast.LoopAttribute;
import org.forlowering.ast.LoweredLoop;
import org.forlowering.ast.Stmt;
import org.forlowering.ast.TaskIntent;
import org.jspecify.annotations.Nullable;

/**
 * Everything the parser knows about a loop before it is lowered.
 *
 * @param kind the kind of loop to build
 * @param indices the index pattern, or null if the loop has no index
 * @param iterable the expression being iterated; a {@code ZIP} primitive for a synchronized loop
 * @param zippered true if the loop is synchronized; if {@code iterable} isn't a {@code ZIP}
 *     primitive, it is treated as an old-style synchronized iteration over a tuple
 * @param body the statements to run each iteration
 * @param intents task intents for a parallel loop; must be empty for a sequential loop
 * @param attributes annotations to carry onto the lowered loop
 * @param userLabel the label the user gave the loop, or null
 * @param isForExpression true if the loop implements a loop expression
 * @param isLoweredParallel true if the loop implements a higher-level parallel construct
 */
public record LoopRequest(
    LoweredLoop.Kind kind,
    @Nullable IndexPattern indices,
    Expr iterable,
    boolean zippered,
    Stmt.Block body,
    ImmutableList<TaskIntent> intents,
    ImmutableList<LoopAttribute> attributes,
    @Nullable String userLabel,
    boolean isForExpression,
    boolean isLoweredParallel) {

  public static Builder builder(LoweredLoop.Kind kind, Expr iterable) {
    return new Builder(kind, iterable);
  }

  /** A Builder for LoopRequests; all properties other than kind and iterable are optional. */
  public static final class Builder {
    private final LoweredLoop.Kind kind;
    private final Expr iterable;
    private IndexPattern indices;
    private boolean zippered;
    private Stmt.Block body = Stmt.Block.empty();
    private ImmutableList<TaskIntent> intents = ImmutableList.of();
    private ImmutableList<LoopAttribute> attributes = ImmutableList.of();
    private String userLabel;
    private boolean isForExpression;
    private boolean isLoweredParallel;

    private Builder(LoweredLoop.Kind kind, Expr iterable) {
      this.kind = kind;
      this.iterable = iterable;
    }

    @CanIgnoreReturnValue
    public Builder indices(@Nullable IndexPattern indices) {
      this.indices = indices;
      return this;
    }

    /** Marks the loop as synchronized; implied if the iterable is a {@code ZIP} primitive. */
    @CanIgnoreReturnValue
    public Builder zippered(boolean zippered) {
      this.zippered = zippered;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder body(Stmt.Block body) {
      this.body = body;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder body(Stmt... stmts) {
      this.body = Stmt.Block.of(stmts);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder intents(List<TaskIntent> intents) {
      this.intents = ImmutableList.copyOf(intents);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder attributes(List<LoopAttribute> attributes) {
      this.attributes = ImmutableList.copyOf(attributes);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder userLabel(@Nullable String userLabel) {
      this.userLabel = userLabel;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder forExpression(boolean isForExpression) {
      this.isForExpression = isForExpression;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder loweredParallel(boolean isLoweredParallel) {
      this.isLoweredParallel = isLoweredParallel;
      return this;
    }

    public LoopRequest build() {
      boolean zip = zippered || (iterable != null && iterable.isPrim(Expr.Primitive.ZIP));
      return new LoopRequest(
          kind,
          indices,
          iterable,
          zip,
          body,
          intents,
          attributes,
          userLabel,
          isForExpression,
          isLoweredParallel);
    }
  }
}
