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

import static org.forlowering.RuntimeNames.BUILD_TUPLE;

import com.google.common.collect.ImmutableList;
import org.forlowering.LoweringError;
import org.forlowering.ast.Expr;
import org.forlowering.ast.LoweredLoop.Synchronized;
import org.forlowering.ast.LoweredLoop.ZipForm;

/**
 * Expands a synchronized multi-source iteration ({@code zip(a, b, ...)}) into a single expression
 * that acquires a tuple of handles, one for each source.
 *
 * <p>The element order of the tuple is the order of the sources; index destructuring depends on
 * that.
 */
final class ZipExpander {

  /** The acquisition expression for a synchronized loop, and a description of its shape. */
  record Expansion(Expr acquisition, Synchronized sourcing) {}

  private final DirectRangeOptimizer optimizer;

  ZipExpander(DirectRangeOptimizer optimizer) {
    this.optimizer = optimizer;
  }

  /**
   * Expands a {@code ZIP} primitive:
   *
   * <ul>
   *   <li>{@code zip((...t))} becomes {@code getIteratorZip(t)}, which creates no tuples beyond the
   *       one the user wrote;
   *   <li>{@code zip(a)} becomes {@code getIterator(a)};
   *   <li>{@code zip(a, b, ...)} becomes {@code buildTuple(getIterator(a), getIterator(b), ...)}.
   * </ul>
   *
   * Each source that gets its own {@code getIterator()} call is first passed through the range
   * optimizer.
   */
  Expansion expand(Expr.Prim zip) {
    if (!zip.isPrim(Expr.Primitive.ZIP)) {
      throw LoweringError.contractViolation("expected a zip primitive, got %s", zip);
    }
    ImmutableList<Expr> sources = zip.args;
    if (sources.isEmpty()) {
      throw LoweringError.contractViolation("zip() with no sources");
    }
    if (sources.size() == 1) {
      Expr only = sources.get(0);
      if (only.isPrim(Expr.Primitive.TUPLE_EXPAND)) {
        Expr.Prim spread = (Expr.Prim) only;
        if (spread.args.size() != 1) {
          throw LoweringError.contractViolation("malformed tuple expansion %s", spread);
        }
        return new Expansion(
            IterationProtocol.acquireSynchronized(spread.args.get(0)),
            new Synchronized(ZipForm.TUPLE_SPREAD, Synchronized.UNKNOWN_ARITY));
      }
      return new Expansion(
          IterationProtocol.acquire(optimizer.tryOptimize(only)),
          new Synchronized(ZipForm.SOURCES, 1));
    }
    for (Expr source : sources) {
      if (source.isPrim(Expr.Primitive.TUPLE_EXPAND)) {
        throw LoweringError.contractViolation(
            "a tuple expansion must be the only source of %s", zip);
      }
    }
    ImmutableList<Expr> handles =
        sources.stream()
            .map(source -> IterationProtocol.acquire(optimizer.tryOptimize(source)))
            .collect(ImmutableList.toImmutableList());
    return new Expansion(
        Expr.call(BUILD_TUPLE, handles), new Synchronized(ZipForm.SOURCES, sources.size()));
  }

  /**
   * Expands an old-style synchronized iteration, whose iterable is an expression that already
   * evaluates to a tuple of iterables: the result is {@code getIteratorZip(iterable)}. If the
   * iterable is an explicit {@code buildTuple(...)} call each of its arguments is passed through
   * the range optimizer, but the shape of the result is otherwise unchanged.
   */
  Expansion expandLegacy(Expr iterable) {
    if (iterable instanceof Expr.Call call && call.isCall(BUILD_TUPLE)) {
      if (call.args.isEmpty()) {
        throw LoweringError.contractViolation("synchronized iteration over an empty tuple");
      }
      ImmutableList<Expr> args =
          call.args.stream().map(optimizer::tryOptimize).collect(ImmutableList.toImmutableList());
      return new Expansion(
          IterationProtocol.acquireSynchronized(Expr.call(BUILD_TUPLE, args)),
          new Synchronized(ZipForm.LEGACY_TUPLE, args.size()));
    }
    return new Expansion(
        IterationProtocol.acquireSynchronized(iterable),
        new Synchronized(ZipForm.LEGACY_TUPLE, Synchronized.UNKNOWN_ARITY));
  }
}
