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
import com.google.common.flogger.FluentLogger;
import java.util.List;
import org.forlowering.LoweringError;
import org.forlowering.ast.Expr;
import org.forlowering.ast.IndexPattern;
import org.forlowering.ast.Label;
import org.forlowering.ast.LoweredLoop;
import org.forlowering.ast.Stmt;
import org.forlowering.ast.Symbol;
import org.forlowering.ast.TaskIntent;
import org.jspecify.annotations.Nullable;

/**
 * Lowers a loop to the iteration protocol. The result is a block of the form
 *
 * <pre>
 * {
 *   def _indexOfInterest#1 (INDEX_OF_INTEREST)
 *   def _iterator#2 (EXPR_TEMP)
 *   _iterator#2 = getIterator(...)
 *   defer freeIterator(_iterator#2)
 *   loop sequential index=_indexOfInterest#1 handle=_iterator#2 {
 *     _indexOfInterest#1 = iteratorIndex(_iterator#2)
 *     ...index destructuring...
 *     ...loop body...
 *     label _continueLabel#3
 *   }
 *   label _breakLabel#4
 * }
 * </pre>
 *
 * Since the release is deferred it runs however control leaves the block.
 *
 * <p>Each LoopAssembler numbers the symbols and labels it creates, so a single LoopAssembler should
 * be used for a compilation unit. It is not thread-safe.
 */
public final class LoopAssembler {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String INDEX_OF_INTEREST_NAME = "_indexOfInterest";
  static final String ELIDED_INDEX_NAME = "_elidedIdx";
  static final String CONTINUE_LABEL_NAME = "_continueLabel";
  static final String BREAK_LABEL_NAME = "_breakLabel";

  private final LoweringContext cx;
  private final IterationProtocol protocol;
  private final DirectRangeOptimizer optimizer;
  private final ZipExpander zipExpander;
  private final IndexDestructurer destructurer;

  public LoopAssembler(LoweringOptions options) {
    this.cx = new LoweringContext(options);
    this.protocol = new IterationProtocol(cx);
    this.optimizer = new DirectRangeOptimizer(cx.options);
    this.zipExpander = new ZipExpander(optimizer);
    this.destructurer = new IndexDestructurer(cx);
  }

  /** Lowers a sequential loop. */
  public Stmt.Block buildForLoop(
      @Nullable IndexPattern indices,
      Expr iterable,
      Stmt.Block body,
      boolean zippered,
      boolean isForExpression) {
    return assemble(
        LoopRequest.builder(LoweredLoop.Kind.SEQUENTIAL, iterable)
            .indices(indices)
            .body(body)
            .zippered(zippered)
            .forExpression(isForExpression)
            .build());
  }

  /** Lowers an order-independent loop. */
  public Stmt.Block buildForeachLoop(
      @Nullable IndexPattern indices,
      Expr iterable,
      Stmt.Block body,
      boolean zippered,
      List<TaskIntent> intents) {
    return assemble(
        LoopRequest.builder(LoweredLoop.Kind.ORDER_INDEPENDENT, iterable)
            .indices(indices)
            .body(body)
            .zippered(zippered)
            .intents(intents)
            .build());
  }

  /** Lowers a loop that spawns a task per iteration. */
  public Stmt.Block buildCoforallLoop(
      @Nullable IndexPattern indices,
      Expr iterable,
      Stmt.Block body,
      boolean zippered,
      List<TaskIntent> intents) {
    return assemble(
        LoopRequest.builder(LoweredLoop.Kind.TASK_PARALLEL, iterable)
            .indices(indices)
            .body(body)
            .zippered(zippered)
            .intents(intents)
            .build());
  }

  /**
   * Lowers the order-independent loop that implements a higher-level parallel construct; the
   * result is marked as synthesized.
   */
  public Stmt.Block buildLoweredForallLoop(
      @Nullable IndexPattern indices,
      Expr iterable,
      Stmt.Block body,
      boolean zippered,
      List<TaskIntent> intents) {
    return assemble(
        LoopRequest.builder(LoweredLoop.Kind.ORDER_INDEPENDENT, iterable)
            .indices(indices)
            .body(body)
            .zippered(zippered)
            .intents(intents)
            .loweredParallel(true)
            .build());
  }

  /** Lowers the described loop. */
  public Stmt.Block assemble(LoopRequest request) {
    checkRequest(request);
    boolean taskParallel = request.kind() == LoweredLoop.Kind.TASK_PARALLEL;

    Symbol index =
        taskParallel
            ? cx.newTemp(
                INDEX_OF_INTEREST_NAME,
                Symbol.Flag.INDEX_OF_INTEREST,
                Symbol.Flag.TASK_PARALLEL_INDEX)
            : cx.newTemp(INDEX_OF_INTEREST_NAME, Symbol.Flag.INDEX_OF_INTEREST);

    IterationProtocol.Acquisition acquisition;
    LoweredLoop.Sourcing sourcing;
    Expr iterable = request.iterable();
    if (iterable instanceof Expr.Prim zip && zip.isPrim(Expr.Primitive.ZIP)) {
      ZipExpander.Expansion expansion = zipExpander.expand(zip);
      acquisition = protocol.bind(expansion.acquisition());
      sourcing = expansion.sourcing();
    } else if (request.zippered()) {
      ZipExpander.Expansion expansion = zipExpander.expandLegacy(iterable);
      acquisition = protocol.bind(expansion.acquisition());
      sourcing = expansion.sourcing();
    } else {
      acquisition = protocol.emit(optimizer.tryOptimize(iterable));
      sourcing = LoweredLoop.Sourcing.SINGLE;
    }
    Symbol handle = acquisition.handle();

    Label continueLabel = cx.newLabel(CONTINUE_LABEL_NAME);
    Label breakLabel = cx.newLabel(BREAK_LABEL_NAME);

    IndexPattern indices =
        (request.indices() == null) ? IndexPattern.bind(ELIDED_INDEX_NAME) : request.indices();
    ImmutableList<Stmt> loopBody =
        ImmutableList.<Stmt>builder()
            .add(IterationProtocol.fetch(index, handle))
            .addAll(destructurer.destructure(indices, Expr.ref(index), taskParallel))
            .addAll(request.body().stmts)
            .add(new Stmt.LabelDef(continueLabel))
            .build();

    LoweredLoop.Header header =
        new LoweredLoop.Header(
            index,
            handle,
            sourcing,
            continueLabel,
            breakLabel,
            request.userLabel(),
            request.attributes(),
            request.isForExpression());
    LoweredLoop loop =
        switch (request.kind()) {
          case SEQUENTIAL -> new LoweredLoop.Sequential(header, loopBody);
          case ORDER_INDEPENDENT -> new LoweredLoop.OrderIndependent(
              header, loopBody, request.isLoweredParallel(), request.intents());
          case TASK_PARALLEL -> new LoweredLoop.TaskParallel(header, loopBody, request.intents());
        };
    loop.verify();

    Stmt.Block result =
        Stmt.Block.of(
            new Stmt.Def(index),
            new Stmt.Def(handle),
            acquisition.init(),
            new Stmt.Defer(IterationProtocol.release(handle)),
            loop,
            new Stmt.LabelDef(breakLabel));
    logger.atFine().log("Lowered %s loop:\n%s", request.kind().displayName, result);
    return result;
  }

  private static void checkRequest(LoopRequest request) {
    if (request.kind() == null) {
      throw LoweringError.contractViolation("loop request has no kind");
    } else if (request.iterable() == null) {
      throw LoweringError.contractViolation("%s loop has no iterable", request.kind().displayName);
    } else if (request.body() == null) {
      throw LoweringError.contractViolation("%s loop has no body", request.kind().displayName);
    } else if (request.kind() == LoweredLoop.Kind.SEQUENTIAL && !request.intents().isEmpty()) {
      throw LoweringError.contractViolation(
          "sequential loop can't have task intents %s", request.intents());
    } else if (request.isLoweredParallel()
        && request.kind() != LoweredLoop.Kind.ORDER_INDEPENDENT) {
      throw LoweringError.contractViolation(
          "only an order-independent loop can implement a parallel construct");
    }
  }
}
