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

package org.forlowering.compiler;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import org.antlr.v4.runtime.tree.ParseTree;
import org.forlowering.ast.Expr;
import org.forlowering.ast.IndexPattern;
import org.forlowering.ast.LoopAttribute;
import org.forlowering.ast.LoweredLoop;
import org.forlowering.ast.Stmt;
import org.forlowering.ast.TaskIntent;
import org.forlowering.compiler.LoopsParser.AssignStatementContext;
import org.forlowering.compiler.LoopsParser.AttributeContext;
import org.forlowering.compiler.LoopsParser.BlockContext;
import org.forlowering.compiler.LoopsParser.BreakStatementContext;
import org.forlowering.compiler.LoopsParser.ContinueStatementContext;
import org.forlowering.compiler.LoopsParser.ExpressionStatementContext;
import org.forlowering.compiler.LoopsParser.IfStatementContext;
import org.forlowering.compiler.LoopsParser.IndexPatternContext;
import org.forlowering.compiler.LoopsParser.IterableContext;
import org.forlowering.compiler.LoopsParser.LoopContext;
import org.forlowering.compiler.LoopsParser.LoopStatementContext;
import org.forlowering.compiler.LoopsParser.NamePatternContext;
import org.forlowering.compiler.LoopsParser.PlainIterableContext;
import org.forlowering.compiler.LoopsParser.ReturnStatementContext;
import org.forlowering.compiler.LoopsParser.StatementContext;
import org.forlowering.compiler.LoopsParser.TaskIntentContext;
import org.forlowering.compiler.LoopsParser.ThrowStatementContext;
import org.forlowering.compiler.LoopsParser.TuplePatternContext;
import org.forlowering.compiler.LoopsParser.UnitContext;
import org.forlowering.compiler.LoopsParser.WithClauseContext;
import org.forlowering.compiler.LoopsParser.ZipIterableContext;
import org.forlowering.compiler.LoopsParser.ZipSpreadIterableContext;
import org.forlowering.lower.LoopAssembler;
import org.forlowering.lower.LoopRequest;
import org.jspecify.annotations.Nullable;

/**
 * Converts statement parse trees to {@link Stmt}s, passing each loop to a {@link LoopAssembler}.
 *
 * <p>Also checks that each {@code break} and {@code continue} is inside a loop, and that any label
 * it names is the label of an enclosing loop.
 */
class StatementBuilder extends VisitorBase<Stmt> {

  private final LoopAssembler assembler;
  private final ExpressionBuilder expressions = new ExpressionBuilder();

  /**
   * The user labels of the enclosing loops, innermost first; unlabeled loops are represented by an
   * empty string.
   */
  private final Deque<String> enclosingLoops = new ArrayDeque<>();

  StatementBuilder(LoopAssembler assembler) {
    this.assembler = assembler;
  }

  Stmt.Block buildUnit(UnitContext unit) {
    return buildStatements(unit.statement());
  }

  private Stmt.Block buildBlock(BlockContext block) {
    return buildStatements(block.statement());
  }

  private Stmt.Block buildStatements(List<StatementContext> statements) {
    return new Stmt.Block(visitAll(statements));
  }

  @Override
  public Stmt visitLoopStatement(LoopStatementContext ctx) {
    return visit(ctx.loop());
  }

  @Override
  public Stmt visitLoop(LoopContext ctx) {
    LoweredLoop.Kind kind;
    boolean loweredParallel = false;
    switch (ctx.kind.getText()) {
      case "for" -> kind = LoweredLoop.Kind.SEQUENTIAL;
      case "foreach" -> kind = LoweredLoop.Kind.ORDER_INDEPENDENT;
      case "coforall" -> kind = LoweredLoop.Kind.TASK_PARALLEL;
      case "forall" -> {
        kind = LoweredLoop.Kind.ORDER_INDEPENDENT;
        loweredParallel = true;
      }
      default -> throw new AssertionError(ctx.kind.getText());
    }
    ImmutableList<TaskIntent> intents = ImmutableList.of();
    if (ctx.withClause() != null) {
      if (kind == LoweredLoop.Kind.SEQUENTIAL) {
        throw CompileError.at(
            ctx.withClause().start,
            CompileError.Kind.LOOP_HEADER,
            "A 'for' loop can't have a 'with' clause");
      }
      intents = intents(ctx.withClause());
    }
    IndexPattern indices = (ctx.indexPattern() == null) ? null : pattern(ctx.indexPattern());
    Expr iterable = iterable(ctx.iterable());
    ImmutableList<LoopAttribute> attributes =
        ctx.attribute().stream()
            .map(this::attribute)
            .collect(ImmutableList.toImmutableList());
    String userLabel = (ctx.label == null) ? null : ctx.label.getText();
    if (userLabel != null && enclosingLoops.contains(userLabel)) {
      throw CompileError.at(
          ctx.label,
          CompileError.Kind.LOOP_HEADER,
          "Label '%s' is already used by an enclosing loop",
          userLabel);
    }

    enclosingLoops.push((userLabel == null) ? "" : userLabel);
    Stmt.Block body;
    try {
      body = buildBlock(ctx.block());
    } finally {
      enclosingLoops.pop();
    }

    return assembler.assemble(
        LoopRequest.builder(kind, iterable)
            .indices(indices)
            .body(body)
            .intents(intents)
            .attributes(attributes)
            .userLabel(userLabel)
            .loweredParallel(loweredParallel)
            .build());
  }

  private Expr iterable(IterableContext ctx) {
    if (ctx instanceof ZipSpreadIterableContext spread) {
      return Expr.prim(
          Expr.Primitive.ZIP,
          Expr.prim(Expr.Primitive.TUPLE_EXPAND, expressions.visit(spread.expression())));
    } else if (ctx instanceof ZipIterableContext zip) {
      return Expr.prim(
          Expr.Primitive.ZIP, expressions.visitAll(zip.expression()).toArray(new Expr[0]));
    } else {
      return expressions.visit(((PlainIterableContext) ctx).expression());
    }
  }

  private IndexPattern pattern(IndexPatternContext ctx) {
    if (ctx instanceof NamePatternContext name) {
      return isPlaceholder(name.ID()) ? IndexPattern.SKIP : IndexPattern.bind(name.ID().getText());
    }
    TuplePatternContext tuple = (TuplePatternContext) ctx;
    if (tuple.indexPattern().size() < 2) {
      throw CompileError.at(
          tuple.start,
          CompileError.Kind.INDEX_PATTERN,
          "A tuple index pattern must have at least two elements");
    }
    return IndexPattern.tuple(
        tuple.indexPattern().stream().map(this::pattern).collect(ImmutableList.toImmutableList()));
  }

  private static ImmutableList<TaskIntent> intents(WithClauseContext ctx) {
    ImmutableList.Builder<TaskIntent> result = ImmutableList.builder();
    for (TaskIntentContext intent : ctx.taskIntent()) {
      String mode = "";
      if (intent.intentMode() != null) {
        // Rejoin "const in" and "const ref" with a single space.
        mode =
            intent.intentMode().children.stream()
                .map(ParseTree::getText)
                .collect(Collectors.joining(" "));
      }
      result.add(new TaskIntent(mode, intent.ID().getText()));
    }
    return result.build();
  }

  private LoopAttribute attribute(AttributeContext ctx) {
    return new LoopAttribute(ctx.ID().getText(), expressions.visitAll(ctx.expression()));
  }

  /**
   * Checks that a {@code break} or {@code continue} is inside a loop with the given label (or any
   * loop, if {@code userLabel} is null).
   */
  private void checkTarget(String keyword, @Nullable String userLabel) {
    if (enclosingLoops.isEmpty()) {
      throw error(CompileError.Kind.BRANCH_TARGET, "'%s' must be inside a loop", keyword);
    } else if (userLabel != null && !enclosingLoops.contains(userLabel)) {
      throw error(CompileError.Kind.BRANCH_TARGET, "No enclosing loop is labeled '%s'", userLabel);
    }
  }

  @Override
  public Stmt visitBreakStatement(BreakStatementContext ctx) {
    String userLabel = (ctx.ID() == null) ? null : ctx.ID().getText();
    checkTarget("break", userLabel);
    return new Stmt.Break(userLabel);
  }

  @Override
  public Stmt visitContinueStatement(ContinueStatementContext ctx) {
    String userLabel = (ctx.ID() == null) ? null : ctx.ID().getText();
    checkTarget("continue", userLabel);
    return new Stmt.Continue(userLabel);
  }

  @Override
  public Stmt visitReturnStatement(ReturnStatementContext ctx) {
    Expr value = (ctx.expression() == null) ? null : expressions.visit(ctx.expression());
    return new Stmt.Return(value);
  }

  @Override
  public Stmt visitThrowStatement(ThrowStatementContext ctx) {
    return new Stmt.Throw(expressions.visit(ctx.expression()));
  }

  @Override
  public Stmt visitIfStatement(IfStatementContext ctx) {
    Stmt.Block otherwise =
        (ctx.block().size() > 1) ? buildBlock(ctx.block(1)) : Stmt.Block.empty();
    return new Stmt.If(expressions.visit(ctx.expression()), buildBlock(ctx.block(0)), otherwise);
  }

  @Override
  public Stmt visitAssignStatement(AssignStatementContext ctx) {
    if (isPlaceholder(ctx.ID())) {
      throw error(CompileError.Kind.INDEX_PATTERN, "Can't assign to '_'");
    }
    return new Stmt.Assign(ctx.ID().getText(), expressions.visit(ctx.expression()));
  }

  @Override
  public Stmt visitExpressionStatement(ExpressionStatementContext ctx) {
    return new Stmt.Eval(expressions.visit(ctx.expression()));
  }
}
