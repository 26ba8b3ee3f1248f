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

import static org.forlowering.RuntimeNames.ALIGN;
import static org.forlowering.RuntimeNames.BUILD_BOUNDED_RANGE;
import static org.forlowering.RuntimeNames.BUILD_HIGH_BOUNDED_RANGE;
import static org.forlowering.RuntimeNames.BUILD_LOW_BOUNDED_RANGE;
import static org.forlowering.RuntimeNames.BUILD_TUPLE;
import static org.forlowering.RuntimeNames.BUILD_UNBOUNDED_RANGE;
import static org.forlowering.RuntimeNames.BY;
import static org.forlowering.RuntimeNames.COUNT;

import java.util.List;
import java.util.function.Function;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.forlowering.ast.Expr;
import org.forlowering.compiler.LoopsParser.BoundedRangeContext;
import org.forlowering.compiler.LoopsParser.CallExprContext;
import org.forlowering.compiler.LoopsParser.ExpressionContext;
import org.forlowering.compiler.LoopsParser.HighBoundedRangeContext;
import org.forlowering.compiler.LoopsParser.IntLiteralContext;
import org.forlowering.compiler.LoopsParser.LowBoundedRangeContext;
import org.forlowering.compiler.LoopsParser.NameExprContext;
import org.forlowering.compiler.LoopsParser.NegateExprContext;
import org.forlowering.compiler.LoopsParser.NotRangeContext;
import org.forlowering.compiler.LoopsParser.PrimaryExprContext;
import org.forlowering.compiler.LoopsParser.ProductContext;
import org.forlowering.compiler.LoopsParser.SumContext;
import org.forlowering.compiler.LoopsParser.TupleLiteralContext;
import org.forlowering.compiler.LoopsParser.UnboundedRangeContext;

/**
 * Converts expression parse trees to {@link Expr}s.
 *
 * <p>Ranges become calls to the range builders ({@code 1..n} is {@code buildBoundedRange(1, n)}),
 * range modifiers become calls named {@code by}, {@code #} and {@code align}, tuples become
 * {@code buildTuple} calls, and arithmetic operators become calls named by the operator. These
 * are the shapes that the range optimizer looks for.
 */
class ExpressionBuilder extends VisitorBase<Expr> {

  /**
   * Returns the left-associative combination of the operands, calling the function named by each
   * operator.
   */
  private Expr leftFold(List<Token> ops, List<? extends ParserRuleContext> operands) {
    return leftFold(ops, operands, Token::getText);
  }

  private Expr leftFold(
      List<Token> ops, List<? extends ParserRuleContext> operands, Function<Token, String> fnName) {
    Expr result = visit(operands.get(0));
    for (int i = 0; i < ops.size(); i++) {
      result = Expr.call(fnName.apply(ops.get(i)), result, visit(operands.get(i + 1)));
    }
    return result;
  }

  @Override
  public Expr visitExpression(ExpressionContext ctx) {
    return leftFold(ctx.ops, ctx.rangeExpr(), ExpressionBuilder::modifierName);
  }

  private static String modifierName(Token op) {
    return switch (op.getText()) {
      case "by" -> BY;
      case "#" -> COUNT;
      case "align" -> ALIGN;
      default -> throw new AssertionError(op.getText());
    };
  }

  @Override
  public Expr visitBoundedRange(BoundedRangeContext ctx) {
    return Expr.call(BUILD_BOUNDED_RANGE, visit(ctx.sum(0)), visit(ctx.sum(1)));
  }

  @Override
  public Expr visitLowBoundedRange(LowBoundedRangeContext ctx) {
    return Expr.call(BUILD_LOW_BOUNDED_RANGE, visit(ctx.sum()));
  }

  @Override
  public Expr visitHighBoundedRange(HighBoundedRangeContext ctx) {
    return Expr.call(BUILD_HIGH_BOUNDED_RANGE, visit(ctx.sum()));
  }

  @Override
  public Expr visitUnboundedRange(UnboundedRangeContext ctx) {
    return Expr.call(BUILD_UNBOUNDED_RANGE);
  }

  @Override
  public Expr visitNotRange(NotRangeContext ctx) {
    return visit(ctx.sum());
  }

  @Override
  public Expr visitSum(SumContext ctx) {
    return leftFold(ctx.ops, ctx.product());
  }

  @Override
  public Expr visitProduct(ProductContext ctx) {
    return leftFold(ctx.ops, ctx.unary());
  }

  @Override
  public Expr visitNegateExpr(NegateExprContext ctx) {
    Expr operand = visit(ctx.unary());
    if (operand instanceof Expr.Const c) {
      return Expr.of(-c.value);
    }
    return Expr.call("neg", operand);
  }

  @Override
  public Expr visitPrimaryExpr(PrimaryExprContext ctx) {
    return visit(ctx.primary());
  }

  @Override
  public Expr visitIntLiteral(IntLiteralContext ctx) {
    try {
      return Expr.of(Long.parseLong(ctx.INT().getText()));
    } catch (NumberFormatException e) {
      throw error(CompileError.Kind.LITERAL, "Integer literal out of range");
    }
  }

  @Override
  public Expr visitCallExpr(CallExprContext ctx) {
    return Expr.call(ctx.ID().getText(), visitAll(ctx.expression()));
  }

  @Override
  public Expr visitNameExpr(NameExprContext ctx) {
    if (isPlaceholder(ctx.ID())) {
      throw error(CompileError.Kind.INDEX_PATTERN, "'_' can only be used in an index pattern");
    }
    return Expr.name(ctx.ID().getText());
  }

  @Override
  public Expr visitTupleLiteral(TupleLiteralContext ctx) {
    return Expr.call(BUILD_TUPLE, visitAll(ctx.expression()));
  }
}
