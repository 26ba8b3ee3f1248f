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
import com.google.errorprone.annotations.FormatMethod;
import java.util.List;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.forlowering.compiler.LoopsParser.ParenExprContext;

/**
 * Shared plumbing for the tree builders in this package. A node type with no visit method in the
 * subclass is a grammar/builder mismatch and fails with an AssertionError. Errors with no explicit
 * location are reported at the start of the rule being built.
 */
abstract class VisitorBase<T> extends LoopsBaseVisitor<T> {

  /** Written {@code _}; binds nothing in an index pattern and is rejected everywhere else. */
  static final String PLACEHOLDER = "_";

  /** The innermost rule being built, or null between top-level visits. */
  private ParserRuleContext building;

  @Override
  protected final T defaultResult() {
    throw new AssertionError("No builder for " + building);
  }

  @Override
  public final T visit(ParseTree tree) {
    ParserRuleContext outer = building;
    if (tree instanceof ParserRuleContext rule) {
      building = rule;
    }
    try {
      return super.visit(tree);
    } finally {
      building = outer;
    }
  }

  /** Builds each of the given nodes in order. */
  final ImmutableList<T> visitAll(List<? extends ParseTree> nodes) {
    return nodes.stream().map(this::visit).collect(ImmutableList.toImmutableList());
  }

  /** Parentheses only group; the builders never see them. */
  @Override
  public final T visitParenExpr(ParenExprContext ctx) {
    return visit(ctx.expression());
  }

  static boolean isPlaceholder(TerminalNode id) {
    return id.getText().equals(PLACEHOLDER);
  }

  /** Returns a CompileError located at the start of the rule being built. */
  @FormatMethod
  final CompileError error(CompileError.Kind kind, String fmt, Object... fmtArgs) {
    Token start = (building == null) ? null : building.start;
    return CompileError.at(start, kind, fmt, fmtArgs);
  }
}
