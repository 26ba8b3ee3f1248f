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

package org.forlowering.ast;

import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * Renders statements as indented text, one statement per line. The output is deterministic
 * (temporaries and labels print with their ids), which makes it suitable for golden-file tests.
 *
 * <p>A lowered loop prints as
 *
 * <pre>
 * loop sequential index=_indexOfInterest#1 handle=_iterator#2 {
 *   ...
 * }
 * </pre>
 *
 * followed on the header line by any of {@code zip=<form>/<arity>}, {@code synthesized}, {@code
 * for-expr}, {@code label=<name>}, {@code intents=(...)} and {@code attrs=(...)}, in that order.
 */
public final class AstPrinter {

  private static final int INDENT = 2;

  private final StringBuilder sb = new StringBuilder();

  private AstPrinter() {}

  /** Returns the printed form of {@code stmt}, ending with a newline. */
  public static String print(Stmt stmt) {
    AstPrinter printer = new AstPrinter();
    printer.print(stmt, 0);
    return printer.sb.toString();
  }

  /** Returns the printed form of a sequence of statements. */
  public static String print(List<? extends Stmt> stmts) {
    AstPrinter printer = new AstPrinter();
    stmts.forEach(s -> printer.print(s, 0));
    return printer.sb.toString();
  }

  private void line(int indent, String text) {
    sb.append(Strings.repeat(" ", indent)).append(text).append('\n');
  }

  private void printBody(List<? extends Stmt> stmts, int indent) {
    stmts.forEach(s -> print(s, indent + INDENT));
  }

  private void print(Stmt stmt, int indent) {
    if (stmt instanceof Stmt.Block block) {
      line(indent, "{");
      printBody(block.stmts, indent);
      line(indent, "}");
    } else if (stmt instanceof LoweredLoop loop) {
      line(indent, loopHeader(loop) + " {");
      printBody(loop.body(), indent);
      line(indent, "}");
    } else if (stmt instanceof Stmt.If ifStmt) {
      line(indent, "if " + ifStmt.condition + " {");
      printBody(ifStmt.then.stmts, indent);
      if (!ifStmt.otherwise.isEmpty()) {
        line(indent, "} else {");
        printBody(ifStmt.otherwise.stmts, indent);
      }
      line(indent, "}");
    } else if (stmt instanceof Stmt.Defer defer && defer.action instanceof Stmt.Block block) {
      line(indent, "defer {");
      printBody(block.stmts, indent);
      line(indent, "}");
    } else {
      line(indent, simple(stmt));
    }
  }

  /** Returns the single-line form of a statement that has no nested statements. */
  private static String simple(Stmt stmt) {
    if (stmt instanceof Stmt.Def def) {
      return "def " + def.symbol + def.symbol.flagsString();
    } else if (stmt instanceof Stmt.Move move) {
      return move.target + " = " + move.value;
    } else if (stmt instanceof Stmt.Assign assign) {
      return assign.name + " = " + assign.value;
    } else if (stmt instanceof Stmt.Eval eval) {
      return eval.expr.toString();
    } else if (stmt instanceof Stmt.Defer defer) {
      return "defer " + simple(defer.action);
    } else if (stmt instanceof Stmt.LabelDef labelDef) {
      return "label " + labelDef.label;
    } else if (stmt instanceof Stmt.Break brk) {
      return withLabel("break", brk.userLabel);
    } else if (stmt instanceof Stmt.Continue cont) {
      return withLabel("continue", cont.userLabel);
    } else if (stmt instanceof Stmt.Return ret) {
      return (ret.value == null) ? "return" : "return " + ret.value;
    } else if (stmt instanceof Stmt.Throw thr) {
      return "throw " + thr.value;
    }
    throw new AssertionError("Can't print " + stmt.getClass().getSimpleName());
  }

  private static String withLabel(String keyword, @Nullable String userLabel) {
    return (userLabel == null) ? keyword : keyword + " " + userLabel;
  }

  private static String loopHeader(LoweredLoop loop) {
    List<String> parts = new ArrayList<>();
    parts.add("loop " + loop.kind().displayName);
    parts.add("index=" + loop.index());
    parts.add("handle=" + loop.handle());
    if (loop.isSynchronized()) {
      parts.add("zip=" + loop.sourcing());
    }
    if (loop.isSynthesized()) {
      parts.add("synthesized");
    }
    if (loop.isForExpression()) {
      parts.add("for-expr");
    }
    if (loop.userLabel() != null) {
      parts.add("label=" + loop.userLabel());
    }
    if (!loop.taskIntents().isEmpty()) {
      parts.add(joined("intents=", loop.taskIntents()));
    }
    if (!loop.attributes().isEmpty()) {
      parts.add(joined("attrs=", loop.attributes()));
    }
    return String.join(" ", parts);
  }

  private static String joined(String prefix, List<?> items) {
    return items.stream()
        .map(Object::toString)
        .collect(Collectors.joining(", ", prefix + "(", ")"));
  }
}
