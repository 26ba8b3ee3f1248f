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

import static org.forlowering.RuntimeNames.CHECK_TUPLE_SIZE;

import com.google.common.collect.ImmutableList;
import org.forlowering.LoweringError;
import org.forlowering.ast.Expr;
import org.forlowering.ast.IndexPattern;
import org.forlowering.ast.Stmt;
import org.forlowering.ast.Symbol;

/**
 * Binds the user's index pattern from the value in a loop's index of interest.
 *
 * <p>A name is declared and assigned the whole value; a tuple pattern first checks the size of
 * the value and then binds each element (recursively) from the corresponding position; a skip
 * binds nothing.
 */
final class IndexDestructurer {

  private final LoweringContext cx;

  IndexDestructurer(LoweringContext cx) {
    this.cx = cx;
  }

  /**
   * Returns the statements that bind {@code pattern} from {@code value}. If {@code taskParallel}
   * is true each bound variable is flagged as a task-parallel index, since it will be passed to the
   * spawned task along with the index of interest.
   */
  ImmutableList<Stmt> destructure(IndexPattern pattern, Expr value, boolean taskParallel) {
    ImmutableList.Builder<Stmt> stmts = ImmutableList.builder();
    destructure(pattern, value, taskParallel, stmts);
    return stmts.build();
  }

  private void destructure(
      IndexPattern pattern, Expr value, boolean taskParallel, ImmutableList.Builder<Stmt> stmts) {
    if (pattern instanceof IndexPattern.Bind bind) {
      Symbol var = cx.newVar(bind.name);
      var.addFlag(Symbol.Flag.INDEX_VAR);
      if (taskParallel) {
        var.addFlag(Symbol.Flag.TASK_PARALLEL_INDEX);
      }
      stmts.add(new Stmt.Def(var));
      stmts.add(new Stmt.Move(var, value));
    } else if (pattern instanceof IndexPattern.Tuple tuple) {
      if (tuple.size() == 0) {
        throw LoweringError.contractViolation("empty tuple index pattern");
      }
      stmts.add(new Stmt.Eval(Expr.call(CHECK_TUPLE_SIZE, value, Expr.of(tuple.size()))));
      for (int i = 0; i < tuple.size(); i++) {
        destructure(tuple.elements.get(i), Expr.element(value, i), taskParallel, stmts);
      }
    }
    // Otherwise it's SKIP, and there's nothing to bind.
  }
}
