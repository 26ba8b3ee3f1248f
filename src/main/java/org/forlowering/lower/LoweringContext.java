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

import org.forlowering.ast.Label;
import org.forlowering.ast.Symbol;

/**
 * Per-compilation-unit state shared by the lowering components: the options and the counter used
 * to give each new Symbol and Label a unique id.
 *
 * <p>Not thread-safe; each compilation unit is lowered by a single thread with its own context.
 */
public final class LoweringContext {

  public final LoweringOptions options;

  /** The id of the most recently created Symbol or Label. */
  private int lastId;

  public LoweringContext(LoweringOptions options) {
    this.options = options;
  }

  /** Returns a new compiler temporary with the given name and flags. */
  public Symbol newTemp(String name, Symbol.Flag... flags) {
    Symbol result = new Symbol(name, ++lastId, /* isTemp= */ true);
    for (Symbol.Flag flag : flags) {
      result.addFlag(flag);
    }
    return result;
  }

  /** Returns a new user-visible variable. */
  public Symbol newVar(String name) {
    return new Symbol(name, ++lastId, /* isTemp= */ false);
  }

  public Label newLabel(String name) {
    return new Label(name, ++lastId);
  }
}
