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

import com.google.common.base.Preconditions;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A Symbol is a variable introduced by lowering: either a compiler temporary (such as the
 * iteration handle) or a user-visible index variable bound by destructuring.
 *
 * <p>Symbols are compared by identity. Flags are the one mutable part of a Symbol; later passes
 * read them to classify how the symbol is used.
 */
public final class Symbol {

  /** Classification flags that lowering attaches to the symbols it creates. */
  public enum Flag {
    /** A compiler temporary holding an intermediate value (e.g. an iteration handle). */
    EXPR_TEMP,

    /** The temporary that receives each value produced by a loop's iteration handle. */
    INDEX_OF_INTEREST,

    /** A user-visible variable bound from the index of interest. */
    INDEX_VAR,

    /**
     * The index of a task-parallel loop; later passes pass it as the argument of the task spawned
     * for each iteration.
     */
    TASK_PARALLEL_INDEX
  }

  public final String name;

  /** Unique within a compilation unit; assigned in creation order. */
  public final int id;

  /** True for compiler temporaries, whose printed form includes the id. */
  public final boolean isTemp;

  private final EnumSet<Flag> flags = EnumSet.noneOf(Flag.class);

  public Symbol(String name, int id, boolean isTemp) {
    Preconditions.checkArgument(!name.isEmpty());
    this.name = name;
    this.id = id;
    this.isTemp = isTemp;
  }

  public void addFlag(Flag flag) {
    flags.add(flag);
  }

  public boolean hasFlag(Flag flag) {
    return flags.contains(flag);
  }

  /** Returns an unmodifiable view of this symbol's flags, in declaration order. */
  public Set<Flag> flags() {
    return Collections.unmodifiableSet(flags);
  }

  /** Returns the flags formatted for printing, e.g. {@code "(EXPR_TEMP)"}, or an empty string. */
  String flagsString() {
    if (flags.isEmpty()) {
      return "";
    }
    return flags.stream().map(Flag::name).collect(Collectors.joining(", ", " (", ")"));
  }

  @Override
  public String toString() {
    return isTemp ? name + "#" + id : name;
  }
}
