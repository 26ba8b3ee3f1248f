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

import com.google.common.collect.ImmutableList;
import java.util.stream.Collectors;

/**
 * An opaque annotation on a loop (e.g. {@code @unroll(4)}) that is carried through lowering for
 * the benefit of code generation.
 */
public record LoopAttribute(String name, ImmutableList<Expr> args) {
  @Override
  public String toString() {
    if (args.isEmpty()) {
      return "@" + name;
    }
    return args.stream()
        .map(Expr::toString)
        .collect(Collectors.joining(", ", "@" + name + "(", ")"));
  }
}
