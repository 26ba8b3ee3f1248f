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

/**
 * Declares how a variable captured by a parallel loop is shared with each task, e.g. {@code ref x}
 * or {@code const in y}. Lowering relocates intents onto the {@link LoweredLoop} without
 * interpreting {@code mode}.
 */
public record TaskIntent(String mode, String variable) {
  @Override
  public String toString() {
    return mode.isEmpty() ? variable : mode + " " + variable;
  }
}
