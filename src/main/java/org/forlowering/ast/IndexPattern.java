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
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The user-visible loop index: a single name, a placeholder, or a (possibly nested) tuple of
 * patterns that destructures a tuple-valued element.
 */
public abstract class IndexPattern {

  private IndexPattern() {}

  /** The only Skip instance. */
  public static final IndexPattern SKIP = new Skip();

  public static Bind bind(String name) {
    return new Bind(name);
  }

  /** Returns a tuple pattern; callers must supply at least one element. */
  public static Tuple tuple(List<IndexPattern> elements) {
    return new Tuple(ImmutableList.copyOf(elements));
  }

  public static Tuple tuple(IndexPattern... elements) {
    return new Tuple(ImmutableList.copyOf(elements));
  }

  /** Binds the whole value to a new variable. */
  public static final class Bind extends IndexPattern {
    public final String name;

    Bind(String name) {
      Preconditions.checkArgument(!name.isEmpty());
      this.name = name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** Matches any value without binding it ({@code _} in a tuple pattern). */
  public static final class Skip extends IndexPattern {
    private Skip() {}

    @Override
    public String toString() {
      return "_";
    }
  }

  /** Destructures a tuple value, binding each element with the corresponding pattern. */
  public static final class Tuple extends IndexPattern {
    public final ImmutableList<IndexPattern> elements;

    Tuple(ImmutableList<IndexPattern> elements) {
      this.elements = elements;
    }

    public int size() {
      return elements.size();
    }

    @Override
    public String toString() {
      return elements.stream()
          .map(IndexPattern::toString)
          .collect(Collectors.joining(", ", "(", ")"));
    }
  }
}
