// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.cmakeformat.java.syntax;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Locale;

/**
 * A Breaker is a predicate over the next unconsumed token that tells a group parser to stop and
 * return control to its caller. Breakers are stacked in a {@link BreakStack}.
 */
public interface Breaker {

  /** Returns true if {@code token} should end the group being parsed. */
  boolean matches(Token token);

  /** Returns a breaker that matches the given keyword or flag spellings, case-insensitively. */
  static Breaker keywords(Collection<String> words) {
    return new KeywordBreaker(words);
  }

  /** Returns a breaker that matches a right parenthesis. */
  static Breaker paren() {
    return ParenBreaker.INSTANCE;
  }

  /** Matches a bare word or unquoted literal whose normalized spelling is one of a fixed set. */
  final class KeywordBreaker implements Breaker {
    private final ImmutableSet<String> words;

    KeywordBreaker(Collection<String> words) {
      ImmutableSet.Builder<String> normalized = ImmutableSet.builder();
      for (String word : words) {
        normalized.add(word.toUpperCase(Locale.ROOT));
      }
      this.words = normalized.build();
    }

    @Override
    public boolean matches(Token token) {
      String word = token.getNormalizedWord();
      return word != null && words.contains(word);
    }

    @Override
    public String toString() {
      return "KeywordBreaker[" + Joiner.on(' ').join(words) + "]";
    }
  }

  /** Matches the right parenthesis that closes an enclosing group. */
  final class ParenBreaker implements Breaker {
    static final ParenBreaker INSTANCE = new ParenBreaker();

    private ParenBreaker() {}

    @Override
    public boolean matches(Token token) {
      return token.getKind() == TokenKind.RIGHT_PAREN;
    }

    @Override
    public String toString() {
      return "ParenBreaker";
    }
  }
}
