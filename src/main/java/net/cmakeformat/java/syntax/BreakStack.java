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

import com.google.common.collect.ImmutableList;

/**
 * An immutable stack of {@link Breaker}s. A nested parser receives its caller's stack with its own
 * breaker pushed on top, so a token that would end any enclosing group also ends the innermost one.
 */
public final class BreakStack {

  private static final BreakStack EMPTY = new BreakStack(ImmutableList.of());

  private final ImmutableList<Breaker> breakers; // outermost first

  private BreakStack(ImmutableList<Breaker> breakers) {
    this.breakers = breakers;
  }

  /** Returns the stack that never breaks. */
  public static BreakStack empty() {
    return EMPTY;
  }

  /** Returns a stack holding only the given breaker. */
  public static BreakStack of(Breaker breaker) {
    return EMPTY.push(breaker);
  }

  /** Returns a new stack with {@code breaker} on top of this one. */
  public BreakStack push(Breaker breaker) {
    return new BreakStack(
        ImmutableList.<Breaker>builderWithExpectedSize(breakers.size() + 1)
            .addAll(breakers)
            .add(breaker)
            .build());
  }

  /** Returns true if any breaker in the stack matches {@code token}. */
  public boolean shouldBreak(Token token) {
    for (int i = breakers.size() - 1; i >= 0; i--) {
      if (breakers.get(i).matches(token)) {
        return true;
      }
    }
    return false;
  }

  public ImmutableList<Breaker> getBreakers() {
    return breakers;
  }

  @Override
  public String toString() {
    return breakers.toString();
  }
}
