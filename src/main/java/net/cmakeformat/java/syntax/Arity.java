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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The number of positional values a group may consume: an exact count, or one of {@code ?}
 * (zero or one), {@code *} (zero or more) and {@code +} (one or more).
 */
public final class Arity {

  private enum Form {
    EXACT,
    ZERO_OR_ONE,
    ZERO_OR_MORE,
    ONE_OR_MORE
  }

  public static final Arity ZERO_OR_ONE = new Arity(Form.ZERO_OR_ONE, -1);
  public static final Arity ZERO_OR_MORE = new Arity(Form.ZERO_OR_MORE, -1);
  public static final Arity ONE_OR_MORE = new Arity(Form.ONE_OR_MORE, -1);

  private static final Arity[] SMALL = {
    new Arity(Form.EXACT, 0), new Arity(Form.EXACT, 1), new Arity(Form.EXACT, 2),
    new Arity(Form.EXACT, 3)
  };

  private final Form form;
  private final int count; // meaningful only for EXACT

  private Arity(Form form, int count) {
    this.form = form;
    this.count = count;
  }

  /** Returns the arity that consumes exactly {@code n} values. */
  public static Arity exactly(int n) {
    checkArgument(n >= 0, "negative arity: %s", n);
    return n < SMALL.length ? SMALL[n] : new Arity(Form.EXACT, n);
  }

  /**
   * Parses the textual form of an arity: a non-negative integer, {@code ?}, {@code *} or {@code
   * +}.
   *
   * @throws IllegalArgumentException if the text is none of these
   */
  public static Arity parse(String text) {
    switch (text) {
      case "?":
        return ZERO_OR_ONE;
      case "*":
        return ZERO_OR_MORE;
      case "+":
        return ONE_OR_MORE;
      default:
        try {
          return exactly(Integer.parseInt(text));
        } catch (NumberFormatException ex) {
          throw new IllegalArgumentException("invalid arity: '" + text + "'", ex);
        }
    }
  }

  /** Returns true if this arity is an exact count. */
  public boolean isExact() {
    return form == Form.EXACT;
  }

  /** Returns the exact count; only valid if {@link #isExact}. */
  public int getCount() {
    checkArgument(isExact(), "arity %s is not exact", this);
    return count;
  }

  /** Returns true if a group that has consumed {@code consumed} values may take no more. */
  public boolean isFull(int consumed) {
    switch (form) {
      case EXACT:
        return consumed >= count;
      case ZERO_OR_ONE:
        return consumed >= 1;
      default:
        return false;
    }
  }

  @Override
  public boolean equals(Object that) {
    if (this == that) {
      return true;
    }
    if (!(that instanceof Arity)) {
      return false;
    }
    Arity other = (Arity) that;
    return form == other.form && count == other.count;
  }

  @Override
  public int hashCode() {
    return 31 * form.hashCode() + count;
  }

  @Override
  public String toString() {
    switch (form) {
      case ZERO_OR_ONE:
        return "?";
      case ZERO_OR_MORE:
        return "*";
      case ONE_OR_MORE:
        return "+";
      default:
        return Integer.toString(count);
    }
  }
}
