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

package net.cmakeformat.java.config;

import com.google.common.collect.ImmutableSet;
import java.util.Locale;

/** Interprets the many spellings of yes and no that configuration files use. */
public final class BooleanParser {

  private static final ImmutableSet<String> TRUE_WORDS =
      ImmutableSet.of("y", "yes", "t", "true", "1", "yup", "yeah", "yada");
  private static final ImmutableSet<String> FALSE_WORDS =
      ImmutableSet.of("n", "no", "f", "false", "0", "nope", "nah", "nada");

  private BooleanParser() {}

  /**
   * Returns the truth value of {@code text}, compared case-insensitively. Text that is neither a
   * yes nor a no word is false, and a warning naming it goes to {@code warnings}.
   */
  public static boolean parse(String text, WarningSink warnings) {
    String word = text.toLowerCase(Locale.ROOT);
    if (TRUE_WORDS.contains(word)) {
      return true;
    }
    if (FALSE_WORDS.contains(word)) {
      return false;
    }
    warnings.warn(String.format("Ambiguous truthiness of string '%s' evaluates to 'FALSE'", text));
    return false;
  }
}
