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

package net.cmakeformat.java.lint;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import net.cmakeformat.java.syntax.Location;

/** A single non-fatal diagnostic: its id, its argument and where it applies. */
@AutoValue
public abstract class LintRecord {

  /** A keyword the command cannot work without is missing. The payload is the keyword. */
  public static final String MISSING_REQUIRED_KEYWORD = "E1125";

  private static final ImmutableMap<String, String> MESSAGES =
      ImmutableMap.of(MISSING_REQUIRED_KEYWORD, "Missing required keyword argument %s");

  public abstract String lintId();

  public abstract String payload();

  public abstract Location location();

  public static LintRecord create(String lintId, String payload, Location location) {
    return new AutoValue_LintRecord(lintId, payload, location);
  }

  /** Returns a human-readable description, or the payload alone for an unknown id. */
  public final String message() {
    String format = MESSAGES.get(lintId());
    return format == null ? payload() : String.format(format, payload());
  }

  /** Returns a string of the form {@code "foo.cmake:1:2: [E1125] Missing ..."}. */
  @Override
  public final String toString() {
    return location() + ": [" + lintId() + "] " + message();
  }
}
