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

import net.cmakeformat.java.syntax.LintSink;
import net.cmakeformat.java.syntax.Location;

/** TeeLintSink forwards records to two delegate LintSinks. */
public final class TeeLintSink implements LintSink {
  private final LintSink delegate1;
  private final LintSink delegate2;

  public TeeLintSink(LintSink delegate1, LintSink delegate2) {
    this.delegate1 = delegate1;
    this.delegate2 = delegate2;
  }

  @Override
  public void record(String lintId, String payload, Location location) {
    delegate1.record(lintId, payload, location);
    delegate2.record(lintId, payload, location);
  }
}
