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

/**
 * An append-only receiver of non-fatal diagnostics. Checks over the tree record into a sink and
 * never read from it.
 */
public interface LintSink {

  /**
   * Records one diagnostic.
   *
   * @param lintId the diagnostic identifier, such as {@code E1125}
   * @param payload the diagnostic argument, such as the name of a missing keyword
   * @param location where the diagnostic applies
   */
  void record(String lintId, String payload, Location location);
}
