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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.cmakeformat.java.syntax.LintSink;
import net.cmakeformat.java.syntax.Location;

/** A LintSink that keeps every record in memory, in the order recorded. */
public final class LintCollector implements LintSink {

  private final List<LintRecord> records = new ArrayList<>();

  @Override
  public void record(String lintId, String payload, Location location) {
    records.add(LintRecord.create(lintId, payload, location));
  }

  public ImmutableList<LintRecord> getRecords() {
    return ImmutableList.copyOf(records);
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }
}
