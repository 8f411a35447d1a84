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

import com.google.common.flogger.GoogleLogger;
import java.util.LinkedHashMap;
import java.util.Map;
import net.cmakeformat.java.syntax.ArgGrammar;
import net.cmakeformat.java.syntax.CommandGrammars;
import net.cmakeformat.java.syntax.LintSink;
import net.cmakeformat.java.syntax.ListFile;
import net.cmakeformat.java.syntax.TreeNode;

/**
 * Reports commands that omit a keyword their grammar declares required. Statements are checked in
 * source order, so records appear in source order too.
 */
public final class RequiredKeywordLinter {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private RequiredKeywordLinter() {}

  /** Checks every statement of {@code file} and records each missing keyword on {@code sink}. */
  public static void check(ListFile file, CommandGrammars grammars, LintSink sink) {
    int checked = 0;
    for (TreeNode statement : file.getStatements()) {
      ArgGrammar grammar = grammars.lookup(statement.getCommandName().getSpelling());
      if (grammar.getRequiredKeywords().isEmpty()) {
        continue;
      }
      Map<String, String> required = new LinkedHashMap<>(grammar.getRequiredKeywords());
      statement.getArgTree().checkRequiredKwargs(sink, required);
      checked++;
    }
    logger.atFine().log("%s: checked required keywords of %d statements", file.getFile(), checked);
  }
}
