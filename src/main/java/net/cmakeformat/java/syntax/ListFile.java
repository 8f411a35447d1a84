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
 * A parsed listfile: its tokens and the BODY tree built over them. The tree holds every token, so
 * {@code getBody().reconstruct()} equals the text that was parsed.
 */
public final class ListFile {

  private final String file;
  private final ImmutableList<Token> tokens;
  private final TreeNode body;

  private ListFile(String file, ImmutableList<Token> tokens, TreeNode body) {
    this.file = file;
    this.tokens = tokens;
    this.body = body;
  }

  /**
   * Scans and parses a listfile.
   *
   * @param input the text to parse
   * @param grammars supplies the argument grammar of each command
   * @throws SyntaxError.Exception if the input cannot be scanned or parsed; no partial tree is
   *     returned
   */
  public static ListFile parse(ParserInput input, CommandGrammars grammars)
      throws SyntaxError.Exception {
    ImmutableList<Token> tokens = Lexer.tokenize(input);
    TreeNode body = ListFileParser.parse(tokens, grammars);
    return new ListFile(input.getFile(), tokens, body);
  }

  /** Returns the apparent name of the parsed file. */
  public String getFile() {
    return file;
  }

  /** Returns every token of the file in order. */
  public ImmutableList<Token> getTokens() {
    return tokens;
  }

  public TreeNode getBody() {
    return body;
  }

  /**
   * Returns the top-level STATEMENT nodes in source order. Statements within a format-off region
   * are not parsed and not included.
   */
  public ImmutableList<TreeNode> getStatements() {
    ImmutableList.Builder<TreeNode> result = ImmutableList.builder();
    for (TreeNode child : body.getChildNodes()) {
      if (child.getKind() == NodeKind.STATEMENT) {
        result.add(child);
      }
    }
    return result.build();
  }

  /** Returns the reconstructed source text. */
  public String reconstruct() {
    return body.reconstruct();
  }
}
