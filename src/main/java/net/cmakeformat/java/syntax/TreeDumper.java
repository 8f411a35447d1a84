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

import java.util.List;

/**
 * Renders a tree as indented text, one node or token per line. Used by the command-line tool and
 * by tests that compare tree shapes.
 *
 * <pre>
 * BODY 1:1
 *   STATEMENT 1:1
 *     FUNNAME 1:1
 *       WORD "set" 1:1
 * </pre>
 */
public final class TreeDumper {

  private final StringBuilder out = new StringBuilder();
  private final boolean includeWhitespace;

  private TreeDumper(boolean includeWhitespace) {
    this.includeWhitespace = includeWhitespace;
  }

  /** Returns the dump of a tree, omitting whitespace and newline tokens. */
  public static String dump(TreeNode root) {
    return dump(root, false);
  }

  /** Returns the dump of a tree, optionally including whitespace and newline tokens. */
  public static String dump(TreeNode root, boolean includeWhitespace) {
    TreeDumper dumper = new TreeDumper(includeWhitespace);
    dumper.node(root, 0);
    return dumper.out.toString();
  }

  /** Returns one line per token: kind, position and quoted spelling. */
  public static String dumpTokens(List<Token> tokens) {
    TreeDumper dumper = new TreeDumper(true);
    for (Token token : tokens) {
      dumper.token(token, 0);
    }
    return dumper.out.toString();
  }

  private void node(TreeNode node, int depth) {
    indent(depth);
    out.append(node.getKind()).append(' ');
    position(node.getStartLocation());
    if (node.getKind() == NodeKind.PARGGROUP) {
      out.append(" [").append(node.getSpec().arity());
      if (node.isSortable()) {
        out.append(", sortable");
      }
      out.append(']');
    }
    out.append('\n');
    for (TreeElement child : node.getChildren()) {
      if (child instanceof TreeNode) {
        node((TreeNode) child, depth + 1);
      } else {
        Token token = (Token) child;
        if (includeWhitespace || !token.getKind().isWhitespace()) {
          token(token, depth + 1);
        }
      }
    }
  }

  private void token(Token token, int depth) {
    indent(depth);
    out.append(token.getKind().name()).append(' ');
    quote(token.getSpelling());
    out.append(' ');
    position(token.getLocation());
    out.append('\n');
  }

  private void indent(int depth) {
    for (int i = 0; i < depth; i++) {
      out.append("  ");
    }
  }

  private void position(Location loc) {
    out.append(loc.line()).append(':').append(loc.column());
  }

  private void quote(String s) {
    out.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\n':
          out.append("\\n");
          break;
        case '\r':
          out.append("\\r");
          break;
        case '\t':
          out.append("\\t");
          break;
        case '"':
        case '\\':
          out.append('\\').append(c);
          break;
        default:
          out.append(c);
      }
    }
    out.append('"');
  }
}
