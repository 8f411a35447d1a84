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

/** The closed set of kinds of {@link TreeNode}. */
public enum NodeKind {
  /** The top-level node of a listfile. */
  BODY,
  /** A command invocation: name, parentheses and argument tree. */
  STATEMENT,
  /** The command name of a statement. */
  FUNNAME,
  /** A region between format-off and format-on markers, kept verbatim. */
  ONOFFSWITCH,
  /** A group of groups; the argument tree of a statement or of a keyword. */
  ARGGROUP,
  /** A keyword and its value tree. */
  KWARGGROUP,
  /** A run of positional arguments. */
  PARGGROUP,
  /** A parenthesized conditional sub-expression. */
  PARENGROUP,
  KEYWORD,
  ARGUMENT,
  FLAG,
  COMMENT,
  LPAREN,
  RPAREN
}
