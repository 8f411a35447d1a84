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

/** A TokenKind is the kind of a lexical token of a listfile. */
public enum TokenKind {
  BRACKET_ARGUMENT("bracket argument"),
  BRACKET_COMMENT("bracket comment"),
  BYTEORDER_MARK("byte-order mark"),
  COMMENT("comment"),
  DEREF("variable reference"),
  FORMAT_OFF("format-off marker"),
  FORMAT_ON("format-on marker"),
  LEFT_PAREN("("),
  NEWLINE("newline"),
  NUMBER("number"),
  QUOTED_LITERAL("quoted literal"),
  RIGHT_PAREN(")"),
  UNQUOTED_LITERAL("unquoted literal"),
  WHITESPACE("whitespace"),
  WORD("word");

  private final String name;

  private TokenKind(String name) {
    this.name = name;
  }

  /** Returns true for the kinds that carry no meaning and are kept only for reconstruction. */
  public boolean isWhitespace() {
    return this == WHITESPACE || this == NEWLINE;
  }

  /** Returns true for line and bracket comments. */
  public boolean isComment() {
    return this == COMMENT || this == BRACKET_COMMENT;
  }

  @Override
  public String toString() {
    return name;
  }
}
