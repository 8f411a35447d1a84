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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * A cursor over an immutable token list. Tokens are consumed strictly from the front; a token
 * consumed by one parser is gone for every caller up the stack, which share the same cursor.
 */
public final class TokenStream {

  private final ImmutableList<Token> tokens;
  private int pos;

  public TokenStream(ImmutableList<Token> tokens) {
    this.tokens = tokens;
    this.pos = 0;
  }

  /** Returns true if every token has been consumed. */
  public boolean isEmpty() {
    return pos >= tokens.size();
  }

  /** Returns the number of unconsumed tokens. */
  public int remaining() {
    return tokens.size() - pos;
  }

  /** Returns the index of the next token; strictly increases as tokens are consumed. */
  public int position() {
    return pos;
  }

  /** Returns the next token without consuming it. The stream must not be empty. */
  public Token peek() {
    Preconditions.checkState(!isEmpty(), "token stream is exhausted");
    return tokens.get(pos);
  }

  /** Returns the token {@code offset} places ahead of the next one, or null past the end. */
  @Nullable
  public Token peek(int offset) {
    int i = pos + offset;
    return i < tokens.size() ? tokens.get(i) : null;
  }

  /** Returns true if the stream is not empty and the next token has the given kind. */
  public boolean nextIs(TokenKind kind) {
    return !isEmpty() && tokens.get(pos).getKind() == kind;
  }

  /** Consumes and returns the next token. The stream must not be empty. */
  public Token next() {
    Token token = peek();
    pos++;
    return token;
  }

  /**
   * Returns the location just past the last token, used to report errors at the end of input.
   */
  public Location endLocation() {
    if (tokens.isEmpty()) {
      return Location.fromFile("");
    }
    Token last = tokens.get(tokens.size() - 1);
    Location loc = last.getLocation();
    String spelling = last.getSpelling();
    int line = loc.line();
    int column = loc.column();
    for (int i = 0; i < spelling.length(); i++) {
      if (spelling.charAt(i) == '\n') {
        line++;
        column = 1;
      } else {
        column++;
      }
    }
    return Location.create(loc.file(), line, column, loc.offset() + spelling.length());
  }
}
