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

import com.google.auto.value.AutoValue;
import java.util.List;
import java.util.Locale;
import javax.annotation.Nullable;

/** An immutable lexical token: its kind, exact source text and location. */
@AutoValue
public abstract class Token implements TreeElement {

  public abstract TokenKind getKind();

  /** Returns the exact source text of the token. */
  public abstract String getSpelling();

  public abstract Location getLocation();

  public static Token create(TokenKind kind, String spelling, Location location) {
    return new AutoValue_Token(kind, spelling, location);
  }

  /**
   * Returns the upper-cased spelling if this token is a bare word or unquoted literal, which is the
   * form used to match keywords and flags such as {@code @ONLY}; otherwise returns null.
   */
  @Nullable
  public final String getNormalizedWord() {
    TokenKind kind = getKind();
    return kind == TokenKind.WORD || kind == TokenKind.UNQUOTED_LITERAL
        ? getSpelling().toUpperCase(Locale.ROOT)
        : null;
  }

  /** Returns true if this token is neither whitespace nor a comment. */
  public final boolean isSemantic() {
    return !getKind().isWhitespace() && !getKind().isComment();
  }

  @Override
  public final Location getStartLocation() {
    return getLocation();
  }

  @Override
  public final void collectTokens(List<Token> out) {
    out.add(this);
  }

  @Override
  public final String toString() {
    return getKind().name() + "(" + getSpelling() + ")@" + getLocation();
  }
}
