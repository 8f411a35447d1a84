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
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * ArgumentParser is a recursive-descent parser for the argument list of a command invocation. It
 * interprets an {@link ArgGrammar} against a {@link TokenStream}, and stops where the {@link
 * BreakStack} of its caller says the enclosing construct resumes.
 *
 * <p>Every parse method appends whitespace and comments at the depth where they are met, so the
 * resulting tree reproduces the consumed tokens exactly.
 */
public final class ArgumentParser {

  /** The unary and binary operators of conditional expressions, parsed as flags. */
  public static final ImmutableSet<String> CONDITIONAL_FLAGS =
      ImmutableSet.of(
          "COMMAND",
          "DEFINED",
          "EQUAL",
          "EXISTS",
          "GREATER",
          "GREATER_EQUAL",
          "IN_LIST",
          "IS_ABSOLUTE",
          "IS_DIRECTORY",
          "IS_NEWER_THAN",
          "IS_SYMLINK",
          "LESS",
          "LESS_EQUAL",
          "MATCHES",
          "NOT",
          "POLICY",
          "STREQUAL",
          "STRGREATER",
          "STRGREATER_EQUAL",
          "STRLESS",
          "STRLESS_EQUAL",
          "TARGET",
          "TEST",
          "VERSION_EQUAL",
          "VERSION_GREATER",
          "VERSION_GREATER_EQUAL",
          "VERSION_LESS",
          "VERSION_LESS_EQUAL");

  // AND and OR each take another conditional expression as their value.
  private static final ImmutableMap<String, ArgGrammar> CONDITIONAL_KEYWORDS =
      ImmutableMap.of("AND", ArgGrammar.conditional(), "OR", ArgGrammar.conditional());

  private static final Breaker CONDITIONAL_BREAKER =
      Breaker.keywords(CONDITIONAL_KEYWORDS.keySet());

  private static final ImmutableSet<String> SORTABLE_TAGS = ImmutableSet.of("sortable", "sort");
  private static final ImmutableSet<String> UNSORTABLE_TAGS =
      ImmutableSet.of("unsortable", "unsort");

  private final TokenStream tokens;

  public ArgumentParser(TokenStream tokens) {
    this.tokens = tokens;
  }

  /**
   * Parses a tree of the given grammar from the front of the stream.
   *
   * @throws SyntaxError.Exception if a parenthetical group is not closed
   */
  public TreeNode parse(ArgGrammar grammar, BreakStack breakStack) throws SyntaxError.Exception {
    switch (grammar.getKind()) {
      case STANDARD:
        return parseStandard(grammar, breakStack);
      case POSITIONAL:
        return parsePositional(
            grammar.getArity(), grammar.getFlags(), grammar.isSortable(), breakStack);
      case CONDITIONAL:
        return parseConditional(breakStack);
    }
    throw new AssertionError(grammar.getKind());
  }

  // A standard tree is a positional run, followed by keywords with their values, followed by
  // flags, in any interleaving:
  //
  //   command_name(parg1 parg2 parg3...
  //                KEYWORD1 kwarg1 kwarg2...
  //                KEYWORD2 kwarg3 kwarg4...
  //                FLAG1 FLAG2 FLAG3)
  //
  // The keyword breakstack also stops at flags so that a keyword's values end where a flag of this
  // command begins; the positional breakstack does not, since flags are positional-looking tokens.
  private TreeNode parseStandard(ArgGrammar grammar, BreakStack breakStack)
      throws SyntaxError.Exception {
    TreeNode tree = newNode(NodeKind.ARGGROUP);
    consumeWhitespace(tree);

    Map<String, ArgGrammar> keywords = grammar.getKeywords();
    BreakStack keywordBreakStack =
        breakStack.push(Breaker.keywords(Sets.union(keywords.keySet(), grammar.getFlags())));
    BreakStack positionalBreakStack = breakStack.push(Breaker.keywords(keywords.keySet()));

    while (!tokens.isEmpty()) {
      Token token = tokens.peek();
      if (breakStack.shouldBreak(token)) {
        break;
      }
      if (token.getKind().isWhitespace()) {
        tree.addChild(tokens.next());
        continue;
      }
      if (isComment(token.getKind())) {
        TreeNode comment = newNode(NodeKind.COMMENT);
        comment.addChild(tokens.next());
        tree.addChild(comment);
        continue;
      }

      int before = tokens.position();
      String word = token.getNormalizedWord();
      if (word != null && keywords.containsKey(word)) {
        tree.addKeywordGroup(parseKeywordGroup(word, keywords.get(word), keywordBreakStack));
      } else {
        tree.addPositionalGroup(
            parsePositional(
                grammar.getArity(),
                grammar.getFlags(),
                grammar.isSortable(),
                positionalBreakStack));
      }
      verifyProgress(before, token);
    }
    return tree;
  }

  /**
   * Parses a continuous run of positional arguments. With an exact arity, exactly that many
   * arguments are consumed unless a right parenthesis intervenes; otherwise {@code ?} takes at most
   * one, and {@code *} and {@code +} take arguments until the breakstack matches.
   */
  TreeNode parsePositional(
      Arity arity, Set<String> flags, boolean sortable, BreakStack breakStack)
      throws SyntaxError.Exception {
    TreeNode tree = newNode(NodeKind.PARGGROUP);
    tree.setSpec(PositionalSpec.create(arity, ImmutableSet.copyOf(flags)));
    tree.setSortable(sortable);
    consumeWhitespace(tree);

    if (!tokens.isEmpty()) {
      String tag = getTag(tokens.peek());
      if (tag != null && SORTABLE_TAGS.contains(tag)) {
        tree.setSortable(true);
      } else if (tag != null && UNSORTABLE_TAGS.contains(tag)) {
        tree.setSortable(false);
      }
    }

    int consumed = 0;
    while (!tokens.isEmpty()) {
      if (arity.isFull(consumed)) {
        break;
      }

      Token token = tokens.peek();
      if (breakStack.shouldBreak(token)) {
        // With an exact arity a word that matches an enclosing keyword is still taken as a value,
        // as in install(TARGETS t RUNTIME COMPONENT runtime) where the second "runtime" is the
        // value of COMPONENT. A right parenthesis always ends the group.
        if (!arity.isExact() || token.getKind() == TokenKind.RIGHT_PAREN) {
          break;
        }
      }

      // Not sanctioned by every command, but accepted by cmake.
      if (token.getKind() == TokenKind.LEFT_PAREN) {
        tree.addChild(parseParenGroup());
        continue;
      }
      if (token.getKind().isWhitespace()) {
        tree.addChild(tokens.next());
        continue;
      }
      if (isComment(token.getKind())) {
        tree.addChild(consumeCommentBlock());
        continue;
      }

      String word = token.getNormalizedWord();
      TreeNode child =
          newNode(word != null && flags.contains(word) ? NodeKind.FLAG : NodeKind.ARGUMENT);
      child.addChild(tokens.next());
      consumeTrailingComment(child);
      tree.addChild(child);
      consumed++;
    }
    return tree;
  }

  /**
   * Parses a keyword and its values. The caller has checked that the next token is {@code word}.
   */
  TreeNode parseKeywordGroup(String word, ArgGrammar values, BreakStack breakStack)
      throws SyntaxError.Exception {
    Token token = tokens.peek();
    Preconditions.checkState(
        word.equals(token.getNormalizedWord()),
        "dispatched keyword %s on %s at %s",
        word,
        token.getSpelling(),
        token.getLocation());

    TreeNode tree = newNode(NodeKind.KWARGGROUP);
    TreeNode keyword = newNode(NodeKind.KEYWORD);
    keyword.addChild(tokens.next());
    tree.setKeyword(keyword);
    consumeWhitespace(tree);

    int before = tokens.position();
    TreeNode body = parse(values, breakStack);
    if (tokens.position() > before) {
      tree.setBody(body);
    }
    return tree;
  }

  /**
   * Parses a parenthesized conditional expression. The next token must be a left parenthesis.
   * Keywords of enclosing groups do not end the expression; only its own right parenthesis does.
   *
   * @throws SyntaxError.Exception if the closing parenthesis is missing
   */
  TreeNode parseParenGroup() throws SyntaxError.Exception {
    Preconditions.checkState(tokens.nextIs(TokenKind.LEFT_PAREN));
    TreeNode tree = newNode(NodeKind.PARENGROUP);
    TreeNode lparen = newNode(NodeKind.LPAREN);
    lparen.addChild(tokens.next());
    tree.addChild(lparen);

    tree.addChild(parseConditional(BreakStack.of(Breaker.paren())));

    TreeNode rparen = newNode(NodeKind.RPAREN);
    rparen.addChild(expect(TokenKind.RIGHT_PAREN));
    tree.addChild(rparen);

    // Parenthetical groups can take a trailing comment because they end with punctuation.
    consumeTrailingComment(tree);
    return tree;
  }

  // Conditional expressions, as in
  //
  //   while(CONDITION1 AND (CONDITION2 OR CONDITION3)
  //         OR (CONDITION3 AND (CONDITION4 AND CONDITION5))
  //         OR CONDITION6)
  //
  // AND and OR are keywords whose values are another conditional expression, so a chain nests to
  // the right. Operators such as STREQUAL are flags within a flat positional run.
  TreeNode parseConditional(BreakStack breakStack) throws SyntaxError.Exception {
    TreeNode tree = newNode(NodeKind.ARGGROUP);
    consumeWhitespace(tree);
    BreakStack childBreakStack = breakStack.push(CONDITIONAL_BREAKER);

    while (!tokens.isEmpty()) {
      Token token = tokens.peek();
      if (breakStack.shouldBreak(token)) {
        break;
      }
      if (token.getKind().isWhitespace()) {
        tree.addChild(tokens.next());
        continue;
      }
      if (isComment(token.getKind())) {
        TreeNode comment = newNode(NodeKind.COMMENT);
        comment.addChild(tokens.next());
        tree.addChild(comment);
        continue;
      }
      if (token.getKind() == TokenKind.LEFT_PAREN) {
        tree.addChild(parseParenGroup());
        continue;
      }

      int before = tokens.position();
      String word = token.getNormalizedWord();
      if (word != null && CONDITIONAL_KEYWORDS.containsKey(word)) {
        tree.addChild(parseKeywordGroup(word, CONDITIONAL_KEYWORDS.get(word), childBreakStack));
      } else {
        tree.addChild(
            parsePositional(Arity.ONE_OR_MORE, CONDITIONAL_FLAGS, false, childBreakStack));
      }
      verifyProgress(before, token);
    }
    return tree;
  }

  // --- comments ---

  /**
   * Consumes a comment block: a bracket comment, or a line comment together with the comment lines
   * that directly follow it (separated by a single newline and optional indentation).
   */
  TreeNode consumeCommentBlock() {
    TreeNode node = newNode(NodeKind.COMMENT);
    Token first = tokens.next();
    node.addChild(first);
    if (first.getKind() == TokenKind.BRACKET_COMMENT) {
      return node;
    }
    while (true) {
      int ahead = 0;
      Token newline = tokens.peek(ahead);
      if (newline == null || newline.getKind() != TokenKind.NEWLINE) {
        break;
      }
      ahead++;
      Token next = tokens.peek(ahead);
      if (next != null && next.getKind() == TokenKind.WHITESPACE) {
        ahead++;
        next = tokens.peek(ahead);
      }
      if (next == null || next.getKind() != TokenKind.COMMENT) {
        break;
      }
      for (int i = 0; i <= ahead; i++) {
        node.addChild(tokens.next());
      }
    }
    return node;
  }

  /**
   * If the next tokens are a comment on the same line, optionally preceded by whitespace, consumes
   * them as children of {@code parent}. Otherwise consumes nothing.
   */
  void consumeTrailingComment(TreeNode parent) {
    Token next = tokens.peek(0);
    int ahead = 0;
    if (next != null && next.getKind() == TokenKind.WHITESPACE) {
      ahead = 1;
      next = tokens.peek(1);
    }
    if (next == null || !next.getKind().isComment()) {
      return;
    }
    if (ahead == 1) {
      parent.addChild(tokens.next());
    }
    parent.addChild(consumeCommentBlock());
  }

  /**
   * Returns the directive of a {@code # cmake-format: <tag>} comment, or null if the token is not
   * such a comment.
   */
  @Nullable
  static String getTag(Token token) {
    if (token.getKind() != TokenKind.COMMENT) {
      return null;
    }
    String content = token.getSpelling().trim().substring(1).trim();
    for (String prefix : new String[] {"cmake-format:", "cmf:"}) {
      if (content.startsWith(prefix)) {
        return content.substring(prefix.length()).trim();
      }
    }
    return null;
  }

  // --- helpers ---

  // Format markers inside an argument list have no effect and are kept as comments.
  private static boolean isComment(TokenKind kind) {
    return kind.isComment() || kind == TokenKind.FORMAT_OFF || kind == TokenKind.FORMAT_ON;
  }

  private void consumeWhitespace(TreeNode tree) {
    while (!tokens.isEmpty() && tokens.peek().getKind().isWhitespace()) {
      tree.addChild(tokens.next());
    }
  }

  Token expect(TokenKind kind) throws SyntaxError.Exception {
    if (tokens.isEmpty()) {
      throw new SyntaxError.Exception(
          tokens.endLocation(), "unexpected end of input, expected '" + kind + "'");
    }
    Token token = tokens.peek();
    if (token.getKind() != kind) {
      throw new SyntaxError.Exception(
          token.getLocation(),
          String.format("unexpected '%s', expected '%s'", token.getSpelling(), kind));
    }
    return tokens.next();
  }

  // Every dispatch must consume at least one token, or the enclosing loop would never end. A
  // violation means the grammar table is broken, not that the input is wrong.
  private void verifyProgress(int before, Token token) {
    Verify.verify(
        tokens.position() > before,
        "parsed an empty subtree at %s (%s token '%s')",
        token.getLocation(),
        token.getKind(),
        token.getSpelling());
  }

  TreeNode newNode(NodeKind kind) {
    return new TreeNode(
        kind, tokens.isEmpty() ? tokens.endLocation() : tokens.peek().getLocation());
  }
}
