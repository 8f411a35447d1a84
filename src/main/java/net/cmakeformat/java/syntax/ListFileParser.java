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
import com.google.common.flogger.GoogleLogger;

/**
 * ListFileParser parses the body of a listfile: a sequence of command invocations separated by
 * whitespace and comments. The arguments of each command are parsed by {@link ArgumentParser}
 * with the grammar the {@link CommandGrammars} supplies for it.
 */
final class ListFileParser {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final TokenStream tokens;
  private final CommandGrammars grammars;
  private final ArgumentParser args;

  private ListFileParser(TokenStream tokens, CommandGrammars grammars) {
    this.tokens = tokens;
    this.grammars = grammars;
    this.args = new ArgumentParser(tokens);
  }

  /** Parses the whole token list into a BODY tree. */
  static TreeNode parse(ImmutableList<Token> tokens, CommandGrammars grammars)
      throws SyntaxError.Exception {
    ListFileParser parser = new ListFileParser(new TokenStream(tokens), grammars);
    TreeNode body = parser.parseBody();
    logger.atFine().log(
        "parsed %d tokens into %d top-level children", tokens.size(), body.getChildren().size());
    return body;
  }

  private TreeNode parseBody() throws SyntaxError.Exception {
    TreeNode body = args.newNode(NodeKind.BODY);
    while (!tokens.isEmpty()) {
      Token token = tokens.peek();
      switch (token.getKind()) {
        case WHITESPACE:
        case NEWLINE:
        case BYTEORDER_MARK:
          body.addChild(tokens.next());
          break;
        case COMMENT:
        case BRACKET_COMMENT:
          body.addChild(args.consumeCommentBlock());
          break;
        case FORMAT_OFF:
          body.addChild(parseFormatOff());
          break;
        case FORMAT_ON:
          // An "on" marker without a preceding "off" is an ordinary comment.
          TreeNode comment = args.newNode(NodeKind.COMMENT);
          comment.addChild(tokens.next());
          body.addChild(comment);
          break;
        case WORD:
          body.addChild(parseStatement());
          break;
        default:
          throw new SyntaxError.Exception(
              token.getLocation(),
              String.format("expected a command name, got '%s'", token.getSpelling()));
      }
    }
    return body;
  }

  // Everything from "# cmake-format: off" through the matching "# cmake-format: on" is kept
  // verbatim, without parsing.
  private TreeNode parseFormatOff() {
    TreeNode node = args.newNode(NodeKind.ONOFFSWITCH);
    node.addChild(tokens.next());
    while (!tokens.isEmpty()) {
      Token token = tokens.next();
      node.addChild(token);
      if (token.getKind() == TokenKind.FORMAT_ON) {
        break;
      }
    }
    return node;
  }

  // statement = WORD WHITESPACE? '(' arguments ')' trailing-comment?
  private TreeNode parseStatement() throws SyntaxError.Exception {
    TreeNode statement = args.newNode(NodeKind.STATEMENT);
    TreeNode funname = args.newNode(NodeKind.FUNNAME);
    Token name = tokens.next();
    funname.addChild(name);
    statement.addChild(funname);

    while (tokens.nextIs(TokenKind.WHITESPACE)) {
      statement.addChild(tokens.next());
    }

    TreeNode lparen = args.newNode(NodeKind.LPAREN);
    lparen.addChild(args.expect(TokenKind.LEFT_PAREN));
    statement.addChild(lparen);

    ArgGrammar grammar = grammars.lookup(name.getSpelling());
    logger.atFine().log("%s: %s uses %s", name.getLocation(), name.getSpelling(), grammar);
    statement.addChild(args.parse(grammar, BreakStack.of(Breaker.paren())));

    TreeNode rparen = args.newNode(NodeKind.RPAREN);
    rparen.addChild(args.expect(TokenKind.RIGHT_PAREN));
    statement.addChild(rparen);

    args.consumeTrailingComment(statement);
    return statement;
  }
}
