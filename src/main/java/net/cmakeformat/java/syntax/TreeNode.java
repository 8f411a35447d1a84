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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A node of the concrete syntax tree. A single node type covers every {@link NodeKind}; the
 * fields that are specific to one kind (the positional spec of a PARGGROUP, the keyword and body of
 * a KWARGGROUP, the positional and keyword views of a standard ARGGROUP) are null or empty for the
 * others.
 *
 * <p>Children are nodes or raw tokens in document order. Whitespace and comments are kept at the
 * depth where they were met, so the tokens of any subtree reproduce the source text it covers.
 *
 * <p>Nodes are built by the parsers of this package and are read-only for everyone else, with the
 * single exception of {@link #setSortable}.
 */
public final class TreeNode implements TreeElement {

  private final NodeKind kind;
  private final List<TreeElement> children = new ArrayList<>();

  // ARGGROUP built by the standard parser: views into children.
  private final List<TreeNode> positionalGroups = new ArrayList<>();
  private final List<TreeNode> keywordGroups = new ArrayList<>();

  @Nullable private PositionalSpec spec; // PARGGROUP
  private boolean sortable; // PARGGROUP

  @Nullable private TreeNode keyword; // KWARGGROUP
  @Nullable private TreeNode body; // KWARGGROUP

  // Where the node begins; reported for nodes that end up with no tokens.
  private final Location origin;

  TreeNode(NodeKind kind, Location origin) {
    this.kind = kind;
    this.origin = origin;
  }

  public NodeKind getKind() {
    return kind;
  }

  /** Returns the children of this node, nodes and tokens, in document order. */
  public List<TreeElement> getChildren() {
    return Collections.unmodifiableList(children);
  }

  /** Returns the child nodes of this node, skipping raw tokens. */
  public ImmutableList<TreeNode> getChildNodes() {
    return ImmutableList.copyOf(Iterables.filter(children, TreeNode.class));
  }

  /** Returns the positional groups of a standard argument tree, in document order. */
  public List<TreeNode> getPositionalGroups() {
    return Collections.unmodifiableList(positionalGroups);
  }

  /** Returns the keyword groups of a standard argument tree, in document order. */
  public List<TreeNode> getKeywordGroups() {
    return Collections.unmodifiableList(keywordGroups);
  }

  /** Returns the spec a PARGGROUP was parsed with, or null for other kinds. */
  @Nullable
  public PositionalSpec getSpec() {
    return spec;
  }

  /** Returns true if the formatter may reorder the values of this PARGGROUP. */
  public boolean isSortable() {
    return sortable;
  }

  /** Annotates a PARGGROUP as sortable or not. */
  public void setSortable(boolean sortable) {
    checkState(kind == NodeKind.PARGGROUP, "only positional groups are sortable, not %s", kind);
    this.sortable = sortable;
  }

  /** Returns the KEYWORD node of a KWARGGROUP, or null for other kinds. */
  @Nullable
  public TreeNode getKeyword() {
    return keyword;
  }

  /** Returns the keyword token of a KWARGGROUP, or null for other kinds. */
  @Nullable
  public Token getKeywordToken() {
    return keyword == null ? null : (Token) keyword.children.get(0);
  }

  /** Returns the value tree of a KWARGGROUP, or null if it has no values. */
  @Nullable
  public TreeNode getBody() {
    return body;
  }

  /** Returns the command name token of a STATEMENT. */
  public Token getCommandName() {
    return findChild(NodeKind.FUNNAME).getToken();
  }

  /** Returns the argument tree of a STATEMENT. */
  public TreeNode getArgTree() {
    return findChild(NodeKind.ARGGROUP);
  }

  private TreeNode findChild(NodeKind childKind) {
    checkState(kind == NodeKind.STATEMENT, "not a statement: %s", kind);
    for (TreeElement child : children) {
      if (child instanceof TreeNode && ((TreeNode) child).kind == childKind) {
        return (TreeNode) child;
      }
    }
    throw new IllegalStateException("statement has no " + childKind);
  }

  /** Returns the first token of a leaf node such as ARGUMENT, FLAG, KEYWORD or FUNNAME. */
  public Token getToken() {
    for (TreeElement child : children) {
      if (child instanceof Token) {
        return (Token) child;
      }
    }
    throw new IllegalStateException(kind + " node has no token");
  }

  /** Returns every token of this subtree in document order. */
  public ImmutableList<Token> getTokens() {
    List<Token> tokens = new ArrayList<>();
    collectTokens(tokens);
    return ImmutableList.copyOf(tokens);
  }

  /** Returns the tokens of this subtree that are neither whitespace nor comments. */
  public ImmutableList<Token> getSemanticTokens() {
    ImmutableList.Builder<Token> result = ImmutableList.builder();
    for (Token token : getTokens()) {
      if (token.isSemantic()) {
        result.add(token);
      }
    }
    return result.build();
  }

  /** Returns the concatenated spelling of every token of this subtree. */
  public String reconstruct() {
    StringBuilder buf = new StringBuilder();
    for (Token token : getTokens()) {
      buf.append(token.getSpelling());
    }
    return buf.toString();
  }

  /** Returns the location of the first token, or where the node begins if it has none. */
  @Override
  public Location getStartLocation() {
    return children.isEmpty() ? origin : children.get(0).getStartLocation();
  }

  @Override
  public void collectTokens(List<Token> out) {
    for (TreeElement child : children) {
      child.collectTokens(out);
    }
  }

  /**
   * Reports every keyword in {@code required} that this standard argument tree does not supply.
   * {@code required} maps the upper-case keyword to the lint id to report; found keywords are
   * removed from it. Each missing keyword is recorded once, ordered by lint id and then keyword,
   * at the location of the first semantic token of the tree.
   */
  public void checkRequiredKwargs(LintSink sink, Map<String, String> required) {
    checkState(kind == NodeKind.ARGGROUP, "not an argument tree: %s", kind);
    for (TreeNode group : keywordGroups) {
      required.remove(group.getKeywordToken().getNormalizedWord());
    }
    if (required.isEmpty()) {
      return;
    }

    ImmutableList<Token> semantic = getSemanticTokens();
    Location location = semantic.isEmpty() ? getStartLocation() : semantic.get(0).getLocation();

    List<Map.Entry<String, String>> missing = new ArrayList<>(required.entrySet());
    missing.sort(
        Map.Entry.<String, String>comparingByValue()
            .thenComparing(Map.Entry.<String, String>comparingByKey()));
    for (Map.Entry<String, String> entry : missing) {
      sink.record(entry.getValue(), entry.getKey(), location);
    }
  }

  // --- mutators used while parsing ---

  void addChild(TreeElement child) {
    children.add(child);
  }

  void addPositionalGroup(TreeNode group) {
    positionalGroups.add(group);
    children.add(group);
  }

  void addKeywordGroup(TreeNode group) {
    keywordGroups.add(group);
    children.add(group);
  }

  void setSpec(PositionalSpec spec) {
    this.spec = spec;
  }

  void setKeyword(TreeNode keyword) {
    this.keyword = keyword;
    children.add(keyword);
  }

  void setBody(TreeNode body) {
    this.body = body;
    children.add(body);
  }

  @Override
  public String toString() {
    return kind + "@" + getStartLocation();
  }
}
