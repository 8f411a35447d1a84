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
 * A TreeElement is a child of a {@link TreeNode}: either another node, or a raw {@link Token}
 * (whitespace, comments and the tokens wrapped by leaf nodes).
 */
public interface TreeElement {

  /** Returns the location of the first token covered by this element. */
  Location getStartLocation();

  /** Appends every token covered by this element, in document order, to {@code out}. */
  void collectTokens(List<Token> out);
}
