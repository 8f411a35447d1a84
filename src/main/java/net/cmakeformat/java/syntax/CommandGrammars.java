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

/** Supplies the argument grammar of each command for the listfile parser. */
public interface CommandGrammars {

  /**
   * Returns the grammar of the named command. Lookup is case-insensitive; a command without a
   * registered grammar yields {@link ArgGrammar#anyArguments}.
   */
  ArgGrammar lookup(String commandName);
}
