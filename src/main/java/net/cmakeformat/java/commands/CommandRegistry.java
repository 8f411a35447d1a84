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

package net.cmakeformat.java.commands;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import net.cmakeformat.java.syntax.ArgGrammar;
import net.cmakeformat.java.syntax.CommandGrammars;

/**
 * An immutable table from command name to argument grammar. Names are case-insensitive; commands
 * without an entry parse with {@link ArgGrammar#anyArguments}.
 *
 * <p>A registry is built once, typically from {@link #builtin} plus the commands a user declares in
 * the configuration, and is never changed by parsing.
 */
public final class CommandRegistry implements CommandGrammars {

  private static final CommandRegistry BUILTIN =
      BuiltinCommands.addTo(new Builder(ImmutableMap.of())).build();

  private final ImmutableMap<String, ArgGrammar> grammars; // keyed by lower-case name

  private CommandRegistry(ImmutableMap<String, ArgGrammar> grammars) {
    this.grammars = grammars;
  }

  /** Returns the registry of the commands built into the language. */
  public static CommandRegistry builtin() {
    return BUILTIN;
  }

  /** Returns a builder with no commands. */
  public static Builder builder() {
    return new Builder(ImmutableMap.of());
  }

  /** Returns a builder initialized with the commands of this registry. */
  public Builder toBuilder() {
    return new Builder(grammars);
  }

  @Override
  public ArgGrammar lookup(String commandName) {
    ArgGrammar grammar = grammars.get(commandName.toLowerCase(Locale.ROOT));
    return grammar != null ? grammar : ArgGrammar.anyArguments();
  }

  /** Returns true if the command has a registered grammar. */
  public boolean contains(String commandName) {
    return grammars.containsKey(commandName.toLowerCase(Locale.ROOT));
  }

  /** Returns the lower-case names of the registered commands, in registration order. */
  public ImmutableSet<String> getCommandNames() {
    return grammars.keySet();
  }

  @Override
  public String toString() {
    return "CommandRegistry" + grammars.keySet();
  }

  /** Builds a {@link CommandRegistry}. A later registration of a name replaces an earlier one. */
  public static final class Builder {
    private final Map<String, ArgGrammar> grammars = new LinkedHashMap<>();

    private Builder(Map<String, ArgGrammar> initial) {
      grammars.putAll(initial);
    }

    @CanIgnoreReturnValue
    public Builder add(String commandName, ArgGrammar grammar) {
      grammars.put(commandName.toLowerCase(Locale.ROOT), grammar);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addAll(Map<String, ArgGrammar> overrides) {
      for (Map.Entry<String, ArgGrammar> entry : overrides.entrySet()) {
        add(entry.getKey(), entry.getValue());
      }
      return this;
    }

    public CommandRegistry build() {
      return new CommandRegistry(ImmutableMap.copyOf(grammars));
    }
  }
}
