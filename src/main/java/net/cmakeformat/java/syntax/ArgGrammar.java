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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An ArgGrammar describes how the arguments of a command, or the values of one of its keywords,
 * are parsed. It is a closed, possibly recursive descriptor interpreted by {@link ArgumentParser}:
 *
 * <ul>
 *   <li>{@link Kind#STANDARD}: positional arguments bounded by an arity, keyword arguments each
 *       with its own sub-grammar, and flags.
 *   <li>{@link Kind#POSITIONAL}: a single run of positional arguments bounded by an arity.
 *   <li>{@link Kind#CONDITIONAL}: a boolean expression with {@code AND}/{@code OR} and
 *       parentheses.
 * </ul>
 *
 * <p>Keyword and flag names are stored upper-case.
 */
public final class ArgGrammar {

  /** The variant of a grammar. */
  public enum Kind {
    STANDARD,
    POSITIONAL,
    CONDITIONAL
  }

  private static final ArgGrammar CONDITIONAL =
      new ArgGrammar(
          Kind.CONDITIONAL,
          Arity.ONE_OR_MORE,
          ImmutableMap.of(),
          ImmutableSet.of(),
          false,
          ImmutableMap.of());

  private static final ArgGrammar ANY_ARGUMENTS =
      new ArgGrammar(
          Kind.STANDARD,
          Arity.ZERO_OR_MORE,
          ImmutableMap.of(),
          ImmutableSet.of(),
          false,
          ImmutableMap.of());

  private final Kind kind;
  private final Arity arity;
  private final ImmutableMap<String, ArgGrammar> keywords;
  private final ImmutableSet<String> flags;
  private final boolean sortable;
  private final ImmutableMap<String, String> requiredKeywords;

  private ArgGrammar(
      Kind kind,
      Arity arity,
      ImmutableMap<String, ArgGrammar> keywords,
      ImmutableSet<String> flags,
      boolean sortable,
      ImmutableMap<String, String> requiredKeywords) {
    this.kind = kind;
    this.arity = arity;
    this.keywords = keywords;
    this.flags = flags;
    this.sortable = sortable;
    this.requiredKeywords = requiredKeywords;
  }

  /** Returns the grammar for commands without a registered grammar: any positional arguments. */
  public static ArgGrammar anyArguments() {
    return ANY_ARGUMENTS;
  }

  /** Returns the boolean-expression grammar used by flow-control commands. */
  public static ArgGrammar conditional() {
    return CONDITIONAL;
  }

  /** Returns a positional grammar with the given arity and no flags. */
  public static ArgGrammar positional(Arity arity) {
    return positional(arity, ImmutableSet.of(), false);
  }

  /** Returns a positional grammar with the given arity and flag vocabulary. */
  public static ArgGrammar positional(Arity arity, Collection<String> flags, boolean sortable) {
    return new ArgGrammar(
        Kind.POSITIONAL, arity, ImmutableMap.of(), normalize(flags), sortable, ImmutableMap.of());
  }

  /** Returns a builder for a standard grammar, initially {@code *} arguments and no keywords. */
  public static Builder standard() {
    return new Builder();
  }

  public Kind getKind() {
    return kind;
  }

  public Arity getArity() {
    return arity;
  }

  /** Returns the keyword table, keyed by upper-case keyword. Empty unless STANDARD. */
  public ImmutableMap<String, ArgGrammar> getKeywords() {
    return keywords;
  }

  public ImmutableSet<String> getFlags() {
    return flags;
  }

  /** Returns true if positional groups of this grammar are sortable by default. */
  public boolean isSortable() {
    return sortable;
  }

  /**
   * Returns the keywords a well-formed invocation must supply, mapped to the lint id reported when
   * one is missing. Empty unless STANDARD.
   */
  public ImmutableMap<String, String> getRequiredKeywords() {
    return requiredKeywords;
  }

  /** Returns a builder initialized from this STANDARD grammar. */
  public Builder toBuilder() {
    checkState(kind == Kind.STANDARD, "not a standard grammar: %s", this);
    Builder builder = new Builder().arity(arity).sortable(sortable);
    builder.keywords.putAll(keywords);
    builder.flags.addAll(flags);
    builder.required.putAll(requiredKeywords);
    return builder;
  }

  private static ImmutableSet<String> normalize(Collection<String> words) {
    ImmutableSet.Builder<String> result = ImmutableSet.builder();
    for (String word : words) {
      result.add(word.toUpperCase(Locale.ROOT));
    }
    return result.build();
  }

  @Override
  public boolean equals(Object that) {
    if (this == that) {
      return true;
    }
    if (!(that instanceof ArgGrammar)) {
      return false;
    }
    ArgGrammar other = (ArgGrammar) that;
    return kind == other.kind
        && sortable == other.sortable
        && arity.equals(other.arity)
        && keywords.equals(other.keywords)
        && flags.equals(other.flags)
        && requiredKeywords.equals(other.requiredKeywords);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, arity, keywords, flags, sortable, requiredKeywords);
  }

  @Override
  public String toString() {
    if (kind == Kind.CONDITIONAL) {
      return "conditional";
    }
    return MoreObjects.toStringHelper(kind.name().toLowerCase(Locale.ROOT))
        .omitNullValues()
        .add("arity", arity)
        .add("keywords", keywords.isEmpty() ? null : keywords)
        .add("flags", flags.isEmpty() ? null : flags)
        .add("sortable", sortable ? true : null)
        .add("required", requiredKeywords.isEmpty() ? null : requiredKeywords)
        .toString();
  }

  /** A builder of STANDARD grammars. */
  public static final class Builder {
    private Arity arity = Arity.ZERO_OR_MORE;
    private boolean sortable = false;
    private final Map<String, ArgGrammar> keywords = new LinkedHashMap<>();
    private final Set<String> flags = new LinkedHashSet<>();
    private final Map<String, String> required = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder arity(Arity arity) {
      this.arity = arity;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder sortable(boolean sortable) {
      this.sortable = sortable;
      return this;
    }

    /** Adds or replaces a keyword and the grammar of its values. */
    @CanIgnoreReturnValue
    public Builder keyword(String name, ArgGrammar values) {
      keywords.put(name.toUpperCase(Locale.ROOT), values);
      return this;
    }

    /** Adds a keyword whose values are a positional run of the given arity. */
    @CanIgnoreReturnValue
    public Builder keyword(String name, Arity values) {
      return keyword(name, positional(values));
    }

    @CanIgnoreReturnValue
    public Builder flags(String... names) {
      for (String name : names) {
        flags.add(name.toUpperCase(Locale.ROOT));
      }
      return this;
    }

    /** Declares {@code keyword} required; a missing one is reported under {@code lintId}. */
    @CanIgnoreReturnValue
    public Builder required(String keyword, String lintId) {
      required.put(keyword.toUpperCase(Locale.ROOT), lintId);
      return this;
    }

    public ArgGrammar build() {
      return new ArgGrammar(
          Kind.STANDARD,
          arity,
          ImmutableMap.copyOf(keywords),
          ImmutableSet.copyOf(flags),
          sortable,
          ImmutableMap.copyOf(required));
    }
  }
}
