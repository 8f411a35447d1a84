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
import com.google.common.collect.ImmutableSet;

/** The arity and flag vocabulary a positional group was parsed with. */
@AutoValue
public abstract class PositionalSpec {

  public abstract Arity arity();

  /** Normalized (upper-case) words that are parsed as flags rather than values. */
  public abstract ImmutableSet<String> flags();

  public static PositionalSpec create(Arity arity, ImmutableSet<String> flags) {
    return new AutoValue_PositionalSpec(arity, flags);
  }
}
