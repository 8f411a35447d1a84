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

/**
 * A Location denotes a position within a listfile: its file name, 1-based line and column, and
 * 0-based character offset.
 */
@AutoValue
public abstract class Location implements Comparable<Location> {

  /** Returns the name of the file, or the empty string for anonymous input. */
  public abstract String file();

  /** Returns the 1-based line number. */
  public abstract int line();

  /** Returns the 1-based column number. */
  public abstract int column();

  /** Returns the 0-based character offset from the start of the input. */
  public abstract int offset();

  public static Location create(String file, int line, int column, int offset) {
    return new AutoValue_Location(file, line, column, offset);
  }

  /** Returns a location at the very start of the named file. */
  public static Location fromFile(String file) {
    return create(file, 1, 1, 0);
  }

  @Override
  public final int compareTo(Location that) {
    return Integer.compare(this.offset(), that.offset());
  }

  @Override
  public final String toString() {
    String prefix = file().isEmpty() ? "" : file() + ":";
    return prefix + line() + ":" + column();
  }
}
