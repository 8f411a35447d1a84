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

import com.google.common.base.Joiner;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The apparent name and contents of a listfile to be parsed. The file name is used only in
 * locations.
 */
public final class ParserInput {

  private final String file;
  private final char[] content;

  private ParserInput(char[] content, String file) {
    this.content = content;
    this.file = file;
  }

  /** Returns the content of the input source. Callers must not modify the result. */
  char[] getContent() {
    return content;
  }

  /** Returns the apparent file name of the input source. */
  public String getFile() {
    return file;
  }

  /** Returns an input source that uses the given string as its content. */
  public static ParserInput fromString(String content, String file) {
    return new ParserInput(content.toCharArray(), file);
  }

  /** Returns an unnamed input source that reads from the lines, each terminated by a newline. */
  public static ParserInput fromLines(String... lines) {
    return fromString(Joiner.on("\n").join(lines) + "\n", "");
  }

  /** Reads a listfile in the given encoding. */
  public static ParserInput readFile(Path path, Charset encoding) throws IOException {
    return fromString(new String(Files.readAllBytes(path), encoding), path.toString());
  }
}
