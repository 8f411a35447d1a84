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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests of {@link Arity}. */
@RunWith(TestParameterInjector.class)
public final class ArityTest {

  @Test
  public void testParse() {
    assertThat(Arity.parse("?")).isSameInstanceAs(Arity.ZERO_OR_ONE);
    assertThat(Arity.parse("*")).isSameInstanceAs(Arity.ZERO_OR_MORE);
    assertThat(Arity.parse("+")).isSameInstanceAs(Arity.ONE_OR_MORE);
    assertThat(Arity.parse("2")).isEqualTo(Arity.exactly(2));
    assertThat(Arity.parse("12").getCount()).isEqualTo(12);
  }

  @Test
  public void testParseRejects(@TestParameter({"", "x", "-1", "1.5", "**"}) String text) {
    assertThrows(IllegalArgumentException.class, () -> Arity.parse(text));
  }

  @Test
  public void testIsFull() {
    assertThat(Arity.exactly(2).isFull(1)).isFalse();
    assertThat(Arity.exactly(2).isFull(2)).isTrue();
    assertThat(Arity.exactly(0).isFull(0)).isTrue();
    assertThat(Arity.ZERO_OR_ONE.isFull(0)).isFalse();
    assertThat(Arity.ZERO_OR_ONE.isFull(1)).isTrue();
    assertThat(Arity.ZERO_OR_MORE.isFull(100)).isFalse();
    assertThat(Arity.ONE_OR_MORE.isFull(100)).isFalse();
  }

  @Test
  public void testToStringRoundTrips(@TestParameter({"?", "*", "+", "0", "7"}) String text) {
    assertThat(Arity.parse(text).toString()).isEqualTo(text);
  }

  @Test
  public void testIsExact() {
    assertThat(Arity.exactly(3).isExact()).isTrue();
    assertThat(Arity.ONE_OR_MORE.isExact()).isFalse();
    assertThrows(IllegalArgumentException.class, () -> Arity.ONE_OR_MORE.getCount());
  }
}
