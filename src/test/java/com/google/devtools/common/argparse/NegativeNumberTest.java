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
package com.google.devtools.common.argparse;

import static com.google.common.truth.Truth.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests that tokens like {@code -5} are read as values unless a short option is spelled so. */
@RunWith(JUnit4.class)
public class NegativeNumberTest {

  private ArgumentParser newParser() {
    ArgumentParser parser = new ArgumentParser();
    parser
        .config()
        .out(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
    return parser;
  }

  @Test
  public void negativeNumbersForOptionAndPositional() {
    ArgumentParser parser = newParser();
    ScalarValue<Integer> num = ScalarValue.of(Integer.class);
    ScalarValue<Integer> number = ScalarValue.of(Integer.class);
    parser.addArgument(num, "--num").nargs(1);
    parser.addArgument(number, "number");

    ParseResult result = parser.parse("--num", "-5", "-6");

    assertThat(result.isSuccess()).isTrue();
    assertThat(num.get()).isEqualTo(-5);
    assertThat(number.get()).isEqualTo(-6);
  }

  @Test
  public void negativeFractionAsPositional() {
    ArgumentParser parser = newParser();
    ScalarValue<Double> ratio = ScalarValue.of(Double.class);
    parser.addArgument(ratio, "ratio");

    ParseResult result = parser.parse("-0.3");

    assertThat(result.isSuccess()).isTrue();
    assertThat(ratio.get()).isEqualTo(-0.3);
  }

  @Test
  public void sequenceOptionTakesSeveralNegativeNumbers() {
    ArgumentParser parser = newParser();
    ListValue<Long> values = ListValue.of(Long.class);
    parser.addArgument(values, "--values").minargs(1);

    ParseResult result = parser.parse("--values", "-1", "-2", "-30");

    assertThat(result.isSuccess()).isTrue();
    assertThat(values.get()).containsExactly(-1L, -2L, -30L).inOrder();
  }

  @Test
  public void shortOptionSpelledLikeANumberWinsWhenIdle() {
    ArgumentParser parser = newParser();
    ScalarValue<Boolean> one = ScalarValue.of(Boolean.class);
    ScalarValue<Integer> number = ScalarValue.of(Integer.class);
    parser.addArgument(one, "-1");
    parser.addArgument(number, "number");

    ParseResult result = parser.parse("-1", "-2");

    assertThat(result.isSuccess()).isTrue();
    assertThat(one.get()).isTrue();
    assertThat(number.get()).isEqualTo(-2);
  }

  @Test
  public void activeOptionTakesNumberEvenIfAShortOptionMatches() {
    ArgumentParser parser = newParser();
    ScalarValue<Boolean> one = ScalarValue.of(Boolean.class);
    ScalarValue<Integer> offset = ScalarValue.of(Integer.class);
    parser.addArgument(one, "-1");
    parser.addArgument(offset, "--offset").nargs(1);

    ParseResult result = parser.parse("--offset", "-1");

    assertThat(result.isSuccess()).isTrue();
    assertThat(offset.get()).isEqualTo(-1);
    assertThat(one.getAssignCount()).isEqualTo(0);
  }

  @Test
  public void numberAfterSatisfiedOptionGoesToPositional() {
    ArgumentParser parser = newParser();
    ScalarValue<Integer> offset = ScalarValue.of(Integer.class);
    ListValue<Integer> rest = ListValue.of(Integer.class);
    parser.addArgument(offset, "--offset").nargs(1);
    parser.addArgument(rest, "rest");

    ParseResult result = parser.parse("--offset", "-1", "-2", "3", "-4");

    assertThat(result.isSuccess()).isTrue();
    assertThat(offset.get()).isEqualTo(-1);
    assertThat(rest.get()).containsExactly(-2, 3, -4).inOrder();
  }
}
