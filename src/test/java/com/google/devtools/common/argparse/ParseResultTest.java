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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ParseResult} and {@link ParseError}. */
@RunWith(JUnit4.class)
public class ParseResultTest {

  @Test
  public void emptyResultIsSuccessful() {
    ParseResult result = new ParseResultBuilder().build();

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.describeErrors()).isEmpty();
    assertThat(result.exitRequested()).isFalse();
  }

  @Test
  public void describeErrorsWritesOneLinePerProblem() {
    ParseResultBuilder builder = new ParseResultBuilder();
    builder.addError("--bogus", ErrorKind.UNKNOWN_OPTION);
    builder.addError("--n", ErrorKind.CONVERSION_ERROR, "'x' is not an int");
    builder.addError("--port", ErrorKind.ACTION_ERROR, "Out of range");
    builder.addError("", ErrorKind.ACTION_ERROR, "Something failed");
    builder.requestExit();
    builder.addError("argv", ErrorKind.INVALID_INPUT);
    builder.addIgnored("a");
    builder.addIgnored("b");

    ParseResult result = builder.build();

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.describeErrors())
        .isEqualTo(
            "Error: Unknown option: '--bogus'\n"
                + "Error: The argument could not be converted: '--n' ('x' is not an int)\n"
                + "Error: --port: Out of range\n"
                + "Error: Something failed\n"
                + "Error: Parser input is invalid.\n"
                + "Error: Ignored arguments: a, b");
  }

  @Test
  public void exitRequestIsRecordedOnce() {
    ParseResultBuilder builder = new ParseResultBuilder();
    builder.requestExit();
    builder.requestExit();

    assertThat(builder.hasArgumentProblems()).isFalse();
    ParseResult result = builder.build();
    assertThat(result.exitRequested()).isTrue();
    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getErrors()).containsExactly(ParseError.create("", ErrorKind.EXIT_REQUESTED));
    assertThat(result.getErrors().get(0).describe()).isNull();
  }

  @Test
  public void ignoredArgumentsAreProblems() {
    ParseResultBuilder builder = new ParseResultBuilder();
    builder.addIgnored("x");

    assertThat(builder.hasArgumentProblems()).isTrue();
    assertThat(builder.build().getErrors()).isEmpty();
  }

  @Test
  public void resultIsASnapshot() {
    ParseResultBuilder builder = new ParseResultBuilder();
    ParseResult before = builder.build();
    builder.addError("--x", ErrorKind.MISSING_OPTION);

    assertThat(before.getErrors()).isEmpty();
    assertThat(builder.build().getErrors()).hasSize(1);
  }
}
