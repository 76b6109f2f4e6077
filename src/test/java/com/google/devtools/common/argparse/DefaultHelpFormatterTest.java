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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for argument descriptions and the {@link DefaultHelpFormatter}. */
@RunWith(JUnit4.class)
public class DefaultHelpFormatterTest {

  private final ByteArrayOutputStream output = new ByteArrayOutputStream();

  private ArgumentParser newParser() {
    ArgumentParser parser = new ArgumentParser();
    parser.config().program("walk").out(new PrintStream(output, true, StandardCharsets.UTF_8));
    return parser;
  }

  @Test
  public void usageFragments() {
    ArgumentParser parser = newParser();
    parser.addArgument(ScalarValue.of(Boolean.class), "--flag");
    parser.addArgument(ListValue.of(String.class), "--pair").nargs(2).metavar("X");
    parser.addArgument(ScalarValue.of(String.class), "--maybe").maxargs(1).metavar("X");
    parser.addArgument(ListValue.of(String.class), "--any").minargs(0).metavar("X");
    parser.addArgument(ListValue.of(String.class), "--some").minargs(1).metavar("X");
    parser.addArgument(ListValue.of(String.class), "--range").nargs(1).maxargs(4).metavar("X");

    assertThat(parser.describeArgument("--flag").arguments()).isEmpty();
    assertThat(parser.describeArgument("--pair").arguments()).isEqualTo("X X");
    assertThat(parser.describeArgument("--maybe").arguments()).isEqualTo("[X]");
    assertThat(parser.describeArgument("--any").arguments()).isEqualTo("[X ...]");
    assertThat(parser.describeArgument("--some").arguments()).isEqualTo("X [X ...]");
    assertThat(parser.describeArgument("--range").arguments()).isEqualTo("X [X {0..3}]");
  }

  @Test
  public void metavarIsDerivedFromTheName() {
    ArgumentParser parser = newParser();
    parser.addArgument(ScalarValue.of(Integer.class), "--max-depth", "-m").nargs(1);
    parser.addArgument(ScalarValue.of(Integer.class), "-n").nargs(1);
    parser.addArgument(ScalarValue.of(String.class), "file");

    assertThat(parser.describeArgument("-m").metavar()).isEqualTo("MAX_DEPTH");
    assertThat(parser.describeArgument("-n").arguments()).isEqualTo("N");
    assertThat(parser.describeArgument("file").arguments()).isEqualTo("file");
  }

  @Test
  public void describeArgumentCarriesTheGroup() {
    ArgumentParser parser = newParser();
    parser.addExclusiveGroup("Format").title("Output format").description("Pick one.");
    parser.addArgument(ScalarValue.of(Boolean.class), "--json").help("Write JSON.");
    parser.endGroup();

    ArgumentDescription json = parser.describeArgument("--json");

    assertThat(json.helpName()).isEqualTo("--json");
    assertThat(json.help()).isEqualTo("Write JSON.");
    assertThat(json.isRequired()).isFalse();
    assertThat(json.isCommand()).isFalse();
    assertThat(json.group().name()).isEqualTo("format");
    assertThat(json.group().title()).isEqualTo("Output format");
    assertThat(json.group().description()).isEqualTo("Pick one.");
    assertThat(json.group().isExclusive()).isTrue();
    assertThat(json.group().isRequired()).isFalse();
  }

  @Test
  public void describeUnknownArgument() {
    ArgumentParser parser = newParser();
    assertThrows(IllegalArgumentException.class, () -> parser.describeArgument("--nope"));
  }

  @Test
  public void describeArgumentsListsOptionsPositionalsThenCommands() {
    ArgumentParser parser = newParser();
    parser.addArgument(ScalarValue.of(String.class), "source");
    parser.addCommand("run", () -> p -> {});
    parser.addArgument(ScalarValue.of(Boolean.class), "--debug");

    assertThat(
            parser.describeArguments().stream()
                .map(ArgumentDescription::helpName)
                .collect(toImmutableList()))
        .containsExactly("--debug", "source", "run")
        .inOrder();
  }

  @Test
  public void helpOptionRendersTheHelpAndStops() {
    ArgumentParser parser = newParser();
    parser
        .config()
        .description("Walks a directory tree.")
        .epilog("Report bugs to the issue tracker.");
    ScalarValue<Integer> depth = ScalarValue.of(Integer.class);
    parser.addArgument(depth, "--depth", "-d").nargs(1).help("How deep to go.");
    parser.addArgument(ListValue.of(String.class), "files").minargs(1).help("Where to start.");
    parser.addGroup("filters").title("Filtering");
    parser.addArgument(ScalarValue.of(String.class), "--name").nargs(1).help("Name pattern.");
    parser.endGroup();
    parser.addCommand("stats", () -> p -> {}).help("Prints statistics.");

    ParseResult result = parser.parse("-d", "2", "-h", "--bogus");

    assertThat(result.helpWasShown()).isTrue();
    assertThat(result.exitRequested()).isTrue();
    assertThat(result.isSuccess()).isFalse();
    assertThat(depth.get()).isEqualTo(2);
    String help = output.toString(StandardCharsets.UTF_8);
    assertThat(help)
        .startsWith("usage: walk [options] files [files ...] {command} ...\n\nWalks a directory");
    assertThat(help).contains("\npositional arguments:\n  files [files ...]");
    assertThat(help).contains("\noptional arguments:\n");
    assertThat(help).contains("  -d, --depth DEPTH       How deep to go.\n");
    assertThat(help).contains("  -h, --help              Display this help message and exit.\n");
    assertThat(help).contains("\nFiltering:\n  --name NAME             Name pattern.\n");
    assertThat(help).contains("\ncommands:\n  stats                   Prints statistics.\n");
    assertThat(help).endsWith("\nReport bugs to the issue tracker.\n");
    assertThat(help).doesNotContain("Error:");
  }

  @Test
  public void requiredArgumentsAreMarked() {
    ArgumentParser parser = newParser();
    parser.addArgument(ScalarValue.of(String.class), "--out").nargs(1).required(true).help("Out.");

    String help = new DefaultHelpFormatter().render(parser);

    assertThat(help).contains("  --out OUT               Out. (required)\n");
  }

  @Test
  public void customUsageLine() {
    ArgumentParser parser = newParser();
    parser.config().usage("walk [-d N] DIR...");

    assertThat(new DefaultHelpFormatter().render(parser)).startsWith("usage: walk [-d N] DIR...\n");
  }

  @Test
  public void customFormatter() {
    ArgumentParser parser = newParser();
    parser.setHelpFormatter((p, out) -> out.println("help for " + p.getConfig().getProgram()));

    ParseResult result = parser.parse("--help");

    assertThat(result.helpWasShown()).isTrue();
    assertThat(output.toString(StandardCharsets.UTF_8)).isEqualTo("help for walk\n");
  }

  @Test
  public void longNamesGetTheirOwnLine() {
    ArgumentParser parser = newParser();
    parser
        .addArgument(ScalarValue.of(String.class), "--a-really-long-option-name")
        .nargs(1)
        .metavar("V")
        .help("Text.");

    String help = new DefaultHelpFormatter().render(parser);

    assertThat(help).contains("  --a-really-long-option-name V\n" + " ".repeat(26) + "Text.\n");
  }

  @Test
  public void paragraphFill() {
    assertThat(DefaultHelpFormatter.paragraphFill("aaa bbb ccc", 2, 8))
        .isEqualTo("  aaa \n  bbb \n  ccc");
    assertThat(DefaultHelpFormatter.paragraphFill("one\ntwo", 1, 80)).isEqualTo(" one\n two");
  }
}
