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

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import java.io.PrintStream;
import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A renderer for help messages in the familiar layout: a usage line, the description, one section
 * each for positional arguments, options, every named group and the commands, then the epilog.
 */
public class DefaultHelpFormatter implements HelpFormatter {

  private static final Splitter NEWLINE_SPLITTER = Splitter.on('\n');
  private static final int WIDTH = 80;
  private static final int MAX_NAME_COLUMN = 26;

  @Override
  public void format(ArgumentParser parser, PrintStream out) {
    out.print(render(parser));
    out.flush();
  }

  /** Renders the full help text for {@code parser}. */
  public String render(ArgumentParser parser) {
    ParserConfig config = parser.getConfig();
    List<ArgumentDescription> positionals = new ArrayList<>();
    List<ArgumentDescription> options = new ArrayList<>();
    List<ArgumentDescription> commands = new ArrayList<>();
    Map<String, List<ArgumentDescription>> groups = new LinkedHashMap<>();
    Map<String, GroupDescription> groupDescriptions = new LinkedHashMap<>();

    for (ArgumentDescription description : parser.describeArguments()) {
      GroupDescription group = description.group();
      if (description.isCommand()) {
        commands.add(description);
      } else if (group != null) {
        groups.computeIfAbsent(group.name(), name -> new ArrayList<>()).add(description);
        groupDescriptions.putIfAbsent(group.name(), group);
      } else if (description.longName().startsWith("-") || description.shortName().startsWith("-")) {
        options.add(description);
      } else {
        positionals.add(description);
      }
    }

    StringBuilder help = new StringBuilder();
    help.append("usage: ").append(usageLine(parser, positionals, commands)).append("\n");
    if (!config.getDescription().isEmpty()) {
      help.append('\n').append(paragraphFill(config.getDescription(), 0, WIDTH)).append('\n');
    }
    appendSection(help, "positional arguments", "", positionals);
    appendSection(help, "optional arguments", "", options);
    for (Map.Entry<String, List<ArgumentDescription>> entry : groups.entrySet()) {
      GroupDescription group = groupDescriptions.get(entry.getKey());
      String title = group.title().isEmpty() ? group.name() : group.title();
      appendSection(help, title, group.description(), entry.getValue());
    }
    appendSection(help, "commands", "", commands);
    if (!config.getEpilog().isEmpty()) {
      help.append('\n').append(paragraphFill(config.getEpilog(), 0, WIDTH)).append('\n');
    }
    return help.toString();
  }

  private static String usageLine(
      ArgumentParser parser,
      List<ArgumentDescription> positionals,
      List<ArgumentDescription> commands) {
    ParserConfig config = parser.getConfig();
    if (!config.getUsage().isEmpty()) {
      return config.getUsage();
    }
    StringBuilder usage = new StringBuilder(config.getProgram());
    usage.append(usage.length() == 0 ? "[options]" : " [options]");
    for (ArgumentDescription positional : positionals) {
      usage.append(' ').append(positional.arguments());
    }
    if (!commands.isEmpty()) {
      usage.append(" {command} ...");
    }
    return usage.toString();
  }

  private static void appendSection(
      StringBuilder help, String title, String description, List<ArgumentDescription> arguments) {
    if (arguments.isEmpty()) {
      return;
    }
    help.append('\n').append(title).append(":\n");
    if (!description.isEmpty()) {
      help.append(paragraphFill(description, 2, WIDTH)).append('\n');
    }
    for (ArgumentDescription argument : arguments) {
      appendArgument(help, argument);
    }
  }

  private static void appendArgument(StringBuilder help, ArgumentDescription argument) {
    String name = "  " + argumentName(argument);
    if (argument.help().isEmpty()) {
      help.append(name).append('\n');
      return;
    }
    String text = argument.help();
    if (argument.isRequired() && !argument.isCommand()) {
      text = text + " (required)";
    }
    if (name.length() + 2 > MAX_NAME_COLUMN) {
      help.append(name).append('\n');
      help.append(paragraphFill(text, MAX_NAME_COLUMN, WIDTH)).append('\n');
    } else {
      String filled = paragraphFill(text, MAX_NAME_COLUMN, WIDTH);
      help.append(Strings.padEnd(name, MAX_NAME_COLUMN, ' '))
          .append(filled.substring(MAX_NAME_COLUMN))
          .append('\n');
    }
  }

  /** Renders e.g. {@code -d, --depth DEPTH} for options and the arguments for positionals. */
  static String argumentName(ArgumentDescription argument) {
    if (argument.isCommand()) {
      return argument.helpName();
    }
    boolean isOption = argument.longName().startsWith("-") || argument.shortName().startsWith("-");
    if (!isOption) {
      return argument.arguments().isEmpty() ? argument.helpName() : argument.arguments();
    }
    StringBuilder name = new StringBuilder();
    if (!argument.shortName().isEmpty()) {
      name.append(argument.shortName());
    }
    if (!argument.longName().isEmpty()) {
      name.append(name.length() == 0 ? "" : ", ").append(argument.longName());
    }
    if (!argument.arguments().isEmpty()) {
      name.append(' ').append(argument.arguments());
    }
    return name.toString();
  }

  /**
   * Paragraph-fill the specified input text, indenting lines to 'indent' and wrapping lines at
   * 'width'. Returns the formatted result.
   */
  static String paragraphFill(String in, int indent, int width) {
    String indentString = " ".repeat(indent);
    StringBuilder out = new StringBuilder();
    String sep = "";
    for (String paragraph : NEWLINE_SPLITTER.split(in)) {
      BreakIterator boundary = BreakIterator.getLineInstance(); // (factory)
      boundary.setText(paragraph);
      out.append(sep).append(indentString);
      int cursor = indent;
      for (int start = boundary.first(), end = boundary.next();
          end != BreakIterator.DONE;
          start = end, end = boundary.next()) {
        String word = paragraph.substring(start, end); // (may include trailing space)
        if (word.length() + cursor > width && cursor > indent) {
          out.append('\n').append(indentString);
          cursor = indent;
        }
        out.append(word);
        cursor += word.length();
      }
      sep = "\n";
    }
    return out.toString();
  }
}
