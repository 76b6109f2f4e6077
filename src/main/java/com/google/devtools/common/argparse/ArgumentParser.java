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

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * A declarative command-line parser. Callers register options, positional arguments, groups and
 * commands, each bound to a {@link Value} they own, and then call {@link #parse}:
 *
 * <pre>
 * ScalarValue&lt;Integer&gt; depth = ScalarValue.of(Integer.class);
 * ListValue&lt;String&gt; files = ListValue.of(String.class);
 *
 * ArgumentParser parser = new ArgumentParser();
 * parser.config().program("walk");
 * parser.addArgument(depth, "--depth", "-d").nargs(1).absent("3");
 * parser.addArgument(files, "files").minargs(1);
 *
 * ParseResult result = parser.parse(args);
 * if (result.exitRequested() || !result.isSuccess()) {
 *   return;
 * }
 * </pre>
 *
 * <p>Problems in the registration are programming errors and throw a {@link
 * ConstructionException}. Problems in the parsed tokens never throw; they are collected in the
 * {@link ParseResult}.
 *
 * <p>The parser and the values registered with it are mutated by every parse. This class is not
 * thread-safe; a parser serves one invocation at a time.
 */
public class ArgumentParser {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final String HELP_TEXT = "Display this help message and exit.";

  /**
   * An unchecked exception thrown when there is a problem registering arguments, groups or
   * commands. This exception always indicates a bug in the calling code.
   */
  public static class ConstructionException extends RuntimeException {
    public ConstructionException(String message) {
      super(message);
    }

    public ConstructionException(Throwable cause) {
      super(cause);
    }

    public ConstructionException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  private final ParserConfig config = new ParserConfig();
  private final ParserDefinition definition = new ParserDefinition();
  private final Map<String, ArgumentGroup> groups = new LinkedHashMap<>();
  private final Set<ArgumentDefinition> helpOptions = new HashSet<>();
  @Nullable private ArgumentGroup activeGroup = null;
  private boolean defaultHelpInstalled = false;
  private HelpFormatter helpFormatter = new DefaultHelpFormatter();

  /** The program-level settings; modify them in place. */
  public ParserConfig config() {
    return config;
  }

  public ParserConfig getConfig() {
    return config;
  }

  public void setHelpFormatter(HelpFormatter helpFormatter) {
    this.helpFormatter = Preconditions.checkNotNull(helpFormatter);
  }

  /**
   * Registers an argument. A name starting with a dash makes an option ({@code --long} or {@code
   * -s}); a name without one makes a positional argument.
   *
   * @throws ConstructionException if the name is invalid or already taken
   */
  public <V extends Value> ArgumentConfig<V> addArgument(V value, String name) {
    return addArgument(value, ImmutableList.of(Preconditions.checkNotNull(name)));
  }

  /**
   * Registers an option with a long and a short name, in either order. Both names must start with
   * a dash.
   *
   * @throws ConstructionException if a name is invalid or already taken
   */
  public <V extends Value> ArgumentConfig<V> addArgument(V value, String name, String altName) {
    return addArgument(
        value,
        ImmutableList.of(Preconditions.checkNotNull(name), Preconditions.checkNotNull(altName)));
  }

  private <V extends Value> ArgumentConfig<V> addArgument(V value, List<String> allNames) {
    Preconditions.checkNotNull(value);
    List<String> names = new ArrayList<>();
    for (String name : allNames) {
      if (!name.isEmpty()) {
        names.add(name);
      }
    }
    if (names.isEmpty()) {
      throw new ConstructionException("An argument must have a name.");
    }
    for (String name : names) {
      if (CharMatcher.whitespace().matchesAnyOf(name)) {
        throw new ConstructionException("Argument names must not contain spaces: '" + name + "'");
      }
    }

    int dashed = 0;
    for (String name : names) {
      if (name.startsWith("-")) {
        ++dashed;
      }
    }
    if (dashed == 0) {
      return addPositional(value, names);
    }
    if (dashed == names.size()) {
      return addOption(value, names);
    }
    throw new ConstructionException(
        "The argument must be either positional or an option: " + String.join(", ", names));
  }

  private <V extends Value> ArgumentConfig<V> addPositional(V value, List<String> names) {
    if (names.size() > 1) {
      throw new ConstructionException(
          "A positional argument has a single name: " + String.join(", ", names));
    }
    ArgumentDefinition positional = new ArgumentDefinition(value, true);
    positional.setLongName(names.get(0));
    if (value.isSequence()) {
      positional.setMinArgs(0);
      positional.setRequired(false);
    } else {
      positional.setNArgs(1);
      positional.setRequired(true);
    }
    // Positional arguments are usually required, so they never join an exclusive group.
    if (activeGroup != null && !activeGroup.isExclusive()) {
      positional.setGroup(activeGroup);
    }
    definition.addPositional(positional);
    return new ArgumentConfig<>(positional, value);
  }

  private <V extends Value> ArgumentConfig<V> addOption(V value, List<String> names) {
    ArgumentDefinition option = new ArgumentDefinition(value, false);
    for (String name : names) {
      if (name.equals("-") || name.equals("--")) {
        throw new ConstructionException("An option must have a name: '" + name + "'");
      }
      if (name.startsWith("--")) {
        if (!option.getLongName().isEmpty()) {
          throw new ConstructionException(
              "An option can have only one long name: " + String.join(", ", names));
        }
        option.setLongName(name);
      } else {
        if (name.length() > 2) {
          throw new ConstructionException(
              "Short option name has too many characters: '" + name + "'");
        }
        if (!option.getShortName().isEmpty()) {
          throw new ConstructionException(
              "An option can have only one short name: " + String.join(", ", names));
        }
        option.setShortName(name);
      }
    }
    ensureIsNewOption(option.getLongName());
    ensureIsNewOption(option.getShortName());
    if (activeGroup != null) {
      option.setGroup(activeGroup);
    }
    definition.addOption(option);
    return new ArgumentConfig<>(option, value);
  }

  private void ensureIsNewOption(String name) {
    if (name.isEmpty()) {
      return;
    }
    ArgumentDefinition existing = definition.findOption(name);
    if (existing != null) {
      ArgumentGroup group = existing.getGroup();
      throw new DuplicateArgumentException(group == null ? "" : group.getName(), name);
    }
  }

  /** Lets {@code options} register its arguments with this parser. */
  public void addArguments(CommandOptions options) {
    options.addArguments(this);
  }

  /**
   * Registers a command. The factory is called only when the command's name is found among the
   * free tokens; the options it creates register their arguments on a new parser that receives
   * the tokens after the command name.
   *
   * @throws ConstructionException if the name is invalid or already taken
   */
  public CommandConfig addCommand(String name, Supplier<? extends CommandOptions> factory) {
    if (Preconditions.checkNotNull(name).isEmpty()) {
      throw new ConstructionException("A command must have a name.");
    }
    if (factory == null) {
      throw new ConstructionException("A command must have an options factory: " + name);
    }
    if (name.startsWith("-")) {
      throw new ConstructionException("Command name must not start with a dash: " + name);
    }
    if (CharMatcher.whitespace().matchesAnyOf(name)) {
      throw new ConstructionException("Command names must not contain spaces: '" + name + "'");
    }
    if (definition.findCommand(name) != null) {
      throw new DuplicateCommandException(name);
    }
    Command command = new Command(name, factory);
    definition.addCommand(command);
    return new CommandConfig(command);
  }

  /**
   * Registers an option that shows the help and stops the parser. Help options never belong to a
   * group.
   */
  public ArgumentConfig<VoidValue> addHelpOption(String name) {
    return addHelpOption(ImmutableList.of(Preconditions.checkNotNull(name)));
  }

  public ArgumentConfig<VoidValue> addHelpOption(String name, String altName) {
    return addHelpOption(
        ImmutableList.of(Preconditions.checkNotNull(name), Preconditions.checkNotNull(altName)));
  }

  private ArgumentConfig<VoidValue> addHelpOption(List<String> names) {
    for (String name : names) {
      if (!name.startsWith("-")) {
        throw new ConstructionException("A help option name must start with a dash: " + name);
      }
    }
    ArgumentGroup group = activeGroup;
    activeGroup = null;
    try {
      ArgumentConfig<VoidValue> help = addOption(new VoidValue(), names);
      help.help(HELP_TEXT);
      helpOptions.add(help.getDefinition());
      return help;
    } finally {
      activeGroup = group;
    }
  }

  /** Registers {@code -h} and {@code --help} as help options, skipping the ones already taken. */
  public void addDefaultHelpOption() {
    List<String> names = new ArrayList<>();
    for (String name : ImmutableList.of("--help", "-h")) {
      if (definition.findOption(name) == null) {
        names.add(name);
      }
    }
    if (names.isEmpty()) {
      logger.atWarning().log("Both -h and --help are taken; the parser has no help option");
      return;
    }
    addHelpOption(names);
  }

  /**
   * Opens a group that subsequently registered arguments join until {@link #endGroup}. Group
   * names are case-insensitive; opening an existing group continues it.
   *
   * @throws MixedGroupTypesException if the group exists as an exclusive group
   */
  public GroupConfig addGroup(String name) {
    return openGroup(name, false);
  }

  /**
   * Opens an exclusive group: at most one of its options may be assigned in a parse. Positional
   * arguments registered while it is open do not join it.
   *
   * @throws MixedGroupTypesException if the group exists as a non-exclusive group
   */
  public GroupConfig addExclusiveGroup(String name) {
    return openGroup(name, true);
  }

  private GroupConfig openGroup(String name, boolean exclusive) {
    if (Preconditions.checkNotNull(name).isEmpty()) {
      throw new ConstructionException("A group must have a name.");
    }
    String key = Ascii.toLowerCase(name);
    ArgumentGroup group = groups.get(key);
    if (group == null) {
      group = new ArgumentGroup(key, exclusive);
      groups.put(key, group);
    } else if (group.isExclusive() != exclusive) {
      throw new MixedGroupTypesException(key);
    }
    activeGroup = group;
    return new GroupConfig(group);
  }

  /** Closes the open group; later arguments belong to no group. */
  public void endGroup() {
    activeGroup = null;
  }

  /** Parses {@code args}; see {@link #parse(List)}. */
  public ParseResult parse(String... args) {
    return parse(args == null ? null : Arrays.asList(args));
  }

  /** Parses {@code argv} after dropping the first {@code skipArgs} tokens, e.g. a program name. */
  public ParseResult parse(@Nullable String[] argv, int skipArgs) {
    Preconditions.checkArgument(skipArgs >= 0, "skipArgs must not be negative: %s", skipArgs);
    if (argv == null) {
      return parse((List<String>) null);
    }
    List<String> args = Arrays.asList(argv);
    return parse(args.subList(Math.min(skipArgs, args.size()), args.size()));
  }

  /**
   * Resets every registered value, assigns the tokens in {@code args} and checks the
   * constraints. Problems are written to the configured output stream and returned in the
   * result.
   *
   * @throws ConstructionException if the registration is inconsistent, e.g. a required option in
   *     an exclusive group
   */
  public ParseResult parse(@Nullable List<String> args) {
    verifyDefinedOptions();
    ParseResultBuilder result = new ParseResultBuilder();
    parse(args, result);
    if (result.hasArgumentProblems()) {
      config.getOut().println(result.build().describeErrors());
      config.getOut().flush();
      result.signalErrorsShown();
    }
    return result.build();
  }

  void parse(@Nullable List<String> args, ParseResultBuilder result) {
    for (ArgumentDefinition argument : definition.allArguments()) {
      argument.resetValue();
    }
    if (args == null || hasNullToken(args)) {
      result.addError("argv", ErrorKind.INVALID_INPUT);
      return;
    }
    if (args.isEmpty() && config.isHelpOnEmptyInvocation() && hasRequiredArguments()) {
      showHelp(result);
      return;
    }

    new ArgumentParserImpl(this, result).parse(args);

    if (!result.wasExitRequested()) {
      assignDefaults(result);
      reportMissingArguments(result);
      reportExclusiveViolations(result);
      reportMissingGroups(result);
    }
  }

  private static boolean hasNullToken(List<String> args) {
    for (String arg : args) {
      if (arg == null) {
        return true;
      }
    }
    return false;
  }

  /** Installs the default help options if none were added and checks the group constraints. */
  void verifyDefinedOptions() {
    if (helpOptions.isEmpty() && !defaultHelpInstalled) {
      defaultHelpInstalled = true;
      addDefaultHelpOption();
    }
    for (ArgumentDefinition option : definition.options) {
      ArgumentGroup group = option.getGroup();
      if (option.isRequired() && group != null && group.isExclusive()) {
        throw new RequiredExclusiveOptionException(option.getHelpName(), group.getName());
      }
    }
  }

  private boolean hasRequiredArguments() {
    for (ArgumentDefinition argument : definition.allArguments()) {
      if (argument.isRequired()) {
        return true;
      }
    }
    return false;
  }

  private void assignDefaults(ParseResultBuilder result) {
    for (ArgumentDefinition argument : definition.allArguments()) {
      if (argument.hasDefault() && !argument.wasAssigned()) {
        argument.assignDefault(newEnvironment(argument, result));
      }
    }
  }

  private void reportMissingArguments(ParseResultBuilder result) {
    for (ArgumentDefinition option : definition.options) {
      if (option.isRequired() && !option.wasAssigned()) {
        result.addError(option.getHelpName(), ErrorKind.MISSING_OPTION);
      }
    }
    for (ArgumentDefinition positional : definition.positionals) {
      if (positional.needsMoreArguments()) {
        result.addError(positional.getHelpName(), ErrorKind.MISSING_ARGUMENT);
      }
    }
  }

  /** Reports each exclusive group whose options assigned more than one distinct value. */
  private void reportExclusiveViolations(ParseResultBuilder result) {
    for (ArgumentGroup group : groups.values()) {
      if (!group.isExclusive()) {
        continue;
      }
      Set<Object> targets = new HashSet<>();
      ArgumentDefinition first = null;
      for (ArgumentDefinition option : definition.options) {
        if (option.getGroup() != group || !option.wasAssigned()) {
          continue;
        }
        targets.add(option.getValue().getTargetId());
        if (first == null || option.getAssignmentOrder() < first.getAssignmentOrder()) {
          first = option;
        }
      }
      if (targets.size() > 1) {
        result.addError(first.getHelpName(), ErrorKind.EXCLUSIVE_VIOLATION);
      }
    }
  }

  private void reportMissingGroups(ParseResultBuilder result) {
    for (ArgumentGroup group : groups.values()) {
      if (!group.isRequired()) {
        continue;
      }
      boolean assigned = false;
      for (ArgumentDefinition argument : definition.allArguments()) {
        if (argument.getGroup() == group && argument.wasAssigned()) {
          assigned = true;
          break;
        }
      }
      if (!assigned) {
        result.addError(group.getName(), ErrorKind.MISSING_OPTION_GROUP);
      }
    }
  }

  /** Renders the help with the configured formatter to the configured output stream. */
  public void generateHelp() {
    helpFormatter.format(this, config.getOut());
  }

  void showHelp(ParseResultBuilder result) {
    logger.atFine().log("Showing help for '%s' and stopping the parser", config.getProgram());
    generateHelp();
    result.signalHelpShown();
    result.requestExit();
  }

  /** Parses {@code args} with a new parser for the arguments of {@code command}. */
  void runCommand(Command command, List<String> args, ParseResultBuilder result) {
    logger.atFine().log("Running command %s with %d tokens", command.getName(), args.size());
    CommandOptions options = command.createOptions();
    ArgumentParser parser = new ArgumentParser();
    String program = config.getProgram();
    parser
        .config()
        .program(program.isEmpty() ? command.getName() : program + " " + command.getName())
        .description(command.getHelp())
        .out(config.getOut())
        .helpOnEmptyInvocation(config.isHelpOnEmptyInvocation())
        .conversionContext(config.getConversionContext());
    parser.helpFormatter = helpFormatter;
    options.addArguments(parser);
    result.addCommand(options);
    parser.verifyDefinedOptions();
    parser.parse(args, result);
  }

  boolean isHelpOption(ArgumentDefinition option) {
    return helpOptions.contains(option);
  }

  ParserDefinition getDefinition() {
    return definition;
  }

  Environment newEnvironment(ArgumentDefinition argument, ParseResultBuilder result) {
    return new Environment(argument.getHelpName(), result, config.getConversionContext());
  }

  /**
   * Describes the option, positional argument or command with the given name.
   *
   * @throws IllegalArgumentException if nothing is registered under {@code name}
   */
  public ArgumentDescription describeArgument(String name) {
    ArgumentDefinition option = definition.findOption(name);
    if (option != null) {
      return describe(option);
    }
    for (ArgumentDefinition positional : definition.positionals) {
      if (positional.hasName(name)) {
        return describe(positional);
      }
    }
    Command command = definition.findCommand(name);
    if (command != null) {
      return describe(command);
    }
    throw new IllegalArgumentException("No argument named '" + name + "'");
  }

  /** Describes all registered arguments: options, then positional arguments, then commands. */
  public ImmutableList<ArgumentDescription> describeArguments() {
    ImmutableList.Builder<ArgumentDescription> descriptions = ImmutableList.builder();
    for (ArgumentDefinition argument : definition.allArguments()) {
      descriptions.add(describe(argument));
    }
    for (Command command : definition.commands) {
      descriptions.add(describe(command));
    }
    return descriptions.build();
  }

  private static ArgumentDescription describe(ArgumentDefinition argument) {
    ArgumentGroup group = argument.getGroup();
    return ArgumentDescription.builder()
        .setHelpName(argument.getHelpName())
        .setShortName(argument.getShortName())
        .setLongName(argument.getLongName())
        .setMetavar(argument.getMetavar())
        .setArguments(usageFragment(argument))
        .setHelp(argument.getRawHelp())
        .setIsRequired(argument.isRequired())
        .setGroup(group == null ? null : GroupDescription.of(group))
        .build();
  }

  private static ArgumentDescription describe(Command command) {
    return ArgumentDescription.builder()
        .setHelpName(command.getName())
        .setLongName(command.getName())
        .setHelp(command.getHelp())
        .setIsCommand(true)
        .build();
  }

  /** Renders the arity of {@code argument} with its metavar, e.g. {@code X [X {0..3}]}. */
  static String usageFragment(ArgumentDefinition argument) {
    if (!argument.acceptsAnyArguments()) {
      return "";
    }
    String metavar = argument.getMetavar();
    int minArgs = argument.getMinArgs();
    int maxArgs = argument.getMaxArgs();
    StringBuilder fragment = new StringBuilder();
    for (int i = 0; i < minArgs; ++i) {
      fragment.append(i == 0 ? "" : " ").append(metavar);
    }
    String separator = fragment.length() == 0 ? "" : " ";
    if (maxArgs == ArgumentDefinition.UNBOUNDED) {
      fragment.append(separator).append('[').append(metavar).append(" ...]");
    } else if (maxArgs - minArgs == 1) {
      fragment.append(separator).append('[').append(metavar).append(']');
    } else if (maxArgs > minArgs) {
      fragment
          .append(separator)
          .append('[')
          .append(metavar)
          .append(" {0..")
          .append(maxArgs - minArgs)
          .append("}]");
    }
    return fragment.toString();
  }
}
