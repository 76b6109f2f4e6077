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

/**
 * The arguments of a sub-command. An instance owns the value targets of the command and registers
 * them when the command is selected on the command line.
 *
 * <pre>
 * class BuildOptions implements CommandOptions {
 *   final ScalarValue&lt;Integer&gt; jobs = ScalarValue.of(Integer.class);
 *
 *   public void addArguments(ArgumentParser parser) {
 *     parser.addArgument(jobs, "--jobs", "-j").nargs(1);
 *   }
 * }
 * parser.addCommand("build", BuildOptions::new);
 * </pre>
 */
@FunctionalInterface
public interface CommandOptions {

  /** Registers the arguments of the command on {@code parser}. */
  void addArguments(ArgumentParser parser);
}
