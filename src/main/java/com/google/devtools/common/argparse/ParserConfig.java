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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.PrintStream;
import javax.annotation.Nullable;

/** The program-level settings of an {@link ArgumentParser}. */
public final class ParserConfig {
  private String program = "";
  private String usage = "";
  private String description = "";
  private String epilog = "";
  private PrintStream out = System.out;
  private boolean helpOnEmptyInvocation = true;
  @Nullable private Object conversionContext = null;

  /** The program name shown in the usage line. */
  @CanIgnoreReturnValue
  public ParserConfig program(String program) {
    this.program = Preconditions.checkNotNull(program);
    return this;
  }

  /** Replaces the generated usage line. */
  @CanIgnoreReturnValue
  public ParserConfig usage(String usage) {
    this.usage = Preconditions.checkNotNull(usage);
    return this;
  }

  @CanIgnoreReturnValue
  public ParserConfig description(String description) {
    this.description = Preconditions.checkNotNull(description);
    return this;
  }

  /** Text shown after the argument descriptions. */
  @CanIgnoreReturnValue
  public ParserConfig epilog(String epilog) {
    this.epilog = Preconditions.checkNotNull(epilog);
    return this;
  }

  /** Where help and error descriptions are written. Defaults to {@code System.out}. */
  @CanIgnoreReturnValue
  public ParserConfig out(PrintStream out) {
    this.out = Preconditions.checkNotNull(out);
    return this;
  }

  /**
   * Whether parsing an empty token list shows the help and requests an exit when the parser has
   * required arguments. Enabled by default; when disabled, the missing arguments are reported as
   * errors instead.
   */
  @CanIgnoreReturnValue
  public ParserConfig helpOnEmptyInvocation(boolean helpOnEmptyInvocation) {
    this.helpOnEmptyInvocation = helpOnEmptyInvocation;
    return this;
  }

  /** The object passed to every converter and exposed by {@link Environment}. */
  @CanIgnoreReturnValue
  public ParserConfig conversionContext(@Nullable Object conversionContext) {
    this.conversionContext = conversionContext;
    return this;
  }

  public String getProgram() {
    return program;
  }

  public String getUsage() {
    return usage;
  }

  public String getDescription() {
    return description;
  }

  public String getEpilog() {
    return epilog;
  }

  public PrintStream getOut() {
    return out;
  }

  public boolean isHelpOnEmptyInvocation() {
    return helpOnEmptyInvocation;
  }

  @Nullable
  public Object getConversionContext() {
    return conversionContext;
  }
}
