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

import com.google.common.base.Strings;
import javax.annotation.Nullable;

/**
 * The context handed to assign actions and converters. It names the argument being assigned and
 * lets an action stop the parser or report a problem without throwing.
 */
public final class Environment {
  private final String argumentName;
  private final ParseResultBuilder result;
  @Nullable private final Object conversionContext;

  Environment(
      String argumentName, ParseResultBuilder result, @Nullable Object conversionContext) {
    this.argumentName = argumentName;
    this.result = result;
    this.conversionContext = conversionContext;
  }

  /** The help name of the argument that receives the value. */
  public String getArgumentName() {
    return argumentName;
  }

  /** The object configured with {@link ParserConfig#conversionContext}, e.g. a locale. */
  @Nullable
  public Object getConversionContext() {
    return conversionContext;
  }

  /** Stops the parser after the current token; the result reports {@code EXIT_REQUESTED}. */
  public void exitParser() {
    result.requestExit();
  }

  /** Records an {@link ErrorKind#ACTION_ERROR} for the current argument. */
  public void addError(String message) {
    result.addError(argumentName, ErrorKind.ACTION_ERROR, Strings.nullToEmpty(message));
  }

  void addConversionError(@Nullable String message) {
    result.addError(argumentName, ErrorKind.CONVERSION_ERROR, Strings.nullToEmpty(message));
  }
}
