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
import com.google.common.flogger.GoogleLogger;
import com.google.common.primitives.Primitives;
import javax.annotation.Nullable;

/**
 * A value whose elements of type {@code T} are converted from tokens. The subclasses decide how a
 * converted element is stored: replaced, wrapped in an {@link java.util.Optional} or appended.
 *
 * <p>The converter is resolved once, when the value is created. If the element type has no
 * conversion strategy, tokens assigned with the default action are logged and dropped.
 */
public abstract class ConvertedValue<T> extends Value {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Class<T> type;
  @Nullable private final Converter<T> converter;

  protected ConvertedValue(Class<T> type, @Nullable Converter<T> converter) {
    this.type = Primitives.wrap(Preconditions.checkNotNull(type));
    this.converter = converter;
  }

  /** The element type, boxed if a primitive type was given. */
  public Class<T> getType() {
    return type;
  }

  /** Whether tokens can be converted to the element type without a custom action. */
  public boolean isConvertible() {
    return converter != null;
  }

  /** Converts {@code token} to the element type, as the default action would. */
  public T convert(String token, Environment env) throws ArgumentParsingException {
    if (converter == null) {
      throw new ArgumentParsingException(
          "No conversion from a string to " + type.getSimpleName(), token);
    }
    return converter.convert(token, env.getConversionContext());
  }

  @Override
  protected final void assign(String token, Environment env) throws ArgumentParsingException {
    if (converter == null) {
      logger.atWarning().log(
          "Assignment is not implemented for %s. ('%s')", type.getSimpleName(), token);
      return;
    }
    store(checkConverted(converter.convert(token, env.getConversionContext()), token));
  }

  /** Converts and stores a default token; there is no conversion context for defaults. */
  final void assignDefaultToken(String token) throws ArgumentParsingException {
    if (converter == null) {
      throw new ArgumentParsingException(
          "No conversion from a string to " + type.getSimpleName(), token);
    }
    store(checkConverted(converter.convert(token, null), token));
  }

  private T checkConverted(@Nullable T element, String token) throws ArgumentParsingException {
    if (element == null) {
      throw new ArgumentParsingException(
          "'" + token + "' did not convert to a " + type.getSimpleName(), token);
    }
    return element;
  }

  @Override
  String getTypeDescription() {
    return converter == null ? "" : converter.getTypeDescription();
  }

  /** Stores one converted element. */
  protected abstract void store(T element);
}
