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

import com.google.common.base.Defaults;
import com.google.common.primitives.Primitives;
import javax.annotation.Nullable;

/**
 * A single value. Each assignment replaces the previous one, so the last token wins.
 *
 * <p>The empty value is the zero value of the primitive counterpart of the type ({@code 0}, {@code
 * false}, ...) or null for other types.
 */
public final class ScalarValue<T> extends ConvertedValue<T> {
  @Nullable private T value;

  private ScalarValue(Class<T> type, @Nullable Converter<T> converter) {
    super(type, converter);
    this.value = zero();
  }

  /** Creates a value that converts tokens with the default strategy for {@code type}. */
  public static <T> ScalarValue<T> of(Class<T> type) {
    return new ScalarValue<>(type, Converters.forType(type));
  }

  public static <T> ScalarValue<T> of(Class<T> type, Converter<T> converter) {
    return new ScalarValue<>(type, converter);
  }

  @Nullable
  public T get() {
    return value;
  }

  /** Replaces the value; meant for assign actions. */
  public void set(@Nullable T value) {
    this.value = value;
  }

  @Override
  protected void store(T element) {
    value = element;
  }

  @Override
  protected void doReset() {
    value = zero();
  }

  @Nullable
  private T zero() {
    return getType().cast(Defaults.defaultValue(Primitives.unwrap(getType())));
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
