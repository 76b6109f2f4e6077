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

import java.util.Optional;
import javax.annotation.Nullable;

/** A value that is empty until an argument assigns it. The last assignment wins. */
public final class OptionalValue<T> extends ConvertedValue<T> {
  private Optional<T> value = Optional.empty();

  private OptionalValue(Class<T> type, @Nullable Converter<T> converter) {
    super(type, converter);
  }

  public static <T> OptionalValue<T> of(Class<T> type) {
    return new OptionalValue<>(type, Converters.forType(type));
  }

  public static <T> OptionalValue<T> of(Class<T> type, Converter<T> converter) {
    return new OptionalValue<>(type, converter);
  }

  public Optional<T> get() {
    return value;
  }

  public void set(Optional<T> value) {
    this.value = value;
  }

  @Override
  protected void store(T element) {
    value = Optional.of(element);
  }

  @Override
  protected void doReset() {
    value = Optional.empty();
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
