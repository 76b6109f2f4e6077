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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** A sequence of values in the order of the tokens that produced them. */
public final class ListValue<T> extends ConvertedValue<T> {
  private final List<T> values = new ArrayList<>();

  private ListValue(Class<T> type, @Nullable Converter<T> converter) {
    super(type, converter);
  }

  public static <T> ListValue<T> of(Class<T> type) {
    return new ListValue<>(type, Converters.forType(type));
  }

  public static <T> ListValue<T> of(Class<T> type, Converter<T> converter) {
    return new ListValue<>(type, converter);
  }

  /** Returns a snapshot of the collected values. */
  public ImmutableList<T> get() {
    return ImmutableList.copyOf(values);
  }

  public void add(T element) {
    values.add(element);
  }

  public int size() {
    return values.size();
  }

  @Override
  protected void store(T element) {
    values.add(element);
  }

  @Override
  protected void doReset() {
    values.clear();
  }

  @Override
  boolean isSequence() {
    return true;
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
