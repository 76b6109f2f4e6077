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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** A test for {@link EnumConverter}. */
@RunWith(JUnit4.class)
public class EnumConverterTest {

  private enum CompilationMode {
    DBG,
    OPT
  }

  private static class CompilationModeConverter extends EnumConverter<CompilationMode> {
    public CompilationModeConverter() {
      super(CompilationMode.class, "compilation mode");
    }
  }

  @Test
  public void converterForEnumWithTwoValues() throws Exception {
    CompilationModeConverter converter = new CompilationModeConverter();
    assertThat(converter.convert("dbg")).isEqualTo(CompilationMode.DBG);
    assertThat(converter.convert("opt")).isEqualTo(CompilationMode.OPT);
    ArgumentParsingException e =
        assertThrows(ArgumentParsingException.class, () -> converter.convert("none"));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Not a valid compilation mode: 'none' (should be dbg or opt)");
    assertThat(e.getInvalidArgument()).isEqualTo("none");
    assertThat(converter.getTypeDescription()).isEqualTo("dbg or opt");
  }

  private enum Fruit {
    Apple,
    Banana,
    Cherry
  }

  @Test
  public void typeDescriptionForEnumWithThreeValues() {
    EnumConverter<Fruit> converter = new EnumConverter<>(Fruit.class, "fruit");
    // Always lowercase in the user-visible messages.
    assertThat(converter.getTypeDescription()).isEqualTo("apple, banana or cherry");
  }

  @Test
  public void converterIsCaseInsensitive() throws Exception {
    EnumConverter<Fruit> converter = new EnumConverter<>(Fruit.class, "fruit");
    assertThat(converter.convert("bAnANa")).isSameInstanceAs(Fruit.Banana);
  }

  @Test
  public void enumTargetsResolveAnEnumConverter() {
    ListValue<Fruit> fruits = ListValue.of(Fruit.class);
    ArgumentParser parser = new ArgumentParser();
    parser.addArgument(fruits, "--fruit").nargs(1);

    ParseResult result = parser.parse("--fruit=cherry", "--fruit", "APPLE");

    assertThat(result.isSuccess()).isTrue();
    assertThat(fruits.get()).containsExactly(Fruit.Cherry, Fruit.Apple).inOrder();
  }
}
