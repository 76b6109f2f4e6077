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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Paths;
import java.time.Duration;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Converters}. */
@RunWith(JUnit4.class)
public class ConvertersTest {

  @Test
  public void booleanConverterAcceptsShorthands() throws Exception {
    Converters.BooleanConverter converter = new Converters.BooleanConverter();
    for (String input : new String[] {"true", "1", "YES", "t", "y", "on"}) {
      assertThat(converter.convert(input)).isTrue();
    }
    for (String input : new String[] {"false", "0", "no", "F", "n", "off"}) {
      assertThat(converter.convert(input)).isFalse();
    }
    assertThrows(ArgumentParsingException.class, () -> converter.convert("maybe"));
  }

  @Test
  public void integerConverterDecodesNegativeAndHexNumbers() throws Exception {
    Converters.IntegerConverter converter = new Converters.IntegerConverter();
    assertThat(converter.convert("-5")).isEqualTo(-5);
    assertThat(converter.convert("0x10")).isEqualTo(16);
    ArgumentParsingException e =
        assertThrows(ArgumentParsingException.class, () -> converter.convert("five"));
    assertThat(e).hasMessageThat().isEqualTo("'five' is not an int");
    assertThat(e).hasCauseThat().isInstanceOf(NumberFormatException.class);
  }

  @Test
  public void doubleConverterAcceptsNegativeFractions() throws Exception {
    assertThat(new Converters.DoubleConverter().convert("-0.25")).isEqualTo(-0.25);
  }

  @Test
  public void characterConverterNeedsExactlyOneCharacter() throws Exception {
    Converters.CharacterConverter converter = new Converters.CharacterConverter();
    assertThat(converter.convert("x")).isEqualTo('x');
    assertThrows(ArgumentParsingException.class, () -> converter.convert("xy"));
  }

  @Test
  public void durationConverter() throws Exception {
    Converters.DurationConverter converter = new Converters.DurationConverter();
    assertThat(converter.convert("0")).isEqualTo(Duration.ZERO);
    assertThat(converter.convert("3d")).isEqualTo(Duration.ofDays(3));
    assertThat(converter.convert("90s")).isEqualTo(Duration.ofSeconds(90));
    assertThat(converter.convert("15ms")).isEqualTo(Duration.ofMillis(15));
    assertThrows(ArgumentParsingException.class, () -> converter.convert("1y"));
  }

  @Test
  public void forTypeFindsDefaultConverters() throws Exception {
    assertThat(Converters.forType(int.class)).isInstanceOf(Converters.IntegerConverter.class);
    assertThat(Converters.forType(Long.class)).isInstanceOf(Converters.LongConverter.class);
    assertThat(Converters.forType(BigInteger.class).convert("12345678901234567890", null))
        .isEqualTo(new BigInteger("12345678901234567890"));
    assertThat(Converters.forType(BigDecimal.class).convert("1.50", null))
        .isEqualTo(new BigDecimal("1.50"));
    assertThat(Converters.forType(java.nio.file.Path.class).convert("a/b", null))
        .isEqualTo(Paths.get("a/b"));
  }

  /** A type that can only be created through its constructor. */
  public static final class Host {
    final String name;

    public Host(String name) {
      if (name.isEmpty()) {
        throw new IllegalArgumentException("empty host");
      }
      this.name = name;
    }
  }

  /** A type with a static factory. */
  public static final class Port {
    final int number;

    private Port(int number) {
      this.number = number;
    }

    public static Port fromString(String value) {
      return new Port(Integer.parseInt(value));
    }
  }

  @Test
  public void forTypeFallsBackToConstructors() throws Exception {
    Converter<Host> converter = Converters.forType(Host.class);
    assertThat(converter).isNotNull();
    assertThat(converter.convert("example.com", null).name).isEqualTo("example.com");
    ArgumentParsingException e =
        assertThrows(ArgumentParsingException.class, () -> converter.convert("", null));
    assertThat(e).hasCauseThat().isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void forTypeFallsBackToStaticFactories() throws Exception {
    Converter<Port> converter = Converters.forType(Port.class);
    assertThat(converter).isNotNull();
    assertThat(converter.convert("8080", null).number).isEqualTo(8080);
    assertThrows(ArgumentParsingException.class, () -> converter.convert("http", null));
  }

  @Test
  public void forTypeReturnsNullForUnconvertibleTypes() {
    assertThat(Converters.forType(Object[].class)).isNull();
    assertThat(Converters.forType(Runnable.class)).isNull();
  }

  @Test
  public void joinEnglishList() {
    assertThat(Converters.joinEnglishList(java.util.Arrays.asList())).isEqualTo("nothing");
    assertThat(Converters.joinEnglishList(java.util.Arrays.asList("one"))).isEqualTo("one");
    assertThat(Converters.joinEnglishList(java.util.Arrays.asList("one", "two", "three")))
        .isEqualTo("one, two or three");
  }
}
