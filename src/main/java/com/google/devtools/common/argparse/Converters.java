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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Primitives;
import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Iterator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/** The converters that value targets use when the caller does not supply one. */
public final class Converters {

  private static final ImmutableList<String> ENABLED_REPS =
      ImmutableList.of("true", "1", "yes", "t", "y", "on");

  private static final ImmutableList<String> DISABLED_REPS =
      ImmutableList.of("false", "0", "no", "f", "n", "off");

  private Converters() {}

  /** Standard converter for booleans. Accepts common shorthands/synonyms. */
  public static class BooleanConverter extends Converter.Contextless<Boolean> {
    @Override
    public Boolean convert(String input) throws ArgumentParsingException {
      String lowered = Ascii.toLowerCase(input);
      if (ENABLED_REPS.contains(lowered)) {
        return true;
      }
      if (DISABLED_REPS.contains(lowered)) {
        return false;
      }
      throw new ArgumentParsingException("'" + input + "' is not a boolean", input);
    }

    @Override
    public String getTypeDescription() {
      return "a boolean";
    }
  }

  /** Standard converter for Strings. */
  public static class StringConverter extends Converter.Contextless<String> {
    @Override
    public String convert(String input) {
      return input;
    }

    @Override
    public String getTypeDescription() {
      return "a string";
    }
  }

  /** Standard converter for integers. */
  public static class IntegerConverter extends Converter.Contextless<Integer> {
    @Override
    public Integer convert(String input) throws ArgumentParsingException {
      try {
        return Integer.decode(input);
      } catch (NumberFormatException e) {
        throw new ArgumentParsingException("'" + input + "' is not an int", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "an integer";
    }
  }

  /** Standard converter for longs. */
  public static class LongConverter extends Converter.Contextless<Long> {
    @Override
    public Long convert(String input) throws ArgumentParsingException {
      try {
        return Long.decode(input);
      } catch (NumberFormatException e) {
        throw new ArgumentParsingException("'" + input + "' is not a long", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "a long integer";
    }
  }

  /** Standard converter for shorts. */
  public static class ShortConverter extends Converter.Contextless<Short> {
    @Override
    public Short convert(String input) throws ArgumentParsingException {
      try {
        return Short.decode(input);
      } catch (NumberFormatException e) {
        throw new ArgumentParsingException("'" + input + "' is not a short", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "a short integer";
    }
  }

  /** Standard converter for bytes. */
  public static class ByteConverter extends Converter.Contextless<Byte> {
    @Override
    public Byte convert(String input) throws ArgumentParsingException {
      try {
        return Byte.decode(input);
      } catch (NumberFormatException e) {
        throw new ArgumentParsingException("'" + input + "' is not a byte", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "a byte";
    }
  }

  /** Standard converter for doubles. */
  public static class DoubleConverter extends Converter.Contextless<Double> {
    @Override
    public Double convert(String input) throws ArgumentParsingException {
      try {
        return Double.parseDouble(input);
      } catch (NumberFormatException e) {
        throw new ArgumentParsingException("'" + input + "' is not a double", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "a double";
    }
  }

  /** Standard converter for floats. */
  public static class FloatConverter extends Converter.Contextless<Float> {
    @Override
    public Float convert(String input) throws ArgumentParsingException {
      try {
        return Float.parseFloat(input);
      } catch (NumberFormatException e) {
        throw new ArgumentParsingException("'" + input + "' is not a float", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "a float";
    }
  }

  /** Converts single-character tokens. */
  public static class CharacterConverter extends Converter.Contextless<Character> {
    @Override
    public Character convert(String input) throws ArgumentParsingException {
      if (input.length() != 1) {
        throw new ArgumentParsingException("'" + input + "' is not a single character", input);
      }
      return input.charAt(0);
    }

    @Override
    public String getTypeDescription() {
      return "a character";
    }
  }

  /** Standard converter for {@link BigInteger}. */
  public static class BigIntegerConverter extends Converter.Contextless<BigInteger> {
    @Override
    public BigInteger convert(String input) throws ArgumentParsingException {
      try {
        return new BigInteger(input);
      } catch (NumberFormatException e) {
        throw new ArgumentParsingException("'" + input + "' is not an integer", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "an arbitrary-precision integer";
    }
  }

  /** Standard converter for {@link BigDecimal}. */
  public static class BigDecimalConverter extends Converter.Contextless<BigDecimal> {
    @Override
    public BigDecimal convert(String input) throws ArgumentParsingException {
      try {
        return new BigDecimal(input);
      } catch (NumberFormatException e) {
        throw new ArgumentParsingException("'" + input + "' is not a decimal number", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "a decimal number";
    }
  }

  /** Standard converter for the {@link java.time.Duration} type. */
  public static class DurationConverter extends Converter.Contextless<Duration> {
    private final Pattern durationRegex = Pattern.compile("^([0-9]+)(d|h|m|s|ms)$");

    @Override
    public Duration convert(String input) throws ArgumentParsingException {
      // '0' doesn't need a unit.
      if ("0".equals(input)) {
        return Duration.ZERO;
      }
      Matcher m = durationRegex.matcher(input);
      if (!m.matches()) {
        throw new ArgumentParsingException("Illegal duration '" + input + "'.", input);
      }
      long duration = Long.parseLong(m.group(1));
      String unit = m.group(2);
      switch (unit) {
        case "d":
          return Duration.ofDays(duration);
        case "h":
          return Duration.ofHours(duration);
        case "m":
          return Duration.ofMinutes(duration);
        case "s":
          return Duration.ofSeconds(duration);
        case "ms":
          return Duration.ofMillis(duration);
        default:
          throw new IllegalStateException(
              "This must not happen. Did you update the regex without the switch case?");
      }
    }

    @Override
    public String getTypeDescription() {
      return "An immutable length of time.";
    }
  }

  /** Converts tokens to file system paths without touching the file system. */
  public static class PathConverter extends Converter.Contextless<Path> {
    @Override
    public Path convert(String input) throws ArgumentParsingException {
      try {
        return Paths.get(input);
      } catch (InvalidPathException e) {
        throw new ArgumentParsingException("'" + input + "' is not a valid path", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "a path";
    }
  }

  /**
   * Converts through a public static {@code valueOf(String)} or {@code fromString(String)} factory,
   * or a public constructor taking a single String. Exceptions thrown by the factory become
   * conversion errors.
   */
  static final class FactoryConverter<T> extends Converter.Contextless<T> {
    private final Class<T> type;
    private final Executable factory;

    private FactoryConverter(Class<T> type, Executable factory) {
      this.type = type;
      this.factory = factory;
    }

    @Override
    public T convert(String input) throws ArgumentParsingException {
      try {
        Object result =
            factory instanceof Constructor
                ? ((Constructor<?>) factory).newInstance(input)
                : ((Method) factory).invoke(null, input);
        return type.cast(result);
      } catch (InvocationTargetException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        throw new ArgumentParsingException(
            "'" + input + "' is not a valid " + type.getSimpleName() + ": " + cause.getMessage(),
            input,
            cause);
      } catch (ReflectiveOperationException e) {
        throw new ArgumentParsingException(
            "Can not create " + type.getSimpleName() + " from '" + input + "'", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "a " + type.getSimpleName();
    }

    @Nullable
    static <T> FactoryConverter<T> find(Class<T> type) {
      for (String name : new String[] {"valueOf", "fromString"}) {
        try {
          Method method = type.getMethod(name, String.class);
          if (Modifier.isStatic(method.getModifiers())
              && type.isAssignableFrom(method.getReturnType())) {
            return new FactoryConverter<>(type, method);
          }
        } catch (NoSuchMethodException e) {
          // Try the next strategy.
        }
      }
      if (Modifier.isAbstract(type.getModifiers()) || type.isInterface()) {
        return null;
      }
      try {
        return new FactoryConverter<>(type, type.getConstructor(String.class));
      } catch (NoSuchMethodException e) {
        return null;
      }
    }
  }

  /**
   * The converters that are available to value targets by default, keyed by the boxed type of the
   * target.
   */
  public static final ImmutableMap<Class<?>, Converter<?>> DEFAULT_CONVERTERS =
      new ImmutableMap.Builder<Class<?>, Converter<?>>()
          .put(String.class, new StringConverter())
          .put(Integer.class, new IntegerConverter())
          .put(Long.class, new LongConverter())
          .put(Short.class, new ShortConverter())
          .put(Byte.class, new ByteConverter())
          .put(Double.class, new DoubleConverter())
          .put(Float.class, new FloatConverter())
          .put(Boolean.class, new BooleanConverter())
          .put(Character.class, new CharacterConverter())
          .put(BigInteger.class, new BigIntegerConverter())
          .put(BigDecimal.class, new BigDecimalConverter())
          .put(Duration.class, new DurationConverter())
          .put(Path.class, new PathConverter())
          .build();

  /**
   * Resolves the conversion strategy for {@code type}: a default converter, an {@link
   * EnumConverter}, or a {@link FactoryConverter} over a factory method or constructor. Returns
   * null if the type can not be created from a string.
   */
  @Nullable
  @SuppressWarnings("unchecked")
  public static <T> Converter<T> forType(Class<T> type) {
    Class<T> boxed = Primitives.wrap(type);
    Converter<?> converter = DEFAULT_CONVERTERS.get(boxed);
    if (converter != null) {
      return (Converter<T>) converter;
    }
    if (boxed.isEnum()) {
      return (Converter<T>) enumConverter(boxed.asSubclass(Enum.class));
    }
    return FactoryConverter.find(boxed);
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static Converter<?> enumConverter(Class<? extends Enum> enumType) {
    return new EnumConverter(enumType, Ascii.toLowerCase(enumType.getSimpleName()));
  }

  /**
   * Join a list of words as in English. Examples: "nothing" "one" "one or two" "one and two" "one,
   * two or three". "one, two and three". The toString method of each element is used.
   */
  static String joinEnglishList(Iterable<?> choices) {
    StringBuilder buf = new StringBuilder();
    for (Iterator<?> ii = choices.iterator(); ii.hasNext(); ) {
      Object choice = ii.next();
      if (buf.length() > 0) {
        buf.append(ii.hasNext() ? ", " : " or ");
      }
      buf.append(choice);
    }
    return buf.length() == 0 ? "nothing" : buf.toString();
  }
}
