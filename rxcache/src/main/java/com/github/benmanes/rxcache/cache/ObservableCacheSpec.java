/*
 * Copyright 2026 Ben Manes. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.benmanes.rxcache.cache;

import static com.github.benmanes.rxcache.cache.ObservableCacheBuilder.requireArgument;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.jspecify.annotations.Nullable;

/**
 * A specification of a {@link ObservableCacheBuilder} configuration.
 * <p>
 * {@code ObservableCacheSpec} supports parsing configuration off of a string, which makes it
 * especially useful for command-line configuration of an {@code ObservableCacheBuilder}.
 * <p>
 * The string syntax is a series of comma-separated keys or key-value pairs, each corresponding to
 * an {@code ObservableCacheBuilder} method.
 * <ul>
 *   <li>{@code expireAfter=[duration]}: sets {@link ObservableCacheBuilder#expireAfter}.
 *   <li>{@code expirationType=[doNothing|remove|update]}: sets
 *       {@link ObservableCacheBuilder#expirationType}.
 *   <li>{@code expirationTolerance=[duration]}: sets
 *       {@link ObservableCacheBuilder#expirationTolerance}.
 * </ul>
 * <p>
 * Durations are represented as either an ISO-8601 string using {@link Duration#parse(CharSequence)}
 * or by an integer followed by one of "d", "h", "m", or "s", representing days, hours, minutes, or
 * seconds respectively. There is currently no short syntax to request durations in milliseconds,
 * microseconds, or nanoseconds.
 * <p>
 * Whitespace before and after commas and equal signs is ignored. Keys may not be repeated.
 * <p>
 * {@code ObservableCacheSpec} does not support configuring the methods that take a scheduler, an
 * executor, or a ticker. These must be configured in code.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class ObservableCacheSpec {
  static final String SPLIT_OPTIONS = ",";
  static final String SPLIT_KEY_VALUE = "=";

  final String specification;

  @Nullable Duration expireAfter;
  @Nullable ExpirationType expirationType;
  @Nullable Duration expirationTolerance;

  private ObservableCacheSpec(String specification) {
    this.specification = requireNonNull(specification);
  }

  /**
   * Returns a {@link ObservableCacheBuilder} configured according to this specification.
   *
   * @return a builder configured to the specification
   */
  ObservableCacheBuilder<Object, Object> toBuilder() {
    ObservableCacheBuilder<Object, Object> builder = ObservableCacheBuilder.newBuilder();
    if (expireAfter != null) {
      builder.expireAfter(expireAfter);
    }
    if (expirationType != null) {
      builder.expirationType(expirationType);
    }
    if (expirationTolerance != null) {
      builder.expirationTolerance(expirationTolerance);
    }
    return builder;
  }

  /**
   * Creates an ObservableCacheSpec from a string.
   *
   * @param specification the string form
   * @return the parsed specification
   */
  @SuppressWarnings("StringSplitter")
  public static ObservableCacheSpec parse(String specification) {
    ObservableCacheSpec spec = new ObservableCacheSpec(specification);
    for (String option : specification.split(SPLIT_OPTIONS)) {
      spec.parseOption(option.trim());
    }
    return spec;
  }

  /** Parses and applies the configuration option. */
  void parseOption(String option) {
    if (option.isEmpty()) {
      return;
    }

    @SuppressWarnings("StringSplitter")
    String[] keyAndValue = option.split(SPLIT_KEY_VALUE);
    requireArgument(keyAndValue.length <= 2,
        "key-value pair %s with more than one equals sign", option);

    String key = keyAndValue[0].trim();
    String value = (keyAndValue.length == 1) ? null : keyAndValue[1].trim();

    configure(key, value);
  }

  /** Configures the setting. */
  void configure(String key, @Nullable String value) {
    switch (key) {
      case "expireAfter":
        expireAfter(key, value);
        return;
      case "expirationType":
        expirationType(key, value);
        return;
      case "expirationTolerance":
        expirationTolerance(key, value);
        return;
      default:
        throw new IllegalArgumentException("Unknown key " + key);
    }
  }

  /** Configures the default expiry. */
  void expireAfter(String key, @Nullable String value) {
    requireArgument(expireAfter == null, "expireAfter was already set");
    expireAfter = parseDuration(key, value);
  }

  /** Configures the default expiration type. */
  void expirationType(String key, @Nullable String value) {
    requireArgument(expirationType == null, "%s was already set to %s", key, expirationType);
    expirationType = parseExpirationType(key, value);
  }

  /** Configures the sweep tolerance. */
  void expirationTolerance(String key, @Nullable String value) {
    requireArgument(expirationTolerance == null, "expirationTolerance was already set");
    expirationTolerance = parseDuration(key, value);
  }

  /** Returns a parsed long value. */
  static long parseLong(String key, @Nullable String value) {
    requireArgument((value != null) && !value.isEmpty(), "value of key %s was omitted", key);
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format(
          "key %s value was set to %s, must be a long", key, value), e);
    }
  }

  /** Returns a parsed duration value. */
  static Duration parseDuration(String key, @Nullable String value) {
    requireArgument((value != null) && !value.isEmpty(), "value of key %s omitted", key);

    @SuppressWarnings("NullAway")
    boolean isIsoFormat = value.contains("p") || value.contains("P");
    if (isIsoFormat) {
      Duration duration = Duration.parse(value);
      requireArgument(!duration.isNegative(),
          "key %s invalid format; was %s, but the duration cannot be negative", key, value);
      return duration;
    }

    @SuppressWarnings("NullAway")
    long duration = parseLong(key, value.substring(0, value.length() - 1));
    requireArgument(duration >= 0,
        "key %s invalid format; was %s, but the duration cannot be negative", key, value);
    TimeUnit unit = parseTimeUnit(key, value);
    return Duration.ofNanos(unit.toNanos(duration));
  }

  /** Returns a parsed {@link TimeUnit} value. */
  static TimeUnit parseTimeUnit(String key, @Nullable String value) {
    requireArgument((value != null) && !value.isEmpty(), "value of key %s omitted", key);
    @SuppressWarnings("NullAway")
    char lastChar = Character.toLowerCase(value.charAt(value.length() - 1));
    switch (lastChar) {
      case 'd':
        return TimeUnit.DAYS;
      case 'h':
        return TimeUnit.HOURS;
      case 'm':
        return TimeUnit.MINUTES;
      case 's':
        return TimeUnit.SECONDS;
      default:
        throw new IllegalArgumentException(String.format(
            "key %s invalid format; was %s, must end with one of [dDhHmMsS]", key, value));
    }
  }

  /** Returns a parsed {@link ExpirationType} value. */
  static ExpirationType parseExpirationType(String key, @Nullable String value) {
    requireArgument((value != null) && !value.isEmpty(), "value of key %s omitted", key);
    @SuppressWarnings("NullAway")
    String normalized = value.toLowerCase(Locale.US);
    switch (normalized) {
      case "donothing":
        return ExpirationType.DO_NOTHING;
      case "remove":
        return ExpirationType.REMOVE;
      case "update":
        return ExpirationType.UPDATE;
      default:
        throw new IllegalArgumentException(String.format(
            "key %s invalid format; was %s, must be one of [doNothing, remove, update]",
            key, value));
    }
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    } else if (!(o instanceof ObservableCacheSpec)) {
      return false;
    }
    ObservableCacheSpec spec = (ObservableCacheSpec) o;
    return Objects.equals(expireAfter, spec.expireAfter)
        && Objects.equals(expirationType, spec.expirationType)
        && Objects.equals(expirationTolerance, spec.expirationTolerance);
  }

  @Override
  public int hashCode() {
    return Objects.hash(expireAfter, expirationType, expirationTolerance);
  }

  /**
   * Returns a string that can be used to parse an equivalent {@code ObservableCacheSpec}. The
   * order and form of this representation is not guaranteed, except that parsing its output will
   * produce an {@code ObservableCacheSpec} equal to this instance.
   *
   * @return a string representation of this specification
   */
  public String toParsableString() {
    return specification;
  }

  /**
   * Returns a string representation for this {@code ObservableCacheSpec} instance. The form of
   * this representation is not guaranteed.
   */
  @Override
  public String toString() {
    return getClass().getSimpleName() + '{' + toParsableString() + '}';
  }
}
