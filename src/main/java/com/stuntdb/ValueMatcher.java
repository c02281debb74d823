/*
 * Copyright 2026 The StuntDB Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.stuntdb;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Calendar;
import java.util.Date;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Type-aware comparison of expected arguments against the arguments a call actually bound.
 * <p>
 * Rules, applied per position:
 * <ul>
 *   <li>An {@link ArgumentMatcher} decides on its own</li>
 *   <li>{@code null} matches only {@code null}</li>
 *   <li>Text, integer, floating-point, decimal, boolean and byte array values match by value, but only within the
 *   same family: {@code 1} never matches {@code "1"}, and {@code 1} never matches {@code 1.0}. Integer widths are
 *   interchangeable ({@code Integer} 1 matches {@code Long} 1). Floating-point values are compared exactly,
 *   after widening to {@code double}</li>
 *   <li>Calendar values of the same type match regardless of the time they hold: a {@link LocalDate} matches any
 *   {@link LocalDate}, an {@link Instant} any {@link Instant}, and so on for {@link LocalDateTime},
 *   {@link LocalTime}, {@link OffsetDateTime}, {@link OffsetTime} and {@link ZonedDateTime}. {@link Date} and its
 *   {@code java.sql} subclasses form one type, as do {@link Calendar} implementations. Calendar values of different
 *   types never match. Use an {@link ArgumentMatcher} to pin an exact time</li>
 *   <li>Any other pairing is a non-match</li>
 * </ul>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ValueMatcher {
	private ValueMatcher() {
		// Prevents instantiation
	}

	/**
	 * Do the bound arguments satisfy the expected ones?
	 *
	 * @param expected the expected arguments, or {@code null} if arguments are unchecked
	 * @param actual   the arguments the call bound, in positional order
	 * @return {@code true} if every position matches (or checking is disabled), {@code false} otherwise
	 */
	public static boolean matches(@Nullable List<?> expected,
																@NonNull List<?> actual) {
		requireNonNull(actual);

		if (expected == null)
			return true;

		if (expected.size() != actual.size())
			return false;

		for (int i = 0; i < expected.size(); ++i)
			if (!matches(expected.get(i), actual.get(i)))
				return false;

		return true;
	}

	/**
	 * Does a single bound value satisfy a single expected value?
	 *
	 * @param expected the expected value, possibly an {@link ArgumentMatcher}
	 * @param actual   the value the call bound
	 * @return {@code true} if the values match, {@code false} otherwise
	 */
	public static boolean matches(@Nullable Object expected,
																@Nullable Object actual) {
		if (expected instanceof ArgumentMatcher argumentMatcher)
			return argumentMatcher.matches(actual);

		if (expected == null || actual == null)
			return expected == null && actual == null;

		if (isCalendarValue(expected))
			return isCalendarValue(actual) && calendarType(expected) == calendarType(actual);

		if (isIntegral(expected))
			return isIntegral(actual) && toBigInteger((Number) expected).equals(toBigInteger((Number) actual));

		if (isFloatingPoint(expected))
			return isFloatingPoint(actual)
					&& Double.doubleToLongBits(((Number) expected).doubleValue()) == Double.doubleToLongBits(((Number) actual).doubleValue());

		if (expected instanceof BigDecimal expectedDecimal)
			return actual instanceof BigDecimal actualDecimal && expectedDecimal.compareTo(actualDecimal) == 0;

		if (expected instanceof String expectedString)
			return actual instanceof String && expectedString.equals(actual);

		if (expected instanceof Boolean expectedBoolean)
			return actual instanceof Boolean && expectedBoolean.equals(actual);

		if (expected instanceof byte[] expectedBytes)
			return actual instanceof byte[] actualBytes && Arrays.equals(expectedBytes, actualBytes);

		return false;
	}

	static boolean isCalendarValue(@NonNull Object value) {
		requireNonNull(value);

		return value instanceof Date
				|| value instanceof Calendar
				|| value instanceof Instant
				|| value instanceof LocalDate
				|| value instanceof LocalDateTime
				|| value instanceof LocalTime
				|| value instanceof OffsetDateTime
				|| value instanceof OffsetTime
				|| value instanceof ZonedDateTime;
	}

	@NonNull
	private static Class<?> calendarType(@NonNull Object value) {
		if (value instanceof Date)
			return Date.class;

		if (value instanceof Calendar)
			return Calendar.class;

		return value.getClass();
	}

	private static boolean isIntegral(@NonNull Object value) {
		return value instanceof Byte
				|| value instanceof Short
				|| value instanceof Integer
				|| value instanceof Long
				|| value instanceof BigInteger;
	}

	private static boolean isFloatingPoint(@NonNull Object value) {
		return value instanceof Float || value instanceof Double;
	}

	@NonNull
	private static BigInteger toBigInteger(@NonNull Number number) {
		return number instanceof BigInteger bigInteger ? bigInteger : BigInteger.valueOf(number.longValue());
	}
}
