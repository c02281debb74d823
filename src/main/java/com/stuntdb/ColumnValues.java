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
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.sql.JDBCType;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Calendar;
import java.util.Date;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Converts programmed row values to the Java types requested through {@link java.sql.ResultSet} getters.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class ColumnValues {
	@NonNull
	static final String INVALID_CAST_SQL_STATE = "22018";
	@NonNull
	static final String OUT_OF_RANGE_SQL_STATE = "22003";

	@NonNull
	private static final Pattern DATE_PATTERN;
	@NonNull
	private static final Pattern DATE_TIME_PATTERN;
	@NonNull
	private static final Pattern OFFSET_DATE_TIME_PATTERN;
	@NonNull
	private static final Pattern TIME_PATTERN;
	@NonNull
	private static final Map<Class<?>, Object> PRIMITIVE_DEFAULTS;
	@NonNull
	private static final Map<Class<?>, Class<?>> WRAPPERS_BY_PRIMITIVE;

	static {
		DATE_PATTERN = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
		DATE_TIME_PATTERN = Pattern.compile("\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?");
		OFFSET_DATE_TIME_PATTERN = Pattern.compile("\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?(Z|[+-]\\d{2}:\\d{2})");
		TIME_PATTERN = Pattern.compile("\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?");

		PRIMITIVE_DEFAULTS = Map.of(
				boolean.class, false,
				byte.class, (byte) 0,
				short.class, (short) 0,
				int.class, 0,
				long.class, 0L,
				float.class, 0F,
				double.class, 0D,
				char.class, '\0'
		);

		WRAPPERS_BY_PRIMITIVE = Map.of(
				boolean.class, Boolean.class,
				byte.class, Byte.class,
				short.class, Short.class,
				int.class, Integer.class,
				long.class, Long.class,
				float.class, Float.class,
				double.class, Double.class,
				char.class, Character.class
		);
	}

	private ColumnValues() {
		// Non-instantiable
	}

	/**
	 * Converts {@code value} to {@code targetType}.
	 * <p>
	 * {@code null} converts to {@code null}, or to the zero value when {@code targetType} is primitive.
	 *
	 * @param value      the programmed value
	 * @param targetType the requested type
	 * @return the converted value
	 * @throws SQLException if the value cannot be represented as {@code targetType}
	 */
	@Nullable
	static Object convert(@Nullable Object value,
												@NonNull Class<?> targetType) throws SQLException {
		requireNonNull(targetType);

		if (value == null)
			return PRIMITIVE_DEFAULTS.get(targetType);

		Class<?> type = targetType.isPrimitive() ? WRAPPERS_BY_PRIMITIVE.get(targetType) : targetType;

		if (type == Object.class || type.isInstance(value))
			return value;

		if (type == String.class)
			return toString(value);

		if (type == Boolean.class)
			return toBoolean(value);

		if (type == Byte.class || type == Short.class || type == Integer.class || type == Long.class
				|| type == BigInteger.class || type == BigDecimal.class)
			return toExactNumber(value, type);

		if (type == Double.class)
			return toBigDecimal(value, type).doubleValue();

		if (type == Float.class)
			return toBigDecimal(value, type).floatValue();

		if (type == byte[].class && value instanceof String string)
			return string.getBytes(StandardCharsets.UTF_8);

		if (type == Reader.class)
			return new StringReader(toString(value));

		if (type == InputStream.class) {
			if (value instanceof byte[] bytes)
				return new ByteArrayInputStream(bytes);

			return new ByteArrayInputStream(toString(value).getBytes(StandardCharsets.UTF_8));
		}

		if (type == UUID.class && value instanceof String string) {
			try {
				return UUID.fromString(string.trim());
			} catch (IllegalArgumentException e) {
				throw conversionFailure(value, type, e);
			}
		}

		Object temporalValue = value instanceof String string ? parseTemporal(string, type) : value;

		if (temporalValue != null && ValueMatcher.isCalendarValue(temporalValue)) {
			Object temporal = toTemporal(temporalValue, type);

			if (temporal != null)
				return temporal;
		}

		throw conversionFailure(value, type, null);
	}

	/**
	 * The JDBC type which best describes {@code value}, as reported by result set metadata.
	 *
	 * @param value a programmed value
	 * @return the JDBC type
	 */
	@NonNull
	static JDBCType jdbcTypeFor(@Nullable Object value) {
		if (value == null)
			return JDBCType.NULL;
		if (value instanceof String)
			return JDBCType.VARCHAR;
		if (value instanceof Boolean)
			return JDBCType.BOOLEAN;
		if (value instanceof Byte)
			return JDBCType.TINYINT;
		if (value instanceof Short)
			return JDBCType.SMALLINT;
		if (value instanceof Integer)
			return JDBCType.INTEGER;
		if (value instanceof Long || value instanceof BigInteger)
			return JDBCType.BIGINT;
		if (value instanceof Float)
			return JDBCType.REAL;
		if (value instanceof Double)
			return JDBCType.DOUBLE;
		if (value instanceof BigDecimal)
			return JDBCType.DECIMAL;
		if (value instanceof byte[])
			return JDBCType.VARBINARY;
		if (value instanceof java.sql.Date || value instanceof LocalDate)
			return JDBCType.DATE;
		if (value instanceof Time || value instanceof LocalTime)
			return JDBCType.TIME;
		if (value instanceof OffsetTime)
			return JDBCType.TIME_WITH_TIMEZONE;
		if (value instanceof OffsetDateTime || value instanceof ZonedDateTime)
			return JDBCType.TIMESTAMP_WITH_TIMEZONE;
		if (ValueMatcher.isCalendarValue(value))
			return JDBCType.TIMESTAMP;

		return JDBCType.JAVA_OBJECT;
	}

	@NonNull
	private static String toString(@NonNull Object value) {
		requireNonNull(value);

		if (value instanceof BigDecimal bigDecimal)
			return bigDecimal.toPlainString();

		if (value instanceof byte[] bytes)
			return new String(bytes, StandardCharsets.UTF_8);

		return value.toString();
	}

	@NonNull
	private static Boolean toBoolean(@NonNull Object value) throws SQLException {
		requireNonNull(value);

		if (value instanceof Number number)
			return toBigDecimal(number, Boolean.class).signum() != 0;

		if (value instanceof String string) {
			String normalized = string.trim();

			if (normalized.equalsIgnoreCase("true") || normalized.equals("1"))
				return true;
			if (normalized.equalsIgnoreCase("false") || normalized.equals("0"))
				return false;
		}

		throw conversionFailure(value, Boolean.class, null);
	}

	@NonNull
	private static Object toExactNumber(@NonNull Object value,
																			@NonNull Class<?> type) throws SQLException {
		requireNonNull(value);
		requireNonNull(type);

		BigDecimal bigDecimal = toBigDecimal(value, type);

		if (type == BigDecimal.class)
			return bigDecimal;

		try {
			if (type == Byte.class)
				return bigDecimal.byteValueExact();
			if (type == Short.class)
				return bigDecimal.shortValueExact();
			if (type == Integer.class)
				return bigDecimal.intValueExact();
			if (type == Long.class)
				return bigDecimal.longValueExact();

			return bigDecimal.toBigIntegerExact();
		} catch (ArithmeticException e) {
			throw new SQLException(format("Value %s cannot be represented exactly as %s", Values.describe(value),
					type.getSimpleName()), OUT_OF_RANGE_SQL_STATE, e);
		}
	}

	@NonNull
	private static BigDecimal toBigDecimal(@NonNull Object value,
																				 @NonNull Class<?> type) throws SQLException {
		requireNonNull(value);
		requireNonNull(type);

		try {
			if (value instanceof BigDecimal bigDecimal)
				return bigDecimal;
			if (value instanceof BigInteger bigInteger)
				return new BigDecimal(bigInteger);
			if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long)
				return BigDecimal.valueOf(((Number) value).longValue());
			if (value instanceof Float || value instanceof Double)
				return new BigDecimal(value.toString());
			if (value instanceof Boolean bool)
				return bool ? BigDecimal.ONE : BigDecimal.ZERO;
			if (value instanceof String string)
				return new BigDecimal(string.trim());
		} catch (NumberFormatException e) {
			// Infinity and NaN land here too
			throw conversionFailure(value, type, e);
		}

		throw conversionFailure(value, type, null);
	}

	@Nullable
	private static Object toTemporal(@NonNull Object value,
																	 @NonNull Class<?> type) {
		requireNonNull(value);
		requireNonNull(type);

		if (type.isInstance(value))
			return value;

		LocalDateTime localDateTime = toLocalDateTime(value);

		if (type == Timestamp.class || type == Date.class)
			return localDateTime == null ? null : Timestamp.valueOf(localDateTime);
		if (type == java.sql.Date.class) {
			if (value instanceof LocalDate localDate)
				return java.sql.Date.valueOf(localDate);
			return localDateTime == null ? null : java.sql.Date.valueOf(localDateTime.toLocalDate());
		}
		if (type == Time.class) {
			if (value instanceof LocalTime localTime)
				return Time.valueOf(localTime);
			return localDateTime == null ? null : Time.valueOf(localDateTime.toLocalTime());
		}
		if (type == LocalDate.class) {
			if (value instanceof java.sql.Date sqlDate)
				return sqlDate.toLocalDate();
			return localDateTime == null ? null : localDateTime.toLocalDate();
		}
		if (type == LocalTime.class) {
			if (value instanceof Time time)
				return time.toLocalTime();
			return localDateTime == null ? null : localDateTime.toLocalTime();
		}
		if (type == LocalDateTime.class)
			return localDateTime;
		if (type == Instant.class)
			return localDateTime == null ? null : localDateTime.atZone(ZoneId.systemDefault()).toInstant();
		if (type == OffsetDateTime.class) {
			if (value instanceof ZonedDateTime zonedDateTime)
				return zonedDateTime.toOffsetDateTime();
			return localDateTime == null ? null : localDateTime.atZone(ZoneId.systemDefault()).toOffsetDateTime();
		}
		if (type == ZonedDateTime.class) {
			if (value instanceof OffsetDateTime offsetDateTime)
				return offsetDateTime.toZonedDateTime();
			return localDateTime == null ? null : localDateTime.atZone(ZoneId.systemDefault());
		}

		return null;
	}

	// ISO-8601 dates, times and date-times; a space may separate date and time
	@Nullable
	private static Object parseTemporal(@NonNull String string,
																			@NonNull Class<?> type) throws SQLException {
		requireNonNull(string);
		requireNonNull(type);

		String normalized = string.trim();

		try {
			if (DATE_PATTERN.matcher(normalized).matches())
				return LocalDate.parse(normalized);
			if (OFFSET_DATE_TIME_PATTERN.matcher(normalized).matches())
				return OffsetDateTime.parse(normalized.replace(' ', 'T'));
			if (DATE_TIME_PATTERN.matcher(normalized).matches())
				return LocalDateTime.parse(normalized.replace(' ', 'T'));
			if (TIME_PATTERN.matcher(normalized).matches())
				return LocalTime.parse(normalized);
		} catch (DateTimeParseException e) {
			throw conversionFailure(string, type, e);
		}

		return null;
	}

	// Date-only and time-only values widen to midnight and the epoch date respectively
	@Nullable
	private static LocalDateTime toLocalDateTime(@NonNull Object value) {
		requireNonNull(value);

		if (value instanceof LocalDateTime localDateTime)
			return localDateTime;
		if (value instanceof LocalDate localDate)
			return localDate.atStartOfDay();
		if (value instanceof LocalTime localTime)
			return localTime.atDate(LocalDate.EPOCH);
		if (value instanceof Timestamp timestamp)
			return timestamp.toLocalDateTime();
		if (value instanceof java.sql.Date sqlDate)
			return sqlDate.toLocalDate().atStartOfDay();
		if (value instanceof Time time)
			return time.toLocalTime().atDate(LocalDate.EPOCH);
		if (value instanceof Date date)
			return LocalDateTime.ofInstant(date.toInstant(), ZoneId.systemDefault());
		if (value instanceof Calendar calendar)
			return LocalDateTime.ofInstant(calendar.toInstant(), calendar.getTimeZone().toZoneId());
		if (value instanceof Instant instant)
			return LocalDateTime.ofInstant(instant, ZoneId.systemDefault());
		if (value instanceof OffsetDateTime offsetDateTime)
			return offsetDateTime.atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
		if (value instanceof ZonedDateTime zonedDateTime)
			return zonedDateTime.withZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
		if (value instanceof OffsetTime offsetTime)
			return offsetTime.withOffsetSameInstant(ZoneOffset.UTC).toLocalTime().atDate(LocalDate.EPOCH);

		return null;
	}

	@NonNull
	private static SQLException conversionFailure(@NonNull Object value,
																								@NonNull Class<?> type,
																								@Nullable Throwable cause) {
		requireNonNull(value);
		requireNonNull(type);

		return new SQLException(format("Unable to convert %s to %s", Values.describe(value), type.getSimpleName()),
				INVALID_CAST_SQL_STATE, cause);
	}
}
