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
import java.util.List;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Package-private helpers for rendering values and SQL in diagnostics.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class Values {
	@NonNull
	private static final Pattern WHITESPACE_PATTERN;

	static {
		WHITESPACE_PATTERN = Pattern.compile("\\s+");
	}

	private Values() {
		// Prevents instantiation
	}

	/**
	 * Collapses runs of whitespace (including newlines) to a single space and trims the ends.
	 *
	 * @param sql the SQL to normalize
	 * @return the normalized SQL
	 */
	@NonNull
	static String collapseWhitespace(@NonNull String sql) {
		requireNonNull(sql);
		return WHITESPACE_PATTERN.matcher(sql).replaceAll(" ").trim();
	}

	@NonNull
	static String describe(@Nullable List<Object> values) {
		if (values == null)
			return "(unchecked)";

		return values.stream().map(Values::describe).collect(joining(", ", "[", "]"));
	}

	@NonNull
	static String describe(@Nullable Object value) {
		if (value == null)
			return "NULL";

		if (value instanceof String)
			return format("'%s'", value);

		if (value instanceof Number || value instanceof Boolean || value instanceof ArgumentMatcher)
			return value.toString();

		if (value instanceof byte[])
			return format("[byte array of length %d]", ((byte[]) value).length);

		return format("%s (%s)", value, value.getClass().getSimpleName());
	}
}
