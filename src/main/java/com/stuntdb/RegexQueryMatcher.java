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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Package-private {@link QueryMatcher} which searches incoming SQL for a regular expression.
 *
 * @since 1.0.0
 */
@ThreadSafe
class RegexQueryMatcher implements QueryMatcher {
	@NonNull
	private final ConcurrentMap<String, Pattern> patternsByExpectedSql;

	RegexQueryMatcher() {
		this.patternsByExpectedSql = new ConcurrentHashMap<>();
	}

	@Override
	public void validate(@NonNull String expectedSql) {
		requireNonNull(expectedSql);

		try {
			compile(expectedSql);
		} catch (PatternSyntaxException e) {
			throw new ExpectationUsageException(format("Invalid SQL pattern '%s': %s", expectedSql, e.getDescription()), e);
		}
	}

	@Override
	public boolean matches(@Nullable String expectedSql,
												 @NonNull String actualSql) {
		requireNonNull(actualSql);

		if (expectedSql == null)
			return true;

		return compile(expectedSql).matcher(Values.collapseWhitespace(actualSql)).find();
	}

	@NonNull
	protected Pattern compile(@NonNull String expectedSql) {
		requireNonNull(expectedSql);
		return getPatternsByExpectedSql().computeIfAbsent(expectedSql, (sql) -> Pattern.compile(collapsePatternWhitespace(sql)));
	}

	/**
	 * Collapses runs of unescaped whitespace in a pattern to a single space and drops them at either end, so the
	 * pattern lines up with whitespace-collapsed SQL.
	 * <p>
	 * Escaped whitespace, whitespace inside a character class and whitespace inside a {@code \Q...\E} quote are
	 * kept as written.
	 *
	 * @param expectedSql the pattern as declared
	 * @return the pattern to compile
	 */
	@NonNull
	static String collapsePatternWhitespace(@NonNull String expectedSql) {
		requireNonNull(expectedSql);

		StringBuilder pattern = new StringBuilder(expectedSql.length());
		boolean quoted = false;
		int characterClassDepth = 0;
		boolean pendingSpace = false;
		int length = expectedSql.length();

		for (int i = 0; i < length; ++i) {
			char c = expectedSql.charAt(i);

			if (quoted) {
				pattern.append(c);

				if (c == '\\' && i + 1 < length && expectedSql.charAt(i + 1) == 'E') {
					pattern.append('E');
					++i;
					quoted = false;
				}

				continue;
			}

			if (characterClassDepth == 0 && Character.isWhitespace(c)) {
				pendingSpace = true;
				continue;
			}

			if (pendingSpace) {
				if (pattern.length() > 0)
					pattern.append(' ');

				pendingSpace = false;
			}

			pattern.append(c);

			if (c == '\\' && i + 1 < length) {
				char escaped = expectedSql.charAt(++i);
				pattern.append(escaped);

				if (escaped == 'Q')
					quoted = true;
			} else if (c == '[') {
				++characterClassDepth;
			} else if (c == ']' && characterClassDepth > 0) {
				--characterClassDepth;
			}
		}

		return pattern.toString();
	}

	@Override
	@NonNull
	public String toString() {
		return getClass().getSimpleName();
	}

	@NonNull
	protected ConcurrentMap<String, Pattern> getPatternsByExpectedSql() {
		return this.patternsByExpectedSql;
	}
}
