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

/**
 * Contract for deciding whether incoming SQL text satisfies the SQL pattern declared on an {@link Expectation}.
 * <p>
 * Standard implementations are available via {@link #regex()} (the default) and {@link #equal()}.
 * <p>
 * Implementations should be threadsafe.
 *
 * @since 1.0.0
 */
@ThreadSafe
public interface QueryMatcher {
	/**
	 * Checks that {@code expectedSql} is usable by this matcher.
	 * <p>
	 * Called once, when the expectation is declared, so that a broken pattern fails the test immediately.
	 *
	 * @param expectedSql the SQL pattern being declared
	 * @throws ExpectationUsageException if the pattern can never be evaluated
	 */
	void validate(@NonNull String expectedSql);

	/**
	 * Does the incoming SQL satisfy the expected pattern?
	 *
	 * @param expectedSql the declared pattern, or {@code null} to accept any SQL
	 * @param actualSql   the SQL the code under test issued
	 * @return {@code true} if the SQL matches, {@code false} otherwise
	 */
	boolean matches(@Nullable String expectedSql,
									@NonNull String actualSql);

	/**
	 * Acquires a matcher which treats the expected SQL as a regular expression and looks for it anywhere in the
	 * incoming SQL (a partial match, not an anchored one).
	 * <p>
	 * Runs of whitespace in both the pattern and the incoming SQL are collapsed to a single space first. Escaped
	 * whitespace, character classes and {@code \Q...\E} quotes in the pattern are left as written.
	 *
	 * @return a regular-expression {@code QueryMatcher}
	 */
	@NonNull
	static QueryMatcher regex() {
		return new RegexQueryMatcher();
	}

	/**
	 * Acquires a matcher which requires the incoming SQL to equal the expected SQL, ignoring differences in
	 * whitespace.
	 *
	 * @return an exact-text {@code QueryMatcher}
	 */
	@NonNull
	static QueryMatcher equal() {
		return new EqualQueryMatcher();
	}
}
