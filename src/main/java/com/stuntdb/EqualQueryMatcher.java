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

import static java.util.Objects.requireNonNull;

/**
 * Package-private {@link QueryMatcher} which compares SQL text for equality, ignoring whitespace differences.
 *
 * @since 1.0.0
 */
@ThreadSafe
class EqualQueryMatcher implements QueryMatcher {
	@Override
	public void validate(@NonNull String expectedSql) {
		requireNonNull(expectedSql);
		// Any text is a valid literal
	}

	@Override
	public boolean matches(@Nullable String expectedSql,
												 @NonNull String actualSql) {
		requireNonNull(actualSql);

		if (expectedSql == null)
			return true;

		return Values.collapseWhitespace(expectedSql).equals(Values.collapseWhitespace(actualSql));
	}

	@Override
	@NonNull
	public String toString() {
		return getClass().getSimpleName();
	}
}
