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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Fluent interface for acquiring standard {@link ArgumentMatcher} instances.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Arguments {
	@NonNull
	private static final ArgumentMatcher ANY;

	static {
		ANY = new ArgumentMatcher() {
			@Override
			public boolean matches(@Nullable Object actual) {
				return true;
			}

			@Override
			@NonNull
			public String toString() {
				return "<any>";
			}
		};
	}

	private Arguments() {
		// Prevents instantiation
	}

	/**
	 * Acquires a matcher which accepts any value, including {@code null}.
	 *
	 * @return a matcher which accepts any value
	 */
	@NonNull
	public static ArgumentMatcher any() {
		return ANY;
	}

	/**
	 * Acquires a matcher which accepts any non-null instance of the given type.
	 *
	 * @param type the type the bound value must be an instance of
	 * @return a matcher for the given type
	 */
	@NonNull
	public static ArgumentMatcher ofType(@NonNull Class<?> type) {
		requireNonNull(type);
		return new TypeArgumentMatcher(type);
	}

	/**
	 * Package-private {@link ArgumentMatcher} that checks the runtime type of a bound value.
	 *
	 * @since 1.0.0
	 */
	@ThreadSafe
	static final class TypeArgumentMatcher implements ArgumentMatcher {
		@NonNull
		private final Class<?> type;

		TypeArgumentMatcher(@NonNull Class<?> type) {
			requireNonNull(type);
			this.type = type;
		}

		@Override
		public boolean matches(@Nullable Object actual) {
			return getType().isInstance(actual);
		}

		@Override
		@NonNull
		public String toString() {
			return format("<any %s>", getType().getSimpleName());
		}

		@NonNull
		Class<?> getType() {
			return this.type;
		}
	}
}
