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

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown when test setup code declares an {@link Expectation} that can never be satisfied as written.
 * <p>
 * Examples: an invalid SQL pattern, arguments attached to a {@link ExpectationKind#COMMIT}, or a second
 * outcome attached to the same expectation.
 * These are raised immediately at declaration time and never deferred to the point where the session is driven.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class ExpectationUsageException extends RuntimeException {
	/**
	 * Creates an {@code ExpectationUsageException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public ExpectationUsageException(@Nullable String message) {
		super(message);
	}

	/**
	 * Creates an {@code ExpectationUsageException} which wraps the given {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public ExpectationUsageException(@Nullable String message,
																	 @Nullable Throwable cause) {
		super(message, cause);
	}
}
