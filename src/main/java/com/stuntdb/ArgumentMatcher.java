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

import javax.annotation.concurrent.ThreadSafe;

/**
 * Contract for custom matching of a single bound argument.
 * <p>
 * Place an instance in the argument list given to {@link Expectation#withArgs(Object...)} to replace the default
 * type-aware equality check for that position. Standard instances are available via {@link Arguments}.
 * <p>
 * Implementations should be threadsafe.
 *
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface ArgumentMatcher {
	/**
	 * Does the bound value satisfy this matcher?
	 *
	 * @param actual the value the code under test bound, which may be {@code null} for SQL {@code NULL}
	 * @return {@code true} if the value is acceptable, {@code false} otherwise
	 */
	boolean matches(@Nullable Object actual);
}
