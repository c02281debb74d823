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

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Checks that every declared {@link Expectation} was consumed.
 * <p>
 * Runs automatically when a {@link MockSession} closes; under-use of the declared sequence is a failure, never
 * silently ignored.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Verifier {
	private Verifier() {
		// Prevents instantiation
	}

	/**
	 * Verifies that {@code expectationQueue} holds no unfulfilled expectations.
	 *
	 * @param expectationQueue the queue to inspect
	 * @throws UnmetExpectationsException listing every unmet expectation in declaration order
	 */
	public static void verify(@NonNull ExpectationQueue expectationQueue) throws UnmetExpectationsException {
		requireNonNull(expectationQueue);

		List<Expectation> unmetExpectations = expectationQueue.getUnfulfilledExpectations();

		if (unmetExpectations.size() > 0)
			throw new UnmetExpectationsException(unmetExpectations);
	}
}
