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

import javax.annotation.concurrent.NotThreadSafe;
import java.sql.SQLException;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown by the {@link Verifier} when declared expectations were never consumed.
 * <p>
 * The message lists every unmet expectation in declaration order.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class UnmetExpectationsException extends SQLException {
	@NonNull
	private final List<Expectation> unmetExpectations;

	UnmetExpectationsException(@NonNull List<Expectation> unmetExpectations) {
		super(createMessage(unmetExpectations), ExpectationMismatchException.SQL_STATE);
		this.unmetExpectations = List.copyOf(unmetExpectations);
	}

	@NonNull
	private static String createMessage(@NonNull List<Expectation> unmetExpectations) {
		requireNonNull(unmetExpectations);

		StringBuilder message = new StringBuilder(format("There %s %d unmet expectation%s:",
				unmetExpectations.size() == 1 ? "is" : "are", unmetExpectations.size(), unmetExpectations.size() == 1 ? "" : "s"));

		for (int i = 0; i < unmetExpectations.size(); ++i)
			message.append(format("%n  %d. %s", i + 1, unmetExpectations.get(i).describe()));

		return message.toString();
	}

	/**
	 * The expectations that were declared but never consumed, in declaration order.
	 *
	 * @return the unmet expectations
	 */
	@NonNull
	public List<Expectation> getUnmetExpectations() {
		return this.unmetExpectations;
	}
}
