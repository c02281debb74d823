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

import javax.annotation.concurrent.NotThreadSafe;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when an incoming call does not correspond to the pending {@link Expectation}.
 * <p>
 * This is distinct from a programmed failure (see {@link Expectation#willReturnError(SQLException)}): a mismatch
 * means no expectation could be consumed at all, so the expectation queue is left untouched.
 * <p>
 * The message names the failing dimension via {@link #getReason()} and shows both the incoming call and the pending
 * expectation.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class ExpectationMismatchException extends SQLException {
	@NonNull
	static final String SQL_STATE = "HY000";

	@NonNull
	private final MismatchReason reason;
	@NonNull
	private final ExpectationKind actualKind;
	@Nullable
	private final String actualSql;
	@NonNull
	private final List<Object> actualArguments;
	@Nullable
	private final Expectation pendingExpectation;

	ExpectationMismatchException(@NonNull MismatchReason reason,
															 @NonNull ExpectationKind actualKind,
															 @Nullable String actualSql,
															 @NonNull List<Object> actualArguments,
															 @Nullable Expectation pendingExpectation) {
		super(createMessage(reason, actualKind, actualSql, actualArguments, pendingExpectation), SQL_STATE);

		this.reason = requireNonNull(reason);
		this.actualKind = requireNonNull(actualKind);
		this.actualSql = actualSql;
		// Arguments may legitimately contain nulls, so List.copyOf() is not an option
		this.actualArguments = Collections.unmodifiableList(new ArrayList<>(requireNonNull(actualArguments)));
		this.pendingExpectation = pendingExpectation;
	}

	@NonNull
	private static String createMessage(@NonNull MismatchReason reason,
																			@NonNull ExpectationKind actualKind,
																			@Nullable String actualSql,
																			@NonNull List<Object> actualArguments,
																			@Nullable Expectation pendingExpectation) {
		requireNonNull(reason);
		requireNonNull(actualKind);
		requireNonNull(actualArguments);

		String call = actualKind.isStatement()
				? format("%s '%s' with args %s", actualKind.getDescription(), actualSql, Values.describe(actualArguments))
				: actualKind.getDescription();

		switch (reason) {
			case NO_PENDING_EXPECTATION:
				return format("%s was not expected: all expectations were already fulfilled", call);
			case SESSION_CLOSED:
				return format("%s was not expected: session is closed", call);
			case TRANSACTION_STATE:
				return format("%s was not expected in the current transaction state; pending expectation is %s",
						call, pendingExpectation == null ? "none" : pendingExpectation.describe());
			case KIND:
				return format("%s was not expected; pending expectation is %s", call, pendingExpectation.describe());
			case PATTERN:
				return format("%s does not match the SQL pattern of pending expectation %s", call, pendingExpectation.describe());
			case ARGUMENTS:
				return format("%s does not match the arguments of pending expectation %s", call, pendingExpectation.describe());
			default:
				throw new IllegalStateException(format("Unhandled %s value %s", MismatchReason.class.getSimpleName(), reason.name()));
		}
	}

	/**
	 * Which dimension of the call failed to match.
	 *
	 * @return the reason for this mismatch
	 */
	@NonNull
	public MismatchReason getReason() {
		return this.reason;
	}

	/**
	 * The kind of the incoming call.
	 *
	 * @return the incoming call's kind
	 */
	@NonNull
	public ExpectationKind getActualKind() {
		return this.actualKind;
	}

	/**
	 * The SQL text of the incoming call.
	 *
	 * @return the incoming SQL, or {@link Optional#empty()} for non-statement calls
	 */
	@NonNull
	public Optional<String> getActualSql() {
		return Optional.ofNullable(this.actualSql);
	}

	/**
	 * The arguments bound for the incoming call, in positional order.
	 *
	 * @return the incoming arguments
	 */
	@NonNull
	public List<Object> getActualArguments() {
		return this.actualArguments;
	}

	/**
	 * The expectation at the head of the queue when the call arrived.
	 *
	 * @return the pending expectation, or {@link Optional#empty()} if none was pending
	 */
	@NonNull
	public Optional<Expectation> getPendingExpectation() {
		return Optional.ofNullable(this.pendingExpectation);
	}
}
