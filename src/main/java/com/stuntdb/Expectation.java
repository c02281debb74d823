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
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One declared, ordered unit of anticipated interaction with a {@link MockSession}.
 * <p>
 * Obtain instances via the {@code expect...} methods on {@link StuntDb}, then refine them fluently:
 * <pre>{@code
 * stuntDb.expectQuery("SELECT (.+) FROM orders WHERE id = \\?")
 *   .withArgs(1)
 *   .willReturnRows(Rows.withColumns("id", "status").addRow(1, "pending").build());
 *
 * stuntDb.expectExec("UPDATE orders")
 *   .withArgs(Arguments.any(), 1)
 *   .willReturnResult(ExecResult.of(0, 1));
 *
 * stuntDb.expectCommit()
 *   .willReturnError(new SQLException("serialization failure", "40001"));
 * }</pre>
 * Only {@link ExpectationKind#QUERY} and {@link ExpectationKind#EXEC} expectations may carry arguments, and each
 * expectation holds at most one outcome. Breaking either rule throws {@link ExpectationUsageException} right away.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Expectation {
	@NonNull
	private final ExpectationKind kind;
	@Nullable
	private final String pattern;
	@NonNull
	private final ReentrantLock lock;

	@Nullable
	private List<Object> expectedArgs;
	@Nullable
	private Rows rows;
	@Nullable
	private ExecResult execResult;
	@Nullable
	private SQLException error;
	private boolean fulfilled;

	Expectation(@NonNull ExpectationKind kind,
							@Nullable String pattern,
							@NonNull ReentrantLock lock) {
		requireNonNull(kind);
		requireNonNull(lock);

		if (pattern != null && !kind.isStatement())
			throw new ExpectationUsageException(format("A SQL pattern cannot be attached to a %s expectation", kind.getDescription()));

		this.kind = kind;
		this.pattern = pattern;
		this.lock = lock;
	}

	/**
	 * Requires the call to bind exactly these arguments, in positional order.
	 * <p>
	 * Values are compared by {@link ValueMatcher}; any position may hold an {@link ArgumentMatcher} instead.
	 *
	 * @param expectedArgs the expected arguments
	 * @return this expectation, for chaining
	 * @throws ExpectationUsageException if this kind does not take arguments or arguments were already attached
	 */
	@NonNull
	public Expectation withArgs(@Nullable Object... expectedArgs) {
		return withArgs(expectedArgs == null ? Collections.singletonList(null) : Arrays.asList(expectedArgs));
	}

	/**
	 * Requires the call to bind exactly these arguments, in positional order.
	 *
	 * @param expectedArgs the expected arguments
	 * @return this expectation, for chaining
	 * @throws ExpectationUsageException if this kind does not take arguments or arguments were already attached
	 */
	@NonNull
	public Expectation withArgs(@NonNull List<?> expectedArgs) {
		requireNonNull(expectedArgs);

		getLock().lock();

		try {
			ensureRefinable();

			if (!getKind().isStatement())
				throw new ExpectationUsageException(format("Arguments cannot be attached to a %s expectation", getKind().getDescription()));

			if (this.expectedArgs != null)
				throw new ExpectationUsageException(format("Arguments were already attached to %s", describe()));

			this.expectedArgs = Collections.unmodifiableList(new ArrayList<>(expectedArgs));
			return this;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Requires the call to bind no arguments at all.
	 *
	 * @return this expectation, for chaining
	 * @throws ExpectationUsageException if this kind does not take arguments or arguments were already attached
	 */
	@NonNull
	public Expectation withNoArgs() {
		return withArgs(List.of());
	}

	/**
	 * Makes the matched query return {@code rows}.
	 *
	 * @param rows the rows to return
	 * @return this expectation, for chaining
	 * @throws ExpectationUsageException if this is not a query expectation or an outcome was already attached
	 */
	@NonNull
	public Expectation willReturnRows(@NonNull Rows rows) {
		requireNonNull(rows);

		getLock().lock();

		try {
			ensureOutcomeAttachable(ExpectationKind.QUERY, "rows");
			this.rows = rows;
			return this;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Makes the matched statement report {@code execResult}.
	 *
	 * @param execResult the result to report
	 * @return this expectation, for chaining
	 * @throws ExpectationUsageException if this is not an exec expectation or an outcome was already attached
	 */
	@NonNull
	public Expectation willReturnResult(@NonNull ExecResult execResult) {
		requireNonNull(execResult);

		getLock().lock();

		try {
			ensureOutcomeAttachable(ExpectationKind.EXEC, "a result");
			this.execResult = execResult;
			return this;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Makes the matched call fail with exactly {@code error}, as a real driver error would.
	 *
	 * @param error the error to throw from the matched call
	 * @return this expectation, for chaining
	 * @throws ExpectationUsageException if an outcome was already attached
	 */
	@NonNull
	public Expectation willReturnError(@NonNull SQLException error) {
		requireNonNull(error);

		getLock().lock();

		try {
			ensureOutcomeAttachable(null, "an error");
			this.error = error;
			return this;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public ExpectationKind getKind() {
		return this.kind;
	}

	/**
	 * The SQL pattern incoming text must satisfy.
	 *
	 * @return the pattern, or {@link Optional#empty()} if any SQL is accepted
	 */
	@NonNull
	public Optional<String> getPattern() {
		return Optional.ofNullable(this.pattern);
	}

	/**
	 * The arguments the call must bind.
	 *
	 * @return the expected arguments, or {@link Optional#empty()} if arguments are unchecked
	 */
	@NonNull
	public Optional<List<Object>> getExpectedArgs() {
		getLock().lock();

		try {
			return Optional.ofNullable(this.expectedArgs);
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Optional<Rows> getRows() {
		getLock().lock();

		try {
			return Optional.ofNullable(this.rows);
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Optional<ExecResult> getExecResult() {
		getLock().lock();

		try {
			return Optional.ofNullable(this.execResult);
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Optional<SQLException> getError() {
		getLock().lock();

		try {
			return Optional.ofNullable(this.error);
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Has a matching call consumed this expectation?
	 *
	 * @return {@code true} if consumed, {@code false} otherwise
	 */
	@NonNull
	public Boolean isFulfilled() {
		getLock().lock();

		try {
			return this.fulfilled;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Human-readable summary naming kind, pattern and arguments, used in mismatch and verification messages.
	 *
	 * @return a description of this expectation
	 */
	@NonNull
	public String describe() {
		if (!getKind().isStatement())
			return getKind().getDescription();

		StringBuilder description = new StringBuilder(getKind().getDescription());
		String pattern = getPattern().orElse(null);

		if (pattern == null)
			description.append(" (any SQL)");
		else
			description.append(format(" matching '%s'", pattern));

		List<Object> expectedArgs = getExpectedArgs().orElse(null);

		if (expectedArgs != null)
			description.append(format(" with args %s", Values.describe(expectedArgs)));

		return description.toString();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{%s, fulfilled=%s}", getClass().getSimpleName(), describe(), isFulfilled());
	}

	void markFulfilled() {
		getLock().lock();

		try {
			if (this.fulfilled)
				throw new IllegalStateException(format("%s was already fulfilled", describe()));

			this.fulfilled = true;
		} finally {
			getLock().unlock();
		}
	}

	private void ensureRefinable() {
		if (this.fulfilled)
			throw new ExpectationUsageException(format("%s was already consumed and can no longer be changed", describe()));
	}

	private void ensureOutcomeAttachable(@Nullable ExpectationKind requiredKind,
																			 @NonNull String outcomeDescription) {
		requireNonNull(outcomeDescription);

		ensureRefinable();

		if (requiredKind != null && getKind() != requiredKind)
			throw new ExpectationUsageException(format("Cannot return %s from a %s expectation", outcomeDescription, getKind().getDescription()));

		if (this.rows != null || this.execResult != null || this.error != null)
			throw new ExpectationUsageException(format("An outcome was already attached to %s", describe()));
	}

	@NonNull
	ReentrantLock getLock() {
		return this.lock;
	}
}
