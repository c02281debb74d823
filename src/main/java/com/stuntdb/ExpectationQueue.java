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

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Ordered collection of {@link Expectation}s; insertion order is match order.
 * <p>
 * Matching only ever examines the head (the oldest unfulfilled expectation) and never searches ahead. Inspecting
 * the head, deciding, and marking it fulfilled happen while holding {@link #getLock()}, which callers may also hold
 * to combine consumption with their own state checks.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ExpectationQueue {
	@NonNull
	private final QueryMatcher queryMatcher;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final Logger logger;

	@NonNull
	@GuardedBy("lock")
	private final List<Expectation> expectations;
	@GuardedBy("lock")
	private int headIndex;

	ExpectationQueue(@NonNull QueryMatcher queryMatcher) {
		requireNonNull(queryMatcher);

		this.queryMatcher = queryMatcher;
		this.lock = new ReentrantLock();
		this.logger = Logger.getLogger(ExpectationQueue.class.getName());
		this.expectations = new ArrayList<>();
		this.headIndex = 0;
	}

	/**
	 * Declares a new expectation at the tail of the queue.
	 *
	 * @param kind    the kind of interaction expected
	 * @param pattern the SQL pattern for statement kinds, or {@code null} to accept any SQL
	 * @return the new expectation, for further refinement
	 * @throws ExpectationUsageException if the pattern is invalid or not allowed for {@code kind}
	 */
	@NonNull
	Expectation append(@NonNull ExpectationKind kind,
										 @Nullable String pattern) {
		requireNonNull(kind);

		if (pattern != null && kind.isStatement())
			getQueryMatcher().validate(pattern);

		getLock().lock();

		try {
			Expectation expectation = new Expectation(kind, pattern, getLock());
			this.expectations.add(expectation);
			return expectation;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * The head of the queue, if any expectation is still unfulfilled.
	 *
	 * @return the pending expectation
	 */
	@NonNull
	public Optional<Expectation> peek() {
		getLock().lock();

		try {
			return Optional.ofNullable(this.headIndex < this.expectations.size() ? this.expectations.get(this.headIndex) : null);
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Consumes the head of the queue if it matches the incoming call.
	 * <p>
	 * On a mismatch the queue is left unchanged.
	 *
	 * @param kind      the kind of the incoming call
	 * @param sql       the SQL of the incoming call, for statement kinds
	 * @param arguments the arguments bound for the incoming call
	 * @return the consumed expectation
	 * @throws ExpectationMismatchException if there is no head or it does not match
	 */
	@NonNull
	Expectation consume(@NonNull ExpectationKind kind,
											@Nullable String sql,
											@NonNull List<Object> arguments) throws ExpectationMismatchException {
		requireNonNull(kind);
		requireNonNull(arguments);

		getLock().lock();

		try {
			Expectation head = peek().orElse(null);
			MismatchReason mismatchReason = mismatchReason(head, kind, sql, arguments);

			if (mismatchReason != null)
				throw new ExpectationMismatchException(mismatchReason, kind, sql, arguments, head);

			head.markFulfilled();
			++this.headIndex;

			logger.finer(() -> format("Consumed expectation %d of %d: %s", this.headIndex, this.expectations.size(), head.describe()));

			return head;
		} finally {
			getLock().unlock();
		}
	}

	@Nullable
	private MismatchReason mismatchReason(@Nullable Expectation head,
																				@NonNull ExpectationKind kind,
																				@Nullable String sql,
																				@NonNull List<Object> arguments) {
		requireNonNull(kind);
		requireNonNull(arguments);

		if (head == null)
			return MismatchReason.NO_PENDING_EXPECTATION;

		if (head.getKind() != kind)
			return MismatchReason.KIND;

		if (!kind.isStatement())
			return null;

		if (!getQueryMatcher().matches(head.getPattern().orElse(null), sql == null ? "" : sql))
			return MismatchReason.PATTERN;

		if (!ValueMatcher.matches(head.getExpectedArgs().orElse(null), arguments))
			return MismatchReason.ARGUMENTS;

		return null;
	}

	/**
	 * A snapshot of every declared expectation, in declaration order.
	 *
	 * @return all expectations
	 */
	@NonNull
	public List<Expectation> getExpectations() {
		getLock().lock();

		try {
			return List.copyOf(this.expectations);
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * The expectations not yet consumed, in declaration order.
	 *
	 * @return the unfulfilled expectations
	 */
	@NonNull
	public List<Expectation> getUnfulfilledExpectations() {
		getLock().lock();

		try {
			List<Expectation> unfulfilledExpectations = new ArrayList<>(this.expectations.size() - this.headIndex);

			for (Expectation expectation : this.expectations)
				if (!expectation.isFulfilled())
					unfulfilledExpectations.add(expectation);

			return unfulfilledExpectations;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public QueryMatcher getQueryMatcher() {
		return this.queryMatcher;
	}

	@NonNull
	ReentrantLock getLock() {
		return this.lock;
	}
}
