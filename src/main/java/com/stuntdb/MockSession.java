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
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * The stateful object that stands in for a real database connection.
 * <p>
 * Every call is matched against the head of the {@link ExpectationQueue}: on a match the head is consumed and its
 * programmed outcome is returned (or its programmed error thrown); otherwise an {@link ExpectationMismatchException}
 * is thrown immediately and nothing changes. Transaction state is a flag moved by begin, commit and rollback.
 * Closing runs the {@link Verifier}.
 * <p>
 * State checks and consumption share the queue lock, so concurrent callers are serialized.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class MockSession {
	@NonNull
	private final ExpectationQueue expectationQueue;
	@NonNull
	private final InteractionLogger interactionLogger;
	@NonNull
	private final Runnable closeHook;
	@NonNull
	private final Logger logger;

	@NonNull
	@GuardedBy("expectationQueue.getLock()")
	private SessionState state;

	MockSession(@NonNull ExpectationQueue expectationQueue,
							@NonNull InteractionLogger interactionLogger,
							@NonNull Runnable closeHook) {
		requireNonNull(expectationQueue);
		requireNonNull(interactionLogger);
		requireNonNull(closeHook);

		this.expectationQueue = expectationQueue;
		this.interactionLogger = interactionLogger;
		this.closeHook = closeHook;
		this.logger = Logger.getLogger(MockSession.class.getName());
		this.state = SessionState.IDLE;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{state=%s, pendingExpectations=%d}", getClass().getSimpleName(), getState().name(),
				getExpectationQueue().getUnfulfilledExpectations().size());
	}

	/**
	 * Opens a transaction.
	 *
	 * @throws ExpectationMismatchException if a transaction is already open or the head is not a begin expectation
	 * @throws SQLException                 the programmed error, if any; the session then stays idle
	 */
	public void begin() throws SQLException {
		interact(ExpectationKind.BEGIN_TRANSACTION, null, List.of(), (expectation) -> {
			throwProgrammedErrorIfPresent(expectation);
			this.state = SessionState.IN_TRANSACTION;
			logger.finer("Transaction begun.");
			return null;
		});
	}

	/**
	 * Runs a query.
	 *
	 * @param sql       the query text
	 * @param arguments the bound arguments, in positional order
	 * @return the programmed rows, or {@link Rows#empty()} if none were programmed
	 * @throws ExpectationMismatchException if the head does not match this query
	 * @throws SQLException                 the programmed error, if any
	 */
	@NonNull
	public Rows query(@NonNull String sql,
										@NonNull List<Object> arguments) throws SQLException {
		requireNonNull(sql);
		requireNonNull(arguments);

		return interact(ExpectationKind.QUERY, sql, arguments, (expectation) -> {
			throwProgrammedErrorIfPresent(expectation);
			return expectation.getRows().orElseGet(Rows::empty);
		});
	}

	/**
	 * Runs a statement.
	 *
	 * @param sql       the statement text
	 * @param arguments the bound arguments, in positional order
	 * @return the programmed result, or {@link ExecResult#none()} if none was programmed
	 * @throws ExpectationMismatchException if the head does not match this statement
	 * @throws SQLException                 the programmed error, if any
	 */
	@NonNull
	public ExecResult exec(@NonNull String sql,
												 @NonNull List<Object> arguments) throws SQLException {
		requireNonNull(sql);
		requireNonNull(arguments);

		return interact(ExpectationKind.EXEC, sql, arguments, (expectation) -> {
			throwProgrammedErrorIfPresent(expectation);
			return expectation.getExecResult().orElseGet(ExecResult::none);
		});
	}

	/**
	 * Commits the open transaction.
	 * <p>
	 * Once the commit expectation is consumed the session is idle again, even if it carries a programmed error.
	 *
	 * @throws ExpectationMismatchException if no transaction is open or the head is not a commit expectation
	 * @throws SQLException                 the programmed error, if any
	 */
	public void commit() throws SQLException {
		interact(ExpectationKind.COMMIT, null, List.of(), (expectation) -> {
			this.state = SessionState.IDLE;
			throwProgrammedErrorIfPresent(expectation);
			logger.finer("Transaction committed.");
			return null;
		});
	}

	/**
	 * Rolls back the open transaction.
	 * <p>
	 * Once the rollback expectation is consumed the session is idle again, even if it carries a programmed error.
	 *
	 * @throws ExpectationMismatchException if no transaction is open or the head is not a rollback expectation
	 * @throws SQLException                 the programmed error, if any
	 */
	public void rollback() throws SQLException {
		interact(ExpectationKind.ROLLBACK, null, List.of(), (expectation) -> {
			this.state = SessionState.IDLE;
			throwProgrammedErrorIfPresent(expectation);
			logger.finer("Transaction rolled back.");
			return null;
		});
	}

	/**
	 * Closes the session and verifies that every expectation was consumed.
	 * <p>
	 * The session is closed even when verification fails. Closing an already-closed session is a no-op.
	 *
	 * @throws UnmetExpectationsException if any expectation was never consumed
	 */
	public void close() throws UnmetExpectationsException {
		getLock().lock();

		try {
			if (this.state == SessionState.CLOSED)
				return;

			if (this.state == SessionState.IN_TRANSACTION)
				logger.fine("Closing session with a transaction still open");

			this.state = SessionState.CLOSED;
		} finally {
			getLock().unlock();
		}

		try {
			Verifier.verify(getExpectationQueue());
			logger.finer("Session closed, all expectations were met.");
		} finally {
			try {
				getCloseHook().run();
			} catch (RuntimeException e) {
				logger.log(WARNING, "Unable to run session close hook", e);
			}
		}
	}

	@NonNull
	public SessionState getState() {
		getLock().lock();

		try {
			return this.state;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Boolean isInTransaction() {
		return getState() == SessionState.IN_TRANSACTION;
	}

	@NonNull
	public Boolean isClosed() {
		return getState() == SessionState.CLOSED;
	}

	@NonNull
	public ExpectationQueue getExpectationQueue() {
		return this.expectationQueue;
	}

	@Nullable
	private <T> T interact(@NonNull ExpectationKind kind,
												 @Nullable String sql,
												 @NonNull List<Object> arguments,
												 @NonNull InteractionOperation<T> interactionOperation) throws SQLException {
		requireNonNull(kind);
		requireNonNull(arguments);
		requireNonNull(interactionOperation);

		long startTime = nanoTime();
		Expectation expectation = null;
		SQLException exception = null;

		getLock().lock();

		try {
			ensureStateAllows(kind, sql, arguments);
			expectation = getExpectationQueue().consume(kind, sql, arguments);
			return interactionOperation.perform(expectation);
		} catch (SQLException e) {
			exception = e;
			throw e;
		} finally {
			getLock().unlock();

			InteractionLog interactionLog = InteractionLog.withKind(kind)
					.sql(sql)
					.arguments(arguments)
					.expectation(expectation)
					.duration(Duration.ofNanos(nanoTime() - startTime))
					.exception(exception)
					.build();

			try {
				getInteractionLogger().log(interactionLog);
			} catch (RuntimeException loggerFailure) {
				if (exception == null)
					throw loggerFailure;

				exception.addSuppressed(loggerFailure);
			}
		}
	}

	@GuardedBy("expectationQueue.getLock()")
	private void ensureStateAllows(@NonNull ExpectationKind kind,
																 @Nullable String sql,
																 @NonNull List<Object> arguments) throws ExpectationMismatchException {
		requireNonNull(kind);
		requireNonNull(arguments);

		MismatchReason mismatchReason = null;

		if (this.state == SessionState.CLOSED)
			mismatchReason = MismatchReason.SESSION_CLOSED;
		else if (kind == ExpectationKind.BEGIN_TRANSACTION && this.state == SessionState.IN_TRANSACTION)
			mismatchReason = MismatchReason.TRANSACTION_STATE;
		else if ((kind == ExpectationKind.COMMIT || kind == ExpectationKind.ROLLBACK) && this.state != SessionState.IN_TRANSACTION)
			mismatchReason = MismatchReason.TRANSACTION_STATE;

		if (mismatchReason != null)
			throw new ExpectationMismatchException(mismatchReason, kind, sql, arguments,
					getExpectationQueue().peek().orElse(null));
	}

	private void throwProgrammedErrorIfPresent(@NonNull Expectation expectation) throws SQLException {
		requireNonNull(expectation);

		SQLException error = expectation.getError().orElse(null);

		if (error != null)
			throw error;
	}

	@NonNull
	private ReentrantLock getLock() {
		return getExpectationQueue().getLock();
	}

	@NonNull
	private InteractionLogger getInteractionLogger() {
		return this.interactionLogger;
	}

	@NonNull
	private Runnable getCloseHook() {
		return this.closeHook;
	}

	@FunctionalInterface
	private interface InteractionOperation<T> {
		@Nullable
		T perform(@NonNull Expectation expectation) throws SQLException;
	}
}
