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
import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Main class for declaring expected database interactions and handing a scripted JDBC connection to the code under
 * test.
 * <p>
 * Each instance owns one {@link MockSession} and is reachable through {@link java.sql.DriverManager} at
 * {@link #getUrl()}, through {@link #getDataSource()}, or directly through {@link #getConnection()}.
 *
 * <pre>{@code
 * try (StuntDb stuntDb = StuntDb.create()) {
 *   stuntDb.expectBegin();
 *   stuntDb.expectQuery("SELECT .* FROM orders")
 *     .withArgs(1)
 *     .willReturnRows(Rows.withColumns("status").addRow(1).build());
 *   stuntDb.expectRollback();
 *
 *   orderService.cancel(stuntDb.getDataSource(), 1);
 * } // Closing verifies that every expectation was consumed
 * }</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class StuntDb implements AutoCloseable {
	@NonNull
	private static final AtomicLong NAME_GENERATOR;

	static {
		NAME_GENERATOR = new AtomicLong(0);
	}

	@NonNull
	private final String name;
	@NonNull
	private final ExpectationQueue expectationQueue;
	@NonNull
	private final MockSession session;
	@NonNull
	private final DataSource dataSource;
	@NonNull
	private final Logger logger;

	private StuntDb(@NonNull Builder builder) {
		requireNonNull(builder);

		this.name = builder.name == null ? format("stuntdb_%d", NAME_GENERATOR.incrementAndGet()) : builder.name;
		this.expectationQueue = new ExpectationQueue(builder.queryMatcher == null ? QueryMatcher.regex() : builder.queryMatcher);
		this.session = new MockSession(this.expectationQueue,
				builder.interactionLogger == null ? new DefaultInteractionLogger() : builder.interactionLogger,
				() -> StuntDriver.deregister(this));
		this.dataSource = new StuntDataSource(this);
		this.logger = Logger.getLogger(StuntDb.class.getName());
	}

	/**
	 * Creates a {@code StuntDb} with default configuration, registered under a generated name.
	 *
	 * @return a new {@code StuntDb}
	 */
	@NonNull
	public static StuntDb create() {
		return builder().build();
	}

	/**
	 * Vends a builder for configuring a {@code StuntDb}.
	 *
	 * @return a {@code StuntDb} builder
	 */
	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{name=%s, session=%s}", getClass().getSimpleName(), getName(), getSession());
	}

	/**
	 * Expects a transaction to be opened.
	 *
	 * @return the new expectation
	 */
	@NonNull
	public Expectation expectBegin() {
		return getExpectationQueue().append(ExpectationKind.BEGIN_TRANSACTION, null);
	}

	/**
	 * Expects a query with any SQL.
	 *
	 * @return the new expectation
	 */
	@NonNull
	public Expectation expectQuery() {
		return getExpectationQueue().append(ExpectationKind.QUERY, null);
	}

	/**
	 * Expects a query whose SQL satisfies {@code sqlPattern} under the configured {@link QueryMatcher}.
	 *
	 * @param sqlPattern the SQL pattern, a regular expression by default
	 * @return the new expectation
	 * @throws ExpectationUsageException if the pattern is invalid
	 */
	@NonNull
	public Expectation expectQuery(@NonNull String sqlPattern) {
		requireNonNull(sqlPattern);
		return getExpectationQueue().append(ExpectationKind.QUERY, sqlPattern);
	}

	/**
	 * Expects a statement execution with any SQL.
	 *
	 * @return the new expectation
	 */
	@NonNull
	public Expectation expectExec() {
		return getExpectationQueue().append(ExpectationKind.EXEC, null);
	}

	/**
	 * Expects a statement execution whose SQL satisfies {@code sqlPattern} under the configured {@link QueryMatcher}.
	 *
	 * @param sqlPattern the SQL pattern, a regular expression by default
	 * @return the new expectation
	 * @throws ExpectationUsageException if the pattern is invalid
	 */
	@NonNull
	public Expectation expectExec(@NonNull String sqlPattern) {
		requireNonNull(sqlPattern);
		return getExpectationQueue().append(ExpectationKind.EXEC, sqlPattern);
	}

	/**
	 * Expects the open transaction to be committed.
	 *
	 * @return the new expectation
	 */
	@NonNull
	public Expectation expectCommit() {
		return getExpectationQueue().append(ExpectationKind.COMMIT, null);
	}

	/**
	 * Expects the open transaction to be rolled back.
	 *
	 * @return the new expectation
	 */
	@NonNull
	public Expectation expectRollback() {
		return getExpectationQueue().append(ExpectationKind.ROLLBACK, null);
	}

	/**
	 * Verifies that every declared expectation has been consumed, without closing the session.
	 *
	 * @throws UnmetExpectationsException if any expectation is unmet
	 */
	public void verify() throws UnmetExpectationsException {
		Verifier.verify(getExpectationQueue());
	}

	/**
	 * Acquires a JDBC connection backed by this instance's session.
	 * <p>
	 * Every connection shares the one session; closing any of them closes the session.
	 *
	 * @return a connection
	 * @throws SQLException if the session is already closed
	 */
	@NonNull
	public Connection getConnection() throws SQLException {
		if (getSession().isClosed())
			throw new SQLException(format("%s '%s' is closed", getClass().getSimpleName(), getName()), StuntConnection.CONNECTION_CLOSED_SQL_STATE);

		logger.finer(() -> format("Opening connection to %s", getUrl()));

		return StuntConnection.create(this);
	}

	/**
	 * Closes the session, verifying that every declared expectation was consumed, and removes this instance from the
	 * driver registry.
	 * <p>
	 * Closing an already-closed instance is a no-op.
	 *
	 * @throws UnmetExpectationsException if any expectation is unmet
	 */
	@Override
	public void close() throws UnmetExpectationsException {
		getSession().close();
	}

	/**
	 * The name this instance is registered under with {@link StuntDriver}.
	 *
	 * @return the registered name
	 */
	@NonNull
	public String getName() {
		return this.name;
	}

	/**
	 * The JDBC URL which selects this instance through {@link java.sql.DriverManager}.
	 *
	 * @return the JDBC URL
	 */
	@NonNull
	public String getUrl() {
		return StuntDriver.URL_PREFIX + getName();
	}

	@NonNull
	public DataSource getDataSource() {
		return this.dataSource;
	}

	@NonNull
	public MockSession getSession() {
		return this.session;
	}

	/**
	 * A snapshot of every declared expectation, in declaration order.
	 *
	 * @return all expectations
	 */
	@NonNull
	public List<Expectation> getExpectations() {
		return getExpectationQueue().getExpectations();
	}

	@NonNull
	ExpectationQueue getExpectationQueue() {
		return this.expectationQueue;
	}

	/**
	 * Builder used to construct instances of {@link StuntDb}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@Nullable
		private String name;
		@Nullable
		private QueryMatcher queryMatcher;
		@Nullable
		private InteractionLogger interactionLogger;

		private Builder() {
			// Use StuntDb.builder()
		}

		/**
		 * Overrides the generated registry name, making the instance reachable at {@code jdbc:stuntdb:<name>}.
		 *
		 * @param name the name to register under
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder name(@Nullable String name) {
			this.name = name;
			return this;
		}

		/**
		 * Overrides how SQL patterns are matched; {@link QueryMatcher#regex()} if unset.
		 *
		 * @param queryMatcher the matcher to use
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder queryMatcher(@Nullable QueryMatcher queryMatcher) {
			this.queryMatcher = queryMatcher;
			return this;
		}

		/**
		 * Overrides where interaction diagnostics go; {@link DefaultInteractionLogger} if unset.
		 *
		 * @param interactionLogger the logger to use
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder interactionLogger(@Nullable InteractionLogger interactionLogger) {
			this.interactionLogger = interactionLogger;
			return this;
		}

		/**
		 * Constructs a {@code StuntDb} and registers it with {@link StuntDriver}.
		 *
		 * @return a {@code StuntDb} instance
		 * @throws ExpectationUsageException if an open instance is already registered under the same name
		 */
		@NonNull
		public StuntDb build() {
			if (this.name != null && this.name.isBlank())
				throw new ExpectationUsageException("Name must not be blank");

			StuntDb stuntDb = new StuntDb(this);
			StuntDriver.register(stuntDb);
			return stuntDb;
		}
	}
}
