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
import java.lang.reflect.Method;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Backs {@link Statement}, {@link PreparedStatement} and {@link java.sql.CallableStatement} proxies.
 * <p>
 * Executing a query consumes a {@link ExpectationKind#QUERY} expectation, executing an update consumes an
 * {@link ExpectationKind#EXEC} expectation. Bound parameters become the interaction's arguments in index order, with
 * unset positions passed as {@code null}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
final class StuntStatement extends JdbcInvocationHandler {
	@NonNull
	static final String GENERATED_KEY_COLUMN_NAME = "GENERATED_KEY";
	@NonNull
	static final String STATEMENT_CLOSED_SQL_STATE = "HY010";

	@NonNull
	private final StuntDb stuntDb;
	@NonNull
	private final Connection connection;
	@Nullable
	private final String sql;
	@NonNull
	private final Statement statement;
	@NonNull
	private final SortedMap<Integer, Object> parameters;
	@NonNull
	private final List<List<Object>> batchedArguments;
	@NonNull
	private final List<String> batchedSql;

	@Nullable
	private StuntResultSet currentResultSet;
	private long updateCount;
	@Nullable
	private ExecResult lastExecResult;
	private boolean closed;
	private boolean closeOnCompletion;
	private boolean poolable;
	private long maxRows;
	private int maxFieldSize;
	private int queryTimeout;
	private int fetchSize;

	/**
	 * @param stuntDb    the owning instance
	 * @param connection the connection proxy that created the statement
	 * @param sql        the prepared text, or {@code null} for a plain {@link Statement}
	 * @param iface      the JDBC interface to implement
	 */
	StuntStatement(@NonNull StuntDb stuntDb,
								 @NonNull Connection connection,
								 @Nullable String sql,
								 @NonNull Class<? extends Statement> iface) {
		requireNonNull(stuntDb);
		requireNonNull(connection);
		requireNonNull(iface);

		this.stuntDb = stuntDb;
		this.connection = connection;
		this.sql = sql;
		this.parameters = new TreeMap<>();
		this.batchedArguments = new ArrayList<>();
		this.batchedSql = new ArrayList<>();
		this.updateCount = -1;
		this.poolable = sql != null;
		this.statement = newProxy(iface, this);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{sql=%s, parameters=%s, closed=%s}", getClass().getSimpleName(),
				this.sql == null ? "(supplied on execution)" : this.sql, this.parameters, this.closed);
	}

	@NonNull
	Statement getStatement() {
		return this.statement;
	}

	@Override
	@Nullable
	protected Object handle(@NonNull Object proxy,
													@NonNull Method method,
													@NonNull Object[] arguments) throws Throwable {
		String name = method.getName();

		if (isParameterSetter(method)) {
			setParameter(method, arguments);
			return null;
		}

		switch (name) {
			case "executeQuery":
				return executeQuery(method, arguments).getResultSet();
			case "executeUpdate":
				return Math.toIntExact(executeUpdate(method, arguments));
			case "executeLargeUpdate":
				return executeUpdate(method, arguments);
			case "execute":
				return execute(method, arguments);
			case "addBatch":
				addBatch(method, arguments);
				return null;
			case "clearBatch":
				ensureOpen();
				this.batchedArguments.clear();
				this.batchedSql.clear();
				return null;
			case "executeBatch": {
				List<Long> updateCounts = executeBatch();
				int[] result = new int[updateCounts.size()];

				for (int i = 0; i < result.length; ++i)
					result[i] = Math.toIntExact(updateCounts.get(i));

				return result;
			}
			case "executeLargeBatch":
				return executeBatch().stream().mapToLong(Long::longValue).toArray();
			case "clearParameters":
				ensureOpen();
				this.parameters.clear();
				return null;
			case "getResultSet":
				ensureOpen();
				return this.currentResultSet == null ? null : this.currentResultSet.getResultSet();
			case "getUpdateCount":
				ensureOpen();
				return Math.toIntExact(this.updateCount);
			case "getLargeUpdateCount":
				ensureOpen();
				return this.updateCount;
			case "getMoreResults":
				ensureOpen();
				releaseCurrentResultSet();
				this.updateCount = -1;
				return false;
			case "getGeneratedKeys":
				ensureOpen();
				return generatedKeys().getResultSet();
			case "getConnection":
				ensureOpen();
				return this.connection;
			case "getMetaData":
				ensureOpen();
				return null;
			case "close":
				close();
				return null;
			case "isClosed":
				return this.closed;
			case "cancel":
				ensureOpen();
				return null;
			case "getWarnings":
				ensureOpen();
				return null;
			case "clearWarnings":
				ensureOpen();
				return null;
			case "closeOnCompletion":
				ensureOpen();
				this.closeOnCompletion = true;
				return null;
			case "isCloseOnCompletion":
				ensureOpen();
				return this.closeOnCompletion;
			case "setPoolable":
				ensureOpen();
				this.poolable = (Boolean) arguments[0];
				return null;
			case "isPoolable":
				ensureOpen();
				return this.poolable;
			case "setMaxRows":
			case "setLargeMaxRows":
				ensureOpen();
				this.maxRows = nonNegative(((Number) arguments[0]).longValue(), "maxRows");
				return null;
			case "getMaxRows":
				ensureOpen();
				return (int) Math.min(this.maxRows, Integer.MAX_VALUE);
			case "getLargeMaxRows":
				ensureOpen();
				return this.maxRows;
			case "setMaxFieldSize":
				ensureOpen();
				this.maxFieldSize = (int) nonNegative((Integer) arguments[0], "maxFieldSize");
				return null;
			case "getMaxFieldSize":
				ensureOpen();
				return this.maxFieldSize;
			case "setQueryTimeout":
				ensureOpen();
				this.queryTimeout = (int) nonNegative((Integer) arguments[0], "queryTimeout");
				return null;
			case "getQueryTimeout":
				ensureOpen();
				return this.queryTimeout;
			case "setFetchSize":
				ensureOpen();
				this.fetchSize = (int) nonNegative((Integer) arguments[0], "fetchSize");
				return null;
			case "getFetchSize":
				ensureOpen();
				return this.fetchSize;
			case "setFetchDirection":
				ensureOpen();
				if ((Integer) arguments[0] != ResultSet.FETCH_FORWARD)
					throw unsupported(method);
				return null;
			case "getFetchDirection":
				return ResultSet.FETCH_FORWARD;
			case "setEscapeProcessing":
				ensureOpen();
				return null;
			case "getResultSetType":
				return ResultSet.TYPE_FORWARD_ONLY;
			case "getResultSetConcurrency":
				return ResultSet.CONCUR_READ_ONLY;
			case "getResultSetHoldability":
				return ResultSet.HOLD_CURSORS_OVER_COMMIT;
			default:
				throw unsupported(method);
		}
	}

	// setInt(int, int), setString(int, String), setNull(int, int), setObject(int, Object, int) and so on
	private boolean isParameterSetter(@NonNull Method method) {
		requireNonNull(method);

		return method.getName().startsWith("set")
				&& method.getParameterCount() >= 2
				&& method.getParameterTypes()[0] == int.class
				&& PreparedStatement.class.isAssignableFrom(method.getDeclaringClass());
	}

	private void setParameter(@NonNull Method method,
														@NonNull Object[] arguments) throws SQLException {
		requireNonNull(method);
		requireNonNull(arguments);

		ensureOpen();

		int parameterIndex = (Integer) arguments[0];

		if (parameterIndex < 1)
			throw new SQLException(format("Parameter index %d is invalid, indices start at 1", parameterIndex),
					StuntResultSet.INVALID_COLUMN_SQL_STATE);

		this.parameters.put(parameterIndex, "setNull".equals(method.getName()) ? null : arguments[1]);
	}

	@NonNull
	private StuntResultSet executeQuery(@NonNull Method method,
																			@NonNull Object[] arguments) throws SQLException {
		requireNonNull(method);
		requireNonNull(arguments);

		String sql = sqlFor(method, arguments);
		List<Object> boundArguments = boundArguments();

		beginExecution();

		Rows rows = getStuntDb().getSession().query(sql, boundArguments);
		this.currentResultSet = new StuntResultSet(rows, getStatement(), this.maxRows);

		return this.currentResultSet;
	}

	private long executeUpdate(@NonNull Method method,
														 @NonNull Object[] arguments) throws SQLException {
		requireNonNull(method);
		requireNonNull(arguments);

		String sql = sqlFor(method, arguments);
		List<Object> boundArguments = boundArguments();

		beginExecution();

		ExecResult execResult = getStuntDb().getSession().exec(sql, boundArguments);
		this.lastExecResult = execResult;
		this.updateCount = execResult.getRowsAffected();

		return this.updateCount;
	}

	// The pending expectation decides whether text run through execute() is a query or an update
	private boolean execute(@NonNull Method method,
													@NonNull Object[] arguments) throws SQLException {
		requireNonNull(method);
		requireNonNull(arguments);

		ensureOpen();

		ReentrantLock lock = getStuntDb().getExpectationQueue().getLock();

		// Peek and dispatch under one hold of the session lock
		lock.lock();

		try {
			Expectation pendingExpectation = getStuntDb().getExpectationQueue().peek().orElse(null);

			if (pendingExpectation != null && pendingExpectation.getKind() == ExpectationKind.QUERY) {
				executeQuery(method, arguments);
				return true;
			}

			executeUpdate(method, arguments);
			return false;
		} finally {
			lock.unlock();
		}
	}

	private void addBatch(@NonNull Method method,
												@NonNull Object[] arguments) throws SQLException {
		requireNonNull(method);
		requireNonNull(arguments);

		ensureOpen();

		if (this.sql == null) {
			if (arguments.length != 1)
				throw new SQLException("Statement.addBatch requires SQL");

			this.batchedSql.add((String) arguments[0]);
		} else {
			if (arguments.length != 0)
				throw new SQLException("SQL must not be supplied to addBatch on a prepared statement");

			this.batchedArguments.add(boundArguments());
		}
	}

	// A failing entry's exception propagates as-is and the remaining entries are discarded
	@NonNull
	private List<Long> executeBatch() throws SQLException {
		ensureOpen();
		beginExecution();

		List<Long> updateCounts = new ArrayList<>();

		try {
			if (this.sql == null) {
				for (String batchedSql : this.batchedSql)
					updateCounts.add(executeBatchEntry(batchedSql, List.of()));
			} else {
				for (List<Object> batchedArguments : this.batchedArguments)
					updateCounts.add(executeBatchEntry(this.sql, batchedArguments));
			}
		} finally {
			this.batchedSql.clear();
			this.batchedArguments.clear();
		}

		return updateCounts;
	}

	private long executeBatchEntry(@NonNull String sql,
																 @NonNull List<Object> arguments) throws SQLException {
		requireNonNull(sql);
		requireNonNull(arguments);

		ExecResult execResult = getStuntDb().getSession().exec(sql, arguments);
		this.lastExecResult = execResult;
		return execResult.getRowsAffected();
	}

	@NonNull
	private StuntResultSet generatedKeys() {
		Rows.Builder rowsBuilder = Rows.withColumns(GENERATED_KEY_COLUMN_NAME);

		if (this.lastExecResult != null)
			rowsBuilder.addRow(this.lastExecResult.getLastInsertId());

		return new StuntResultSet(rowsBuilder.build(), getStatement(), 0);
	}

	private void close() {
		if (this.closed)
			return;

		this.closed = true;
		releaseCurrentResultSet();
	}

	@NonNull
	private String sqlFor(@NonNull Method method,
												@NonNull Object[] arguments) throws SQLException {
		requireNonNull(method);
		requireNonNull(arguments);

		ensureOpen();

		if (this.sql != null) {
			if (arguments.length > 0 && arguments[0] instanceof String)
				throw new SQLException(format("SQL must not be supplied to %s on a prepared statement", method.getName()));

			return this.sql;
		}

		if (arguments.length == 0 || !(arguments[0] instanceof String suppliedSql))
			throw new SQLException(format("%s requires SQL", method.getName()));

		return suppliedSql;
	}

	@NonNull
	private List<Object> boundArguments() {
		if (this.parameters.isEmpty())
			return List.of();

		List<Object> boundArguments = new ArrayList<>(Collections.nCopies(this.parameters.lastKey(), null));

		for (Map.Entry<Integer, Object> parameter : this.parameters.entrySet())
			boundArguments.set(parameter.getKey() - 1, parameter.getValue());

		return Collections.unmodifiableList(boundArguments);
	}

	private void beginExecution() {
		releaseCurrentResultSet();
		this.updateCount = -1;
	}

	private void releaseCurrentResultSet() {
		if (this.currentResultSet != null) {
			this.currentResultSet.release();
			this.currentResultSet = null;
		}
	}

	private long nonNegative(long value,
													 @NonNull String propertyName) throws SQLException {
		requireNonNull(propertyName);

		if (value < 0)
			throw new SQLException(format("%s must not be negative, was %d", propertyName, value));

		return value;
	}

	private void ensureOpen() throws SQLException {
		if (this.closed)
			throw new SQLException("Statement is closed", STATEMENT_CLOSED_SQL_STATE);
	}

	@NonNull
	private StuntDb getStuntDb() {
		return this.stuntDb;
	}
}
