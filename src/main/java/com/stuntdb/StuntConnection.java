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
import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Backs {@link Connection} proxies handed out by a {@link StuntDb}.
 * <p>
 * Transaction control maps onto the {@link MockSession}: {@code setAutoCommit(false)} opens a transaction,
 * {@code setAutoCommit(true)} commits an open one, and {@code commit()}/{@code rollback()} end it. Closing the
 * connection closes the session, which verifies that every expectation was consumed.
 * <p>
 * Settings such as read-only, catalog, schema and isolation level are stored and reported back but never affect
 * matching.
 *
 * @since 1.0.0
 */
@NotThreadSafe
final class StuntConnection extends JdbcInvocationHandler {
	@NonNull
	static final String CONNECTION_CLOSED_SQL_STATE = "08003";
	@NonNull
	static final String CONNECTION_FAILURE_SQL_STATE = "08001";

	@NonNull
	private final StuntDb stuntDb;
	@NonNull
	private final Connection connection;
	@NonNull
	private final Properties clientInfo;

	private boolean readOnly;
	@Nullable
	private String catalog;
	@Nullable
	private String schema;
	private int transactionIsolation;
	private int holdability;
	private int networkTimeout;
	@NonNull
	private Map<String, Class<?>> typeMap;

	private StuntConnection(@NonNull StuntDb stuntDb) {
		requireNonNull(stuntDb);

		this.stuntDb = stuntDb;
		this.clientInfo = new Properties();
		this.transactionIsolation = Connection.TRANSACTION_READ_COMMITTED;
		this.holdability = ResultSet.HOLD_CURSORS_OVER_COMMIT;
		this.typeMap = new HashMap<>();
		this.connection = newProxy(Connection.class, this);
	}

	/**
	 * Creates a connection proxy bound to {@code stuntDb}'s session.
	 *
	 * @param stuntDb the owning instance
	 * @return a connection
	 */
	@NonNull
	static Connection create(@NonNull StuntDb stuntDb) {
		requireNonNull(stuntDb);
		return new StuntConnection(stuntDb).connection;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{url=%s, state=%s}", getClass().getSimpleName(), getStuntDb().getUrl(), getSession().getState().name());
	}

	@Override
	@NonNull
	protected Optional<Object> getWrapped() {
		return Optional.of(getStuntDb());
	}

	@Override
	@Nullable
	protected Object handle(@NonNull Object proxy,
													@NonNull Method method,
													@NonNull Object[] arguments) throws Throwable {
		switch (method.getName()) {
			case "close":
				getSession().close();
				return null;
			case "isClosed":
				return getSession().isClosed();
			case "isValid":
				if ((Integer) arguments[0] < 0)
					throw new SQLException("Timeout must not be negative");
				return !getSession().isClosed();
			case "setAutoCommit":
				setAutoCommit((Boolean) arguments[0]);
				return null;
			case "getAutoCommit":
				ensureOpen();
				return !getSession().isInTransaction();
			case "commit":
				getSession().commit();
				return null;
			case "rollback":
				if (arguments.length > 0)
					throw unsupported(method);
				getSession().rollback();
				return null;
			case "createStatement":
				ensureOpen();
				return new StuntStatement(getStuntDb(), this.connection, null, Statement.class).getStatement();
			case "prepareStatement":
				ensureOpen();
				return new StuntStatement(getStuntDb(), this.connection, requireSql(arguments), PreparedStatement.class).getStatement();
			case "prepareCall":
				ensureOpen();
				return new StuntStatement(getStuntDb(), this.connection, requireSql(arguments), CallableStatement.class).getStatement();
			case "nativeSQL":
				ensureOpen();
				return requireSql(arguments);
			case "getMetaData":
				ensureOpen();
				return StuntDatabaseMetaData.create(getStuntDb(), this.connection);
			case "getWarnings":
				ensureOpen();
				return null;
			case "clearWarnings":
				ensureOpen();
				return null;
			case "setReadOnly":
				ensureOpen();
				this.readOnly = (Boolean) arguments[0];
				return null;
			case "isReadOnly":
				ensureOpen();
				return this.readOnly;
			case "setCatalog":
				ensureOpen();
				this.catalog = (String) arguments[0];
				return null;
			case "getCatalog":
				ensureOpen();
				return this.catalog;
			case "setSchema":
				ensureOpen();
				this.schema = (String) arguments[0];
				return null;
			case "getSchema":
				ensureOpen();
				return this.schema;
			case "setTransactionIsolation":
				ensureOpen();
				this.transactionIsolation = (Integer) arguments[0];
				return null;
			case "getTransactionIsolation":
				ensureOpen();
				return this.transactionIsolation;
			case "setHoldability":
				ensureOpen();
				this.holdability = (Integer) arguments[0];
				return null;
			case "getHoldability":
				ensureOpen();
				return this.holdability;
			case "setClientInfo":
				if (arguments.length == 1) {
					this.clientInfo.clear();
					if (arguments[0] != null)
						this.clientInfo.putAll((Properties) arguments[0]);
				} else if (arguments[1] == null) {
					this.clientInfo.remove((String) arguments[0]);
				} else {
					this.clientInfo.setProperty((String) arguments[0], (String) arguments[1]);
				}
				return null;
			case "getClientInfo":
				ensureOpen();
				if (arguments.length == 1)
					return this.clientInfo.getProperty((String) arguments[0]);
				Properties clientInfo = new Properties();
				clientInfo.putAll(this.clientInfo);
				return clientInfo;
			case "setNetworkTimeout":
				ensureOpen();
				if ((Integer) arguments[1] < 0)
					throw new SQLException("Network timeout must not be negative");
				this.networkTimeout = (Integer) arguments[1];
				return null;
			case "getNetworkTimeout":
				ensureOpen();
				return this.networkTimeout;
			case "setTypeMap":
				ensureOpen();
				this.typeMap = arguments[0] == null ? new HashMap<>() : new HashMap<>(castTypeMap(arguments[0]));
				return null;
			case "getTypeMap":
				ensureOpen();
				return new HashMap<>(this.typeMap);
			default:
				throw unsupported(method);
		}
	}

	// Changing auto-commit while a transaction is open commits it
	private void setAutoCommit(boolean autoCommit) throws SQLException {
		ensureOpen();

		boolean inTransaction = getSession().isInTransaction();

		if (!autoCommit && !inTransaction)
			getSession().begin();
		else if (autoCommit && inTransaction)
			getSession().commit();
	}

	@NonNull
	private String requireSql(@NonNull Object[] arguments) throws SQLException {
		requireNonNull(arguments);

		if (arguments.length == 0 || !(arguments[0] instanceof String sql))
			throw new SQLException("SQL must not be null");

		return sql;
	}

	@SuppressWarnings("unchecked")
	@NonNull
	private Map<String, Class<?>> castTypeMap(@NonNull Object typeMap) {
		requireNonNull(typeMap);
		return (Map<String, Class<?>>) typeMap;
	}

	private void ensureOpen() throws SQLException {
		if (getSession().isClosed())
			throw new SQLException("Connection is closed", CONNECTION_CLOSED_SQL_STATE);
	}

	@NonNull
	private MockSession getSession() {
		return getStuntDb().getSession();
	}

	@NonNull
	private StuntDb getStuntDb() {
		return this.stuntDb;
	}
}
