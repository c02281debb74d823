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
import java.lang.reflect.Method;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Minimal {@link DatabaseMetaData}: product and driver identification plus the handful of capability flags that
 * connection pools and data access libraries commonly check.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class StuntDatabaseMetaData extends JdbcInvocationHandler {
	@NonNull
	static final String PRODUCT_NAME = "StuntDB";
	@NonNull
	static final String DRIVER_NAME = "StuntDB JDBC Driver";

	@NonNull
	private final StuntDb stuntDb;
	@NonNull
	private final Connection connection;

	private StuntDatabaseMetaData(@NonNull StuntDb stuntDb,
																@NonNull Connection connection) {
		requireNonNull(stuntDb);
		requireNonNull(connection);

		this.stuntDb = stuntDb;
		this.connection = connection;
	}

	@NonNull
	static DatabaseMetaData create(@NonNull StuntDb stuntDb,
																 @NonNull Connection connection) {
		return newProxy(DatabaseMetaData.class, new StuntDatabaseMetaData(stuntDb, connection));
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{url=%s}", getClass().getSimpleName(), this.stuntDb.getUrl());
	}

	@Override
	@Nullable
	protected Object handle(@NonNull Object proxy,
													@NonNull Method method,
													@NonNull Object[] arguments) throws Throwable {
		String version = format("%d.%d", StuntDriver.MAJOR_VERSION, StuntDriver.MINOR_VERSION);

		switch (method.getName()) {
			case "getDatabaseProductName":
				return PRODUCT_NAME;
			case "getDatabaseProductVersion":
				return version;
			case "getDatabaseMajorVersion":
			case "getDriverMajorVersion":
				return StuntDriver.MAJOR_VERSION;
			case "getDatabaseMinorVersion":
			case "getDriverMinorVersion":
				return StuntDriver.MINOR_VERSION;
			case "getDriverName":
				return DRIVER_NAME;
			case "getDriverVersion":
				return version;
			case "getJDBCMajorVersion":
				return 4;
			case "getJDBCMinorVersion":
				return 2;
			case "getURL":
				return this.stuntDb.getUrl();
			case "getUserName":
				return "";
			case "getConnection":
				return this.connection;
			case "isReadOnly":
				return false;
			case "getIdentifierQuoteString":
				return "\"";
			case "getSQLStateType":
				return DatabaseMetaData.sqlStateSQL;
			case "getDefaultTransactionIsolation":
				return Connection.TRANSACTION_READ_COMMITTED;
			case "getResultSetHoldability":
				return ResultSet.HOLD_CURSORS_OVER_COMMIT;
			case "supportsTransactions":
			case "supportsBatchUpdates":
			case "supportsGetGeneratedKeys":
			case "supportsTransactionIsolationLevel":
				return true;
			case "supportsResultSetType":
				return (Integer) arguments[0] == ResultSet.TYPE_FORWARD_ONLY;
			case "supportsResultSetConcurrency":
				return (Integer) arguments[0] == ResultSet.TYPE_FORWARD_ONLY && (Integer) arguments[1] == ResultSet.CONCUR_READ_ONLY;
			case "supportsResultSetHoldability":
				return (Integer) arguments[0] == ResultSet.HOLD_CURSORS_OVER_COMMIT;
			case "supportsSavepoints":
			case "supportsNamedParameters":
			case "supportsMultipleResultSets":
			case "supportsMultipleOpenResults":
			case "supportsStoredProcedures":
			case "autoCommitFailureClosesAllResultSets":
			case "generatedKeyAlwaysReturned":
				return false;
			default:
				throw unsupported(method);
		}
	}
}
