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
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A forward-only, read-only {@link ResultSet} cursor over a {@link Rows} value.
 * <p>
 * Typed getters convert the programmed value through {@link ColumnValues}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
final class StuntResultSet extends JdbcInvocationHandler {
	@NonNull
	static final String INVALID_COLUMN_SQL_STATE = "07009";
	@NonNull
	static final String INVALID_CURSOR_STATE_SQL_STATE = "24000";

	@NonNull
	private static final Set<String> VALUE_GETTER_NAMES;

	static {
		VALUE_GETTER_NAMES = Set.of(
				"getObject",
				"getString",
				"getNString",
				"getBoolean",
				"getByte",
				"getShort",
				"getInt",
				"getLong",
				"getFloat",
				"getDouble",
				"getBigDecimal",
				"getBytes",
				"getDate",
				"getTime",
				"getTimestamp",
				"getCharacterStream",
				"getNCharacterStream",
				"getBinaryStream",
				"getAsciiStream"
		);
	}

	@NonNull
	private final Rows rows;
	@Nullable
	private final Statement statement;
	private final int rowLimit;
	@NonNull
	private final ResultSet resultSet;

	private int rowIndex;
	private boolean closed;
	private boolean lastValueWasNull;
	private int fetchSize;

	/**
	 * @param rows      the rows to expose
	 * @param statement the statement which produced the rows, if any
	 * @param maxRows   the maximum number of rows to expose, or {@code 0} for all of them
	 */
	StuntResultSet(@NonNull Rows rows,
								 @Nullable Statement statement,
								 long maxRows) {
		requireNonNull(rows);

		this.rows = rows;
		this.statement = statement;
		this.rowLimit = maxRows > 0 ? (int) Math.min(maxRows, rows.getRowCount()) : rows.getRowCount();
		this.rowIndex = -1;
		this.resultSet = newProxy(ResultSet.class, this);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{columns=%s, row=%d, closed=%s}", getClass().getSimpleName(), getRows().getColumnNames(),
				this.rowIndex + 1, this.closed);
	}

	@NonNull
	ResultSet getResultSet() {
		return this.resultSet;
	}

	/**
	 * Closes the cursor without raising the programmed close error, for closes JDBC performs implicitly.
	 */
	void release() {
		this.closed = true;
	}

	@Override
	@Nullable
	protected Object handle(@NonNull Object proxy,
													@NonNull Method method,
													@NonNull Object[] arguments) throws Throwable {
		String name = method.getName();

		if (VALUE_GETTER_NAMES.contains(name) && arguments.length >= 1)
			return getValue(method, arguments);

		switch (name) {
			case "next":
				return next();
			case "close":
				close();
				return null;
			case "isClosed":
				return this.closed;
			case "wasNull":
				ensureOpen();
				return this.lastValueWasNull;
			case "findColumn":
				ensureOpen();
				return findColumn((String) arguments[0]);
			case "getMetaData":
				ensureOpen();
				return new StuntResultSetMetaData(getRows());
			case "getRow":
				ensureOpen();
				return isOnRow() ? this.rowIndex + 1 : 0;
			case "isBeforeFirst":
				ensureOpen();
				return this.rowIndex < 0 && this.rowLimit > 0;
			case "isAfterLast":
				ensureOpen();
				return this.rowIndex >= this.rowLimit && this.rowLimit > 0;
			case "isFirst":
				ensureOpen();
				return this.rowIndex == 0 && this.rowLimit > 0;
			case "isLast":
				ensureOpen();
				return this.rowIndex == this.rowLimit - 1 && this.rowLimit > 0;
			case "getType":
				return ResultSet.TYPE_FORWARD_ONLY;
			case "getConcurrency":
				return ResultSet.CONCUR_READ_ONLY;
			case "getHoldability":
				return ResultSet.HOLD_CURSORS_OVER_COMMIT;
			case "getFetchDirection":
				return ResultSet.FETCH_FORWARD;
			case "setFetchDirection":
				if ((Integer) arguments[0] != ResultSet.FETCH_FORWARD)
					throw unsupported(method);
				return null;
			case "getFetchSize":
				return this.fetchSize;
			case "setFetchSize":
				this.fetchSize = (Integer) arguments[0];
				return null;
			case "getStatement":
				return this.statement;
			case "getWarnings":
				ensureOpen();
				return null;
			case "clearWarnings":
				ensureOpen();
				return null;
			default:
				throw unsupported(method);
		}
	}

	private boolean next() throws SQLException {
		ensureOpen();

		if (this.rowIndex + 1 >= this.rowLimit) {
			this.rowIndex = this.rowLimit;
			return false;
		}

		++this.rowIndex;

		SQLException rowError = getRows().getRowError(this.rowIndex).orElse(null);

		if (rowError != null)
			throw rowError;

		return true;
	}

	private void close() throws SQLException {
		if (this.closed)
			return;

		this.closed = true;

		SQLException closeError = getRows().getCloseError().orElse(null);

		if (closeError != null)
			throw closeError;
	}

	@Nullable
	private Object getValue(@NonNull Method method,
													@NonNull Object[] arguments) throws SQLException {
		requireNonNull(method);
		requireNonNull(arguments);

		ensureOpen();

		if (!isOnRow())
			throw new SQLException("The cursor is not positioned on a row", INVALID_CURSOR_STATE_SQL_STATE);

		int columnIndex = arguments[0] instanceof String columnLabel ? findColumn(columnLabel) : (Integer) arguments[0];

		if (columnIndex < 1 || columnIndex > getRows().getColumnNames().size())
			throw new SQLException(format("Column index %d is out of range, there are %d columns", columnIndex,
					getRows().getColumnNames().size()), INVALID_COLUMN_SQL_STATE);

		List<Object> row = getRows().getRows().get(this.rowIndex);
		Object value = row.get(columnIndex - 1);
		this.lastValueWasNull = value == null;

		Class<?> targetType = method.getReturnType();

		// getObject(column, Class) names its target; getObject(column, Map) ignores the type map
		if ("getObject".equals(method.getName()) && arguments.length == 2 && arguments[1] instanceof Class<?> requestedType)
			targetType = requestedType;

		Object convertedValue = ColumnValues.convert(value, targetType);

		// getBigDecimal(column, scale)
		if (convertedValue instanceof BigDecimal bigDecimal && arguments.length == 2 && arguments[1] instanceof Integer scale)
			return bigDecimal.setScale(scale, RoundingMode.HALF_UP);

		return convertedValue;
	}

	private int findColumn(@NonNull String columnLabel) throws SQLException {
		requireNonNull(columnLabel);

		List<String> columnNames = getRows().getColumnNames();
		String normalizedColumnLabel = columnLabel.toLowerCase(Locale.ROOT);

		for (int i = 0; i < columnNames.size(); ++i)
			if (columnNames.get(i).toLowerCase(Locale.ROOT).equals(normalizedColumnLabel))
				return i + 1;

		throw new SQLException(format("No column named '%s', columns are %s", columnLabel, columnNames), INVALID_COLUMN_SQL_STATE);
	}

	private boolean isOnRow() {
		return this.rowIndex >= 0 && this.rowIndex < this.rowLimit;
	}

	private void ensureOpen() throws SQLException {
		if (this.closed)
			throw new SQLException("Result set is closed", INVALID_CURSOR_STATE_SQL_STATE);
	}

	@NonNull
	private Rows getRows() {
		return this.rows;
	}
}
