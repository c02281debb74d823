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
import java.sql.JDBCType;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Describes the columns of a {@link Rows} value.
 * <p>
 * Column types are inferred from the first non-null value in each column; a column with no non-null values is
 * reported as {@link JDBCType#NULL}.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class StuntResultSetMetaData implements ResultSetMetaData {
	@NonNull
	private final Rows rows;

	StuntResultSetMetaData(@NonNull Rows rows) {
		requireNonNull(rows);
		this.rows = rows;
	}

	@Override
	public int getColumnCount() {
		return getRows().getColumnNames().size();
	}

	@Override
	public boolean isAutoIncrement(int column) throws SQLException {
		checkColumn(column);
		return false;
	}

	@Override
	public boolean isCaseSensitive(int column) throws SQLException {
		return jdbcType(column) == JDBCType.VARCHAR;
	}

	@Override
	public boolean isSearchable(int column) throws SQLException {
		checkColumn(column);
		return true;
	}

	@Override
	public boolean isCurrency(int column) throws SQLException {
		checkColumn(column);
		return false;
	}

	@Override
	public int isNullable(int column) throws SQLException {
		checkColumn(column);
		return columnNullableUnknown;
	}

	@Override
	public boolean isSigned(int column) throws SQLException {
		JDBCType jdbcType = jdbcType(column);
		return jdbcType == JDBCType.TINYINT || jdbcType == JDBCType.SMALLINT || jdbcType == JDBCType.INTEGER
				|| jdbcType == JDBCType.BIGINT || jdbcType == JDBCType.REAL || jdbcType == JDBCType.DOUBLE
				|| jdbcType == JDBCType.DECIMAL;
	}

	@Override
	public int getColumnDisplaySize(int column) throws SQLException {
		checkColumn(column);

		int displaySize = 0;

		for (List<Object> row : getRows().getRows()) {
			Object value = row.get(column - 1);
			displaySize = Math.max(displaySize, Values.describe(value).length());
		}

		return displaySize;
	}

	@Override
	@NonNull
	public String getColumnLabel(int column) throws SQLException {
		return getColumnName(column);
	}

	@Override
	@NonNull
	public String getColumnName(int column) throws SQLException {
		checkColumn(column);
		return getRows().getColumnNames().get(column - 1);
	}

	@Override
	@NonNull
	public String getSchemaName(int column) throws SQLException {
		checkColumn(column);
		return "";
	}

	@Override
	public int getPrecision(int column) throws SQLException {
		checkColumn(column);
		return 0;
	}

	@Override
	public int getScale(int column) throws SQLException {
		checkColumn(column);
		return 0;
	}

	@Override
	@NonNull
	public String getTableName(int column) throws SQLException {
		checkColumn(column);
		return "";
	}

	@Override
	@NonNull
	public String getCatalogName(int column) throws SQLException {
		checkColumn(column);
		return "";
	}

	@Override
	public int getColumnType(int column) throws SQLException {
		return jdbcType(column).getVendorTypeNumber();
	}

	@Override
	@NonNull
	public String getColumnTypeName(int column) throws SQLException {
		return jdbcType(column).getName();
	}

	@Override
	public boolean isReadOnly(int column) throws SQLException {
		checkColumn(column);
		return true;
	}

	@Override
	public boolean isWritable(int column) throws SQLException {
		checkColumn(column);
		return false;
	}

	@Override
	public boolean isDefinitelyWritable(int column) throws SQLException {
		checkColumn(column);
		return false;
	}

	@Override
	@NonNull
	public String getColumnClassName(int column) throws SQLException {
		checkColumn(column);
		Object value = firstNonNullValue(column);
		return value == null ? Object.class.getName() : value.getClass().getName();
	}

	@Override
	public <T> T unwrap(@NonNull Class<T> iface) throws SQLException {
		requireNonNull(iface);

		if (iface.isInstance(this))
			return iface.cast(this);

		throw new SQLException(format("%s does not wrap %s", getClass().getSimpleName(), iface.getName()));
	}

	@Override
	public boolean isWrapperFor(@NonNull Class<?> iface) {
		requireNonNull(iface);
		return iface.isInstance(this);
	}

	@NonNull
	private JDBCType jdbcType(int column) throws SQLException {
		checkColumn(column);
		return ColumnValues.jdbcTypeFor(firstNonNullValue(column));
	}

	@Nullable
	private Object firstNonNullValue(int column) {
		for (List<Object> row : getRows().getRows()) {
			Object value = row.get(column - 1);

			if (value != null)
				return value;
		}

		return null;
	}

	private void checkColumn(int column) throws SQLException {
		if (column < 1 || column > getColumnCount())
			throw new SQLException(format("Column index %d is out of range, there are %d columns", column, getColumnCount()),
					StuntResultSet.INVALID_COLUMN_SQL_STATE);
	}

	@NonNull
	private Rows getRows() {
		return this.rows;
	}
}
