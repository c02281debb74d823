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

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An ordered, immutable set of named-column records handed back for a matched query.
 * <p>
 * Each {@link java.sql.ResultSet} produced from a {@code Rows} gets its own cursor, so one instance may be returned
 * by several expectations.
 * <p>
 * Example usage:
 * <pre>{@code
 * Rows rows = Rows.withColumns("id", "status")
 *   .addRow(1, "pending")
 *   .fromCsv("2,shipped\n3,NULL")
 *   .build();
 * }</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Rows {
	@NonNull
	private static final String NULL_FIELD = "NULL";
	@NonNull
	private static final Pattern INTEGER_PATTERN;
	@NonNull
	private static final Pattern DECIMAL_PATTERN;
	@NonNull
	private static final CSVFormat CSV_FORMAT;

	static {
		INTEGER_PATTERN = Pattern.compile("-?\\d+");
		DECIMAL_PATTERN = Pattern.compile("-?\\d*\\.\\d+([eE][-+]?\\d+)?|-?\\d+[eE][-+]?\\d+");
		CSV_FORMAT = CSVFormat.DEFAULT.builder()
				.setTrim(true)
				.setIgnoreEmptyLines(true)
				.setIgnoreSurroundingSpaces(true)
				.get();
	}

	@NonNull
	private final List<String> columnNames;
	@NonNull
	private final List<List<Object>> rows;
	@NonNull
	private final Map<Integer, SQLException> rowErrors;
	@Nullable
	private final SQLException closeError;

	private Rows(@NonNull Builder builder) {
		requireNonNull(builder);

		this.columnNames = List.copyOf(builder.columnNames);
		this.rows = Collections.unmodifiableList(new ArrayList<>(builder.rows));
		this.rowErrors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.rowErrors));
		this.closeError = builder.closeError;
	}

	/**
	 * Creates a {@link Rows} builder for the given column names.
	 *
	 * @param columnNames the column names, in order
	 * @return a {@link Rows} builder
	 */
	@NonNull
	public static Builder withColumns(@NonNull String... columnNames) {
		requireNonNull(columnNames);
		return new Builder(Arrays.asList(columnNames));
	}

	/**
	 * Creates a {@link Rows} builder for the given column names.
	 *
	 * @param columnNames the column names, in order
	 * @return a {@link Rows} builder
	 */
	@NonNull
	public static Builder withColumns(@NonNull List<String> columnNames) {
		requireNonNull(columnNames);
		return new Builder(columnNames);
	}

	/**
	 * A result with no columns and no rows.
	 *
	 * @return an empty {@code Rows}
	 */
	@NonNull
	public static Rows empty() {
		return new Builder(List.of()).build();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{columnNames=%s, rowCount=%d}", getClass().getSimpleName(), getColumnNames(), getRowCount());
	}

	@NonNull
	public List<String> getColumnNames() {
		return this.columnNames;
	}

	/**
	 * The records, each holding one value per column in column order; values may be {@code null}.
	 *
	 * @return the records
	 */
	@NonNull
	public List<List<Object>> getRows() {
		return this.rows;
	}

	@NonNull
	public Integer getRowCount() {
		return this.rows.size();
	}

	/**
	 * The error raised when a cursor advances onto the given row.
	 *
	 * @param rowIndex zero-based row index
	 * @return the error for that row, if one was programmed
	 */
	@NonNull
	public Optional<SQLException> getRowError(int rowIndex) {
		return Optional.ofNullable(this.rowErrors.get(rowIndex));
	}

	/**
	 * The error raised when a cursor over these rows is closed.
	 *
	 * @return the close error, if one was programmed
	 */
	@NonNull
	public Optional<SQLException> getCloseError() {
		return Optional.ofNullable(this.closeError);
	}

	/**
	 * Converts one delimited text field into a row value.
	 * <p>
	 * {@code NULL} becomes {@code null}, whole numbers become {@link Long} (or {@link BigDecimal} when too large),
	 * decimal numbers become {@link BigDecimal}; everything else stays text.
	 *
	 * @param field the trimmed field text
	 * @return the row value
	 */
	@Nullable
	static Object parseField(@NonNull String field) {
		requireNonNull(field);

		if (NULL_FIELD.equals(field))
			return null;

		if (INTEGER_PATTERN.matcher(field).matches()) {
			try {
				return Long.valueOf(field);
			} catch (NumberFormatException e) {
				return new BigDecimal(field);
			}
		}

		if (DECIMAL_PATTERN.matcher(field).matches())
			return new BigDecimal(field);

		return field;
	}

	/**
	 * Builder used to construct instances of {@link Rows}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final List<String> columnNames;
		@NonNull
		private final List<List<Object>> rows;
		@NonNull
		private final Map<Integer, SQLException> rowErrors;
		@Nullable
		private SQLException closeError;

		private Builder(@NonNull List<String> columnNames) {
			requireNonNull(columnNames);

			Set<String> normalizedColumnNames = new HashSet<>(columnNames.size());

			for (String columnName : columnNames) {
				if (columnName == null || columnName.isBlank())
					throw new ExpectationUsageException(format("Column names must not be blank (were %s)", columnNames));

				if (!normalizedColumnNames.add(columnName.toLowerCase(Locale.ROOT)))
					throw new ExpectationUsageException(format("Duplicate column name '%s' in %s", columnName, columnNames));
			}

			this.columnNames = List.copyOf(columnNames);
			this.rows = new ArrayList<>();
			this.rowErrors = new LinkedHashMap<>();
		}

		/**
		 * Appends one record.
		 *
		 * @param values one value per column, in column order
		 * @return this {@code Builder}, for chaining
		 * @throws ExpectationUsageException if the number of values differs from the number of columns
		 */
		@NonNull
		public Builder addRow(@Nullable Object... values) {
			List<Object> row = values == null ? Collections.singletonList(null) : Arrays.asList(values);

			if (row.size() != this.columnNames.size())
				throw new ExpectationUsageException(format("Row %s has %d values but there are %d columns %s",
						Values.describe(row), row.size(), this.columnNames.size(), this.columnNames));

			// Copy, since Arrays.asList() is backed by the caller's array
			this.rows.add(Collections.unmodifiableList(new ArrayList<>(row)));
			return this;
		}

		/**
		 * Appends one record per line of comma-separated text.
		 * <p>
		 * Fields are trimmed and may be quoted. The field {@code NULL} is read as SQL {@code NULL}; whole and
		 * decimal numbers are read as numbers; anything else is read as text.
		 *
		 * @param csv comma-separated records, one per line
		 * @return this {@code Builder}, for chaining
		 * @throws ExpectationUsageException if the text cannot be parsed or a record has the wrong number of fields
		 */
		@NonNull
		public Builder fromCsv(@NonNull String csv) {
			requireNonNull(csv);

			try (CSVParser parser = CSVParser.parse(csv, CSV_FORMAT)) {
				for (CSVRecord record : parser) {
					List<Object> values = new ArrayList<>(record.size());

					for (String field : record)
						values.add(parseField(field));

					addRow(values.toArray());
				}
			} catch (IOException | UncheckedIOException | IllegalStateException e) {
				throw new ExpectationUsageException(format("Unable to parse rows from CSV text: %s", e.getMessage()), e);
			}

			return this;
		}

		/**
		 * Makes the cursor fail with {@code error} when it advances onto the given row.
		 *
		 * @param rowIndex zero-based index of a row added to this builder
		 * @param error    the error to raise
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder rowError(int rowIndex,
														@NonNull SQLException error) {
			requireNonNull(error);

			if (rowIndex < 0 || rowIndex >= this.rows.size())
				throw new ExpectationUsageException(format("Row index %d is out of range, there are %d rows", rowIndex, this.rows.size()));

			this.rowErrors.put(rowIndex, error);
			return this;
		}

		/**
		 * Makes closing the cursor fail with {@code error}.
		 *
		 * @param closeError the error to raise on close
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder closeError(@Nullable SQLException closeError) {
			this.closeError = closeError;
			return this;
		}

		/**
		 * Constructs a {@code Rows} instance.
		 *
		 * @return a {@code Rows} instance
		 */
		@NonNull
		public Rows build() {
			return new Rows(this);
		}
	}
}
