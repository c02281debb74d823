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

/**
 * The kinds of driver interaction an {@link Expectation} can stand for.
 *
 * @since 1.0.0
 */
public enum ExpectationKind {
	/**
	 * A transaction is opened, e.g. {@link java.sql.Connection#setAutoCommit(boolean)} with {@code false}.
	 */
	BEGIN_TRANSACTION("Begin transaction", false),
	/**
	 * A statement that produces rows.
	 */
	QUERY("Query", true),
	/**
	 * A statement that produces an update count.
	 */
	EXEC("Exec", true),
	/**
	 * The open transaction is committed.
	 */
	COMMIT("Commit", false),
	/**
	 * The open transaction is rolled back.
	 */
	ROLLBACK("Rollback", false);

	@NonNull
	private final String description;
	@NonNull
	private final Boolean statement;

	ExpectationKind(@NonNull String description,
									@NonNull Boolean statement) {
		this.description = description;
		this.statement = statement;
	}

	/**
	 * Does this kind carry SQL text and bound arguments?
	 * <p>
	 * Only statement kinds may declare a pattern or expected arguments.
	 *
	 * @return {@code true} for {@link #QUERY} and {@link #EXEC}, {@code false} otherwise
	 */
	@NonNull
	public Boolean isStatement() {
		return this.statement;
	}

	@NonNull
	public String getDescription() {
		return this.description;
	}
}
