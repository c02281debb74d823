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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

import static java.lang.String.format;

/**
 * The summary a statement execution reports: the last generated key and the number of affected rows.
 * <p>
 * Instances are immutable.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ExecResult {
	@NonNull
	private static final ExecResult NONE;

	static {
		NONE = new ExecResult(0L, 0L);
	}

	@NonNull
	private final Long lastInsertId;
	@NonNull
	private final Long rowsAffected;

	private ExecResult(@NonNull Long lastInsertId,
										 @NonNull Long rowsAffected) {
		this.lastInsertId = lastInsertId;
		this.rowsAffected = rowsAffected;
	}

	/**
	 * Factory method for providing {@link ExecResult} instances.
	 *
	 * @param lastInsertId the key generated by the statement, exposed through {@link java.sql.Statement#getGeneratedKeys()}
	 * @param rowsAffected the update count
	 * @return an execution result
	 */
	@NonNull
	public static ExecResult of(long lastInsertId,
															long rowsAffected) {
		if (rowsAffected < 0)
			throw new ExpectationUsageException(format("Rows affected cannot be negative (was %d)", rowsAffected));

		return new ExecResult(lastInsertId, rowsAffected);
	}

	/**
	 * The result of a statement which generated no key and touched no rows.
	 *
	 * @return an empty execution result
	 */
	@NonNull
	public static ExecResult none() {
		return NONE;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getLastInsertId(), getRowsAffected());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ExecResult))
			return false;

		ExecResult execResult = (ExecResult) object;

		return Objects.equals(execResult.getLastInsertId(), getLastInsertId())
				&& Objects.equals(execResult.getRowsAffected(), getRowsAffected());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{lastInsertId=%s, rowsAffected=%s}", getClass().getSimpleName(), getLastInsertId(), getRowsAffected());
	}

	@NonNull
	public Long getLastInsertId() {
		return this.lastInsertId;
	}

	@NonNull
	public Long getRowsAffected() {
		return this.rowsAffected;
	}
}
