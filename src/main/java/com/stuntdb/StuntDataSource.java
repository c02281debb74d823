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
import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Package-private {@link DataSource} which hands out connections to a single {@link StuntDb}.
 *
 * @since 1.0.0
 */
@ThreadSafe
class StuntDataSource implements DataSource {
	@NonNull
	private final StuntDb stuntDb;

	@Nullable
	private volatile PrintWriter logWriter;
	private volatile int loginTimeout;

	StuntDataSource(@NonNull StuntDb stuntDb) {
		requireNonNull(stuntDb);
		this.stuntDb = stuntDb;
	}

	@Override
	@NonNull
	public Connection getConnection() throws SQLException {
		return getStuntDb().getConnection();
	}

	@Override
	@NonNull
	public Connection getConnection(@Nullable String username,
																	@Nullable String password) throws SQLException {
		return getStuntDb().getConnection();
	}

	@Override
	@Nullable
	public PrintWriter getLogWriter() {
		return this.logWriter;
	}

	@Override
	public void setLogWriter(@Nullable PrintWriter out) {
		this.logWriter = out;
	}

	@Override
	public void setLoginTimeout(int seconds) {
		this.loginTimeout = seconds;
	}

	@Override
	public int getLoginTimeout() {
		return this.loginTimeout;
	}

	@Override
	@NonNull
	public Logger getParentLogger() {
		return Logger.getLogger(StuntDataSource.class.getPackageName());
	}

	@Override
	public <T> T unwrap(@NonNull Class<T> iface) throws SQLException {
		requireNonNull(iface);

		if (iface.isInstance(this))
			return iface.cast(this);

		if (iface.isInstance(getStuntDb()))
			return iface.cast(getStuntDb());

		throw new SQLException(format("%s does not wrap %s", getClass().getSimpleName(), iface.getName()));
	}

	@Override
	public boolean isWrapperFor(@NonNull Class<?> iface) {
		requireNonNull(iface);
		return iface.isInstance(this) || iface.isInstance(getStuntDb());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{url=%s}", getClass().getSimpleName(), getStuntDb().getUrl());
	}

	@NonNull
	protected StuntDb getStuntDb() {
		return this.stuntDb;
	}
}
