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
import java.sql.Connection;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * JDBC {@link Driver} which resolves {@code jdbc:stuntdb:<name>} URLs to the open {@link StuntDb} registered under
 * {@code <name>}.
 * <p>
 * The driver registers itself with {@link DriverManager} when loaded, either through the
 * {@code META-INF/services/java.sql.Driver} entry or when the first {@link StuntDb} is built. User, password and
 * connection properties are ignored.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class StuntDriver implements Driver {
	@NonNull
	public static final String URL_PREFIX = "jdbc:stuntdb:";

	static final int MAJOR_VERSION = 1;
	static final int MINOR_VERSION = 0;

	@NonNull
	private static final ConcurrentMap<String, StuntDb> STUNT_DBS_BY_NAME;
	@NonNull
	private static final Logger LOGGER;

	static {
		STUNT_DBS_BY_NAME = new ConcurrentHashMap<>();
		LOGGER = Logger.getLogger(StuntDriver.class.getName());

		try {
			DriverManager.registerDriver(new StuntDriver());
		} catch (SQLException e) {
			throw new ExceptionInInitializerError(e);
		}
	}

	@Override
	@Nullable
	public Connection connect(@Nullable String url,
														@Nullable Properties info) throws SQLException {
		// Per the Driver contract, a URL meant for another driver yields null rather than an error
		if (!acceptsURL(url))
			return null;

		String name = url.substring(URL_PREFIX.length());
		StuntDb stuntDb = lookup(name).orElse(null);

		if (stuntDb == null)
			throw new SQLException(format("No open StuntDB is registered under the name '%s' (url was %s)", name, url),
					StuntConnection.CONNECTION_FAILURE_SQL_STATE);

		return stuntDb.getConnection();
	}

	@Override
	public boolean acceptsURL(@Nullable String url) {
		return url != null && url.startsWith(URL_PREFIX);
	}

	@Override
	@NonNull
	public DriverPropertyInfo[] getPropertyInfo(@Nullable String url,
																							@Nullable Properties info) {
		return new DriverPropertyInfo[0];
	}

	@Override
	public int getMajorVersion() {
		return MAJOR_VERSION;
	}

	@Override
	public int getMinorVersion() {
		return MINOR_VERSION;
	}

	@Override
	public boolean jdbcCompliant() {
		return false;
	}

	@Override
	@NonNull
	public Logger getParentLogger() {
		return Logger.getLogger(StuntDriver.class.getPackageName());
	}

	/**
	 * Finds the open {@link StuntDb} registered under {@code name}.
	 *
	 * @param name the registered name
	 * @return the instance, or {@link Optional#empty()} if none is registered
	 */
	@NonNull
	public static Optional<StuntDb> lookup(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(STUNT_DBS_BY_NAME.get(name));
	}

	static void register(@NonNull StuntDb stuntDb) {
		requireNonNull(stuntDb);

		StuntDb existingStuntDb = STUNT_DBS_BY_NAME.putIfAbsent(stuntDb.getName(), stuntDb);

		if (existingStuntDb != null)
			throw new ExpectationUsageException(format("An open StuntDB is already registered under the name '%s'", stuntDb.getName()));

		LOGGER.finer(() -> format("Registered %s", stuntDb.getUrl()));
	}

	static void deregister(@NonNull StuntDb stuntDb) {
		requireNonNull(stuntDb);

		if (STUNT_DBS_BY_NAME.remove(stuntDb.getName(), stuntDb))
			LOGGER.finer(() -> format("Deregistered %s", stuntDb.getUrl()));
	}
}
