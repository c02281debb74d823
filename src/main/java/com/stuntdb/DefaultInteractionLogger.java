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
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Basic implementation of {@link InteractionLogger} which logs via <a href="https://docs.oracle.com/en/java/javase/17/docs/api/java.logging/java/util/logging/package-summary.html">java.util.logging</a>.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultInteractionLogger implements InteractionLogger {
	@NonNull
	public static final String DEFAULT_LOGGER_NAME = "com.stuntdb.SQL";
	@NonNull
	public static final Level DEFAULT_LOGGER_LEVEL = Level.FINE;

	/**
	 * The point at which we ellipsize output for arguments.
	 */
	private static final int MAXIMUM_ARGUMENT_LOGGING_LENGTH = 100;

	@NonNull
	private final Logger logger;
	@NonNull
	private final Level loggerLevel;

	/**
	 * Creates a new interaction logger with the default logger name <code>{@value #DEFAULT_LOGGER_NAME}</code> and level.
	 */
	public DefaultInteractionLogger() {
		this(DEFAULT_LOGGER_NAME, DEFAULT_LOGGER_LEVEL);
	}

	/**
	 * Creates a new interaction logger with the given logger name and level.
	 *
	 * @param loggerName  the logger name to use
	 * @param loggerLevel the logger level to use
	 */
	public DefaultInteractionLogger(@NonNull String loggerName,
																	@NonNull Level loggerLevel) {
		requireNonNull(loggerName);
		requireNonNull(loggerLevel);

		this.logger = Logger.getLogger(loggerName);
		this.loggerLevel = loggerLevel;
	}

	@Override
	public void log(@NonNull InteractionLog interactionLog) {
		requireNonNull(interactionLog);

		if (getLogger().isLoggable(getLoggerLevel()))
			getLogger().log(getLoggerLevel(), formatInteractionLog(interactionLog));
	}

	@NonNull
	protected String formatInteractionLog(@NonNull InteractionLog interactionLog) {
		requireNonNull(interactionLog);

		List<String> lines = new ArrayList<>(4);

		lines.add(interactionLog.getSql().orElse(interactionLog.getKind().getDescription()));

		if (interactionLog.getArguments().size() > 0)
			lines.add(format("Arguments: %s", interactionLog.getArguments().stream()
					.map(argument -> ellipsize(Values.describe(argument), MAXIMUM_ARGUMENT_LOGGING_LENGTH))
					.collect(joining(", "))));

		lines.add(format("%s matching", interactionLog.getDuration()));

		Exception exception = interactionLog.getException().orElse(null);

		if (exception != null)
			lines.add(format("Failed due to %s", exception));
		else
			interactionLog.getExpectation().ifPresent(expectation -> lines.add(format("Matched %s", expectation.describe())));

		return lines.stream().collect(joining("\n"));
	}

	/**
	 * Ellipsizes the given {@code string}, capping at {@code maximumLength}.
	 *
	 * @param string        the string to ellipsize
	 * @param maximumLength the maximum length of the ellipsized string, not including ellipsis
	 * @return an ellipsized version of {@code string}
	 */
	@NonNull
	protected String ellipsize(@NonNull String string,
														 int maximumLength) {
		requireNonNull(string);

		string = string.trim();

		if (string.length() <= maximumLength)
			return string;

		return format("%s...", string.substring(0, maximumLength));
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@NonNull
	protected Level getLoggerLevel() {
		return this.loggerLevel;
	}
}
