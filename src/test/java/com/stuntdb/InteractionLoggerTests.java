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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * @since 1.0.0
 */
public class InteractionLoggerTests {
	@Test
	public void testInteractionLoggerFailureSuppressedWhenCallFails() {
		RuntimeException loggerFailure = new RuntimeException("logger failed");
		InteractionLogger interactionLogger = (interactionLog) -> {
			throw loggerFailure;
		};

		StuntDb stuntDb = StuntDb.builder().interactionLogger(interactionLogger).build();
		stuntDb.expectQuery("FROM users");

		ExpectationMismatchException exception = Assertions.assertThrows(ExpectationMismatchException.class,
				() -> stuntDb.getSession().query("SELECT * FROM orders", List.of()));

		Assertions.assertTrue(
				Arrays.stream(exception.getSuppressed()).anyMatch(suppressed -> "logger failed".equals(suppressed.getMessage())),
				"Expected interaction logger failure to be suppressed");

		Assertions.assertThrows(UnmetExpectationsException.class, stuntDb::close);
	}

	@Test
	public void testInteractionLoggerFailurePropagatesWhenCallSucceeds() throws Exception {
		RuntimeException loggerFailure = new RuntimeException("logger failed");
		InteractionLogger interactionLogger = (interactionLog) -> {
			throw loggerFailure;
		};

		try (StuntDb stuntDb = StuntDb.builder().interactionLogger(interactionLogger).build()) {
			Expectation exec = stuntDb.expectExec();

			Assertions.assertSame(loggerFailure, Assertions.assertThrows(RuntimeException.class,
					() -> stuntDb.getSession().exec("DELETE FROM t", List.of())));
			Assertions.assertTrue(exec.isFulfilled(), "The call itself matched before logging failed");
		}
	}

	@Test
	public void testEveryCallIsLogged() throws Exception {
		List<InteractionLog> interactionLogs = new CopyOnWriteArrayList<>();
		SQLException programmedError = new SQLException("boom");

		try (StuntDb stuntDb = StuntDb.builder().interactionLogger(interactionLogs::add).build()) {
			Expectation begin = stuntDb.expectBegin();
			Expectation exec = stuntDb.expectExec("UPDATE").withArgs(1).willReturnError(programmedError);
			stuntDb.expectRollback();

			stuntDb.getSession().begin();
			Assertions.assertThrows(SQLException.class, () -> stuntDb.getSession().exec("UPDATE t SET a = ?", List.of(1)));
			Assertions.assertThrows(ExpectationMismatchException.class, stuntDb.getSession()::commit);
			stuntDb.getSession().rollback();

			Assertions.assertEquals(4, interactionLogs.size());

			InteractionLog beginLog = interactionLogs.get(0);
			Assertions.assertEquals(ExpectationKind.BEGIN_TRANSACTION, beginLog.getKind());
			Assertions.assertSame(begin, beginLog.getExpectation().orElseThrow());
			Assertions.assertTrue(beginLog.getSql().isEmpty());
			Assertions.assertTrue(beginLog.getException().isEmpty());

			InteractionLog execLog = interactionLogs.get(1);
			Assertions.assertEquals("UPDATE t SET a = ?", execLog.getSql().orElseThrow());
			Assertions.assertEquals(List.of(1), execLog.getArguments());
			Assertions.assertSame(exec, execLog.getExpectation().orElseThrow());
			Assertions.assertSame(programmedError, execLog.getException().orElseThrow());

			InteractionLog commitLog = interactionLogs.get(2);
			Assertions.assertTrue(commitLog.getExpectation().isEmpty(), "A mismatched call consumes nothing");
			Assertions.assertTrue(commitLog.getException().orElseThrow() instanceof ExpectationMismatchException);

			Assertions.assertEquals(ExpectationKind.ROLLBACK, interactionLogs.get(3).getKind());
		}
	}

	@Test
	public void testDefaultInteractionLoggerWritesToJavaUtilLogging() throws Exception {
		String loggerName = "com.stuntdb.SQL.tests";
		Logger logger = Logger.getLogger(loggerName);
		CapturingHandler handler = new CapturingHandler();
		Level originalLevel = logger.getLevel();

		logger.addHandler(handler);
		logger.setLevel(Level.FINE);
		logger.setUseParentHandlers(false);

		try (StuntDb stuntDb = StuntDb.builder().interactionLogger(new DefaultInteractionLogger(loggerName, Level.FINE)).build()) {
			stuntDb.expectQuery("FROM users").withArgs("x".repeat(150));

			stuntDb.getSession().query("SELECT *\n  FROM users WHERE name = ?", List.of("x".repeat(150)));
		} finally {
			logger.removeHandler(handler);
			logger.setLevel(originalLevel);
			logger.setUseParentHandlers(true);
		}

		Assertions.assertEquals(1, handler.getRecords().size());

		LogRecord record = handler.getRecords().get(0);
		Assertions.assertEquals(Level.FINE, record.getLevel());
		Assertions.assertTrue(record.getMessage().startsWith("SELECT *\n  FROM users WHERE name = ?"), record.getMessage());
		Assertions.assertTrue(record.getMessage().contains("Arguments: '" + "x".repeat(99) + "..."), "Long arguments should be ellipsized");
		Assertions.assertTrue(record.getMessage().contains("Matched Query matching 'FROM users'"), record.getMessage());
	}

	@Test
	public void testDefaultInteractionLoggerFormatsFailures() {
		DefaultInteractionLogger interactionLogger = new DefaultInteractionLogger();
		InteractionLog interactionLog = InteractionLog.withKind(ExpectationKind.COMMIT)
				.duration(Duration.ofMillis(2))
				.exception(new SQLException("commit failed"))
				.build();

		String message = interactionLogger.formatInteractionLog(interactionLog);

		Assertions.assertEquals("Commit\nPT0.002S matching\nFailed due to java.sql.SQLException: commit failed", message);
	}

	private static final class CapturingHandler extends Handler {
		private final List<LogRecord> records = new ArrayList<>();

		@Override
		public synchronized void publish(LogRecord record) {
			this.records.add(record);
		}

		@Override
		public void flush() {
			// Nothing buffered
		}

		@Override
		public void close() {
			// Nothing to release
		}

		private synchronized List<LogRecord> getRecords() {
			return new ArrayList<>(this.records);
		}
	}
}
