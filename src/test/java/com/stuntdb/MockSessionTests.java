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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
public class MockSessionTests {
	@Test
	public void testCallsInDeclarationOrderSucceed() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			Expectation begin = stuntDb.expectBegin();
			Expectation query = stuntDb.expectQuery("SELECT");
			Expectation exec = stuntDb.expectExec("UPDATE");
			Expectation commit = stuntDb.expectCommit();

			MockSession session = stuntDb.getSession();

			session.begin();
			Assertions.assertEquals(SessionState.IN_TRANSACTION, session.getState());
			session.query("SELECT 1", List.of());
			session.exec("UPDATE t SET a = 1", List.of());
			session.commit();
			Assertions.assertEquals(SessionState.IDLE, session.getState());

			for (Expectation expectation : List.of(begin, query, exec, commit))
				Assertions.assertTrue(expectation.isFulfilled(), "Expected " + expectation.describe() + " to be fulfilled");

			Assertions.assertTrue(session.getExpectationQueue().getUnfulfilledExpectations().isEmpty());
		}
	}

	@Test
	public void testOutOfOrderCallIsRejected() throws Exception {
		StuntDb stuntDb = StuntDb.create();
		stuntDb.expectQuery("FROM users");
		stuntDb.expectExec("UPDATE users");

		MockSession session = stuntDb.getSession();

		ExpectationMismatchException exception = Assertions.assertThrows(ExpectationMismatchException.class,
				() -> session.exec("UPDATE users SET name = ?", List.of("x")));

		Assertions.assertEquals(MismatchReason.KIND, exception.getReason());
		Assertions.assertEquals(ExpectationKind.EXEC, exception.getActualKind());
		Assertions.assertEquals("UPDATE users SET name = ?", exception.getActualSql().orElseThrow());
		Assertions.assertEquals(List.of("x"), exception.getActualArguments());
		Assertions.assertEquals(ExpectationKind.QUERY, exception.getPendingExpectation().orElseThrow().getKind());
		Assertions.assertEquals(ExpectationMismatchException.SQL_STATE, exception.getSQLState());

		// A mismatch leaves the queue untouched
		Assertions.assertEquals(2, session.getExpectationQueue().getUnfulfilledExpectations().size());

		session.query("SELECT * FROM users", List.of());
		session.exec("UPDATE users SET name = ?", List.of("x"));
		stuntDb.close();
	}

	@Test
	public void testArgumentsAreTypeSensitive() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			stuntDb.expectQuery("FROM orders").withArgs(1);

			MockSession session = stuntDb.getSession();

			Assertions.assertEquals(MismatchReason.ARGUMENTS, Assertions.assertThrows(ExpectationMismatchException.class,
					() -> session.query("SELECT * FROM orders WHERE id = ?", List.of(2))).getReason());
			Assertions.assertEquals(MismatchReason.ARGUMENTS, Assertions.assertThrows(ExpectationMismatchException.class,
					() -> session.query("SELECT * FROM orders WHERE id = ?", List.of("1"))).getReason());
			Assertions.assertEquals(MismatchReason.ARGUMENTS, Assertions.assertThrows(ExpectationMismatchException.class,
					() -> session.query("SELECT * FROM orders WHERE id = ?", List.of())).getReason());

			session.query("SELECT * FROM orders WHERE id = ?", List.of(1L));
		}
	}

	@Test
	public void testPatternIsMatchedPartially() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			stuntDb.expectQuery("SELECT (.+) FROM orders");

			MockSession session = stuntDb.getSession();

			ExpectationMismatchException exception = Assertions.assertThrows(ExpectationMismatchException.class,
					() -> session.query("SELECT id FROM users", List.of()));
			Assertions.assertEquals(MismatchReason.PATTERN, exception.getReason());

			session.query("SELECT id, value FROM orders WHERE id = ?", List.of(1));
		}
	}

	@Test
	public void testTimestampArgumentsMatchAnyTimestamp() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			stuntDb.expectExec("INSERT INTO audit").withArgs("login", Instant.EPOCH);
			stuntDb.expectExec("INSERT INTO audit").withArgs("logout", new Timestamp(0L));

			MockSession session = stuntDb.getSession();

			session.exec("INSERT INTO audit (event, at) VALUES (?, ?)", List.of("login", Instant.now()));
			session.exec("INSERT INTO audit (event, at) VALUES (?, ?)", List.of("logout", new Timestamp(123456789L)));
		}
	}

	@Test
	public void testTimestampArgumentOfAnotherTypeIsAMismatch() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			Expectation expectation = stuntDb.expectExec("UPDATE orders").withArgs(LocalDate.of(2024, 1, 1));

			ExpectationMismatchException exception = Assertions.assertThrows(ExpectationMismatchException.class,
					() -> stuntDb.getSession().exec("UPDATE orders SET t = ?", List.of(LocalTime.NOON)));

			Assertions.assertEquals(MismatchReason.ARGUMENTS, exception.getReason());
			Assertions.assertFalse(expectation.isFulfilled());

			stuntDb.getSession().exec("UPDATE orders SET t = ?", List.of(LocalDate.of(2025, 6, 30)));
		}
	}

	@Test
	public void testProgrammedErrorIsReturnedVerbatim() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			SQLException serializationFailure = new SQLException("could not serialize access", "40001");

			stuntDb.expectBegin();
			stuntDb.expectQuery("SELECT").willReturnError(serializationFailure);
			stuntDb.expectRollback();

			MockSession session = stuntDb.getSession();
			session.begin();

			SQLException exception = Assertions.assertThrows(SQLException.class, () -> session.query("SELECT 1", List.of()));

			Assertions.assertSame(serializationFailure, exception);
			Assertions.assertEquals(SessionState.IN_TRANSACTION, session.getState(), "A programmed query error should not move the transaction state");

			session.rollback();
		}
	}

	@Test
	public void testFailedBeginLeavesSessionIdle() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			SQLException connectionFailure = new SQLException("connection refused", "08001");

			stuntDb.expectBegin().willReturnError(connectionFailure);
			stuntDb.expectBegin();
			stuntDb.expectCommit();

			MockSession session = stuntDb.getSession();

			Assertions.assertSame(connectionFailure, Assertions.assertThrows(SQLException.class, session::begin));
			Assertions.assertEquals(SessionState.IDLE, session.getState());

			session.begin();
			session.commit();
		}
	}

	@Test
	public void testFailedCommitStillEndsTransaction() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			SQLException commitFailure = new SQLException("deferred constraint violated", "23505");

			stuntDb.expectBegin();
			stuntDb.expectCommit().willReturnError(commitFailure);

			MockSession session = stuntDb.getSession();
			session.begin();

			Assertions.assertSame(commitFailure, Assertions.assertThrows(SQLException.class, session::commit));
			Assertions.assertEquals(SessionState.IDLE, session.getState());
		}
	}

	@Test
	public void testTransactionStateIsEnforced() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			stuntDb.expectBegin();
			stuntDb.expectBegin();
			stuntDb.expectCommit();
			stuntDb.expectCommit();

			MockSession session = stuntDb.getSession();

			// Nothing is open yet
			Assertions.assertEquals(MismatchReason.TRANSACTION_STATE,
					Assertions.assertThrows(ExpectationMismatchException.class, session::commit).getReason());
			Assertions.assertEquals(MismatchReason.TRANSACTION_STATE,
					Assertions.assertThrows(ExpectationMismatchException.class, session::rollback).getReason());

			session.begin();

			// Already open
			Assertions.assertEquals(MismatchReason.TRANSACTION_STATE,
					Assertions.assertThrows(ExpectationMismatchException.class, session::begin).getReason());
			Assertions.assertEquals(SessionState.IN_TRANSACTION, session.getState());

			// Head is Begin, not Commit
			Assertions.assertEquals(MismatchReason.KIND,
					Assertions.assertThrows(ExpectationMismatchException.class, session::commit).getReason());

			Assertions.assertEquals(3, session.getExpectationQueue().getUnfulfilledExpectations().size());
			Assertions.assertThrows(UnmetExpectationsException.class, session::close);
		}
	}

	@Test
	public void testCallAfterAllExpectationsFulfilled() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			stuntDb.expectExec();

			MockSession session = stuntDb.getSession();
			session.exec("DELETE FROM t", List.of());

			ExpectationMismatchException exception = Assertions.assertThrows(ExpectationMismatchException.class,
					() -> session.exec("DELETE FROM t", List.of()));

			Assertions.assertEquals(MismatchReason.NO_PENDING_EXPECTATION, exception.getReason());
			Assertions.assertTrue(exception.getPendingExpectation().isEmpty());
		}
	}

	@Test
	public void testDefaultOutcomes() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			stuntDb.expectQuery();
			stuntDb.expectExec();

			Rows rows = stuntDb.getSession().query("SELECT 1", List.of());
			ExecResult execResult = stuntDb.getSession().exec("DELETE FROM t", List.of());

			Assertions.assertEquals(0, rows.getRowCount());
			Assertions.assertEquals(ExecResult.none(), execResult);
		}
	}

	@Test
	public void testUnmetExpectationsAreReportedOnClose() {
		StuntDb stuntDb = StuntDb.create();
		stuntDb.expectBegin();
		stuntDb.expectQuery("SELECT .* FROM orders").withArgs(1);
		stuntDb.expectCommit();

		MockSession session = stuntDb.getSession();

		UnmetExpectationsException exception = Assertions.assertThrows(UnmetExpectationsException.class, session::close);

		Assertions.assertEquals(3, exception.getUnmetExpectations().size());
		Assertions.assertTrue(exception.getMessage().startsWith("There are 3 unmet expectations:"), exception.getMessage());
		assertMentionsInOrder(exception.getMessage(), "1. Begin transaction", "2. Query matching 'SELECT .* FROM orders' with args [1]", "3. Commit");

		// Closed even though verification failed
		Assertions.assertEquals(SessionState.CLOSED, session.getState());
		Assertions.assertTrue(StuntDriver.lookup(stuntDb.getName()).isEmpty(), "A closed instance should leave the registry");
	}

	@Test
	public void testCloseIsIdempotent() throws Exception {
		StuntDb stuntDb = StuntDb.create();
		stuntDb.expectExec();

		MockSession session = stuntDb.getSession();

		Assertions.assertThrows(UnmetExpectationsException.class, session::close);
		Assertions.assertDoesNotThrow(session::close, "Second close should be a no-op");
		Assertions.assertDoesNotThrow(stuntDb::close);
	}

	@Test
	public void testCallsAfterCloseAreRejected() throws Exception {
		StuntDb stuntDb = StuntDb.create();
		stuntDb.close();

		MockSession session = stuntDb.getSession();

		Assertions.assertEquals(MismatchReason.SESSION_CLOSED, Assertions.assertThrows(ExpectationMismatchException.class,
				() -> session.query("SELECT 1", List.of())).getReason());
		Assertions.assertEquals(MismatchReason.SESSION_CLOSED, Assertions.assertThrows(ExpectationMismatchException.class,
				session::begin).getReason());
		Assertions.assertThrows(SQLException.class, stuntDb::getConnection);
	}

	@Test
	public void testExplicitVerifyDoesNotClose() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			stuntDb.expectExec();

			Assertions.assertThrows(UnmetExpectationsException.class, stuntDb::verify);
			Assertions.assertFalse(stuntDb.getSession().isClosed());

			stuntDb.getSession().exec("DELETE FROM t", List.of());
			stuntDb.verify();
		}
	}

	@Test
	public void testMismatchMessageNamesBothSides() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			stuntDb.expectQuery("SELECT .* FROM orders").withArgs(1, "pending");

			ExpectationMismatchException exception = Assertions.assertThrows(ExpectationMismatchException.class,
					() -> stuntDb.getSession().query("SELECT * FROM orders WHERE id = ? AND status = ?", List.of(2, "pending")));

			Assertions.assertEquals("Query 'SELECT * FROM orders WHERE id = ? AND status = ?' with args [2, 'pending'] "
					+ "does not match the arguments of pending expectation Query matching 'SELECT .* FROM orders' with args [1, 'pending']",
					exception.getMessage());

			stuntDb.getSession().query("SELECT * FROM orders WHERE id = ? AND status = ?", List.of(1, "pending"));
		}
	}

	@Test
	public void testDuplicateNameIsRejected() throws Exception {
		try (StuntDb stuntDb = StuntDb.builder().name("duplicate_name").build()) {
			Assertions.assertEquals("jdbc:stuntdb:duplicate_name", stuntDb.getUrl());
			Assertions.assertThrows(ExpectationUsageException.class, () -> StuntDb.builder().name("duplicate_name").build());
		}

		// The name is free again once closed
		StuntDb.builder().name("duplicate_name").build().close();
	}

	private void assertMentionsInOrder(@NonNull String message,
																		 @NonNull String... fragments) {
		requireNonNull(message);
		requireNonNull(fragments);

		int fromIndex = 0;

		for (String fragment : fragments) {
			int index = message.indexOf(fragment, fromIndex);
			Assertions.assertTrue(index >= 0, "Expected '" + fragment + "' in order within: " + message);
			fromIndex = index + fragment.length();
		}
	}
}
