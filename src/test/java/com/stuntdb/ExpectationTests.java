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
import java.util.Arrays;
import java.util.List;

/**
 * @since 1.0.0
 */
public class ExpectationTests {
	@Test
	public void testArgumentsOnlyAttachToStatements() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			Expectation begin = stuntDb.expectBegin();

			Assertions.assertThrows(ExpectationUsageException.class, () -> begin.withArgs(1));
			Assertions.assertThrows(ExpectationUsageException.class, begin::withNoArgs);

			stuntDb.getSession().begin();
		}
	}

	@Test
	public void testArgumentsAttachOnce() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			Expectation query = stuntDb.expectQuery("SELECT").withArgs(1);

			Assertions.assertThrows(ExpectationUsageException.class, () -> query.withArgs(2));
			Assertions.assertThrows(ExpectationUsageException.class, query::withNoArgs);
			Assertions.assertEquals(List.of(1), query.getExpectedArgs().orElseThrow());

			stuntDb.getSession().query("SELECT 1", List.of(1));
		}
	}

	@Test
	public void testOutcomesMustSuitTheKind() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			Expectation query = stuntDb.expectQuery();
			Expectation exec = stuntDb.expectExec();

			Assertions.assertThrows(ExpectationUsageException.class, () -> query.willReturnResult(ExecResult.of(1, 1)));
			Assertions.assertThrows(ExpectationUsageException.class, () -> exec.willReturnRows(Rows.empty()));

			query.willReturnRows(Rows.empty());
			exec.willReturnResult(ExecResult.none());

			stuntDb.getSession().query("SELECT 1", List.of());
			stuntDb.getSession().exec("DELETE FROM t", List.of());
		}
	}

	@Test
	public void testOnlyOneOutcome() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			Expectation query = stuntDb.expectQuery().willReturnRows(Rows.empty());

			Assertions.assertThrows(ExpectationUsageException.class, () -> query.willReturnError(new SQLException("boom")));
			Assertions.assertThrows(ExpectationUsageException.class, () -> query.willReturnRows(Rows.empty()));

			Expectation commit = stuntDb.expectCommit().willReturnError(new SQLException("first"));

			Assertions.assertThrows(ExpectationUsageException.class, () -> commit.willReturnError(new SQLException("second")));

			stuntDb.getSession().query("SELECT 1", List.of());
			stuntDb.getSession().begin();
			Assertions.assertThrows(UnmetExpectationsException.class, stuntDb::close);
		}
	}

	@Test
	public void testConsumedExpectationsCannotChange() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			Expectation exec = stuntDb.expectExec("DELETE");

			stuntDb.getSession().exec("DELETE FROM t", List.of());

			Assertions.assertTrue(exec.isFulfilled());
			Assertions.assertThrows(ExpectationUsageException.class, () -> exec.willReturnResult(ExecResult.none()));
			Assertions.assertThrows(ExpectationUsageException.class, () -> exec.withArgs(1));
		}
	}

	@Test
	public void testInvalidPatternFailsAtDeclaration() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			Assertions.assertThrows(ExpectationUsageException.class, () -> stuntDb.expectQuery("SELECT [a-"));
			Assertions.assertTrue(stuntDb.getExpectations().isEmpty(), "A rejected declaration should not be queued");
		}
	}

	@Test
	public void testDescribe() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			Assertions.assertEquals("Begin transaction", stuntDb.expectBegin().describe());
			Assertions.assertEquals("Query (any SQL)", stuntDb.expectQuery().describe());
			Assertions.assertEquals("Exec matching 'UPDATE t' with args [1, 'x', NULL]",
					stuntDb.expectExec("UPDATE t").withArgs(1, "x", null).describe());
			Assertions.assertEquals("Query matching 'SELECT' with args [<any>, <any String>]",
					stuntDb.expectQuery("SELECT").withArgs(Arguments.any(), Arguments.ofType(String.class)).describe());

			Assertions.assertThrows(UnmetExpectationsException.class, stuntDb::close);
		}
	}

	@Test
	public void testArgumentsMayContainNull() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			Expectation exec = stuntDb.expectExec().withArgs(Arrays.asList("a", null));

			Assertions.assertEquals(Arrays.asList("a", null), exec.getExpectedArgs().orElseThrow());

			stuntDb.getSession().exec("INSERT INTO t VALUES (?, ?)", Arrays.asList("a", null));
		}
	}

	@Test
	public void testExecResultRejectsNegativeRowsAffected() {
		Assertions.assertThrows(ExpectationUsageException.class, () -> ExecResult.of(1, -1));
		Assertions.assertEquals(ExecResult.of(0, 0), ExecResult.none());
		Assertions.assertEquals(42L, ExecResult.of(42, 1).getLastInsertId());
	}
}
