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


/**
 * StuntDB is a scriptable JDBC driver double: declare, in order, the database interactions the code under test is
 * expected to perform, hand it a {@link java.sql.Connection}, and get a precise failure the moment it deviates.
 * <p>
 * Expectations are consumed strictly in declaration order. Closing the session (or the {@link com.stuntdb.StuntDb})
 * verifies that every expectation was consumed.
 *
 * <pre>
 * try (StuntDb stuntDb = StuntDb.create()) {
 *   // Declare
 *   stuntDb.expectBegin();
 *   stuntDb.expectQuery("SELECT balance FROM account WHERE id = \\?")
 *     .withArgs(1)
 *     .willReturnRows(Rows.withColumns("balance").addRow(new BigDecimal("10.00")).build());
 *   stuntDb.expectExec("UPDATE account SET balance")
 *     .withArgs(new BigDecimal("5.00"), 1)
 *     .willReturnResult(ExecResult.of(0, 1));
 *   stuntDb.expectCommit();
 *
 *   // Exercise, through the DataSource or at jdbc:stuntdb:&lt;name&gt; via DriverManager
 *   accountService.withdraw(stuntDb.getDataSource(), 1, new BigDecimal("5.00"));
 * } // Throws UnmetExpectationsException if anything was left unconsumed</pre>
 *
 * @since 1.0.0
 */
package com.stuntdb;
