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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
public class SessionConcurrencyTests {
	private static final int THREAD_COUNT = 8;
	private static final int CALLS_PER_THREAD = 25;

	@Test
	public void testConcurrentCallersConsumeEachExpectationOnce() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			for (int i = 0; i < THREAD_COUNT * CALLS_PER_THREAD; ++i)
				stuntDb.expectExec("INSERT INTO events").willReturnResult(ExecResult.of(i, 1));

			CyclicBarrier barrier = new CyclicBarrier(THREAD_COUNT);
			AtomicReference<Throwable> failure = new AtomicReference<>();
			AtomicInteger rowsAffected = new AtomicInteger();
			List<Thread> threads = new ArrayList<>(THREAD_COUNT);

			for (int i = 0; i < THREAD_COUNT; ++i) {
				int threadId = i;
				threads.add(new Thread(() -> runInserts(stuntDb, barrier, failure, rowsAffected, threadId)));
			}

			for (Thread thread : threads)
				thread.start();

			for (Thread thread : threads)
				thread.join(TimeUnit.SECONDS.toMillis(10));

			if (failure.get() != null)
				throw new RuntimeException(failure.get());

			Assertions.assertEquals(THREAD_COUNT * CALLS_PER_THREAD, rowsAffected.get());
			Assertions.assertTrue(stuntDb.getExpectations().stream().allMatch(Expectation::isFulfilled));
		}
	}

	@Test
	public void testOnlyOneCallerWinsTheHead() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			stuntDb.expectExec("UPDATE counters");

			CyclicBarrier barrier = new CyclicBarrier(THREAD_COUNT);
			AtomicInteger successes = new AtomicInteger();
			AtomicInteger noPendingMismatches = new AtomicInteger();
			AtomicReference<Throwable> failure = new AtomicReference<>();
			List<Thread> threads = new ArrayList<>(THREAD_COUNT);

			for (int i = 0; i < THREAD_COUNT; ++i) {
				threads.add(new Thread(() -> {
					try {
						barrier.await(5, TimeUnit.SECONDS);
						stuntDb.getSession().exec("UPDATE counters SET n = n + 1", List.of());
						successes.incrementAndGet();
					} catch (ExpectationMismatchException e) {
						if (e.getReason() == MismatchReason.NO_PENDING_EXPECTATION)
							noPendingMismatches.incrementAndGet();
						else
							failure.compareAndSet(null, e);
					} catch (Throwable t) {
						failure.compareAndSet(null, t);
					}
				}));
			}

			for (Thread thread : threads)
				thread.start();

			for (Thread thread : threads)
				thread.join(TimeUnit.SECONDS.toMillis(10));

			if (failure.get() != null)
				throw new RuntimeException(failure.get());

			Assertions.assertEquals(1, successes.get());
			Assertions.assertEquals(THREAD_COUNT - 1, noPendingMismatches.get());
		}
	}

	@Test
	public void testMatchingIsSerialized() throws Exception {
		ConcurrencyGuard guard = new ConcurrencyGuard();

		try (StuntDb stuntDb = StuntDb.create()) {
			for (int i = 0; i < THREAD_COUNT; ++i)
				stuntDb.expectExec("INSERT").withArgs(guard);

			CyclicBarrier barrier = new CyclicBarrier(THREAD_COUNT);
			AtomicReference<Throwable> failure = new AtomicReference<>();
			List<Thread> threads = new ArrayList<>(THREAD_COUNT);

			for (int i = 0; i < THREAD_COUNT; ++i) {
				int threadId = i;
				threads.add(new Thread(() -> {
					try {
						barrier.await(5, TimeUnit.SECONDS);
						stuntDb.getSession().exec("INSERT INTO t VALUES (?)", List.of(threadId));
					} catch (Throwable t) {
						failure.compareAndSet(null, t);
					}
				}));
			}

			for (Thread thread : threads)
				thread.start();

			for (Thread thread : threads)
				thread.join(TimeUnit.SECONDS.toMillis(10));

			if (failure.get() != null)
				throw new RuntimeException(failure.get());
		}

		Assertions.assertFalse(guard.isConcurrent(), "Expected head inspection and consumption to be serialized");
		Assertions.assertEquals(THREAD_COUNT, guard.getEntryCount());
	}

	@Test
	public void testConcurrentExecuteRoutesByTheHeadItConsumes() throws Exception {
		try (StuntDb stuntDb = StuntDb.create()) {
			for (int i = 0; i < THREAD_COUNT * CALLS_PER_THREAD; ++i) {
				if (i % 2 == 0)
					stuntDb.expectQuery();
				else
					stuntDb.expectExec();
			}

			CyclicBarrier barrier = new CyclicBarrier(THREAD_COUNT);
			AtomicReference<Throwable> failure = new AtomicReference<>();
			AtomicInteger queryCount = new AtomicInteger();
			List<Thread> threads = new ArrayList<>(THREAD_COUNT);

			for (int i = 0; i < THREAD_COUNT; ++i) {
				threads.add(new Thread(() -> {
					try {
						barrier.await(5, TimeUnit.SECONDS);

						Connection connection = stuntDb.getConnection();

						try (Statement statement = connection.createStatement()) {
							for (int j = 0; j < CALLS_PER_THREAD; ++j)
								if (statement.execute("SELECT OR UPDATE"))
									queryCount.incrementAndGet();
						}
					} catch (Throwable t) {
						failure.compareAndSet(null, t);
					}
				}));
			}

			for (Thread thread : threads)
				thread.start();

			for (Thread thread : threads)
				thread.join(TimeUnit.SECONDS.toMillis(10));

			if (failure.get() != null)
				throw new RuntimeException(failure.get());

			Assertions.assertEquals(THREAD_COUNT * CALLS_PER_THREAD / 2, queryCount.get());
			Assertions.assertTrue(stuntDb.getExpectations().stream().allMatch(Expectation::isFulfilled));
		}
	}

	private void runInserts(@NonNull StuntDb stuntDb,
													@NonNull CyclicBarrier barrier,
													@NonNull AtomicReference<Throwable> failure,
													@NonNull AtomicInteger rowsAffected,
													int threadId) {
		requireNonNull(stuntDb);
		requireNonNull(barrier);
		requireNonNull(failure);
		requireNonNull(rowsAffected);

		try {
			barrier.await(5, TimeUnit.SECONDS);

			// Each thread gets its own connection, all sharing the one session
			Connection connection = stuntDb.getConnection();

			try (PreparedStatement preparedStatement = connection.prepareStatement("INSERT INTO events (thread_id, n) VALUES (?, ?)")) {
				for (int i = 0; i < CALLS_PER_THREAD; ++i) {
					preparedStatement.setInt(1, threadId);
					preparedStatement.setInt(2, i);
					rowsAffected.addAndGet(preparedStatement.executeUpdate());
				}
			}
		} catch (Throwable t) {
			failure.compareAndSet(null, t);
		}
	}

	// Argument matcher which notices if two callers are ever matching at the same time
	private static final class ConcurrencyGuard implements ArgumentMatcher {
		@NonNull
		private final AtomicInteger inFlight = new AtomicInteger();
		@NonNull
		private final AtomicInteger entryCount = new AtomicInteger();
		private volatile boolean concurrent;

		@Override
		public boolean matches(@Nullable Object actual) {
			this.entryCount.incrementAndGet();

			if (this.inFlight.incrementAndGet() > 1)
				this.concurrent = true;

			try {
				Thread.sleep(5);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new RuntimeException(e);
			} finally {
				this.inFlight.decrementAndGet();
			}

			return actual instanceof Integer;
		}

		private boolean isConcurrent() {
			return this.concurrent;
		}

		private int getEntryCount() {
			return this.entryCount.get();
		}
	}
}
