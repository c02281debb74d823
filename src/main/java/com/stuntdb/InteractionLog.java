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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Diagnostics for a single call made against a {@link MockSession}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class InteractionLog {
	@NonNull
	private final ExpectationKind kind;
	@Nullable
	private final String sql;
	@NonNull
	private final List<Object> arguments;
	@Nullable
	private final Expectation expectation;
	@NonNull
	private final Duration duration;
	@Nullable
	private final Exception exception;

	/**
	 * Creates an {@code InteractionLog} for the given {@code builder}.
	 *
	 * @param builder the builder used to construct this {@code InteractionLog}
	 */
	private InteractionLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.kind = requireNonNull(builder.kind);
		this.sql = builder.sql;
		this.arguments = builder.arguments == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(builder.arguments));
		this.expectation = builder.expectation;
		this.duration = builder.duration == null ? Duration.ZERO : builder.duration;
		this.exception = builder.exception;
	}

	/**
	 * Creates an {@link InteractionLog} builder for a call of the given {@code kind}.
	 *
	 * @param kind the kind of call being logged
	 * @return an {@link InteractionLog} builder
	 */
	@NonNull
	public static Builder withKind(@NonNull ExpectationKind kind) {
		requireNonNull(kind);
		return new Builder(kind);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(6);

		components.add(format("kind=%s", getKind().name()));

		String sql = getSql().orElse(null);

		if (sql != null)
			components.add(format("sql=%s", Values.collapseWhitespace(sql)));

		if (getArguments().size() > 0)
			components.add(format("arguments=%s", Values.describe(getArguments())));

		Expectation expectation = getExpectation().orElse(null);

		if (expectation != null)
			components.add(format("expectation=%s", expectation.describe()));

		components.add(format("duration=%s", getDuration()));

		Exception exception = getException().orElse(null);

		if (exception != null)
			components.add(format("exception=%s", exception));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof InteractionLog))
			return false;

		InteractionLog interactionLog = (InteractionLog) object;

		return Objects.equals(getKind(), interactionLog.getKind())
				&& Objects.equals(getSql(), interactionLog.getSql())
				&& Objects.equals(getArguments(), interactionLog.getArguments())
				&& Objects.equals(getExpectation(), interactionLog.getExpectation())
				&& Objects.equals(getDuration(), interactionLog.getDuration())
				&& Objects.equals(getException(), interactionLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getKind(), getSql(), getArguments(), getExpectation(), getDuration(), getException());
	}

	/**
	 * The kind of call that was made.
	 *
	 * @return the call's kind
	 */
	@NonNull
	public ExpectationKind getKind() {
		return this.kind;
	}

	/**
	 * The SQL the call carried.
	 *
	 * @return the SQL, if the call was a statement
	 */
	@NonNull
	public Optional<String> getSql() {
		return Optional.ofNullable(this.sql);
	}

	/**
	 * The arguments the call bound.
	 *
	 * @return the bound arguments, possibly empty
	 */
	@NonNull
	public List<Object> getArguments() {
		return this.arguments;
	}

	/**
	 * The expectation the call consumed.
	 *
	 * @return the consumed expectation, or {@link Optional#empty()} if the call did not match
	 */
	@NonNull
	public Optional<Expectation> getExpectation() {
		return Optional.ofNullable(this.expectation);
	}

	/**
	 * How long did it take to match the call and produce its outcome?
	 *
	 * @return how long the call took
	 */
	@NonNull
	public Duration getDuration() {
		return this.duration;
	}

	/**
	 * The exception the call completed with, either a mismatch or a programmed failure.
	 *
	 * @return the exception, if the call failed
	 */
	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link InteractionLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final ExpectationKind kind;
		@Nullable
		private String sql;
		@Nullable
		private List<Object> arguments;
		@Nullable
		private Expectation expectation;
		@Nullable
		private Duration duration;
		@Nullable
		private Exception exception;

		private Builder(@NonNull ExpectationKind kind) {
			requireNonNull(kind);
			this.kind = kind;
		}

		@NonNull
		public Builder sql(@Nullable String sql) {
			this.sql = sql;
			return this;
		}

		@NonNull
		public Builder arguments(@Nullable List<Object> arguments) {
			this.arguments = arguments;
			return this;
		}

		@NonNull
		public Builder expectation(@Nullable Expectation expectation) {
			this.expectation = expectation;
			return this;
		}

		@NonNull
		public Builder duration(@Nullable Duration duration) {
			this.duration = duration;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		/**
		 * Constructs an {@code InteractionLog} instance.
		 *
		 * @return an {@code InteractionLog} instance
		 */
		@NonNull
		public InteractionLog build() {
			return new InteractionLog(this);
		}
	}
}
