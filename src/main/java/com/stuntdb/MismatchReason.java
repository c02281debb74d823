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

/**
 * Which part of an incoming call failed to correspond to the pending {@link Expectation}.
 *
 * @since 1.0.0
 */
public enum MismatchReason {
	/**
	 * Every declared expectation has already been consumed.
	 */
	NO_PENDING_EXPECTATION,
	/**
	 * The pending expectation is for a different kind of interaction.
	 */
	KIND,
	/**
	 * The incoming SQL text does not satisfy the pending expectation's pattern.
	 */
	PATTERN,
	/**
	 * The incoming bound arguments do not satisfy the pending expectation's arguments.
	 */
	ARGUMENTS,
	/**
	 * The call is not legal in the current transaction state, e.g. commit outside a transaction.
	 */
	TRANSACTION_STATE,
	/**
	 * The session has already been closed.
	 */
	SESSION_CLOSED
}
