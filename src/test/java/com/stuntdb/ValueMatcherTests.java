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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * @since 1.0.0
 */
public class ValueMatcherTests {
	@Test
	public void testIntegerWidthsAreInterchangeable() {
		Assertions.assertTrue(ValueMatcher.matches(1, 1L));
		Assertions.assertTrue(ValueMatcher.matches((short) 7, (byte) 7));
		Assertions.assertTrue(ValueMatcher.matches(BigInteger.valueOf(Long.MAX_VALUE), Long.MAX_VALUE));
		Assertions.assertFalse(ValueMatcher.matches(1, 2L));
	}

	@Test
	public void testFamiliesDoNotCrossMatch() {
		Assertions.assertFalse(ValueMatcher.matches(1, "1"), "Integer should never match text");
		Assertions.assertFalse(ValueMatcher.matches("1", 1), "Text should never match an integer");
		Assertions.assertFalse(ValueMatcher.matches(1, 1.0D), "Integer should never match a double");
		Assertions.assertFalse(ValueMatcher.matches(1.0D, new BigDecimal("1.0")), "Double should never match a decimal");
		Assertions.assertFalse(ValueMatcher.matches(true, 1), "Boolean should never match an integer");
	}

	@Test
	public void testFloatingPointComparesExactly() {
		Assertions.assertTrue(ValueMatcher.matches(1.5D, 1.5D));
		Assertions.assertTrue(ValueMatcher.matches(1.5F, 1.5D), "1.5 widens to double exactly");
		Assertions.assertFalse(ValueMatcher.matches(0.1F, 0.1D), "0.1F widens to a different double");
		Assertions.assertTrue(ValueMatcher.matches(Double.NaN, Double.NaN));
	}

	@Test
	public void testDecimalsIgnoreScale() {
		Assertions.assertTrue(ValueMatcher.matches(new BigDecimal("5.0"), new BigDecimal("5.00")));
		Assertions.assertFalse(ValueMatcher.matches(new BigDecimal("5.01"), new BigDecimal("5.00")));
	}

	@Test
	public void testByteArraysCompareContents() {
		Assertions.assertTrue(ValueMatcher.matches(new byte[]{1, 2, 3}, new byte[]{1, 2, 3}));
		Assertions.assertFalse(ValueMatcher.matches(new byte[]{1, 2, 3}, new byte[]{1, 2}));
		Assertions.assertFalse(ValueMatcher.matches(new byte[]{65}, "A"));
	}

	@Test
	public void testNullMatchesOnlyNull() {
		Assertions.assertTrue(ValueMatcher.matches(null, (Object) null));
		Assertions.assertFalse(ValueMatcher.matches(null, 0));
		Assertions.assertFalse(ValueMatcher.matches("", (Object) null));
	}

	@Test
	public void testCalendarValuesMatchByTypeOnly() {
		Instant instant = Instant.parse("2024-01-01T00:00:00Z");

		Assertions.assertTrue(ValueMatcher.matches(instant, Instant.parse("1999-12-31T23:59:59Z")));
		Assertions.assertTrue(ValueMatcher.matches(LocalDate.of(2024, 1, 1), LocalDate.of(1970, 1, 1)));
		Assertions.assertTrue(ValueMatcher.matches(new Date(), new Timestamp(0)), "java.sql subclasses count as Date");
		Assertions.assertFalse(ValueMatcher.matches(instant, "2024-01-01T00:00:00Z"));
		Assertions.assertFalse(ValueMatcher.matches(instant, (Object) null));
	}

	@Test
	public void testCalendarValuesOfDifferentTypesNeverMatch() {
		Assertions.assertFalse(ValueMatcher.matches(LocalDate.of(2024, 1, 1), Instant.now()));
		Assertions.assertFalse(ValueMatcher.matches(LocalTime.NOON, new Date()));
		Assertions.assertFalse(ValueMatcher.matches(new Date(), LocalDateTime.now()));
		Assertions.assertFalse(ValueMatcher.matches(LocalDate.of(2024, 1, 1), new Timestamp(0)));
	}

	@Test
	public void testUnsupportedTypesNeverMatch() {
		UUID uuid = UUID.randomUUID();
		Assertions.assertFalse(ValueMatcher.matches(uuid, uuid), "Types outside the supported families need an argument matcher");
		Assertions.assertTrue(ValueMatcher.matches((ArgumentMatcher) uuid::equals, uuid));
	}

	@Test
	public void testArgumentMatchers() {
		Assertions.assertTrue(ValueMatcher.matches(Arguments.any(), null));
		Assertions.assertTrue(ValueMatcher.matches(Arguments.any(), "anything"));
		Assertions.assertTrue(ValueMatcher.matches(Arguments.ofType(UUID.class), UUID.randomUUID()));
		Assertions.assertFalse(ValueMatcher.matches(Arguments.ofType(UUID.class), "not a uuid"));
		Assertions.assertFalse(ValueMatcher.matches(Arguments.ofType(UUID.class), null));
	}

	@Test
	public void testArgumentLists() {
		Assertions.assertTrue(ValueMatcher.matches(null, List.of(1, "x")), "Unchecked arguments accept anything");
		Assertions.assertTrue(ValueMatcher.matches(List.of(1, "x"), List.of(1L, "x")));
		Assertions.assertTrue(ValueMatcher.matches(Arrays.asList(1, null), Arrays.asList(1L, null)));
		Assertions.assertFalse(ValueMatcher.matches(List.of(1, "x"), List.of("x", 1)), "Positions matter");
		Assertions.assertFalse(ValueMatcher.matches(List.of(1), List.of(1, 2)), "Counts must agree");
		Assertions.assertTrue(ValueMatcher.matches(List.of(), List.of()));
		Assertions.assertFalse(ValueMatcher.matches(List.of(), List.of(1)));
	}
}
