/*-
 * #%L
 * This file is part of GeoSpectra.
 * %%
 * Copyright (C) 2023 - 2024 GeoSpectra developers
 * %%
 * GeoSpectra is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * GeoSpectra is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with GeoSpectra.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package geospectra.lib.operations.parameters;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import geospectra.lib.operations.OperationArgumentException;
import geospectra.lib.operations.OperationArgumentException.Reason;

@SuppressWarnings("javadoc")
public class TestParameterResolver {
	
	private static final OperationParameter<Integer> OPTIONAL = OperationParameter.createOptionalParameter(
			"TEST::1", "Optional index", null, Integer.class, 5, ParameterConditions.isNotNegative());
	
	private static final OperationParameter<Integer> OPTIONAL_NULL = OperationParameter.createOptionalParameter(
			"TEST::2", "Optional index without default", null, Integer.class, null);
	
	private static final OperationParameter<Integer> REQUIRED = OperationParameter.createRequiredParameter(
			"TEST::3", "Required index", null, Integer.class, ParameterConditions.isNotNegative());
	
	@Test
	public void test_explicitValue() {
		var resolver = new ParameterResolver(ParameterBindings.create().put(OPTIONAL, 2));
		assertTrue(resolver.isProvided(OPTIONAL));
		assertEquals(2, resolver.resolve(OPTIONAL));
		
		// The fallback is not evaluated when a value is given
		var calls = new AtomicInteger();
		assertEquals(2, resolver.resolve(OPTIONAL, () -> calls.incrementAndGet()));
		assertEquals(0, calls.get());
	}
	
	@Test
	public void test_fallbackThenDefault() {
		var resolver = new ParameterResolver(null);
		assertFalse(resolver.isProvided(OPTIONAL));
		assertEquals(7, resolver.resolve(OPTIONAL, () -> 7));
		assertEquals(5, resolver.resolve(OPTIONAL, () -> null));
		assertEquals(5, resolver.resolve(OPTIONAL));
		assertNull(resolver.resolve(OPTIONAL_NULL));
		assertEquals(1, resolver.resolve(REQUIRED, () -> 1));
	}
	
	@Test
	public void test_missingRequired() {
		var resolver = new ParameterResolver(ParameterBindings.create());
		var e = assertThrows(OperationArgumentException.class, () -> resolver.resolve(REQUIRED));
		assertEquals(Reason.MISSING_REQUIRED_PARAMETER, e.getReason());
		assertEquals(REQUIRED, e.getParameter());
		e = assertThrows(OperationArgumentException.class, () -> resolver.resolve(REQUIRED, () -> null));
		assertEquals(Reason.MISSING_REQUIRED_PARAMETER, e.getReason());
	}
	
	@Test
	public void test_invalidValue() {
		var resolver = new ParameterResolver(ParameterBindings.create().put(OPTIONAL, -1).putValue(REQUIRED, "one"));
		var e = assertThrows(OperationArgumentException.class, () -> resolver.resolve(OPTIONAL));
		assertEquals(Reason.INVALID_PARAMETER_VALUE, e.getReason());
		e = assertThrows(OperationArgumentException.class, () -> resolver.resolve(REQUIRED, () -> 1));
		assertEquals(Reason.INVALID_PARAMETER_VALUE, e.getReason());
	}
	
	@Test
	public void test_isProvidedIgnoresDefaults() {
		var resolver = new ParameterResolver(ParameterBindings.create().put(OPTIONAL_NULL, 3));
		assertTrue(resolver.isProvided(OPTIONAL_NULL));
		assertFalse(resolver.isProvided(OPTIONAL));
	}

	@Test
	public void test_explicitNull() {
		var bindings = new ParameterBindings().putValue(OPTIONAL, null).putValue(REQUIRED, null);
		assertTrue(bindings.contains(OPTIONAL));
		var resolver = new ParameterResolver(bindings);
		assertTrue(resolver.isProvided(OPTIONAL));
		assertTrue(resolver.isProvided(REQUIRED));
		assertFalse(resolver.isProvided(OPTIONAL_NULL));
		
		// An explicit null resolves to the default without consulting the fallback
		var calls = new AtomicInteger();
		assertEquals(5, resolver.resolve(OPTIONAL, () -> calls.incrementAndGet()));
		assertEquals(0, calls.get());
		var e = assertThrows(OperationArgumentException.class, () -> resolver.resolve(REQUIRED, () -> 1));
		assertEquals(Reason.MISSING_REQUIRED_PARAMETER, e.getReason());
	}

}
