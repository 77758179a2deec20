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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonParseException;

import geospectra.lib.imaging.SpectralDomain;

@SuppressWarnings("javadoc")
public class TestParameterBindings {
	
	private static final OperationParameter<Integer> INDEX = OperationParameter.createOptionalParameter(
			"TEST::1", "Index", null, Integer.class, 0).withAliases("idx");
	
	private static final OperationParameter<int[]> INDICES = OperationParameter.createOptionalParameter(
			"TEST::2", "Indices", null, int[].class, null);
	
	private static final OperationParameter<SpectralDomain> DOMAIN = OperationParameter.createOptionalParameter(
			"TEST::3", "Domain", null, SpectralDomain.class, null);
	
	private static final List<OperationParameter<?>> KNOWN = List.of(INDEX, INDICES, DOMAIN);
	
	@Test
	public void test_entries() {
		var bindings = ParameterBindings.create()
				.put(INDEX, 2)
				.put(DOMAIN, SpectralDomain.RED);
		assertEquals(2, bindings.size());
		assertTrue(bindings.contains(INDEX));
		assertEquals(2, bindings.get(INDEX));
		assertNull(bindings.get(INDICES));
		assertEquals(List.of(INDEX, DOMAIN), List.copyOf(bindings.getParameters()));
		
		var copy = new ParameterBindings(bindings);
		bindings.remove(INDEX);
		assertFalse(bindings.contains(INDEX));
		assertTrue(copy.contains(INDEX));
		
		assertThrows(IllegalArgumentException.class, () -> bindings.putValue(null, 1));
	}
	
	@Test
	public void test_retain() {
		var bindings = ParameterBindings.create()
				.put(INDEX, 2)
				.put(DOMAIN, SpectralDomain.RED);
		var retained = bindings.retain(List.of(DOMAIN));
		assertEquals(1, retained.size());
		assertTrue(retained.contains(DOMAIN));
		assertEquals(2, bindings.size());
	}
	
	@Test
	public void test_toJson() {
		var bindings = ParameterBindings.create()
				.put(INDEX, 2)
				.put(INDICES, new int[] {1, 3})
				.put(DOMAIN, SpectralDomain.NEAR_INFRARED);
		assertEquals("{\"TEST::1\":2,\"TEST::2\":[1,3],\"TEST::3\":\"NEAR_INFRARED\"}", bindings.toJson());
		
		var read = ParameterBindings.fromJson(bindings.toJson(true), KNOWN);
		assertEquals(2, read.get(INDEX));
		assertArrayEquals(new int[] {1, 3}, (int[])read.get(INDICES));
		assertEquals(SpectralDomain.NEAR_INFRARED, read.get(DOMAIN));
	}
	
	@Test
	public void test_fromJsonByName() {
		var read = ParameterBindings.fromJson("{\"idx\": 4, \"Domain\": \"near infrared\", \"unknown\": true}", KNOWN);
		assertEquals(2, read.size());
		assertEquals(4, read.get(INDEX));
		assertEquals(SpectralDomain.NEAR_INFRARED, read.get(DOMAIN));
	}
	
	@Test
	public void test_fromJsonInvalid() {
		assertThrows(JsonParseException.class, () -> ParameterBindings.fromJson("[1, 2]", KNOWN));
		assertThrows(JsonParseException.class, () -> ParameterBindings.fromJson("{\"TEST::3\": \"purple\"}", KNOWN));
	}

}
