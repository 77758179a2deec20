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

package geospectra.lib.operations.spectral;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Modifier;
import java.util.HashSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import geospectra.lib.operations.parameters.OperationParameter;

@SuppressWarnings("javadoc")
public class TestSpectralOperationParameters {
	
	@Test
	public void test_all() {
		var all = SpectralOperationParameters.all();
		assertEquals(47, all.size());
		assertSame(all, SpectralOperationParameters.all());
		assertEquals(all.size(), new HashSet<>(all).size());
		assertTrue(all.contains(SpectralOperationParameters.BAND_INDEX));
		assertTrue(all.contains(SpectralOperationParameters.INDEX_OF_2200NM_BAND));
		assertTrue(all.contains(SpectralOperationParameters.INDICES_OF_BANDS_BETWEEN_500NM_600NM));
		assertThrows(UnsupportedOperationException.class, () -> all.add(SpectralOperationParameters.BAND_INDEX));
	}
	
	@Test
	public void test_allConstantsListed() throws Exception {
		int n = 0;
		for (var field : SpectralOperationParameters.class.getFields()) {
			if (Modifier.isStatic(field.getModifiers()) && field.getType() == OperationParameter.class) {
				assertTrue(SpectralOperationParameters.all().contains(field.get(null)), field.getName());
				n++;
			}
		}
		assertEquals(n, SpectralOperationParameters.all().size());
	}
	
	@Test
	public void test_bandIndexParametersAreOptional() {
		for (var parameter : SpectralOperationParameters.all()) {
			assertTrue(parameter.isOptional(), parameter + " should be optional");
			assertEquals(null, parameter.getDefaultValue());
		}
		assertTrue(SpectralOperationParameters.INDEX_OF_RED_BAND.isKnownAs("RED"));
		assertTrue(SpectralOperationParameters.INDEX_OF_550NM_BAND.isKnownAs("550nm"));
		assertTrue(SpectralOperationParameters.INDEX_OF_550NM_BAND.isValid(3));
		assertTrue(!SpectralOperationParameters.INDEX_OF_550NM_BAND.isValid(-3));
	}
	
	@Test
	public void test_fromIdentifier() {
		assertEquals(List.of(SpectralOperationParameters.INDEX_OF_550NM_BAND), SpectralOperationParameters.fromIdentifier("2240550$"));
		assertEquals(List.of(SpectralOperationParameters.BAND_INDEX), SpectralOperationParameters.fromIdentifier("223001"));
		assertEquals(28, SpectralOperationParameters.fromIdentifier("::224\\d{4}$").size());
		assertTrue(SpectralOperationParameters.fromIdentifier("999999").isEmpty());
		assertTrue(SpectralOperationParameters.fromIdentifier(null).isEmpty());
	}
	
	@Test
	public void test_fromName() {
		List<OperationParameter<?>> infrared = SpectralOperationParameters.fromName("infrared");
		assertEquals(6, infrared.size());
		assertEquals(List.of(SpectralOperationParameters.BAND_INDEX), SpectralOperationParameters.fromName("^Band index$"));
		// Invalid expressions are matched literally
		assertEquals(List.of(SpectralOperationParameters.INDEX_OF_ULTRAVIOLET_BAND), SpectralOperationParameters.fromName("(UV"));
		assertTrue(SpectralOperationParameters.fromName("[").isEmpty());
	}

}
