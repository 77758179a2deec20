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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Modifier;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import geospectra.lib.operations.ExecutionMode;
import geospectra.lib.raster.RasterFormat;

@SuppressWarnings("javadoc")
public class TestSpectralOperationMethods {
	
	@Test
	public void test_all() {
		var all = SpectralOperationMethods.all();
		assertEquals(34, all.size());
		assertSame(all, SpectralOperationMethods.all());
		var identifiers = all.stream().map(m -> m.getIdentifier()).collect(Collectors.toSet());
		assertEquals(all.size(), identifiers.size());
		assertEquals(all.size(), new HashSet<>(all).size());
	}
	
	@Test
	public void test_allConstantsListed() throws Exception {
		int n = 0;
		for (var field : SpectralOperationMethods.class.getFields()) {
			if (Modifier.isStatic(field.getModifiers()) && field.getType() == SpectralOperationMethod.class) {
				assertTrue(SpectralOperationMethods.all().contains(field.get(null)), field.getName());
				n++;
			}
		}
		assertEquals(n, SpectralOperationMethods.all().size());
	}
	
	@Test
	public void test_indexMethods() {
		for (var method : SpectralOperationMethods.all()) {
			if (method.getSpectralDomain().isBandWise())
				continue;
			assertEquals(SpectralOperationDomain.LOCAL, method.getSpectralDomain(), method.getName());
			assertFalse(method.supportsInPlace(), method.getName());
			assertFalse(method.isReversible(), method.getName());
			assertFalse(method.getParameters().isEmpty(), method.getName());
			assertTrue(method.getSupportedFormats().contains(RasterFormat.INTEGER));
			assertTrue(method.getSupportedFormats().contains(RasterFormat.FLOATING));
		}
	}
	
	@Test
	public void test_perBandMethods() {
		var inversion = SpectralOperationMethods.SPECTRAL_INVERSION;
		assertTrue(inversion.isReversible());
		assertTrue(inversion.supportsInPlace());
		assertTrue(inversion.getSpectralDomain().isBandWise());
		assertEquals(List.of(SpectralOperationParameters.BAND_INDEX, SpectralOperationParameters.BAND_INDICES), inversion.getParameters());
		
		var filtering = SpectralOperationMethods.SPECTRAL_BAND_FILTERING;
		assertEquals(List.of(ExecutionMode.OUT_PLACE), List.copyOf(filtering.getSupportedModes()));
		assertTrue(filtering.hasParameter(SpectralOperationParameters.BAND_NAMES));
		
		var contrast = SpectralOperationMethods.SATURATING_CONTRAST_ENHANCEMENT;
		assertFalse(contrast.isReversible());
		assertTrue(contrast.supportsInPlace());
		assertEquals(SpectralOperationDomain.BAND_GLOBAL, contrast.getSpectralDomain());
		assertEquals(List.of(contrast), SpectralOperationMethods.fromIdentifier("213130"));
	}
	
	@Test
	public void test_find() {
		assertEquals(List.of(SpectralOperationMethods.NORMALIZED_DIFFERENCE_VEGETATION_INDEX), 
				SpectralOperationMethods.fromIdentifier("252013"));
		assertEquals(List.of(SpectralOperationMethods.NORMALIZED_DIFFERENCE_VEGETATION_INDEX), 
				SpectralOperationMethods.fromName("\\(NDVI\\)"));
		assertEquals(4, SpectralOperationMethods.fromName("Vogelmann").size());
		assertEquals(List.of(SpectralOperationMethods.SIMPLE_RATIO_INDEX), SpectralOperationMethods.fromName("\\(SR\\)"));
		assertTrue(SpectralOperationMethods.fromName("Fourier").isEmpty());
		assertTrue(SpectralOperationMethods.fromName(null).isEmpty());
	}

}
