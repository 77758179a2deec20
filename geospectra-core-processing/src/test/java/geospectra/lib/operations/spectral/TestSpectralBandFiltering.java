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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import geospectra.lib.geometry.SpectralGeometry;
import geospectra.lib.imaging.RasterImaging;
import geospectra.lib.imaging.SpectralDomain;
import geospectra.lib.operations.OperationArgumentException;
import geospectra.lib.operations.OperationArgumentException.Reason;
import geospectra.lib.operations.parameters.ParameterBindings;
import geospectra.lib.presentation.RasterPresentation;

@SuppressWarnings("javadoc")
public class TestSpectralBandFiltering {
	
	private static SpectralGeometry createSource() {
		return SpectralGeometries.createInteger(5, 2, 3, 16, (r, c, b) -> 1000 * b + 10 * r + c, 
				RasterImaging.fromDomains(SpectralDomain.BLUE, SpectralDomain.GREEN, SpectralDomain.RED, 
						SpectralDomain.NEAR_INFRARED, SpectralDomain.SHORT_WAVELENGTH_INFRARED));
	}
	
	@Test
	public void test_indicesAndNames() {
		var op = new SpectralBandFiltering(createSource(), ParameterBindings.create()
				.put(SpectralOperationParameters.BAND_INDICES, new int[] {4, 1})
				.put(SpectralOperationParameters.BAND_NAMES, new SpectralDomain[] {SpectralDomain.RED, SpectralDomain.GREEN}));
		assertArrayEquals(new int[] {1, 2, 4}, op.getSelectedBands());
		op.execute();
		var result = op.getResult();
		var raster = result.getRaster();
		assertEquals(3, raster.getNumberOfBands());
		assertEquals(16, raster.getRadiometricResolution());
		assertEquals(1012, raster.getValue(1, 2, 0));
		assertEquals(2012, raster.getValue(1, 2, 1));
		assertEquals(4012, raster.getValue(1, 2, 2));
		assertEquals(List.of(SpectralDomain.GREEN, SpectralDomain.RED, SpectralDomain.SHORT_WAVELENGTH_INFRARED), 
				result.getImaging().getSpectralDomains());
		assertEquals(RasterPresentation.createFalseColorPresentation(0, 1, 2), result.getPresentation());
	}
	
	@Test
	public void test_singleBand() {
		var op = new SpectralBandFiltering(createSource(), ParameterBindings.create()
				.put(SpectralOperationParameters.BAND_NAME, SpectralDomain.NEAR_INFRARED));
		op.execute();
		var result = op.getResult();
		assertEquals(1, result.getRaster().getNumberOfBands());
		assertEquals(3000, result.getRaster().getValue(0, 0, 0));
		assertEquals(RasterPresentation.createGrayscalePresentation(), result.getPresentation());
	}
	
	@Test
	public void test_allBands() {
		var source = createSource();
		var op = new SpectralBandFiltering(source, null);
		op.execute();
		var result = op.getResult();
		assertEquals(5, result.getRaster().getNumberOfBands());
		assertEquals(source.getPresentation(), result.getPresentation());
		assertEquals(source.getImaging(), result.getImaging());
		assertEquals(4102, result.getRaster().getValue(1, 2, 4));
	}
	
	@Test
	public void test_withoutImaging() {
		var source = SpectralGeometries.createFloat(3, 1, 1, (r, c, b) -> b + 0.5, null);
		var op = new SpectralBandFiltering(source, ParameterBindings.create()
				.put(SpectralOperationParameters.BAND_INDICES, new int[] {0, 2}));
		op.execute();
		assertFalse(op.getResult().hasImaging());
		assertEquals(2.5, op.getResult().getRaster().getFloatValue(0, 0, 1), 1e-12);
		
		var e = assertThrows(OperationArgumentException.class, () -> new SpectralBandFiltering(source, 
				ParameterBindings.create().put(SpectralOperationParameters.BAND_NAME, SpectralDomain.RED)));
		assertEquals(Reason.INVALID_SOURCE_DATA, e.getReason());
	}
	
	@Test
	public void test_inPlaceNotSupported() {
		var source = createSource();
		var e = assertThrows(OperationArgumentException.class, () -> new SpectralBandFiltering(source, source, null));
		assertEquals(Reason.IN_PLACE_NOT_SUPPORTED, e.getReason());
	}

}
