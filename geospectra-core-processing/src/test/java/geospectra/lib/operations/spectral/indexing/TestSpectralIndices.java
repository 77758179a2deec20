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

package geospectra.lib.operations.spectral.indexing;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import geospectra.lib.geometry.SpectralGeometry;
import geospectra.lib.imaging.RasterImaging;
import geospectra.lib.imaging.RasterImagingBand;
import geospectra.lib.imaging.SpectralDomain;
import geospectra.lib.imaging.SpectralRange;
import geospectra.lib.operations.OperationArgumentException;
import geospectra.lib.operations.OperationArgumentException.Reason;
import geospectra.lib.operations.parameters.ParameterBindings;
import geospectra.lib.operations.spectral.SpectralGeometries;
import geospectra.lib.operations.spectral.SpectralOperationMethods;
import geospectra.lib.operations.spectral.SpectralOperationParameters;
import geospectra.lib.presentation.RasterPresentation;
import geospectra.lib.raster.RasterFormat;

@SuppressWarnings("javadoc")
public class TestSpectralIndices {
	
	private static final double[] WAVELENGTHS = {
			445, 500, 510, 531, 550, 570, 680, 700, 705, 715, 720, 726, 734, 740, 747, 750, 800, 819, 
			900, 970, 1510, 1599, 1649, 1680, 1754, 2000, 2100, 2200
	};
	
	/**
	 * Imaging with a narrow band for every wavelength used by the catalog, followed by one band per broad domain.
	 */
	private static RasterImaging createCatalogImaging() {
		var bands = new ArrayList<>(SpectralGeometries.narrowBands(WAVELENGTHS).getBands());
		for (var domain : new SpectralDomain[] {SpectralDomain.BLUE, SpectralDomain.RED, SpectralDomain.NEAR_INFRARED, SpectralDomain.SHORT_WAVELENGTH_INFRARED})
			bands.add(RasterImagingBand.create(domain));
		return RasterImaging.create("test", bands);
	}
	
	private static SpectralGeometry createRedNir(double red, double nir) {
		return SpectralGeometries.createPixel(RasterImaging.fromDomains(SpectralDomain.RED, SpectralDomain.NEAR_INFRARED), red, nir);
	}
	
	private static double computePixel(SpectralIndex index, SpectralGeometry source, int band) {
		var computation = index.createComputation(source, null);
		computation.execute();
		return computation.getResult().getRaster().getFloatValue(0, 0, band);
	}
	
	@Test
	public void test_catalog() {
		assertEquals(31, SpectralIndex.values().length);
		var methods = new HashSet<>();
		for (var index : SpectralIndex.values()) {
			assertTrue(methods.add(index.getMethod()));
			assertTrue(SpectralOperationMethods.all().contains(index.getMethod()));
			assertSame(index, SpectralIndex.fromMethod(index.getMethod()));
			assertFalse(index.getRequirements().isEmpty());
		}
		assertNull(SpectralIndex.fromMethod(SpectralOperationMethods.SPECTRAL_INVERSION));
		assertEquals(3, SpectralIndex.NDXI.getNumberOfBands());
		assertEquals(RasterPresentation.createFalseColorPresentation(0, 1, 2), SpectralIndex.NDXI.getPresentation());
	}
	
	@ParameterizedTest
	@EnumSource(SpectralIndex.class)
	public void test_zeroSource(SpectralIndex index) {
		var imaging = createCatalogImaging();
		var source = SpectralGeometries.createFloat(imaging.getNumberOfBands(), 2, 2, (r, c, b) -> 0, imaging);
		var computation = index.createComputation(source, null);
		computation.execute();
		var raster = computation.getResult().getRaster();
		assertEquals(index.getNumberOfBands(), raster.getNumberOfBands());
		for (int b = 0; b < raster.getNumberOfBands(); b++) {
			for (int r = 0; r < 2; r++) {
				for (int c = 0; c < 2; c++)
					assertEquals(0.0, raster.getFloatValue(r, c, b));
			}
		}
	}
	
	@ParameterizedTest
	@EnumSource(SpectralIndex.class)
	public void test_resultShape(SpectralIndex index) {
		var imaging = createCatalogImaging();
		var source = SpectralGeometries.createFloat(imaging.getNumberOfBands(), 3, 2, (r, c, b) -> 0.1 + 0.01 * b + 0.1 * r + 0.05 * c, imaging);
		var computation = index.createComputation(source, null);
		var lazy = computation.getResult();
		computation.execute();
		var result = computation.getResult();
		var raster = result.getRaster();
		assertEquals(RasterFormat.FLOATING, raster.getFormat());
		assertEquals(32, raster.getRadiometricResolution());
		assertEquals(3, raster.getNumberOfRows());
		assertEquals(2, raster.getNumberOfColumns());
		assertFalse(result.hasImaging());
		assertEquals(index.getPresentation(), result.getPresentation());
		for (int b = 0; b < raster.getNumberOfBands(); b++) {
			for (int r = 0; r < 3; r++) {
				for (int c = 0; c < 2; c++) {
					double value = raster.getFloatValue(r, c, b);
					assertTrue(Double.isFinite(value));
					// the allocated raster stores single precision values
					assertEquals((float)lazy.getRaster().getFloatValue(r, c, b), value);
				}
			}
		}
	}
	
	@Test
	public void test_ndvi() {
		var lazy = SpectralIndex.NDVI.createComputation(createRedNir(0.2, 0.8), null).getResult();
		assertEquals(0.6, lazy.getRaster().getFloatValue(0, 0, 0), 1e-9);
		assertArrayEquals(new double[] {0.6}, lazy.getRaster().getFloatValues(0, 0), 1e-9);
		assertEquals(0.6, computePixel(SpectralIndex.NDVI, createRedNir(0.2, 0.8), 0), 1e-6);
		assertEquals(0.0, computePixel(SpectralIndex.NDVI, createRedNir(0, 0), 0));
		assertEquals(-1.0, computePixel(SpectralIndex.NDVI, createRedNir(0.5, 0), 0), 1e-6);
	}
	
	@Test
	public void test_simpleRatio() {
		assertEquals(4.0, computePixel(SpectralIndex.SR, createRedNir(0.2, 0.8), 0), 1e-6);
		assertEquals(0.0, computePixel(SpectralIndex.SR, createRedNir(0, 0.8), 0));
	}
	
	@Test
	public void test_soilAdjusted() {
		assertEquals(1.5 * 0.6 / 1.5, computePixel(SpectralIndex.SAVI, createRedNir(0.2, 0.8), 0), 1e-6);
	}
	
	@Test
	public void test_enhancedVegetation() {
		var source = SpectralGeometries.createPixel(RasterImaging.fromDomains(SpectralDomain.BLUE, SpectralDomain.RED, SpectralDomain.NEAR_INFRARED), 
				0.1, 0.2, 0.8);
		double expected = 2.5 * 0.6 / (0.8 + 6 * 0.2 - 7.5 * 0.1 + 1);
		assertEquals(expected, computePixel(SpectralIndex.EVI, source, 0), 1e-6);
	}
	
	@Test
	public void test_reciprocalIndices() {
		var source = SpectralGeometries.createPixel(SpectralGeometries.narrowBands(510, 550, 700, 800), 0.25, 0.5, 0.125, 2);
		assertEquals(2 - 8, computePixel(SpectralIndex.ARI1, source, 0), 1e-6);
		assertEquals(2 * (2 - 8), computePixel(SpectralIndex.ARI2, source, 0), 1e-6);
		assertEquals(4 - 2, computePixel(SpectralIndex.CRI1, source, 0), 1e-6);
		assertEquals(4 - 8, computePixel(SpectralIndex.CRI2, source, 0), 1e-6);
		assertEquals(computePixel(SpectralIndex.ARI1, source, 0), computePixel(SpectralIndex.ARI, source, 0));
		assertEquals(computePixel(SpectralIndex.ARI2, source, 0), computePixel(SpectralIndex.ARI, source, 1));
		assertEquals(computePixel(SpectralIndex.CRI1, source, 0), computePixel(SpectralIndex.CRI, source, 0));
		assertEquals(computePixel(SpectralIndex.CRI2, source, 0), computePixel(SpectralIndex.CRI, source, 1));
	}
	
	@Test
	public void test_logarithmOfZero() {
		var source = SpectralGeometries.createPixel(SpectralGeometries.narrowBands(1510, 1680), 0, 0.5);
		assertEquals(0.0, computePixel(SpectralIndex.NDNI, source, 0));
		source = SpectralGeometries.createPixel(SpectralGeometries.narrowBands(1510, 1680), 0.25, 0.5);
		double a = Math.log(4);
		double b = Math.log(2);
		assertEquals((a - b) / (a + b), computePixel(SpectralIndex.NDNI, source, 0), 1e-6);
	}
	
	@Test
	public void test_nonFiniteValues() {
		// infinite red reflectance makes the normalized difference undefined
		var source = SpectralGeometries.createFloat(2, 1, 3, (r, c, b) -> b == 0 && c > 0 ? Double.POSITIVE_INFINITY : 0.5 + 0.1 * b, 
				RasterImaging.fromDomains(SpectralDomain.RED, SpectralDomain.NEAR_INFRARED));
		var computation = SpectralIndex.NDVI.createComputation(source, null);
		assertEquals(0, computation.getNumberOfNonFiniteValues());
		computation.execute();
		var raster = computation.getResult().getRaster();
		assertEquals(1.0 / 11.0, raster.getFloatValue(0, 0, 0), 1e-6);
		assertEquals(0.0, raster.getFloatValue(0, 1, 0));
		assertEquals(0.0, raster.getFloatValue(0, 2, 0));
		assertEquals(2, computation.getNumberOfNonFiniteValues());
	}
	
	@Test
	public void test_sumGreen() {
		var source = SpectralGeometries.createPixel(SpectralGeometries.narrowBands(450, 510, 550, 590, 650), 1, 2, 4, 6, 100);
		var computation = SpectralIndex.SUM_GREEN.createComputation(source, null);
		assertArrayEquals(new int[] {1, 2, 3}, computation.getSourceBands());
		computation.execute();
		assertEquals(4.0, computation.getResult().getRaster().getFloatValue(0, 0, 0), 1e-6);
		
		var explicit = SpectralIndex.SUM_GREEN.createComputation(source, ParameterBindings.create()
				.put(SpectralOperationParameters.INDICES_OF_BANDS_BETWEEN_500NM_600NM, new int[] {0, 4}));
		explicit.execute();
		assertEquals(50.5, explicit.getResult().getRaster().getFloatValue(0, 0, 0), 1e-6);
		
		var noGreen = SpectralGeometries.createPixel(SpectralGeometries.narrowBands(450, 650), 1, 2);
		var e = assertThrows(OperationArgumentException.class, () -> SpectralIndex.SUM_GREEN.createComputation(noGreen, null));
		assertEquals(Reason.INVALID_SOURCE_DATA, e.getReason());
	}
	
	@Test
	public void test_ndxiPositionalDefaults() {
		var source = SpectralGeometries.createPixel(null, 0.2, 0.8, 0.5);
		var computation = SpectralIndex.NDXI.createComputation(source, null);
		assertArrayEquals(new int[] {0, 1, 2}, computation.getSourceBands());
		computation.execute();
		var raster = computation.getResult().getRaster();
		assertEquals(3, raster.getNumberOfBands());
		assertEquals((0.5 - 0.8) / (0.5 + 0.8), raster.getFloatValue(0, 0, 0), 1e-6);
		assertEquals(0.6, raster.getFloatValue(0, 0, 1), 1e-6);
		assertEquals((0.5 - 0.2) / (0.5 + 0.2), raster.getFloatValue(0, 0, 2), 1e-6);
	}
	
	@Test
	public void test_ndxiFromImaging() {
		var imaging = RasterImaging.fromDomains(SpectralDomain.SHORT_WAVELENGTH_INFRARED, SpectralDomain.GREEN, 
				SpectralDomain.RED, SpectralDomain.NEAR_INFRARED);
		var source = SpectralGeometries.createPixel(imaging, 0.5, 0, 0.2, 0.8);
		var computation = SpectralIndex.NDXI.createComputation(source, null);
		assertArrayEquals(new int[] {2, 3, 0}, computation.getSourceBands());
		computation.execute();
		assertEquals(computePixel(SpectralIndex.NDSI, source, 0), computation.getResult().getRaster().getFloatValue(0, 0, 0));
		assertEquals(computePixel(SpectralIndex.NDVI, source, 0), computation.getResult().getRaster().getFloatValue(0, 0, 1));
		assertEquals(computePixel(SpectralIndex.NDWI, source, 0), computation.getResult().getRaster().getFloatValue(0, 0, 2));
	}
	
	@Test
	public void test_explicitBands() {
		// Explicit indices take precedence over the imaging metadata
		var source = createRedNir(0.2, 0.8);
		var computation = SpectralIndex.NDVI.createComputation(source, ParameterBindings.create()
				.put(SpectralOperationParameters.INDEX_OF_RED_BAND, 1)
				.put(SpectralOperationParameters.INDEX_OF_NEAR_INFRARED_BAND, 0));
		computation.execute();
		assertEquals(-0.6, computation.getResult().getRaster().getFloatValue(0, 0, 0), 1e-6);
		
		// Or make up for its absence
		var noImaging = SpectralGeometries.createPixel(null, 0.8, 0.2);
		computation = SpectralIndex.NDVI.createComputation(noImaging, ParameterBindings.create()
				.put(SpectralOperationParameters.INDEX_OF_RED_BAND, 1)
				.put(SpectralOperationParameters.INDEX_OF_NEAR_INFRARED_BAND, 0));
		computation.execute();
		assertEquals(0.6, computation.getResult().getRaster().getFloatValue(0, 0, 0), 1e-6);
	}
	
	@Test
	public void test_wavelengthLookup() {
		// The first band containing the wavelength is used, limits included
		var imaging = RasterImaging.fromRanges(new SpectralRange(600, 705), new SpectralRange(705, 800));
		var source = SpectralGeometries.createPixel(imaging, 0.3, 0.7);
		var computation = SpectralIndex.NDVI705.createComputation(source, null);
		assertArrayEquals(new int[] {0, 1}, computation.getSourceBands());
		computation.execute();
		assertEquals(0.4, computation.getResult().getRaster().getFloatValue(0, 0, 0), 1e-6);
	}
	
	@Test
	public void test_unresolvedBands() {
		var noImaging = SpectralGeometries.createPixel(null, 0.2, 0.8);
		var e = assertThrows(OperationArgumentException.class, () -> SpectralIndex.NDVI.createComputation(noImaging, null));
		assertEquals(Reason.INVALID_SOURCE_DATA, e.getReason());
		
		var noNir = SpectralGeometries.createPixel(RasterImaging.fromDomains(SpectralDomain.RED, SpectralDomain.GREEN), 0.2, 0.8);
		e = assertThrows(OperationArgumentException.class, () -> SpectralIndex.NDVI.createComputation(noNir, null));
		assertEquals(Reason.INVALID_SOURCE_DATA, e.getReason());
		assertEquals(SpectralOperationParameters.INDEX_OF_NEAR_INFRARED_BAND, e.getParameter());
		
		var twoBands = createRedNir(0.2, 0.8);
		e = assertThrows(OperationArgumentException.class, () -> SpectralIndex.NDVI.createComputation(twoBands, 
				ParameterBindings.create().put(SpectralOperationParameters.INDEX_OF_RED_BAND, 2)));
		assertEquals(Reason.OUT_OF_RANGE_BAND_INDEX, e.getReason());
	}
	
	@Test
	public void test_inPlaceNotSupported() {
		var source = createRedNir(0.2, 0.8);
		var e = assertThrows(OperationArgumentException.class, () -> SpectralIndex.NDVI.createComputation(source, source, null));
		assertEquals(Reason.IN_PLACE_NOT_SUPPORTED, e.getReason());
	}
	
	@Test
	public void test_integerSource() {
		var source = SpectralGeometries.createInteger(2, 1, 1, 8, (r, c, b) -> b == 0 ? 50 : 200, 
				RasterImaging.fromDomains(SpectralDomain.RED, SpectralDomain.NEAR_INFRARED));
		assertEquals(0.6, computePixel(SpectralIndex.NDVI, source, 0), 1e-6);
	}

}
