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

package geospectra.lib.imaging;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestRasterImaging {
	
	@Test
	public void test_spectralDomainFromString() {
		assertEquals(SpectralDomain.NEAR_INFRARED, SpectralDomain.fromString("NEAR_INFRARED"));
		assertEquals(SpectralDomain.NEAR_INFRARED, SpectralDomain.fromString("near infrared"));
		assertEquals(SpectralDomain.NEAR_INFRARED, SpectralDomain.fromString("NearInfrared"));
		assertEquals(SpectralDomain.SHORT_WAVELENGTH_INFRARED, SpectralDomain.fromString("Short-wavelength infrared"));
		assertNull(SpectralDomain.fromString("ultraviolent"));
		assertNull(SpectralDomain.fromString(null));
		assertNull(SpectralDomain.UNDEFINED.getNominalRange());
		assertEquals(new SpectralRange(620, 700), SpectralDomain.RED.getNominalRange());
	}
	
	@Test
	public void test_spectralRange() {
		var range = new SpectralRange(500, 600);
		assertTrue(range.contains(500));
		assertTrue(range.contains(600));
		assertFalse(range.contains(600.1));
		assertTrue(range.overlaps(590, 700));
		assertFalse(range.overlaps(601, 700));
		assertEquals(new SpectralRange(545, 555), SpectralRange.centredOn(550, 10));
		assertThrows(IllegalArgumentException.class, () -> new SpectralRange(600, 500));
		assertThrows(IllegalArgumentException.class, () -> new SpectralRange(Double.NaN, 500));
	}
	
	@Test
	public void test_lookupByDomain() {
		var imaging = RasterImaging.fromDomains(SpectralDomain.BLUE, SpectralDomain.GREEN, SpectralDomain.RED, SpectralDomain.NEAR_INFRARED);
		assertEquals(4, imaging.getNumberOfBands());
		assertEquals(2, imaging.indexOf(SpectralDomain.RED));
		assertEquals(3, imaging.indexOf(SpectralDomain.NEAR_INFRARED));
		assertEquals(-1, imaging.indexOf(SpectralDomain.SHORT_WAVELENGTH_INFRARED));
		assertEquals(1, imaging.indexOfName("green"));
		assertEquals(-1, imaging.indexOfName("yellow"));
		assertEquals(List.of(SpectralDomain.BLUE, SpectralDomain.GREEN, SpectralDomain.RED, SpectralDomain.NEAR_INFRARED), 
				imaging.getSpectralDomains());
	}
	
	@Test
	public void test_lookupByWavelength() {
		var imaging = RasterImaging.fromRanges(
				new SpectralRange(500, 550), 
				new SpectralRange(550, 600),
				new SpectralRange(600, 700));
		// Limits are inclusive and the first match wins
		assertEquals(0, imaging.indexOfWavelength(550));
		assertEquals(1, imaging.indexOfWavelength(570));
		assertEquals(2, imaging.indexOfWavelength(700));
		assertEquals(-1, imaging.indexOfWavelength(450));
		assertArrayEquals(new int[] {0, 1}, imaging.indicesBetween(500, 599));
		assertArrayEquals(new int[0], imaging.indicesBetween(800, 900));
	}
	
	@Test
	public void test_filter() {
		var imaging = RasterImaging.create("sensor", List.of(
				RasterImagingBand.create(SpectralDomain.RED),
				RasterImagingBand.create(SpectralDomain.GREEN),
				RasterImagingBand.create(SpectralDomain.BLUE)));
		var filtered = imaging.filter(2, 0);
		assertEquals("sensor", filtered.getDevice());
		assertEquals(List.of(SpectralDomain.BLUE, SpectralDomain.RED), filtered.getSpectralDomains());
		assertThrows(IndexOutOfBoundsException.class, () -> imaging.filter(3));
	}
	
	@Test
	public void test_invalidImaging() {
		assertThrows(IllegalArgumentException.class, () -> RasterImaging.create(null, Collections.emptyList()));
		assertThrows(IllegalArgumentException.class, () -> RasterImaging.create(null, null));
	}
	
	@Test
	public void test_band() {
		var band = RasterImagingBand.create(null, null, null);
		assertEquals(SpectralDomain.UNDEFINED, band.getSpectralDomain());
		assertNull(band.getSpectralRange());
		
		var red = RasterImagingBand.create(SpectralDomain.RED);
		assertEquals("Red", red.getName());
		assertEquals(SpectralDomain.RED.getNominalRange(), red.getSpectralRange());
	}

}
