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

import org.junit.jupiter.api.Test;

import geospectra.lib.geometry.SpectralGeometry;
import geospectra.lib.operations.spectral.SpectralGeometries;

@SuppressWarnings("javadoc")
public class TestVogelmannRedEdgeIndices {
	
	private static SpectralGeometry createSource() {
		// bands at 715, 720, 726, 734, 740, 747 nm
		return SpectralGeometries.createFloat(6, 3, 3, (r, c, b) -> 0.1 + 0.05 * b + 0.01 * r * c, 
				SpectralGeometries.narrowBands(747, 740, 734, 726, 720, 715));
	}
	
	@Test
	public void test_sourceBands() {
		var computation = SpectralIndex.VOGX.createComputation(createSource(), null);
		assertArrayEquals(new int[] {5, 4, 3, 2, 1, 0}, computation.getSourceBands());
		assertArrayEquals(new int[] {4, 1}, SpectralIndex.VOG1.createComputation(createSource(), null).getSourceBands());
	}
	
	@Test
	public void test_vog1() {
		var computation = SpectralIndex.VOG1.createComputation(createSource(), null);
		computation.execute();
		double r720 = 0.1 + 0.05 * 4 + 0.01 * 4;
		double r740 = 0.1 + 0.05 * 1 + 0.01 * 4;
		assertEquals(r740 / r720, computation.getResult().getRaster().getFloatValue(2, 2, 0), 1e-6);
	}
	
	@Test
	public void test_compositeMatchesSingleIndices() {
		var source = createSource();
		var composite = SpectralIndex.VOGX.createComputation(source, null);
		composite.execute();
		var singles = new SpectralIndex[] {SpectralIndex.VOG1, SpectralIndex.VOG2, SpectralIndex.VOG3};
		for (int b = 0; b < singles.length; b++) {
			var single = singles[b].createComputation(source, null);
			single.execute();
			for (int r = 0; r < 3; r++) {
				for (int c = 0; c < 3; c++)
					assertEquals(single.getResult().getRaster().getFloatValue(r, c, 0), composite.getResult().getRaster().getFloatValue(r, c, b));
			}
		}
	}

}
