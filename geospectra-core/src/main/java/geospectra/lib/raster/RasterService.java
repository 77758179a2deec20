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

package geospectra.lib.raster;

/**
 * Supplies raster values on demand, e.g. by evaluating a formula over another raster.
 * 
 * @see ServiceRaster
 */
public interface RasterService {
	
	/**
	 * Compute the integer value of a single band.
	 * @param row
	 * @param col
	 * @param band
	 * @return
	 */
	int readValue(int row, int col, int band);
	
	/**
	 * Compute the floating point value of a single band.
	 * @param row
	 * @param col
	 * @param band
	 * @return
	 */
	double readFloatValue(int row, int col, int band);
	
	/**
	 * Compute the floating point values of all bands at a location.
	 * <p>
	 * The default implementation calls {@link #readFloatValue(int, int, int)} once per band.
	 * 
	 * @param row
	 * @param col
	 * @param nBands
	 * @return
	 */
	default double[] readFloatValues(int row, int col, int nBands) {
		double[] values = new double[nBands];
		for (int b = 0; b < nBands; b++)
			values[b] = readFloatValue(row, col, b);
		return values;
	}

}
