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
 * Storage representations of raster values.
 * <p>
 * The two representations expose different precision and rounding semantics, 
 * see {@link Raster#getValue(int, int, int)} and {@link Raster#getFloatValue(int, int, int)}.
 */
public enum RasterFormat {
	
	/**
	 * Unsigned quantized integer values, between 1 and 31 bits per band.
	 */
	INTEGER(1, 31, 8),
	/**
	 * Floating point values, either 32 or 64 bits per band.
	 */
	FLOATING(32, 64, 32);
	
	private int minResolution, maxResolution, defaultResolution;
	
	private RasterFormat(int minResolution, int maxResolution, int defaultResolution) {
		this.minResolution = minResolution;
		this.maxResolution = maxResolution;
		this.defaultResolution = defaultResolution;
	}
	
	/**
	 * Returns true if the radiometric resolution (bits per band) can be represented by this format.
	 * @param bits
	 * @return
	 */
	public boolean isValidResolution(int bits) {
		if (this == FLOATING)
			return bits == 32 || bits == 64;
		return bits >= minResolution && bits <= maxResolution;
	}
	
	/**
	 * Get the resolution used when none is specified.
	 * @return
	 */
	public int getDefaultResolution() {
		return defaultResolution;
	}
	
	/**
	 * Smallest supported radiometric resolution.
	 * @return
	 */
	public int getMinResolution() {
		return minResolution;
	}
	
	/**
	 * Largest supported radiometric resolution.
	 * @return
	 */
	public int getMaxResolution() {
		return maxResolution;
	}

}
