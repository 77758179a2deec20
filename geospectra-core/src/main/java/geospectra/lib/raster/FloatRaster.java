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
 * Writable raster storing floating point values.
 * <p>
 * With a radiometric resolution of 32 bits, values are stored at single precision.
 */
public class FloatRaster extends AbstractRaster {
	
	private final double[] data;
	private final boolean singlePrecision;

	/**
	 * Create a raster filled with zeros.
	 * @param nBands
	 * @param nRows
	 * @param nCols
	 * @param bits either 32 or 64
	 * @throws IllegalArgumentException if the raster is too large to be held in memory
	 */
	public FloatRaster(int nBands, int nRows, int nCols, int bits) {
		super(RasterFormat.FLOATING, nBands, nRows, nCols, bits);
		this.data = new double[storageSize(nBands, nRows, nCols)];
		this.singlePrecision = bits == 32;
	}

	@Override
	public boolean isWritable() {
		return true;
	}

	@Override
	public int getValue(int row, int col, int band) {
		return toInt(data[offset(row, col, band)]);
	}

	@Override
	public double getFloatValue(int row, int col, int band) {
		return data[offset(row, col, band)];
	}

	@Override
	public void setValue(int row, int col, int band, int value) {
		data[offset(row, col, band)] = value;
	}

	@Override
	public void setFloatValue(int row, int col, int band, double value) {
		data[offset(row, col, band)] = singlePrecision ? (float)value : value;
	}
	
	/**
	 * Convert a floating point value to the integer value reported by {@link #getValue(int, int, int)}: 
	 * rounded, with NaN and negative values read as 0.
	 * @param value
	 * @return
	 */
	public static int toInt(double value) {
		if (Double.isNaN(value) || value <= 0)
			return 0;
		long rounded = Math.round(value);
		return rounded > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int)rounded;
	}

}
