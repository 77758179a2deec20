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
 * Writable raster storing quantized unsigned integer values.
 * <p>
 * Values written outside {@code [0, 2^bits - 1]} are clamped.
 */
public class IntegerRaster extends AbstractRaster {
	
	private final int[] data;
	private final int maxValue;

	/**
	 * Create a raster filled with zeros.
	 * @param nBands
	 * @param nRows
	 * @param nCols
	 * @param bits radiometric resolution, between 1 and 31
	 * @throws IllegalArgumentException if the raster is too large to be held in memory
	 */
	public IntegerRaster(int nBands, int nRows, int nCols, int bits) {
		super(RasterFormat.INTEGER, nBands, nRows, nCols, bits);
		this.data = new int[storageSize(nBands, nRows, nCols)];
		this.maxValue = (1 << bits) - 1;
	}
	
	/**
	 * Largest value that can be stored.
	 * @return
	 */
	public int getMaxValue() {
		return maxValue;
	}

	@Override
	public boolean isWritable() {
		return true;
	}

	@Override
	public int getValue(int row, int col, int band) {
		return data[offset(row, col, band)];
	}

	@Override
	public double getFloatValue(int row, int col, int band) {
		return data[offset(row, col, band)];
	}

	@Override
	public void setValue(int row, int col, int band, int value) {
		data[offset(row, col, band)] = clamp(value);
	}

	@Override
	public void setFloatValue(int row, int col, int band, double value) {
		if (Double.isNaN(value))
			value = 0;
		data[offset(row, col, band)] = clamp(Math.round(value));
	}
	
	private int clamp(long value) {
		if (value < 0)
			return 0;
		return value > maxValue ? maxValue : (int)value;
	}

}
