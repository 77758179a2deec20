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

import java.util.Objects;

/**
 * Abstract {@link Raster} handling dimensions and coordinate checks.
 * <p>
 * Subclasses need only implement single-band access; multi-band access loops over bands.
 */
public abstract class AbstractRaster implements Raster {
	
	// some virtual machines reserve header words in arrays
	private static final int MAX_STORAGE_SIZE = Integer.MAX_VALUE - 8;
	
	private final RasterFormat format;
	private final int nBands, nRows, nCols, bits;
	
	protected AbstractRaster(RasterFormat format, int nBands, int nRows, int nCols, int bits) {
		Objects.requireNonNull(format, "Raster format must not be null");
		if (nBands < 1)
			throw new IllegalArgumentException("Number of bands must be at least 1, but was " + nBands);
		if (nRows < 1 || nCols < 1)
			throw new IllegalArgumentException("Raster size must be at least 1x1, but was " + nRows + "x" + nCols);
		if (!format.isValidResolution(bits))
			throw new IllegalArgumentException("Radiometric resolution " + bits + " is not supported by " + format);
		this.format = format;
		this.nBands = nBands;
		this.nRows = nRows;
		this.nCols = nCols;
		this.bits = bits;
	}

	@Override
	public int getNumberOfBands() {
		return nBands;
	}

	@Override
	public int getNumberOfRows() {
		return nRows;
	}

	@Override
	public int getNumberOfColumns() {
		return nCols;
	}

	@Override
	public int getRadiometricResolution() {
		return bits;
	}

	@Override
	public RasterFormat getFormat() {
		return format;
	}
	
	@Override
	public boolean isReadable() {
		return true;
	}
	
	@Override
	public int[] getValues(int row, int col) {
		checkLocation(row, col);
		int[] values = new int[nBands];
		for (int b = 0; b < nBands; b++)
			values[b] = getValue(row, col, b);
		return values;
	}
	
	@Override
	public double[] getFloatValues(int row, int col) {
		checkLocation(row, col);
		double[] values = new double[nBands];
		for (int b = 0; b < nBands; b++)
			values[b] = getFloatValue(row, col, b);
		return values;
	}
	
	@Override
	public void setValues(int row, int col, int[] values) {
		checkValues(values == null ? -1 : values.length);
		for (int b = 0; b < nBands; b++)
			setValue(row, col, b, values[b]);
	}
	
	@Override
	public void setFloatValues(int row, int col, double[] values) {
		checkValues(values == null ? -1 : values.length);
		for (int b = 0; b < nBands; b++)
			setFloatValue(row, col, b, values[b]);
	}
	
	/**
	 * Get the offset of a value in band-sequential storage.
	 * @param row
	 * @param col
	 * @param band
	 * @return
	 */
	protected int offset(int row, int col, int band) {
		checkLocation(row, col);
		if (band < 0 || band >= nBands)
			throw new IndexOutOfBoundsException("Band index " + band + " is out of range [0, " + nBands + ")");
		return (int)(((long)band * nRows + row) * nCols + col);
	}
	
	/**
	 * Get the number of values stored by a raster held in a single array.
	 * @param nBands
	 * @param nRows
	 * @param nCols
	 * @return
	 * @throws IllegalArgumentException if the values do not fit in a Java array
	 */
	protected static int storageSize(int nBands, int nRows, int nCols) throws IllegalArgumentException {
		long size;
		try {
			size = Math.multiplyExact(Math.multiplyExact((long)nBands, (long)nRows), (long)nCols);
		} catch (ArithmeticException e) {
			throw new IllegalArgumentException("Raster of " + nBands + " bands of " + nRows + "x" + nCols + " values is too large", e);
		}
		if (size > MAX_STORAGE_SIZE)
			throw new IllegalArgumentException("Raster of " + nBands + " bands of " + nRows + "x" + nCols + 
					" values is too large to be stored in memory (" + size + " values, at most " + MAX_STORAGE_SIZE + ")");
		return (int)size;
	}
	
	protected void checkLocation(int row, int col) {
		if (row < 0 || row >= nRows)
			throw new IndexOutOfBoundsException("Row index " + row + " is out of range [0, " + nRows + ")");
		if (col < 0 || col >= nCols)
			throw new IndexOutOfBoundsException("Column index " + col + " is out of range [0, " + nCols + ")");
	}
	
	protected void checkWritable() {
		if (!isWritable())
			throw new UnsupportedOperationException("Raster is not writable");
	}
	
	private void checkValues(int length) {
		if (length != nBands)
			throw new IllegalArgumentException("Expected " + nBands + " band values, but got " + (length < 0 ? "null" : length));
	}
	
	@Override
	public String toString() {
		return getClass().getSimpleName() + " [" + format + ", " + nBands + " bands, " 
				+ nRows + "x" + nCols + ", " + bits + " bits]";
	}

}
