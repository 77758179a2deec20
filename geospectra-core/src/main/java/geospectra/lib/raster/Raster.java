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
 * A two-dimensional grid of values with a fixed number of spectral bands.
 * <p>
 * Coordinates are zero-based and given as (row, column, band). 
 * Every accessor throws an {@link IndexOutOfBoundsException} for coordinates outside the raster.
 */
public interface Raster {
	
	/**
	 * Number of spectral bands.
	 * @return
	 */
	int getNumberOfBands();
	
	/**
	 * Number of rows.
	 * @return
	 */
	int getNumberOfRows();
	
	/**
	 * Number of columns.
	 * @return
	 */
	int getNumberOfColumns();
	
	/**
	 * Number of bits used to store a value of a single band.
	 * @return
	 */
	int getRadiometricResolution();
	
	/**
	 * Storage representation of the values.
	 * @return
	 */
	RasterFormat getFormat();
	
	/**
	 * Returns true if values can be read.
	 * @return
	 */
	boolean isReadable();
	
	/**
	 * Returns true if values can be written.
	 * @return
	 */
	boolean isWritable();
	
	/**
	 * Get the integer value of a single band.
	 * <p>
	 * For {@link RasterFormat#FLOATING} rasters the value is rounded and clamped to the non-negative int range.
	 * 
	 * @param row
	 * @param col
	 * @param band
	 * @return
	 */
	int getValue(int row, int col, int band);
	
	/**
	 * Get the integer values of all bands at a location.
	 * @param row
	 * @param col
	 * @return
	 */
	int[] getValues(int row, int col);
	
	/**
	 * Get the floating point value of a single band.
	 * <p>
	 * For {@link RasterFormat#INTEGER} rasters this is the stored integer, without any scaling.
	 * 
	 * @param row
	 * @param col
	 * @param band
	 * @return
	 */
	double getFloatValue(int row, int col, int band);
	
	/**
	 * Get the floating point values of all bands at a location.
	 * @param row
	 * @param col
	 * @return
	 */
	double[] getFloatValues(int row, int col);
	
	/**
	 * Set the integer value of a single band.
	 * @param row
	 * @param col
	 * @param band
	 * @param value
	 * @throws UnsupportedOperationException if the raster is not writable
	 */
	void setValue(int row, int col, int band, int value);
	
	/**
	 * Set the integer values of all bands at a location.
	 * @param row
	 * @param col
	 * @param values one value per band
	 * @throws UnsupportedOperationException if the raster is not writable
	 */
	void setValues(int row, int col, int[] values);
	
	/**
	 * Set the floating point value of a single band.
	 * @param row
	 * @param col
	 * @param band
	 * @param value
	 * @throws UnsupportedOperationException if the raster is not writable
	 */
	void setFloatValue(int row, int col, int band, double value);
	
	/**
	 * Set the floating point values of all bands at a location.
	 * @param row
	 * @param col
	 * @param values one value per band
	 * @throws UnsupportedOperationException if the raster is not writable
	 */
	void setFloatValues(int row, int col, double[] values);

}
