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
 * Allocates writable rasters.
 */
public interface RasterFactory {
	
	/**
	 * Create a new raster filled with zeros.
	 * 
	 * @param format storage representation
	 * @param nBands number of bands
	 * @param nRows number of rows
	 * @param nCols number of columns
	 * @param bits radiometric resolution, which must be valid for the format
	 * @return
	 * @throws IllegalArgumentException if the dimensions or resolution are invalid
	 */
	Raster createRaster(RasterFormat format, int nBands, int nRows, int nCols, int bits);
	
	/**
	 * Create a raster with the same format, dimensions and resolution as an existing raster.
	 * @param raster
	 * @return
	 */
	default Raster createRaster(Raster raster) {
		return createRaster(raster.getFormat(), raster.getNumberOfBands(), 
				raster.getNumberOfRows(), raster.getNumberOfColumns(), raster.getRadiometricResolution());
	}

}
