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
 * Factory backed by in-memory {@link IntegerRaster} and {@link FloatRaster} instances.
 */
public class DefaultRasterFactory implements RasterFactory {
	
	private static final DefaultRasterFactory INSTANCE = new DefaultRasterFactory();
	
	/**
	 * Get the shared factory instance.
	 * @return
	 */
	public static DefaultRasterFactory getInstance() {
		return INSTANCE;
	}

	@Override
	public Raster createRaster(RasterFormat format, int nBands, int nRows, int nCols, int bits) {
		switch (format) {
		case INTEGER:
			return new IntegerRaster(nBands, nRows, nCols, bits);
		case FLOATING:
			return new FloatRaster(nBands, nRows, nCols, bits);
		default:
			throw new IllegalArgumentException("Unsupported raster format " + format);
		}
	}

}
