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

package geospectra.lib.operations.spectral;

import java.util.ArrayList;

import geospectra.lib.geometry.SpectralGeometry;
import geospectra.lib.geometry.SpectralGeometryFactory;
import geospectra.lib.imaging.RasterImaging;
import geospectra.lib.imaging.RasterImagingBand;
import geospectra.lib.imaging.SpectralRange;
import geospectra.lib.presentation.RasterPresentation;
import geospectra.lib.raster.FloatRaster;
import geospectra.lib.raster.IntegerRaster;
import geospectra.lib.raster.Raster;

/**
 * Source geometries for spectral operation tests.
 */
public class SpectralGeometries {
	
	/**
	 * Create a floating point geometry whose value at (row, col, band) is given by a function.
	 * @param nBands
	 * @param nRows
	 * @param nCols
	 * @param values
	 * @param imaging may be null
	 * @return
	 */
	public static SpectralGeometry createFloat(int nBands, int nRows, int nCols, ValueFunction values, RasterImaging imaging) {
		var raster = new FloatRaster(nBands, nRows, nCols, 64);
		fill(raster, values);
		return SpectralGeometryFactory.getDefaultFactory().createSpectralPolygon(raster, RasterPresentation.createGrayscalePresentation(), imaging);
	}
	
	/**
	 * Create an integer geometry whose value at (row, col, band) is given by a function.
	 * @param nBands
	 * @param nRows
	 * @param nCols
	 * @param bits
	 * @param values
	 * @param imaging may be null
	 * @return
	 */
	public static SpectralGeometry createInteger(int nBands, int nRows, int nCols, int bits, ValueFunction values, RasterImaging imaging) {
		var raster = new IntegerRaster(nBands, nRows, nCols, bits);
		fill(raster, values);
		return SpectralGeometryFactory.getDefaultFactory().createSpectralPolygon(raster, RasterPresentation.createGrayscalePresentation(), imaging);
	}
	
	/**
	 * Create a single-pixel floating point geometry.
	 * @param imaging
	 * @param values one value per band
	 * @return
	 */
	public static SpectralGeometry createPixel(RasterImaging imaging, double... values) {
		return createFloat(values.length, 1, 1, (r, c, b) -> values[b], imaging);
	}
	
	/**
	 * Imaging metadata with one narrow band centred on each wavelength.
	 * @param wavelengths in nanometres
	 * @return
	 */
	public static RasterImaging narrowBands(double... wavelengths) {
		var bands = new ArrayList<RasterImagingBand>();
		for (double w : wavelengths)
			bands.add(RasterImagingBand.create(w + " nm", null, SpectralRange.centredOn(w, 2)));
		return RasterImaging.create("test", bands);
	}
	
	private static void fill(Raster raster, ValueFunction values) {
		for (int b = 0; b < raster.getNumberOfBands(); b++) {
			for (int r = 0; r < raster.getNumberOfRows(); r++) {
				for (int c = 0; c < raster.getNumberOfColumns(); c++)
					raster.setFloatValue(r, c, b, values.valueAt(r, c, b));
			}
		}
	}
	
	/**
	 * Value of a raster at a location.
	 */
	@FunctionalInterface
	public static interface ValueFunction {
		
		double valueAt(int row, int col, int band);
		
	}

}
