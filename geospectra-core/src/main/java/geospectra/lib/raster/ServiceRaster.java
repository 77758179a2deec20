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
 * Read-only raster whose values are computed on each access by a {@link RasterService}.
 * <p>
 * Nothing is cached, so repeated access recomputes the value.
 */
public class ServiceRaster extends AbstractRaster {
	
	private final RasterService service;

	/**
	 * Create a raster backed by a service.
	 * @param service
	 * @param format
	 * @param nBands
	 * @param nRows
	 * @param nCols
	 * @param bits
	 */
	public ServiceRaster(RasterService service, RasterFormat format, int nBands, int nRows, int nCols, int bits) {
		super(format, nBands, nRows, nCols, bits);
		this.service = Objects.requireNonNull(service, "Raster service must not be null");
	}
	
	/**
	 * Get the service computing the values.
	 * @return
	 */
	public RasterService getService() {
		return service;
	}

	@Override
	public boolean isWritable() {
		return false;
	}

	@Override
	public int getValue(int row, int col, int band) {
		offset(row, col, band);
		return service.readValue(row, col, band);
	}

	@Override
	public double getFloatValue(int row, int col, int band) {
		offset(row, col, band);
		return service.readFloatValue(row, col, band);
	}
	
	@Override
	public double[] getFloatValues(int row, int col) {
		checkLocation(row, col);
		return service.readFloatValues(row, col, getNumberOfBands());
	}

	@Override
	public void setValue(int row, int col, int band, int value) {
		checkWritable();
	}

	@Override
	public void setFloatValue(int row, int col, int band, double value) {
		checkWritable();
	}

}
