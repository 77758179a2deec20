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

/**
 * The extent of source values a spectral operation reads to compute one result value.
 */
public enum SpectralOperationDomain {
	
	/**
	 * All bands at the same location.
	 */
	LOCAL(false),
	/**
	 * The same band at the same location.
	 */
	BAND_LOCAL(true),
	/**
	 * All bands in a neighbourhood of the location.
	 */
	FOCAL(false),
	/**
	 * The same band in a neighbourhood of the location.
	 */
	BAND_FOCAL(true),
	/**
	 * All bands in a zone containing the location.
	 */
	ZONAL(false),
	/**
	 * The same band in a zone containing the location.
	 */
	BAND_ZONAL(true),
	/**
	 * All values of the raster.
	 */
	GLOBAL(false),
	/**
	 * All values of the same band.
	 */
	BAND_GLOBAL(true);
	
	private final boolean bandWise;
	
	private SpectralOperationDomain(boolean bandWise) {
		this.bandWise = bandWise;
	}
	
	/**
	 * Returns true if each result band depends on a single source band, 
	 * so that values can be computed band by band.
	 * @return
	 */
	public boolean isBandWise() {
		return bandWise;
	}

}
