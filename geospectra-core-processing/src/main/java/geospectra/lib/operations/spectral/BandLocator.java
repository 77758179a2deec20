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

import java.util.Objects;
import java.util.OptionalInt;

import geospectra.lib.imaging.RasterImaging;
import geospectra.lib.imaging.SpectralDomain;

/**
 * Finds a band in imaging metadata, either by spectral domain or by a wavelength 
 * that the band's spectral range must contain.
 */
public final class BandLocator {
	
	private final SpectralDomain domain;
	private final double wavelength;
	
	private BandLocator(SpectralDomain domain, double wavelength) {
		this.domain = domain;
		this.wavelength = wavelength;
	}
	
	/**
	 * Locate the first band recording a spectral domain.
	 * @param domain
	 * @return
	 */
	public static BandLocator domain(SpectralDomain domain) {
		return new BandLocator(Objects.requireNonNull(domain, "Spectral domain must not be null"), Double.NaN);
	}
	
	/**
	 * Locate the first band whose spectral range contains a wavelength, limits included.
	 * @param wavelength in nanometres
	 * @return
	 */
	public static BandLocator wavelength(double wavelength) {
		if (!(wavelength > 0) || Double.isInfinite(wavelength))
			throw new IllegalArgumentException("Wavelength must be a positive number, but was " + wavelength);
		return new BandLocator(null, wavelength);
	}
	
	/**
	 * Find the band in imaging metadata.
	 * @param imaging the imaging metadata, may be null
	 * @return the band index, or an empty optional if there is no metadata or no band matches
	 */
	public OptionalInt locate(RasterImaging imaging) {
		if (imaging == null)
			return OptionalInt.empty();
		int index = domain != null ? imaging.indexOf(domain) : imaging.indexOfWavelength(wavelength);
		return index < 0 ? OptionalInt.empty() : OptionalInt.of(index);
	}
	
	@Override
	public String toString() {
		if (domain != null)
			return "band of " + domain;
		return "band containing " + wavelength + " nm";
	}

}
