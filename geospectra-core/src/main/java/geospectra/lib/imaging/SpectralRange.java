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

package geospectra.lib.imaging;

import java.util.Objects;

/**
 * Closed wavelength interval, in nanometres, recorded by a single band.
 */
public final class SpectralRange {
	
	private final double minWavelength;
	private final double maxWavelength;

	/**
	 * Create a spectral range.
	 * @param minWavelength lower limit in nanometres
	 * @param maxWavelength upper limit in nanometres, not smaller than the lower limit
	 */
	public SpectralRange(double minWavelength, double maxWavelength) {
		if (!Double.isFinite(minWavelength) || !Double.isFinite(maxWavelength) || minWavelength < 0)
			throw new IllegalArgumentException("Invalid spectral range [" + minWavelength + ", " + maxWavelength + "]");
		if (maxWavelength < minWavelength)
			throw new IllegalArgumentException("Maximum wavelength " + maxWavelength + " is smaller than minimum " + minWavelength);
		this.minWavelength = minWavelength;
		this.maxWavelength = maxWavelength;
	}
	
	/**
	 * Create a range centred on a wavelength.
	 * @param centre in nanometres
	 * @param width full width in nanometres
	 * @return
	 */
	public static SpectralRange centredOn(double centre, double width) {
		return new SpectralRange(centre - width / 2.0, centre + width / 2.0);
	}
	
	public double getMinWavelength() {
		return minWavelength;
	}
	
	public double getMaxWavelength() {
		return maxWavelength;
	}
	
	/**
	 * Returns true if the wavelength lies in the range, limits included.
	 * @param wavelength in nanometres
	 * @return
	 */
	public boolean contains(double wavelength) {
		return minWavelength <= wavelength && maxWavelength >= wavelength;
	}
	
	/**
	 * Returns true if this range shares at least one wavelength with {@code [min, max]}.
	 * @param min
	 * @param max
	 * @return
	 */
	public boolean overlaps(double min, double max) {
		return minWavelength <= max && maxWavelength >= min;
	}

	@Override
	public int hashCode() {
		return Objects.hash(minWavelength, maxWavelength);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof SpectralRange))
			return false;
		var other = (SpectralRange) obj;
		return Double.compare(minWavelength, other.minWavelength) == 0
				&& Double.compare(maxWavelength, other.maxWavelength) == 0;
	}
	
	@Override
	public String toString() {
		return "[" + minWavelength + " nm, " + maxWavelength + " nm]";
	}

}
