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
 * Imaging metadata of a single band: a name, the spectral domain and, where known, the wavelength range.
 */
public final class RasterImagingBand {
	
	private final String name;
	private final SpectralDomain domain;
	private final SpectralRange range;
	
	private RasterImagingBand(String name, SpectralDomain domain, SpectralRange range) {
		this.name = name;
		this.domain = domain == null ? SpectralDomain.UNDEFINED : domain;
		this.range = range;
	}
	
	/**
	 * Create band metadata.
	 * @param name band name; if null, the domain name is used
	 * @param domain spectral domain; null is treated as {@link SpectralDomain#UNDEFINED}
	 * @param range wavelength range, may be null
	 * @return
	 */
	public static RasterImagingBand create(String name, SpectralDomain domain, SpectralRange range) {
		return new RasterImagingBand(name == null && domain != null ? domain.toString() : name, domain, range);
	}
	
	/**
	 * Create band metadata from a domain, using its nominal range.
	 * @param domain
	 * @return
	 */
	public static RasterImagingBand create(SpectralDomain domain) {
		return create(domain.toString(), domain, domain.getNominalRange());
	}
	
	/**
	 * Create band metadata from a wavelength range, with an undefined domain.
	 * @param minWavelength
	 * @param maxWavelength
	 * @return
	 */
	public static RasterImagingBand create(double minWavelength, double maxWavelength) {
		var range = new SpectralRange(minWavelength, maxWavelength);
		return create(range.toString(), SpectralDomain.UNDEFINED, range);
	}
	
	public String getName() {
		return name;
	}
	
	public SpectralDomain getSpectralDomain() {
		return domain;
	}
	
	/**
	 * Get the wavelength range.
	 * @return the range, or null if not known
	 */
	public SpectralRange getSpectralRange() {
		return range;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, domain, range);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof RasterImagingBand))
			return false;
		var other = (RasterImagingBand) obj;
		return Objects.equals(name, other.name) && domain == other.domain && Objects.equals(range, other.range);
	}

	@Override
	public String toString() {
		return "RasterImagingBand [" + name + ", " + domain + ", " + range + "]";
	}

}
