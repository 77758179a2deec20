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

/**
 * Named regions of the electromagnetic spectrum that a raster band may record.
 * <p>
 * Nominal wavelength limits are in nanometres.
 */
public enum SpectralDomain {
	
	/**
	 * Domain not known.
	 */
	UNDEFINED("Undefined", Double.NaN, Double.NaN),
	/**
	 * Ultraviolet
	 */
	ULTRAVIOLET("Ultraviolet", 10, 400),
	/**
	 * Visible light as a whole
	 */
	VISIBLE("Visible", 400, 700),
	/**
	 * Violet
	 */
	VIOLET("Violet", 400, 450),
	/**
	 * Blue
	 */
	BLUE("Blue", 450, 495),
	/**
	 * Green
	 */
	GREEN("Green", 495, 570),
	/**
	 * Yellow
	 */
	YELLOW("Yellow", 570, 590),
	/**
	 * Orange
	 */
	ORANGE("Orange", 590, 620),
	/**
	 * Red
	 */
	RED("Red", 620, 700),
	/**
	 * Infrared as a whole
	 */
	INFRARED("Infrared", 700, 1_000_000),
	/**
	 * Near infrared (NIR)
	 */
	NEAR_INFRARED("Near infrared", 700, 1400),
	/**
	 * Short-wavelength infrared (SWIR)
	 */
	SHORT_WAVELENGTH_INFRARED("Short-wavelength infrared", 1400, 3000),
	/**
	 * Mid-wavelength infrared (MWIR)
	 */
	MIDDLE_WAVELENGTH_INFRARED("Mid-wavelength infrared", 3000, 8000),
	/**
	 * Long-wavelength infrared (LWIR), also called thermal infrared
	 */
	LONG_WAVELENGTH_INFRARED("Long-wavelength infrared", 8000, 15000),
	/**
	 * Far infrared (FIR)
	 */
	FAR_INFRARED("Far infrared", 15000, 1_000_000);
	
	private final String name;
	private final double minWavelength, maxWavelength;
	
	private SpectralDomain(String name, double minWavelength, double maxWavelength) {
		this.name = name;
		this.minWavelength = minWavelength;
		this.maxWavelength = maxWavelength;
	}
	
	/**
	 * Nominal lower limit in nanometres, or NaN for {@link #UNDEFINED}.
	 * @return
	 */
	public double getMinWavelength() {
		return minWavelength;
	}
	
	/**
	 * Nominal upper limit in nanometres, or NaN for {@link #UNDEFINED}.
	 * @return
	 */
	public double getMaxWavelength() {
		return maxWavelength;
	}
	
	/**
	 * Get the nominal wavelength range of the domain.
	 * @return the range, or null for {@link #UNDEFINED}
	 */
	public SpectralRange getNominalRange() {
		if (this == UNDEFINED)
			return null;
		return new SpectralRange(minWavelength, maxWavelength);
	}
	
	/**
	 * Find a domain by enum name or display name, ignoring case, spaces, dashes and underscores.
	 * @param text
	 * @return the domain, or null if none matches
	 */
	public static SpectralDomain fromString(String text) {
		if (text == null)
			return null;
		String key = normalize(text);
		for (var domain : values()) {
			if (normalize(domain.name()).equals(key) || normalize(domain.name).equals(key))
				return domain;
		}
		return null;
	}
	
	private static String normalize(String text) {
		return text.replaceAll("[\\s_\\-]", "").toLowerCase();
	}
	
	@Override
	public String toString() {
		return name;
	}

}
