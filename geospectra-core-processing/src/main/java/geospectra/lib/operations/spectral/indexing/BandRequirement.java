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

package geospectra.lib.operations.spectral.indexing;

import java.util.Objects;

import geospectra.lib.imaging.SpectralDomain;
import geospectra.lib.operations.parameters.OperationParameter;
import geospectra.lib.operations.spectral.BandLocator;

/**
 * A source band (or group of bands) read by a spectral index, with the parameter giving its index 
 * and the way to find it in imaging metadata when the parameter is not given.
 */
public final class BandRequirement {
	
	private final OperationParameter<Integer> parameter;
	private final BandLocator locator;
	private final Integer positionalDefault;
	
	private final OperationParameter<int[]> groupParameter;
	private final double minWavelength;
	private final double maxWavelength;
	
	private BandRequirement(OperationParameter<Integer> parameter, BandLocator locator, Integer positionalDefault,
			OperationParameter<int[]> groupParameter, double minWavelength, double maxWavelength) {
		this.parameter = parameter;
		this.locator = locator;
		this.positionalDefault = positionalDefault;
		this.groupParameter = groupParameter;
		this.minWavelength = minWavelength;
		this.maxWavelength = maxWavelength;
	}
	
	/**
	 * A band located by spectral domain.
	 */
	public static BandRequirement of(OperationParameter<Integer> parameter, SpectralDomain domain) {
		return new BandRequirement(Objects.requireNonNull(parameter), BandLocator.domain(domain), null, null, Double.NaN, Double.NaN);
	}
	
	/**
	 * A band located by spectral domain, or by position if it cannot be located.
	 */
	public static BandRequirement of(OperationParameter<Integer> parameter, SpectralDomain domain, int positionalDefault) {
		return new BandRequirement(Objects.requireNonNull(parameter), BandLocator.domain(domain), positionalDefault, null, Double.NaN, Double.NaN);
	}
	
	/**
	 * A band whose spectral range contains a wavelength.
	 * @param parameter
	 * @param wavelength in nanometres
	 * @return
	 */
	public static BandRequirement of(OperationParameter<Integer> parameter, double wavelength) {
		return new BandRequirement(Objects.requireNonNull(parameter), BandLocator.wavelength(wavelength), null, null, Double.NaN, Double.NaN);
	}
	
	/**
	 * All bands whose spectral ranges overlap a wavelength interval.
	 * @param parameter
	 * @param minWavelength in nanometres
	 * @param maxWavelength in nanometres
	 * @return
	 */
	public static BandRequirement between(OperationParameter<int[]> parameter, double minWavelength, double maxWavelength) {
		if (!(minWavelength <= maxWavelength))
			throw new IllegalArgumentException("Invalid wavelength interval [" + minWavelength + ", " + maxWavelength + "]");
		return new BandRequirement(null, null, null, Objects.requireNonNull(parameter), minWavelength, maxWavelength);
	}
	
	/**
	 * Returns true if the requirement covers a group of bands.
	 * @return
	 */
	public boolean isGroup() {
		return groupParameter != null;
	}
	
	public OperationParameter<Integer> getParameter() {
		return parameter;
	}
	
	public BandLocator getLocator() {
		return locator;
	}
	
	/**
	 * Band index used when the band is not given and cannot be located, or null.
	 * @return
	 */
	public Integer getPositionalDefault() {
		return positionalDefault;
	}
	
	public OperationParameter<int[]> getGroupParameter() {
		return groupParameter;
	}
	
	public double getMinWavelength() {
		return minWavelength;
	}
	
	public double getMaxWavelength() {
		return maxWavelength;
	}
	
	@Override
	public String toString() {
		if (isGroup())
			return groupParameter.getName() + " (" + minWavelength + "-" + maxWavelength + " nm)";
		return parameter.getName() + " (" + locator + (positionalDefault == null ? "" : ", else band " + positionalDefault) + ")";
	}

}
