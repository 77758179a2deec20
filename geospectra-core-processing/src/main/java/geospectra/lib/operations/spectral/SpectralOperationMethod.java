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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import geospectra.lib.operations.ExecutionMode;
import geospectra.lib.operations.OperationMethod;
import geospectra.lib.operations.parameters.OperationParameter;
import geospectra.lib.raster.RasterFormat;

/**
 * Method of an operation transforming the raster of a spectral geometry.
 */
public class SpectralOperationMethod extends OperationMethod {
	
	private final SpectralOperationDomain spectralDomain;
	private final Set<RasterFormat> supportedFormats;
	
	/**
	 * Create a method.
	 * @param identifier
	 * @param name
	 * @param remarks
	 * @param aliases
	 * @param version
	 * @param reversible
	 * @param spectralDomain source values read per result value
	 * @param supportedFormats source raster formats that can be transformed
	 * @param supportedModes
	 * @param parameters
	 */
	public SpectralOperationMethod(String identifier, String name, String remarks, String[] aliases, String version,
			boolean reversible, SpectralOperationDomain spectralDomain, Set<RasterFormat> supportedFormats,
			Set<ExecutionMode> supportedModes, OperationParameter<?>... parameters) {
		super(identifier, name, remarks, aliases, version, reversible, supportedModes, parameters);
		this.spectralDomain = Objects.requireNonNull(spectralDomain);
		if (supportedFormats == null || supportedFormats.isEmpty())
			throw new IllegalArgumentException("Method " + name + " must support at least one raster format");
		this.supportedFormats = Collections.unmodifiableSet(EnumSet.copyOf(supportedFormats));
	}
	
	/**
	 * Create a method supporting both raster formats and both execution modes.
	 * @param identifier
	 * @param name
	 * @param remarks
	 * @param reversible
	 * @param spectralDomain
	 * @param parameters
	 * @return
	 */
	public static SpectralOperationMethod createSpectralTransformation(String identifier, String name, String remarks,
			boolean reversible, SpectralOperationDomain spectralDomain, OperationParameter<?>... parameters) {
		return createSpectralTransformation(identifier, name, remarks, reversible, spectralDomain, 
				EnumSet.allOf(ExecutionMode.class), parameters);
	}
	
	/**
	 * Create a method supporting both raster formats.
	 * @param identifier
	 * @param name
	 * @param remarks
	 * @param reversible
	 * @param spectralDomain
	 * @param supportedModes
	 * @param parameters
	 * @return
	 */
	public static SpectralOperationMethod createSpectralTransformation(String identifier, String name, String remarks,
			boolean reversible, SpectralOperationDomain spectralDomain, Set<ExecutionMode> supportedModes, 
			OperationParameter<?>... parameters) {
		return new SpectralOperationMethod(identifier, name, remarks, null, "1.0.0", reversible, spectralDomain, 
				EnumSet.allOf(RasterFormat.class), supportedModes, parameters);
	}
	
	public SpectralOperationDomain getSpectralDomain() {
		return spectralDomain;
	}
	
	public Set<RasterFormat> getSupportedFormats() {
		return supportedFormats;
	}

}
