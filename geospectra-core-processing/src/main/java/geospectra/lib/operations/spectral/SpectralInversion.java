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

import geospectra.lib.geometry.SpectralGeometry;
import geospectra.lib.operations.OperationArgumentException;
import geospectra.lib.operations.parameters.ParameterBindings;
import geospectra.lib.raster.RasterFormat;

/**
 * Inverts the values of the selected bands.
 * <p>
 * An integer value {@code v} with {@code n} bits becomes {@code (2^n - 1) - v}; a floating point value becomes {@code -v}.
 * Applying the inversion twice restores the source.
 */
public class SpectralInversion extends PerBandSpectralTransformation {
	
	private final int maxValue;
	private final boolean integer;

	/**
	 * Create a spectral inversion.
	 * @param source
	 * @param result the geometry to write into, may be the source or null
	 * @param parameters band selection, may be null to invert all bands
	 * @throws OperationArgumentException
	 */
	public SpectralInversion(SpectralGeometry source, SpectralGeometry result, ParameterBindings parameters) throws OperationArgumentException {
		super(source, result, SpectralOperationMethods.SPECTRAL_INVERSION, parameters);
		var raster = source.getRaster();
		this.integer = raster.getFormat() == RasterFormat.INTEGER;
		this.maxValue = (int)((1L << raster.getRadiometricResolution()) - 1);
	}
	
	/**
	 * Create an out of place spectral inversion.
	 * @param source
	 * @param parameters
	 * @throws OperationArgumentException
	 */
	public SpectralInversion(SpectralGeometry source, ParameterBindings parameters) throws OperationArgumentException {
		this(source, null, parameters);
	}

	@Override
	protected double computeBandFloat(int row, int col, int sourceBand) {
		if (integer)
			return maxValue - readSource(row, col, sourceBand);
		return -readSource(row, col, sourceBand);
	}

	@Override
	protected int computeBand(int row, int col, int sourceBand) {
		return maxValue - getSource().getRaster().getValue(row, col, sourceBand);
	}
	
	@Override
	protected SpectralInversion computeReverseOperation() {
		if (isInPlace())
			return new SpectralInversion(getResult(), getResult(), getParameters());
		// an out of place result only holds the selected bands
		return new SpectralInversion(getResult(), null, null);
	}

}
