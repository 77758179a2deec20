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

/**
 * Copies the selected bands of a raster, removing all others.
 */
public class SpectralBandFiltering extends PerBandSpectralTransformation {

	/**
	 * Create a band filtering.
	 * @param source
	 * @param result the geometry to write into, or null
	 * @param parameters band indices and spectral domains of the bands to keep
	 * @throws OperationArgumentException
	 */
	public SpectralBandFiltering(SpectralGeometry source, SpectralGeometry result, ParameterBindings parameters) throws OperationArgumentException {
		super(source, result, SpectralOperationMethods.SPECTRAL_BAND_FILTERING, parameters);
	}
	
	public SpectralBandFiltering(SpectralGeometry source, ParameterBindings parameters) throws OperationArgumentException {
		this(source, null, parameters);
	}

	@Override
	protected double computeBandFloat(int row, int col, int sourceBand) {
		return getSource().getRaster().getFloatValue(row, col, sourceBand);
	}

	@Override
	protected int computeBand(int row, int col, int sourceBand) {
		return getSource().getRaster().getValue(row, col, sourceBand);
	}

}
