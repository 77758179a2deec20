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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import geospectra.lib.geometry.SpectralGeometry;
import geospectra.lib.operations.OperationArgumentException;
import geospectra.lib.operations.parameters.ParameterBindings;
import geospectra.lib.raster.RasterFormat;
import geospectra.lib.raster.RasterStatistics;

/**
 * Stretches the values of the selected bands linearly so that each band fills the whole value range.
 * <p>
 * For an integer raster with {@code n} bits the minimum of a band maps to 0 and its maximum to {@code 2^n - 1}.
 * For a floating point raster the band is stretched to [0, 1].
 * Bands holding a single value, or no finite range at all, are copied unchanged.
 */
public class SaturatingContrastEnhancement extends PerBandSpectralTransformation {
	
	private final static Logger logger = LoggerFactory.getLogger(SaturatingContrastEnhancement.class);
	
	private final boolean integer;
	private final double[] offsets;
	private final double[] factors;

	/**
	 * Create a contrast enhancement.
	 * The band minima and maxima are read from the source when the operation is created.
	 * @param source
	 * @param result the geometry to write into, may be the source or null
	 * @param parameters band selection, may be null to stretch all bands
	 * @throws OperationArgumentException
	 */
	public SaturatingContrastEnhancement(SpectralGeometry source, SpectralGeometry result, ParameterBindings parameters) throws OperationArgumentException {
		super(source, result, SpectralOperationMethods.SATURATING_CONTRAST_ENHANCEMENT, parameters);
		var raster = source.getRaster();
		this.integer = raster.getFormat() == RasterFormat.INTEGER;
		double top = integer ? (double)((1L << raster.getRadiometricResolution()) - 1) : 1.0;
		
		var stats = RasterStatistics.compute(raster);
		int nBands = raster.getNumberOfBands();
		this.offsets = new double[nBands];
		this.factors = new double[nBands];
		for (int b : getSelectedBands()) {
			double min = stats.getMin(b);
			double max = stats.getMax(b);
			double range = max - min;
			if (Double.isFinite(range) && range > 0) {
				offsets[b] = min;
				factors[b] = top / range;
			} else {
				logger.debug("Band {} has no value range to stretch (min={}, max={})", b, min, max);
				factors[b] = 1.0;
			}
		}
	}
	
	/**
	 * Create an out of place contrast enhancement.
	 * @param source
	 * @param parameters
	 * @throws OperationArgumentException
	 */
	public SaturatingContrastEnhancement(SpectralGeometry source, ParameterBindings parameters) throws OperationArgumentException {
		this(source, null, parameters);
	}
	
	/**
	 * Value subtracted from a source band before scaling.
	 * @param sourceBand
	 * @return
	 */
	public double getOffset(int sourceBand) {
		return offsets[sourceBand];
	}
	
	/**
	 * Scale applied to a source band after the offset.
	 * @param sourceBand
	 * @return
	 */
	public double getFactor(int sourceBand) {
		return factors[sourceBand];
	}

	@Override
	protected double computeBandFloat(int row, int col, int sourceBand) {
		double value = (readSource(row, col, sourceBand) - offsets[sourceBand]) * factors[sourceBand];
		if (integer)
			return Math.round(value);
		return value;
	}

	@Override
	protected int computeBand(int row, int col, int sourceBand) {
		int value = getSource().getRaster().getValue(row, col, sourceBand);
		return (int)Math.round((value - offsets[sourceBand]) * factors[sourceBand]);
	}

}
