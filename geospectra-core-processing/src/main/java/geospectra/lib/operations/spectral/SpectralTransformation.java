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

import java.util.Arrays;
import java.util.OptionalInt;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import geospectra.lib.geometry.SpectralGeometry;
import geospectra.lib.imaging.RasterImaging;
import geospectra.lib.operations.Operation;
import geospectra.lib.operations.OperationArgumentException;
import geospectra.lib.operations.OperationArgumentException.Reason;
import geospectra.lib.operations.parameters.OperationParameter;
import geospectra.lib.operations.parameters.ParameterBindings;
import geospectra.lib.presentation.RasterPresentation;
import geospectra.lib.raster.FloatRaster;
import geospectra.lib.raster.Raster;
import geospectra.lib.raster.RasterFormat;
import geospectra.lib.raster.RasterService;
import geospectra.lib.raster.ServiceRaster;

/**
 * Base class for operations computing the values of a raster from the values of a source raster, 
 * one location at a time.
 * <p>
 * Subclasses resolve the bands they read in their constructor, declare the shape of the result by 
 * calling {@link #setResultProperties(RasterFormat, int, int, RasterPresentation, RasterImaging)} from 
 * {@link #prepareResult()}, and implement {@link #computeFloat(int, int, int)} (and {@link #compute(int, int, int)} 
 * if the result may be an integer raster).
 * <p>
 * The result of an operation that has not been executed is computed on demand whenever a value is read.
 * Execution writes each value of the result once. Computing a value only reads the source, so rows may be 
 * computed in parallel, see {@link #setParallel(boolean)}.
 */
public abstract class SpectralTransformation extends Operation<SpectralGeometry, SpectralGeometry> {
	
	private final static Logger logger = LoggerFactory.getLogger(SpectralTransformation.class);
	
	private final boolean providedResult;
	private final RasterFormat sourceFormat;
	
	private boolean resultPropertiesSet = false;
	private RasterFormat resultFormat;
	private int nResultBands;
	private int resultBits;
	private RasterPresentation resultPresentation;
	private RasterImaging resultImaging;
	
	private volatile boolean parallel = false;

	/**
	 * Create a spectral transformation.
	 * 
	 * @param source the source geometry, not null
	 * @param result the geometry to write the result into, or null to create a new one
	 * @param method the method
	 * @param parameters parameter values, may be null
	 * @throws OperationArgumentException if the source raster cannot be read or has an unsupported format, 
	 *                                    or if an argument is invalid
	 */
	protected SpectralTransformation(SpectralGeometry source, SpectralGeometry result, SpectralOperationMethod method, ParameterBindings parameters) 
			throws OperationArgumentException {
		super(source, result, method, parameters);
		var raster = source.getRaster();
		if (!raster.isReadable())
			throw new OperationArgumentException(Reason.INVALID_SOURCE_DATA, "The source raster of " + method.getName() + " is not readable");
		if (!method.getSupportedFormats().contains(raster.getFormat()))
			throw new OperationArgumentException(Reason.UNSUPPORTED_FORMAT, 
					method.getName() + " does not support " + raster.getFormat() + " rasters");
		if (result != null && !result.getRaster().isWritable())
			throw new OperationArgumentException(Reason.INVALID_SOURCE_DATA, "The result raster of " + method.getName() + " is not writable");
		this.providedResult = result != null;
		this.sourceFormat = raster.getFormat();
	}
	
	/**
	 * Get the method as a spectral operation method.
	 * @return
	 */
	public SpectralOperationMethod getSpectralMethod() {
		return (SpectralOperationMethod)getMethod();
	}
	
	/**
	 * Request that rows are computed in parallel during execution.
	 * @param parallel
	 */
	public void setParallel(boolean parallel) {
		this.parallel = parallel;
	}
	
	public boolean isParallel() {
		return parallel;
	}
	
	/**
	 * Returns true if source and result are the same geometry.
	 * @return
	 */
	protected boolean isInPlace() {
		return providedResult && result == getSource();
	}
	
	/**
	 * Read a source value as a double, using the accessor matching the format of the source raster.
	 * @param row
	 * @param col
	 * @param band
	 * @return
	 */
	protected double readSource(int row, int col, int band) {
		var raster = getSource().getRaster();
		switch (sourceFormat) {
		case INTEGER:
			return raster.getValue(row, col, band);
		case FLOATING:
		default:
			return raster.getFloatValue(row, col, band);
		}
	}
	
	/**
	 * Read several source values at a location.
	 * @param row
	 * @param col
	 * @param bands band indices, in the order the values should be returned
	 * @return
	 */
	protected double[] readSource(int row, int col, int[] bands) {
		double[] values = new double[bands.length];
		for (int i = 0; i < bands.length; i++)
			values[i] = readSource(row, col, bands[i]);
		return values;
	}
	
	/**
	 * Resolve the index of a source band from an explicit parameter value, then from the imaging metadata 
	 * of the source, then from a positional default.
	 * 
	 * @param parameter the band index parameter
	 * @param locator finds the band in the imaging metadata, may be null
	 * @param positionalDefault the index used if the band cannot be located, may be null
	 * @return the band index
	 * @throws OperationArgumentException if the band cannot be identified, or the index is not a band of the source
	 */
	protected int resolveBandIndex(OperationParameter<Integer> parameter, BandLocator locator, Integer positionalDefault) 
			throws OperationArgumentException {
		Integer index = resolveParameter(parameter, () -> {
			OptionalInt located = locator == null ? OptionalInt.empty() : locator.locate(getSource().getImaging());
			return located.isPresent() ? Integer.valueOf(located.getAsInt()) : positionalDefault;
		});
		if (index == null)
			throw new OperationArgumentException(Reason.INVALID_SOURCE_DATA, parameter, 
					"The source of " + getMethod().getName() + " does not identify the " + (locator == null ? parameter.getName() : locator));
		checkBandIndex(parameter, index);
		logger.trace("{}: {} resolved to {}", getMethod().getName(), parameter.getName(), index);
		return index;
	}
	
	/**
	 * Resolve several source band indices from an explicit parameter value, then from the imaging metadata 
	 * of the source.
	 * 
	 * @param parameter the band indices parameter
	 * @param lookup finds the bands in the imaging metadata; only called with non-null metadata
	 * @return the band indices, not empty
	 * @throws OperationArgumentException if no band can be identified, or an index is not a band of the source
	 */
	protected int[] resolveBandIndices(OperationParameter<int[]> parameter, Function<RasterImaging, int[]> lookup) 
			throws OperationArgumentException {
		int[] indices = resolveParameter(parameter, () -> {
			var imaging = getSource().getImaging();
			return imaging == null ? null : lookup.apply(imaging);
		});
		if (indices == null || indices.length == 0)
			throw new OperationArgumentException(Reason.INVALID_SOURCE_DATA, parameter, 
					"The source of " + getMethod().getName() + " does not identify the " + parameter.getName());
		for (int index : indices)
			checkBandIndex(parameter, index);
		return indices.clone();
	}
	
	/**
	 * Check that an index is a band of the source raster.
	 * @param parameter the parameter the index was resolved from, may be null
	 * @param index
	 * @throws OperationArgumentException if the index is negative, or not less than the number of source bands
	 */
	protected void checkBandIndex(OperationParameter<?> parameter, int index) throws OperationArgumentException {
		int nBands = getSource().getRaster().getNumberOfBands();
		if (index < 0 || index >= nBands)
			throw new OperationArgumentException(Reason.OUT_OF_RANGE_BAND_INDEX, parameter, 
					"Band index " + index + " is not valid for a source with " + nBands + " bands");
	}
	
	/**
	 * Declare the shape of the result. Only the first call has an effect, so subclasses 
	 * call this before delegating to {@link #prepareResult()}.
	 * 
	 * @param format
	 * @param nBands
	 * @param bits
	 * @param presentation
	 * @param imaging may be null
	 */
	protected final void setResultProperties(RasterFormat format, int nBands, int bits, RasterPresentation presentation, RasterImaging imaging) {
		if (resultPropertiesSet)
			return;
		if (format == null || presentation == null)
			throw new IllegalArgumentException("Result format and presentation must not be null");
		if (nBands < 1)
			throw new IllegalArgumentException("The result must have at least one band");
		if (!format.isValidResolution(bits))
			throw new IllegalArgumentException(bits + " is not a valid resolution for " + format + " rasters");
		this.resultFormat = format;
		this.nResultBands = nBands;
		this.resultBits = bits;
		this.resultPresentation = presentation;
		this.resultImaging = imaging;
		this.resultPropertiesSet = true;
	}
	
	protected RasterFormat getResultFormat() {
		return resultFormat;
	}
	
	protected int getNumberOfResultBands() {
		return nResultBands;
	}
	
	protected int getResultRadiometricResolution() {
		return resultBits;
	}

	/**
	 * Create the result geometry. Properties not declared by a subclass are taken from the source.
	 */
	@Override
	protected void prepareResult() {
		var source = getSource();
		var sourceRaster = source.getRaster();
		setResultProperties(sourceRaster.getFormat(), sourceRaster.getNumberOfBands(), sourceRaster.getRadiometricResolution(), 
				source.getPresentation(), source.getImaging());
		
		int nRows = sourceRaster.getNumberOfRows();
		int nCols = sourceRaster.getNumberOfColumns();
		
		if (providedResult) {
			var raster = result.getRaster();
			if (raster.getNumberOfBands() != nResultBands || raster.getNumberOfRows() != nRows || raster.getNumberOfColumns() != nCols)
				throw new OperationArgumentException(Reason.INVALID_SOURCE_DATA, 
						String.format("The result raster of %s must have %d bands, %d rows and %d columns, but has %d, %d and %d", 
								getMethod().getName(), nResultBands, nRows, nCols, 
								raster.getNumberOfBands(), raster.getNumberOfRows(), raster.getNumberOfColumns()));
			return;
		}
		
		Raster raster;
		if (isExecuting()) {
			raster = source.getFactory().getRasterFactory().createRaster(resultFormat, nResultBands, nRows, nCols, resultBits);
			logger.debug("Allocated {} for {}", raster, getMethod().getName());
		} else {
			raster = new ServiceRaster(new ComputingService(), resultFormat, nResultBands, nRows, nCols, resultBits);
			logger.trace("Created on-demand {} for {}", raster, getMethod().getName());
		}
		result = source.getFactory().createSpectralGeometry(source, raster, resultPresentation, resultImaging);
	}

	@Override
	protected void computeResult() {
		var raster = result.getRaster();
		int nRows = raster.getNumberOfRows();
		int nCols = raster.getNumberOfColumns();
		boolean floating = resultFormat == RasterFormat.FLOATING;
		
		if (getSpectralMethod().getSpectralDomain().isBandWise()) {
			for (int b = 0; b < nResultBands; b++) {
				int band = b;
				forEachRow(nRows, row -> {
					for (int col = 0; col < nCols; col++) {
						if (floating)
							raster.setFloatValue(row, col, band, computeFloat(row, col, band));
						else
							raster.setValue(row, col, band, compute(row, col, band));
					}
				});
			}
		} else {
			forEachRow(nRows, row -> {
				for (int col = 0; col < nCols; col++) {
					if (floating)
						raster.setFloatValues(row, col, computeFloat(row, col));
					else
						raster.setValues(row, col, compute(row, col));
				}
			});
		}
	}
	
	private void forEachRow(int nRows, IntConsumer consumer) {
		var rows = IntStream.range(0, nRows);
		if (parallel)
			rows = rows.parallel();
		rows.forEach(consumer);
	}
	
	/**
	 * Compute a floating point result value.
	 * @param row
	 * @param col
	 * @param band result band
	 * @return
	 */
	protected abstract double computeFloat(int row, int col, int band);
	
	/**
	 * Compute the floating point values of all result bands at a location.
	 * @param row
	 * @param col
	 * @return
	 */
	protected double[] computeFloat(int row, int col) {
		double[] values = new double[nResultBands];
		for (int b = 0; b < nResultBands; b++)
			values[b] = computeFloat(row, col, b);
		return values;
	}
	
	/**
	 * Compute an integer result value. Only needed for operations that may produce integer rasters.
	 * @param row
	 * @param col
	 * @param band result band
	 * @return
	 */
	protected int compute(int row, int col, int band) {
		throw new UnsupportedOperationException(getMethod().getName() + " does not compute integer values");
	}
	
	/**
	 * Compute the integer values of all result bands at a location.
	 * @param row
	 * @param col
	 * @return
	 */
	protected int[] compute(int row, int col) {
		int[] values = new int[nResultBands];
		for (int b = 0; b < nResultBands; b++)
			values[b] = compute(row, col, b);
		return values;
	}
	
	
	/**
	 * Computes values of the result on demand, at double precision whatever the declared resolution.
	 */
	private class ComputingService implements RasterService {

		@Override
		public int readValue(int row, int col, int band) {
			if (resultFormat == RasterFormat.INTEGER)
				return compute(row, col, band);
			return FloatRaster.toInt(computeFloat(row, col, band));
		}

		@Override
		public double readFloatValue(int row, int col, int band) {
			if (resultFormat == RasterFormat.INTEGER)
				return compute(row, col, band);
			return computeFloat(row, col, band);
		}
		
		@Override
		public double[] readFloatValues(int row, int col, int nBands) {
			if (resultFormat == RasterFormat.INTEGER)
				return Arrays.stream(compute(row, col)).asDoubleStream().toArray();
			return computeFloat(row, col);
		}
		
	}

}
