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
import java.util.TreeSet;
import java.util.stream.IntStream;

import geospectra.lib.geometry.SpectralGeometry;
import geospectra.lib.imaging.SpectralDomain;
import geospectra.lib.operations.OperationArgumentException;
import geospectra.lib.operations.OperationArgumentException.Reason;
import geospectra.lib.operations.parameters.ParameterBindings;
import geospectra.lib.presentation.RasterPresentation;

/**
 * Base class for transformations applied to each selected band independently.
 * <p>
 * Bands are selected by {@link SpectralOperationParameters#BAND_INDEX}, {@link SpectralOperationParameters#BAND_INDICES} 
 * and, where the method accepts them, {@link SpectralOperationParameters#BAND_NAME} and {@link SpectralOperationParameters#BAND_NAMES}. 
 * The selection is the union of all given values in ascending order, or all bands if none is given.
 * <p>
 * Executed out of place, the result has one band per selected band, with the format and resolution of the source. 
 * Executed in place, the selected bands are transformed and all other bands keep their values.
 */
public abstract class PerBandSpectralTransformation extends SpectralTransformation {
	
	private final int[] selectedBands;
	private final int[] sourceBands;
	private final boolean[] transformed;

	protected PerBandSpectralTransformation(SpectralGeometry source, SpectralGeometry result, SpectralOperationMethod method, ParameterBindings parameters) 
			throws OperationArgumentException {
		super(source, result, method, parameters);
		this.selectedBands = selectBands();
		int nSourceBands = source.getRaster().getNumberOfBands();
		if (isInPlace()) {
			this.sourceBands = IntStream.range(0, nSourceBands).toArray();
			this.transformed = new boolean[nSourceBands];
			for (int b : selectedBands)
				transformed[b] = true;
		} else {
			this.sourceBands = selectedBands.clone();
			this.transformed = new boolean[selectedBands.length];
			Arrays.fill(transformed, true);
		}
	}
	
	private int[] selectBands() {
		var selection = new TreeSet<Integer>();
		// explicit null entries select nothing
		Integer index = resolveParameter(SpectralOperationParameters.BAND_INDEX);
		if (index != null) {
			checkBandIndex(SpectralOperationParameters.BAND_INDEX, index);
			selection.add(index);
		}
		int[] indices = resolveParameter(SpectralOperationParameters.BAND_INDICES);
		if (indices != null) {
			for (int i : indices) {
				checkBandIndex(SpectralOperationParameters.BAND_INDICES, i);
				selection.add(i);
			}
		}
		SpectralDomain domain = resolveParameter(SpectralOperationParameters.BAND_NAME);
		if (domain != null)
			selection.add(indexOfDomain(domain));
		SpectralDomain[] domains = resolveParameter(SpectralOperationParameters.BAND_NAMES);
		if (domains != null) {
			for (var d : domains)
				selection.add(indexOfDomain(d));
		}
		if (selection.isEmpty())
			return IntStream.range(0, getSource().getRaster().getNumberOfBands()).toArray();
		return selection.stream().mapToInt(Integer::intValue).toArray();
	}
	
	private int indexOfDomain(SpectralDomain domain) {
		var located = BandLocator.domain(domain).locate(getSource().getImaging());
		if (located.isEmpty())
			throw new OperationArgumentException(Reason.INVALID_SOURCE_DATA, SpectralOperationParameters.BAND_NAME, 
					"The source of " + getMethod().getName() + " has no band of " + domain);
		return located.getAsInt();
	}
	
	/**
	 * Get the selected source bands, in ascending order.
	 * @return
	 */
	public int[] getSelectedBands() {
		return selectedBands.clone();
	}
	
	/**
	 * Returns true if all bands of the source are selected.
	 * @return
	 */
	protected boolean selectsAllBands() {
		return selectedBands.length == getSource().getRaster().getNumberOfBands();
	}

	@Override
	protected void prepareResult() {
		var source = getSource();
		var raster = source.getRaster();
		if (isInPlace() || selectsAllBands()) {
			setResultProperties(raster.getFormat(), sourceBands.length, raster.getRadiometricResolution(), 
					source.getPresentation(), source.getImaging());
		} else {
			setResultProperties(raster.getFormat(), selectedBands.length, raster.getRadiometricResolution(), 
					createPresentation(selectedBands.length), source.hasImaging() ? source.getImaging().filter(selectedBands) : null);
		}
		super.prepareResult();
	}
	
	/**
	 * Presentation of a result keeping only some of the source bands.
	 * @param nBands
	 * @return
	 */
	protected RasterPresentation createPresentation(int nBands) {
		if (nBands == 3)
			return RasterPresentation.createFalseColorPresentation(0, 1, 2);
		return RasterPresentation.createGrayscalePresentation();
	}

	@Override
	protected final double computeFloat(int row, int col, int band) {
		int sourceBand = sourceBands[band];
		if (!transformed[band])
			return getSource().getRaster().getFloatValue(row, col, sourceBand);
		return computeBandFloat(row, col, sourceBand);
	}

	@Override
	protected final int compute(int row, int col, int band) {
		int sourceBand = sourceBands[band];
		if (!transformed[band])
			return getSource().getRaster().getValue(row, col, sourceBand);
		return computeBand(row, col, sourceBand);
	}
	
	/**
	 * Compute the floating point result value for a source band.
	 * @param row
	 * @param col
	 * @param sourceBand
	 * @return
	 */
	protected abstract double computeBandFloat(int row, int col, int sourceBand);
	
	/**
	 * Compute the integer result value for a source band.
	 * @param row
	 * @param col
	 * @param sourceBand
	 * @return
	 */
	protected abstract int computeBand(int row, int col, int sourceBand);

}
