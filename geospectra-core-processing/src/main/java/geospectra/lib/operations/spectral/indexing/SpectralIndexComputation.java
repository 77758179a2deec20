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

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import geospectra.lib.geometry.SpectralGeometry;
import geospectra.lib.operations.OperationArgumentException;
import geospectra.lib.operations.parameters.ParameterBindings;
import geospectra.lib.operations.spectral.SpectralTransformation;
import geospectra.lib.raster.RasterFormat;

/**
 * Computes a {@link SpectralIndex}.
 * <p>
 * The source bands are resolved when the computation is created. The result is a 32-bit floating point raster 
 * without imaging metadata. Values that are not finite are written as 0.
 */
public class SpectralIndexComputation extends SpectralTransformation {
	
	private final static Logger logger = LoggerFactory.getLogger(SpectralIndexComputation.class);
	
	private final SpectralIndex index;
	private final int[] bands;
	
	private final LongAdder nonFinite = new LongAdder();
	private final AtomicBoolean nonFiniteReported = new AtomicBoolean();

	/**
	 * Create an index computation.
	 * @param index
	 * @param source
	 * @param result the geometry to write into, or null
	 * @param parameters band indices overriding the imaging metadata of the source, may be null
	 * @throws OperationArgumentException if a band cannot be identified or is not a band of the source
	 */
	public SpectralIndexComputation(SpectralIndex index, SpectralGeometry source, SpectralGeometry result, ParameterBindings parameters) 
			throws OperationArgumentException {
		super(source, result, Objects.requireNonNull(index, "Spectral index must not be null").getMethod(), parameters);
		this.index = index;
		this.bands = resolveBands();
	}
	
	private int[] resolveBands() {
		int[] resolved = new int[0];
		for (var requirement : index.getRequirements()) {
			int[] next;
			if (requirement.isGroup()) {
				next = resolveBandIndices(requirement.getGroupParameter(), 
						imaging -> imaging.indicesBetween(requirement.getMinWavelength(), requirement.getMaxWavelength()));
			} else {
				next = new int[] { resolveBandIndex(requirement.getParameter(), requirement.getLocator(), requirement.getPositionalDefault()) };
			}
			int n = resolved.length;
			resolved = Arrays.copyOf(resolved, n + next.length);
			System.arraycopy(next, 0, resolved, n, next.length);
		}
		logger.debug("{} reads source bands {}", index, resolved);
		return resolved;
	}
	
	public SpectralIndex getIndex() {
		return index;
	}
	
	/**
	 * Source bands read by the formula, in the order of its requirements.
	 * @return
	 */
	public int[] getSourceBands() {
		return bands.clone();
	}
	
	/**
	 * Number of non-finite values computed so far, which were replaced by 0.
	 * @return
	 */
	public long getNumberOfNonFiniteValues() {
		return nonFinite.sum();
	}
	
	@Override
	protected void prepareResult() {
		setResultProperties(RasterFormat.FLOATING, index.getNumberOfBands(), 32, index.getPresentation(), null);
		super.prepareResult();
	}

	@Override
	protected double[] computeFloat(int row, int col) {
		double[] values = index.getFormula().compute(readSource(row, col, bands));
		if (values.length != index.getNumberOfBands())
			throw new IllegalStateException(index + " computed " + values.length + " values, but " + index.getNumberOfBands() + " were expected");
		for (int b = 0; b < values.length; b++) {
			if (!Double.isFinite(values[b])) {
				nonFinite.increment();
				if (nonFiniteReported.compareAndSet(false, true))
					logger.warn("{} produced a non-finite value at row {}, column {}, band {}; non-finite values are written as 0", 
							index, row, col, b);
				values[b] = 0;
			}
		}
		return values;
	}

	@Override
	protected void finalizeResult() {
		long n = nonFinite.sum();
		if (n > 0)
			logger.debug("{}: {} non-finite values written as 0", index, n);
	}

	@Override
	protected double computeFloat(int row, int col, int band) {
		return computeFloat(row, col)[band];
	}

}
