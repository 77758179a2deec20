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

package geospectra.lib.raster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.StatisticalSummary;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * Per-band summary statistics of a raster.
 * <p>
 * Values are read with {@link Raster#getFloatValue(int, int, int)}; NaN values are skipped.
 */
public class RasterStatistics {
	
	private final List<StatisticalSummary> summaries;
	
	private RasterStatistics(List<StatisticalSummary> summaries) {
		this.summaries = Collections.unmodifiableList(summaries);
	}
	
	/**
	 * Compute statistics for every band of a raster.
	 * @param raster
	 * @return
	 */
	public static RasterStatistics compute(Raster raster) {
		if (!raster.isReadable())
			throw new IllegalArgumentException("Raster is not readable");
		var list = new ArrayList<StatisticalSummary>();
		for (int b = 0; b < raster.getNumberOfBands(); b++) {
			var stats = new SummaryStatistics();
			for (int r = 0; r < raster.getNumberOfRows(); r++) {
				for (int c = 0; c < raster.getNumberOfColumns(); c++) {
					double val = raster.getFloatValue(r, c, b);
					if (!Double.isNaN(val))
						stats.addValue(val);
				}
			}
			list.add(stats.getSummary());
		}
		return new RasterStatistics(list);
	}
	
	/**
	 * Get the summary of a band.
	 * @param band
	 * @return
	 */
	public StatisticalSummary getSummary(int band) {
		return summaries.get(band);
	}
	
	/**
	 * Number of bands summarized.
	 * @return
	 */
	public int getNumberOfBands() {
		return summaries.size();
	}
	
	public double getMin(int band) {
		return summaries.get(band).getMin();
	}
	
	public double getMax(int band) {
		return summaries.get(band).getMax();
	}

}
