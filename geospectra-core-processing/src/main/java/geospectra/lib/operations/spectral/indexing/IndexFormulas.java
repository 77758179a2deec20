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

/**
 * Arithmetic shared by the index formulas. 
 * Divisions by zero, and terms that would need one, evaluate to 0.
 */
final class IndexFormulas {
	
	private IndexFormulas() {
		throw new AssertionError();
	}
	
	static double ratio(double numerator, double denominator) {
		return denominator == 0 ? 0 : numerator / denominator;
	}
	
	/**
	 * {@code (a - b) / (a + b)}
	 */
	static double normalizedDifference(double a, double b) {
		return ratio(a - b, a + b);
	}
	
	/**
	 * {@code 1/a - 1/b}, or 0 if either value is 0.
	 */
	static double reciprocalDifference(double a, double b) {
		return a == 0 || b == 0 ? 0 : 1 / a - 1 / b;
	}
	
	/**
	 * Normalized difference of {@code log(1/a)} and {@code log(1/b)}, or 0 if either value is 0.
	 */
	static double logNormalizedDifference(double a, double b) {
		if (a == 0 || b == 0)
			return 0;
		return normalizedDifference(Math.log(1 / a), Math.log(1 / b));
	}
	
	static double mean(double[] values) {
		if (values.length == 0)
			return 0;
		double sum = 0;
		for (double v : values)
			sum += v;
		return sum / values.length;
	}

}
