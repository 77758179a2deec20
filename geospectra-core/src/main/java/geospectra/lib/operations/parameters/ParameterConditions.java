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

package geospectra.lib.operations.parameters;

import java.util.Arrays;
import java.util.function.Predicate;

/**
 * Common conditions on parameter values.
 */
public class ParameterConditions {
	
	private ParameterConditions() {
		throw new AssertionError();
	}
	
	/**
	 * Value must be zero or greater.
	 * @return
	 */
	public static Predicate<Number> isNotNegative() {
		return n -> n.doubleValue() >= 0;
	}
	
	/**
	 * Value must be greater than zero.
	 * @return
	 */
	public static Predicate<Number> isPositive() {
		return n -> n.doubleValue() > 0;
	}
	
	/**
	 * Value must lie in {@code [min, max]}.
	 * @param min
	 * @param max
	 * @return
	 */
	public static Predicate<Number> isBetween(double min, double max) {
		return n -> n.doubleValue() >= min && n.doubleValue() <= max;
	}
	
	/**
	 * Every element must be zero or greater.
	 * @return
	 */
	public static Predicate<int[]> areNotNegative() {
		return values -> Arrays.stream(values).allMatch(v -> v >= 0);
	}
	
	/**
	 * Array must contain at least one element.
	 * @return
	 */
	public static Predicate<Object[]> isNotEmpty() {
		return values -> values.length > 0;
	}
	
	/**
	 * Array must contain at least one element.
	 * @return
	 */
	public static Predicate<int[]> isNotEmptyIntArray() {
		return values -> values.length > 0;
	}

}
