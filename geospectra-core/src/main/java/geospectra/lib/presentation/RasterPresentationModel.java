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

package geospectra.lib.presentation;

/**
 * Ways in which raster bands can be mapped to a viewable image.
 */
public enum RasterPresentationModel {
	
	/**
	 * Bands map to the channels of a colour space, recording the colours they represent.
	 */
	TRUE_COLOR,
	/**
	 * Three bands map to red, green and blue regardless of their spectral domain.
	 */
	FALSE_COLOR,
	/**
	 * A single band shown as intensity.
	 */
	GRAYSCALE,
	/**
	 * A single band shown as inverted intensity.
	 */
	INVERTED_GRAYSCALE,
	/**
	 * A single band shown as opacity.
	 */
	TRANSPARENCY,
	/**
	 * Each value of a single band is looked up in a colour map.
	 */
	PSEUDO_COLOR,
	/**
	 * Value intervals of a single band are looked up in a colour map.
	 */
	DENSITY_SLICING;
	
	/**
	 * Returns true if the model requires a colour map.
	 * @return
	 */
	public boolean requiresColorMap() {
		return this == PSEUDO_COLOR || this == DENSITY_SLICING;
	}

}
