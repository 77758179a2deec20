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

package geospectra.lib.common;

/**
 * Static functions for working with packed RGB values, 
 * as used in the colour maps of raster presentations.
 */
public class ColorTools {
	
	private ColorTools() {
		throw new AssertionError();
	}
	
	/**
	 * Get the red component of a packed RGB value.
	 * @param rgb
	 * @return
	 */
	public static int red(int rgb) {
		return (rgb >> 16) & 0xff;
	}

	/**
	 * Get the green component of a packed RGB value.
	 * @param rgb
	 * @return
	 */
	public static int green(int rgb) {
		return (rgb >> 8) & 0xff;
	}

	/**
	 * Get the blue component of a packed RGB value.
	 * @param rgb
	 * @return
	 */
	public static int blue(int rgb) {
		return rgb & 0xff;
	}
	
	/**
	 * Format a packed RGB value as a hex string, e.g. {@code #FF8000}.
	 * @param rgb
	 * @return
	 */
	public static String toHexString(int rgb) {
		return String.format("#%02X%02X%02X", red(rgb), green(rgb), blue(rgb));
	}

}
