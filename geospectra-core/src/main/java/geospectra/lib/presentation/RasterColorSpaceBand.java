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
 * Channels of the supported colour spaces.
 */
@SuppressWarnings("javadoc")
public enum RasterColorSpaceBand {
	RED, GREEN, BLUE,
	HUE, SATURATION, VALUE, LIGHTNESS,
	A, B,
	CYAN, MAGENTA, YELLOW, BLACK,
	LUMA, BLUE_DIFFERENCE_CHROMA, RED_DIFFERENCE_CHROMA;
}
