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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static geospectra.lib.presentation.RasterColorSpaceBand.*;

/**
 * Colour spaces, with their channels in conventional order.
 */
public enum RasterColorSpace {
	
	/**
	 * No colour space, used by single-band models.
	 */
	NONE(),
	/**
	 * Red, green, blue
	 */
	RGB(RED, GREEN, BLUE),
	/**
	 * Hue, saturation, value
	 */
	HSV(HUE, SATURATION, VALUE),
	/**
	 * Hue, saturation, lightness
	 */
	HSL(HUE, SATURATION, LIGHTNESS),
	/**
	 * CIE L*a*b*
	 */
	CIE_LAB(LIGHTNESS, A, B),
	/**
	 * Cyan, magenta, yellow, black
	 */
	CMYK(CYAN, MAGENTA, YELLOW, BLACK),
	/**
	 * Luma, blue difference, red difference
	 */
	YCBCR(LUMA, BLUE_DIFFERENCE_CHROMA, RED_DIFFERENCE_CHROMA);
	
	private final List<RasterColorSpaceBand> channels;
	
	private RasterColorSpace(RasterColorSpaceBand... channels) {
		this.channels = Collections.unmodifiableList(Arrays.asList(channels));
	}
	
	/**
	 * Channels of the colour space in conventional order.
	 * @return
	 */
	public List<RasterColorSpaceBand> getChannels() {
		return channels;
	}

}
