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
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

import geospectra.lib.common.ColorTools;

/**
 * Describes how the bands of a raster map to a viewable image.
 * <p>
 * For colour models, {@link #getBands()} is indexed by raster band: element {@code i} is the colour channel 
 * shown for band {@code i}, or null if band {@code i} is not shown.
 * Pseudo colour and density slicing instead use a colour map from band value to packed RGB.
 * <p>
 * Instances are immutable.
 */
public final class RasterPresentation {
	
	private static final RasterPresentation GRAYSCALE = new RasterPresentation(RasterPresentationModel.GRAYSCALE, RasterColorSpace.NONE);
	private static final RasterPresentation INVERTED_GRAYSCALE = new RasterPresentation(RasterPresentationModel.INVERTED_GRAYSCALE, RasterColorSpace.NONE);
	private static final RasterPresentation TRANSPARENCY = new RasterPresentation(RasterPresentationModel.TRANSPARENCY, RasterColorSpace.NONE);
	
	private final RasterPresentationModel model;
	private final RasterColorSpace colorSpace;
	private final List<RasterColorSpaceBand> bands;
	private final NavigableMap<Integer, Integer> colorMap;
	
	/**
	 * Create a presentation without a colour map.
	 * @param model any model except {@link RasterPresentationModel#PSEUDO_COLOR} and {@link RasterPresentationModel#DENSITY_SLICING}
	 * @param colorSpace
	 * @param bands colour channel per raster band, may contain null
	 */
	public RasterPresentation(RasterPresentationModel model, RasterColorSpace colorSpace, RasterColorSpaceBand... bands) {
		Objects.requireNonNull(model, "Presentation model must not be null");
		if (model.requiresColorMap())
			throw new IllegalArgumentException("Pseudo color and density slicing models must define a color map");
		this.model = model;
		this.colorSpace = colorSpace == null ? RasterColorSpace.NONE : colorSpace;
		this.bands = Collections.unmodifiableList(Arrays.asList(bands.clone()));
		this.colorMap = Collections.emptyNavigableMap();
	}
	
	/**
	 * Create a presentation with a colour map.
	 * @param model either {@link RasterPresentationModel#PSEUDO_COLOR} or {@link RasterPresentationModel#DENSITY_SLICING}
	 * @param colorMap mapping from band value (or lower limit of the value interval) to packed RGB
	 */
	public RasterPresentation(RasterPresentationModel model, Map<Integer, Integer> colorMap) {
		Objects.requireNonNull(model, "Presentation model must not be null");
		if (!model.requiresColorMap())
			throw new IllegalArgumentException("Only pseudo color and density slicing models can define a color map");
		Objects.requireNonNull(colorMap, "Color map must not be null");
		if (colorMap.isEmpty())
			throw new IllegalArgumentException("Color map must not be empty");
		this.model = model;
		this.colorSpace = RasterColorSpace.RGB;
		this.bands = List.of(RasterColorSpaceBand.VALUE);
		this.colorMap = Collections.unmodifiableNavigableMap(new TreeMap<>(colorMap));
	}
	
	/**
	 * True colour presentation of red, green and blue bands in the first three raster bands.
	 * @return
	 */
	public static RasterPresentation createTrueColorPresentation() {
		return createTrueColorPresentation(RasterColorSpace.RGB);
	}
	
	/**
	 * True colour presentation with the raster bands in the conventional channel order of a colour space.
	 * @param colorSpace
	 * @return
	 */
	public static RasterPresentation createTrueColorPresentation(RasterColorSpace colorSpace) {
		if (colorSpace == null || colorSpace == RasterColorSpace.NONE)
			throw new IllegalArgumentException("The color space " + colorSpace + " is not supported for true color presentation");
		return new RasterPresentation(RasterPresentationModel.TRUE_COLOR, colorSpace, 
				colorSpace.getChannels().toArray(RasterColorSpaceBand[]::new));
	}
	
	/**
	 * True colour RGB presentation with explicit band indices, which must be distinct.
	 * @param red
	 * @param green
	 * @param blue
	 * @return
	 */
	public static RasterPresentation createTrueColorPresentation(int red, int green, int blue) {
		if (red == green || red == blue || green == blue)
			throw new IllegalArgumentException("Red, green and blue must be shown from different bands, but got " + red + ", " + green + ", " + blue);
		return new RasterPresentation(RasterPresentationModel.TRUE_COLOR, RasterColorSpace.RGB, rgbBands(red, green, blue));
	}
	
	/**
	 * False colour presentation showing three bands as red, green and blue.
	 * <p>
	 * The same band may be assigned to more than one channel, in which case the last assignment 
	 * (red, then green, then blue) is recorded.
	 * @param red
	 * @param green
	 * @param blue
	 * @return
	 */
	public static RasterPresentation createFalseColorPresentation(int red, int green, int blue) {
		return new RasterPresentation(RasterPresentationModel.FALSE_COLOR, RasterColorSpace.RGB, rgbBands(red, green, blue));
	}
	
	public static RasterPresentation createGrayscalePresentation() {
		return GRAYSCALE;
	}

	public static RasterPresentation createInvertedGrayscalePresentation() {
		return INVERTED_GRAYSCALE;
	}

	public static RasterPresentation createTransparencyPresentation() {
		return TRANSPARENCY;
	}
	
	/**
	 * Pseudo colour presentation.
	 * @param colorMap mapping from band value to packed RGB
	 * @return
	 */
	public static RasterPresentation createPseudoColorPresentation(Map<Integer, Integer> colorMap) {
		return new RasterPresentation(RasterPresentationModel.PSEUDO_COLOR, colorMap);
	}
	
	/**
	 * Density slicing presentation.
	 * @param colorMap mapping from the lower limit of each value interval to packed RGB
	 * @return
	 */
	public static RasterPresentation createDensitySlicingPresentation(Map<Integer, Integer> colorMap) {
		return new RasterPresentation(RasterPresentationModel.DENSITY_SLICING, colorMap);
	}
	
	private static RasterColorSpaceBand[] rgbBands(int red, int green, int blue) {
		if (red < 0)
			throw new IllegalArgumentException("The index of the red band is less than 0");
		if (green < 0)
			throw new IllegalArgumentException("The index of the green band is less than 0");
		if (blue < 0)
			throw new IllegalArgumentException("The index of the blue band is less than 0");
		var bands = new RasterColorSpaceBand[Math.max(red, Math.max(green, blue)) + 1];
		bands[red] = RasterColorSpaceBand.RED;
		bands[green] = RasterColorSpaceBand.GREEN;
		bands[blue] = RasterColorSpaceBand.BLUE;
		return bands;
	}
	
	public RasterPresentationModel getModel() {
		return model;
	}
	
	public RasterColorSpace getColorSpace() {
		return colorSpace;
	}
	
	/**
	 * Colour channel per raster band; elements may be null.
	 * @return
	 */
	public List<RasterColorSpaceBand> getBands() {
		return bands;
	}
	
	/**
	 * Index of the raster band shown in a colour channel.
	 * @param channel
	 * @return the band index, or -1 if the channel is not used
	 */
	public int indexOf(RasterColorSpaceBand channel) {
		return bands.indexOf(channel);
	}
	
	/**
	 * Returns true if the presentation uses a colour map.
	 * @return
	 */
	public boolean hasColorMap() {
		return !colorMap.isEmpty();
	}
	
	/**
	 * Colour map sorted by key; empty if the model does not use one.
	 * @return
	 */
	public Map<Integer, Integer> getColorMap() {
		return colorMap;
	}
	
	/**
	 * Look up the packed RGB value for a band value.
	 * <p>
	 * Pseudo colour requires an exact key, density slicing uses the largest key not greater than the value.
	 * @param value
	 * @return the colour, or null if none is defined
	 */
	public Integer getColor(int value) {
		if (model == RasterPresentationModel.PSEUDO_COLOR)
			return colorMap.get(value);
		if (model == RasterPresentationModel.DENSITY_SLICING) {
			var entry = colorMap.floorEntry(value);
			return entry == null ? null : entry.getValue();
		}
		return null;
	}

	@Override
	public int hashCode() {
		return Objects.hash(model, colorSpace, bands, colorMap);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof RasterPresentation))
			return false;
		var other = (RasterPresentation) obj;
		return model == other.model && colorSpace == other.colorSpace 
				&& bands.equals(other.bands) && colorMap.equals(other.colorMap);
	}
	
	@Override
	public String toString() {
		var sb = new StringBuilder("RasterPresentation [").append(model);
		if (colorSpace != RasterColorSpace.NONE)
			sb.append(", ").append(colorSpace).append(", ").append(bands);
		if (hasColorMap()) {
			sb.append(", ").append(colorMap.entrySet().stream()
					.map(e -> e.getKey() + "=" + ColorTools.toHexString(e.getValue()))
					.collect(Collectors.joining(", ", "{", "}")));
		}
		return sb.append("]").toString();
	}

}
