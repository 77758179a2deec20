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

package geospectra.lib.imaging;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Imaging metadata of a raster: the spectral domain and wavelength range of each band, in band order.
 * <p>
 * Instances are immutable.
 */
public final class RasterImaging {
	
	private final String device;
	private final List<RasterImagingBand> bands;
	
	private RasterImaging(String device, List<RasterImagingBand> bands) {
		this.device = device;
		this.bands = Collections.unmodifiableList(new ArrayList<>(bands));
	}
	
	/**
	 * Create imaging metadata.
	 * @param device name of the imaging device, may be null
	 * @param bands band metadata in band order
	 * @return
	 */
	public static RasterImaging create(String device, List<RasterImagingBand> bands) {
		if (bands == null || bands.isEmpty())
			throw new IllegalArgumentException("Imaging requires at least one band");
		if (bands.contains(null))
			throw new IllegalArgumentException("Imaging bands must not be null");
		return new RasterImaging(device, bands);
	}
	
	/**
	 * Create imaging metadata with one band per spectral domain, using nominal wavelength ranges.
	 * @param domains
	 * @return
	 */
	public static RasterImaging fromDomains(SpectralDomain... domains) {
		return create(null, Arrays.stream(domains).map(RasterImagingBand::create).collect(Collectors.toList()));
	}
	
	/**
	 * Create imaging metadata with one band per wavelength range.
	 * @param ranges
	 * @return
	 */
	public static RasterImaging fromRanges(SpectralRange... ranges) {
		var list = new ArrayList<RasterImagingBand>();
		for (var range : ranges)
			list.add(RasterImagingBand.create(range.toString(), SpectralDomain.UNDEFINED, range));
		return create(null, list);
	}
	
	public String getDevice() {
		return device;
	}
	
	public int getNumberOfBands() {
		return bands.size();
	}
	
	public List<RasterImagingBand> getBands() {
		return bands;
	}
	
	public RasterImagingBand getBand(int index) {
		return bands.get(index);
	}
	
	/**
	 * Spectral domains in band order.
	 * @return
	 */
	public List<SpectralDomain> getSpectralDomains() {
		return bands.stream().map(RasterImagingBand::getSpectralDomain).collect(Collectors.toUnmodifiableList());
	}
	
	/**
	 * Wavelength ranges in band order; unknown ranges are null.
	 * @return
	 */
	public List<SpectralRange> getSpectralRanges() {
		return Collections.unmodifiableList(bands.stream().map(RasterImagingBand::getSpectralRange).collect(Collectors.toList()));
	}
	
	/**
	 * Index of the first band recording a spectral domain.
	 * @param domain
	 * @return the band index, or -1 if no band matches
	 */
	public int indexOf(SpectralDomain domain) {
		for (int i = 0; i < bands.size(); i++) {
			if (bands.get(i).getSpectralDomain() == domain)
				return i;
		}
		return -1;
	}
	
	/**
	 * Index of the first band whose wavelength range contains a wavelength, limits included.
	 * @param wavelength in nanometres
	 * @return the band index, or -1 if no band matches
	 */
	public int indexOfWavelength(double wavelength) {
		for (int i = 0; i < bands.size(); i++) {
			var range = bands.get(i).getSpectralRange();
			if (range != null && range.contains(wavelength))
				return i;
		}
		return -1;
	}
	
	/**
	 * Index of the first band with a given name, ignoring case.
	 * @param name
	 * @return the band index, or -1 if no band matches
	 */
	public int indexOfName(String name) {
		for (int i = 0; i < bands.size(); i++) {
			if (bands.get(i).getName() != null && bands.get(i).getName().equalsIgnoreCase(name))
				return i;
		}
		return -1;
	}
	
	/**
	 * Indices of all bands whose wavelength range overlaps {@code [minWavelength, maxWavelength]}.
	 * @param minWavelength
	 * @param maxWavelength
	 * @return ascending band indices, possibly empty
	 */
	public int[] indicesBetween(double minWavelength, double maxWavelength) {
		var list = new ArrayList<Integer>();
		for (int i = 0; i < bands.size(); i++) {
			var range = bands.get(i).getSpectralRange();
			if (range != null && range.overlaps(minWavelength, maxWavelength))
				list.add(i);
		}
		return list.stream().mapToInt(Integer::intValue).toArray();
	}
	
	/**
	 * Create imaging metadata keeping only the specified bands, in the order given.
	 * @param bandIndices
	 * @return
	 * @throws IndexOutOfBoundsException if an index is not a valid band
	 */
	public RasterImaging filter(int... bandIndices) {
		var list = new ArrayList<RasterImagingBand>();
		for (int i : bandIndices)
			list.add(bands.get(i));
		return create(device, list);
	}
	
	@Override
	public String toString() {
		return "RasterImaging [" + (device == null ? "" : device + ", ") + bands.size() + " bands: " 
				+ bands.stream().map(RasterImagingBand::getName).collect(Collectors.joining(", ")) + "]";
	}

}
