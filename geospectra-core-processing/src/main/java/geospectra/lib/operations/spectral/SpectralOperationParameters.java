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

package geospectra.lib.operations.spectral;

import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import geospectra.lib.imaging.SpectralDomain;
import geospectra.lib.operations.parameters.OperationParameter;
import geospectra.lib.operations.parameters.ParameterConditions;

/**
 * Catalog of the parameters used by spectral operations.
 * <p>
 * Band index parameters are optional with no default value: an operation that needs the band 
 * locates it from imaging metadata when no index is given.
 */
public final class SpectralOperationParameters {
	
	private final static Logger logger = LoggerFactory.getLogger(SpectralOperationParameters.class);
	
	private static final String PREFIX = "GEOSPECTRA::";
	
	private SpectralOperationParameters() {
		throw new AssertionError();
	}
	
	/**
	 * Zero-based index of the band an operation is executed on.
	 */
	public static final OperationParameter<Integer> BAND_INDEX = OperationParameter.createOptionalParameter(
			PREFIX + "223001", "Band index", 
			"The zero-based index of the band the operation should be executed on.", 
			Integer.class, null, ParameterConditions.isNotNegative());
	
	/**
	 * Zero-based indices of the bands an operation is executed on.
	 */
	public static final OperationParameter<int[]> BAND_INDICES = OperationParameter.createOptionalParameter(
			PREFIX + "223002", "Band indices", 
			"The zero-based indices of the bands the operation should be executed on.", 
			int[].class, null, ParameterConditions.areNotNegative(), ParameterConditions.isNotEmptyIntArray());
	
	/**
	 * Spectral domain of the band an operation is executed on.
	 */
	public static final OperationParameter<SpectralDomain> BAND_NAME = OperationParameter.createOptionalParameter(
			PREFIX + "223003", "Band name", 
			"The spectral domain of the band the operation should be executed on.", 
			SpectralDomain.class, null);
	
	/**
	 * Spectral domains of the bands an operation is executed on.
	 */
	public static final OperationParameter<SpectralDomain[]> BAND_NAMES = OperationParameter.createOptionalParameter(
			PREFIX + "223004", "Band names", 
			"The spectral domains of the bands the operation should be executed on.", 
			SpectralDomain[].class, null, ParameterConditions.isNotEmpty());
	
	public static final OperationParameter<Integer> INDEX_OF_VISIBLE_BAND = createDomainBandIndex("223010", "visible", SpectralDomain.VISIBLE);
	public static final OperationParameter<Integer> INDEX_OF_RED_BAND = createDomainBandIndex("223011", "red", SpectralDomain.RED);
	public static final OperationParameter<Integer> INDEX_OF_GREEN_BAND = createDomainBandIndex("223012", "green", SpectralDomain.GREEN);
	public static final OperationParameter<Integer> INDEX_OF_BLUE_BAND = createDomainBandIndex("223013", "blue", SpectralDomain.BLUE);
	public static final OperationParameter<Integer> INDEX_OF_ORANGE_BAND = createDomainBandIndex("223014", "orange", SpectralDomain.ORANGE);
	public static final OperationParameter<Integer> INDEX_OF_YELLOW_BAND = createDomainBandIndex("223015", "yellow", SpectralDomain.YELLOW);
	public static final OperationParameter<Integer> INDEX_OF_VIOLET_BAND = createDomainBandIndex("223016", "violet", SpectralDomain.VIOLET);
	public static final OperationParameter<Integer> INDEX_OF_ULTRAVIOLET_BAND = createDomainBandIndex("223020", "ultraviolet (UV)", SpectralDomain.ULTRAVIOLET);
	public static final OperationParameter<Integer> INDEX_OF_INFRARED_BAND = createDomainBandIndex("223030", "infrared (IR)", SpectralDomain.INFRARED);
	public static final OperationParameter<Integer> INDEX_OF_NEAR_INFRARED_BAND = createDomainBandIndex("223031", "near infrared (NIR)", SpectralDomain.NEAR_INFRARED);
	public static final OperationParameter<Integer> INDEX_OF_SHORT_WAVELENGTH_INFRARED_BAND = createDomainBandIndex("223032", "short-wavelength infrared (SWIR)", SpectralDomain.SHORT_WAVELENGTH_INFRARED);
	public static final OperationParameter<Integer> INDEX_OF_MIDDLE_WAVELENGTH_INFRARED_BAND = createDomainBandIndex("223033", "middle-wavelength infrared (MWIR)", SpectralDomain.MIDDLE_WAVELENGTH_INFRARED);
	public static final OperationParameter<Integer> INDEX_OF_LONG_WAVELENGTH_INFRARED_BAND = createDomainBandIndex("223034", "long-wavelength infrared (LWIR)", SpectralDomain.LONG_WAVELENGTH_INFRARED);
	public static final OperationParameter<Integer> INDEX_OF_FAR_INFRARED_BAND = createDomainBandIndex("223035", "far infrared (FIR)", SpectralDomain.FAR_INFRARED);
	
	public static final OperationParameter<Integer> INDEX_OF_445NM_BAND = createWavelengthBandIndex(445);
	public static final OperationParameter<Integer> INDEX_OF_500NM_BAND = createWavelengthBandIndex(500);
	public static final OperationParameter<Integer> INDEX_OF_510NM_BAND = createWavelengthBandIndex(510);
	public static final OperationParameter<Integer> INDEX_OF_531NM_BAND = createWavelengthBandIndex(531);
	public static final OperationParameter<Integer> INDEX_OF_550NM_BAND = createWavelengthBandIndex(550);
	public static final OperationParameter<Integer> INDEX_OF_570NM_BAND = createWavelengthBandIndex(570);
	public static final OperationParameter<Integer> INDEX_OF_680NM_BAND = createWavelengthBandIndex(680);
	public static final OperationParameter<Integer> INDEX_OF_700NM_BAND = createWavelengthBandIndex(700);
	public static final OperationParameter<Integer> INDEX_OF_705NM_BAND = createWavelengthBandIndex(705);
	public static final OperationParameter<Integer> INDEX_OF_715NM_BAND = createWavelengthBandIndex(715);
	public static final OperationParameter<Integer> INDEX_OF_720NM_BAND = createWavelengthBandIndex(720);
	public static final OperationParameter<Integer> INDEX_OF_726NM_BAND = createWavelengthBandIndex(726);
	public static final OperationParameter<Integer> INDEX_OF_734NM_BAND = createWavelengthBandIndex(734);
	public static final OperationParameter<Integer> INDEX_OF_740NM_BAND = createWavelengthBandIndex(740);
	public static final OperationParameter<Integer> INDEX_OF_747NM_BAND = createWavelengthBandIndex(747);
	public static final OperationParameter<Integer> INDEX_OF_750NM_BAND = createWavelengthBandIndex(750);
	public static final OperationParameter<Integer> INDEX_OF_800NM_BAND = createWavelengthBandIndex(800);
	public static final OperationParameter<Integer> INDEX_OF_819NM_BAND = createWavelengthBandIndex(819);
	public static final OperationParameter<Integer> INDEX_OF_900NM_BAND = createWavelengthBandIndex(900);
	public static final OperationParameter<Integer> INDEX_OF_970NM_BAND = createWavelengthBandIndex(970);
	public static final OperationParameter<Integer> INDEX_OF_1510NM_BAND = createWavelengthBandIndex(1510);
	public static final OperationParameter<Integer> INDEX_OF_1599NM_BAND = createWavelengthBandIndex(1599);
	public static final OperationParameter<Integer> INDEX_OF_1649NM_BAND = createWavelengthBandIndex(1649);
	public static final OperationParameter<Integer> INDEX_OF_1680NM_BAND = createWavelengthBandIndex(1680);
	public static final OperationParameter<Integer> INDEX_OF_1754NM_BAND = createWavelengthBandIndex(1754);
	public static final OperationParameter<Integer> INDEX_OF_2000NM_BAND = createWavelengthBandIndex(2000);
	public static final OperationParameter<Integer> INDEX_OF_2100NM_BAND = createWavelengthBandIndex(2100);
	public static final OperationParameter<Integer> INDEX_OF_2200NM_BAND = createWavelengthBandIndex(2200);
	
	/**
	 * Zero-based indices of all bands recording wavelengths between 500 and 600 nm.
	 */
	public static final OperationParameter<int[]> INDICES_OF_BANDS_BETWEEN_500NM_600NM = OperationParameter.createOptionalParameter(
			PREFIX + "223300", "Indices of bands between 500 and 600 nm", 
			"The zero-based indices of the spectral bands recording wavelengths between 500 and 600 nm.", 
			int[].class, null, ParameterConditions.areNotNegative(), ParameterConditions.isNotEmptyIntArray());
	
	private static OperationParameter<Integer> createDomainBandIndex(String id, String name, SpectralDomain domain) {
		return OperationParameter.createOptionalParameter(PREFIX + id, "Index of " + name + " band", 
				"The zero-based index of the " + name + " spectral band within the raster.",
				Integer.class, null, ParameterConditions.isNotNegative())
				.withAliases(domain.name());
	}
	
	private static OperationParameter<Integer> createWavelengthBandIndex(int nm) {
		return OperationParameter.createOptionalParameter(PREFIX + String.format("224%04d", nm), "Index of " + nm + " nm band", 
				"The zero-based index of the spectral band recording the wavelength of " + nm + " nm.",
				Integer.class, null, ParameterConditions.isNotNegative())
				.withAliases(nm + "nm");
	}
	
	
	private static final List<OperationParameter<?>> ALL = List.of(
			BAND_INDEX, BAND_INDICES, BAND_NAME,
			BAND_NAMES,
			INDEX_OF_VISIBLE_BAND, INDEX_OF_RED_BAND, INDEX_OF_GREEN_BAND,
			INDEX_OF_BLUE_BAND, INDEX_OF_ORANGE_BAND, INDEX_OF_YELLOW_BAND,
			INDEX_OF_VIOLET_BAND, INDEX_OF_ULTRAVIOLET_BAND, INDEX_OF_INFRARED_BAND,
			INDEX_OF_NEAR_INFRARED_BAND, INDEX_OF_SHORT_WAVELENGTH_INFRARED_BAND, INDEX_OF_MIDDLE_WAVELENGTH_INFRARED_BAND,
			INDEX_OF_LONG_WAVELENGTH_INFRARED_BAND, INDEX_OF_FAR_INFRARED_BAND,
			INDEX_OF_445NM_BAND, INDEX_OF_500NM_BAND, INDEX_OF_510NM_BAND,
			INDEX_OF_531NM_BAND, INDEX_OF_550NM_BAND, INDEX_OF_570NM_BAND,
			INDEX_OF_680NM_BAND, INDEX_OF_700NM_BAND, INDEX_OF_705NM_BAND,
			INDEX_OF_715NM_BAND, INDEX_OF_720NM_BAND, INDEX_OF_726NM_BAND,
			INDEX_OF_734NM_BAND, INDEX_OF_740NM_BAND, INDEX_OF_747NM_BAND,
			INDEX_OF_750NM_BAND, INDEX_OF_800NM_BAND, INDEX_OF_819NM_BAND,
			INDEX_OF_900NM_BAND, INDEX_OF_970NM_BAND, INDEX_OF_1510NM_BAND,
			INDEX_OF_1599NM_BAND, INDEX_OF_1649NM_BAND, INDEX_OF_1680NM_BAND,
			INDEX_OF_1754NM_BAND, INDEX_OF_2000NM_BAND, INDEX_OF_2100NM_BAND,
			INDEX_OF_2200NM_BAND,
			INDICES_OF_BANDS_BETWEEN_500NM_600NM);
	
	/**
	 * Get all parameters in the catalog, each once.
	 * @return an immutable list
	 */
	public static List<OperationParameter<?>> all() {
		return ALL;
	}
	
	/**
	 * Find the parameters whose identifier matches a regular expression.
	 * @param pattern regular expression, matched anywhere in the identifier
	 * @return the matching parameters, possibly empty
	 */
	public static List<OperationParameter<?>> fromIdentifier(String pattern) {
		return find(pattern, OperationParameter::getIdentifier);
	}
	
	/**
	 * Find the parameters whose name matches a regular expression.
	 * @param pattern regular expression, matched anywhere in the name
	 * @return the matching parameters, possibly empty
	 */
	public static List<OperationParameter<?>> fromName(String pattern) {
		return find(pattern, OperationParameter::getName);
	}
	
	private static List<OperationParameter<?>> find(String pattern, Function<OperationParameter<?>, String> property) {
		if (pattern == null)
			return Collections.emptyList();
		Pattern regex;
		try {
			regex = Pattern.compile(pattern);
		} catch (PatternSyntaxException e) {
			logger.debug("Searching for '{}' as literal text: {}", pattern, e.getDescription());
			regex = Pattern.compile(Pattern.quote(pattern));
		}
		var compiled = regex;
		return all().stream()
				.filter(p -> compiled.matcher(property.apply(p)).find())
				.collect(Collectors.toUnmodifiableList());
	}

}
