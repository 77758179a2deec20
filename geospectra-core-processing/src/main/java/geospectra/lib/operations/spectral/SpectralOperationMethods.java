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

import static geospectra.lib.operations.spectral.SpectralOperationParameters.*;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

import geospectra.lib.operations.ExecutionMode;
import geospectra.lib.operations.OperationMethod;
import geospectra.lib.operations.parameters.OperationParameter;

/**
 * Catalog of spectral operation methods.
 * <p>
 * Spectral index methods read all bands at a location and write a new raster; 
 * they do not support in-place execution.
 */
public final class SpectralOperationMethods {
	
	private static final String PREFIX = "GEOSPECTRA::";
	
	private SpectralOperationMethods() {
		throw new AssertionError();
	}
	
	/**
	 * Inverts every value of the selected bands.
	 */
	public static final SpectralOperationMethod SPECTRAL_INVERSION = SpectralOperationMethod.createSpectralTransformation(
			PREFIX + "213104", "Spectral inversion", 
			"Inverts all spectral values to the opposite.", 
			true, SpectralOperationDomain.BAND_LOCAL, 
			BAND_INDEX, BAND_INDICES);
	
	/**
	 * Keeps a subset of the bands.
	 */
	public static final SpectralOperationMethod SPECTRAL_BAND_FILTERING = SpectralOperationMethod.createSpectralTransformation(
			PREFIX + "213110", "Spectral band filtering", 
			"Keeps the bands selected by index or by spectral domain, and removes all others.", 
			false, SpectralOperationDomain.BAND_LOCAL, EnumSet.of(ExecutionMode.OUT_PLACE),
			BAND_INDEX, BAND_INDICES, BAND_NAME, BAND_NAMES);
	
	/**
	 * Stretches the values of the selected bands linearly over the full value range.
	 */
	public static final SpectralOperationMethod SATURATING_CONTRAST_ENHANCEMENT = SpectralOperationMethod.createSpectralTransformation(
			PREFIX + "213130", "Saturating contrast enhancement", 
			"A linear transformation pulling the values of each band to fill the entire value range.", 
			false, SpectralOperationDomain.BAND_GLOBAL, 
			BAND_INDEX, BAND_INDICES);
	
	public static final SpectralOperationMethod ANTHOCYANIN_REFLECTANCE_INDEX = createIndex("252370", 
			"Anthocyanin reflectance index (ARI) computation",
			"The anthocyanin reflectance index (ARI) is a reflectance measurement that is sensitive to anthocyanin in plant foliage.",
			INDEX_OF_550NM_BAND, INDEX_OF_700NM_BAND, INDEX_OF_800NM_BAND);
	
	public static final SpectralOperationMethod ANTHOCYANIN_REFLECTANCE_INDEX_1 = createIndex("252371", 
			"Anthocyanin reflectance index 1 (ARI1) computation",
			"The anthocyanin reflectance index 1 (ARI1) is a reflectance measurement that is sensitive to anthocyanin in plant foliage.",
			INDEX_OF_550NM_BAND, INDEX_OF_700NM_BAND);
	
	public static final SpectralOperationMethod ANTHOCYANIN_REFLECTANCE_INDEX_2 = createIndex("252372", 
			"Anthocyanin reflectance index 2 (ARI2) computation",
			"The anthocyanin reflectance index 2 (ARI2) is a reflectance measurement that is sensitive to anthocyanin in plant foliage.",
			INDEX_OF_550NM_BAND, INDEX_OF_700NM_BAND, INDEX_OF_800NM_BAND);
	
	public static final SpectralOperationMethod ATMOSPHERICALLY_RESISTANT_VEGETATION_INDEX = createIndex("252031", 
			"Atmospherically resistant vegetation index (ARVI) computation",
			"The atmospherically resistant vegetation index (ARVI) is an enhancement to the NDVI that corrects for atmospheric scattering.",
			INDEX_OF_RED_BAND, INDEX_OF_NEAR_INFRARED_BAND, INDEX_OF_BLUE_BAND);
	
	public static final SpectralOperationMethod CAROTENOID_REFLECTANCE_INDEX = createIndex("252320", 
			"Carotenoid reflectance index (CRIx) computation",
			"The carotenoid reflectance index (CRIx) is a reflectance measurement that is sensitive to carotenoid pigments in plant foliage.",
			INDEX_OF_510NM_BAND, INDEX_OF_550NM_BAND, INDEX_OF_700NM_BAND);
	
	public static final SpectralOperationMethod CAROTENOID_REFLECTANCE_INDEX_1 = createIndex("252321", 
			"Carotenoid reflectance index 1 (CRI1) computation",
			"The carotenoid reflectance index 1 (CRI1) is a reflectance measurement that is sensitive to carotenoid pigments in plant foliage.",
			INDEX_OF_510NM_BAND, INDEX_OF_550NM_BAND);
	
	public static final SpectralOperationMethod CAROTENOID_REFLECTANCE_INDEX_2 = createIndex("252322", 
			"Carotenoid reflectance index 2 (CRI2) computation",
			"The carotenoid reflectance index 2 (CRI2) is a reflectance measurement that is sensitive to carotenoid pigments in plant foliage.",
			INDEX_OF_510NM_BAND, INDEX_OF_700NM_BAND);
	
	public static final SpectralOperationMethod CELLULOSE_ABSORPTION_INDEX = createIndex("252231", 
			"Cellulose absorption index (CAI) computation",
			"The cellulose absorption index (CAI) quantifies exposed surfaces that contain dried plant material.",
			INDEX_OF_2000NM_BAND, INDEX_OF_2100NM_BAND, INDEX_OF_2200NM_BAND);
	
	public static final SpectralOperationMethod ENHANCED_VEGETATION_INDEX = createIndex("252061", 
			"Enhanced vegetation index (EVI) computation",
			"The enhanced vegetation index (EVI) is an optimized index designed to enhance the vegetation signal.",
			INDEX_OF_RED_BAND, INDEX_OF_NEAR_INFRARED_BAND, INDEX_OF_BLUE_BAND);
	
	public static final SpectralOperationMethod MODIFIED_RED_EDGE_NORMALIZED_DIFFERENCE_VEGETATION_INDEX = createIndex("252751", 
			"Modified red edge normalized difference vegetation index (mNDVI705) computation",
			"The modified red edge normalized difference vegetation index is a modification of the NDVI705.",
			INDEX_OF_445NM_BAND, INDEX_OF_705NM_BAND, INDEX_OF_750NM_BAND);
	
	public static final SpectralOperationMethod MODIFIED_RED_EDGE_SIMPLE_RATIO_INDEX = createIndex("252752", 
			"Modified red edge simple ratio index (mSR705) computation",
			"The modified red edge simple ratio index is a modification of the SR.",
			INDEX_OF_445NM_BAND, INDEX_OF_705NM_BAND, INDEX_OF_750NM_BAND);
	
	public static final SpectralOperationMethod MOISTURE_STRESS_INDEX = createIndex("252350", 
			"Moisture stress index (MSI) computation",
			"The moisture stress index (MSI) is a reflectance measurement that is sensitive to increases in leaf water content.",
			INDEX_OF_819NM_BAND, INDEX_OF_1599NM_BAND);
	
	public static final SpectralOperationMethod NORMALIZED_DIFFERENCE_INDEX = createIndex("252011", 
			"Normalized difference index (NDxI) computation",
			"Normalized difference indices for soil, vegetation and water computed in a single pass.",
			INDEX_OF_RED_BAND, INDEX_OF_NEAR_INFRARED_BAND, INDEX_OF_SHORT_WAVELENGTH_INFRARED_BAND);
	
	public static final SpectralOperationMethod NORMALIZED_DIFFERENCE_INFRARED_INDEX = createIndex("252015", 
			"Normalized difference infrared index (NDII) computation",
			"The normalized difference infrared index (NDII) is sensitive to changes in the water content of plant canopies.",
			INDEX_OF_819NM_BAND, INDEX_OF_1649NM_BAND);
	
	public static final SpectralOperationMethod NORMALIZED_DIFFERENCE_LIGNIN_INDEX = createIndex("252022", 
			"Normalized difference lignin index (NDLI) computation",
			"The normalized difference lignin index is designed to estimate the relative amounts of lignin contained in vegetation canopies.",
			INDEX_OF_1680NM_BAND, INDEX_OF_1754NM_BAND);
	
	public static final SpectralOperationMethod NORMALIZED_DIFFERENCE_NITROGEN_INDEX = createIndex("252023", 
			"Normalized difference nitrogen index (NDNI) computation",
			"The normalized difference nitrogen index is sensitive to changing nitrogen status when the canopy is green.",
			INDEX_OF_1510NM_BAND, INDEX_OF_1680NM_BAND);
	
	public static final SpectralOperationMethod NORMALIZED_DIFFERENCE_SOIL_INDEX = createIndex("252012", 
			"Normalized difference soil index (NDSI) computation",
			"The normalized difference soil index models the ratio of the short-wavelength and near infrared bands.",
			INDEX_OF_NEAR_INFRARED_BAND, INDEX_OF_SHORT_WAVELENGTH_INFRARED_BAND);
	
	public static final SpectralOperationMethod NORMALIZED_DIFFERENCE_VEGETATION_INDEX = createIndex("252013", 
			"Normalized difference vegetation index (NDVI) computation",
			"The normalized difference vegetation index models the ratio of the near infrared and red bands.",
			INDEX_OF_RED_BAND, INDEX_OF_NEAR_INFRARED_BAND);
	
	public static final SpectralOperationMethod NORMALIZED_DIFFERENCE_WATER_INDEX = createIndex("252014", 
			"Normalized difference water index (NDWI) computation",
			"The normalized difference water index models the ratio of the short-wavelength infrared and red bands.",
			INDEX_OF_RED_BAND, INDEX_OF_SHORT_WAVELENGTH_INFRARED_BAND);
	
	public static final SpectralOperationMethod PHOTOCHEMICAL_REFLECTANCE_INDEX = createIndex("252301", 
			"Photochemical reflectance index (PRI) computation",
			"The photochemical reflectance index takes advantage of the changes to carotenoid pigments.",
			INDEX_OF_531NM_BAND, INDEX_OF_570NM_BAND);
	
	public static final SpectralOperationMethod PLANT_SENESCENCE_REFLECTANCE_INDEX = createIndex("252302", 
			"Plant senescence reflectance index (PSRI) computation",
			"The plant senescence reflectance index is designed to maximize sensitivity to the ratio of bulk carotenoids to chlorophyll.",
			INDEX_OF_500NM_BAND, INDEX_OF_680NM_BAND, INDEX_OF_750NM_BAND);
	
	public static final SpectralOperationMethod RED_EDGE_NORMALIZED_DIFFERENCE_VEGETATION_INDEX = createIndex("252750", 
			"Red edge normalized difference vegetation index (NDVI705) computation",
			"The red edge normalized difference vegetation index is a modification of the normalized difference vegetation index.",
			INDEX_OF_705NM_BAND, INDEX_OF_750NM_BAND);
	
	public static final SpectralOperationMethod SIMPLE_RATIO_INDEX = createIndex("252070", 
			"Simple ratio (SR) index computation",
			"The simple ratio index is a well known and often used spectral vegetation index.",
			INDEX_OF_RED_BAND, INDEX_OF_NEAR_INFRARED_BAND);
	
	public static final SpectralOperationMethod SOIL_ADJUSTED_VEGETATION_INDEX = createIndex("252033", 
			"Soil adjusted vegetation index (SAVI) computation",
			"The soil adjusted vegetation index reduces the influence of soil brightness on the NDVI.",
			INDEX_OF_RED_BAND, INDEX_OF_NEAR_INFRARED_BAND);
	
	public static final SpectralOperationMethod STRUCTURE_INSENSITIVE_PIGMENT_INDEX = createIndex("252308", 
			"Structure insensitive pigment index (SIPI) computation",
			"The structure insensitive pigment index is suited to areas with high variability in canopy structure or leaf area index.",
			INDEX_OF_445NM_BAND, INDEX_OF_680NM_BAND, INDEX_OF_800NM_BAND);
	
	public static final SpectralOperationMethod SUM_GREEN_INDEX = createIndex("252205", 
			"Sum green index computation",
			"The sum green index is used to detect changes in vegetation greenness.",
			INDICES_OF_BANDS_BETWEEN_500NM_600NM);
	
	public static final SpectralOperationMethod VOGELMANN_RED_EDGE_INDEX = createIndex("252710", 
			"Vogelmann red edge index (VOGx) computation",
			"The Vogelmann red edge indices (VOG1, VOG2, VOG3) computed in a single pass.",
			INDEX_OF_715NM_BAND, INDEX_OF_720NM_BAND, INDEX_OF_726NM_BAND, INDEX_OF_734NM_BAND, INDEX_OF_740NM_BAND, INDEX_OF_747NM_BAND);
	
	public static final SpectralOperationMethod VOGELMANN_RED_EDGE_INDEX_1 = createIndex("252711", 
			"Vogelmann red edge index 1 (VOG1) computation",
			"The Vogelmann red edge index 1 is a narrowband reflectance measurement.",
			INDEX_OF_720NM_BAND, INDEX_OF_740NM_BAND);
	
	public static final SpectralOperationMethod VOGELMANN_RED_EDGE_INDEX_2 = createIndex("252712", 
			"Vogelmann red edge index 2 (VOG2) computation",
			"The Vogelmann red edge index 2 is a narrowband reflectance measurement.",
			INDEX_OF_715NM_BAND, INDEX_OF_726NM_BAND, INDEX_OF_734NM_BAND, INDEX_OF_747NM_BAND);
	
	public static final SpectralOperationMethod VOGELMANN_RED_EDGE_INDEX_3 = createIndex("252713", 
			"Vogelmann red edge index 3 (VOG3) computation",
			"The Vogelmann red edge index 3 is a narrowband reflectance measurement.",
			INDEX_OF_715NM_BAND, INDEX_OF_720NM_BAND, INDEX_OF_734NM_BAND, INDEX_OF_747NM_BAND);
	
	public static final SpectralOperationMethod WATER_BAND_INDEX = createIndex("252075", 
			"Water band index (WBI) computation",
			"The water band index (WBI) is a reflectance measurement that is sensitive to changes in canopy water content.",
			INDEX_OF_900NM_BAND, INDEX_OF_970NM_BAND);
	
	private static SpectralOperationMethod createIndex(String id, String name, String remarks, OperationParameter<?>... parameters) {
		return SpectralOperationMethod.createSpectralTransformation(PREFIX + id, name, remarks, false, 
				SpectralOperationDomain.LOCAL, EnumSet.of(ExecutionMode.OUT_PLACE), parameters);
	}
	
	
	private static final List<SpectralOperationMethod> ALL = List.of(
			SPECTRAL_INVERSION, SPECTRAL_BAND_FILTERING,
			SATURATING_CONTRAST_ENHANCEMENT, ANTHOCYANIN_REFLECTANCE_INDEX,
			ANTHOCYANIN_REFLECTANCE_INDEX_1, ANTHOCYANIN_REFLECTANCE_INDEX_2,
			ATMOSPHERICALLY_RESISTANT_VEGETATION_INDEX, CAROTENOID_REFLECTANCE_INDEX,
			CAROTENOID_REFLECTANCE_INDEX_1, CAROTENOID_REFLECTANCE_INDEX_2,
			CELLULOSE_ABSORPTION_INDEX, ENHANCED_VEGETATION_INDEX,
			MODIFIED_RED_EDGE_NORMALIZED_DIFFERENCE_VEGETATION_INDEX, MODIFIED_RED_EDGE_SIMPLE_RATIO_INDEX,
			MOISTURE_STRESS_INDEX, NORMALIZED_DIFFERENCE_INDEX,
			NORMALIZED_DIFFERENCE_INFRARED_INDEX, NORMALIZED_DIFFERENCE_LIGNIN_INDEX,
			NORMALIZED_DIFFERENCE_NITROGEN_INDEX, NORMALIZED_DIFFERENCE_SOIL_INDEX,
			NORMALIZED_DIFFERENCE_VEGETATION_INDEX, NORMALIZED_DIFFERENCE_WATER_INDEX,
			PHOTOCHEMICAL_REFLECTANCE_INDEX, PLANT_SENESCENCE_REFLECTANCE_INDEX,
			RED_EDGE_NORMALIZED_DIFFERENCE_VEGETATION_INDEX, SIMPLE_RATIO_INDEX,
			SOIL_ADJUSTED_VEGETATION_INDEX, STRUCTURE_INSENSITIVE_PIGMENT_INDEX,
			SUM_GREEN_INDEX, VOGELMANN_RED_EDGE_INDEX,
			VOGELMANN_RED_EDGE_INDEX_1, VOGELMANN_RED_EDGE_INDEX_2,
			VOGELMANN_RED_EDGE_INDEX_3, WATER_BAND_INDEX);
	
	/**
	 * Get all methods in the catalog, each once.
	 * @return an immutable list
	 */
	public static List<SpectralOperationMethod> all() {
		return ALL;
	}
	
	/**
	 * Find the methods whose identifier matches a regular expression.
	 * @param pattern regular expression, matched anywhere in the identifier
	 * @return the matching methods, possibly empty
	 */
	public static List<SpectralOperationMethod> fromIdentifier(String pattern) {
		return find(pattern, OperationMethod::getIdentifier);
	}
	
	/**
	 * Find the methods whose name matches a regular expression.
	 * @param pattern regular expression, matched anywhere in the name
	 * @return the matching methods, possibly empty
	 */
	public static List<SpectralOperationMethod> fromName(String pattern) {
		return find(pattern, OperationMethod::getName);
	}
	
	private static List<SpectralOperationMethod> find(String pattern, Function<OperationMethod, String> property) {
		if (pattern == null)
			return Collections.emptyList();
		Pattern regex;
		try {
			regex = Pattern.compile(pattern);
		} catch (PatternSyntaxException e) {
			regex = Pattern.compile(Pattern.quote(pattern));
		}
		var compiled = regex;
		return all().stream()
				.filter(m -> compiled.matcher(property.apply(m)).find())
				.collect(Collectors.toUnmodifiableList());
	}

}
