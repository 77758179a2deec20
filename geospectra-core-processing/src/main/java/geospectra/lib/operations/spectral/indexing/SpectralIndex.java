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

import static geospectra.lib.operations.spectral.SpectralOperationParameters.*;
import static geospectra.lib.operations.spectral.indexing.BandRequirement.between;
import static geospectra.lib.operations.spectral.indexing.BandRequirement.of;
import static geospectra.lib.operations.spectral.indexing.IndexFormulas.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import geospectra.lib.geometry.SpectralGeometry;
import geospectra.lib.imaging.SpectralDomain;
import geospectra.lib.operations.OperationArgumentException;
import geospectra.lib.operations.OperationMethod;
import geospectra.lib.operations.parameters.ParameterBindings;
import geospectra.lib.operations.spectral.SpectralOperationMethod;
import geospectra.lib.operations.spectral.SpectralOperationMethods;
import geospectra.lib.presentation.RasterPresentation;

/**
 * Spectral indices that can be computed by {@link SpectralIndexComputation}.
 * <p>
 * Each index reads the bands of its requirements, in order, and computes one or more floating point bands. 
 * Indices computing several bands list them in the order they are written.
 */
public enum SpectralIndex {
	
	/**
	 * Anthocyanin reflectance indices; band 0 is ARI1, band 1 is ARI2.
	 */
	ARI(SpectralOperationMethods.ANTHOCYANIN_REFLECTANCE_INDEX, 2, grayscale(),
			v -> new double[] { reciprocalDifference(v[0], v[1]), v[2] * reciprocalDifference(v[0], v[1]) },
			of(INDEX_OF_550NM_BAND, 550), of(INDEX_OF_700NM_BAND, 700), of(INDEX_OF_800NM_BAND, 800)),
	
	/**
	 * {@code 1/R550 - 1/R700}
	 */
	ARI1(SpectralOperationMethods.ANTHOCYANIN_REFLECTANCE_INDEX_1, 1, grayscale(),
			v -> new double[] { reciprocalDifference(v[0], v[1]) },
			of(INDEX_OF_550NM_BAND, 550), of(INDEX_OF_700NM_BAND, 700)),
	
	/**
	 * {@code R800 * (1/R550 - 1/R700)}
	 */
	ARI2(SpectralOperationMethods.ANTHOCYANIN_REFLECTANCE_INDEX_2, 1, grayscale(),
			v -> new double[] { v[2] * reciprocalDifference(v[0], v[1]) },
			of(INDEX_OF_550NM_BAND, 550), of(INDEX_OF_700NM_BAND, 700), of(INDEX_OF_800NM_BAND, 800)),
	
	/**
	 * {@code (NIR - (2 * RED - BLUE)) / (NIR + (2 * RED - BLUE))}
	 */
	ARVI(SpectralOperationMethods.ATMOSPHERICALLY_RESISTANT_VEGETATION_INDEX, 1, grayscale(),
			v -> new double[] { normalizedDifference(v[1], 2 * v[0] - v[2]) },
			of(INDEX_OF_RED_BAND, SpectralDomain.RED), of(INDEX_OF_NEAR_INFRARED_BAND, SpectralDomain.NEAR_INFRARED), 
			of(INDEX_OF_BLUE_BAND, SpectralDomain.BLUE)),
	
	/**
	 * {@code 0.5 * (R2000 + R2200) - R2100}
	 */
	CAI(SpectralOperationMethods.CELLULOSE_ABSORPTION_INDEX, 1, grayscale(),
			v -> new double[] { 0.5 * (v[0] + v[2]) - v[1] },
			of(INDEX_OF_2000NM_BAND, 2000), of(INDEX_OF_2100NM_BAND, 2100), of(INDEX_OF_2200NM_BAND, 2200)),
	
	/**
	 * Carotenoid reflectance indices; band 0 is CRI1, band 1 is CRI2.
	 */
	CRI(SpectralOperationMethods.CAROTENOID_REFLECTANCE_INDEX, 2, grayscale(),
			v -> new double[] { reciprocalDifference(v[0], v[1]), reciprocalDifference(v[0], v[2]) },
			of(INDEX_OF_510NM_BAND, 510), of(INDEX_OF_550NM_BAND, 550), of(INDEX_OF_700NM_BAND, 700)),
	
	/**
	 * {@code 1/R510 - 1/R550}
	 */
	CRI1(SpectralOperationMethods.CAROTENOID_REFLECTANCE_INDEX_1, 1, grayscale(),
			v -> new double[] { reciprocalDifference(v[0], v[1]) },
			of(INDEX_OF_510NM_BAND, 510), of(INDEX_OF_550NM_BAND, 550)),
	
	/**
	 * {@code 1/R510 - 1/R700}
	 */
	CRI2(SpectralOperationMethods.CAROTENOID_REFLECTANCE_INDEX_2, 1, grayscale(),
			v -> new double[] { reciprocalDifference(v[0], v[1]) },
			of(INDEX_OF_510NM_BAND, 510), of(INDEX_OF_700NM_BAND, 700)),
	
	/**
	 * {@code 2.5 * (NIR - RED) / (NIR + 6 * RED - 7.5 * BLUE + 1)}
	 */
	EVI(SpectralOperationMethods.ENHANCED_VEGETATION_INDEX, 1, grayscale(),
			v -> new double[] { ratio(2.5 * (v[1] - v[0]), v[1] + 6 * v[0] - 7.5 * v[2] + 1) },
			of(INDEX_OF_RED_BAND, SpectralDomain.RED), of(INDEX_OF_NEAR_INFRARED_BAND, SpectralDomain.NEAR_INFRARED), 
			of(INDEX_OF_BLUE_BAND, SpectralDomain.BLUE)),
	
	/**
	 * {@code (R750 - R705) / (R750 + R705 - 2 * R445)}
	 */
	MNDVI705(SpectralOperationMethods.MODIFIED_RED_EDGE_NORMALIZED_DIFFERENCE_VEGETATION_INDEX, 1, grayscale(),
			v -> new double[] { ratio(v[2] - v[1], v[2] + v[1] - 2 * v[0]) },
			of(INDEX_OF_445NM_BAND, 445), of(INDEX_OF_705NM_BAND, 705), of(INDEX_OF_750NM_BAND, 750)),
	
	/**
	 * {@code (R750 - R445) / (R705 - R445)}
	 */
	MSR705(SpectralOperationMethods.MODIFIED_RED_EDGE_SIMPLE_RATIO_INDEX, 1, grayscale(),
			v -> new double[] { ratio(v[2] - v[0], v[1] - v[0]) },
			of(INDEX_OF_445NM_BAND, 445), of(INDEX_OF_705NM_BAND, 705), of(INDEX_OF_750NM_BAND, 750)),
	
	/**
	 * {@code R1599 / R819}
	 */
	MSI(SpectralOperationMethods.MOISTURE_STRESS_INDEX, 1, grayscale(),
			v -> new double[] { ratio(v[1], v[0]) },
			of(INDEX_OF_819NM_BAND, 819), of(INDEX_OF_1599NM_BAND, 1599)),
	
	/**
	 * {@code (R819 - R1649) / (R819 + R1649)}
	 */
	NDII(SpectralOperationMethods.NORMALIZED_DIFFERENCE_INFRARED_INDEX, 1, grayscale(),
			v -> new double[] { normalizedDifference(v[0], v[1]) },
			of(INDEX_OF_819NM_BAND, 819), of(INDEX_OF_1649NM_BAND, 1649)),
	
	/**
	 * {@code (log(1/R1754) - log(1/R1680)) / (log(1/R1754) + log(1/R1680))}
	 */
	NDLI(SpectralOperationMethods.NORMALIZED_DIFFERENCE_LIGNIN_INDEX, 1, grayscale(),
			v -> new double[] { logNormalizedDifference(v[1], v[0]) },
			of(INDEX_OF_1680NM_BAND, 1680), of(INDEX_OF_1754NM_BAND, 1754)),
	
	/**
	 * {@code (log(1/R1510) - log(1/R1680)) / (log(1/R1510) + log(1/R1680))}
	 */
	NDNI(SpectralOperationMethods.NORMALIZED_DIFFERENCE_NITROGEN_INDEX, 1, grayscale(),
			v -> new double[] { logNormalizedDifference(v[0], v[1]) },
			of(INDEX_OF_1510NM_BAND, 1510), of(INDEX_OF_1680NM_BAND, 1680)),
	
	/**
	 * {@code (SWIR - NIR) / (SWIR + NIR)}
	 */
	NDSI(SpectralOperationMethods.NORMALIZED_DIFFERENCE_SOIL_INDEX, 1, grayscale(),
			v -> new double[] { normalizedDifference(v[1], v[0]) },
			of(INDEX_OF_NEAR_INFRARED_BAND, SpectralDomain.NEAR_INFRARED), 
			of(INDEX_OF_SHORT_WAVELENGTH_INFRARED_BAND, SpectralDomain.SHORT_WAVELENGTH_INFRARED)),
	
	/**
	 * {@code (NIR - RED) / (NIR + RED)}
	 */
	NDVI(SpectralOperationMethods.NORMALIZED_DIFFERENCE_VEGETATION_INDEX, 1, grayscale(),
			v -> new double[] { normalizedDifference(v[1], v[0]) },
			of(INDEX_OF_RED_BAND, SpectralDomain.RED), of(INDEX_OF_NEAR_INFRARED_BAND, SpectralDomain.NEAR_INFRARED)),
	
	/**
	 * {@code (R750 - R705) / (R750 + R705)}
	 */
	NDVI705(SpectralOperationMethods.RED_EDGE_NORMALIZED_DIFFERENCE_VEGETATION_INDEX, 1, grayscale(),
			v -> new double[] { normalizedDifference(v[1], v[0]) },
			of(INDEX_OF_705NM_BAND, 705), of(INDEX_OF_750NM_BAND, 750)),
	
	/**
	 * {@code (SWIR - RED) / (SWIR + RED)}
	 */
	NDWI(SpectralOperationMethods.NORMALIZED_DIFFERENCE_WATER_INDEX, 1, grayscale(),
			v -> new double[] { normalizedDifference(v[1], v[0]) },
			of(INDEX_OF_RED_BAND, SpectralDomain.RED), 
			of(INDEX_OF_SHORT_WAVELENGTH_INFRARED_BAND, SpectralDomain.SHORT_WAVELENGTH_INFRARED)),
	
	/**
	 * Normalized difference indices; band 0 is NDSI (soil), band 1 is NDVI (vegetation), band 2 is NDWI (water).
	 * Without imaging metadata, bands 0, 1 and 2 of the source are read as red, near infrared and short-wavelength infrared.
	 */
	NDXI(SpectralOperationMethods.NORMALIZED_DIFFERENCE_INDEX, 3, RasterPresentation.createFalseColorPresentation(0, 1, 2),
			v -> new double[] { normalizedDifference(v[2], v[1]), normalizedDifference(v[1], v[0]), normalizedDifference(v[2], v[0]) },
			of(INDEX_OF_RED_BAND, SpectralDomain.RED, 0), of(INDEX_OF_NEAR_INFRARED_BAND, SpectralDomain.NEAR_INFRARED, 1), 
			of(INDEX_OF_SHORT_WAVELENGTH_INFRARED_BAND, SpectralDomain.SHORT_WAVELENGTH_INFRARED, 2)),
	
	/**
	 * {@code (R531 - R570) / (R531 + R570)}
	 */
	PRI(SpectralOperationMethods.PHOTOCHEMICAL_REFLECTANCE_INDEX, 1, grayscale(),
			v -> new double[] { normalizedDifference(v[0], v[1]) },
			of(INDEX_OF_531NM_BAND, 531), of(INDEX_OF_570NM_BAND, 570)),
	
	/**
	 * {@code (R680 - R500) / R750}
	 */
	PSRI(SpectralOperationMethods.PLANT_SENESCENCE_REFLECTANCE_INDEX, 1, grayscale(),
			v -> new double[] { ratio(v[1] - v[0], v[2]) },
			of(INDEX_OF_500NM_BAND, 500), of(INDEX_OF_680NM_BAND, 680), of(INDEX_OF_750NM_BAND, 750)),
	
	/**
	 * {@code 1.5 * (NIR - RED) / (NIR + RED + 0.5)}
	 */
	SAVI(SpectralOperationMethods.SOIL_ADJUSTED_VEGETATION_INDEX, 1, grayscale(),
			v -> new double[] { ratio(1.5 * (v[1] - v[0]), v[1] + v[0] + 0.5) },
			of(INDEX_OF_RED_BAND, SpectralDomain.RED), of(INDEX_OF_NEAR_INFRARED_BAND, SpectralDomain.NEAR_INFRARED)),
	
	/**
	 * {@code (R800 - R445) / (R800 - R680)}
	 */
	SIPI(SpectralOperationMethods.STRUCTURE_INSENSITIVE_PIGMENT_INDEX, 1, grayscale(),
			v -> new double[] { ratio(v[2] - v[0], v[2] - v[1]) },
			of(INDEX_OF_445NM_BAND, 445), of(INDEX_OF_680NM_BAND, 680), of(INDEX_OF_800NM_BAND, 800)),
	
	/**
	 * {@code NIR / RED}
	 */
	SR(SpectralOperationMethods.SIMPLE_RATIO_INDEX, 1, grayscale(),
			v -> new double[] { ratio(v[1], v[0]) },
			of(INDEX_OF_RED_BAND, SpectralDomain.RED), of(INDEX_OF_NEAR_INFRARED_BAND, SpectralDomain.NEAR_INFRARED)),
	
	/**
	 * Mean of all bands between 500 and 600 nm.
	 */
	SUM_GREEN(SpectralOperationMethods.SUM_GREEN_INDEX, 1, grayscale(),
			v -> new double[] { mean(v) },
			between(INDICES_OF_BANDS_BETWEEN_500NM_600NM, 500, 600)),
	
	/**
	 * {@code R740 / R720}
	 */
	VOG1(SpectralOperationMethods.VOGELMANN_RED_EDGE_INDEX_1, 1, grayscale(),
			v -> new double[] { ratio(v[1], v[0]) },
			of(INDEX_OF_720NM_BAND, 720), of(INDEX_OF_740NM_BAND, 740)),
	
	/**
	 * {@code (R734 - R747) / (R715 + R726)}
	 */
	VOG2(SpectralOperationMethods.VOGELMANN_RED_EDGE_INDEX_2, 1, grayscale(),
			v -> new double[] { ratio(v[2] - v[3], v[0] + v[1]) },
			of(INDEX_OF_715NM_BAND, 715), of(INDEX_OF_726NM_BAND, 726), of(INDEX_OF_734NM_BAND, 734), of(INDEX_OF_747NM_BAND, 747)),
	
	/**
	 * {@code (R734 - R747) / (R715 + R720)}
	 */
	VOG3(SpectralOperationMethods.VOGELMANN_RED_EDGE_INDEX_3, 1, grayscale(),
			v -> new double[] { ratio(v[2] - v[3], v[0] + v[1]) },
			of(INDEX_OF_715NM_BAND, 715), of(INDEX_OF_720NM_BAND, 720), of(INDEX_OF_734NM_BAND, 734), of(INDEX_OF_747NM_BAND, 747)),
	
	/**
	 * Vogelmann red edge indices; band 0 is VOG1, band 1 is VOG2, band 2 is VOG3.
	 */
	VOGX(SpectralOperationMethods.VOGELMANN_RED_EDGE_INDEX, 3, grayscale(),
			v -> new double[] { ratio(v[4], v[1]), ratio(v[3] - v[5], v[0] + v[2]), ratio(v[3] - v[5], v[0] + v[1]) },
			of(INDEX_OF_715NM_BAND, 715), of(INDEX_OF_720NM_BAND, 720), of(INDEX_OF_726NM_BAND, 726), 
			of(INDEX_OF_734NM_BAND, 734), of(INDEX_OF_740NM_BAND, 740), of(INDEX_OF_747NM_BAND, 747)),
	
	/**
	 * {@code R900 / R970}
	 */
	WBI(SpectralOperationMethods.WATER_BAND_INDEX, 1, grayscale(),
			v -> new double[] { ratio(v[0], v[1]) },
			of(INDEX_OF_900NM_BAND, 900), of(INDEX_OF_970NM_BAND, 970));
	
	private final SpectralOperationMethod method;
	private final int nBands;
	private final RasterPresentation presentation;
	private final IndexFormula formula;
	private final List<BandRequirement> requirements;
	
	SpectralIndex(SpectralOperationMethod method, int nBands, RasterPresentation presentation, IndexFormula formula, BandRequirement... requirements) {
		this.method = method;
		this.nBands = nBands;
		this.presentation = presentation;
		this.formula = formula;
		this.requirements = Collections.unmodifiableList(Arrays.asList(requirements));
		for (var requirement : requirements) {
			var parameter = requirement.isGroup() ? requirement.getGroupParameter() : requirement.getParameter();
			if (!method.hasParameter(parameter))
				throw new IllegalStateException(method.getName() + " does not accept " + parameter);
		}
	}
	
	private static RasterPresentation grayscale() {
		return RasterPresentation.createGrayscalePresentation();
	}
	
	public SpectralOperationMethod getMethod() {
		return method;
	}
	
	/**
	 * Number of bands of the result.
	 * @return
	 */
	public int getNumberOfBands() {
		return nBands;
	}
	
	public RasterPresentation getPresentation() {
		return presentation;
	}
	
	public IndexFormula getFormula() {
		return formula;
	}
	
	public List<BandRequirement> getRequirements() {
		return requirements;
	}
	
	/**
	 * Create the computation of this index.
	 * @param source
	 * @param parameters band indices overriding the imaging metadata of the source, may be null
	 * @return
	 * @throws OperationArgumentException if a required band cannot be identified
	 */
	public SpectralIndexComputation createComputation(SpectralGeometry source, ParameterBindings parameters) throws OperationArgumentException {
		return new SpectralIndexComputation(this, source, null, parameters);
	}
	
	/**
	 * Create the computation of this index, writing into an existing result.
	 * @param source
	 * @param result
	 * @param parameters
	 * @return
	 * @throws OperationArgumentException
	 */
	public SpectralIndexComputation createComputation(SpectralGeometry source, SpectralGeometry result, ParameterBindings parameters) throws OperationArgumentException {
		return new SpectralIndexComputation(this, source, result, parameters);
	}
	
	/**
	 * Get the index computed by a method.
	 * @param method
	 * @return the index, or null if the method does not compute one
	 */
	public static SpectralIndex fromMethod(OperationMethod method) {
		for (var index : values()) {
			if (index.method.equals(method))
				return index;
		}
		return null;
	}

}
