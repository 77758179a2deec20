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

package geospectra.lib.geometry;

import java.util.Objects;

import org.locationtech.jts.geom.Geometry;

import geospectra.lib.imaging.RasterImaging;
import geospectra.lib.presentation.RasterPresentation;
import geospectra.lib.raster.Raster;

/**
 * A geometry carrying raster data: a footprint together with the raster, 
 * how it should be presented and, where known, the imaging metadata of its bands.
 * <p>
 * Instances are created by a {@link SpectralGeometryFactory} and are never modified afterwards, 
 * although the values of a writable raster may be.
 */
public final class SpectralGeometry {
	
	private final SpectralGeometryFactory factory;
	private final Geometry footprint;
	private final Raster raster;
	private final RasterPresentation presentation;
	private final RasterImaging imaging;
	
	SpectralGeometry(SpectralGeometryFactory factory, Geometry footprint, Raster raster, RasterPresentation presentation, RasterImaging imaging) {
		this.factory = factory;
		this.footprint = footprint;
		this.raster = raster;
		this.presentation = presentation;
		this.imaging = imaging;
	}
	
	/**
	 * Factory that created this geometry, used to create derived geometries.
	 * @return
	 */
	public SpectralGeometryFactory getFactory() {
		return factory;
	}
	
	/**
	 * Footprint of the raster.
	 * @return
	 */
	public Geometry getFootprint() {
		return footprint;
	}
	
	public Raster getRaster() {
		return raster;
	}
	
	public RasterPresentation getPresentation() {
		return presentation;
	}
	
	/**
	 * Imaging metadata, if known.
	 * @return the imaging, or null
	 */
	public RasterImaging getImaging() {
		return imaging;
	}
	
	/**
	 * Returns true if imaging metadata is available.
	 * @return
	 */
	public boolean hasImaging() {
		return imaging != null;
	}

	@Override
	public int hashCode() {
		return Objects.hash(footprint, raster, presentation, imaging);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof SpectralGeometry))
			return false;
		var other = (SpectralGeometry) obj;
		return Objects.equals(footprint, other.footprint) && raster == other.raster
				&& Objects.equals(presentation, other.presentation) && Objects.equals(imaging, other.imaging);
	}

	@Override
	public String toString() {
		return "SpectralGeometry [" + footprint.getGeometryType() + ", " + raster + ", " + presentation.getModel() + "]";
	}

}
