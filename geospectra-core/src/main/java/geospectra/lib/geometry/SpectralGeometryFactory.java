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

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import geospectra.lib.imaging.RasterImaging;
import geospectra.lib.presentation.RasterPresentation;
import geospectra.lib.raster.DefaultRasterFactory;
import geospectra.lib.raster.Raster;
import geospectra.lib.raster.RasterFactory;

/**
 * Creates {@link SpectralGeometry} objects.
 * <p>
 * This is the only way to construct a spectral geometry. Footprints are built with a JTS {@link GeometryFactory}, 
 * rasters allocated through a {@link RasterFactory}.
 */
public class SpectralGeometryFactory {
	
	private final static Logger logger = LoggerFactory.getLogger(SpectralGeometryFactory.class);
	
	private static final SpectralGeometryFactory DEFAULT = new SpectralGeometryFactory(
			new GeometryFactory(new PrecisionModel(PrecisionModel.FLOATING)), DefaultRasterFactory.getInstance());
	
	private final GeometryFactory geometryFactory;
	private final RasterFactory rasterFactory;
	
	/**
	 * Create a factory.
	 * @param geometryFactory
	 * @param rasterFactory
	 */
	public SpectralGeometryFactory(GeometryFactory geometryFactory, RasterFactory rasterFactory) {
		this.geometryFactory = Objects.requireNonNull(geometryFactory);
		this.rasterFactory = Objects.requireNonNull(rasterFactory);
	}
	
	/**
	 * Get a factory using a floating precision model and in-memory rasters.
	 * @return
	 */
	public static SpectralGeometryFactory getDefaultFactory() {
		return DEFAULT;
	}
	
	public GeometryFactory getGeometryFactory() {
		return geometryFactory;
	}
	
	public RasterFactory getRasterFactory() {
		return rasterFactory;
	}
	
	/**
	 * Create a spectral geometry sharing the footprint of a source geometry.
	 * 
	 * @param source geometry providing the footprint; if null, the raster extent is used
	 * @param raster
	 * @param presentation
	 * @param imaging may be null
	 * @return
	 */
	public SpectralGeometry createSpectralGeometry(Geometry source, Raster raster, RasterPresentation presentation, RasterImaging imaging) {
		Objects.requireNonNull(raster, "Raster must not be null");
		Objects.requireNonNull(presentation, "Presentation must not be null");
		checkImaging(raster, imaging);
		Geometry footprint = source == null ? createExtent(raster) : geometryFactory.createGeometry(source);
		return new SpectralGeometry(this, footprint, raster, presentation, imaging);
	}
	
	/**
	 * Create a spectral geometry from another one, replacing its raster data.
	 * @param source
	 * @param raster
	 * @param presentation
	 * @param imaging
	 * @return
	 */
	public SpectralGeometry createSpectralGeometry(SpectralGeometry source, Raster raster, RasterPresentation presentation, RasterImaging imaging) {
		return createSpectralGeometry(source == null ? null : source.getFootprint(), raster, presentation, imaging);
	}
	
	/**
	 * Create a spectral geometry whose footprint is the raster extent, 
	 * with columns along the x axis and rows along the y axis.
	 * @param raster
	 * @param presentation
	 * @param imaging
	 * @return
	 */
	public SpectralGeometry createSpectralPolygon(Raster raster, RasterPresentation presentation, RasterImaging imaging) {
		return createSpectralGeometry((Geometry)null, raster, presentation, imaging);
	}
	
	private Polygon createExtent(Raster raster) {
		double w = raster.getNumberOfColumns();
		double h = raster.getNumberOfRows();
		return geometryFactory.createPolygon(new Coordinate[] {
				new Coordinate(0, 0),
				new Coordinate(w, 0),
				new Coordinate(w, h),
				new Coordinate(0, h),
				new Coordinate(0, 0)
		});
	}
	
	private static void checkImaging(Raster raster, RasterImaging imaging) {
		if (imaging != null && imaging.getNumberOfBands() != raster.getNumberOfBands()) {
			logger.debug("Imaging has {} bands, raster has {}", imaging.getNumberOfBands(), raster.getNumberOfBands());
			throw new IllegalArgumentException("Imaging describes " + imaging.getNumberOfBands() 
				+ " bands, but the raster has " + raster.getNumberOfBands());
		}
	}

}
