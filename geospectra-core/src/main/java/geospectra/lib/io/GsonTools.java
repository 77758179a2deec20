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

package geospectra.lib.io;

import java.io.IOException;
import java.util.ArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import geospectra.lib.imaging.RasterImaging;
import geospectra.lib.imaging.RasterImagingBand;
import geospectra.lib.imaging.SpectralDomain;
import geospectra.lib.imaging.SpectralRange;

/**
 * Helper class providing Gson instances with type adapters registered to serialize 
 * imaging metadata.
 * <p>
 * These include:
 * <ul>
 * <li>{@link SpectralDomain}, read leniently by name or display name</li>
 * <li>{@link SpectralRange}</li>
 * <li>{@link RasterImaging}</li>
 * </ul>
 */
public class GsonTools {
	
	private final static Logger logger = LoggerFactory.getLogger(GsonTools.class);
	
	private static GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeAdapterFactory(new GeoSpectraTypeAdapterFactory());
	
	/**
	 * Access the builder used with {@link #getInstance()}.
	 * This makes it possible to register new type adapters if required, which will be used by future Gson instances 
	 * returned by this class.
	 * <p>
	 * To create a derived builder that does not change the default, use {@code GsonTools.getInstance().newBuilder()}.
	 * 
	 * @return
	 */
	public static GsonBuilder getDefaultBuilder() {
		logger.trace("Requesting GsonBuilder from {}", Thread.currentThread().getStackTrace()[0]);
		return builder;
	}
	
	/**
	 * Get default Gson, capable of serializing/deserializing imaging metadata.
	 * @return
	 * 
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return builder.create();
	}
	
	/**
	 * Get default Gson, optionally with pretty printing enabled.
	 * 
	 * @param pretty if true, write using pretty-printing (i.e. more whitespace for formatting)
	 * @return
	 * 
	 * @see #getInstance()
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}
	
	
	static class GeoSpectraTypeAdapterFactory implements TypeAdapterFactory {

		@SuppressWarnings("unchecked")
		@Override
		public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
			var cls = type.getRawType();
			if (SpectralDomain.class.equals(cls))
				return (TypeAdapter<T>)SpectralDomainTypeAdapter.INSTANCE;
			if (SpectralRange.class.equals(cls))
				return (TypeAdapter<T>)SpectralRangeTypeAdapter.INSTANCE;
			if (RasterImaging.class.equals(cls))
				return (TypeAdapter<T>)RasterImagingTypeAdapter.INSTANCE;
			return null;
		}
		
	}
	
	
	static class SpectralDomainTypeAdapter extends TypeAdapter<SpectralDomain> {
		
		static final SpectralDomainTypeAdapter INSTANCE = new SpectralDomainTypeAdapter();

		@Override
		public void write(JsonWriter out, SpectralDomain value) throws IOException {
			if (value == null)
				out.nullValue();
			else
				out.value(value.name());
		}

		@Override
		public SpectralDomain read(JsonReader in) throws IOException {
			if (in.peek() == JsonToken.NULL) {
				in.nextNull();
				return null;
			}
			String text = in.nextString();
			var domain = SpectralDomain.fromString(text);
			if (domain == null)
				throw new JsonParseException("Unknown spectral domain '" + text + "'");
			return domain;
		}
		
	}
	
	
	static class SpectralRangeTypeAdapter extends TypeAdapter<SpectralRange> {
		
		static final SpectralRangeTypeAdapter INSTANCE = new SpectralRangeTypeAdapter();

		@Override
		public void write(JsonWriter out, SpectralRange value) throws IOException {
			if (value == null) {
				out.nullValue();
				return;
			}
			out.beginObject();
			out.name("min").value(value.getMinWavelength());
			out.name("max").value(value.getMaxWavelength());
			out.endObject();
		}

		@Override
		public SpectralRange read(JsonReader in) throws IOException {
			if (in.peek() == JsonToken.NULL) {
				in.nextNull();
				return null;
			}
			double min = Double.NaN, max = Double.NaN;
			in.beginObject();
			while (in.hasNext()) {
				String name = in.nextName();
				if ("min".equals(name))
					min = in.nextDouble();
				else if ("max".equals(name))
					max = in.nextDouble();
				else
					in.skipValue();
			}
			in.endObject();
			try {
				return new SpectralRange(min, max);
			} catch (IllegalArgumentException e) {
				throw new JsonParseException(e.getLocalizedMessage(), e);
			}
		}
		
	}
	
	
	static class RasterImagingTypeAdapter extends TypeAdapter<RasterImaging> {
		
		static final RasterImagingTypeAdapter INSTANCE = new RasterImagingTypeAdapter();

		@Override
		public void write(JsonWriter out, RasterImaging value) throws IOException {
			if (value == null) {
				out.nullValue();
				return;
			}
			out.beginObject();
			if (value.getDevice() != null)
				out.name("device").value(value.getDevice());
			out.name("bands");
			out.beginArray();
			for (var band : value.getBands()) {
				out.beginObject();
				out.name("name").value(band.getName());
				out.name("domain");
				SpectralDomainTypeAdapter.INSTANCE.write(out, band.getSpectralDomain());
				if (band.getSpectralRange() != null) {
					out.name("range");
					SpectralRangeTypeAdapter.INSTANCE.write(out, band.getSpectralRange());
				}
				out.endObject();
			}
			out.endArray();
			out.endObject();
		}

		@Override
		public RasterImaging read(JsonReader in) throws IOException {
			if (in.peek() == JsonToken.NULL) {
				in.nextNull();
				return null;
			}
			String device = null;
			var bands = new ArrayList<RasterImagingBand>();
			in.beginObject();
			while (in.hasNext()) {
				String name = in.nextName();
				if ("device".equals(name))
					device = in.nextString();
				else if ("bands".equals(name)) {
					in.beginArray();
					while (in.hasNext())
						bands.add(readBand(in));
					in.endArray();
				} else
					in.skipValue();
			}
			in.endObject();
			try {
				return RasterImaging.create(device, bands);
			} catch (IllegalArgumentException e) {
				throw new JsonParseException(e.getLocalizedMessage(), e);
			}
		}
		
		private static RasterImagingBand readBand(JsonReader in) throws IOException {
			String name = null;
			SpectralDomain domain = null;
			SpectralRange range = null;
			in.beginObject();
			while (in.hasNext()) {
				switch (in.nextName()) {
				case "name":
					name = in.nextString();
					break;
				case "domain":
					domain = SpectralDomainTypeAdapter.INSTANCE.read(in);
					break;
				case "range":
					range = SpectralRangeTypeAdapter.INSTANCE.read(in);
					break;
				default:
					in.skipValue();
				}
			}
			in.endObject();
			if (range == null && domain != null)
				range = domain.getNominalRange();
			return RasterImagingBand.create(name, domain, range);
		}
		
	}

}
