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

package geospectra.lib.operations.parameters;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import geospectra.lib.io.GsonTools;

/**
 * Values given to the parameters of one operation invocation.
 * <p>
 * Each parameter has at most one entry; putting a value again replaces it. 
 * An entry may hold null, which counts as provided but without a value.
 * <p>
 * Bindings can be written to and read from JSON, with parameter identifiers as keys.
 */
public class ParameterBindings {
	
	private final static Logger logger = LoggerFactory.getLogger(ParameterBindings.class);
	
	private final Map<OperationParameter<?>, Object> values = new LinkedHashMap<>();
	
	/**
	 * Create empty bindings.
	 */
	public ParameterBindings() {}
	
	/**
	 * Create a copy of existing bindings.
	 * @param bindings
	 */
	public ParameterBindings(ParameterBindings bindings) {
		if (bindings != null)
			values.putAll(bindings.values);
	}
	
	/**
	 * Create empty bindings.
	 * @return
	 */
	public static ParameterBindings create() {
		return new ParameterBindings();
	}
	
	/**
	 * Bind a value to a parameter.
	 * @param <T>
	 * @param parameter
	 * @param value
	 * @return this instance
	 */
	public <T> ParameterBindings put(OperationParameter<T> parameter, T value) {
		return putValue(parameter, value);
	}
	
	/**
	 * Bind a value of any type to a parameter. 
	 * The value is checked only when an operation is created.
	 * @param parameter
	 * @param value
	 * @return this instance
	 */
	public ParameterBindings putValue(OperationParameter<?> parameter, Object value) {
		if (parameter == null)
			throw new IllegalArgumentException("Parameter must not be null");
		values.put(parameter, value);
		return this;
	}
	
	/**
	 * Remove the entry of a parameter.
	 * @param parameter
	 * @return this instance
	 */
	public ParameterBindings remove(OperationParameter<?> parameter) {
		values.remove(parameter);
		return this;
	}
	
	/**
	 * Returns true if there is an entry for the parameter, even if it holds null.
	 * @param parameter
	 * @return
	 */
	public boolean contains(OperationParameter<?> parameter) {
		return values.containsKey(parameter);
	}
	
	/**
	 * Get the raw value bound to a parameter.
	 * @param parameter
	 * @return the value, or null if there is none
	 */
	public Object get(OperationParameter<?> parameter) {
		return values.get(parameter);
	}
	
	/**
	 * Parameters with an entry, in insertion order.
	 * @return
	 */
	public Set<OperationParameter<?>> getParameters() {
		return Collections.unmodifiableSet(values.keySet());
	}
	
	public int size() {
		return values.size();
	}
	
	public boolean isEmpty() {
		return values.isEmpty();
	}
	
	/**
	 * Create bindings with only the entries whose parameter is in a collection.
	 * @param parameters
	 * @return
	 */
	public ParameterBindings retain(Collection<? extends OperationParameter<?>> parameters) {
		var bindings = new ParameterBindings();
		for (var entry : values.entrySet()) {
			if (parameters.contains(entry.getKey()))
				bindings.values.put(entry.getKey(), entry.getValue());
			else
				logger.trace("Dropping parameter {}", entry.getKey());
		}
		return bindings;
	}
	
	/**
	 * Write the bindings as a JSON object keyed by parameter identifier.
	 * @return
	 */
	public String toJson() {
		return toJson(false);
	}
	
	/**
	 * Write the bindings as a JSON object keyed by parameter identifier, optionally pretty-printed.
	 * @param pretty
	 * @return
	 */
	public String toJson(boolean pretty) {
		Gson gson = GsonTools.getInstance(pretty);
		var json = new JsonObject();
		for (Entry<OperationParameter<?>, Object> entry : values.entrySet()) {
			Object value = entry.getValue();
			json.add(entry.getKey().getIdentifier(), value == null ? JsonNull.INSTANCE : gson.toJsonTree(value));
		}
		return gson.toJson(json);
	}
	
	/**
	 * Read bindings from a JSON object.
	 * <p>
	 * Keys are matched against the identifier, name and aliases of the known parameters, ignoring case.
	 * Keys that match no parameter are logged and skipped.
	 * 
	 * @param json
	 * @param knownParameters
	 * @return
	 * @throws JsonParseException if the JSON is not an object or a value cannot be read as the parameter type
	 */
	public static ParameterBindings fromJson(String json, Collection<? extends OperationParameter<?>> knownParameters) throws JsonParseException {
		Gson gson = GsonTools.getInstance();
		JsonElement element = gson.fromJson(json, JsonElement.class);
		if (element == null || !element.isJsonObject())
			throw new JsonParseException("Parameter bindings must be a JSON object");
		var bindings = new ParameterBindings();
		for (var entry : element.getAsJsonObject().entrySet()) {
			var parameter = knownParameters.stream().filter(p -> p.isKnownAs(entry.getKey())).findFirst().orElse(null);
			if (parameter == null) {
				logger.warn("Unknown parameter '{}' will be ignored", entry.getKey());
				continue;
			}
			var value = entry.getValue();
			if (value.isJsonNull())
				bindings.values.put(parameter, null);
			else
				bindings.values.put(parameter, gson.fromJson(value, parameter.getType()));
		}
		return bindings;
	}

	@Override
	public String toString() {
		return "ParameterBindings " + values;
	}

}
