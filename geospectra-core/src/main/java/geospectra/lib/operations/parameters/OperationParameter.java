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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import geospectra.lib.imaging.SpectralDomain;

/**
 * A named, typed configuration slot of an operation, such as the index of the red band.
 * <p>
 * Parameters are immutable and compared by identifier. Required parameters must be given a value 
 * for every invocation; optional parameters fall back to their default value.
 * Values are checked against the parameter type and its conditions before an operation uses them.
 * 
 * @param <T> value type
 */
public final class OperationParameter<T> {
	
	private final String identifier;
	private final String name;
	private final String remarks;
	private final List<String> aliases;
	private final Class<T> type;
	private final boolean optional;
	private final T defaultValue;
	private final List<Predicate<? super T>> conditions;
	
	private OperationParameter(String identifier, String name, String remarks, String[] aliases, 
			Class<T> type, boolean optional, T defaultValue, List<Predicate<? super T>> conditions) {
		if (identifier == null)
			throw new IllegalArgumentException("Parameter identifier must not be null");
		if (name == null)
			throw new IllegalArgumentException("Parameter name must not be null");
		Objects.requireNonNull(type, "Parameter type must not be null");
		this.identifier = identifier;
		this.name = name;
		this.remarks = remarks;
		this.aliases = aliases == null ? Collections.emptyList() : List.of(aliases);
		this.type = type;
		this.optional = optional;
		this.defaultValue = defaultValue;
		this.conditions = List.copyOf(conditions);
	}
	
	/**
	 * Create a parameter that must be given a value.
	 * @param <T>
	 * @param identifier unique identifier
	 * @param name human readable name
	 * @param remarks description, may be null
	 * @param type value type
	 * @param conditions predicates every value must satisfy
	 * @return
	 */
	@SafeVarargs
	public static <T> OperationParameter<T> createRequiredParameter(String identifier, String name, String remarks, 
			Class<T> type, Predicate<? super T>... conditions) {
		return new OperationParameter<>(identifier, name, remarks, null, type, false, null, Arrays.asList(conditions));
	}
	
	/**
	 * Create a parameter with a default value.
	 * @param <T>
	 * @param identifier unique identifier
	 * @param name human readable name
	 * @param remarks description, may be null
	 * @param type value type
	 * @param defaultValue value used when none is given, may be null
	 * @param conditions predicates every given value must satisfy
	 * @return
	 */
	@SafeVarargs
	public static <T> OperationParameter<T> createOptionalParameter(String identifier, String name, String remarks, 
			Class<T> type, T defaultValue, Predicate<? super T>... conditions) {
		return new OperationParameter<>(identifier, name, remarks, null, type, true, defaultValue, Arrays.asList(conditions));
	}
	
	/**
	 * Create a copy of this parameter with alternative names.
	 * @param aliases
	 * @return
	 */
	public OperationParameter<T> withAliases(String... aliases) {
		return new OperationParameter<>(identifier, name, remarks, aliases, type, optional, defaultValue, conditions);
	}
	
	public String getIdentifier() {
		return identifier;
	}
	
	public String getName() {
		return name;
	}
	
	public String getRemarks() {
		return remarks;
	}
	
	public List<String> getAliases() {
		return aliases;
	}
	
	public Class<T> getType() {
		return type;
	}
	
	public boolean isOptional() {
		return optional;
	}
	
	/**
	 * Value used for optional parameters without an explicit value.
	 * @return the default value, or null
	 */
	public T getDefaultValue() {
		return defaultValue;
	}
	
	/**
	 * Returns true if the identifier, name or an alias equals the text, ignoring case.
	 * @param text
	 * @return
	 */
	public boolean isKnownAs(String text) {
		if (text == null)
			return false;
		if (identifier.equalsIgnoreCase(text) || name.equalsIgnoreCase(text))
			return true;
		return aliases.stream().anyMatch(a -> a.equalsIgnoreCase(text));
	}
	
	/**
	 * Convert a value to the parameter type.
	 * <p>
	 * Numbers are converted to integral types if no precision is lost, and to floating point types freely. 
	 * Strings are converted to spectral domains by name. 
	 * Arrays and collections are converted element by element to {@code int[]}, {@code double[]} 
	 * and {@code SpectralDomain[]}; a single value becomes an array of length one. 
	 * Values of any other type are only accepted if they are already instances of the parameter type.
	 * 
	 * @param value
	 * @return the converted value, or null if the value is null or cannot be converted
	 */
	public T convert(Object value) {
		Object converted = convert(value, type);
		return converted == null ? null : type.cast(converted);
	}
	
	/**
	 * Returns true if a value can be converted to the parameter type and satisfies all conditions.
	 * @param value
	 * @return
	 */
	public boolean isValid(Object value) {
		T converted = convert(value);
		if (converted == null)
			return false;
		for (var condition : conditions) {
			if (!condition.test(converted))
				return false;
		}
		return true;
	}
	
	private static Object convert(Object value, Class<?> cls) {
		if (value == null)
			return null;
		if (cls.isInstance(value))
			return value;
		if (cls == Integer.class || cls == int.class)
			return toInteger(value);
		if (cls == Long.class || cls == long.class)
			return toLong(value);
		if (cls == Double.class || cls == double.class)
			return value instanceof Number ? ((Number)value).doubleValue() : null;
		if (cls == Float.class || cls == float.class)
			return value instanceof Number ? ((Number)value).floatValue() : null;
		if (cls == SpectralDomain.class)
			return toSpectralDomain(value);
		if (cls == int[].class)
			return toIntArray(value);
		if (cls == double[].class)
			return toDoubleArray(value);
		if (cls == SpectralDomain[].class)
			return toSpectralDomainArray(value);
		return null;
	}
	
	private static Integer toInteger(Object value) {
		Long l = toLong(value);
		if (l == null || l < Integer.MIN_VALUE || l > Integer.MAX_VALUE)
			return null;
		return l.intValue();
	}
	
	private static Long toLong(Object value) {
		if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte)
			return ((Number)value).longValue();
		if (value instanceof Number) {
			double d = ((Number)value).doubleValue();
			if (d == Math.rint(d) && d >= Long.MIN_VALUE && d < Long.MAX_VALUE)
				return (long)d;
		}
		return null;
	}
	
	private static SpectralDomain toSpectralDomain(Object value) {
		if (value instanceof SpectralDomain)
			return (SpectralDomain)value;
		if (value instanceof String)
			return SpectralDomain.fromString((String)value);
		return null;
	}
	
	private static int[] toIntArray(Object value) {
		var elements = elements(value);
		int[] array = new int[elements.size()];
		int i = 0;
		for (var element : elements) {
			Integer converted = toInteger(element);
			if (converted == null)
				return null;
			array[i++] = converted;
		}
		return array;
	}
	
	private static double[] toDoubleArray(Object value) {
		var elements = elements(value);
		double[] array = new double[elements.size()];
		int i = 0;
		for (var element : elements) {
			if (!(element instanceof Number))
				return null;
			array[i++] = ((Number)element).doubleValue();
		}
		return array;
	}
	
	private static SpectralDomain[] toSpectralDomainArray(Object value) {
		var elements = elements(value);
		var array = new SpectralDomain[elements.size()];
		int i = 0;
		for (var element : elements) {
			var converted = toSpectralDomain(element);
			if (converted == null)
				return null;
			array[i++] = converted;
		}
		return array;
	}
	
	/**
	 * Elements of a collection or array; any other value is treated as a single element.
	 */
	private static Collection<?> elements(Object value) {
		if (value instanceof Collection)
			return (Collection<?>)value;
		if (value instanceof Object[])
			return Arrays.asList((Object[])value);
		if (value instanceof int[])
			return Arrays.stream((int[])value).boxed().collect(Collectors.toList());
		if (value instanceof long[])
			return Arrays.stream((long[])value).boxed().collect(Collectors.toList());
		if (value instanceof double[])
			return Arrays.stream((double[])value).boxed().collect(Collectors.toList());
		if (value instanceof float[]) {
			var list = new ArrayList<Float>();
			for (float f : (float[])value)
				list.add(f);
			return list;
		}
		return Collections.singletonList(value);
	}

	@Override
	public int hashCode() {
		return identifier.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof OperationParameter))
			return false;
		return identifier.equals(((OperationParameter<?>)obj).identifier);
	}

	@Override
	public String toString() {
		return "[" + identifier + "] " + name;
	}

}
