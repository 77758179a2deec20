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

package geospectra.lib.operations;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import geospectra.lib.operations.parameters.OperationParameter;

/**
 * Describes an operation: its identity, the parameters it accepts and how it may be executed.
 * <p>
 * Methods are compared by identifier and version.
 */
public class OperationMethod {
	
	private final String identifier;
	private final String name;
	private final String remarks;
	private final List<String> aliases;
	private final String version;
	private final boolean reversible;
	private final Set<ExecutionMode> supportedModes;
	private final List<OperationParameter<?>> parameters;
	
	/**
	 * Create a method.
	 * @param identifier unique identifier
	 * @param name human readable name
	 * @param remarks description, may be null
	 * @param aliases alternative names, may be null
	 * @param version version string, e.g. "1.0"
	 * @param reversible true if a reverse operation can be computed
	 * @param supportedModes execution modes, at least one
	 * @param parameters parameters accepted by the method
	 */
	public OperationMethod(String identifier, String name, String remarks, String[] aliases, String version, 
			boolean reversible, Set<ExecutionMode> supportedModes, OperationParameter<?>... parameters) {
		Objects.requireNonNull(identifier, "Method identifier must not be null");
		Objects.requireNonNull(name, "Method name must not be null");
		if (supportedModes == null || supportedModes.isEmpty())
			throw new IllegalArgumentException("Method " + name + " must support at least one execution mode");
		this.identifier = identifier;
		this.name = name;
		this.remarks = remarks;
		this.aliases = aliases == null ? Collections.emptyList() : List.of(aliases);
		this.version = version == null ? "1.0" : version;
		this.reversible = reversible;
		this.supportedModes = Collections.unmodifiableSet(EnumSet.copyOf(supportedModes));
		this.parameters = List.of(parameters);
	}
	
	/**
	 * Create a non-reversible method at version 1.0.
	 * @param identifier
	 * @param name
	 * @param remarks
	 * @param supportedModes
	 * @param parameters
	 * @return
	 */
	public static OperationMethod createMethod(String identifier, String name, String remarks, 
			Set<ExecutionMode> supportedModes, OperationParameter<?>... parameters) {
		return new OperationMethod(identifier, name, remarks, null, "1.0", false, supportedModes, parameters);
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
	
	public String getVersion() {
		return version;
	}
	
	public boolean isReversible() {
		return reversible;
	}
	
	public Set<ExecutionMode> getSupportedModes() {
		return supportedModes;
	}
	
	/**
	 * Returns true if the method can write its result into its source.
	 * @return
	 */
	public boolean supportsInPlace() {
		return supportedModes.contains(ExecutionMode.IN_PLACE);
	}
	
	public List<OperationParameter<?>> getParameters() {
		return parameters;
	}
	
	/**
	 * Returns true if the method accepts a parameter.
	 * @param parameter
	 * @return
	 */
	public boolean hasParameter(OperationParameter<?> parameter) {
		return parameters.contains(parameter);
	}

	@Override
	public int hashCode() {
		return Objects.hash(identifier, version);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		var other = (OperationMethod) obj;
		return identifier.equals(other.identifier) && version.equals(other.version);
	}
	
	@Override
	public String toString() {
		return "[" + identifier + "] " + name + " (v" + version + ")";
	}

}
