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

import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import geospectra.lib.operations.OperationArgumentException;
import geospectra.lib.operations.OperationArgumentException.Reason;

/**
 * Resolves the effective value of parameters for one invocation.
 * <p>
 * The order is: an explicit value from the bindings, then a fallback computed by the caller, 
 * then the default of an optional parameter. A required parameter with none of these cannot be resolved.
 */
public class ParameterResolver {
	
	private final static Logger logger = LoggerFactory.getLogger(ParameterResolver.class);
	
	private final ParameterBindings bindings;
	
	/**
	 * Create a resolver for bindings.
	 * @param bindings may be null, meaning no explicit values
	 */
	public ParameterResolver(ParameterBindings bindings) {
		this.bindings = bindings == null ? new ParameterBindings() : bindings;
	}
	
	/**
	 * Returns true if the bindings contain an explicit entry for the parameter, even a null one.
	 * Defaults are not considered.
	 * @param parameter
	 * @return
	 */
	public boolean isProvided(OperationParameter<?> parameter) {
		return bindings.contains(parameter);
	}
	
	/**
	 * Resolve a parameter without a fallback.
	 * @param <T>
	 * @param parameter
	 * @return
	 * @throws OperationArgumentException if the value is invalid or a required parameter has no value
	 */
	public <T> T resolve(OperationParameter<T> parameter) throws OperationArgumentException {
		return resolve(parameter, null);
	}
	
	/**
	 * Resolve a parameter.
	 * <p>
	 * The fallback is only called if there is no entry for the parameter. If it returns null, 
	 * resolution continues with the default value. An explicit null entry skips the fallback 
	 * and resolves to the default value.
	 * 
	 * @param <T>
	 * @param parameter
	 * @param fallback may be null
	 * @return the value; null only for optional parameters whose default is null
	 * @throws OperationArgumentException if the value is invalid or a required parameter has no value
	 */
	public <T> T resolve(OperationParameter<T> parameter, Supplier<? extends T> fallback) throws OperationArgumentException {
		Object raw = bindings.get(parameter);
		if (raw != null) {
			if (!parameter.isValid(raw))
				throw new OperationArgumentException(Reason.INVALID_PARAMETER_VALUE, parameter,
						"The value " + raw + " is not valid for parameter " + parameter.getName());
			return parameter.convert(raw);
		}
		if (fallback != null && !bindings.contains(parameter)) {
			T value = fallback.get();
			if (value != null) {
				logger.trace("Parameter {} resolved from fallback: {}", parameter.getName(), value);
				return value;
			}
		}
		if (parameter.isOptional())
			return parameter.getDefaultValue();
		throw new OperationArgumentException(Reason.MISSING_REQUIRED_PARAMETER, parameter,
				"No value is given for the required parameter " + parameter.getName());
	}
	
	/**
	 * Bindings used by this resolver.
	 * @return
	 */
	public ParameterBindings getBindings() {
		return bindings;
	}

}
