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

import geospectra.lib.operations.parameters.OperationParameter;

/**
 * Thrown when an operation cannot be created from the arguments it was given.
 * <p>
 * The {@link Reason} identifies the kind of failure, so that callers do not need to parse messages.
 * All of these are raised before any value is computed.
 */
public class OperationArgumentException extends IllegalArgumentException {
	
	private static final long serialVersionUID = 1L;
	
	/**
	 * Kinds of invalid operation arguments.
	 */
	public enum Reason {
		/**
		 * The source is null.
		 */
		NULL_SOURCE,
		/**
		 * A required parameter has no value.
		 */
		MISSING_REQUIRED_PARAMETER,
		/**
		 * A parameter value has the wrong type or fails a parameter condition.
		 */
		INVALID_PARAMETER_VALUE,
		/**
		 * Source and result are the same object, but the method does not support in-place execution.
		 */
		IN_PLACE_NOT_SUPPORTED,
		/**
		 * The source lacks data the operation needs, e.g. imaging metadata identifying a band.
		 */
		INVALID_SOURCE_DATA,
		/**
		 * A band index lies outside the bands of the source.
		 */
		OUT_OF_RANGE_BAND_INDEX,
		/**
		 * The source raster format is not supported by the method.
		 */
		UNSUPPORTED_FORMAT;
	}
	
	private final Reason reason;
	private final transient OperationParameter<?> parameter;

	/**
	 * Create an exception.
	 * @param reason
	 * @param parameter the parameter responsible, may be null
	 * @param message
	 */
	public OperationArgumentException(Reason reason, OperationParameter<?> parameter, String message) {
		this(reason, parameter, message, null);
	}
	
	/**
	 * Create an exception with a cause.
	 * @param reason
	 * @param parameter the parameter responsible, may be null
	 * @param message
	 * @param cause
	 */
	public OperationArgumentException(Reason reason, OperationParameter<?> parameter, String message, Throwable cause) {
		super(message, cause);
		this.reason = reason;
		this.parameter = parameter;
	}
	
	/**
	 * Create an exception not related to a single parameter.
	 * @param reason
	 * @param message
	 */
	public OperationArgumentException(Reason reason, String message) {
		this(reason, null, message, null);
	}
	
	public Reason getReason() {
		return reason;
	}
	
	/**
	 * Parameter responsible for the failure.
	 * @return the parameter, or null
	 */
	public OperationParameter<?> getParameter() {
		return parameter;
	}

}
