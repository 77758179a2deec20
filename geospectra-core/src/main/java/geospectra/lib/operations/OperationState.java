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

/**
 * Lifecycle of an {@link Operation}.
 * <p>
 * States only move forward. An operation that has completed or failed cannot be executed again.
 */
public enum OperationState {
	
	/**
	 * Constructor running, arguments not yet validated.
	 */
	CONSTRUCTED,
	/**
	 * Arguments validated and parameters resolved; ready to execute.
	 */
	VALIDATED,
	/**
	 * Result shape being decided and allocated.
	 */
	PREPARING,
	/**
	 * Result values being computed.
	 */
	EXECUTING,
	/**
	 * Result being finalized.
	 */
	FINALIZING,
	/**
	 * Execution finished successfully.
	 */
	COMPLETED,
	/**
	 * Execution ended with an exception.
	 */
	FAILED;
	
	/**
	 * Returns true if the operation can no longer be executed.
	 * @return
	 */
	public boolean isTerminal() {
		return this == COMPLETED || this == FAILED;
	}

}
