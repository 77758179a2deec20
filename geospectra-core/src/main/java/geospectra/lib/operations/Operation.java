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

import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import geospectra.lib.operations.OperationArgumentException.Reason;
import geospectra.lib.operations.parameters.OperationParameter;
import geospectra.lib.operations.parameters.ParameterBindings;
import geospectra.lib.operations.parameters.ParameterResolver;

/**
 * Base class for operations computing a result from a source object.
 * <p>
 * All arguments are validated by the constructor: a constructed operation will not fail because of 
 * its source or parameters. {@link #execute()} then runs {@link #prepareResult()}, {@link #computeResult()} 
 * and {@link #finalizeResult()} once.
 * <p>
 * Parameters bound to values but not accepted by the method are dropped.
 * 
 * @param <S> source type
 * @param <R> result type
 */
public abstract class Operation<S, R> {
	
	private final static Logger logger = LoggerFactory.getLogger(Operation.class);
	
	private final OperationMethod method;
	private final S source;
	private final ParameterBindings parameters;
	private final ParameterResolver resolver;
	
	private volatile OperationState state = OperationState.CONSTRUCTED;
	
	/**
	 * The result; may be given to the constructor, otherwise set by {@link #prepareResult()}.
	 */
	protected R result;
	
	/**
	 * Create an operation and validate its arguments.
	 * 
	 * @param source the source, not null
	 * @param result the result to write into, or null to create one
	 * @param method the method
	 * @param parameters parameter values, may be null if the method has no required parameters
	 * @throws OperationArgumentException if an argument is invalid
	 */
	protected Operation(S source, R result, OperationMethod method, ParameterBindings parameters) throws OperationArgumentException {
		if (method == null)
			throw new IllegalArgumentException("Operation method must not be null");
		if (source == null)
			throw new OperationArgumentException(Reason.NULL_SOURCE, "The source of " + method.getName() + " is null");
		if (result != null && source == result && !method.supportsInPlace())
			throw new OperationArgumentException(Reason.IN_PLACE_NOT_SUPPORTED, 
					"The source and result are the same object, but " + method.getName() + " does not support in-place execution");
		
		for (var parameter : method.getParameters())
			checkParameter(method, parameter, parameters);
		
		this.method = method;
		this.source = source;
		this.result = result;
		this.parameters = parameters == null ? new ParameterBindings() : parameters.retain(method.getParameters());
		this.resolver = new ParameterResolver(this.parameters);
		setState(OperationState.VALIDATED);
	}
	
	private static void checkParameter(OperationMethod method, OperationParameter<?> parameter, ParameterBindings parameters) {
		Object value = parameters == null ? null : parameters.get(parameter);
		if (value == null) {
			if (!parameter.isOptional())
				throw new OperationArgumentException(Reason.MISSING_REQUIRED_PARAMETER, parameter,
						"The parameters of " + method.getName() + " do not contain a value for " + parameter.getName());
			return;
		}
		if (parameter.convert(value) == null)
			throw new OperationArgumentException(Reason.INVALID_PARAMETER_VALUE, parameter,
					"The value of " + parameter.getName() + " (" + value + ") is not of type " + parameter.getType().getSimpleName());
		if (!parameter.isValid(value))
			throw new OperationArgumentException(Reason.INVALID_PARAMETER_VALUE, parameter,
					"The value of " + parameter.getName() + " (" + value + ") does not satisfy the conditions of the parameter");
	}
	
	public OperationMethod getMethod() {
		return method;
	}
	
	public S getSource() {
		return source;
	}
	
	public OperationState getState() {
		return state;
	}
	
	/**
	 * Parameter values accepted by the method, as given to the constructor.
	 * @return
	 */
	public ParameterBindings getParameters() {
		return new ParameterBindings(parameters);
	}
	
	public boolean isReversible() {
		return method.isReversible();
	}
	
	/**
	 * Get the result.
	 * <p>
	 * If the operation has not been executed and no result was given, the result is prepared 
	 * (but not computed) first.
	 * @return
	 */
	public R getResult() {
		if (result == null)
			prepareResult();
		return result;
	}
	
	/**
	 * Execute the operation.
	 * @throws IllegalStateException if the operation has already been executed
	 */
	public final void execute() throws IllegalStateException {
		synchronized (this) {
			if (state != OperationState.VALIDATED)
				throw new IllegalStateException("Cannot execute " + method.getName() + " in state " + state);
			setState(OperationState.PREPARING);
		}
		long startTime = System.currentTimeMillis();
		try {
			prepareResult();
			setState(OperationState.EXECUTING);
			computeResult();
			setState(OperationState.FINALIZING);
			finalizeResult();
			setState(OperationState.COMPLETED);
		} catch (RuntimeException e) {
			setState(OperationState.FAILED);
			throw e;
		}
		logger.debug("{} executed in {} ms", method.getName(), System.currentTimeMillis() - startTime);
	}
	
	/**
	 * Get the operation reversing this one.
	 * @return
	 * @throws UnsupportedOperationException if the method is not reversible
	 */
	public Operation<R, S> getReverseOperation() throws UnsupportedOperationException {
		if (!isReversible())
			throw new UnsupportedOperationException(method.getName() + " is not reversible");
		return computeReverseOperation();
	}
	
	/**
	 * Decide the shape of the result and create it. Called before {@link #computeResult()}, 
	 * and by {@link #getResult()} on an operation that has not been executed.
	 */
	protected void prepareResult() {}
	
	/**
	 * Compute the result values.
	 */
	protected abstract void computeResult();
	
	/**
	 * Complete the result after computation.
	 */
	protected void finalizeResult() {}
	
	/**
	 * Create the reverse operation; only called for reversible methods.
	 * @return
	 */
	protected Operation<R, S> computeReverseOperation() {
		throw new UnsupportedOperationException(method.getName() + " does not define a reverse operation");
	}
	
	/**
	 * Resolve a parameter from its explicit value or, for optional parameters, its default.
	 * @param <T>
	 * @param parameter
	 * @return
	 */
	protected <T> T resolveParameter(OperationParameter<T> parameter) {
		return resolver.resolve(parameter);
	}
	
	/**
	 * Resolve a parameter from its explicit value, then the fallback, then its default.
	 * @param <T>
	 * @param parameter
	 * @param fallback evaluated only if no explicit value is given
	 * @return
	 */
	protected <T> T resolveParameter(OperationParameter<T> parameter, Supplier<? extends T> fallback) {
		return resolver.resolve(parameter, fallback);
	}
	
	/**
	 * Returns true if the bindings hold an entry for a parameter, even a null one.
	 * @param parameter
	 * @return
	 */
	protected boolean isProvidedParameter(OperationParameter<?> parameter) {
		return resolver.isProvided(parameter);
	}
	
	/**
	 * Returns true while {@link #execute()} is running.
	 * @return
	 */
	protected boolean isExecuting() {
		var current = state;
		return current == OperationState.PREPARING || current == OperationState.EXECUTING || current == OperationState.FINALIZING;
	}
	
	private void setState(OperationState newState) {
		logger.trace("{}: {} -> {}", method == null ? getClass().getSimpleName() : method.getName(), state, newState);
		state = newState;
	}

}
