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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;

import org.junit.jupiter.api.Test;

import geospectra.lib.operations.OperationArgumentException.Reason;
import geospectra.lib.operations.parameters.OperationParameter;
import geospectra.lib.operations.parameters.ParameterBindings;
import geospectra.lib.operations.parameters.ParameterConditions;

@SuppressWarnings("javadoc")
public class TestOperation {
	
	private static final OperationParameter<Double> FACTOR = OperationParameter.createRequiredParameter(
			"TEST::1", "Factor", null, Double.class, ParameterConditions.isPositive());
	
	private static final OperationParameter<Double> OFFSET = OperationParameter.createOptionalParameter(
			"TEST::2", "Offset", null, Double.class, 0.0);
	
	private static final OperationParameter<Double> UNRELATED = OperationParameter.createOptionalParameter(
			"TEST::3", "Unrelated", null, Double.class, 0.0);
	
	private static final OperationMethod SCALE = new OperationMethod("TEST::SCALE", "Scale", null, null, "1.0", 
			true, EnumSet.allOf(ExecutionMode.class), FACTOR, OFFSET);
	
	private static final OperationMethod SCALE_OUT_OF_PLACE = OperationMethod.createMethod("TEST::SCALE_OUT", "Scale out of place", null, 
			EnumSet.of(ExecutionMode.OUT_PLACE), FACTOR);
	
	/**
	 * Multiplies an array by a factor, then adds an offset.
	 */
	static class ScaleOperation extends Operation<double[], double[]> {
		
		private final double factor;
		private final double offset;
		private boolean failing = false;
		
		ScaleOperation(double[] source, double[] result, OperationMethod method, ParameterBindings parameters) {
			super(source, result, method, parameters);
			this.factor = resolveParameter(FACTOR);
			this.offset = isProvidedParameter(OFFSET) ? resolveParameter(OFFSET) : 0;
		}

		@Override
		protected void prepareResult() {
			if (result == null)
				result = new double[getSource().length];
		}

		@Override
		protected void computeResult() {
			if (failing)
				throw new IllegalStateException("Computation failed");
			for (int i = 0; i < getSource().length; i++)
				result[i] = getSource()[i] * factor + offset;
		}
		
		@Override
		protected Operation<double[], double[]> computeReverseOperation() {
			var parameters = ParameterBindings.create()
					.put(FACTOR, 1.0 / factor)
					.put(OFFSET, -offset / factor);
			return new ScaleOperation(getResult(), null, getMethod(), parameters);
		}
		
	}
	
	@Test
	public void test_lifecycle() {
		var op = new ScaleOperation(new double[] {1, 2, 3}, null, SCALE, ParameterBindings.create().put(FACTOR, 2.0));
		assertEquals(OperationState.VALIDATED, op.getState());
		op.execute();
		assertEquals(OperationState.COMPLETED, op.getState());
		assertTrue(op.getState().isTerminal());
		assertArrayEquals(new double[] {2, 4, 6}, op.getResult());
		assertThrows(IllegalStateException.class, () -> op.execute());
	}
	
	@Test
	public void test_failure() {
		var op = new ScaleOperation(new double[] {1}, null, SCALE, ParameterBindings.create().put(FACTOR, 2.0));
		op.failing = true;
		assertThrows(IllegalStateException.class, () -> op.execute());
		assertEquals(OperationState.FAILED, op.getState());
		assertThrows(IllegalStateException.class, () -> op.execute());
	}
	
	@Test
	public void test_inPlace() {
		double[] values = {1, 2};
		var op = new ScaleOperation(values, values, SCALE, ParameterBindings.create().put(FACTOR, 3.0));
		op.execute();
		assertSame(values, op.getResult());
		assertArrayEquals(new double[] {3, 6}, values);
		
		var e = assertThrows(OperationArgumentException.class, 
				() -> new ScaleOperation(values, values, SCALE_OUT_OF_PLACE, ParameterBindings.create().put(FACTOR, 3.0)));
		assertEquals(Reason.IN_PLACE_NOT_SUPPORTED, e.getReason());
	}
	
	@Test
	public void test_invalidArguments() {
		var bindings = ParameterBindings.create().put(FACTOR, 2.0);
		var e = assertThrows(OperationArgumentException.class, () -> new ScaleOperation(null, null, SCALE, bindings));
		assertEquals(Reason.NULL_SOURCE, e.getReason());
		
		e = assertThrows(OperationArgumentException.class, () -> new ScaleOperation(new double[1], null, SCALE, null));
		assertEquals(Reason.MISSING_REQUIRED_PARAMETER, e.getReason());
		assertEquals(FACTOR, e.getParameter());
		
		e = assertThrows(OperationArgumentException.class, 
				() -> new ScaleOperation(new double[1], null, SCALE, ParameterBindings.create().put(FACTOR, -1.0)));
		assertEquals(Reason.INVALID_PARAMETER_VALUE, e.getReason());
		
		e = assertThrows(OperationArgumentException.class, 
				() -> new ScaleOperation(new double[1], null, SCALE, ParameterBindings.create().putValue(FACTOR, "two")));
		assertEquals(Reason.INVALID_PARAMETER_VALUE, e.getReason());
		
		assertThrows(IllegalArgumentException.class, () -> new ScaleOperation(new double[1], null, null, bindings));
	}
	
	@Test
	public void test_unrelatedParametersDropped() {
		var bindings = ParameterBindings.create().put(FACTOR, 2.0).put(UNRELATED, 1.0);
		var op = new ScaleOperation(new double[1], null, SCALE, bindings);
		assertTrue(op.getParameters().contains(FACTOR));
		assertFalse(op.getParameters().contains(UNRELATED));
		assertEquals(2, bindings.size());
	}
	
	@Test
	public void test_reverse() {
		var op = new ScaleOperation(new double[] {1, 2}, null, SCALE, 
				ParameterBindings.create().put(FACTOR, 2.0).put(OFFSET, 1.0));
		op.execute();
		assertArrayEquals(new double[] {3, 5}, op.getResult());
		var reverse = op.getReverseOperation();
		reverse.execute();
		assertArrayEquals(new double[] {1, 2}, reverse.getResult(), 1e-12);
		
		var notReversible = new ScaleOperation(new double[] {1}, null, SCALE_OUT_OF_PLACE, ParameterBindings.create().put(FACTOR, 2.0));
		assertThrows(UnsupportedOperationException.class, () -> notReversible.getReverseOperation());
	}
	
	@Test
	public void test_resultBeforeExecution() {
		var op = new ScaleOperation(new double[] {1, 2}, null, SCALE, ParameterBindings.create().put(FACTOR, 2.0));
		var prepared = op.getResult();
		assertArrayEquals(new double[2], prepared);
		assertEquals(OperationState.VALIDATED, op.getState());
		op.execute();
		assertSame(prepared, op.getResult());
		assertArrayEquals(new double[] {2, 4}, prepared);
	}

}
