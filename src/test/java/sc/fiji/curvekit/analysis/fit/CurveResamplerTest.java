/*
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package sc.fiji.curvekit.analysis.fit;

import static org.junit.Assert.*;

import org.junit.Test;

import sc.fiji.curvekit.FittingException;
import sc.fiji.curvekit.InvalidInputException;

/**
 * Tests for {@link CurveResampler} implementations
 */
public class CurveResamplerTest {

	private static double[] range(final int n) {
		final double[] values = new double[n];
		for (int i = 0; i < n; i++) values[i] = i;
		return values;
	}

	@Test
	public void testPolynomialReproducesLine() {
		final double[] x = { 0, 1, 2, 3, 4, 5 };
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) y[i] = 2 * x[i] + 1;
		final CurveResampler resampler = CurveResampler.create(ResamplingMode.POLYNOMIAL, 1);
		assertEquals(ResamplingMode.POLYNOMIAL, resampler.getMode());
		final ResampledCurve curve = resampler.resample(x, y, 11);
		assertEquals("Resampled length should be honored", 11, curve.size());
		assertEquals("First x should be the minimum", 0, curve.getXs()[0], 1e-12);
		assertEquals("Last x should be the maximum", 5, curve.getXs()[10], 1e-12);
		for (int i = 0; i < curve.size(); i++) {
			assertEquals("y should lie on the line", 2 * curve.getXs()[i] + 1, curve.getYs()[i], 1e-6);
			assertEquals("Gradient of y = 2x+1 should be 2", 2, curve.getGradients()[i], 1e-6);
		}
	}

	@Test(expected = FittingException.class)
	public void testPolynomialUnderdetermined() {
		CurveResampler.create(ResamplingMode.POLYNOMIAL, 2).resample(new double[] { 1, 1, 2, 2 },
				new double[] { 0, 1, 2, 3 }, 10);
	}

	@Test(expected = InvalidInputException.class)
	public void testPolynomialNegativeDegree() {
		CurveResampler.create(ResamplingMode.POLYNOMIAL, -1);
	}

	@Test(expected = InvalidInputException.class)
	public void testPolynomialFractionalDegree() {
		CurveResampler.create(ResamplingMode.POLYNOMIAL, 1.5);
	}

	@Test(expected = InvalidInputException.class)
	public void testPolynomialInfiniteDegree() {
		CurveResampler.create(ResamplingMode.POLYNOMIAL, Double.POSITIVE_INFINITY);
	}

	@Test(expected = InvalidInputException.class)
	public void testPolynomialDegreeOverflow() {
		new PolynomialResampler(Integer.MAX_VALUE);
	}

	@Test(expected = FittingException.class)
	public void testPolynomialLargestDegreeIsUnderdetermined() {
		new PolynomialResampler(PolynomialResampler.MAX_DEGREE).resample(range(5), range(5), 10);
	}

	@Test
	public void testSplineInterpolatesSamples() {
		final double[] x = range(10);
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) y[i] = x[i] * x[i];
		final ResampledCurve curve = CurveResampler.create(ResamplingMode.SPLINE, 0).resample(x, y, 10);
		assertArrayEquals("Uniform grid should coincide with the samples", x, curve.getXs(), 1e-12);
		assertArrayEquals("Interpolating spline should pass through every sample", y, curve.getYs(), 1e-9);
	}

	@Test(expected = FittingException.class)
	public void testSplineDuplicateAbscissae() {
		final double[] x = { 0, 1, 1, 2, 3 };
		final double[] y = { 0, 1, 2, 3, 4 };
		CurveResampler.create(ResamplingMode.SPLINE, 0).resample(x, y, 20);
	}

	@Test(expected = FittingException.class)
	public void testSplineTooFewPoints() {
		CurveResampler.create(ResamplingMode.SPLINE, 0).resample(new double[] { 0, 1, 2 },
				new double[] { 0, 1, 0 }, 20);
	}

	@Test(expected = InvalidInputException.class)
	public void testNegativeSmoothing() {
		CurveResampler.create(ResamplingMode.SPLINE, -0.5);
	}

	@Test(expected = InvalidInputException.class)
	public void testLengthTooSmall() {
		CurveResampler.create(ResamplingMode.SPLINE, 0).resample(range(5), range(5), 1);
	}

	@Test(expected = InvalidInputException.class)
	public void testMismatchedLengths() {
		CurveResampler.create(ResamplingMode.PARAMETRIC_SPLINE, 0).resample(range(5), range(4), 10);
	}

	@Test
	public void testParametricSplineFollowsArc() {
		final int n = 20;
		final double[] x = new double[n];
		final double[] y = new double[n];
		for (int i = 0; i < n; i++) {
			final double theta = Math.PI * i / (n - 1);
			x[i] = Math.cos(theta);
			y[i] = Math.sin(theta);
		}
		final ResampledCurve curve = CurveResampler.create(ResamplingMode.PARAMETRIC_SPLINE, 0).resample(x, y, 50);
		assertEquals(50, curve.size());
		assertEquals("Curve should start at the first sample", x[0], curve.getXs()[0], 1e-9);
		assertEquals(y[0], curve.getYs()[0], 1e-9);
		assertEquals("Curve should end at the last sample", x[n - 1], curve.getXs()[49], 1e-9);
		assertEquals(y[n - 1], curve.getYs()[49], 1e-9);
		for (int i = 0; i < curve.size(); i++) {
			assertEquals("Resampled points should stay on the unit circle", 1,
					Math.hypot(curve.getXs()[i], curve.getYs()[i]), 1e-2);
		}
		// halfway along the arc the tangent points left
		assertEquals(Math.PI, Math.abs(curve.getPositionAngles()[25]), 0.2);
	}

	@Test(expected = FittingException.class)
	public void testParametricSplineRepeatedPoints() {
		final double[] x = { 0, 1, 1, 2, 3 };
		final double[] y = { 0, 1, 1, 0, 1 };
		CurveResampler.create(ResamplingMode.PARAMETRIC_SPLINE, 0).resample(x, y, 10);
	}

}
