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

import sc.fiji.curvekit.FittingException;
import sc.fiji.curvekit.InvalidInputException;

/**
 * Resamples raw, possibly irregularly spaced curve samples onto a fixed number
 * of uniformly spaced points and annotates the result with gradients and
 * position angles.
 *
 * @see ResamplingMode
 */
public interface CurveResampler {

	/**
	 * Resamples the curve (x, y).
	 *
	 * @param x      the x coordinates of the raw samples
	 * @param y      the y coordinates of the raw samples
	 * @param length the number of output samples (>= 2)
	 * @return the resampled curve
	 * @throws InvalidInputException if arrays are mismatched, hold fewer than
	 *                               two points or {@code length < 2}
	 * @throws FittingException      if the underlying fit is singular or
	 *                               under-determined
	 */
	ResampledCurve resample(double[] x, double[] y, int length) throws InvalidInputException, FittingException;

	ResamplingMode getMode();

	/**
	 * Creates a resampler for the specified mode.
	 *
	 * @param mode      the resampling strategy
	 * @param parameter the smoothing factor for spline modes, the polynomial
	 *                  degree for {@link ResamplingMode#POLYNOMIAL}
	 * @return the resampler
	 */
	static CurveResampler create(final ResamplingMode mode, final double parameter) {
		if (mode == null)
			throw new InvalidInputException("Resampling mode cannot be null");
		switch (mode) {
			case PARAMETRIC_SPLINE:
				return new ParametricSplineResampler(parameter);
			case POLYNOMIAL:
				if (parameter != Math.rint(parameter))
					throw new InvalidInputException("Polynomial degree must be an integer: " + parameter);
				if (parameter > PolynomialResampler.MAX_DEGREE)
					throw new InvalidInputException("Polynomial degree too large: " + parameter);
				return new PolynomialResampler((int) parameter);
			case SPLINE:
				return new SplineResampler(parameter);
			default:
				throw new IllegalArgumentException("Unknown resampling mode: " + mode);
		}
	}

	/**
	 * Validates the common arguments of {@link #resample(double[], double[], int)}.
	 */
	static void validate(final double[] x, final double[] y, final int length) throws InvalidInputException {
		if (x == null || y == null)
			throw new InvalidInputException("Coordinates cannot be null");
		if (x.length != y.length)
			throw new InvalidInputException("x and y must be equal-length: " + x.length + " vs " + y.length);
		if (x.length < 2)
			throw new InvalidInputException("At least two points are required");
		if (length < 2)
			throw new InvalidInputException("Resampled length must be >= 2: " + length);
	}

}
