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

import sc.fiji.curvekit.CurveKitUtils;
import sc.fiji.curvekit.FittingException;
import sc.fiji.curvekit.InvalidInputException;
import sc.fiji.curvekit.analysis.ArcLength;
import sc.fiji.curvekit.util.SamplingUtils;

/**
 * Resamples a curve with a parametric smoothing spline: x and y are smoothed
 * jointly as functions of the normalized chord length u ∈ [0, 1] and evaluated
 * at uniformly spaced parameter values. Works for closed, self-intersecting or
 * vertical curves.
 */
public class ParametricSplineResampler implements CurveResampler {

	private final double smoothing;

	/** Creates an interpolating (s = 0) resampler. */
	public ParametricSplineResampler() {
		this(0);
	}

	/**
	 * @param smoothing the smoothing factor: the maximum sum of squared
	 *                  distances between the input points and the curve. 0
	 *                  interpolates every point
	 */
	public ParametricSplineResampler(final double smoothing) {
		if (Double.isNaN(smoothing) || smoothing < 0)
			throw new InvalidInputException("Smoothing factor must be >= 0: " + smoothing);
		this.smoothing = smoothing;
	}

	@Override
	public ResampledCurve resample(final double[] x, final double[] y, final int length)
			throws InvalidInputException, FittingException {
		CurveResampler.validate(x, y, length);
		final double[] u = ArcLength.cumulative(x, y);
		final double total = u[u.length - 1];
		if (!(total > 0))
			throw new FittingException("Curve has zero length");
		for (int i = 0; i < u.length; i++)
			u[i] /= total;
		if (!SamplingUtils.isStrictlyIncreasing(u))
			throw new FittingException("Curve contains repeated consecutive points");
		final SmoothingSpline spline = new SmoothingSpline(u, new double[][] { x, y }, smoothing);
		CurveKitUtils.log(String.format("Parametric spline: %d points, s=%s, residual=%s", x.length,
				CurveKitUtils.formatDouble(smoothing, 2), CurveKitUtils.formatDouble(spline.getResidual(), 3)));
		final double[] us = SamplingUtils.linspace(0, u[u.length - 1], length);
		return new ResampledCurve(spline.values(0, us), spline.values(1, us));
	}

	public double getSmoothing() {
		return smoothing;
	}

	@Override
	public ResamplingMode getMode() {
		return ResamplingMode.PARAMETRIC_SPLINE;
	}

}
