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

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.stat.StatUtils;

import sc.fiji.curvekit.CurveKitUtils;
import sc.fiji.curvekit.FittingException;
import sc.fiji.curvekit.InvalidInputException;
import sc.fiji.curvekit.util.SamplingUtils;

/**
 * Resamples a curve with a one-dimensional smoothing spline y(x), evaluated at
 * uniformly spaced x values over the sampled range. The curve must be
 * single-valued in x and x must be strictly increasing.
 */
public class SplineResampler implements CurveResampler {

	private final double smoothing;

	/** Creates an interpolating (s = 0) resampler. */
	public SplineResampler() {
		this(0);
	}

	/**
	 * @param smoothing the smoothing factor: the maximum residual sum of
	 *                  squares. 0 interpolates every sample
	 */
	public SplineResampler(final double smoothing) {
		if (Double.isNaN(smoothing) || smoothing < 0)
			throw new InvalidInputException("Smoothing factor must be >= 0: " + smoothing);
		this.smoothing = smoothing;
	}

	@Override
	public ResampledCurve resample(final double[] x, final double[] y, final int length)
			throws InvalidInputException, FittingException {
		CurveResampler.validate(x, y, length);
		final SmoothingSpline spline = new SmoothingSpline(x, y, smoothing);
		final double[] xs = SamplingUtils.linspace(StatUtils.min(x), StatUtils.max(x), length);
		final double[] ys;
		try {
			ys = spline.values(0, xs);
		} catch (final MathIllegalArgumentException | MathIllegalStateException ex) {
			throw new FittingException("Could not evaluate spline: " + ex.getMessage(), ex);
		}
		CurveKitUtils.log(String.format("Spline: %d points, s=%s, residual=%s", x.length,
				CurveKitUtils.formatDouble(smoothing, 2), CurveKitUtils.formatDouble(spline.getResidual(), 3)));
		return new ResampledCurve(xs, ys);
	}

	public double getSmoothing() {
		return smoothing;
	}

	@Override
	public ResamplingMode getMode() {
		return ResamplingMode.SPLINE;
	}

}
