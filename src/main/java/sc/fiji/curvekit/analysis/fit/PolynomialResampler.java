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

import java.util.Arrays;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.commons.math3.stat.StatUtils;

import sc.fiji.curvekit.CurveKitUtils;
import sc.fiji.curvekit.FittingException;
import sc.fiji.curvekit.InvalidInputException;
import sc.fiji.curvekit.util.SamplingUtils;

/**
 * Resamples a curve with a least-squares polynomial y(x) evaluated at
 * uniformly spaced x values over the sampled range. Unsuitable for closed or
 * multi-valued curves.
 */
public class PolynomialResampler implements CurveResampler {

	/** Largest accepted degree */
	public static final int MAX_DEGREE = Integer.MAX_VALUE - 1;

	private final int degree;

	/**
	 * @param degree the polynomial degree (>= 0)
	 */
	public PolynomialResampler(final int degree) {
		if (degree < 0 || degree > MAX_DEGREE)
			throw new InvalidInputException("Polynomial degree must be between 0 and " + MAX_DEGREE + ": " + degree);
		this.degree = degree;
	}

	@Override
	public ResampledCurve resample(final double[] x, final double[] y, final int length)
			throws InvalidInputException, FittingException {
		CurveResampler.validate(x, y, length);
		final PolynomialFunction polynomial = fit(x, y);
		final double[] xs = SamplingUtils.linspace(StatUtils.min(x), StatUtils.max(x), length);
		final double[] ys = new double[length];
		for (int i = 0; i < length; i++)
			ys[i] = polynomial.value(xs[i]);
		return new ResampledCurve(xs, ys);
	}

	/**
	 * Fits the least-squares polynomial.
	 *
	 * @return the fitted polynomial
	 * @throws FittingException if there are fewer distinct x values than
	 *                          coefficients or the fit did not converge
	 */
	public PolynomialFunction fit(final double[] x, final double[] y) throws FittingException {
		SamplingUtils.requireSameLength(x, y, "x", "y");
		final long distinct = Arrays.stream(x).distinct().count();
		if (distinct < (long) degree + 1)
			throw new FittingException("Degree " + degree + " fit requires at least " + ((long) degree + 1)
					+ " distinct x values but " + distinct + " were given");
		final WeightedObservedPoints obs = new WeightedObservedPoints();
		for (int i = 0; i < x.length; i++)
			obs.add(x[i], y[i]);
		final double[] coefficients;
		try {
			coefficients = PolynomialCurveFitter.create(degree).fit(obs.toList());
		} catch (final MathIllegalStateException | MathIllegalArgumentException ex) {
			throw new FittingException("Polynomial fit failed: " + ex.getMessage(), ex);
		}
		for (final double c : coefficients) {
			if (!Double.isFinite(c))
				throw new FittingException("Polynomial fit is ill-conditioned");
		}
		CurveKitUtils.log("Polynomial fit of degree " + degree + ": " + Arrays.toString(coefficients));
		return new PolynomialFunction(coefficients);
	}

	public int getDegree() {
		return degree;
	}

	@Override
	public ResamplingMode getMode() {
		return ResamplingMode.POLYNOMIAL;
	}

}
