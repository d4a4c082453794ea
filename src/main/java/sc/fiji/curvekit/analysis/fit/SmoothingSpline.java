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

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.analysis.solvers.AllowedSolution;
import org.apache.commons.math3.analysis.solvers.BracketingNthOrderBrentSolver;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;

import sc.fiji.curvekit.CurveKitUtils;
import sc.fiji.curvekit.FittingException;
import sc.fiji.curvekit.InvalidInputException;
import sc.fiji.curvekit.util.SamplingUtils;

/**
 * Cubic smoothing spline of one or more series sampled at common, strictly
 * increasing abscissae.
 * <p>
 * The spline g minimizes the roughness {@code ∫ g''(x)² dx} subject to
 * {@code Σ (y_i - g(x_i))² <= s}, the residual being summed over all series
 * (Reinsch, 1967). A smoothing factor of 0 yields the natural cubic
 * interpolating spline. Fitted ordinates are obtained by solving the banded
 * system {@code (R + αQᵀQ)γ = Qᵀy}; the Lagrange weight α is located with a
 * bracketing Brent solver so that the residual matches {@code s} without
 * exceeding it. The fitted
 * ordinates are then interpolated by a natural spline, which is the smoothing
 * spline itself.
 * </p>
 *
 * @see SplineInterpolator
 */
public class SmoothingSpline {

	/** Minimum number of samples for a cubic fit */
	public static final int MIN_POINTS = 4;

	/* search range of log10(α / mean(h)³) */
	private static final double LOG_ALPHA_MIN = -8;
	private static final double LOG_ALPHA_MAX = 12;
	/* the lower bound is lowered in steps down to this floor for large-magnitude data */
	private static final double LOG_ALPHA_FLOOR = -60;
	private static final double LOG_ALPHA_STEP = 4;
	private static final int MAX_EVAL = 200;

	private final double[] x;
	private final double[] h;
	private final PolynomialSplineFunction[] functions;
	private double alpha;
	private double residual;

	/**
	 * Fits a single series.
	 *
	 * @param x the strictly increasing abscissae
	 * @param y the ordinates
	 * @param s the smoothing factor (>= 0)
	 */
	public SmoothingSpline(final double[] x, final double[] y, final double s) {
		this(x, new double[][] { y }, s);
	}

	/**
	 * Fits several series jointly: a single smoothing weight is shared so that
	 * the combined residual of all series matches {@code s}. This is how a
	 * parametric curve (x(u), y(u)) is smoothed.
	 *
	 * @param x  the strictly increasing abscissae (the curve parameter)
	 * @param ys the ordinates of each series
	 * @param s  the smoothing factor (>= 0)
	 * @throws InvalidInputException if arrays are mismatched or s is invalid
	 * @throws FittingException      if fewer than {@value #MIN_POINTS} samples
	 *                               are given or abscissae are not strictly
	 *                               increasing
	 */
	public SmoothingSpline(final double[] x, final double[][] ys, final double s)
			throws InvalidInputException, FittingException {
		if (ys == null || ys.length == 0)
			throw new InvalidInputException("At least one series is required");
		for (final double[] y : ys)
			SamplingUtils.requireSameLength(x, y, "x", "y");
		if (Double.isNaN(s) || s < 0)
			throw new InvalidInputException("Smoothing factor must be >= 0: " + s);
		if (x.length < MIN_POINTS)
			throw new FittingException("Cubic spline requires at least " + MIN_POINTS + " points but "
					+ x.length + " were given");
		if (!SamplingUtils.isStrictlyIncreasing(x))
			throw new FittingException("Spline abscissae must be strictly increasing (duplicate or unsorted values)");
		this.x = x.clone();
		h = new double[x.length - 1];
		for (int i = 0; i < h.length; i++)
			h[i] = x[i + 1] - x[i];

		final double[][] fitted;
		if (s == 0) {
			fitted = ys;
		} else {
			alpha = solveAlpha(ys, s);
			fitted = smooth(alpha, ys);
		}
		functions = new PolynomialSplineFunction[ys.length];
		final SplineInterpolator interpolator = new SplineInterpolator();
		try {
			for (int k = 0; k < ys.length; k++)
				functions[k] = interpolator.interpolate(this.x, fitted[k]);
		} catch (final MathIllegalArgumentException ex) {
			throw new FittingException("Spline interpolation failed: " + ex.getMessage(), ex);
		}
	}

	private double solveAlpha(final double[][] ys, final double s) {
		double meanH = 0;
		for (final double step : h)
			meanH += step;
		meanH /= h.length;
		final double scale = meanH * meanH * meanH;
		final UnivariateFunction f = t -> {
			smooth(scale * Math.pow(10, t), ys);
			return residual / s - 1;
		};
		if (f.value(LOG_ALPHA_MAX) <= 0) {
			CurveKitUtils.log("Smoothing factor " + s + " exceeds the residual of the smoothest fit ("
					+ CurveKitUtils.formatDouble(residual, 3) + ")");
			return scale * Math.pow(10, LOG_ALPHA_MAX);
		}
		double lower = LOG_ALPHA_MIN;
		while (f.value(lower) > 0) {
			if (lower <= LOG_ALPHA_FLOOR) {
				CurveKitUtils.log("Smoothing factor " + s + " cannot be met by smoothing: interpolating");
				return 0;
			}
			lower = Math.max(LOG_ALPHA_FLOOR, lower - LOG_ALPHA_STEP);
		}
		try {
			// the residual grows with α: solutions below the root satisfy residual <= s
			final double t = new BracketingNthOrderBrentSolver(1e-14, 1e-10, 0, 5).solve(MAX_EVAL, f, lower,
					LOG_ALPHA_MAX, AllowedSolution.BELOW_SIDE);
			return scale * Math.pow(10, t);
		} catch (final MathIllegalStateException | MathIllegalArgumentException ex) {
			throw new FittingException("Could not determine smoothing weight for s=" + s, ex);
		}
	}

	/*
	 * Fitted ordinates for a given weight. Also updates the residual.
	 */
	private double[][] smooth(final double alpha, final double[][] ys) {
		final int n = x.length;
		final int m = n - 2;
		// pentadiagonal R + αQᵀQ: main, first and second super-diagonals
		final double[] d0 = new double[m];
		final double[] d1 = new double[m];
		final double[] d2 = new double[m];
		for (int a = 0; a < m; a++) {
			final int j = a + 1;
			final double ih0 = 1 / h[j - 1];
			final double ih1 = 1 / h[j];
			d0[a] = (h[j - 1] + h[j]) / 3 + alpha * (ih0 * ih0 + (ih0 + ih1) * (ih0 + ih1) + ih1 * ih1);
			if (a + 1 < m) {
				final double ih2 = 1 / h[j + 1];
				d1[a] = h[j] / 6 - alpha * ((ih0 + ih1) * ih1 + ih1 * (ih1 + ih2));
				if (a + 2 < m)
					d2[a] = alpha * ih1 * ih2;
			}
		}
		final double[][] chol = choleskyBand(d0, d1, d2);

		residual = 0;
		final double[][] fitted = new double[ys.length][];
		for (int k = 0; k < ys.length; k++) {
			final double[] y = ys[k];
			final double[] rhs = new double[m];
			for (int a = 0; a < m; a++) {
				final int j = a + 1;
				rhs[a] = (y[j + 1] - y[j]) / h[j] - (y[j] - y[j - 1]) / h[j - 1];
			}
			final double[] gamma = solveBand(chol, rhs);
			final double[] qg = new double[n];
			for (int a = 0; a < m; a++) {
				final int j = a + 1;
				qg[j - 1] += gamma[a] / h[j - 1];
				qg[j] -= gamma[a] * (1 / h[j - 1] + 1 / h[j]);
				qg[j + 1] += gamma[a] / h[j];
			}
			final double[] g = new double[n];
			for (int i = 0; i < n; i++) {
				final double delta = alpha * qg[i];
				g[i] = y[i] - delta;
				residual += delta * delta;
			}
			fitted[k] = g;
		}
		return fitted;
	}

	/* Cholesky factor of a symmetric matrix with half-bandwidth 2 */
	private static double[][] choleskyBand(final double[] d0, final double[] d1, final double[] d2) {
		final int m = d0.length;
		final double[] l0 = new double[m];
		final double[] l1 = new double[m];
		final double[] l2 = new double[m];
		for (int i = 0; i < m; i++) {
			if (i >= 2)
				l2[i] = d2[i - 2] / l0[i - 2];
			if (i >= 1)
				l1[i] = (d1[i - 1] - ((i >= 2) ? l2[i] * l1[i - 1] : 0)) / l0[i - 1];
			final double diag = d0[i] - l1[i] * l1[i] - l2[i] * l2[i];
			if (!(diag > 0))
				throw new FittingException("Spline system is not positive definite");
			l0[i] = Math.sqrt(diag);
		}
		return new double[][] { l0, l1, l2 };
	}

	private static double[] solveBand(final double[][] chol, final double[] b) {
		final double[] l0 = chol[0];
		final double[] l1 = chol[1];
		final double[] l2 = chol[2];
		final int m = b.length;
		final double[] z = new double[m];
		for (int i = 0; i < m; i++) {
			double sum = b[i];
			if (i >= 1) sum -= l1[i] * z[i - 1];
			if (i >= 2) sum -= l2[i] * z[i - 2];
			z[i] = sum / l0[i];
		}
		final double[] sol = new double[m];
		for (int i = m - 1; i >= 0; i--) {
			double sum = z[i];
			if (i + 1 < m) sum -= l1[i + 1] * sol[i + 1];
			if (i + 2 < m) sum -= l2[i + 2] * sol[i + 2];
			sol[i] = sum / l0[i];
		}
		return sol;
	}

	/** @return the value of the first series at t */
	public double value(final double t) {
		return value(0, t);
	}

	/** @return the value of series {@code series} at t */
	public double value(final int series, final double t) {
		return functions[series].value(t);
	}

	public double[] values(final int series, final double[] ts) {
		final double[] values = new double[ts.length];
		for (int i = 0; i < ts.length; i++)
			values[i] = functions[series].value(ts[i]);
		return values;
	}

	public PolynomialSplineFunction getFunction(final int series) {
		return functions[series];
	}

	/** @return the residual sum of squares of the fit (0 for interpolating splines) */
	public double getResidual() {
		return residual;
	}

	/** @return the Lagrange weight of the smoothing term (0 for interpolating splines) */
	public double getWeight() {
		return alpha;
	}

	public int getNumSeries() {
		return functions.length;
	}

}
