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
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import sc.fiji.curvekit.FittingException;
import sc.fiji.curvekit.InvalidInputException;
import sc.fiji.curvekit.util.ImgUtils;
import sc.fiji.curvekit.util.Logger;

/**
 * Least-squares fit of a {@link TwoDGaussian} to the pixels of a 2-D image
 * (e.g., a compact source cut out of a larger frame). Pixel (x, y) is located
 * at dimension 0 = x and dimension 1 = y.
 *
 * @see LevenbergMarquardtOptimizer
 */
public class GaussianSourceFitter<T extends RealType<T>> {

	private static final int MAX_EVALUATIONS = 10000;
	private static final int MAX_ITERATIONS = 1000;

	private final RandomAccessibleInterval<T> rai;
	private final double[] xs;
	private final double[] ys;
	private final double[] observed;
	private final Logger logger;
	private double rms = Double.NaN;
	private int iterations;

	public GaussianSourceFitter(final RandomAccessibleInterval<T> rai) {
		if (rai == null)
			throw new InvalidInputException("Image cannot be null");
		if (rai.numDimensions() != 2)
			throw new InvalidInputException("A 2-D image is required but image has " + rai.numDimensions()
					+ " dimensions");
		this.rai = rai;
		final int n = (int) (rai.dimension(0) * rai.dimension(1));
		if (n < TwoDGaussian.N_PARAMS)
			throw new InvalidInputException("Image has fewer pixels than model parameters");
		xs = new double[n];
		ys = new double[n];
		observed = new double[n];
		final Cursor<T> cursor = Views.flatIterable(rai).localizingCursor();
		int i = 0;
		while (cursor.hasNext()) {
			cursor.fwd();
			xs[i] = cursor.getDoublePosition(0);
			ys[i] = cursor.getDoublePosition(1);
			observed[i++] = cursor.get().getRealDouble();
		}
		logger = new Logger(GaussianSourceFitter.class);
	}

	/**
	 * Convenience factory for row-major arrays addressed {@code z[row][col]}: x
	 * runs along columns and y along rows.
	 */
	public static GaussianSourceFitter<DoubleType> of(final double[][] z) {
		return new GaussianSourceFitter<>(ImgUtils.wrap(z));
	}

	/**
	 * Estimates a starting point from image moments: background from the
	 * minimum, amplitude from the range, centre and widths from the first and
	 * second moments of the background-subtracted intensities.
	 *
	 * @return the initial guess
	 */
	public TwoDGaussian estimate() {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (final double v : observed) {
			min = Math.min(min, v);
			max = Math.max(max, v);
		}
		double sum = 0;
		double mx = 0;
		double my = 0;
		for (int i = 0; i < observed.length; i++) {
			final double w = observed[i] - min;
			sum += w;
			mx += w * xs[i];
			my += w * ys[i];
		}
		if (!(sum > 0)) {
			// flat image: centre of the field, unit widths
			return new TwoDGaussian(0, rai.min(0) + (rai.dimension(0) - 1) / 2d,
					rai.min(1) + (rai.dimension(1) - 1) / 2d, 1, 1, 0, min);
		}
		mx /= sum;
		my /= sum;
		double vx = 0;
		double vy = 0;
		for (int i = 0; i < observed.length; i++) {
			final double w = observed[i] - min;
			vx += w * (xs[i] - mx) * (xs[i] - mx);
			vy += w * (ys[i] - my) * (ys[i] - my);
		}
		final double sx = Math.max(1, Math.sqrt(vx / sum));
		final double sy = Math.max(1, Math.sqrt(vy / sum));
		return new TwoDGaussian(max - min, mx, my, sx, sy, 0, min);
	}

	/** Fits starting from {@link #estimate()}. */
	public TwoDGaussian fit() throws FittingException {
		return fit(estimate());
	}

	/**
	 * Fits the model to the image.
	 *
	 * @param guess the starting parameters
	 * @return the fitted model
	 * @throws FittingException if the optimizer does not converge or the
	 *                          problem is singular
	 */
	public TwoDGaussian fit(final TwoDGaussian guess) throws FittingException {
		if (guess == null)
			throw new InvalidInputException("Initial guess cannot be null");
		final LeastSquaresProblem problem = new LeastSquaresBuilder()
				.start(guess.toArray())
				.model(this::model, this::jacobian)
				.target(observed)
				.lazyEvaluation(false)
				.maxEvaluations(MAX_EVALUATIONS)
				.maxIterations(MAX_ITERATIONS)
				.build();
		final LeastSquaresOptimizer.Optimum optimum;
		try {
			optimum = new LevenbergMarquardtOptimizer().optimize(problem);
		} catch (final MathIllegalStateException | MathIllegalArgumentException ex) {
			throw new FittingException("Gaussian fit failed: " + ex.getMessage(), ex);
		}
		rms = optimum.getRMS();
		iterations = optimum.getIterations();
		final TwoDGaussian result = TwoDGaussian.fromArray(optimum.getPoint().toArray());
		logger.debug("Fitted " + result + " after " + iterations + " iterations (RMS=" + rms + ")");
		return result;
	}

	private double[] model(final double[] params) {
		final double[] values = new double[observed.length];
		for (int i = 0; i < values.length; i++)
			values[i] = TwoDGaussian.value(xs[i], ys[i], params);
		return values;
	}

	private double[][] jacobian(final double[] params) {
		final double[][] jac = new double[observed.length][TwoDGaussian.N_PARAMS];
		for (int i = 0; i < jac.length; i++)
			TwoDGaussian.gradient(xs[i], ys[i], params, jac[i]);
		return jac;
	}

	/** @return the root-mean-square residual of the last fit, NaN if no fit was performed */
	public double getRMS() {
		return rms;
	}

	public int getIterations() {
		return iterations;
	}

}
