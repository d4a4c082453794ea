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

package sc.fiji.curvekit.analysis.correlation;

import org.apache.commons.math3.stat.StatUtils;

import sc.fiji.curvekit.InvalidInputException;

/**
 * Normalized cross-correlation of two equal-length signals, truncated to the
 * central part of the full correlation so that the output has the same length
 * as the inputs.
 * <p>
 * Signal {@code a} is standardized and divided by its length, {@code v} is
 * standardized (population standard deviation). Element {@code i} of the
 * result is {@code Σ a'[m+k]·v'[m]} with {@code k = i - (n-1)/2}, so that
 * {@link #zeroLagIndex(int)} holds the zero-lag value and a positive lag means
 * {@code a} trails {@code v}. A constant signal yields NaN or infinite values
 * rather than an error.
 * </p>
 */
public final class NormalizedCrossCorrelator {

	private NormalizedCrossCorrelator() {
	}

	/**
	 * Correlates {@code a} against {@code v}.
	 *
	 * @param a the leading signal
	 * @param v the reference signal
	 * @return the normalized correlation, of length {@code a.length}
	 * @throws InvalidInputException if lengths differ or signals are empty
	 */
	public static double[] correlate(final double[] a, final double[] v) throws InvalidInputException {
		if (a == null || v == null) throw new InvalidInputException("Signals cannot be null");
		if (a.length != v.length)
			throw new InvalidInputException("Signals must be equal-length: " + a.length + " vs " + v.length);
		if (a.length == 0) throw new InvalidInputException("Signals cannot be empty");
		final int n = a.length;
		final double[] an = standardize(a, n);
		final double[] vn = standardize(v, 1);
		final int center = zeroLagIndex(n);
		final double[] result = new double[n];
		for (int i = 0; i < n; i++) {
			final int k = i - center;
			final int from = Math.max(0, -k);
			final int to = Math.min(n, n - k);
			double sum = 0;
			for (int m = from; m < to; m++)
				sum += an[m + k] * vn[m];
			result[i] = sum;
		}
		return result;
	}

	/**
	 * @param n the signal length
	 * @return the index of the zero-lag element in a correlation of length n
	 */
	public static int zeroLagIndex(final int n) {
		return (n - 1) / 2;
	}

	/**
	 * Converts an index of a correlation of length {@code n} into a lag.
	 */
	public static int lag(final int index, final int n) {
		return index - zeroLagIndex(n);
	}

	private static double[] standardize(final double[] values, final int scale) {
		final double mean = StatUtils.mean(values);
		final double std = Math.sqrt(StatUtils.populationVariance(values, mean));
		final double[] result = new double[values.length];
		for (int i = 0; i < values.length; i++)
			result[i] = (values[i] - mean) / (std * scale);
		return result;
	}

}
