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

package sc.fiji.curvekit.util;

import sc.fiji.curvekit.InvalidInputException;

/**
 * Static helpers for 1-D sample arrays
 */
public class SamplingUtils {

	private SamplingUtils() {
	}

	/**
	 * Evenly spaced samples over a closed interval. The first and last elements
	 * are exactly {@code start} and {@code stop}.
	 *
	 * @param start the first value
	 * @param stop  the last value
	 * @param num   number of samples. 0 yields an empty array and 1 yields
	 *              {@code [start]}
	 * @return the samples
	 */
	public static double[] linspace(final double start, final double stop, final int num) {
		if (num < 0)
			throw new InvalidInputException("Number of samples must be non-negative: " + num);
		final double[] values = new double[num];
		if (num == 0)
			return values;
		values[0] = start;
		if (num == 1)
			return values;
		final double step = (stop - start) / (num - 1);
		for (int i = 1; i < num - 1; i++)
			values[i] = start + i * step;
		values[num - 1] = stop;
		return values;
	}

	public static double sum(final double[] values) {
		double sum = 0;
		for (final double v : values)
			sum += v;
		return sum;
	}

	/**
	 * Index of the first occurrence of the largest value. NaN ranks above
	 * every number, so the index of the first NaN is returned when there is one.
	 */
	public static int argmax(final double[] values) {
		int idx = 0;
		for (int i = 0; i < values.length; i++) {
			if (Double.isNaN(values[i]))
				return i;
			if (values[i] > values[idx])
				idx = i;
		}
		return idx;
	}

	public static boolean isStrictlyIncreasing(final double[] values) {
		for (int i = 1; i < values.length; i++) {
			if (!(values[i] > values[i - 1]))
				return false;
		}
		return true;
	}

	public static void requireSameLength(final double[] x, final double[] y, final String xName, final String yName) {
		if (x == null || y == null)
			throw new InvalidInputException(xName + " and " + yName + " cannot be null");
		if (x.length != y.length)
			throw new InvalidInputException(xName + " and " + yName + " must be equal-length: " + x.length + " vs " + y.length);
	}

}
