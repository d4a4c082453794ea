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

package sc.fiji.curvekit.analysis;

import sc.fiji.curvekit.InvalidInputException;
import sc.fiji.curvekit.util.SamplingUtils;

/**
 * Chordal distances along an ordered point sequence.
 */
public class ArcLength {

	private ArcLength() {
	}

	/**
	 * Per-step chordal distances. Element 0 is {@code 0.0}; element {@code i}
	 * is the Euclidean distance between points {@code i-1} and {@code i}. Note
	 * that this is not a running total: see {@link #cumulative(double[], double[])}.
	 *
	 * @param x the x coordinates
	 * @param y the y coordinates
	 * @return the step lengths, prefixed by a leading zero
	 * @throws InvalidInputException if arrays differ in length or are empty
	 */
	public static double[] steps(final double[] x, final double[] y) throws InvalidInputException {
		SamplingUtils.requireSameLength(x, y, "x", "y");
		if (x.length < 1)
			throw new InvalidInputException("At least one point is required");
		final double[] dist = new double[x.length];
		for (int i = 1; i < x.length; i++)
			dist[i] = Math.hypot(x[i] - x[i - 1], y[i] - y[i - 1]);
		return dist;
	}

	/**
	 * Cumulative arc length: the running sum of {@link #steps(double[], double[])}.
	 * The last element is the polyline length.
	 */
	public static double[] cumulative(final double[] x, final double[] y) throws InvalidInputException {
		final double[] dist = steps(x, y);
		for (int i = 1; i < dist.length; i++)
			dist[i] += dist[i - 1];
		return dist;
	}

}
