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
 * Per-point tangent estimates of a sampled curve: the gradient dy/dx and the
 * position angle (direction of the tangent, in radians).
 * <p>
 * Interior points use centered differences over their two neighbors, end
 * points use one-sided differences. Vertical or zero-length steps are not
 * special-cased: the gradient becomes infinite or NaN while the position angle
 * stays defined.
 * </p>
 */
public class CurveGradient {

	private final double[] grad;
	private final double[] posang;

	/**
	 * Computes gradients and position angles of the curve (x, y).
	 *
	 * @param x the x coordinates
	 * @param y the y coordinates
	 * @throws InvalidInputException if arrays differ in length or hold fewer
	 *                               than two points
	 */
	public CurveGradient(final double[] x, final double[] y) throws InvalidInputException {
		SamplingUtils.requireSameLength(x, y, "x", "y");
		final int n = x.length;
		if (n < 2)
			throw new InvalidInputException("At least two points are required to estimate gradients");
		final double[] deltax = deltas(x);
		final double[] deltay = deltas(y);
		grad = new double[n];
		posang = new double[n];
		for (int i = 0; i < n; i++) {
			grad[i] = deltay[i] / deltax[i];
			posang[i] = Math.atan2(deltay[i], deltax[i]);
		}
	}

	private static double[] deltas(final double[] v) {
		final int n = v.length;
		final double[] d = new double[n];
		for (int i = 1; i < n - 1; i++)
			d[i] = v[i + 1] - v[i - 1];
		d[0] = v[1] - v[0];
		d[n - 1] = v[n - 1] - v[n - 2];
		return d;
	}

	/** @return dy/dx at each point */
	public double[] getGradients() {
		return grad;
	}

	/** @return the tangent direction at each point, in (-PI, PI] */
	public double[] getPositionAngles() {
		return posang;
	}

}
