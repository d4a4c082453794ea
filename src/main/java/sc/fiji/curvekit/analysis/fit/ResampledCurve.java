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

import sc.fiji.curvekit.analysis.CurveGradient;
import sc.fiji.curvekit.util.SamplingUtils;

/**
 * A uniformly resampled curve annotated with per-sample gradients and
 * position angles. All four arrays share the same length. Instances are
 * immutable: accessors return copies.
 */
public final class ResampledCurve {

	private final double[] xs;
	private final double[] ys;
	private final double[] grad;
	private final double[] posang;

	/**
	 * Wraps the resampled coordinates and annotates them with
	 * {@link CurveGradient} estimates.
	 *
	 * @param xs the resampled x coordinates
	 * @param ys the resampled y coordinates
	 */
	public ResampledCurve(final double[] xs, final double[] ys) {
		SamplingUtils.requireSameLength(xs, ys, "xs", "ys");
		final CurveGradient gradient = new CurveGradient(xs, ys);
		this.xs = xs.clone();
		this.ys = ys.clone();
		this.grad = gradient.getGradients();
		this.posang = gradient.getPositionAngles();
	}

	public double[] getXs() {
		return xs.clone();
	}

	public double[] getYs() {
		return ys.clone();
	}

	public double[] getGradients() {
		return grad.clone();
	}

	public double[] getPositionAngles() {
		return posang.clone();
	}

	public int size() {
		return xs.length;
	}

	@Override
	public String toString() {
		return "ResampledCurve[n=" + size() + "]";
	}

}
