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

import java.util.Collections;
import java.util.List;

/**
 * The all-pairs correlation summary of a signal stack, as assembled by
 * {@link CorrelationMapBuilder}.
 * <p>
 * Matrices have {@code (m-1) x (m-1)} cells for a stack of {@code m} signals.
 * The pair of rows {@code (i, j)}, {@code i < j}, occupies cell
 * {@code [i][j-1]} and its mirror {@code [j-1][i]}; unused cells are NaN. For a
 * cell {@code [r][c]} the label matrices hold {@code ya = y[c]},
 * {@code yv = y[r]}, {@code yidxa = c} and {@code yidxv = r}. Accessors return
 * copies.
 * </p>
 */
public final class CorrelationMap {

	private final double[][] ccmax;
	private final double[][] ccpeak;
	private final double[][] ya;
	private final double[][] yv;
	private final double[][] yidxa;
	private final double[][] yidxv;
	private final double[][] zfit;
	private final double[] xfit;
	private final double[] x;
	private final double[] y;
	private final List<PairCorrelation> pairs;

	CorrelationMap(final double[][] ccmax, final double[][] ccpeak, final double[][] ya, final double[][] yv,
			final double[][] yidxa, final double[][] yidxv, final double[][] zfit, final double[] xfit,
			final double[] x, final double[] y, final List<PairCorrelation> pairs) {
		this.ccmax = ccmax;
		this.ccpeak = ccpeak;
		this.ya = ya;
		this.yv = yv;
		this.yidxa = yidxa;
		this.yidxv = yidxv;
		this.zfit = zfit;
		this.xfit = xfit;
		this.x = x;
		this.y = y;
		this.pairs = Collections.unmodifiableList(pairs);
	}

	/** @return the correlation peak values. Degenerate pairs are 0 */
	public double[][] getCcmax() {
		return copy(ccmax);
	}

	/** @return the lags of the correlation peaks. Degenerate pairs are 0 */
	public double[][] getCcpeak() {
		return copy(ccpeak);
	}

	public double[][] getYa() {
		return copy(ya);
	}

	public double[][] getYv() {
		return copy(yv);
	}

	public double[][] getYidxa() {
		return copy(yidxa);
	}

	public double[][] getYidxv() {
		return copy(yidxv);
	}

	/** @return the (possibly resampled) signal stack that was correlated */
	public double[][] getZfit() {
		return copy(zfit);
	}

	/** @return the axis of {@link #getZfit()} */
	public double[] getXfit() {
		return xfit.clone();
	}

	public int getNxfit() {
		return xfit.length;
	}

	public double[] getX() {
		return x.clone();
	}

	public int getNx() {
		return x.length;
	}

	public double[] getY() {
		return y.clone();
	}

	public int getNy() {
		return y.length;
	}

	/** @return the per-pair outcomes, in row-major order of the leading row */
	public List<PairCorrelation> getPairs() {
		return pairs;
	}

	/**
	 * Retrieves the outcome for a pair of rows.
	 *
	 * @param indexA the leading row
	 * @param indexV the reference row
	 * @return the outcome, or null if the pair was not correlated
	 */
	public PairCorrelation getPair(final int indexA, final int indexV) {
		for (final PairCorrelation pair : pairs) {
			if (pair.getIndexA() == indexA && pair.getIndexV() == indexV) return pair;
		}
		return null;
	}

	private static double[][] copy(final double[][] matrix) {
		final double[][] result = new double[matrix.length][];
		for (int i = 0; i < matrix.length; i++)
			result[i] = matrix[i].clone();
		return result;
	}

}
