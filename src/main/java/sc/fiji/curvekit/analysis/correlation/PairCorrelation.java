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

/**
 * Outcome of correlating one pair of signals of a stack: either a computed
 * peak (value and lag) or a degenerate pair, where one of the two signals sums
 * to exactly zero.
 */
public final class PairCorrelation {

	public enum Status {
		COMPUTED, DEGENERATE
	}

	private final int indexA;
	private final int indexV;
	private final Status status;
	private final double value;
	private final int lag;

	private PairCorrelation(final int indexA, final int indexV, final Status status, final double value,
			final int lag) {
		this.indexA = indexA;
		this.indexV = indexV;
		this.status = status;
		this.value = value;
		this.lag = lag;
	}

	public static PairCorrelation computed(final int indexA, final int indexV, final double value, final int lag) {
		return new PairCorrelation(indexA, indexV, Status.COMPUTED, value, lag);
	}

	public static PairCorrelation degenerate(final int indexA, final int indexV) {
		return new PairCorrelation(indexA, indexV, Status.DEGENERATE, Double.NaN, 0);
	}

	/** @return the row index of the leading signal ({@code a}) */
	public int getIndexA() {
		return indexA;
	}

	/** @return the row index of the reference signal ({@code v}) */
	public int getIndexV() {
		return indexV;
	}

	public Status getStatus() {
		return status;
	}

	public boolean isDegenerate() {
		return status == Status.DEGENERATE;
	}

	/**
	 * @return the correlation peak
	 * @throws IllegalStateException if this pair is degenerate
	 */
	public double getValue() {
		if (isDegenerate()) throw new IllegalStateException("Degenerate pair has no peak");
		return value;
	}

	/**
	 * @return the lag (in samples) of the correlation peak
	 * @throws IllegalStateException if this pair is degenerate
	 */
	public int getLag() {
		if (isDegenerate()) throw new IllegalStateException("Degenerate pair has no lag");
		return lag;
	}

	@Override
	public String toString() {
		if (isDegenerate()) return "PairCorrelation[" + indexA + "," + indexV + ": DEGENERATE]";
		return "PairCorrelation[" + indexA + "," + indexV + ": value=" + value + ", lag=" + lag + "]";
	}

}
