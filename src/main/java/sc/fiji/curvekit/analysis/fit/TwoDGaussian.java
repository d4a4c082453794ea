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

import sc.fiji.curvekit.InvalidInputException;

/**
 * Rotated elliptical 2-D Gaussian on a constant background:
 *
 * <pre>
 * g(x, y) = offset + A·exp(-(a·dx² + 2b·dx·dy + c·dy²))
 * a = cos²θ/(2σx²) + sin²θ/(2σy²)
 * b = -sin2θ/(4σx²) + sin2θ/(4σy²)
 * c = sin²θ/(2σx²) + cos²θ/(2σy²)
 * </pre>
 *
 * where dx = x - xo and dy = y - yo. Parameters are ordered as in
 * {@link #toArray()}: amplitude, xo, yo, sigmaX, sigmaY, theta, offset.
 */
public final class TwoDGaussian {

	public static final int N_PARAMS = 7;

	private final double amplitude;
	private final double xo;
	private final double yo;
	private final double sigmaX;
	private final double sigmaY;
	private final double theta;
	private final double offset;

	public TwoDGaussian(final double amplitude, final double xo, final double yo, final double sigmaX,
			final double sigmaY, final double theta, final double offset) {
		this.amplitude = amplitude;
		this.xo = xo;
		this.yo = yo;
		this.sigmaX = sigmaX;
		this.sigmaY = sigmaY;
		this.theta = theta;
		this.offset = offset;
	}

	public static TwoDGaussian fromArray(final double[] params) {
		if (params == null || params.length != N_PARAMS)
			throw new InvalidInputException("Expected " + N_PARAMS + " Gaussian parameters");
		return new TwoDGaussian(params[0], params[1], params[2], params[3], params[4], params[5], params[6]);
	}

	public double[] toArray() {
		return new double[] { amplitude, xo, yo, sigmaX, sigmaY, theta, offset };
	}

	public double value(final double x, final double y) {
		return value(x, y, toArray());
	}

	/**
	 * Evaluates the model at every (xs[i], ys[i]) pair, returning a flat array
	 * in the same order.
	 */
	public double[] evaluate(final double[] xs, final double[] ys) {
		if (xs.length != ys.length)
			throw new InvalidInputException("xs and ys must be equal-length");
		final double[] params = toArray();
		final double[] values = new double[xs.length];
		for (int i = 0; i < xs.length; i++)
			values[i] = value(xs[i], ys[i], params);
		return values;
	}

	static double value(final double x, final double y, final double[] p) {
		final double[] abc = coefficients(p[3], p[4], p[5]);
		final double dx = x - p[1];
		final double dy = y - p[2];
		final double q = abc[0] * dx * dx + 2 * abc[1] * dx * dy + abc[2] * dy * dy;
		return p[6] + p[0] * Math.exp(-q);
	}

	/*
	 * Partial derivatives of g with respect to each parameter at (x, y).
	 */
	static void gradient(final double x, final double y, final double[] p, final double[] out) {
		final double amp = p[0];
		final double sx = p[3];
		final double sy = p[4];
		final double th = p[5];
		final double[] abc = coefficients(sx, sy, th);
		final double dx = x - p[1];
		final double dy = y - p[2];
		final double dx2 = dx * dx;
		final double dxy = 2 * dx * dy;
		final double dy2 = dy * dy;
		final double e = Math.exp(-(abc[0] * dx2 + abc[1] * dxy + abc[2] * dy2));
		final double ae = amp * e;

		final double cos = Math.cos(th);
		final double sin = Math.sin(th);
		final double cos2 = cos * cos;
		final double sin2 = sin * sin;
		final double sinDouble = Math.sin(2 * th);
		final double cosDouble = Math.cos(2 * th);
		final double sx2 = sx * sx;
		final double sy2 = sy * sy;
		final double sx3 = sx2 * sx;
		final double sy3 = sy2 * sy;

		final double dqdsx = dx2 * (-cos2 / sx3) + dxy * (sinDouble / (2 * sx3)) + dy2 * (-sin2 / sx3);
		final double dqdsy = dx2 * (-sin2 / sy3) + dxy * (-sinDouble / (2 * sy3)) + dy2 * (-cos2 / sy3);
		final double dqdth = dx2 * (-sinDouble / (2 * sx2) + sinDouble / (2 * sy2))
				+ dxy * (-cosDouble / (2 * sx2) + cosDouble / (2 * sy2))
				+ dy2 * (sinDouble / (2 * sx2) - sinDouble / (2 * sy2));

		out[0] = e;
		out[1] = ae * (2 * abc[0] * dx + 2 * abc[1] * dy);
		out[2] = ae * (2 * abc[1] * dx + 2 * abc[2] * dy);
		out[3] = -ae * dqdsx;
		out[4] = -ae * dqdsy;
		out[5] = -ae * dqdth;
		out[6] = 1;
	}

	private static double[] coefficients(final double sx, final double sy, final double th) {
		final double cos = Math.cos(th);
		final double sin = Math.sin(th);
		final double sin2th = Math.sin(2 * th);
		final double a = (cos * cos) / (2 * sx * sx) + (sin * sin) / (2 * sy * sy);
		final double b = -sin2th / (4 * sx * sx) + sin2th / (4 * sy * sy);
		final double c = (sin * sin) / (2 * sx * sx) + (cos * cos) / (2 * sy * sy);
		return new double[] { a, b, c };
	}

	public double getAmplitude() {
		return amplitude;
	}

	public double getXo() {
		return xo;
	}

	public double getYo() {
		return yo;
	}

	public double getSigmaX() {
		return sigmaX;
	}

	public double getSigmaY() {
		return sigmaY;
	}

	public double getTheta() {
		return theta;
	}

	public double getOffset() {
		return offset;
	}

	@Override
	public String toString() {
		return String.format("TwoDGaussian[A=%.4g, xo=%.4g, yo=%.4g, sx=%.4g, sy=%.4g, theta=%.4g, offset=%.4g]",
				amplitude, xo, yo, sigmaX, sigmaY, theta, offset);
	}

}
