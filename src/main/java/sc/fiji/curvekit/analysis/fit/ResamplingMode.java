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

/**
 * The strategies available to {@link CurveResampler}.
 */
public enum ResamplingMode {

	/**
	 * Joint smoothing spline of x(u) and y(u), u being the normalized chord
	 * length. Suited to curves that are not single-valued in x. The mode
	 * parameter is the smoothing factor.
	 */
	PARAMETRIC_SPLINE("smoothing factor"),

	/**
	 * Least-squares polynomial y(x). The mode parameter is the degree.
	 */
	POLYNOMIAL("degree"),

	/**
	 * One-dimensional smoothing spline y(x). The mode parameter is the
	 * smoothing factor.
	 */
	SPLINE("smoothing factor");

	private final String parameterName;

	ResamplingMode(final String parameterName) {
		this.parameterName = parameterName;
	}

	/** @return a description of the parameter each mode expects */
	public String getParameterName() {
		return parameterName;
	}

}
