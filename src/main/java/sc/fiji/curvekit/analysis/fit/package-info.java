/*-
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

/**
 * Curve resampling strategies and model fitting.
 * <p>
 * {@link sc.fiji.curvekit.analysis.fit.CurveResampler} implementations are
 * selected through {@link sc.fiji.curvekit.analysis.fit.ResamplingMode}:
 * </p>
 * <pre>{@code
 * CurveResampler resampler = CurveResampler.create(ResamplingMode.POLYNOMIAL, 3);
 * ResampledCurve curve = resampler.resample(xs, ys, 200);
 * }</pre>
 * {@link sc.fiji.curvekit.analysis.fit.GaussianSourceFitter} fits a rotated
 * elliptical {@link sc.fiji.curvekit.analysis.fit.TwoDGaussian} to an image
 * patch.
 */
package sc.fiji.curvekit.analysis.fit;
