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
 * Geometric measurements of point sequences and image profiling.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link sc.fiji.curvekit.analysis.ArcLength} - Per-step and cumulative
 *       chordal distances</li>
 *   <li>{@link sc.fiji.curvekit.analysis.CurveGradient} - Finite-difference
 *       gradients and direction angles</li>
 *   <li>{@link sc.fiji.curvekit.analysis.LineProfiler} - Image intensities
 *       along a segment or polyline</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * double[] profile = LineProfiler.profile(z, new double[] {2, 40}, new double[] {5, 5}, "cubic");
 * }</pre>
 *
 * @see sc.fiji.curvekit.analysis.fit
 * @see sc.fiji.curvekit.analysis.correlation
 */
package sc.fiji.curvekit.analysis;
