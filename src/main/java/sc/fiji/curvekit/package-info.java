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
 * CurveKit: resampling, annotation and correlation of sampled curves and
 * signals.
 * <p>
 * Entry points live in the sub-packages; this package holds the library-wide
 * exceptions ({@link sc.fiji.curvekit.InvalidInputException},
 * {@link sc.fiji.curvekit.FittingException}), logging helpers
 * ({@link sc.fiji.curvekit.CurveKitUtils}) and preferences
 * ({@link sc.fiji.curvekit.CurveKitPrefs}).
 * </p>
 *
 * @see sc.fiji.curvekit.analysis
 */
package sc.fiji.curvekit;
