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

package sc.fiji.curvekit;

import org.scijava.Context;
import org.scijava.prefs.PrefService;

/**
 * Class handling CurveKit preferences. Values are persisted by the SciJava
 * {@link PrefService}; a system property with the same key (prefixed by
 * {@code curvekit.}) takes precedence, which is convenient for headless runs.
 */
public class CurveKitPrefs {

	public static final String DEBUG_KEY = "debugMode";
	public static final String THREADS_KEY = "threads";
	public static final boolean DEF_DEBUG_MODE = false;
	public static final int DEF_THREADS = 1;

	private final PrefService prefService;

	public CurveKitPrefs(final Context context) {
		prefService = context.getService(PrefService.class);
	}

	public boolean isDebugMode() {
		final String property = System.getProperty("curvekit." + DEBUG_KEY);
		if (property != null) return Boolean.parseBoolean(property);
		if (prefService == null) return DEF_DEBUG_MODE;
		return prefService.getBoolean(CurveKitPrefs.class, DEBUG_KEY, DEF_DEBUG_MODE);
	}

	public void setDebugMode(final boolean debug) {
		if (prefService != null) prefService.put(CurveKitPrefs.class, DEBUG_KEY, debug);
	}

	/**
	 * @return the number of worker threads used by multi-threaded computations.
	 *         Always at least 1
	 */
	public int getThreads() {
		int threads = DEF_THREADS;
		final String property = System.getProperty("curvekit." + THREADS_KEY);
		if (property != null) {
			try {
				threads = Integer.parseInt(property.trim());
			} catch (final NumberFormatException ex) {
				CurveKitUtils.warn("Ignoring invalid thread count '" + property + "'");
			}
		} else if (prefService != null) {
			threads = prefService.getInt(CurveKitPrefs.class, THREADS_KEY, DEF_THREADS);
		}
		return Math.max(1, threads);
	}

	public void setThreads(final int threads) {
		if (threads < 1) throw new InvalidInputException("Thread count must be >= 1");
		if (prefService != null) prefService.put(CurveKitPrefs.class, THREADS_KEY, threads);
	}

}
