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

import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.util.Locale;

import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.prefs.PrefService;
import org.scijava.util.VersionUtils;

/** Static utilities for CurveKit **/
public class CurveKitUtils {

	private static Context context;
	private static LogService logService;
	private static boolean initialized;
	private static Boolean debug;

	public static final String VERSION = getVersion();

	private CurveKitUtils() {}

	private static synchronized void initialize() {
		if (initialized) return;
		if (context == null) getContext();
		if (logService == null) logService = context.getService(LogService.class);
		initialized = true;
	}

	/**
	 * Retrieves CurveKit's version
	 *
	 * @return the version or a non-empty place holder string if version could
	 *         not be retrieved.
	 */
	private static String getVersion() {
		try {
			final String version = VersionUtils.getVersion(CurveKitUtils.class);
			return (version == null) ? "N/A" : version;
		} catch (final Throwable ignored) {
			return "N/A";
		}
	}

	public static synchronized void error(final String string) {
		if (!initialized) initialize();
		logService.error("[CurveKit] " + string);
	}

	public static synchronized void error(final String string, final Throwable t) {
		if (!initialized) initialize();
		if (t == null)
			logService.error("[CurveKit] " + string);
		else
			logService.error("[CurveKit] " + string, t);
	}

	public static synchronized void log(final String string) {
		if (!isDebugMode()) return;
		if (!initialized) initialize();
		logService.info("[CurveKit] " + string);
	}

	public static synchronized void warn(final String string) {
		if (!initialized) initialize();
		logService.warn("[CurveKit] " + string);
	}

	public static String formatDouble(final double value, final int digits) {
		return (Double.isNaN(value)) ? "NaN" : getDecimalFormat(value, digits).format(value);
	}

	public static DecimalFormat getDecimalFormat(final double value, final int digits) {
		final StringBuilder pattern = new StringBuilder("0.");
		while (pattern.length() < digits + 2)
			pattern.append("0");
		final double absValue = Math.abs(value);
		if ((absValue > 0 && absValue < 0.01) || absValue >= 1000) pattern.append("E0");
		final NumberFormat nf = NumberFormat.getNumberInstance(Locale.US);
		final DecimalFormat df = (DecimalFormat) nf;
		df.applyLocalizedPattern(pattern.toString());
		return df;
	}

	/**
	 * Assesses if CurveKit is running in debug mode. Unless set explicitly with
	 * {@link #setDebugMode(boolean)}, the flag is read once from
	 * {@link CurveKitPrefs}.
	 *
	 * @return the debug flag
	 */
	public static synchronized boolean isDebugMode() {
		if (debug == null) debug = new CurveKitPrefs(getContext()).isDebugMode();
		return debug;
	}

	/**
	 * Enables/disables debug mode
	 *
	 * @param b verbose flag
	 */
	public static synchronized void setDebugMode(final boolean b) {
		if (isDebugMode() && !b) {
			log("Exiting debug mode...");
		}
		debug = b;
		if (b) log("Entering debug mode...");
	}

	/**
	 * Convenience method to access the SciJava context used for logging and
	 * preferences. A minimal context is created on first use if none was set.
	 *
	 * @return the context. Never null
	 */
	public static synchronized Context getContext() {
		if (context == null) {
			context = new Context(LogService.class, PrefService.class);
		}
		return context;
	}

	public static synchronized boolean isContextSet() {
		return null != CurveKitUtils.context;
	}

	/**
	 * Sets the context to be used by CurveKit, e.g., the one of a running ImageJ
	 * instance.
	 *
	 * @param context the SciJava context
	 */
	public static synchronized void setContext(final Context context) {
		CurveKitUtils.context = context;
		logService = null;
		initialized = false;
	}

}
