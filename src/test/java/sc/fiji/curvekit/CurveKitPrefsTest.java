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

import static org.junit.Assert.*;

import org.junit.After;
import org.junit.Test;

/**
 * Tests for {@link CurveKitPrefs}
 */
public class CurveKitPrefsTest {

	private static final String THREADS_PROPERTY = "curvekit." + CurveKitPrefs.THREADS_KEY;

	@After
	public void clearProperties() {
		System.clearProperty(THREADS_PROPERTY);
	}

	@Test
	public void testThreadsFromSystemProperty() {
		System.setProperty(THREADS_PROPERTY, "3");
		assertEquals(3, new CurveKitPrefs(CurveKitUtils.getContext()).getThreads());
	}

	@Test
	public void testInvalidThreadsFallBackToDefault() {
		System.setProperty(THREADS_PROPERTY, "many");
		assertEquals(CurveKitPrefs.DEF_THREADS, new CurveKitPrefs(CurveKitUtils.getContext()).getThreads());
		System.setProperty(THREADS_PROPERTY, "0");
		assertEquals("Thread count should never drop below 1", 1,
				new CurveKitPrefs(CurveKitUtils.getContext()).getThreads());
	}

	@Test(expected = InvalidInputException.class)
	public void testRejectsNonPositiveThreads() {
		new CurveKitPrefs(CurveKitUtils.getContext()).setThreads(0);
	}

}
