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

package sc.fiji.curvekit.analysis;

import static org.junit.Assert.*;

import org.junit.Test;

import sc.fiji.curvekit.InvalidInputException;

/**
 * Tests for {@link ArcLength}
 */
public class ArcLengthTest {

	@Test
	public void testSteps() {
		final double[] x = { 0, 3, 3, 6 };
		final double[] y = { 0, 4, 4, 8 };
		final double[] steps = ArcLength.steps(x, y);
		assertEquals("Output should match input length", 4, steps.length);
		assertArrayEquals("Steps should be per-segment distances", new double[] { 0, 5, 0, 5 }, steps, 1e-12);
	}

	@Test
	public void testCumulative() {
		final double[] x = { 0, 3, 3, 6 };
		final double[] y = { 0, 4, 4, 8 };
		assertArrayEquals(new double[] { 0, 5, 5, 10 }, ArcLength.cumulative(x, y), 1e-12);
	}

	@Test
	public void testSinglePoint() {
		final double[] steps = ArcLength.steps(new double[] { 2 }, new double[] { 3 });
		assertArrayEquals("A single point has no length", new double[] { 0 }, steps, 0);
	}

	@Test(expected = InvalidInputException.class)
	public void testMismatchedLengths() {
		ArcLength.steps(new double[] { 0, 1 }, new double[] { 0 });
	}

	@Test(expected = InvalidInputException.class)
	public void testEmpty() {
		ArcLength.steps(new double[0], new double[0]);
	}

}
