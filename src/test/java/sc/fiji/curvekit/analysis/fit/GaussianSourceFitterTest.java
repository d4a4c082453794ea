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

import static org.junit.Assert.*;

import org.junit.Test;

import sc.fiji.curvekit.InvalidInputException;

/**
 * Tests for {@link TwoDGaussian} and {@link GaussianSourceFitter}
 */
public class GaussianSourceFitterTest {

	private static double[][] render(final TwoDGaussian model, final int width, final int height) {
		final double[][] z = new double[height][width];
		for (int row = 0; row < height; row++)
			for (int col = 0; col < width; col++)
				z[row][col] = model.value(col, row);
		return z;
	}

	@Test
	public void testModelPeak() {
		final TwoDGaussian model = new TwoDGaussian(10, 4, 5, 2, 1, 0.4, 1);
		assertEquals("Peak should be amplitude plus offset", 11, model.value(4, 5), 1e-12);
		assertTrue("Value should decay away from the centre", model.value(8, 5) < model.value(5, 5));
		assertEquals("Far field should approach the offset", 1, model.value(100, 100), 1e-9);
	}

	@Test
	public void testEvaluateFlattens() {
		final TwoDGaussian model = new TwoDGaussian(2, 0, 0, 1, 1, 0, 0);
		final double[] values = model.evaluate(new double[] { 0, 1, 2 }, new double[] { 0, 0, 0 });
		assertEquals(3, values.length);
		assertEquals(2, values[0], 1e-12);
		assertEquals(2 * Math.exp(-0.5), values[1], 1e-12);
	}

	@Test
	public void testAxisAlignedSymmetry() {
		// rotating a circular Gaussian changes nothing
		final TwoDGaussian a = new TwoDGaussian(3, 0, 0, 1.5, 1.5, 0, 0);
		final TwoDGaussian b = new TwoDGaussian(3, 0, 0, 1.5, 1.5, 1.2, 0);
		assertEquals(a.value(1.3, -0.7), b.value(1.3, -0.7), 1e-12);
	}

	@Test
	public void testFitRecoversSyntheticSource() {
		final TwoDGaussian truth = new TwoDGaussian(10, 12.3, 10.7, 2.5, 1.5, 0.3, 1);
		final double[][] z = render(truth, 25, 22);
		final GaussianSourceFitter<?> fitter = GaussianSourceFitter.of(z);
		final TwoDGaussian fitted = fitter.fit();
		assertEquals("Amplitude", truth.getAmplitude(), fitted.getAmplitude(), 1e-4);
		assertEquals("Centre x", truth.getXo(), fitted.getXo(), 1e-4);
		assertEquals("Centre y", truth.getYo(), fitted.getYo(), 1e-4);
		assertEquals("Offset", truth.getOffset(), fitted.getOffset(), 1e-4);
		for (final double[] p : new double[][] { { 10, 10 }, { 13.5, 9 }, { 15, 12 } })
			assertEquals("Fitted surface should match", truth.value(p[0], p[1]), fitted.value(p[0], p[1]), 1e-4);
		assertTrue("Noise-free fit should have negligible residual", fitter.getRMS() < 1e-6);
	}

	@Test
	public void testEstimateFromMoments() {
		final TwoDGaussian truth = new TwoDGaussian(5, 8, 6, 2, 2, 0, 0);
		final TwoDGaussian guess = GaussianSourceFitter.of(render(truth, 17, 13)).estimate();
		assertEquals(8, guess.getXo(), 0.1);
		assertEquals(6, guess.getYo(), 0.1);
		assertEquals(5, guess.getAmplitude(), 0.1);
	}

	@Test(expected = InvalidInputException.class)
	public void testTooFewPixels() {
		GaussianSourceFitter.of(new double[][] { { 1, 2, 3 }, { 4, 5, 6 } });
	}

}
