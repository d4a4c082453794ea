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

package sc.fiji.curvekit.analysis.correlation;

import static org.junit.Assert.*;

import org.junit.Test;

import sc.fiji.curvekit.InvalidInputException;

/**
 * Tests for {@link CorrelationMapBuilder}
 */
public class CorrelationMapBuilderTest {

	private static double[] axis(final int k) {
		final double[] x = new double[k];
		for (int i = 0; i < k; i++) x[i] = i;
		return x;
	}

	private static double[] pulse(final int k, final double center, final double sigma) {
		final double[] row = new double[k];
		for (int i = 0; i < k; i++)
			row[i] = Math.exp(-(i - center) * (i - center) / (2 * sigma * sigma));
		return row;
	}

	private static double[] sine(final int k, final double amplitude, final double offset) {
		final double[] row = new double[k];
		for (int i = 0; i < k; i++)
			row[i] = offset + amplitude * Math.sin(2 * Math.PI * i / 25.0);
		return row;
	}

	@Test
	public void testThreeRowsGiveSymmetricMatrices() {
		final double[][] z = { pulse(40, 10, 3), pulse(40, 14, 3), pulse(40, 20, 4) };
		final CorrelationMap map = CorrelationMapBuilder.build(z, axis(40), new double[] { 100, 200, 300 }, false);
		final double[][] ccmax = map.getCcmax();
		final double[][] ccpeak = map.getCcpeak();
		assertEquals("Matrix should be (m-1) x (m-1)", 2, ccmax.length);
		assertEquals(2, ccmax[0].length);
		assertEquals("ccmax should be symmetric", ccmax[0][1], ccmax[1][0], 0);
		assertEquals("ccpeak should be symmetric", ccpeak[0][1], ccpeak[1][0], 0);
		for (final double[] row : ccmax)
			for (final double v : row)
				assertFalse("Every cell should be filled", Double.isNaN(v));
		assertEquals("Row 1 trails row 0 by 4 samples", 4, ccpeak[0][0], 0);
		assertEquals("Row 2 trails row 1 by 6 samples", 6, ccpeak[1][1], 0);
		// cell [r][c] is labelled with y[c] and y[r]
		assertEquals(200, map.getYa()[0][1], 0);
		assertEquals(100, map.getYv()[0][1], 0);
		assertEquals(1, map.getYidxa()[0][1], 0);
		assertEquals(0, map.getYidxv()[0][1], 0);
		assertEquals(3, map.getPairs().size());
	}

	@Test
	public void testZeroRowIsDegenerate() {
		final double[][] z = { pulse(30, 10, 3), new double[30], pulse(30, 15, 3) };
		final CorrelationMap map = CorrelationMapBuilder.build(z, axis(30), new double[] { 0, 1, 2 }, false);
		assertTrue(map.getPair(1, 0).isDegenerate());
		assertTrue(map.getPair(2, 1).isDegenerate());
		assertFalse(map.getPair(2, 0).isDegenerate());
		final double[][] ccmax = map.getCcmax();
		final double[][] ccpeak = map.getCcpeak();
		assertEquals("Pair (0, 1) should collapse to 0", 0, ccmax[0][0], 0);
		assertEquals(0, ccpeak[0][0], 0);
		assertEquals("Pair (1, 2) should collapse to 0", 0, ccmax[1][1], 0);
		assertEquals(0, ccpeak[1][1], 0);
		assertTrue("Pair (0, 2) should correlate", ccmax[0][1] > 0.5);
	}

	@Test
	public void testIdenticalSinusoids() {
		final double[][] z = { sine(100, 1, 2), sine(100, 1, 2) };
		final CorrelationMap map = CorrelationMapBuilder.build(z, axis(100), new double[] { 0, 1 }, false);
		assertEquals("Identical signals should not lag", 0, map.getCcpeak()[0][0], 0);
		assertEquals("Identical signals should correlate perfectly", 1, map.getCcmax()[0][0], 1e-6);
	}

	@Test
	public void testDelayedPulse() {
		final double[][] z = { pulse(100, 40, 3), pulse(100, 45, 3) };
		final CorrelationMapBuilder builder = new CorrelationMapBuilder(z, axis(100), new double[] { 0, 1 });
		builder.setResample(false);
		final CorrelationMap map = builder.build();
		assertEquals("A 5-sample delay of the second row should give a lag of +5", 5, map.getCcpeak()[0][0], 0);
		assertEquals(5, map.getPair(1, 0).getLag());
	}

	@Test
	public void testResampling() {
		final int k = 30;
		final double[][] z = { sine(k, 10, 50), sine(k, 10, 50), pulse(k, 12, 4) };
		final double[] x = axis(k);
		final CorrelationMap map = CorrelationMapBuilder.build(z, x, new double[] { 0, 1, 2 }, true);
		assertEquals("Fine axis should have 10k + 1 samples", 10 * k + 1, map.getNxfit());
		assertEquals(x[0], map.getXfit()[0], 0);
		assertEquals(x[k - 1], map.getXfit()[10 * k], 0);
		assertEquals(3, map.getZfit().length);
		assertEquals(10 * k + 1, map.getZfit()[0].length);
		assertEquals(k, map.getNx());
		assertEquals(3, map.getNy());
		assertEquals("Identical rows should not lag after resampling", 0, map.getCcpeak()[0][0], 0);
		assertEquals(1, map.getCcmax()[0][0], 1e-6);
	}

	@Test
	public void testMultiThreadedMatchesSingleThreaded() {
		final double[][] z = new double[6][];
		for (int i = 0; i < z.length; i++)
			z[i] = pulse(60, 20 + 2 * i, 3 + i * 0.5);
		final double[] y = { 0, 1, 2, 3, 4, 5 };
		final CorrelationMapBuilder single = new CorrelationMapBuilder(z, axis(60), y);
		single.setResample(false);
		single.setThreads(1);
		final CorrelationMapBuilder multi = new CorrelationMapBuilder(z, axis(60), y);
		multi.setResample(false);
		multi.setThreads(4);
		final double[][] expected = single.build().getCcmax();
		final double[][] actual = multi.build().getCcmax();
		for (int r = 0; r < expected.length; r++)
			assertArrayEquals(expected[r], actual[r], 0);
	}

	@Test
	public void testResamplingFlattensLowAmplitudeSignals() {
		final int k = 50;
		final double[][] z = { sine(k, 1, 2), sine(k, 1, 2) };
		final double[][] zfit = CorrelationMapBuilder.build(z, axis(k), new double[] { 0, 1 }, true).getZfit();
		for (final double[] row : zfit) {
			for (int i = 1; i < row.length - 1; i++)
				assertEquals("Unit-scale rows should be re-gridded as lines", 0, row[i + 1] - 2 * row[i] + row[i - 1],
						1e-6);
		}
	}

	@Test
	public void testBuilderIsolatedFromCallerArrays() {
		final double[][] z = { pulse(100, 40, 3), pulse(100, 45, 3) };
		final double[] y = { 10, 20 };
		final CorrelationMapBuilder builder = new CorrelationMapBuilder(z, axis(100), y);
		builder.setResample(false);
		z[1] = pulse(100, 48, 3);
		z[0][40] = 0;
		y[0] = -1;
		final CorrelationMap map = builder.build();
		assertEquals("Changes after construction should not leak into the map", 5, map.getCcpeak()[0][0], 0);
		assertEquals(10, map.getYa()[0][0], 0);
		assertEquals(1, map.getZfit()[0][40], 0);
	}

	@Test(expected = InvalidInputException.class)
	public void testSingleRow() {
		new CorrelationMapBuilder(new double[][] { { 1, 2, 3 } }, axis(3), new double[] { 0 });
	}

	@Test(expected = InvalidInputException.class)
	public void testRaggedStack() {
		new CorrelationMapBuilder(new double[][] { { 1, 2, 3 }, { 1, 2 } }, axis(3), new double[] { 0, 1 });
	}

	@Test(expected = InvalidInputException.class)
	public void testLabelMismatch() {
		new CorrelationMapBuilder(new double[][] { { 1, 2, 3 }, { 1, 2, 3 } }, axis(3), new double[] { 0 });
	}

}
