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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;

import net.imglib2.parallel.DefaultTaskExecutor;
import net.imglib2.parallel.TaskExecutor;
import sc.fiji.curvekit.CurveKitPrefs;
import sc.fiji.curvekit.CurveKitUtils;
import sc.fiji.curvekit.FittingException;
import sc.fiji.curvekit.InvalidInputException;
import sc.fiji.curvekit.analysis.fit.SmoothingSpline;
import sc.fiji.curvekit.util.Logger;
import sc.fiji.curvekit.util.SamplingUtils;

/**
 * Builds the pairwise peak-correlation and lag matrices of a stack of signals
 * sampled on a common axis.
 * <p>
 * Each row of the stack is optionally re-gridded first: it is fitted with a
 * smoothing spline (smoothing factor equal to the number of samples) and
 * evaluated on {@value #OVERSAMPLING}x the original resolution. Every pair of
 * rows is then correlated with {@link NormalizedCrossCorrelator}, the later
 * row leading. A pair in which either row sums to exactly zero is
 * {@link PairCorrelation.Status#DEGENERATE degenerate} and reported as zero
 * correlation and zero lag.
 * </p>
 * <p>
 * Re-gridding allows a residual sum of squares of up to {@code k} per row. For
 * signals whose variations are of order one or smaller this exceeds the
 * residual of a straight-line fit, so the re-gridded rows are flattened to
 * lines and their lags are lost. Disable re-gridding with
 * {@link #setResample(boolean)} for such data.
 * </p>
 */
public class CorrelationMapBuilder {

    /** Resampling factor applied to the x axis when re-gridding */
    public static final int OVERSAMPLING = 10;

    private final double[][] z;
    private final double[] x;
    private final double[] y;
    private boolean resample = true;
    private int nThreads;
    private final Logger logger;

    /**
     * @param z the signal stack, one signal per row ({@code m x k})
     * @param x the common axis (length {@code k})
     * @param y the row labels (length {@code m})
     * @throws InvalidInputException if the stack is ragged, has fewer than two
     *                               rows or columns, or its shape does not
     *                               match the axes
     */
    public CorrelationMapBuilder(final double[][] z, final double[] x, final double[] y)
            throws InvalidInputException {
        if (z == null || x == null || y == null)
            throw new InvalidInputException("z, x and y cannot be null");
        if (z.length < 2)
            throw new InvalidInputException("At least two signals are required but got " + z.length);
        if (x.length < 2)
            throw new InvalidInputException("At least two samples per signal are required but got " + x.length);
        if (y.length != z.length)
            throw new InvalidInputException("y has " + y.length + " labels but z has " + z.length + " rows");
        for (int i = 0; i < z.length; i++) {
            if (z[i] == null || z[i].length != x.length)
                throw new InvalidInputException("Row " + i + " of z does not match the length of x (" + x.length + ")");
        }
        this.z = new double[z.length][];
        for (int i = 0; i < z.length; i++)
            this.z[i] = z[i].clone();
        this.x = x.clone();
        this.y = y.clone();
        this.nThreads = new CurveKitPrefs(CurveKitUtils.getContext()).getThreads();
        this.logger = new Logger(CorrelationMapBuilder.class);
    }

    /**
     * Convenience method building a map with default thread settings.
     *
     * @see #CorrelationMapBuilder(double[][], double[], double[])
     */
    public static CorrelationMap build(final double[][] z, final double[] x, final double[] y,
                                       final boolean doResample) {
        final CorrelationMapBuilder builder = new CorrelationMapBuilder(z, x, y);
        builder.setResample(doResample);
        return builder.build();
    }

    /**
     * Whether rows are re-gridded on a finer axis before correlating. Default
     * is true. Re-gridding requires at least
     * {@value SmoothingSpline#MIN_POINTS} samples and a strictly increasing x.
     */
    public void setResample(final boolean resample) {
        this.resample = resample;
    }

    public boolean isResample() {
        return resample;
    }

    /**
     * Sets the number of threads used to correlate pairs. Defaults to the
     * value stored in {@link CurveKitPrefs}.
     */
    public void setThreads(final int nThreads) {
        if (nThreads < 1) throw new InvalidInputException("Thread count must be >= 1");
        this.nThreads = nThreads;
    }

    public int getThreads() {
        return nThreads;
    }

    /**
     * Builds the correlation map.
     *
     * @return the map
     * @throws FittingException if re-gridding fails to fit a row
     */
    public CorrelationMap build() throws FittingException {
        final double[] xfit;
        final double[][] zfit;
        if (resample) {
            xfit = SamplingUtils.linspace(x[0], x[x.length - 1], OVERSAMPLING * x.length + 1);
            zfit = new double[z.length][];
            for (int i = 0; i < z.length; i++)
                zfit[i] = regrid(z[i], xfit);
        } else {
            xfit = x.clone();
            zfit = new double[z.length][];
            for (int i = 0; i < z.length; i++)
                zfit[i] = z[i].clone();
        }
        final int ny = zfit.length;
        final int nxfit = xfit.length;
        final double[] sums = new double[ny];
        for (int i = 0; i < ny; i++)
            sums[i] = SamplingUtils.sum(zfit[i]);

        // pairs (idx1, idx2) with idx2 < idx1, enumerated row by row
        final List<int[]> indices = new ArrayList<>();
        for (int idx1 = 1; idx1 < ny; idx1++) {
            for (int idx2 = 0; idx2 < idx1; idx2++)
                indices.add(new int[] { idx1, idx2 });
        }
        final PairCorrelation[] outcomes = new PairCorrelation[indices.size()];
        final List<Integer> slots = IntStream.range(0, outcomes.length).boxed().collect(Collectors.toList());
        logger.debug("Correlating " + outcomes.length + " pairs of " + nxfit + " samples using " + nThreads
                + " thread(s)");

        final ExecutorService es = Executors.newFixedThreadPool(nThreads);
        final TaskExecutor ex = new DefaultTaskExecutor(es);
        try {
            ex.forEach(slots, slot -> {
                final int[] pair = indices.get(slot);
                outcomes[slot] = correlatePair(zfit, sums, pair[0], pair[1]);
            });
        } finally {
            es.shutdown();
        }

        final int size = ny - 1;
        final double[][] ccmax = nanMatrix(size);
        final double[][] ccpeak = nanMatrix(size);
        final double[][] ya = nanMatrix(size);
        final double[][] yv = nanMatrix(size);
        final double[][] yidxa = nanMatrix(size);
        final double[][] yidxv = nanMatrix(size);
        for (final PairCorrelation outcome : outcomes) {
            final double value = (outcome.isDegenerate()) ? 0 : outcome.getValue();
            final double lag = (outcome.isDegenerate()) ? 0 : outcome.getLag();
            final int r = outcome.getIndexV();
            final int c = outcome.getIndexA() - 1;
            fill(r, c, value, lag, ccmax, ccpeak, ya, yv, yidxa, yidxv);
            if (r != c) fill(c, r, value, lag, ccmax, ccpeak, ya, yv, yidxa, yidxv);
        }
        return new CorrelationMap(ccmax, ccpeak, ya, yv, yidxa, yidxv, zfit, xfit, x.clone(), y.clone(),
                Arrays.asList(outcomes));
    }

    private double[] regrid(final double[] row, final double[] xfit) {
        final SmoothingSpline spline = new SmoothingSpline(x, row, row.length);
        try {
            return spline.values(0, xfit);
        } catch (final MathIllegalArgumentException | MathIllegalStateException e) {
            throw new FittingException("Could not re-grid signal: " + e.getMessage(), e);
        }
    }

    private static PairCorrelation correlatePair(final double[][] zfit, final double[] sums, final int idx1,
                                                 final int idx2) {
        if (sums[idx1] == 0 || sums[idx2] == 0)
            return PairCorrelation.degenerate(idx1, idx2);
        final double[] cc = NormalizedCrossCorrelator.correlate(zfit[idx1], zfit[idx2]);
        final int peak = SamplingUtils.argmax(cc);
        return PairCorrelation.computed(idx1, idx2, cc[peak], NormalizedCrossCorrelator.lag(peak, cc.length));
    }

    private void fill(final int r, final int c, final double value, final double lag, final double[][] ccmax,
                      final double[][] ccpeak, final double[][] ya, final double[][] yv, final double[][] yidxa,
                      final double[][] yidxv) {
        ccmax[r][c] = value;
        ccpeak[r][c] = lag;
        ya[r][c] = y[c];
        yv[r][c] = y[r];
        yidxa[r][c] = c;
        yidxv[r][c] = r;
    }

    private static double[][] nanMatrix(final int size) {
        final double[][] matrix = new double[size][size];
        for (final double[] row : matrix)
            Arrays.fill(row, Double.NaN);
        return matrix;
    }

}
