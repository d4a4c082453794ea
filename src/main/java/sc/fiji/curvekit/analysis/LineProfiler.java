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

import java.util.Locale;
import java.util.concurrent.Callable;

import org.apache.commons.math3.analysis.interpolation.BicubicInterpolatingFunction;
import org.apache.commons.math3.analysis.interpolation.BicubicInterpolator;

import net.imglib2.Interval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import sc.fiji.curvekit.InvalidInputException;
import sc.fiji.curvekit.util.ImgUtils;
import sc.fiji.curvekit.util.Logger;
import sc.fiji.curvekit.util.SamplingUtils;

/**
 * Profiles image intensities along a line segment or polyline.
 * <p>
 * Pixel coordinates follow the image axes: {@code x} runs along dimension 0
 * (columns) and {@code y} along dimension 1 (rows). When only the two
 * endpoints of a segment are given, the segment is densified to one sample per
 * pixel of length; otherwise the supplied vertices are sampled as they are.
 * </p>
 */
public class LineProfiler< T extends RealType< T > > implements Callable< double[] >
{

    public enum Interpolation
    {
        /** Coordinates are truncated to integer pixel indices */
        NEAREST,
        /** Bicubic sub-pixel interpolation */
        CUBIC;

        /**
         * Parses an interpolation name ("nearest" or "cubic", case-insensitive).
         */
        public static Interpolation fromString( final String name )
        {
            if ( name == null )
                throw new InvalidInputException( "Interpolation cannot be null" );
            switch ( name.trim().toLowerCase( Locale.ROOT ) )
            {
                case "nearest":
                    return NEAREST;
                case "cubic":
                    return CUBIC;
                default:
                    throw new InvalidInputException( "Unknown interpolation: '" + name + "'" );
            }
        }
    }

    public static final Interpolation DEFAULT_INTERPOLATION = Interpolation.CUBIC;

    private final RandomAccessibleInterval< T > rai;
    private final double[] x;
    private final double[] y;
    private Interpolation interpolation = DEFAULT_INTERPOLATION;
    private double[] values;
    private final Logger logger;

    /**
     * Instantiates a new profiler. Arguments are validated before any sampling
     * takes place.
     *
     * @param rai the 2-D image to be sampled
     * @param xi  the x coordinates of the segment endpoints or polyline
     *            vertices
     * @param yi  the y coordinates of the segment endpoints or polyline
     *            vertices
     * @throws InvalidInputException if {@code xi} and {@code yi} differ in
     *                               length, hold fewer than two points, or any
     *                               coordinate does not lie strictly inside the
     *                               image
     */
    public LineProfiler( final RandomAccessibleInterval< T > rai, final double[] xi, final double[] yi )
            throws InvalidInputException
    {
        if ( rai == null )
            throw new InvalidInputException( "Image cannot be null" );
        if ( rai.numDimensions() != 2 )
            throw new InvalidInputException( "A 2-D image is required but image has " + rai.numDimensions()
                    + " dimensions" );
        if ( xi == null || yi == null )
            throw new InvalidInputException( "xi and yi cannot be null" );
        if ( xi.length != yi.length )
            throw new InvalidInputException( "xi and yi must be equal-length!" );
        if ( xi.length < 2 )
            throw new InvalidInputException( "xi or yi must contain at least two elements!" );
        for ( int i = 0; i < xi.length; i++ )
        {
            if ( !( rai.min( 0 ) < xi[ i ] && xi[ i ] < rai.max( 0 ) ) )
                throw new InvalidInputException( "xi out of range: " + xi[ i ] );
            if ( !( rai.min( 1 ) < yi[ i ] && yi[ i ] < rai.max( 1 ) ) )
                throw new InvalidInputException( "yi out of range: " + yi[ i ] );
        }
        this.rai = rai;
        if ( xi.length == 2 )
        {
            final int n = ( int ) Math.round( Math.hypot( xi[ 1 ] - xi[ 0 ], yi[ 1 ] - yi[ 0 ] ) );
            this.x = SamplingUtils.linspace( xi[ 0 ], xi[ 1 ], n );
            this.y = SamplingUtils.linspace( yi[ 0 ], yi[ 1 ], n );
        }
        else
        {
            this.x = xi.clone();
            this.y = yi.clone();
        }
        logger = new Logger( LineProfiler.class );
    }

    /**
     * Profiles a row-major array addressed {@code z[row][col]}.
     *
     * @see #LineProfiler(RandomAccessibleInterval, double[], double[])
     */
    public static double[] profile( final double[][] z, final double[] xi, final double[] yi,
                                    final String interpolation ) throws InvalidInputException
    {
        final Interpolation mode = Interpolation.fromString( interpolation );
        final LineProfiler< DoubleType > profiler = new LineProfiler<>( ImgUtils.wrap( z ), xi, yi );
        profiler.setInterpolation( mode );
        return profiler.call();
    }

    /**
     * Sets the interpolation used to sample the image. Default is
     * {@link Interpolation#CUBIC}.
     *
     * @param interpolation the interpolation
     */
    public void setInterpolation( final Interpolation interpolation )
    {
        if ( interpolation == null )
            throw new InvalidInputException( "Interpolation cannot be null" );
        this.interpolation = interpolation;
    }

    public Interpolation getInterpolation()
    {
        return interpolation;
    }

    /** @return the x coordinates at which the image is sampled */
    public double[] getSamplingX()
    {
        return x.clone();
    }

    /** @return the y coordinates at which the image is sampled */
    public double[] getSamplingY()
    {
        return y.clone();
    }

    /**
     * The profile values, or null if they have not been processed yet.
     *
     * @return the values
     */
    public double[] getValues()
    {
        return values;
    }

    public void process()
    {
        call();
    }

    /**
     * Process and return the profile values.
     *
     * @return one intensity per sampling point. With cubic interpolation,
     *         points outside the interpolable region are NaN
     */
    @Override
    public double[] call()
    {
        logger.debug( "Sampling " + x.length + " points (" + interpolation + ")" );
        switch ( interpolation )
        {
            case NEAREST:
                values = sampleNearest();
                break;
            case CUBIC:
                values = sampleCubic();
                break;
            default:
                throw new IllegalArgumentException( "Unknown interpolation: " + interpolation );
        }
        return values;
    }

    private double[] sampleNearest()
    {
        final double[] result = new double[ x.length ];
        final RandomAccess< T > ra = rai.randomAccess();
        for ( int i = 0; i < x.length; i++ )
        {
            ra.setPosition( ( long ) Math.floor( x[ i ] ), 0 );
            ra.setPosition( ( long ) Math.floor( y[ i ] ), 1 );
            result[ i ] = ra.get().getRealDouble();
        }
        return result;
    }

    private double[] sampleCubic()
    {
        final double[] result = new double[ x.length ];
        if ( x.length == 0 )
            return result;
        // grid covers the sampled region plus a one-pixel margin used for derivatives
        long minX = Long.MAX_VALUE, maxX = Long.MIN_VALUE, minY = Long.MAX_VALUE, maxY = Long.MIN_VALUE;
        for ( int i = 0; i < x.length; i++ )
        {
            minX = Math.min( minX, ( long ) Math.floor( x[ i ] ) );
            maxX = Math.max( maxX, ( long ) Math.ceil( x[ i ] ) );
            minY = Math.min( minY, ( long ) Math.floor( y[ i ] ) );
            maxY = Math.max( maxY, ( long ) Math.ceil( y[ i ] ) );
        }
        final Interval interval = ImgUtils.interval2d( minX - 1, minY - 1, maxX + 1, maxY + 1 );
        final double[][] grid = ImgUtils.toGrid( Views.extendMirrorSingle( rai ), interval );
        final double[] xval = new double[ grid.length ];
        final double[] yval = new double[ grid[ 0 ].length ];
        for ( int i = 0; i < xval.length; i++ )
            xval[ i ] = interval.min( 0 ) + i;
        for ( int j = 0; j < yval.length; j++ )
            yval[ j ] = interval.min( 1 ) + j;
        final BicubicInterpolatingFunction function = new BicubicInterpolator().interpolate( xval, yval, grid );
        for ( int i = 0; i < x.length; i++ )
        {
            result[ i ] = ( function.isValidPoint( x[ i ], y[ i ] ) ) ? function.value( x[ i ], y[ i ] ) : Double.NaN;
        }
        return result;
    }

}
