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

package sc.fiji.curvekit.util;

import net.imglib2.Cursor;
import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccessible;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import sc.fiji.curvekit.InvalidInputException;

/**
 * Static utilities for handling 2-D {@link RandomAccessibleInterval}s
 */
public class ImgUtils
{

    private ImgUtils() {}

    /**
     * Wraps a row-major array addressed {@code z[row][col]} as an image whose
     * dimension 0 runs along columns (x) and dimension 1 along rows (y).
     *
     * @param z the array. All rows must be equal-length
     * @return the image (a copy of the array data)
     */
    public static Img< DoubleType > wrap( final double[][] z )
    {
        if ( z == null || z.length == 0 || z[ 0 ] == null || z[ 0 ].length == 0 )
            throw new InvalidInputException( "Image cannot be empty" );
        final int width = z[ 0 ].length;
        final double[] flat = new double[ z.length * width ];
        for ( int row = 0; row < z.length; row++ )
        {
            if ( z[ row ] == null || z[ row ].length != width )
                throw new InvalidInputException( "Image rows must be equal-length" );
            System.arraycopy( z[ row ], 0, flat, row * width, width );
        }
        return ArrayImgs.doubles( flat, width, z.length );
    }

    /**
     * Copies the values of a 2-D source over the given interval into an array
     * addressed {@code grid[x - min(0)][y - min(1)]}.
     */
    public static < T extends RealType< T > > double[][] toGrid( final RandomAccessible< T > source,
                                                                  final Interval interval )
    {
        final int w = ( int ) interval.dimension( 0 );
        final int h = ( int ) interval.dimension( 1 );
        final double[][] grid = new double[ w ][ h ];
        final Cursor< T > cursor = Views.flatIterable( Views.interval( source, interval ) ).localizingCursor();
        while ( cursor.hasNext() )
        {
            cursor.fwd();
            final int x = ( int ) ( cursor.getLongPosition( 0 ) - interval.min( 0 ) );
            final int y = ( int ) ( cursor.getLongPosition( 1 ) - interval.min( 1 ) );
            grid[ x ][ y ] = cursor.get().getRealDouble();
        }
        return grid;
    }

    /** Creates a 2-D interval from its inclusive corners. */
    public static Interval interval2d( final long minX, final long minY, final long maxX, final long maxY )
    {
        return new FinalInterval( new long[] { minX, minY }, new long[] { maxX, maxY } );
    }

}
