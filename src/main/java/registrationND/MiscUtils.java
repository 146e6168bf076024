package registrationND;

import ij.ImagePlus;
import ij.ImageStack;
import net.imglib2.Cursor;
import net.imglib2.IterableInterval;
import net.imglib2.Point;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.ComplexType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.util.RealSum;
import net.imglib2.view.Views;

public class MiscUtils {

	/**
	 * Copies real or complex values of the input to a new complex image
	 *
	 * @param input - real or complex image
	 * @param type - complex type of the output
	 * @return - complex copy, zero-min
	 */
	public static < T extends ComplexType< T >, C extends ComplexType< C > & NativeType< C > > Img< C > copyToComplex( final RandomAccessibleInterval< T > input, final C type )
	{
		final long [] dims = Intervals.dimensionsAsLongArray( input );
		final Img< C > output = new ArrayImgFactory< C >( type ).create( dims );

		LoopBuilder.setImages( Views.zeroMin( input ), output ).forEachPixel(
				( in, out ) -> out.setComplexNumber( in.getRealDouble(), in.getImaginaryDouble() ) );

		return output;
	}

	/** computes location of the voxel with maximum magnitude,
	 * the first one in the iteration order if there are several **/
	public static < C extends ComplexType< C > > C computeMaxMagnitudeLocation(
			final IterableInterval< C > input, final Point maxLocation)
		{
			final Cursor< C > cursor = input.localizingCursor();

			// initialize with the first value
			C type = cursor.next();
			C max = type.copy();
			double maxMagnitude = magnitude( type );
			maxLocation.setPosition( cursor );
			double currMagnitude;

			while ( cursor.hasNext() )
			{
				type = cursor.next();
				currMagnitude = magnitude( type );

				if ( currMagnitude > maxMagnitude )
				{
					maxMagnitude = currMagnitude;
					max.set( type );
					maxLocation.setPosition( cursor );
				}
			}
			return max;
		}

	/** replaces each value by its complex conjugate **/
	public static < C extends ComplexType< C > > void complexConjugate( final RandomAccessibleInterval< C > data )
	{
		LoopBuilder.setImages( data ).multiThreaded().forEachPixel( ComplexType::complexConjugate );
	}

	/** absolute value of complex number **/
	public static double magnitude( final ComplexType< ? > value )
	{
		return Math.hypot( value.getRealDouble(), value.getImaginaryDouble() );
	}

	/**
	 * Computes the sum of Re(z*conj(z)) over all pixels using RealSum
	 *
	 * @param iterable - complex image data
	 * @return - total power
	 */
	public static double sumPower( final Iterable< ? extends ComplexType< ? > > iterable )
	{
		final RealSum sum = new RealSum();
		double re, im;
		for ( final ComplexType< ? > type : iterable )
		{
			re = type.getRealDouble();
			im = type.getImaginaryDouble();
			sum.add( re*re + im*im );
		}
		return sum.getSum();
	}

    /** returns dimensions of the ImagePlus (without channels) in XYZT format**/
	public static String getDimensionsText(final ImagePlus ip)
	{
		String sDims = "XY";

		if(ip.getNSlices()>1)
		{
			sDims = sDims + "Z";
		}

		if(ip.getNFrames()>1)
		{
			sDims = sDims + "T";
		}

		return sDims;
	}

	/** copies one channel of the image to a float Img with XY(Z)(T) dimensions
	 * (channel is zero based) **/
	public static Img< FloatType > convertFloatChannel(final ImagePlus imp, final int nChannel)
	{
		final String sDims = getDimensionsText(imp);
		final int nDims = sDims.length();
		final long [] dimensions = new long[nDims];
		dimensions[0] = imp.getWidth();
		dimensions[1] = imp.getHeight();
		int nZdim = -1;
		int nTdim = -1;
		for(int i=2;i<nDims;i++)
		{
			if(sDims.charAt(i)=='Z')
			{
				dimensions[i] = imp.getNSlices();
				nZdim = i;
			}
			if(sDims.charAt(i)=='T')
			{
				dimensions[i] = imp.getNFrames();
				nTdim = i;
			}
		}
		final Img< FloatType > img = ArrayImgs.floats(dimensions);
		final RandomAccess< FloatType > ra = img.randomAccess();
		final ImageStack stack = imp.getStack();
		final int nW = imp.getWidth();
		final int nH = imp.getHeight();
		int nSl, nTp;
		for(nTp = 1; nTp <= imp.getNFrames(); nTp++)
		{
			for(nSl = 1; nSl <= imp.getNSlices(); nSl++)
			{
				final float [] pixels = (float []) stack.getProcessor(imp.getStackIndex(nChannel+1, nSl, nTp)).convertToFloatProcessor().getPixels();
				if(nZdim>0)
				{
					ra.setPosition(nSl-1, nZdim);
				}
				if(nTdim>0)
				{
					ra.setPosition(nTp-1, nTdim);
				}
				for(int y=0;y<nH;y++)
				{
					ra.setPosition(y, 1);
					for(int x=0;x<nW;x++)
					{
						ra.setPosition(x, 0);
						ra.get().set(pixels[x+y*nW]);
					}
				}
			}
		}
		return img;
	}
}
