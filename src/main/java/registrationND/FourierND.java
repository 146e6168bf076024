package registrationND;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.jtransforms.fft.DoubleFFT_1D;
import org.jtransforms.fft.FloatFFT_1D;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.ComplexType;
import net.imglib2.util.Util;
import net.imglib2.view.Views;

/**
 * In place N-dimensional complex to complex FFT. Forward transform uses
 * exp(-2 pi i kn/N) and is not scaled, inverse is scaled by 1/N.
 *
 * Each dimension is transformed line by line with JTransforms, single precision
 * for float data and double precision for double data. Any length is supported,
 * singleton dimensions are skipped.
 *
 * @author Eugene Katrukha
 */
public class FourierND {

	public static < C extends ComplexType< C > & NativeType< C > > void forward(final Img< C > data)
	{
		transform(data, true);
	}

	public static < C extends ComplexType< C > & NativeType< C > > void inverse(final Img< C > data)
	{
		transform(data, false);
	}

	static < C extends ComplexType< C > & NativeType< C > > void transform(final Img< C > data, final boolean bForward)
	{
		final int nDim = data.numDimensions();
		final Precision precision = Precision.of(Util.getTypeFromInterval(data));
		final int nThreads = Runtime.getRuntime().availableProcessors();
		final ExecutorService es = Executors.newFixedThreadPool( nThreads );
		try
		{
			for(int d=0;d<nDim;d++)
			{
				if(data.dimension(d) == 1)
				{
					continue;
				}
				transformDimension(data, d, bForward, precision, es, nThreads);
			}
		}
		finally
		{
			es.shutdown();
		}
	}

	/** transforms all lines of data along dimension dim, lines are split between nTasks tasks **/
	static < C extends ComplexType< C > & NativeType< C > > void transformDimension(final Img< C > data, final int dim, final boolean bForward, final Precision precision, final ExecutorService es, final int nTasks)
	{
		final int nDim = data.numDimensions();
		final List< long [] > lineStarts = new ArrayList<>();

		//starting points of the lines are the positions of the hyperslice at dim = 0
		if(nDim == 1)
		{
			lineStarts.add(new long[] {data.min(0)});
		}
		else
		{
			final Cursor< C > cursor = Views.hyperSlice(data, dim, data.min(dim)).localizingCursor();
			final long [] slicePos = new long[nDim-1];
			while(cursor.hasNext())
			{
				cursor.fwd();
				cursor.localize(slicePos);
				final long [] start = new long[nDim];
				for(int d=0, s=0;d<nDim;d++)
				{
					start[d] = (d == dim) ? data.min(dim) : slicePos[s++];
				}
				lineStarts.add(start);
			}
		}

		final int nLines = lineStarts.size();
		final int nChunk = (nLines + nTasks - 1)/nTasks;
		final List< Callable< Void > > tasks = new ArrayList<>();
		for(int nBegin=0;nBegin<nLines;nBegin+=nChunk)
		{
			final List< long [] > chunk = lineStarts.subList(nBegin, Math.min(nBegin+nChunk, nLines));
			tasks.add(() ->
			{
				if(precision == Precision.FLOAT)
				{
					transformLinesFloat(data, dim, bForward, chunk);
				}
				else
				{
					transformLinesDouble(data, dim, bForward, chunk);
				}
				return null;
			});
		}

		try
		{
			for(final Future< Void > future : es.invokeAll(tasks))
			{
				future.get();
			}
		}
		catch ( InterruptedException exc )
		{
			Thread.currentThread().interrupt();
			throw new IllegalStateException("FFT was interrupted", exc);
		}
		catch ( ExecutionException exc )
		{
			throw new IllegalStateException("FFT along dimension " + dim + " failed", exc.getCause());
		}
	}

	private static < C extends ComplexType< C > > void transformLinesDouble(final Img< C > data, final int dim, final boolean bForward, final List< long [] > lineStarts)
	{
		final int n = (int) data.dimension(dim);
		final DoubleFFT_1D fft = new DoubleFFT_1D(n);
		final double [] line = new double[2*n];
		final RandomAccess< C > ra = data.randomAccess();
		int i;
		for(final long [] start : lineStarts)
		{
			ra.setPosition(start);
			for(i=0;i<n;i++)
			{
				line[2*i] = ra.get().getRealDouble();
				line[2*i+1] = ra.get().getImaginaryDouble();
				ra.fwd(dim);
			}
			if(bForward)
			{
				fft.complexForward(line);
			}
			else
			{
				fft.complexInverse(line, true);
			}
			ra.setPosition(start);
			for(i=0;i<n;i++)
			{
				ra.get().setComplexNumber(line[2*i], line[2*i+1]);
				ra.fwd(dim);
			}
		}
	}

	private static < C extends ComplexType< C > > void transformLinesFloat(final Img< C > data, final int dim, final boolean bForward, final List< long [] > lineStarts)
	{
		final int n = (int) data.dimension(dim);
		final FloatFFT_1D fft = new FloatFFT_1D(n);
		final float [] line = new float[2*n];
		final RandomAccess< C > ra = data.randomAccess();
		int i;
		for(final long [] start : lineStarts)
		{
			ra.setPosition(start);
			for(i=0;i<n;i++)
			{
				line[2*i] = ra.get().getRealFloat();
				line[2*i+1] = ra.get().getImaginaryFloat();
				ra.fwd(dim);
			}
			if(bForward)
			{
				fft.complexForward(line);
			}
			else
			{
				fft.complexInverse(line, true);
			}
			ra.setPosition(start);
			for(i=0;i<n;i++)
			{
				ra.get().setComplexNumber(line[2*i], line[2*i+1]);
				ra.fwd(dim);
			}
		}
	}

}
