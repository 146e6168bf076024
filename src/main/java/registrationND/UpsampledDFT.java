package registrationND;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.ComplexType;
import net.imglib2.util.Util;
import net.imglib2.view.Views;

/**
 * Upsampled DFT by matrix multiplication.
 * <p>
 * Gives the same result as embedding the (Fourier transformed) data
 * into an array that is upsampleFactor times larger in each dimension,
 * taking the FFT of the larger array and cropping a region of it starting
 * at axisOffsets. The larger array is never created: for each dimension
 * the region is computed by contracting the data with a small DFT kernel,
 * which is much faster and memory efficient if the region is small
 * compared to the upsampled array.
 * <p>
 * Manuel Guizar-Sicairos, Samuel T. Thurman, and James R. Fienup,
 * "Efficient subpixel image registration algorithms",
 * Optics Letters 33, 156-158 (2008).
 *
 * @author Eugene Katrukha
 */
public class UpsampledDFT {

	/** same region size along all dimensions, region starts at zero **/
	public static < C extends ComplexType< C > & NativeType< C > > Img< C > upsampledDFT(final RandomAccessibleInterval< C > data, final long regionSize, final double upsampleFactor)
	{
		return upsampledDFT(data, regionSize, upsampleFactor, null);
	}

	/** same region size along all dimensions **/
	public static < C extends ComplexType< C > & NativeType< C > > Img< C > upsampledDFT(final RandomAccessibleInterval< C > data, final long regionSize, final double upsampleFactor, final double [] axisOffsets)
	{
		final long [] regionSizes = new long[data.numDimensions()];
		for(int d=0;d<regionSizes.length;d++)
		{
			regionSizes[d] = regionSize;
		}
		return upsampledDFT(data, regionSizes, upsampleFactor, axisOffsets);
	}

	/**
	 * @param data Fourier transform of original data
	 * @param regionSize size of the region to sample, one value per dimension
	 * @param upsampleFactor upsampling factor
	 * @param axisOffsets offsets of the sampled region (in upsampled pixels),
	 * one value per dimension, zeros if null
	 * @return upsampled DFT of the specified region
	 */
	public static < C extends ComplexType< C > & NativeType< C > > Img< C > upsampledDFT(final RandomAccessibleInterval< C > data, final long [] regionSize, final double upsampleFactor, final double [] axisOffsets)
	{
		final int nDim = data.numDimensions();
		if(regionSize.length != nDim)
		{
			throw new ShapeMismatchException("Number of upsampled region sizes ("+Integer.toString(regionSize.length)
			+") must be equal to the input data's number of dimensions ("+Integer.toString(nDim)+").");
		}
		final double [] offsets;
		if(axisOffsets == null)
		{
			offsets = new double[nDim];
		}
		else
		{
			if(axisOffsets.length != nDim)
			{
				throw new ShapeMismatchException("Number of axis offsets ("+Integer.toString(axisOffsets.length)
				+") must be equal to the input data's number of dimensions ("+Integer.toString(nDim)+").");
			}
			offsets = axisOffsets;
		}
		if(!(upsampleFactor > 0))
		{
			throw new IllegalArgumentException("Upsample factor must be positive, got "+Double.toString(upsampleFactor));
		}

		final Precision precision = Precision.of(Util.getTypeFromInterval(data));
		RandomAccessibleInterval< C > current = Views.zeroMin(data);
		double [][][] kernel;

		for(int d=nDim-1;d>=0;d--)
		{
			kernel = dftKernel(data.dimension(d), regionSize[d], upsampleFactor, offsets[d], precision);
			current = contractDimension(current, d, kernel[0], kernel[1]);
		}
		return (Img< C >) current;
	}

	/** returns real [0] and imaginary [1] parts of the kernel
	 * exp(-2 pi i (k - offset) * fftfreq(n, upsampleFactor)[j]),
	 * with k in [0, regionSize) and j in [0, n) **/
	static double [][][] dftKernel(final long n, final long regionSize, final double upsampleFactor, final double offset, final Precision precision)
	{
		final double [][][] kernel = new double [2][(int) regionSize][(int) n];
		final double [] freq = fftFreq(n, upsampleFactor);
		double phase;
		for(int k=0;k<regionSize;k++)
		{
			for(int j=0;j<n;j++)
			{
				phase = 2.0*Math.PI*(k-offset)*freq[j];
				//kernel has the same precision as the data
				kernel[0][k][j] = precision.round(Math.cos(phase));
				kernel[1][k][j] = precision.round((-1.0)*Math.sin(phase));
			}
		}
		return kernel;
	}

	/** sample frequencies of DFT of length n and sample spacing d,
	 * in the standard order (zero, positive, negative) **/
	public static double [] fftFreq(final long n, final double d)
	{
		final double [] freq = new double[(int) n];
		final long nPositive = (n+1)/2;
		for(int j=0;j<n;j++)
		{
			if(j<nPositive)
			{
				freq[j] = j/(d*n);
			}
			else
			{
				freq[j] = (j-n)/(d*n);
			}
		}
		return freq;
	}

	/** matrix multiplication of the kernel (K x n) with data along dimension dim,
	 * the output has the size K along dim and the same size as data along the rest **/
	static < C extends ComplexType< C > & NativeType< C > > Img< C > contractDimension(final RandomAccessibleInterval< C > data, final int dim, final double [][] kernelRe, final double [][] kernelIm)
	{
		final int nDim = data.numDimensions();
		final int nIn = (int) data.dimension(dim);
		final long [] outDims = new long[nDim];
		data.dimensions(outDims);
		outDims[dim] = kernelRe.length;

		final C type = Util.getTypeFromInterval(data).createVariable();
		final Img< C > output = new ArrayImgFactory< C >(type).create(outDims);
		final RandomAccessibleInterval< C > input = Views.zeroMin(data);
		final RandomAccess< C > inRA = input.randomAccess();
		final Cursor< C > outC = output.localizingCursor();

		double sumRe, sumIm, re, im;
		int k, j;
		C val;
		while(outC.hasNext())
		{
			outC.fwd();
			inRA.setPosition(outC);
			k = outC.getIntPosition(dim);
			sumRe = 0.0;
			sumIm = 0.0;
			for(j=0;j<nIn;j++)
			{
				inRA.setPosition(j, dim);
				val = inRA.get();
				re = val.getRealDouble();
				im = val.getImaginaryDouble();
				sumRe += kernelRe[k][j]*re - kernelIm[k][j]*im;
				sumIm += kernelRe[k][j]*im + kernelIm[k][j]*re;
			}
			outC.get().setComplexNumber(sumRe, sumIm);
		}
		return output;
	}
}
