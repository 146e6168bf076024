package registrationND;

import ij.IJ;
import net.imglib2.Point;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.ComplexType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.complex.ComplexFloatType;
import net.imglib2.util.Intervals;
import net.imglib2.util.Util;

/**
 * Efficient subpixel image translation registration by cross-correlation.
 * <p>
 * Initial estimate of the cross-correlation peak is obtained by FFT,
 * then (if upsampleFactor is larger than one) it is refined by upsampling
 * the DFT only in a small neighborhood of that estimate by means of
 * a matrix-multiply DFT (see {@link UpsampledDFT}).
 * <p>
 * Default "phase" normalization corresponds to phase correlation,
 * which works well for images under different illumination,
 * but is not very robust to noise. For noisy images null normalization
 * (plain cross-correlation) may be preferable.
 * <p>
 * Instance fields are registration parameters only, every call of
 * {@link #calculate(RandomAccessibleInterval, RandomAccessibleInterval)}
 * returns a new result and keeps no data.
 *
 * @author Eugene Katrukha
 */
public class PhaseCrossCorrelation {

	/** images are registered within 1/upsampleFactor of a pixel **/
	public int upsampleFactor = 1;

	/** "real" means inputs are images and will be Fourier transformed,
	 * "fourier" means inputs are already Fourier transforms, case insensitive **/
	public String space = "real";

	/** search over ambiguous periodic shifts in real space, not implemented **/
	public boolean bDisambiguate = false;

	/** mask of valid reference pixels, masked registration is not implemented **/
	public RandomAccessibleInterval< ? > referenceMask = null;

	/** mask of valid moving pixels, masked registration is not implemented **/
	public RandomAccessibleInterval< ? > movingMask = null;

	/** minimum overlap ratio, used only by masked registration **/
	public double overlapRatio = 0.3;

	/** "phase" or null (no normalization) **/
	public String normalization = "phase";

	/** whether to log results to IJ.log window **/
	public boolean bVerbose = false;

	/** if true, throws DegenerateRegistrationException for empty images
	 * instead of returning NaN error **/
	public boolean bStrictAmplitude = false;

	/**
	 * @param reference reference image (or its Fourier transform)
	 * @param moving image to register, same dimensions as reference
	 * @return shift required to register moving image with the reference, error and phase difference
	 */
	public < R extends ComplexType< R >, M extends ComplexType< M > > RegistrationResult calculate(final RandomAccessibleInterval< R > reference, final RandomAccessibleInterval< M > moving)
	{
		final boolean bRealSpace = validate(reference, moving);

		final Precision precision = Precision.promote(
				Precision.of(Util.getTypeFromInterval(reference)),
				Precision.of(Util.getTypeFromInterval(moving)));

		if(precision == Precision.FLOAT)
		{
			return register(reference, moving, bRealSpace, new ComplexFloatType(), precision);
		}
		return register(reference, moving, bRealSpace, new ComplexDoubleType(), precision);
	}

	/** checks parameters and dimensions, returns true for the real space input **/
	boolean validate(final RandomAccessibleInterval< ? > reference, final RandomAccessibleInterval< ? > moving)
	{
		if(referenceMask != null || movingMask != null)
		{
			throw new UnsupportedOperationException("Masked phase cross-correlation is not implemented.");
		}
		if(bDisambiguate)
		{
			throw new UnsupportedOperationException("Disambiguation of the shift is not implemented.");
		}
		if(reference.numDimensions() != moving.numDimensions() || !Intervals.equalDimensions(reference, moving))
		{
			throw new ShapeMismatchException("Images must have the same shape, got "
					+Util.printInterval(reference)+" != "+Util.printInterval(moving));
		}
		final boolean bRealSpace;
		if(space == null)
		{
			throw new IllegalArgumentException("Space argument must be \"real\" or \"fourier\".");
		}
		switch(space.toLowerCase())
		{
			case "real":
				bRealSpace = true;
				break;
			case "fourier":
				bRealSpace = false;
				break;
			default:
				throw new IllegalArgumentException("Space argument must be \"real\" or \"fourier\", got \""+space+"\".");
		}
		if(normalization != null && !normalization.equals("phase"))
		{
			throw new IllegalArgumentException("Normalization must be either \"phase\" or null, got \""+normalization+"\".");
		}
		if(upsampleFactor < 1)
		{
			throw new IllegalArgumentException("Upsample factor must be positive, got "+Integer.toString(upsampleFactor));
		}
		return bRealSpace;
	}

	< R extends ComplexType< R >, M extends ComplexType< M >, C extends ComplexType< C > & NativeType< C > > RegistrationResult register(final RandomAccessibleInterval< R > reference, final RandomAccessibleInterval< M > moving, final boolean bRealSpace, final C type, final Precision precision)
	{
		int d;
		final int nDim = reference.numDimensions();
		final long [] shape = Intervals.dimensionsAsLongArray(reference);

		final Img< C > srcFreq = MiscUtils.copyToComplex(reference, type);
		final Img< C > targetFreq = MiscUtils.copyToComplex(moving, type);
		if(bRealSpace)
		{
			FourierND.forward(srcFreq);
			FourierND.forward(targetFreq);
		}

		//cross-correlation in the Fourier domain
		final Img< C > imageProduct = targetFreq.copy();
		MiscUtils.complexConjugate(imageProduct);
		LoopBuilder.setImages(srcFreq, imageProduct).multiThreaded().forEachPixel((s,t)->t.mul(s));

		if(normalization != null)
		{
			final double minAmp = 100.0*precision.eps();
			LoopBuilder.setImages(imageProduct).multiThreaded().forEachPixel(t->
			{
				final double amp = Math.max(MiscUtils.magnitude(t), minAmp);
				t.setComplexNumber(t.getRealDouble()/amp, t.getImaginaryDouble()/amp);
			});
		}

		final Img< C > crossCorrelation = imageProduct.copy();
		FourierND.inverse(crossCorrelation);

		//locate maximum
		final Point maxima = new Point(nDim);
		C ccMax = MiscUtils.computeMaxMagnitudeLocation(crossCorrelation, maxima);

		//periodic DFT index to signed shift
		final double [] shift = new double[nDim];
		for(d=0;d<nDim;d++)
		{
			shift[d] = maxima.getDoublePosition(d);
			if(shift[d] > Math.floor(shape[d]/2.0))
			{
				shift[d] -= shape[d];
			}
		}

		double srcAmp, targetAmp;
		if(upsampleFactor == 1)
		{
			srcAmp = MiscUtils.sumPower(srcFreq)/srcFreq.size();
			targetAmp = MiscUtils.sumPower(targetFreq)/targetFreq.size();
		}
		//refine estimate with matrix multiply DFT
		else
		{
			//initial shift estimate in upsampled grid
			for(d=0;d<nDim;d++)
			{
				shift[d] = Math.rint(shift[d]*upsampleFactor)/upsampleFactor;
			}
			final long upsampledRegionSize = (long) Math.ceil(upsampleFactor*1.5);
			//center of output array at dftShift
			final double dftShift = Math.floor(upsampledRegionSize/2.0);
			final double [] sampleRegionOffset = new double[nDim];
			for(d=0;d<nDim;d++)
			{
				sampleRegionOffset[d] = dftShift - shift[d]*upsampleFactor;
			}
			//product is not needed anymore, conjugate in place
			MiscUtils.complexConjugate(imageProduct);
			final Img< C > upsampledCC = UpsampledDFT.upsampledDFT(imageProduct, upsampledRegionSize, upsampleFactor, sampleRegionOffset);
			MiscUtils.complexConjugate(upsampledCC);

			ccMax = MiscUtils.computeMaxMagnitudeLocation(upsampledCC, maxima);
			for(d=0;d<nDim;d++)
			{
				shift[d] += (maxima.getDoublePosition(d) - dftShift)/upsampleFactor;
			}
			//not normalized by the number of pixels, same as upsampled CC
			srcAmp = MiscUtils.sumPower(srcFreq);
			targetAmp = MiscUtils.sumPower(targetFreq);
		}

		for(d=0;d<nDim;d++)
		{
			//no shift along singleton dimensions
			if(shape[d] == 1)
			{
				shift[d] = 0.0;
			}
			else
			{
				shift[d] = precision.round(shift[d]);
			}
		}

		final double error = computeError(ccMax, srcAmp, targetAmp);
		final double phaseDiff = computePhaseDiff(ccMax);
		final RegistrationResult result = new RegistrationResult(shift, error, phaseDiff, precision);

		if(bVerbose)
		{
			String sOutput = "Shift for moving image to register with reference (px):\n("+Double.toString(shift[0]);
			for(d=1;d<nDim;d++)
			{
				sOutput = sOutput +", " +Double.toString(shift[d]);
			}
			sOutput=sOutput+")\nError: "+Double.toString(error)+", phase difference: "+Double.toString(phaseDiff);
			IJ.log(sOutput);
		}
		return result;
	}

	/**
	 * RMS error metric between reference and moving images
	 * (J.R. Fienup, "Invariant error metrics for image reconstruction", Applied Optics 36, 8352-8357 (1997)).
	 *
	 * @param ccMax complex value of the cross-correlation at its maximum
	 * @param srcAmp normalized average intensity of the reference image
	 * @param targetAmp normalized average intensity of the moving image
	 * @return error, NaN if one of the intensities is zero
	 */
	double computeError(final ComplexType< ? > ccMax, final double srcAmp, final double targetAmp)
	{
		final double amp = srcAmp*targetAmp;
		if(amp == 0.0)
		{
			final String sWarning = "Could not determine RMS error between images with the normalized average intensities "
					+Double.toString(srcAmp)+" and "+Double.toString(targetAmp)+". Either the reference or moving image may be empty.";
			if(bStrictAmplitude)
			{
				throw new DegenerateRegistrationException(sWarning);
			}
			if(bVerbose)
			{
				IJ.log("Warning! "+sWarning);
			}
			return Double.NaN;
		}
		final double re = ccMax.getRealDouble();
		final double im = ccMax.getImaginaryDouble();
		final double error = 1.0 - (re*re + im*im)/amp;
		return Math.sqrt(Math.abs(error));
	}

	/** global phase difference between the two images in (-pi, pi],
	 * should be zero if images are non-negative **/
	static double computePhaseDiff(final ComplexType< ? > ccMax)
	{
		final double phase = Math.atan2(ccMax.getImaginaryDouble(), ccMax.getRealDouble());
		return phase == -Math.PI ? Math.PI : phase;
	}
}
