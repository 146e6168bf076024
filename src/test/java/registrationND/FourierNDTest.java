package registrationND;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.complex.ComplexFloatType;

public class FourierNDTest {

	static void assertImagesEqual(final Img< ComplexDoubleType > expected, final Img< ComplexDoubleType > actual, final double tolerance)
	{
		final Cursor< ComplexDoubleType > expC = expected.cursor();
		final Cursor< ComplexDoubleType > actC = actual.cursor();
		while(expC.hasNext())
		{
			expC.fwd();
			actC.fwd();
			assertEquals(expC.get().getRealDouble(), actC.get().getRealDouble(), tolerance);
			assertEquals(expC.get().getImaginaryDouble(), actC.get().getImaginaryDouble(), tolerance);
		}
	}

	/** 2D DFT summed term by term in double precision **/
	static Img< ComplexDoubleType > naiveDFT2D(final Img< ComplexDoubleType > data)
	{
		final int n0 = (int) data.dimension(0);
		final int n1 = (int) data.dimension(1);
		final Img< ComplexDoubleType > out = ArrayImgs.complexDoubles(n0, n1);
		final Cursor< ComplexDoubleType > outC = out.localizingCursor();
		while(outC.hasNext())
		{
			outC.fwd();
			final int k0 = outC.getIntPosition(0);
			final int k1 = outC.getIntPosition(1);
			double re = 0.0;
			double im = 0.0;
			final Cursor< ComplexDoubleType > inC = data.localizingCursor();
			while(inC.hasNext())
			{
				inC.fwd();
				final double phase = -2.0*Math.PI*(((long) k0*inC.getIntPosition(0))%n0/(double) n0 + ((long) k1*inC.getIntPosition(1))%n1/(double) n1);
				final double cos = Math.cos(phase);
				final double sin = Math.sin(phase);
				re += inC.get().getRealDouble()*cos - inC.get().getImaginaryDouble()*sin;
				im += inC.get().getRealDouble()*sin + inC.get().getImaginaryDouble()*cos;
			}
			outC.get().set(re, im);
		}
		return out;
	}

	@Test
	public void testDeltaTransformsToOnes()
	{
		final Img< ComplexDoubleType > data = ArrayImgs.complexDoubles(12, 17, 1);
		data.firstElement().set(1.0, 0.0);
		FourierND.forward(data);
		for(final ComplexDoubleType t : data)
		{
			assertEquals(1.0, t.getRealDouble(), 1e-12);
			assertEquals(0.0, t.getImaginaryDouble(), 1e-12);
		}
	}

	@Test
	public void testForwardInverseRecoversData()
	{
		final Img< ComplexDoubleType > data = UpsampledDFTTest.randomComplex(5L, 12, 17, 1, 3);
		final Img< ComplexDoubleType > transformed = data.copy();
		FourierND.forward(transformed);
		FourierND.inverse(transformed);
		assertImagesEqual(data, transformed, 1e-12);
	}

	@Test
	public void testPowerOfTwoForwardInverseRecoversData()
	{
		final Img< ComplexDoubleType > data = UpsampledDFTTest.randomComplex(7L, 128, 128);
		final Img< ComplexDoubleType > transformed = data.copy();
		FourierND.forward(transformed);
		FourierND.inverse(transformed);
		assertImagesEqual(data, transformed, 1e-12);
	}

	@Test
	public void testMatchesNaiveDFTInDoublePrecision()
	{
		//one power of two length and one prime length
		final Img< ComplexDoubleType > data = UpsampledDFTTest.randomComplex(6L, 32, 7);
		final Img< ComplexDoubleType > expected = naiveDFT2D(data);
		final Img< ComplexDoubleType > fft = data.copy();
		FourierND.forward(fft);
		assertImagesEqual(expected, fft, 1e-10);

		FourierND.inverse(fft);
		assertImagesEqual(data, fft, 1e-12);
	}

	@Test
	public void testFloatDataTransformedInSinglePrecision()
	{
		final Img< ComplexDoubleType > data = UpsampledDFTTest.randomComplex(8L, 64, 9);
		final Img< ComplexDoubleType > expected = naiveDFT2D(data);
		final Img< ComplexFloatType > floatData = ArrayImgs.complexFloats(64, 9);
		LoopBuilder.setImages(data, floatData).forEachPixel((s,t)->t.set(s.getRealFloat(), s.getImaginaryFloat()));
		FourierND.forward(floatData);
		final Cursor< ComplexDoubleType > expC = expected.cursor();
		final Cursor< ComplexFloatType > actC = floatData.cursor();
		double maxErr = 0.0;
		while(expC.hasNext())
		{
			expC.fwd();
			actC.fwd();
			maxErr = Math.max(maxErr, Math.abs(expC.get().getRealDouble() - actC.get().getRealDouble()));
			maxErr = Math.max(maxErr, Math.abs(expC.get().getImaginaryDouble() - actC.get().getImaginaryDouble()));
		}
		//values are of the order of sqrt(576), single precision keeps about 7 digits
		assertTrue(maxErr < 1e-3);
		assertTrue(maxErr > 0.0);
	}

	@Test
	public void testSinusoidOfPrimeLength()
	{
		//exp(2 pi i 3 n/17) has all its energy in frequency 3
		final int n = 17;
		final Img< ComplexDoubleType > data = ArrayImgs.complexDoubles(n);
		final Cursor< ComplexDoubleType > cursor = data.localizingCursor();
		while(cursor.hasNext())
		{
			cursor.fwd();
			final double phase = 2.0*Math.PI*3*cursor.getIntPosition(0)/n;
			cursor.get().set(Math.cos(phase), Math.sin(phase));
		}
		FourierND.forward(data);
		final RandomAccess< ComplexDoubleType > ra = data.randomAccess();
		for(int k=0;k<n;k++)
		{
			ra.setPosition(k, 0);
			assertEquals(k == 3 ? n : 0.0, ra.get().getRealDouble(), 1e-11);
			assertEquals(0.0, ra.get().getImaginaryDouble(), 1e-11);
		}
	}
}
