package registrationND;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.Random;

import org.junit.Test;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.complex.ComplexFloatType;
import net.imglib2.util.Intervals;

public class UpsampledDFTTest {

	static Img< ComplexDoubleType > randomComplex(final long seed, final long... dims)
	{
		final Random rnd = new Random(seed);
		final Img< ComplexDoubleType > img = ArrayImgs.complexDoubles(dims);
		img.forEach(t->t.set(2.0*rnd.nextDouble()-1.0, 2.0*rnd.nextDouble()-1.0));
		return img;
	}

	@Test(expected = ShapeMismatchException.class)
	public void testMismatchUpsampledRegionSize()
	{
		final Img< ComplexDoubleType > data = ArrayImgs.complexDoubles(4, 4);
		UpsampledDFT.upsampledDFT(data, new long [] {3, 2, 1, 4}, 1.0, null);
	}

	@Test(expected = ShapeMismatchException.class)
	public void testMismatchOffsetsSize()
	{
		final Img< ComplexDoubleType > data = ArrayImgs.complexDoubles(4, 4);
		UpsampledDFT.upsampledDFT(data, 3, 1.0, new double [] {3, 2, 1, 4});
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonPositiveUpsampleFactor()
	{
		final Img< ComplexDoubleType > data = ArrayImgs.complexDoubles(4, 4);
		UpsampledDFT.upsampledDFT(data, 3, 0.0);
	}

	@Test
	public void testRegionSizeIsBroadcast()
	{
		final Img< ComplexDoubleType > data = randomComplex(1L, 4, 5, 6);
		final Img< ComplexDoubleType > out = UpsampledDFT.upsampledDFT(data, 3, 2.0);
		assertArrayEquals(new long [] {3, 3, 3}, Intervals.dimensionsAsLongArray(out));
	}

	@Test
	public void testNoUpsamplingIsDFT()
	{
		final Img< ComplexDoubleType > data = randomComplex(2L, 6, 10);
		final Img< ComplexDoubleType > expected = data.copy();
		FourierND.forward(expected);

		final Img< ComplexDoubleType > out = UpsampledDFT.upsampledDFT(data, new long [] {6, 10}, 1.0, null);

		final Cursor< ComplexDoubleType > outC = out.cursor();
		final Cursor< ComplexDoubleType > expC = expected.cursor();
		while(outC.hasNext())
		{
			outC.fwd();
			expC.fwd();
			assertEquals(expC.get().getRealDouble(), outC.get().getRealDouble(), 1e-10);
			assertEquals(expC.get().getImaginaryDouble(), outC.get().getImaginaryDouble(), 1e-10);
		}
	}

	@Test
	public void testUpsampledGridContainsDFT()
	{
		final int nUp = 3;
		final Img< ComplexDoubleType > data = randomComplex(3L, 5, 4);
		final Img< ComplexDoubleType > dft = data.copy();
		FourierND.forward(dft);

		final Img< ComplexDoubleType > out = UpsampledDFT.upsampledDFT(data, new long [] {5*nUp, 4*nUp}, nUp, null);

		final Cursor< ComplexDoubleType > dftC = dft.localizingCursor();
		final RandomAccess< ComplexDoubleType > outRA = out.randomAccess();
		while(dftC.hasNext())
		{
			dftC.fwd();
			outRA.setPosition(nUp*dftC.getIntPosition(0), 0);
			outRA.setPosition(nUp*dftC.getIntPosition(1), 1);
			assertEquals(dftC.get().getRealDouble(), outRA.get().getRealDouble(), 1e-10);
			assertEquals(dftC.get().getImaginaryDouble(), outRA.get().getImaginaryDouble(), 1e-10);
		}
	}

	@Test
	public void testOffsetMovesRegion()
	{
		final Img< ComplexDoubleType > data = randomComplex(4L, 8, 6);
		final Img< ComplexDoubleType > full = UpsampledDFT.upsampledDFT(data, new long [] {10, 9}, 2.0, null);
		final Img< ComplexDoubleType > part = UpsampledDFT.upsampledDFT(data, new long [] {4, 5}, 2.0, new double [] {-3, -2});

		final Cursor< ComplexDoubleType > partC = part.localizingCursor();
		final RandomAccess< ComplexDoubleType > fullRA = full.randomAccess();
		while(partC.hasNext())
		{
			partC.fwd();
			fullRA.setPosition(partC.getIntPosition(0)+3, 0);
			fullRA.setPosition(partC.getIntPosition(1)+2, 1);
			assertEquals(fullRA.get().getRealDouble(), partC.get().getRealDouble(), 1e-9);
			assertEquals(fullRA.get().getImaginaryDouble(), partC.get().getImaginaryDouble(), 1e-9);
		}
	}

	@Test
	public void testFloatDataGivesFloatOutput()
	{
		final Img< ComplexFloatType > data = ArrayImgs.complexFloats(4, 4);
		data.forEach(t->t.set(1.0f, 0.0f));
		final Img< ComplexFloatType > out = UpsampledDFT.upsampledDFT(data, 2, 4.0);
		assertEquals(ComplexFloatType.class, out.firstElement().getClass());
		//DC term of constant data
		assertEquals(16.0, out.firstElement().getRealDouble(), 1e-5);
		assertEquals(0.0, out.firstElement().getImaginaryDouble(), 1e-5);
	}

	@Test
	public void testFftFreq()
	{
		assertArrayEquals(new double [] {0, 0.25, -0.5, -0.25}, UpsampledDFT.fftFreq(4, 1.0), 1e-15);
		assertArrayEquals(new double [] {0, 0.1, 0.2, -0.2, -0.1}, UpsampledDFT.fftFreq(5, 2.0), 1e-15);
		assertArrayEquals(new double [] {0}, UpsampledDFT.fftFreq(1, 1.0), 0.0);
	}
}
