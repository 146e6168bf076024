package registrationND;

import net.imglib2.type.numeric.ComplexType;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexFloatType;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Floating point precision of the working (complex) arrays.
 *
 * The precision of a registration is the wider of the precisions
 * of its two inputs, but never less than single.
 *
 * @author Eugene Katrukha
 */
public enum Precision
{
	FLOAT
	{
		@Override
		public double eps()
		{
			return Math.ulp(1.0f);
		}

		@Override
		public double round(final double value)
		{
			return (float) value;
		}
	},
	DOUBLE
	{
		@Override
		public double eps()
		{
			return Math.ulp(1.0);
		}

		@Override
		public double round(final double value)
		{
			return value;
		}
	};

	/** machine epsilon **/
	public abstract double eps();

	/** rounds value to the precision **/
	public abstract double round(final double value);

	/** precision needed to hold values of the provided type **/
	public static Precision of(final ComplexType< ? > type)
	{
		if(type instanceof ComplexFloatType || type instanceof FloatType)
		{
			return FLOAT;
		}
		if(type instanceof IntegerType)
		{
			//float mantissa holds 8 and 16 bit integers exactly
			return ((RealType< ? >) type).getBitsPerPixel() <= 16 ? FLOAT : DOUBLE;
		}
		if(type instanceof RealType)
		{
			return ((RealType< ? >) type).getBitsPerPixel() <= 32 ? FLOAT : DOUBLE;
		}
		return DOUBLE;
	}

	/** wider of the two precisions **/
	public static Precision promote(final Precision p1, final Precision p2)
	{
		return (p1 == DOUBLE || p2 == DOUBLE) ? DOUBLE : FLOAT;
	}

}
