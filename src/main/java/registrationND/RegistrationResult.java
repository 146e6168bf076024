package registrationND;

import java.util.Arrays;

/** result of translation registration: shift (in pixels, one value per dimension),
 * normalized RMS error and global phase difference **/
public final class RegistrationResult
{
	private final double [] shift;

	private final double error;

	private final double phaseDiff;

	private final Precision precision;

	public RegistrationResult(final double [] shift, final double error, final double phaseDiff, final Precision precision)
	{
		this.shift = shift.clone();
		this.error = error;
		this.phaseDiff = phaseDiff;
		this.precision = precision;
	}

	/** shift required to register moving image with the reference,
	 * axes order is the same as in the input images **/
	public double [] getShift()
	{
		return shift.clone();
	}

	public double getShift(final int d)
	{
		return shift[d];
	}

	public int numDimensions()
	{
		return shift.length;
	}

	/** translation invariant normalized RMS error, NaN if one of images is empty **/
	public double getError()
	{
		return error;
	}

	/** global phase difference between images in (-pi, pi],
	 * should be zero if images are non-negative **/
	public double getPhaseDiff()
	{
		return phaseDiff;
	}

	public Precision getPrecision()
	{
		return precision;
	}

	@Override
	public String toString()
	{
		return "shift " + Arrays.toString(shift) + ", error " + error + ", phase difference " + phaseDiff;
	}
}
