package registrationND;

/** thrown only in strict amplitude mode, when the product of normalized
 * intensities of reference and moving images is zero **/
public class DegenerateRegistrationException extends ArithmeticException
{
	private static final long serialVersionUID = 1L;

	public DegenerateRegistrationException(final String message)
	{
		super(message);
	}
}
