package registrationND;

/** thrown when arrays (or per-dimension parameters) do not match
 * the dimensionality/shape they are used with **/
public class ShapeMismatchException extends IllegalArgumentException
{
	private static final long serialVersionUID = 1L;

	public ShapeMismatchException(final String message)
	{
		super(message);
	}
}
