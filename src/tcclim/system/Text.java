package tcclim.system;

/**
 * Fail-soft parsing helpers for text fields.
 * @author aaron.cherney
 */
public abstract class Text
{
	private Text()
	{
	}


	/**
	 * Parses the given characters as a base 10 integer, ignoring surrounding
	 * whitespace.
	 *
	 * @param sVal characters to parse, can be null
	 * @param nDefault value returned when the characters are not an integer
	 * @return the parsed integer or the default value
	 */
	public static int parseInt(CharSequence sVal, int nDefault)
	{
		if (sVal == null)
			return nDefault;

		try
		{
			return Integer.parseInt(sVal.toString().trim());
		}
		catch (NumberFormatException oEx) // malformed numbers degrade to the default
		{
			return nDefault;
		}
	}
}
