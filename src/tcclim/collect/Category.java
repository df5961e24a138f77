package tcclim.collect;

/**
 * Intensity classes determined from the maximum sustained wind speed using
 * Saffir–Simpson hurricane wind scale thresholds. Each constant stores the
 * wind speed in knots that must be exceeded to reach the class.
 * @author aaron.cherney
 */
public enum Category
{
	TD(Integer.MIN_VALUE),
	TS(34),
	C1(64),
	C2(83),
	C3(96),
	C4(114),
	C5(137);


	/**
	 * Wind speed in knots the class starts above
	 */
	private final int m_nThreshold;


	Category(int nThreshold)
	{
		m_nThreshold = nThreshold;
	}


	/**
	 * Determines the class of the given wind speed
	 * @param nWind maximum sustained wind in knots
	 * @return the highest class whose threshold the wind exceeds
	 */
	public static Category fromWind(int nWind)
	{
		Category[] oCats = values();
		int nIndex = oCats.length;
		while (nIndex-- > 1)
		{
			if (nWind > oCats[nIndex].m_nThreshold)
				return oCats[nIndex];
		}
		return TD;
	}
}
