package tcclim.collect;

import tcclim.system.TimeUtil;

/**
 * One time-stamped best track observation read from a BDeck file. Fields only
 * present in the long format are left null or {@link #MISSING} for records
 * read from short format lines.
 * @author aaron.cherney
 */
public class BDeckRecord implements Comparable<BDeckRecord>
{
	/**
	 * Value substituted for integer fields that cannot be parsed
	 */
	public static final int BAD_VALUE = -999;


	/**
	 * Value of integer fields that are not present in the line
	 */
	public static final int MISSING = Integer.MIN_VALUE;


	/**
	 * True if the line had more than 20 fields
	 */
	public boolean m_bLongFormat;


	/**
	 * Two letter basin code, for example WP
	 */
	public String m_sBasin;


	/**
	 * Storm number assigned by the agency
	 */
	public int m_nNumber;


	/**
	 * Time of the observation in milliseconds since Epoch
	 */
	public long m_lTime;


	/**
	 * Timestamp as it appears in the file, yyyyMMddHH
	 */
	public String m_sTime;

	public String m_sTechNum;

	public String m_sTechCode;

	public int m_nTau;


	/**
	 * Latitude in decimal degrees, south is negative
	 */
	public double m_dLat;


	/**
	 * Longitude in decimal degrees, west is negative
	 */
	public double m_dLon;


	/**
	 * Maximum sustained wind in knots
	 */
	public int m_nWind;


	/**
	 * Minimum sea level pressure in millibars, {@link #MISSING} if the line
	 * has no pressure field
	 */
	public int m_nPressure = MISSING;


	/**
	 * Storm type code as it appears in the file, null if the line has none
	 */
	public String m_sRawCategory;


	/**
	 * Best category, see {@link BDeckParser#getCategory(int, java.lang.String)}
	 */
	public String m_sCategory;


	/**
	 * Radii in nautical miles of 34, 50 and 64 knot winds in the order NE,
	 * SE, SW, NW. Null when not reported.
	 */
	public int[] m_nR34;

	public int[] m_nR50;

	public int[] m_nR64;


	/**
	 * Pressure of the last closed isobar in millibars
	 */
	public int m_nLci = MISSING;


	/**
	 * Radius of the last closed isobar in nautical miles
	 */
	public int m_nLciRadius = MISSING;


	/**
	 * Radius of maximum winds in nautical miles
	 */
	public int m_nRmw = MISSING;

	public String m_sName;

	public String m_sDepth;


	public boolean hasPressure()
	{
		return m_nPressure != MISSING;
	}


	/**
	 * Compares records by time
	 */
	@Override
	public int compareTo(BDeckRecord o)
	{
		return Long.compare(m_lTime, o.m_lTime);
	}


	@Override
	public String toString()
	{
		return String.format("%s%02d %s %.1f %.1f %dkt %s", m_sBasin, m_nNumber, TimeUtil.format(m_lTime), m_dLat, m_dLon, m_nWind, m_sCategory);
	}
}
