package tcclim.store;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import tcclim.collect.BDeckData;
import tcclim.collect.BDeckFile;
import tcclim.collect.ReadOptions;
import tcclim.geosrv.GeoUtil;
import tcclim.geosrv.Polygon;
import tcclim.system.Config;
import tcclim.system.MathUtil;
import tcclim.system.Text;
import tcclim.system.TimeUtil;

/**
 * The best track of one tropical cyclone. The track is a time series of
 * positions, wind speeds and optionally pressures and storm type codes, all
 * with one value per sample. A Storm never changes after it is constructed,
 * so derived values like the season and ACE are computed once on first use
 * and cached.
 * @author aaron.cherney
 */
public class Storm
{
	private static final Logger LOGGER = LogManager.getLogger(Storm.class);


	/**
	 * Storm types that count as tropical, sorted for binary searches
	 */
	private static final String[] TROPICAL_TYPES = new String[]{"HU", "ST", "TD", "TS", "TY"};


	/**
	 * ATCF basin codes of the northern hemisphere, sorted for binary searches
	 */
	private static final String[] NORTHERN_BASINS = new String[]{"AL", "CP", "EP", "IO", "WP"};


	/**
	 * Minimum wind speed in knots for a sample to contribute ACE
	 */
	public static final double ACE_MIN_WIND = 35.0;


	/**
	 * Sentinel time used when a storm has no tropical samples
	 */
	public static final long NO_TIME = Long.MIN_VALUE;


	/**
	 * Basin code and two digit number, for example WP01
	 */
	private final String m_sAtcfId;

	private final String m_sName;


	/**
	 * Sample times in milliseconds since Epoch, non-decreasing
	 */
	private final long[] m_lTimes;


	/**
	 * Modified Julian Date of each sample
	 */
	private final double[] m_dMjd;

	private final double[] m_dLon;

	private final double[] m_dLat;


	/**
	 * Maximum sustained wind of each sample in knots
	 */
	private final double[] m_dWind;


	/**
	 * Pressure of each sample in millibars, null if the track has none
	 */
	private final double[] m_dPressure;


	/**
	 * Storm type code of each sample, null if the track has none
	 */
	private final String[] m_sTypes;


	/**
	 * True if this track was selected from part of another track
	 */
	private final boolean m_bSubset;


	/**
	 * False if samples were removed from the middle of the track
	 */
	private final boolean m_bContinuous;

	private final boolean m_bInterpolated;

	private final Movement m_oMovement;

	private Integer m_oSeason;

	private SortedMap<Integer, BasinAce> m_oDailyAce;

	private Double m_oTotalAce;

	private long[] m_lTropical;


	/**
	 * Creates a Storm from the given track. The arrays are copied.
	 *
	 * @param sAtcfId basin code followed by the two digit storm number, for
	 * example WP01
	 * @param lTimes sample times in milliseconds since Epoch, non-decreasing
	 * @param dLon longitudes in decimal degrees
	 * @param dLat latitudes in decimal degrees
	 * @param dWind maximum sustained winds in knots
	 * @param dPressure pressures in millibars, can be null
	 * @param sTypes storm type codes, can be null
	 * @param sName name of the storm, can be null
	 * @throws IllegalArgumentException if the arrays are empty or their lengths
	 * differ or the times decrease
	 */
	public Storm(String sAtcfId, long[] lTimes, double[] dLon, double[] dLat, double[] dWind, double[] dPressure, String[] sTypes, String sName)
	{
		this(sAtcfId, lTimes.clone(), dLon.clone(), dLat.clone(), dWind.clone(),
		   dPressure == null ? null : dPressure.clone(), sTypes == null ? null : sTypes.clone(),
		   sName, false, true, false);
	}


	/**
	 * Takes ownership of the given arrays
	 */
	private Storm(String sAtcfId, long[] lTimes, double[] dLon, double[] dLat, double[] dWind, double[] dPressure, String[] sTypes, String sName,
	   boolean bSubset, boolean bContinuous, boolean bInterpolated)
	{
		if (sAtcfId == null || sAtcfId.length() < 3)
			throw new IllegalArgumentException(String.format("Invalid ATCF id: %s", sAtcfId));

		int nLen = lTimes.length;
		if (nLen == 0)
			throw new IllegalArgumentException("A storm needs at least one sample");
		if (dLon.length != nLen || dLat.length != nLen || dWind.length != nLen
		   || (dPressure != null && dPressure.length != nLen) || (sTypes != null && sTypes.length != nLen))
			throw new IllegalArgumentException(String.format("Sample arrays of %s differ in length", sAtcfId));
		for (int nIndex = 1; nIndex < nLen; nIndex++)
		{
			if (lTimes[nIndex] < lTimes[nIndex - 1])
				throw new IllegalArgumentException(String.format("Times of %s decrease at sample %d", sAtcfId, nIndex));
		}

		m_sAtcfId = sAtcfId;
		m_sName = sName == null || sName.isEmpty() ? null : sName;
		m_lTimes = lTimes;
		m_dLon = dLon;
		m_dLat = dLat;
		m_dWind = dWind;
		m_dPressure = dPressure;
		m_sTypes = sTypes;
		m_bSubset = bSubset;
		m_bContinuous = bContinuous;
		m_bInterpolated = bInterpolated;

		m_dMjd = new double[nLen];
		for (int nIndex = 0; nIndex < nLen; nIndex++)
			m_dMjd[nIndex] = TimeUtil.toMjd(lTimes[nIndex]);

		m_oMovement = new Movement(lTimes, dLon, dLat);
	}


	/**
	 * Creates a Storm from the records of a parsed BDeck file. The raw storm
	 * types of the records become the storm types of the track.
	 *
	 * @param oData parsed BDeck data
	 * @return the storm
	 * @throws IllegalArgumentException if the data has no records
	 */
	public static Storm fromData(BDeckData oData)
	{
		return new Storm(oData.getMetadata().getFullCode(), oData.getTimes(), oData.getLons(), oData.getLats(),
		   oData.getWinds(), oData.getPressures(), oData.getRawCategories(), oData.getMetadata().getName(),
		   false, true, false);
	}


	/**
	 * Reads every line of the given BDeck file and creates a Storm from it.
	 *
	 * @param oPath BDeck file
	 * @param oOptions read filters
	 * @return the storm
	 * @throws IOException if the file cannot be read or has no records
	 */
	public static Storm fromBDeck(Path oPath, ReadOptions oOptions)
		throws IOException
	{
		try (BDeckFile oFile = new BDeckFile(oPath))
		{
			oFile.open();
			BDeckData oData = oFile.readAll(oOptions);
			if (oData.isEmpty())
				throw new IOException(String.format("No records read from %s", oPath));

			Storm oStorm = fromData(oData);
			LOGGER.debug(String.format("Created %s with %d samples from %s", oStorm.getFullAtcfId(), oStorm.size(), oPath));
			return oStorm;
		}
	}


	/**
	 * Wrapper for {@link #fromBDeck(java.nio.file.Path, tcclim.collect.ReadOptions)}
	 * using the read options of the system configuration.
	 */
	public static Storm fromBDeck(Path oPath)
		throws IOException
	{
		return fromBDeck(oPath, ReadOptions.fromConfig(Config.getInstance()));
	}


	public String getAtcfId()
	{
		return m_sAtcfId;
	}


	/**
	 * @return two letter ATCF basin code
	 */
	public String getAtcfBasin()
	{
		return m_sAtcfId.substring(0, 2);
	}


	/**
	 * @return the storm number, -999 if it is not a number
	 */
	public int getAtcfNumber()
	{
		return Text.parseInt(m_sAtcfId.substring(2), -999);
	}


	/**
	 * @return ATCF id followed by the season, for example WP012025
	 */
	public String getFullAtcfId()
	{
		return m_sAtcfId + getSeason();
	}


	public String getName()
	{
		return m_sName;
	}


	public int size()
	{
		return m_lTimes.length;
	}


	public long getStartTime()
	{
		return m_lTimes[0];
	}


	public long getEndTime()
	{
		return m_lTimes[m_lTimes.length - 1];
	}


	/**
	 * Determines the season the storm belongs to. Storms in northern
	 * hemisphere basins belong to the calendar year. Southern hemisphere
	 * seasons run from July to June and are named by the year they end in.
	 * A storm crossing into a new year belongs to the new year only if its
	 * number is very low, meaning it was numbered after the crossover.
	 *
	 * @return season year
	 */
	public int getSeason()
	{
		if (m_oSeason == null)
			m_oSeason = computeSeason();

		return m_oSeason;
	}


	int computeSeason()
	{
		int nStartYear = TimeUtil.getYear(getStartTime());
		int nEndYear = TimeUtil.getYear(getEndTime());
		if (nStartYear == nEndYear)
		{
			if (Arrays.binarySearch(NORTHERN_BASINS, getAtcfBasin()) >= 0)
				return nStartYear;
			if (TimeUtil.getMonth(getStartTime()) >= 7)
				return nStartYear + 1;

			return nStartYear;
		}

		if (getAtcfNumber() % 60 < 3) // assumes at most 2 crossover storms per basin
			return nEndYear;

		return nStartYear;
	}


	/**
	 * Determines if the given storm type is tropical: TD, TS, TY, HU or ST
	 * @param sType storm type code
	 * @return true if the type is tropical
	 */
	public static boolean isTropical(String sType)
	{
		return sType != null && Arrays.binarySearch(TROPICAL_TYPES, sType) >= 0;
	}


	/**
	 * Determines if the given sample is tropical. Tracks without storm types
	 * are treated as tropical throughout.
	 * @param nIndex sample index
	 * @return true if the sample is tropical
	 */
	public boolean isTropical(int nIndex)
	{
		return m_sTypes == null || isTropical(m_sTypes[nIndex]);
	}


	/**
	 * @return time of the first tropical sample, {@link #NO_TIME} if there is
	 * none
	 */
	public long getStartTimeTropical()
	{
		return getTropicalInterval()[0];
	}


	/**
	 * @return time of the last tropical sample, {@link #NO_TIME} if there is
	 * none
	 */
	public long getEndTimeTropical()
	{
		return getTropicalInterval()[1];
	}


	public boolean hasTropicalInterval()
	{
		return getTropicalInterval()[0] != NO_TIME;
	}


	private long[] getTropicalInterval()
	{
		if (m_lTropical == null)
		{
			long[] lInterval = new long[]{NO_TIME, NO_TIME};
			int nLen = size();
			for (int nIndex = 0; nIndex < nLen; nIndex++)
			{
				if (isTropical(nIndex))
				{
					lInterval[0] = m_lTimes[nIndex];
					break;
				}
			}
			for (int nIndex = nLen - 1; nIndex >= 0; nIndex--)
			{
				if (isTropical(nIndex))
				{
					lInterval[1] = m_lTimes[nIndex];
					break;
				}
			}
			m_lTropical = lInterval;
		}
		return m_lTropical;
	}


	public double getMaxWind()
	{
		double dMax = m_dWind[0];
		for (double dWind : m_dWind)
			dMax = Math.max(dMax, dWind);

		return dMax;
	}


	/**
	 * Gets the basin of the given sample
	 * @param nIndex sample index
	 * @return the basin of the sample's position
	 */
	public Basin getBasin(int nIndex)
	{
		return Basin.getBasin(m_dLon[nIndex], m_dLat[nIndex]);
	}


	/**
	 * Gets the ACE of the storm grouped by the integer Modified Julian Date of
	 * the samples and then by basin. Only synoptic, tropical samples with a
	 * wind of at least 35 knots contribute, each adding wind^2 / 10^4 to the
	 * basin of its position.
	 *
	 * @return read-only map of MJD day to basin totals
	 */
	public SortedMap<Integer, BasinAce> getDailyAce()
	{
		if (m_oDailyAce == null)
			m_oDailyAce = Collections.unmodifiableSortedMap(computeDailyAce());

		return m_oDailyAce;
	}


	/**
	 * Computes the daily ACE without using the cached value.
	 * @return a new map of MJD day to basin totals
	 */
	public TreeMap<Integer, BasinAce> computeDailyAce()
	{
		TreeMap<Integer, BasinAce> oDaily = new TreeMap();
		for (int nIndex = 0; nIndex < m_lTimes.length; nIndex++)
		{
			double dWind = m_dWind[nIndex];
			if (!isTropical(nIndex) || !TimeUtil.isSynoptic(m_lTimes[nIndex]) || dWind < ACE_MIN_WIND)
				continue;

			Integer oDay = (int)Math.floor(m_dMjd[nIndex]);
			BasinAce oAce = oDaily.get(oDay);
			if (oAce == null)
			{
				oAce = new BasinAce();
				oDaily.put(oDay, oAce);
			}
			oAce.add(getBasin(nIndex), dWind * dWind / 10000);
		}
		return oDaily;
	}


	/**
	 * @return the sum of the ACE of every day and basin
	 */
	public double getTotalAce()
	{
		if (m_oTotalAce == null)
		{
			double dTotal = 0.0;
			for (BasinAce oAce : getDailyAce().values())
				dTotal += oAce.getTotal();
			m_oTotalAce = dTotal;
		}
		return m_oTotalAce;
	}


	/**
	 * @return bearing and speed of each step of the track
	 */
	public Movement getMovement()
	{
		return m_oMovement;
	}


	/**
	 * Wrapper for {@link #select(tcclim.geosrv.Polygon, double)} using the
	 * polygon buffer of the system configuration.
	 */
	public Storm select(Polygon oPoly)
	{
		return select(oPoly, Config.getInstance().getBboxTolerance());
	}


	/**
	 * Creates a new Storm from the samples inside of the given polygon
	 * buffered outward by the given tolerance. The new track is discontinuous
	 * if any samples between two selected samples were left out.
	 *
	 * @param oPoly polygon to select with
	 * @param dTol buffer in decimal degrees
	 * @return the selected track, or null if no samples are inside
	 */
	public Storm select(Polygon oPoly, double dTol)
	{
		int nLen = size();
		int[] nSelected = new int[nLen];
		int nCount = 0;
		boolean bContinuous = true;
		for (int nIndex = 0; nIndex < nLen; nIndex++)
		{
			if (!GeoUtil.isInsidePolygon(oPoly, m_dLon[nIndex], m_dLat[nIndex], dTol))
				continue;

			if (nCount > 0 && nIndex - nSelected[nCount - 1] > 1)
				bContinuous = false;
			nSelected[nCount++] = nIndex;
		}

		if (nCount == 0)
			return null;

		long[] lTimes = new long[nCount];
		double[] dLon = new double[nCount];
		double[] dLat = new double[nCount];
		double[] dWind = new double[nCount];
		double[] dPressure = m_dPressure == null ? null : new double[nCount];
		String[] sTypes = m_sTypes == null ? null : new String[nCount];
		for (int nIndex = 0; nIndex < nCount; nIndex++)
		{
			int nSrc = nSelected[nIndex];
			lTimes[nIndex] = m_lTimes[nSrc];
			dLon[nIndex] = m_dLon[nSrc];
			dLat[nIndex] = m_dLat[nSrc];
			dWind[nIndex] = m_dWind[nSrc];
			if (dPressure != null)
				dPressure[nIndex] = m_dPressure[nSrc];
			if (sTypes != null)
				sTypes[nIndex] = m_sTypes[nSrc];
		}

		return new Storm(m_sAtcfId, lTimes, dLon, dLat, dWind, dPressure, sTypes, m_sName,
		   m_bSubset || nCount < nLen, m_bContinuous && bContinuous, m_bInterpolated);
	}


	/**
	 * Resamples the track at a fixed number of hours starting at the first
	 * sample. Positions, winds and pressures are linearly interpolated, storm
	 * types take the value of the nearest sample.
	 *
	 * @param nHours interval between the new samples in hours
	 * @return the interpolated track
	 * @throws IllegalStateException if the track is not continuous
	 * @throws IllegalArgumentException if the interval is not positive
	 */
	public Storm interpolate(int nHours)
	{
		if (!m_bContinuous)
			throw new IllegalStateException(String.format("Cannot interpolate %s, the track is not continuous", m_sAtcfId));
		if (nHours <= 0)
			throw new IllegalArgumentException(String.format("Interpolation interval must be positive: %d", nHours));

		long lStep = nHours * TimeUtil.HOUR;
		int nCount = (int)((getEndTime() - getStartTime()) / lStep) + 1;
		long[] lTimes = new long[nCount];
		double[] dLon = new double[nCount];
		double[] dLat = new double[nCount];
		double[] dWind = new double[nCount];
		double[] dPressure = m_dPressure == null ? null : new double[nCount];
		String[] sTypes = m_sTypes == null ? null : new String[nCount];

		double[] dUnwrapped = unwrapLongitudes(m_dLon);
		double dMinLon = Double.MAX_VALUE;
		for (double dVal : m_dLon)
			dMinLon = Math.min(dMinLon, dVal);
		boolean bWestNegative = dMinLon < 0;

		for (int nIndex = 0; nIndex < nCount; nIndex++)
		{
			long lTime = getStartTime() + nIndex * lStep;
			double dMjd = TimeUtil.toMjd(lTime);
			lTimes[nIndex] = lTime;
			double dX = GeoUtil.to360(MathUtil.interpolate(m_dMjd, dUnwrapped, dMjd));
			if (bWestNegative && dX > 180)
				dX -= 360;
			dLon[nIndex] = dX;
			dLat[nIndex] = MathUtil.interpolate(m_dMjd, m_dLat, dMjd);
			dWind[nIndex] = MathUtil.interpolate(m_dMjd, m_dWind, dMjd);
			if (dPressure != null)
				dPressure[nIndex] = MathUtil.interpolate(m_dMjd, m_dPressure, dMjd);
			if (sTypes != null)
				sTypes[nIndex] = m_sTypes[MathUtil.nearest(m_dMjd, dMjd)];
		}

		return new Storm(m_sAtcfId, lTimes, dLon, dLat, dWind, dPressure, sTypes, m_sName,
		   m_bSubset, true, true);
	}


	/**
	 * Removes jumps of more than 180 degrees between consecutive longitudes
	 * so tracks crossing the antimeridian or the prime meridian interpolate
	 * along the short way. Interpolated values are wrapped back to west
	 * negative longitudes if any sample is negative, otherwise to [0, 360).
	 */
	static double[] unwrapLongitudes(double[] dLon)
	{
		double[] dOut = new double[dLon.length];
		double dOffset = 0.0;
		for (int nIndex = 0; nIndex < dLon.length; nIndex++)
		{
			if (nIndex > 0)
			{
				double dDiff = dLon[nIndex] - dLon[nIndex - 1];
				if (dDiff > 180)
					dOffset -= 360;
				else if (dDiff < -180)
					dOffset += 360;
			}
			dOut[nIndex] = dLon[nIndex] + dOffset;
		}
		return dOut;
	}


	public long[] getTimes()
	{
		return m_lTimes.clone();
	}


	public double[] getLons()
	{
		return m_dLon.clone();
	}


	public double[] getLats()
	{
		return m_dLat.clone();
	}


	public double[] getWinds()
	{
		return m_dWind.clone();
	}


	/**
	 * @return pressures in millibars, null if the track has none
	 */
	public double[] getPressures()
	{
		return m_dPressure == null ? null : m_dPressure.clone();
	}


	/**
	 * @return storm type codes, null if the track has none
	 */
	public String[] getTypes()
	{
		return m_sTypes == null ? null : m_sTypes.clone();
	}


	public boolean isSubset()
	{
		return m_bSubset;
	}


	public boolean isContinuous()
	{
		return m_bContinuous;
	}


	public boolean isInterpolated()
	{
		return m_bInterpolated;
	}


	@Override
	public String toString()
	{
		return String.format("%s %s %s to %s", getFullAtcfId(), m_sName == null ? "" : m_sName,
		   TimeUtil.format(getStartTime()), TimeUtil.format(getEndTime()));
	}
}
