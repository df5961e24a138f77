package tcclim.comp;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import tcclim.collect.ReadOptions;
import tcclim.store.Basin;
import tcclim.store.BasinAce;
import tcclim.store.Storm;
import tcclim.system.Config;
import tcclim.system.MathUtil;
import tcclim.system.TimeUtil;

/**
 * A collection of storms grouped by season. Storms are indexed by their
 * season and by their full ATCF id. The dataset holds references to the
 * storms it is given and never modifies them.
 * @author aaron.cherney
 */
public class SeasonDataset
{
	private static final Logger LOGGER = LogManager.getLogger(SeasonDataset.class);


	/**
	 * Day of year index of February 29th in a leap year
	 */
	private static final int FEB_29 = 59;

	private final TreeMap<Integer, ArrayList<Storm>> m_oSeasons = new TreeMap();

	private final HashMap<String, Storm> m_oStorms = new HashMap();


	/**
	 * Groups the given storms by season
	 * @param oStorms storms to include in the dataset
	 */
	public SeasonDataset(Collection<Storm> oStorms)
	{
		for (Storm oStorm : oStorms)
		{
			Integer oSeason = oStorm.getSeason();
			ArrayList<Storm> oList = m_oSeasons.get(oSeason);
			if (oList == null)
			{
				oList = new ArrayList();
				m_oSeasons.put(oSeason, oList);
			}
			oList.add(oStorm);
			if (m_oStorms.put(oStorm.getFullAtcfId(), oStorm) != null)
				LOGGER.warn(String.format("Duplicate storm %s replaced", oStorm.getFullAtcfId()));
		}
	}


	/**
	 * Reads one storm from each of the given BDeck files.
	 *
	 * @param oFiles BDeck files
	 * @param oOptions read filters
	 * @return the dataset
	 * @throws IOException if any file cannot be read
	 */
	public static SeasonDataset fromBDeck(List<Path> oFiles, ReadOptions oOptions)
		throws IOException
	{
		ArrayList<Storm> oStorms = new ArrayList(oFiles.size());
		for (Path oFile : oFiles)
		{
			try
			{
				oStorms.add(Storm.fromBDeck(oFile, oOptions));
			}
			catch (IOException oEx)
			{
				LOGGER.error(String.format("Failed to read %s", oFile), oEx);
				throw oEx;
			}
		}
		SeasonDataset oDataset = new SeasonDataset(oStorms);
		LOGGER.info(String.format("Loaded %d storms in %d seasons with %s", oStorms.size(), oDataset.m_oSeasons.size(), oOptions));
		return oDataset;
	}


	/**
	 * Wrapper for {@link #fromBDeck(java.util.List, tcclim.collect.ReadOptions)}
	 * using the read options of the system configuration.
	 */
	public static SeasonDataset fromBDeck(List<Path> oFiles)
		throws IOException
	{
		return fromBDeck(oFiles, ReadOptions.fromConfig(Config.getInstance()));
	}


	/**
	 * Computes the ACE of each day of the given calendar year. Storms of the
	 * previous and next seasons are included so storms crossing the year
	 * boundary contribute to the days they were active in this year.
	 *
	 * @param nYear calendar year
	 * @param bPushLeapDay if true and the year is a leap year, the energy of
	 * February 29th and March 1st is combined in the slot of February 29th and
	 * the extra slot removed so every year has 365 days
	 * @param oBasin basin to sum, null for all basins
	 * @return ACE of each day of the year, starting with January 1st
	 * @throws IllegalArgumentException if the dataset has none of the year and
	 * its neighboring seasons
	 */
	public double[] getDailyAce(int nYear, boolean bPushLeapDay, Basin oBasin)
	{
		if (!m_oSeasons.containsKey(nYear - 1) && !m_oSeasons.containsKey(nYear) && !m_oSeasons.containsKey(nYear + 1))
			throw new IllegalArgumentException(String.format("Year %d not in dataset", nYear));

		boolean bLeap = TimeUtil.isLeapYear(nYear);
		double[] dAce = new double[bLeap ? 366 : 365];
		int nJan1 = TimeUtil.toMjdDay(TimeUtil.toMillis(nYear, 1, 1, 0));
		for (int nSeason = nYear - 1; nSeason <= nYear + 1; nSeason++)
		{
			ArrayList<Storm> oList = m_oSeasons.get(nSeason);
			if (oList == null)
				continue;

			for (Storm oStorm : oList)
			{
				for (Map.Entry<Integer, BasinAce> oEntry : oStorm.getDailyAce().entrySet())
				{
					int nDay = oEntry.getKey() - nJan1;
					if (nDay < 0 || nDay >= dAce.length)
						continue;

					BasinAce oAce = oEntry.getValue();
					dAce[nDay] += oBasin == null ? oAce.getTotal() : oAce.get(oBasin);
				}
			}
		}

		if (bPushLeapDay && bLeap)
		{
			double[] dFolded = new double[365];
			System.arraycopy(dAce, 0, dFolded, 0, FEB_29 + 1);
			dFolded[FEB_29] += dAce[FEB_29 + 1];
			System.arraycopy(dAce, FEB_29 + 2, dFolded, FEB_29 + 1, 365 - FEB_29 - 1);
			dAce = dFolded;
		}
		return dAce;
	}


	/**
	 * Computes the running total of {@link #getDailyAce(int, boolean, tcclim.store.Basin)}
	 */
	public double[] getCumulativeAce(int nYear, boolean bPushLeapDay, Basin oBasin)
	{
		return MathUtil.cumulativeSum(getDailyAce(nYear, bPushLeapDay, oBasin));
	}


	/**
	 * Finds the spans of time where storms of the given season were active at
	 * the same time.
	 *
	 * @param nSeason season year
	 * @param bTropical if true the tropical part of each storm is used and
	 * storms that were never tropical are left out, otherwise the whole track
	 * @param oBasin only storms numbered in this basin are used, null for all
	 * @return overlap spans ordered by time
	 * @throws IllegalArgumentException if the dataset has no storms for the
	 * season
	 */
	public List<Overlap> getOverlappingStorms(int nSeason, boolean bTropical, Basin oBasin)
	{
		ArrayList<Storm> oList = m_oSeasons.get(nSeason);
		if (oList == null)
			throw new IllegalArgumentException(String.format("Season %d not in dataset", nSeason));

		ArrayList<Storm> oValid = new ArrayList(oList.size());
		for (Storm oStorm : oList)
		{
			if (oBasin != null && Basin.fromAtcf(oStorm.getAtcfBasin()) != oBasin)
				continue;
			if (bTropical && !oStorm.hasTropicalInterval())
				continue;
			oValid.add(oStorm);
		}

		int nCount = oValid.size();
		long[] lStarts = new long[nCount];
		long[] lEnds = new long[nCount];
		String[] sIds = new String[nCount];
		for (int nIndex = 0; nIndex < nCount; nIndex++)
		{
			Storm oStorm = oValid.get(nIndex);
			lStarts[nIndex] = bTropical ? oStorm.getStartTimeTropical() : oStorm.getStartTime();
			lEnds[nIndex] = bTropical ? oStorm.getEndTimeTropical() : oStorm.getEndTime();
			sIds[nIndex] = oStorm.getFullAtcfId();
		}
		ArrayList<Overlap> oOverlaps = Overlaps.find(lStarts, lEnds, sIds);
		LOGGER.debug(String.format("Found %d overlaps among %d storms of season %d", oOverlaps.size(), nCount, nSeason));
		return oOverlaps;
	}


	/**
	 * @param sFullAtcfId ATCF id followed by the season, for example WP012025
	 * @return the storm, or null if it is not in the dataset
	 */
	public Storm getStorm(String sFullAtcfId)
	{
		return m_oStorms.get(sFullAtcfId);
	}


	public Set<Integer> getSeasons()
	{
		return Collections.unmodifiableSet(m_oSeasons.keySet());
	}


	/**
	 * @param nSeason season year
	 * @return storms of the season in the order they were given, empty if
	 * there are none
	 */
	public List<Storm> getStorms(int nSeason)
	{
		ArrayList<Storm> oList = m_oSeasons.get(nSeason);
		if (oList == null)
			return Collections.emptyList();

		return Collections.unmodifiableList(oList);
	}


	public int size()
	{
		return m_oStorms.size();
	}
}
