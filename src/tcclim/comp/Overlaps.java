package tcclim.comp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.TreeSet;

/**
 * Finds the spans of time where intervals overlap by sweeping over the sorted
 * interval boundaries.
 * @author aaron.cherney
 */
public abstract class Overlaps
{
	private Overlaps()
	{
	}


	/**
	 * Finds every span where at least two of the given intervals are active.
	 * Each time the sweep advances while two or more intervals are active, the
	 * span since the previous boundary is emitted. Intervals that only touch
	 * count as overlapping at that instant but produce no span.
	 *
	 * @param lStarts interval start times
	 * @param lEnds interval end times
	 * @param sIds identifier of each interval
	 * @return overlap spans ordered by time, empty if no intervals overlap
	 */
	public static ArrayList<Overlap> find(long[] lStarts, long[] lEnds, String[] sIds)
	{
		if (lStarts.length != lEnds.length || lStarts.length != sIds.length)
			throw new IllegalArgumentException("Interval arrays differ in length");

		ArrayList<Event> oEvents = new ArrayList(lStarts.length * 2);
		for (int nIndex = 0; nIndex < lStarts.length; nIndex++)
		{
			oEvents.add(new Event(lStarts[nIndex], true, nIndex));
			oEvents.add(new Event(lEnds[nIndex], false, nIndex));
		}
		Collections.sort(oEvents);

		ArrayList<Overlap> oOverlaps = new ArrayList();
		TreeSet<Integer> oActive = new TreeSet();
		boolean bFirst = true;
		long lPrev = 0;
		for (Event oEvent : oEvents)
		{
			if (!bFirst && oEvent.m_lTime > lPrev && oActive.size() >= 2)
			{
				ArrayList<String> oIds = new ArrayList(oActive.size());
				for (Integer oIndex : oActive)
					oIds.add(sIds[oIndex]);
				oOverlaps.add(new Overlap(lPrev, oEvent.m_lTime, oIds));
			}

			if (oEvent.m_bStart)
				oActive.add(oEvent.m_nIndex);
			else
				oActive.remove(oEvent.m_nIndex);

			lPrev = oEvent.m_lTime;
			bFirst = false;
		}
		return oOverlaps;
	}


	private static class Event implements Comparable<Event>
	{
		final long m_lTime;

		final boolean m_bStart;

		final int m_nIndex;


		Event(long lTime, boolean bStart, int nIndex)
		{
			m_lTime = lTime;
			m_bStart = bStart;
			m_nIndex = nIndex;
		}


		/**
		 * Orders by time with starts before ends at the same time
		 */
		@Override
		public int compareTo(Event oRhs)
		{
			int nReturn = Long.compare(m_lTime, oRhs.m_lTime);
			if (nReturn == 0)
				nReturn = Boolean.compare(oRhs.m_bStart, m_bStart);
			if (nReturn == 0)
				nReturn = Integer.compare(m_nIndex, oRhs.m_nIndex);

			return nReturn;
		}
	}
}
