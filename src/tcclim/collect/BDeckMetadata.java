package tcclim.collect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Running summary of the records of one BDeck file. The values are only
 * meaningful once the whole file has been read.
 * @author aaron.cherney
 */
public class BDeckMetadata
{
	/**
	 * Maximum wind speed in knots over the lifetime of the storm
	 */
	int m_nMaxWind = 0;


	/**
	 * Times in milliseconds since Epoch the maximum wind speed was reported
	 */
	final ArrayList<Long> m_oPeakTimes = new ArrayList();


	/**
	 * Minimum reported pressure in millibars
	 */
	int m_nMinPressure = 9999;


	/**
	 * Basin code followed by the two digit storm number, for example WP01
	 */
	String m_sFullCode = "";


	/**
	 * Name of the storm when it was at its peak
	 */
	String m_sName = "";


	/**
	 * Updates the summary with the given record
	 * @param oRec the most recently read record
	 */
	void record(BDeckRecord oRec)
	{
		if (oRec.m_nWind > m_nMaxWind)
		{
			m_nMaxWind = oRec.m_nWind;
			m_oPeakTimes.clear();
			m_oPeakTimes.add(oRec.m_lTime);
			if (oRec.m_sName != null)
				m_sName = oRec.m_sName;
		}
		else if (oRec.m_nWind == m_nMaxWind)
		{
			m_oPeakTimes.add(oRec.m_lTime);
		}

		if (oRec.hasPressure() && oRec.m_nPressure > 0 && oRec.m_nPressure < m_nMinPressure) // ignore missing and bad pressures
			m_nMinPressure = oRec.m_nPressure;

		m_sFullCode = String.format("%s%02d", oRec.m_sBasin, oRec.m_nNumber);
	}


	public int getMaxWind()
	{
		return m_nMaxWind;
	}


	public List<Long> getPeakTimes()
	{
		return Collections.unmodifiableList(m_oPeakTimes);
	}


	public int getMinPressure()
	{
		return m_nMinPressure;
	}


	public String getFullCode()
	{
		return m_sFullCode;
	}


	public String getName()
	{
		return m_sName;
	}
}
