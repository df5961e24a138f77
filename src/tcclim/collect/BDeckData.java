package tcclim.collect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The records of one BDeck file in file order along with the summary
 * metadata. Column accessors return new arrays with one value per record.
 * @author aaron.cherney
 */
public class BDeckData
{
	private final ArrayList<BDeckRecord> m_oRecords = new ArrayList();

	private final BDeckMetadata m_oMetadata = new BDeckMetadata();


	void add(BDeckRecord oRec)
	{
		m_oRecords.add(oRec);
		m_oMetadata.record(oRec);
	}


	public List<BDeckRecord> getRecords()
	{
		return Collections.unmodifiableList(m_oRecords);
	}


	public BDeckMetadata getMetadata()
	{
		return m_oMetadata;
	}


	public int size()
	{
		return m_oRecords.size();
	}


	public boolean isEmpty()
	{
		return m_oRecords.isEmpty();
	}


	public long[] getTimes()
	{
		long[] lTimes = new long[m_oRecords.size()];
		for (int nIndex = 0; nIndex < lTimes.length; nIndex++)
			lTimes[nIndex] = m_oRecords.get(nIndex).m_lTime;

		return lTimes;
	}


	public double[] getLons()
	{
		double[] dLons = new double[m_oRecords.size()];
		for (int nIndex = 0; nIndex < dLons.length; nIndex++)
			dLons[nIndex] = m_oRecords.get(nIndex).m_dLon;

		return dLons;
	}


	public double[] getLats()
	{
		double[] dLats = new double[m_oRecords.size()];
		for (int nIndex = 0; nIndex < dLats.length; nIndex++)
			dLats[nIndex] = m_oRecords.get(nIndex).m_dLat;

		return dLats;
	}


	public double[] getWinds()
	{
		double[] dWinds = new double[m_oRecords.size()];
		for (int nIndex = 0; nIndex < dWinds.length; nIndex++)
			dWinds[nIndex] = m_oRecords.get(nIndex).m_nWind;

		return dWinds;
	}


	/**
	 * Gets the pressure of each record. Records without a pressure field are
	 * {@code Double.NaN}.
	 * @return pressures in millibars, null if no record has a pressure
	 */
	public double[] getPressures()
	{
		double[] dPres = new double[m_oRecords.size()];
		boolean bAny = false;
		for (int nIndex = 0; nIndex < dPres.length; nIndex++)
		{
			BDeckRecord oRec = m_oRecords.get(nIndex);
			if (oRec.hasPressure())
			{
				dPres[nIndex] = oRec.m_nPressure;
				bAny = true;
			}
			else
				dPres[nIndex] = Double.NaN;
		}
		return bAny ? dPres : null;
	}


	/**
	 * Gets the raw storm type code of each record. Records without one are
	 * empty Strings.
	 * @return storm type codes, null if no record has one
	 */
	public String[] getRawCategories()
	{
		String[] sCats = new String[m_oRecords.size()];
		boolean bAny = false;
		for (int nIndex = 0; nIndex < sCats.length; nIndex++)
		{
			String sCat = m_oRecords.get(nIndex).m_sRawCategory;
			if (sCat != null && !sCat.isEmpty())
			{
				sCats[nIndex] = sCat;
				bAny = true;
			}
			else
				sCats[nIndex] = "";
		}
		return bAny ? sCats : null;
	}


	public String[] getCategories()
	{
		String[] sCats = new String[m_oRecords.size()];
		for (int nIndex = 0; nIndex < sCats.length; nIndex++)
			sCats[nIndex] = m_oRecords.get(nIndex).m_sCategory;

		return sCats;
	}
}
