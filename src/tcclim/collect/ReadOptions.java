package tcclim.collect;

import tcclim.system.Config;

/**
 * Filters applied while reading a BDeck file.
 * @author aaron.cherney
 */
public class ReadOptions
{
	/**
	 * Reads every line, the defaults used when building storms
	 */
	public static final ReadOptions ALL = new ReadOptions(false, false);


	/**
	 * Only keep records at 00, 06, 12 and 18 UTC
	 */
	public final boolean m_bFormalAdvisoryOnly;


	/**
	 * Drop subtropical and extratropical records (long format only)
	 */
	public final boolean m_bTropicalNatureOnly;


	public ReadOptions(boolean bFormalAdvisoryOnly, boolean bTropicalNatureOnly)
	{
		m_bFormalAdvisoryOnly = bFormalAdvisoryOnly;
		m_bTropicalNatureOnly = bTropicalNatureOnly;
	}


	/**
	 * Creates the read options defined in the given configuration
	 * @param oConfig configuration to read "formaladvisory" and "tropicalnature" from
	 * @return configured options, both default to false
	 */
	public static ReadOptions fromConfig(Config oConfig)
	{
		return new ReadOptions(oConfig.optBoolean(Config.FORMAL_ADVISORY, false),
		   oConfig.optBoolean(Config.TROPICAL_NATURE, false));
	}


	@Override
	public String toString()
	{
		return String.format("formaladvisory=%b tropicalnature=%b", m_bFormalAdvisoryOnly, m_bTropicalNatureOnly);
	}
}
