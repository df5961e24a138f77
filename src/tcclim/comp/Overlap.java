package tcclim.comp;

import java.util.Collections;
import java.util.List;
import tcclim.system.TimeUtil;

/**
 * A span of time during which two or more storms were active at once.
 * @author aaron.cherney
 */
public class Overlap
{
	/**
	 * Start of the span in milliseconds since Epoch
	 */
	public final long m_lStart;

	/**
	 * End of the span in milliseconds since Epoch
	 */
	public final long m_lEnd;

	private final List<String> m_oIds;


	Overlap(long lStart, long lEnd, List<String> oIds)
	{
		m_lStart = lStart;
		m_lEnd = lEnd;
		m_oIds = Collections.unmodifiableList(oIds);
	}


	/**
	 * @return identifiers of the storms active during the span in the order
	 * the storms were given
	 */
	public List<String> getIds()
	{
		return m_oIds;
	}


	@Override
	public String toString()
	{
		return String.format("%s to %s %s", TimeUtil.format(m_lStart), TimeUtil.format(m_lEnd), m_oIds);
	}
}
