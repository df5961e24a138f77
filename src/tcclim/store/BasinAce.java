package tcclim.store;

import java.util.Arrays;

/**
 * Accumulated Cyclone Energy totals for each basin, in units of 10^4 kt^2.
 * @author aaron.cherney
 */
public class BasinAce
{
	private final double[] m_dAce = new double[Basin.values().length];


	/**
	 * Adds energy to the total of the given basin
	 * @param oBasin basin to add to
	 * @param dAce energy to add
	 */
	void add(Basin oBasin, double dAce)
	{
		m_dAce[oBasin.ordinal()] += dAce;
	}


	public double get(Basin oBasin)
	{
		return m_dAce[oBasin.ordinal()];
	}


	public double getWpac()
	{
		return get(Basin.WPAC);
	}


	public double getEpac()
	{
		return get(Basin.EPAC);
	}


	public double getNio()
	{
		return get(Basin.NIO);
	}


	public double getShem()
	{
		return get(Basin.SHEM);
	}


	public double getAtl()
	{
		return get(Basin.ATL);
	}


	/**
	 * @return the sum of all of the basins
	 */
	public double getTotal()
	{
		double dTotal = 0.0;
		for (double dAce : m_dAce)
			dTotal += dAce;

		return dTotal;
	}


	@Override
	public boolean equals(Object oObj)
	{
		if (!(oObj instanceof BasinAce))
			return false;

		return Arrays.equals(m_dAce, ((BasinAce)oObj).m_dAce);
	}


	@Override
	public int hashCode()
	{
		return Arrays.hashCode(m_dAce);
	}


	@Override
	public String toString()
	{
		return String.format("wpac=%.4f epac=%.4f nio=%.4f shem=%.4f atl=%.4f", getWpac(), getEpac(), getNio(), getShem(), getAtl());
	}
}
