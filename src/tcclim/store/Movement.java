package tcclim.store;

import tcclim.geosrv.GeoUtil;
import tcclim.system.TimeUtil;

/**
 * Bearing and speed of each step between consecutive track points. There is
 * one step fewer than there are track points.
 * @author aaron.cherney
 */
public class Movement
{
	/**
	 * Initial great circle bearing of each step in degrees clockwise from north
	 */
	private final double[] m_dBearings;


	/**
	 * Speed of each step in knots
	 */
	private final double[] m_dSpeeds;


	/**
	 * Computes the movement of the given track
	 * @param lTimes times in milliseconds since Epoch
	 * @param dLon longitudes in decimal degrees
	 * @param dLat latitudes in decimal degrees
	 */
	Movement(long[] lTimes, double[] dLon, double[] dLat)
	{
		int nSteps = Math.max(lTimes.length - 1, 0);
		m_dBearings = new double[nSteps];
		m_dSpeeds = new double[nSteps];
		for (int nIndex = 0; nIndex < nSteps; nIndex++)
		{
			double dLat1 = dLat[nIndex];
			double dLon1 = dLon[nIndex];
			double dLat2 = dLat[nIndex + 1];
			double dLon2 = dLon[nIndex + 1];
			m_dBearings[nIndex] = GeoUtil.bearing(dLat1, dLon1, dLat2, dLon2);
			double dHours = (lTimes[nIndex + 1] - lTimes[nIndex]) / (double)TimeUtil.HOUR;
			if (dHours > 0)
				m_dSpeeds[nIndex] = GeoUtil.distanceFromLatLon(dLat1, dLon1, dLat2, dLon2) / GeoUtil.KM_PER_NM / dHours;
		}
	}


	public double[] getBearings()
	{
		return m_dBearings.clone();
	}


	public double[] getSpeeds()
	{
		return m_dSpeeds.clone();
	}


	public double getBearing(int nStep)
	{
		return m_dBearings[nStep];
	}


	public double getSpeed(int nStep)
	{
		return m_dSpeeds[nStep];
	}


	public int size()
	{
		return m_dSpeeds.length;
	}
}
