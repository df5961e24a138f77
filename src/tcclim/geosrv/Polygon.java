package tcclim.geosrv;

import java.util.Arrays;

/**
 * A simple polygon in decimal degrees used to select track points. The ring
 * is stored open, the last point connects back to the first. Coordinates use
 * the same longitude convention as the tracks they are tested against.
 * @author aaron.cherney
 */
public class Polygon
{
	/**
	 * Maximum latitude of the polygon
	 */
	public final double m_dTop;

	/**
	 * Minimum latitude of the polygon
	 */
	public final double m_dBot;

	/**
	 * Maximum longitude of the polygon
	 */
	public final double m_dRight;

	/**
	 * Minimum longitude of the polygon
	 */
	public final double m_dLeft;

	/**
	 * Points of the ring in the format [x0, y0, x1, y1, ... xn, yn]
	 */
	final double[] m_dPoints;


	/**
	 * Creates a polygon from the given lon/lat pairs. A closing point equal to
	 * the first point is dropped.
	 *
	 * @param dPoints ring in the format [x0, y0, x1, y1, ... xn, yn]
	 * @throws IllegalArgumentException if fewer than 3 points are given
	 */
	public Polygon(double... dPoints)
	{
		int nLen = dPoints.length;
		if (nLen % 2 != 0)
			throw new IllegalArgumentException("Polygon coordinates must be lon/lat pairs");
		if (nLen >= 8 && dPoints[0] == dPoints[nLen - 2] && dPoints[1] == dPoints[nLen - 1]) // ensure the polygon is open
			nLen -= 2;
		if (nLen < 6)
			throw new IllegalArgumentException("Polygon needs at least 3 points");

		m_dPoints = Arrays.copyOf(dPoints, nLen);
		double dLeft = Double.MAX_VALUE;
		double dBot = Double.MAX_VALUE;
		double dRight = -Double.MAX_VALUE;
		double dTop = -Double.MAX_VALUE;
		for (int nIndex = 0; nIndex < nLen; nIndex += 2)
		{
			dLeft = Math.min(dLeft, m_dPoints[nIndex]);
			dRight = Math.max(dRight, m_dPoints[nIndex]);
			dBot = Math.min(dBot, m_dPoints[nIndex + 1]);
			dTop = Math.max(dTop, m_dPoints[nIndex + 1]);
		}
		m_dLeft = dLeft;
		m_dBot = dBot;
		m_dRight = dRight;
		m_dTop = dTop;
	}


	/**
	 * Creates an axis aligned rectangle
	 * @param dLeft minimum longitude
	 * @param dBot minimum latitude
	 * @param dRight maximum longitude
	 * @param dTop maximum latitude
	 * @return rectangular polygon
	 */
	public static Polygon box(double dLeft, double dBot, double dRight, double dTop)
	{
		return new Polygon(dLeft, dBot, dRight, dBot, dRight, dTop, dLeft, dTop);
	}


	/**
	 * @return the number of points in the ring
	 */
	public int size()
	{
		return m_dPoints.length / 2;
	}
}
