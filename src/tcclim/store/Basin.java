package tcclim.store;

import tcclim.geosrv.GeoUtil;

/**
 * Ocean basins ACE is accumulated in.
 * @author aaron.cherney
 */
public enum Basin
{
	WPAC,
	EPAC,
	NIO,
	SHEM,
	ATL;


	/**
	 * Determines the basin of the given position. Anything south of the
	 * equator is the southern hemisphere. Longitudes are normalized to
	 * [0, 360) first so west negative positions are handled. The boundary
	 * between the eastern Pacific and the Atlantic from 240 to 300 degrees is
	 * approximated as eastern Pacific.
	 *
	 * @param dLon longitude in decimal degrees
	 * @param dLat latitude in decimal degrees
	 * @return the basin of the position
	 */
	public static Basin getBasin(double dLon, double dLat)
	{
		if (dLat < 0)
			return SHEM;

		double dX = GeoUtil.to360(dLon);
		if (dX < 100)
		{
			if (dLat < 40)
				return NIO;

			return dX < 70 ? ATL : WPAC;
		}
		if (dX < 180)
			return WPAC;
		if (dX < 240)
			return EPAC;
		if (dX > 300)
			return ATL;

		return EPAC;
	}


	/**
	 * Maps a two letter ATCF basin code to a basin
	 * @param sAtcfBasin ATCF basin code, for example WP or AL
	 * @return the basin, or null if the code is not recognized
	 */
	public static Basin fromAtcf(String sAtcfBasin)
	{
		switch (sAtcfBasin)
		{
			case "WP":
				return WPAC;
			case "EP":
			case "CP":
				return EPAC;
			case "IO":
			case "BB":
			case "AS":
				return NIO;
			case "SH":
			case "SI":
			case "SP":
			case "SA":
				return SHEM;
			case "AL":
			case "SL":
				return ATL;
			default:
				return null;
		}
	}
}
