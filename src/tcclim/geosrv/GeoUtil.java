package tcclim.geosrv;

/**
 * Contains static methods for great circle calculations and planar point in
 * polygon tests on geo-coordinates in decimal degrees.
 * @author aaron.cherney
 */
public abstract class GeoUtil
{
	/**
	 * Approximate radius of the earth in km
	 */
	public static final double EARTH_RADIUS_KM = 6371;


	/**
	 * Kilometers in a nautical mile
	 */
	public static final double KM_PER_NM = 1.852;


	/**
	 * Pi divided by 180
	 */
	public static final double PIOVER180 = Math.PI / 180;


	/**
	 * Determines if the given point is inside the given bounding box with the
	 * given tolerance.
	 *
	 * @param dX x coordinate of the point
	 * @param dY y coordinate of the point
	 * @param dL left bound of the bounding box
	 * @param dB bottom bound of the bounding box
	 * @param dR right bound of the bounding box
	 * @param dT top bound of the bounding box
	 * @param dTol tolerance to expand the bounding box by
	 * @return true if the point is inside (or on the edge) of the bounding box
	 * expanded by the tolerance, otherwise false.
	 */
	public static boolean isInside(double dX, double dY, double dL, double dB, double dR, double dT, double dTol)
	{
		return (dX >= dL - dTol && dX <= dR + dTol
		   && dY >= dB - dTol && dY <= dT + dTol);
	}


	/**
	 * Gets the squared perpendicular distance from the given point to the given
	 * line segment.
	 *
	 * @param dX x coordinate of the point
	 * @param dY y coordinate of the point
	 * @param dX1 x coordinate of the first endpoint of the line segment
	 * @param dY1 y coordinate of the first endpoint of the line segment
	 * @param dX2 x coordinate of the second endpoint of the line segment
	 * @param dY2 y coordinate of the second endpoint of the line segment
	 * @return the squared perpendicular distance from the point to the line
	 * segment or {@code Double.NaN} if the point does not project onto the
	 * segment
	 */
	public static double getPerpDist(double dX, double dY, double dX1, double dY1, double dX2, double dY2)
	{
		double dXd = dX2 - dX1;
		double dYd = dY2 - dY1;
		double dXp = dX - dX1;
		double dYp = dY - dY1;

		if (dXd == 0 && dYd == 0) // line segment is a point
			return dXp * dXp + dYp * dYp; // squared dist between the points

		double dU = dXp * dXd + dYp * dYd;
		double dV = dXd * dXd + dYd * dYd;

		if (dU < 0 || dU > dV) // nearest point is not on the line
			return Double.NaN;

		// find the perpendicular intersection of the point on the line
		dXp = dX1 + (dU * dXd / dV);
		dYp = dY1 + (dU * dYd / dV);

		dXd = dX - dXp; // calculate the squared distance
		dYd = dY - dYp; // between the point and the intersection
		return dXd * dXd + dYd * dYd;
	}


	/**
	 * Gets the squared distance between the given two points
	 */
	public static double sqDist(double dXi, double dYi, double dXj, double dYj)
	{
		double dX = dXi - dXj;
		double dY = dYi - dYj;
		return dX * dX + dY * dY;
	}


	/**
	 * Gets the squared distance from the point to the nearest point of the
	 * line segment, including its endpoints.
	 */
	public static double sqSegDist(double dX, double dY, double dX1, double dY1, double dX2, double dY2)
	{
		double dDist = getPerpDist(dX, dY, dX1, dY1, dX2, dY2);
		if (Double.isNaN(dDist))
			dDist = Math.min(sqDist(dX, dY, dX1, dY1), sqDist(dX, dY, dX2, dY2));

		return dDist;
	}


	/**
	 * Determines if the given point is inside the given polygon. This is an
	 * implementation of the Ray Casting Algorithm.
	 *
	 * @param oPoly the polygon
	 * @param dX x coordinate of the point
	 * @param dY y coordinate of the point
	 * @return true if the point is inside the polygon, otherwise false
	 */
	public static boolean isInsidePolygon(Polygon oPoly, double dX, double dY)
	{
		if (!isInside(dX, dY, oPoly.m_dLeft, oPoly.m_dBot, oPoly.m_dRight, oPoly.m_dTop, 0)) // early out bounding box test
			return false;

		double[] dPts = oPoly.m_dPoints;
		int nLen = dPts.length;
		int nCount = 0;
		for (int nIndex = 0; nIndex < nLen; nIndex += 2)
		{
			double dX1 = dPts[nIndex];
			double dY1 = dPts[nIndex + 1];
			double dX2 = dPts[(nIndex + 2) % nLen]; // wrap to close the ring
			double dY2 = dPts[(nIndex + 3) % nLen];
			if ((dY1 < dY && dY2 >= dY || dY2 < dY && dY1 >= dY)
			   && (dX1 <= dX || dX2 <= dX)
			   && (dX1 + (dY - dY1) / (dY2 - dY1) * (dX2 - dX1) < dX))
				++nCount;
		}
		return (nCount & 1) != 0;
	}


	/**
	 * Determines if the given point is inside the given polygon buffered
	 * outward by the given distance. A point is inside the buffered polygon if
	 * it is inside the polygon or within the tolerance of any of its edges.
	 *
	 * @param oPoly the polygon
	 * @param dX x coordinate of the point
	 * @param dY y coordinate of the point
	 * @param dTol buffer distance in decimal degrees
	 * @return true if the point is inside the buffered polygon
	 */
	public static boolean isInsidePolygon(Polygon oPoly, double dX, double dY, double dTol)
	{
		if (!isInside(dX, dY, oPoly.m_dLeft, oPoly.m_dBot, oPoly.m_dRight, oPoly.m_dTop, dTol))
			return false;

		if (isInsidePolygon(oPoly, dX, dY))
			return true;

		double dSqTol = dTol * dTol;
		double[] dPts = oPoly.m_dPoints;
		int nLen = dPts.length;
		for (int nIndex = 0; nIndex < nLen; nIndex += 2)
		{
			if (sqSegDist(dX, dY, dPts[nIndex], dPts[nIndex + 1], dPts[(nIndex + 2) % nLen], dPts[(nIndex + 3) % nLen]) <= dSqTol)
				return true;
		}
		return false;
	}


	/**
	 * Gets the distance between the 2 geo-coordinates in km using the Haversine
	 * formula.
	 *
	 * @param dLat1 latitude in decimal degrees of the first point
	 * @param dLon1 longitude in decimal degrees of the first point
	 * @param dLat2 latitude in decimal degrees of the second point
	 * @param dLon2 longitude in decimal degrees of the second point
	 * @return distance in km between the 2 geo-coordinates.
	 */
	public static double distanceFromLatLon(double dLat1, double dLon1, double dLat2, double dLon2)
	{
		double dLat = (dLat2 - dLat1) * PIOVER180;
		double dLon = (dLon2 - dLon1) * PIOVER180;
		double dA = Math.sin(dLat / 2) * Math.sin(dLat / 2) + Math.cos(dLat1 * PIOVER180) * Math.cos(dLat2 * PIOVER180) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
		return 2 * EARTH_RADIUS_KM * Math.asin(Math.sqrt(dA));
	}


	/**
	 * Gets the initial bearing of the great circle path from the first
	 * geo-coordinate to the second.
	 *
	 * @param dLat1 latitude in decimal degrees of the first point
	 * @param dLon1 longitude in decimal degrees of the first point
	 * @param dLat2 latitude in decimal degrees of the second point
	 * @param dLon2 longitude in decimal degrees of the second point
	 * @return bearing in degrees clockwise from north. Range is {@literal 0 <= deg < 360}
	 */
	public static double bearing(double dLat1, double dLon1, double dLat2, double dLon2)
	{
		double dPhi1 = dLat1 * PIOVER180;
		double dPhi2 = dLat2 * PIOVER180;
		double dLambda = (dLon2 - dLon1) * PIOVER180;
		double dY = Math.sin(dLambda) * Math.cos(dPhi2);
		double dX = Math.cos(dPhi1) * Math.sin(dPhi2) - Math.sin(dPhi1) * Math.cos(dPhi2) * Math.cos(dLambda);
		double dDeg = Math.atan2(dY, dX) / PIOVER180;
		dDeg = (dDeg + 360) % 360;
		if (dDeg >= 360) // -0.0 and rounding
			dDeg = 0;

		return dDeg;
	}


	/**
	 * Normalizes the longitude into the range {@literal 0 <= lon < 360}
	 * @param dLon longitude in decimal degrees
	 * @return equivalent longitude in the range [0, 360)
	 */
	public static double to360(double dLon)
	{
		double dNorm = dLon % 360;
		if (dNorm < 0)
			dNorm += 360;

		return dNorm;
	}
}
