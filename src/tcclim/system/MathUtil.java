package tcclim.system;

/**
 * This class contains static interpolation methods used when resampling
 * tracks onto a new time axis.
 * @author aaron.cherney
 */
public class MathUtil
{
	/**
	 * Linearly interpolates the value at the given position. Positions outside
	 * of the range of the known positions are extrapolated from the first or
	 * last segment.
	 *
	 * @param dX known positions, non-decreasing
	 * @param dY known values, same length as dX
	 * @param dXi position to get the value at
	 * @return the interpolated value
	 */
	public static double interpolate(double[] dX, double[] dY, double dXi)
	{
		int nLen = dX.length;
		if (nLen == 1)
			return dY[0];

		int nHi = upperBound(dX, dXi);
		if (nHi < 1)
			nHi = 1;
		else if (nHi > nLen - 1)
			nHi = nLen - 1;
		int nLo = nHi - 1;

		double dRange = dX[nHi] - dX[nLo];
		if (dRange == 0) // repeated position
			return dY[nHi];

		return dY[nLo] + (dXi - dX[nLo]) / dRange * (dY[nHi] - dY[nLo]);
	}


	/**
	 * Finds the index of the known position nearest to the given position.
	 * Ties go to the lower index.
	 *
	 * @param dX known positions, non-decreasing
	 * @param dXi position to look up
	 * @return index of the nearest position
	 */
	public static int nearest(double[] dX, double dXi)
	{
		int nHi = upperBound(dX, dXi);
		if (nHi == 0)
			return 0;
		if (nHi == dX.length)
			return dX.length - 1;

		int nLo = nHi - 1;
		if (dXi - dX[nLo] <= dX[nHi] - dXi)
			return nLo;

		return nHi;
	}


	/**
	 * Gets the index of the first position that is greater than the given
	 * value.
	 * @param dX sorted positions
	 * @param dVal value to search for
	 * @return index of the first position greater than dVal, dX.length if
	 * there is none
	 */
	public static int upperBound(double[] dX, double dVal)
	{
		int nLo = 0;
		int nHi = dX.length;
		while (nLo < nHi)
		{
			int nMid = (nLo + nHi) >>> 1;
			if (dX[nMid] <= dVal)
				nLo = nMid + 1;
			else
				nHi = nMid;
		}
		return nLo;
	}


	/**
	 * Gets the running sum of the given values
	 * @param dVals values to sum
	 * @return new array where each element is the sum of all the values up to
	 * and including that index
	 */
	public static double[] cumulativeSum(double[] dVals)
	{
		double[] dSums = new double[dVals.length];
		double dSum = 0.0;
		for (int nIndex = 0; nIndex < dVals.length; nIndex++)
		{
			dSum += dVals[nIndex];
			dSums[nIndex] = dSum;
		}
		return dSums;
	}
}
