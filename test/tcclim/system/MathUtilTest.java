package tcclim.system;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class MathUtilTest
{
	private static final double[] X = new double[]{0.0, 1.0, 2.0, 4.0};

	private static final double[] Y = new double[]{10.0, 20.0, 0.0, 8.0};


	@Test
	void interpolatesInside()
	{
		assertEquals(15.0, MathUtil.interpolate(X, Y, 0.5), 1e-12);
		assertEquals(0.0, MathUtil.interpolate(X, Y, 2.0), 1e-12);
		assertEquals(4.0, MathUtil.interpolate(X, Y, 3.0), 1e-12);
	}


	@Test
	void extrapolatesOutside()
	{
		assertEquals(0.0, MathUtil.interpolate(X, Y, -1.0), 1e-12);
		assertEquals(12.0, MathUtil.interpolate(X, Y, 5.0), 1e-12);
	}


	@Test
	void singlePointIsConstant()
	{
		assertEquals(3.0, MathUtil.interpolate(new double[]{1.0}, new double[]{3.0}, 7.0), 0.0);
	}


	@Test
	void nearestTiesGoLow()
	{
		assertEquals(0, MathUtil.nearest(X, -3.0));
		assertEquals(0, MathUtil.nearest(X, 0.5));
		assertEquals(1, MathUtil.nearest(X, 0.6));
		assertEquals(2, MathUtil.nearest(X, 3.0));
		assertEquals(3, MathUtil.nearest(X, 9.0));
	}


	@Test
	void cumulativeSum()
	{
		assertArrayEquals(new double[]{1.0, 3.0, 6.0}, MathUtil.cumulativeSum(new double[]{1.0, 2.0, 3.0}), 1e-12);
		assertEquals(0, MathUtil.cumulativeSum(new double[0]).length);
	}
}
