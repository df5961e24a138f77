package tcclim.geosrv;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeoUtilTest
{
	@Test
	void haversineDistance()
	{
		// one degree of latitude
		assertEquals(111.195, GeoUtil.distanceFromLatLon(0, 0, 1, 0), 1e-3);
		assertEquals(0.0, GeoUtil.distanceFromLatLon(15, 130, 15, 130), 1e-9);
		assertEquals(GeoUtil.distanceFromLatLon(10, 179.5, 10, -179.5), GeoUtil.distanceFromLatLon(10, -0.5, 10, 0.5), 1e-9);
	}


	@Test
	void bearingsAreInRange()
	{
		assertEquals(0.0, GeoUtil.bearing(0, 0, 1, 0), 1e-9);
		assertEquals(90.0, GeoUtil.bearing(0, 0, 0, 1), 1e-9);
		assertEquals(180.0, GeoUtil.bearing(1, 0, 0, 0), 1e-9);
		assertEquals(270.0, GeoUtil.bearing(0, 1, 0, 0), 1e-9);
		assertEquals(0.0, GeoUtil.bearing(10, 130, 10, 130), 1e-9);
	}


	@Test
	void normalizesLongitude()
	{
		assertEquals(260.0, GeoUtil.to360(-100.0), 1e-12);
		assertEquals(0.0, GeoUtil.to360(360.0), 1e-12);
		assertEquals(135.0, GeoUtil.to360(135.0), 1e-12);
	}


	@Test
	void pointInPolygon()
	{
		Polygon oTriangle = new Polygon(0, 0, 10, 0, 0, 10, 0, 0);
		assertEquals(3, oTriangle.size());
		assertTrue(GeoUtil.isInsidePolygon(oTriangle, 2, 2));
		assertFalse(GeoUtil.isInsidePolygon(oTriangle, 6, 6));
		assertFalse(GeoUtil.isInsidePolygon(oTriangle, -1, 5));
	}


	@Test
	void bufferedPolygonIncludesEdges()
	{
		Polygon oBox = Polygon.box(120, 10, 140, 20);
		assertTrue(GeoUtil.isInsidePolygon(oBox, 140.005, 15, 0.01));
		assertTrue(GeoUtil.isInsidePolygon(oBox, 120, 10, 0.01));
		assertFalse(GeoUtil.isInsidePolygon(oBox, 140.02, 15, 0.01));
		assertFalse(GeoUtil.isInsidePolygon(oBox, 140.005, 15, 0.0));
	}


	@Test
	void polygonNeedsThreePoints()
	{
		assertThrows(IllegalArgumentException.class, () -> new Polygon(0, 0, 1, 1));
		assertThrows(IllegalArgumentException.class, () -> new Polygon(0, 0, 1));
	}
}
