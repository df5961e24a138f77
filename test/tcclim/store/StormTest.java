package tcclim.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.SortedMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tcclim.collect.ReadOptions;
import tcclim.geosrv.GeoUtil;
import tcclim.geosrv.Polygon;
import tcclim.system.TimeUtil;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StormTest
{
	@TempDir
	Path m_oDir;


	private static long hour(int nHours)
	{
		return TimeUtil.toMillis(2025, 8, 1, 0) + nHours * TimeUtil.HOUR;
	}


	private static Storm track(String sId, long[] lTimes, double[] dLon, double[] dLat, double[] dWind, String[] sTypes)
	{
		return new Storm(sId, lTimes, dLon, dLat, dWind, null, sTypes, null);
	}


	private static Storm twoPoint(String sId, long lStart, long lEnd)
	{
		return track(sId, new long[]{lStart, lEnd}, new double[]{130, 131}, new double[]{15, 16},
		   new double[]{40, 45}, null);
	}


	private static Path fixture(String sName)
		throws Exception
	{
		return Paths.get(StormTest.class.getResource("/bdeck/" + sName).toURI());
	}


	@Test
	void seasonOfCrossoverStorms()
	{
		long lStart = TimeUtil.toMillis(2024, 12, 30, 0);
		long lEnd = TimeUtil.toMillis(2025, 1, 2, 0);
		assertEquals(2025, twoPoint("WP02", lStart, lEnd).getSeason());
		assertEquals(2024, twoPoint("WP10", lStart, lEnd).getSeason());
		assertEquals(2025, twoPoint("SH62", lStart, lEnd).getSeason());
		assertEquals("WP022025", twoPoint("WP02", lStart, lEnd).getFullAtcfId());
	}


	@Test
	void seasonOfSingleYearStorms()
	{
		assertEquals(2024, twoPoint("WP15", TimeUtil.toMillis(2024, 8, 1, 0), TimeUtil.toMillis(2024, 8, 5, 0)).getSeason());
		assertEquals(2024, twoPoint("AL15", TimeUtil.toMillis(2024, 8, 1, 0), TimeUtil.toMillis(2024, 8, 5, 0)).getSeason());
		assertEquals(2025, twoPoint("SH05", TimeUtil.toMillis(2024, 8, 1, 0), TimeUtil.toMillis(2024, 8, 5, 0)).getSeason());
		assertEquals(2025, twoPoint("SH20", TimeUtil.toMillis(2025, 3, 1, 0), TimeUtil.toMillis(2025, 3, 5, 0)).getSeason());
		Storm oStorm = twoPoint("SH20", TimeUtil.toMillis(2025, 3, 1, 0), TimeUtil.toMillis(2025, 3, 5, 0));
		assertEquals("SH", oStorm.getAtcfBasin());
		assertEquals(20, oStorm.getAtcfNumber());
	}


	@Test
	void aceOfSynopticTropicalSamples()
	{
		long[] lTimes = new long[]{hour(12), hour(15), hour(18), hour(24), hour(30), hour(36)};
		double[] dWind = new double[]{60, 60, 34, 35, 60, 60};
		String[] sTypes = new String[]{"TS", "TS", "TD", "TS", "EX", "HU"};
		double[] dLon = new double[]{130, 130, 130, 130, 130, -60};
		double[] dLat = new double[]{15, 15, 15, 15, 15, 15};
		Storm oStorm = track("WP03", lTimes, dLon, dLat, dWind, sTypes);

		SortedMap<Integer, BasinAce> oDaily = oStorm.getDailyAce();
		assertEquals(2, oDaily.size());
		BasinAce oFirst = oDaily.get(TimeUtil.toMjdDay(hour(12)));
		assertEquals(0.36, oFirst.getWpac(), 1e-12);
		assertEquals(0.36, oFirst.getTotal(), 1e-12);
		BasinAce oSecond = oDaily.get(TimeUtil.toMjdDay(hour(24)));
		assertEquals(0.1225, oSecond.getWpac(), 1e-12);
		assertEquals(0.36, oSecond.getEpac(), 1e-12);
		assertEquals(0.8425, oStorm.getTotalAce(), 1e-12);
	}


	@Test
	void cachedAceMatchesRecomputed()
		throws Exception
	{
		Storm oStorm = Storm.fromBDeck(fixture("bwp012025.dat"), ReadOptions.ALL);
		assertSame(oStorm.getDailyAce(), oStorm.getDailyAce());
		assertEquals(oStorm.computeDailyAce(), oStorm.getDailyAce());
		assertEquals(oStorm.getTotalAce(), oStorm.getTotalAce(), 0.0);
	}


	@Test
	void stormFromLongFormatFile()
		throws Exception
	{
		Storm oStorm = Storm.fromBDeck(fixture("bwp012025.dat"), ReadOptions.ALL);
		assertEquals("WP01", oStorm.getAtcfId());
		assertEquals(2025, oStorm.getSeason());
		assertEquals("WP012025", oStorm.getFullAtcfId());
		assertEquals("ALPHA", oStorm.getName());
		assertEquals(6, oStorm.size());
		assertEquals(70.0, oStorm.getMaxWind(), 0.0);
		assertEquals(TimeUtil.toMillis(2025, 1, 1, 0), oStorm.getStartTimeTropical());
		assertEquals(TimeUtil.toMillis(2025, 1, 2, 0), oStorm.getEndTimeTropical());
		assertEquals(TimeUtil.toMillis(2025, 1, 2, 6), oStorm.getEndTime());
		assertEquals(1.485, oStorm.getTotalAce(), 1e-9);

		SortedMap<Integer, BasinAce> oDaily = oStorm.getDailyAce();
		int nJan1 = TimeUtil.toMjdDay(TimeUtil.toMillis(2025, 1, 1, 0));
		assertEquals(nJan1, oDaily.firstKey().intValue());
		assertEquals(1.1825, oDaily.get(nJan1).getWpac(), 1e-9);
		assertEquals(0.3025, oDaily.get(nJan1 + 1).getWpac(), 1e-9);
	}


	@Test
	void stormFromShortFormatFile()
		throws Exception
	{
		Storm oFormal = Storm.fromBDeck(fixture("bep052024.dat"), new ReadOptions(true, false));
		Storm oAll = Storm.fromBDeck(fixture("bep052024.dat"), ReadOptions.ALL);
		assertEquals(5, oFormal.size());
		assertEquals(6, oAll.size());
		assertEquals("EP052024", oAll.getFullAtcfId());
		assertNull(oAll.getName());
		assertEquals(0.6125, oFormal.getTotalAce(), 1e-9);
		assertEquals(0.6125, oAll.getTotalAce(), 1e-9);
		assertEquals(0.6125, oAll.getDailyAce().get(oAll.getDailyAce().firstKey()).getEpac(), 1e-9);
		assertEquals(TimeUtil.toMillis(2024, 7, 1, 18), oAll.getEndTimeTropical());
	}


	@Test
	void emptyFileIsAnError()
		throws Exception
	{
		Path oFile = m_oDir.resolve("bwp992025.dat");
		Files.write(oFile, "not a best track\n".getBytes(StandardCharsets.UTF_8));
		assertThrows(IOException.class, () -> Storm.fromBDeck(oFile, ReadOptions.ALL));
	}


	@Test
	void tropicalBrackets()
	{
		long[] lTimes = new long[]{hour(0), hour(6), hour(12)};
		double[] dLon = new double[]{130, 131, 132};
		double[] dLat = new double[]{15, 16, 17};
		double[] dWind = new double[]{30, 40, 30};

		Storm oUntyped = track("WP04", lTimes, dLon, dLat, dWind, null);
		assertTrue(oUntyped.hasTropicalInterval());
		assertEquals(hour(0), oUntyped.getStartTimeTropical());
		assertEquals(hour(12), oUntyped.getEndTimeTropical());

		Storm oMixed = track("WP04", lTimes, dLon, dLat, dWind, new String[]{"LO", "TS", "EX"});
		assertEquals(hour(6), oMixed.getStartTimeTropical());
		assertEquals(hour(6), oMixed.getEndTimeTropical());

		Storm oNever = track("WP04", lTimes, dLon, dLat, dWind, new String[]{"LO", "SD", "EX"});
		assertFalse(oNever.hasTropicalInterval());
		assertEquals(Storm.NO_TIME, oNever.getStartTimeTropical());
		assertEquals(0.0, oNever.getTotalAce(), 0.0);
	}


	@Test
	void movementBetweenSamples()
	{
		long[] lTimes = new long[]{hour(0), hour(6), hour(6)};
		Storm oStorm = track("WP05", lTimes, new double[]{130, 130, 131}, new double[]{0, 1, 1},
		   new double[]{40, 40, 40}, null);
		Movement oMove = oStorm.getMovement();
		assertEquals(2, oMove.size());
		assertEquals(0.0, oMove.getBearing(0), 1e-9);
		assertEquals(GeoUtil.distanceFromLatLon(0, 130, 1, 130) / GeoUtil.KM_PER_NM / 6, oMove.getSpeed(0), 1e-9);
		assertEquals(10.007, oMove.getSpeed(0), 1e-3);
		assertEquals(0.0, oMove.getSpeed(1), 0.0);
		assertEquals(90.0, oMove.getBearing(1), 0.05);

		double[] dSpeeds = oMove.getSpeeds();
		assertArrayEquals(new double[]{oMove.getSpeed(0), oMove.getSpeed(1)}, dSpeeds, 0.0);
		double[] dBearings = oMove.getBearings();
		assertEquals(2, dBearings.length);
		assertEquals(0.0, dBearings[0], 1e-9);
		dSpeeds[0] = -1;
		dBearings[0] = -1;
		assertEquals(10.007, oMove.getSpeeds()[0], 1e-3);
		assertEquals(0.0, oMove.getBearings()[0], 1e-9);

		Storm oSingle = twoPoint("WP05", hour(0), hour(6)).select(Polygon.box(129, 14, 130.5, 15.5));
		assertEquals(1, oSingle.size());
		assertEquals(0, oSingle.getMovement().size());
	}


	@Test
	void selectionInsideBox()
	{
		long[] lTimes = new long[]{hour(0), hour(6), hour(12), hour(18), hour(24)};
		double[] dLon = new double[]{125, 130, 145, 135, 138};
		double[] dLat = new double[]{15, 16, 17, 18, 19};
		double[] dWind = new double[]{30, 40, 50, 40, 30};
		Storm oStorm = track("WP06", lTimes, dLon, dLat, dWind, null);

		Storm oAll = oStorm.select(Polygon.box(120, 10, 150, 20));
		assertEquals(5, oAll.size());
		assertTrue(oAll.isContinuous());
		assertFalse(oAll.isSubset());

		Storm oGap = oStorm.select(Polygon.box(120, 10, 140, 20));
		assertEquals(4, oGap.size());
		assertFalse(oGap.isContinuous());
		assertTrue(oGap.isSubset());
		assertArrayEquals(new long[]{hour(0), hour(6), hour(18), hour(24)}, oGap.getTimes());

		Storm oTail = oStorm.select(Polygon.box(128, 10, 150, 20));
		assertEquals(4, oTail.size());
		assertTrue(oTail.isContinuous());
		assertTrue(oTail.isSubset());

		Storm oEdge = oStorm.select(Polygon.box(125.005, 10, 150, 20), 0.01);
		assertEquals(5, oEdge.size());

		assertNull(oStorm.select(Polygon.box(0, 0, 10, 10)));
	}


	@Test
	void interpolationKeepsExistingSamples()
	{
		long[] lTimes = new long[]{hour(0), hour(6), hour(12), hour(18), hour(30)};
		double[] dLon = new double[]{130, 131, 132.5, 133, 136};
		double[] dLat = new double[]{15, 15.5, 16.5, 17, 19};
		double[] dWind = new double[]{30, 40, 55, 65, 45};
		double[] dPres = new double[]{1004, 998, 985, 975, 990};
		String[] sTypes = new String[]{"TD", "TS", "TS", "TY", "TS"};
		Storm oStorm = new Storm("WP07", lTimes, dLon, dLat, dWind, dPres, sTypes, "GAMMA");

		Storm oInterp = oStorm.interpolate(6);
		assertTrue(oInterp.isInterpolated());
		assertFalse(oStorm.isInterpolated());
		assertEquals(6, oInterp.size());
		assertEquals(hour(24), oInterp.getTimes()[4]);
		for (int nIndex = 0; nIndex < 4; nIndex++)
		{
			assertEquals(dLon[nIndex], oInterp.getLons()[nIndex], 1e-6);
			assertEquals(dLat[nIndex], oInterp.getLats()[nIndex], 1e-6);
			assertEquals(dWind[nIndex], oInterp.getWinds()[nIndex], 1e-6);
			assertEquals(dPres[nIndex], oInterp.getPressures()[nIndex], 1e-6);
			assertEquals(sTypes[nIndex], oInterp.getTypes()[nIndex]);
		}
		assertEquals(136.0, oInterp.getLons()[5], 1e-6);
		assertEquals(134.5, oInterp.getLons()[4], 1e-6);
		assertEquals(55.0, oInterp.getWinds()[4], 1e-6);
		assertEquals("TY", oInterp.getTypes()[4]);
		assertEquals("GAMMA", oInterp.getName());
	}


	@Test
	void interpolationAcrossAntimeridian()
	{
		Storm oStorm = track("WP08", new long[]{hour(0), hour(12)}, new double[]{179, -179},
		   new double[]{20, 20}, new double[]{50, 50}, null);
		double[] dLon = oStorm.interpolate(6).getLons();
		assertEquals(3, dLon.length);
		assertEquals(180.0, GeoUtil.to360(dLon[1]), 1e-6);
		assertEquals(-179.0, dLon[2], 1e-6);

		Storm oEast = track("WP09", new long[]{hour(0), hour(12)}, new double[]{355, 5},
		   new double[]{20, 20}, new double[]{50, 50}, null);
		dLon = oEast.interpolate(6).getLons();
		assertEquals(355.0, dLon[0], 1e-6);
		assertEquals(180.0, GeoUtil.to360(dLon[1] + 180), 1e-6);
		assertEquals(5.0, dLon[2], 1e-6);

		Storm oWest = track("WP10", new long[]{hour(0), hour(12)}, new double[]{5, 355},
		   new double[]{20, 20}, new double[]{50, 50}, null);
		dLon = oWest.interpolate(6).getLons();
		assertEquals(5.0, dLon[0], 1e-6);
		assertEquals(180.0, GeoUtil.to360(dLon[1] + 180), 1e-6);
		assertEquals(355.0, dLon[2], 1e-6);
	}


	@Test
	void interpolationPreconditions()
	{
		long[] lTimes = new long[]{hour(0), hour(6), hour(12)};
		Storm oStorm = track("WP09", lTimes, new double[]{130, 150, 132}, new double[]{15, 16, 17},
		   new double[]{40, 45, 50}, null);
		assertThrows(IllegalArgumentException.class, () -> oStorm.interpolate(0));
		assertThrows(IllegalArgumentException.class, () -> oStorm.interpolate(-6));
		Storm oGap = oStorm.select(Polygon.box(120, 10, 140, 20));
		assertFalse(oGap.isContinuous());
		assertThrows(IllegalStateException.class, () -> oGap.interpolate(6));
	}


	@Test
	void invalidTracksAreRejected()
	{
		double[] dOne = new double[]{1.0};
		assertThrows(IllegalArgumentException.class,
		   () -> track("WP01", new long[0], new double[0], new double[0], new double[0], null));
		assertThrows(IllegalArgumentException.class,
		   () -> track("WP01", new long[]{hour(0), hour(6)}, dOne, dOne, dOne, null));
		assertThrows(IllegalArgumentException.class,
		   () -> track("WP01", new long[]{hour(6), hour(0)}, new double[2], new double[2], new double[2], null));
		assertThrows(IllegalArgumentException.class,
		   () -> track("W", new long[]{hour(0)}, dOne, dOne, dOne, null));
	}


	@Test
	void arraysAreCopied()
	{
		double[] dWind = new double[]{40, 50};
		Storm oStorm = track("WP11", new long[]{hour(0), hour(6)}, new double[]{130, 131}, new double[]{15, 16}, dWind, null);
		dWind[1] = 150;
		assertEquals(50.0, oStorm.getMaxWind(), 0.0);
		oStorm.getWinds()[1] = 150;
		assertEquals(50.0, oStorm.getMaxWind(), 0.0);
	}
}
