package tcclim.collect;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.util.Arrays;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import tcclim.system.CsvReader;
import tcclim.system.Text;
import tcclim.system.TimeUtil;

/**
 * Parses best track records in the BDeck format.
 * <p>
 * Each physical line is a comma separated record. Lines with more than 20
 * fields are the long format, which reports wind radii for one threshold per
 * line: the 34 knot radii are on the record's own line, the 50 and 64 knot
 * radii are on the lines that directly follow it with the same timestamp.
 * </p>
 * <p>
 * Parsing keeps no state between calls, the metadata accumulator is returned
 * with the records in {@link BDeckData}.
 * </p>
 * @author aaron.cherney
 */
public abstract class BDeckParser
{
	private static final Logger LOGGER = LogManager.getLogger(BDeckParser.class);


	/**
	 * Lines with more fields than this are the long format
	 */
	public static final int LONG_FORMAT_COLS = 20;


	/**
	 * Fewest fields a line needs to contain a position and wind speed
	 */
	public static final int MIN_COLS = 9;


	/**
	 * Last two characters of the timestamps of formal advisories
	 */
	private static final String[] FORMAL_HOURS = new String[]{"00", "06", "12", "18"};


	/**
	 * Storm types dropped when only records with tropical nature are requested
	 */
	private static final String[] NON_TROPICAL = new String[]{"EX", "SD", "SS"};


	/**
	 * Raw storm types that are reclassified from the wind speed
	 */
	private static final String[] AMBIGUOUS = new String[]{"HU", "MH", "ST", "TY"};


	// field positions
	private static final int BASIN = 0;
	private static final int NUMBER = 1;
	private static final int TIME = 2;
	private static final int TECHNUM = 3;
	private static final int TECHCODE = 4;
	private static final int TAU = 5;
	private static final int LAT = 6;
	private static final int LON = 7;
	private static final int WIND = 8;
	private static final int PRES = 9;
	private static final int TYPE = 10;
	private static final int RADII = 13;
	private static final int LCI = 17;
	private static final int LCI_RADIUS = 18;
	private static final int RMW = 19;
	private static final int NAME = 27;
	private static final int DEPTH = 28;


	private BDeckParser()
	{
	}


	/**
	 * Gets the best category from the wind speed and the raw storm type of a
	 * record. The raw type is kept unless it is absent or one of TY, HU, ST
	 * and MH, which are reclassified by the wind speed.
	 *
	 * @param nWind maximum sustained wind in knots
	 * @param sRawCategory storm type in the file, can be null
	 * @return the raw type or the code of the {@link Category} of the wind
	 */
	public static String getCategory(int nWind, String sRawCategory)
	{
		if (sRawCategory != null && !sRawCategory.isEmpty() && Arrays.binarySearch(AMBIGUOUS, sRawCategory) < 0)
			return sRawCategory;

		return Category.fromWind(nWind).name();
	}


	/**
	 * Determines if the timestamp belongs to a formal advisory
	 * @param sTime timestamp in the format yyyyMMddHH
	 * @return true if the hour is 00, 06, 12 or 18
	 */
	public static boolean isFormalAdvisory(String sTime)
	{
		if (sTime.length() < 2)
			return false;

		return Arrays.binarySearch(FORMAL_HOURS, sTime.substring(sTime.length() - 2)) >= 0;
	}


	/**
	 * Parses a coordinate in tenths of a degree followed by a hemisphere
	 * letter, for example 125N or 1304E.
	 *
	 * @param sVal field to parse
	 * @param cNegative hemisphere letter that makes the coordinate negative
	 * @return coordinate in decimal degrees
	 */
	public static double parseCoordinate(String sVal, char cNegative)
	{
		if (sVal.isEmpty())
			return BDeckRecord.BAD_VALUE / 10.0;

		int nLast = sVal.length() - 1;
		double dVal = Text.parseInt(sVal.substring(0, nLast), BDeckRecord.BAD_VALUE) / 10.0;
		if (sVal.charAt(nLast) == cNegative)
			dVal = -dVal;

		return dVal;
	}


	/**
	 * Wrapper for {@link #parse(java.io.InputStream, tcclim.collect.ReadOptions)}
	 * for lines already in memory.
	 *
	 * @param oLines physical lines of a BDeck file
	 * @param oOptions read filters
	 * @return the parsed records and their metadata
	 */
	public static BDeckData parse(List<String> oLines, ReadOptions oOptions)
	{
		byte[] yText = String.join("\n", oLines).getBytes(StandardCharsets.UTF_8);
		try
		{
			return parse(new ByteArrayInputStream(yText), oOptions);
		}
		catch (IOException oEx) // byte array streams do not fail
		{
			throw new IllegalStateException(oEx);
		}
	}


	/**
	 * Parses all of the records of a BDeck stream. Lines are consumed in order
	 * by a single cursor. When a long format record needs radii continuation
	 * lines, the cursor advances onto them. A continuation line with a
	 * different timestamp leaves the radii unset and is consumed without being
	 * parsed as a record.
	 *
	 * @param oIn stream positioned at the start of a BDeck file
	 * @param oOptions read filters
	 * @return the parsed records and their metadata
	 * @throws IOException
	 */
	public static BDeckData parse(InputStream oIn, ReadOptions oOptions)
		throws IOException
	{
		BDeckData oData = new BDeckData();
		CsvReader oCsv = new CsvReader(oIn);
		int nSkipped = 0;
		int nCols = oCsv.readLine();
		while (nCols > 0)
		{
			BDeckRecord oRec = parseRecord(oCsv, nCols, oOptions);
			if (oRec == null)
			{
				++nSkipped;
				nCols = oCsv.readLine();
				continue;
			}

			if (oRec.m_bLongFormat)
				nCols = readContinuation(oCsv, oRec);
			else
				nCols = oCsv.readLine();

			oData.add(oRec);
		}
		LOGGER.debug(String.format("Read %d records for %s, skipped %d lines", oData.size(), oData.getMetadata().getFullCode(), nSkipped));
		return oData;
	}


	/**
	 * Parses the current line of the reader into a record.
	 *
	 * @return the record, or null if the line is filtered out or unusable
	 */
	private static BDeckRecord parseRecord(CsvReader oCsv, int nCols, ReadOptions oOptions)
	{
		if (nCols < MIN_COLS)
		{
			LOGGER.debug(String.format("Line %d has %d fields, skipping", oCsv.getLineNumber(), nCols));
			return null;
		}

		boolean bLong = nCols > LONG_FORMAT_COLS;
		String sTime = oCsv.parseString(TIME);
		if (oOptions.m_bFormalAdvisoryOnly && !isFormalAdvisory(sTime))
			return null;

		if (bLong && oOptions.m_bTropicalNatureOnly && Arrays.binarySearch(NON_TROPICAL, oCsv.parseString(TYPE)) >= 0)
			return null;

		BDeckRecord oRec = new BDeckRecord();
		try
		{
			oRec.m_lTime = TimeUtil.parseBDeckTime(sTime);
		}
		catch (ParseException oEx)
		{
			LOGGER.debug(String.format("Line %d has an invalid timestamp \"%s\", skipping", oCsv.getLineNumber(), sTime));
			return null;
		}

		oRec.m_bLongFormat = bLong;
		oRec.m_sTime = sTime;
		oRec.m_sBasin = oCsv.parseString(BASIN);
		oRec.m_nNumber = oCsv.parseInt(NUMBER, BDeckRecord.BAD_VALUE);
		oRec.m_sTechNum = oCsv.parseString(TECHNUM);
		oRec.m_sTechCode = oCsv.parseString(TECHCODE);
		oRec.m_nTau = oCsv.parseInt(TAU, BDeckRecord.BAD_VALUE);
		oRec.m_dLat = parseCoordinate(oCsv.parseString(LAT), 'S');
		oRec.m_dLon = parseCoordinate(oCsv.parseString(LON), 'W');
		oRec.m_nWind = oCsv.parseInt(WIND, BDeckRecord.BAD_VALUE);
		if (nCols > PRES)
		{
			oRec.m_nPressure = oCsv.parseInt(PRES, BDeckRecord.BAD_VALUE);
			oRec.m_sRawCategory = oCsv.parseString(TYPE);
		}
		oRec.m_sCategory = getCategory(oRec.m_nWind, oRec.m_sRawCategory);

		if (bLong)
		{
			oRec.m_nLci = oCsv.parseInt(LCI, BDeckRecord.BAD_VALUE);
			oRec.m_nLciRadius = oCsv.parseInt(LCI_RADIUS, BDeckRecord.BAD_VALUE);
			oRec.m_nRmw = oCsv.parseInt(RMW, BDeckRecord.BAD_VALUE);
			if (nCols > DEPTH)
			{
				oRec.m_sName = oCsv.parseString(NAME);
				oRec.m_sDepth = oCsv.parseString(DEPTH);
			}
			if (oRec.m_nWind > 34)
				oRec.m_nR34 = parseQuadrants(oCsv);
		}
		return oRec;
	}


	/**
	 * Reads the 50 and 64 knot radii continuation lines of the given long
	 * format record. Every line looked at is consumed.
	 *
	 * @return the column count of the next unconsumed line, 0 at the end of
	 * the stream
	 */
	private static int readContinuation(CsvReader oCsv, BDeckRecord oRec)
		throws IOException
	{
		if (oRec.m_nWind >= 50)
		{
			if (oCsv.readLine() == 0) // end of input, the record is still kept
				return 0;
			if (!isSameTime(oCsv, oRec))
				return oCsv.readLine();
			oRec.m_nR50 = parseQuadrants(oCsv);

			if (oRec.m_nWind > 64)
			{
				if (oCsv.readLine() == 0)
					return 0;
				if (!isSameTime(oCsv, oRec))
					return oCsv.readLine();
				oRec.m_nR64 = parseQuadrants(oCsv);
			}
		}
		return oCsv.readLine();
	}


	private static boolean isSameTime(CsvReader oCsv, BDeckRecord oRec)
	{
		boolean bSame = oCsv.parseString(TIME).equals(oRec.m_sTime);
		if (!bSame)
			LOGGER.debug(String.format("Line %d is not a radii line for %s, discarding", oCsv.getLineNumber(), oRec.m_sTime));

		return bSame;
	}


	/**
	 * Reads the NE, SE, SW and NW wind radii of the current line
	 */
	private static int[] parseQuadrants(CsvReader oCsv)
	{
		int[] nRadii = new int[4];
		for (int nIndex = 0; nIndex < nRadii.length; nIndex++)
			nRadii[nIndex] = oCsv.parseInt(RADII + nIndex, BDeckRecord.BAD_VALUE);

		return nRadii;
	}
}
