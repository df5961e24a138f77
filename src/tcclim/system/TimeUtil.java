package tcclim.system;

import java.text.ParseException;
import java.text.SimpleDateFormat;
import java.util.Calendar;
import java.util.GregorianCalendar;
import java.util.TimeZone;

/**
 * Contains methods for converting between times in milliseconds since Epoch,
 * UTC calendar fields and Modified Julian Dates (MJD). Every time in the
 * system is a UTC millisecond value, MJD is used as the continuous day axis
 * for day bucketing and interpolation.
 * @author aaron.cherney
 */
public abstract class TimeUtil
{
	/**
	 * Number of milliseconds in a day
	 */
	public static final long DAY = 86400000L;


	/**
	 * Number of milliseconds in an hour
	 */
	public static final long HOUR = 3600000L;


	/**
	 * Offset between Julian Date and Modified Julian Date
	 */
	public static final double MJD_OFFSET = 2400000.5;


	/**
	 * MJD of 1970-01-01 00:00 UTC
	 */
	public static final int MJD_EPOCH = 40587;


	/**
	 * Format of BDeck timestamps
	 */
	public static final String BDECK_FORMAT = "yyyyMMddHH";


	/**
	 * Format used in log messages and String representations
	 */
	public static final String DISPLAY_FORMAT = "yyyy-MM-dd HH:mm";


	public static final TimeZone UTC = TimeZone.getTimeZone("UTC");


	private TimeUtil()
	{
	}


	/**
	 * Creates a UTC calendar set to the given time
	 * @param lMillis time in milliseconds since Epoch
	 * @return a new GregorianCalendar in UTC
	 */
	public static GregorianCalendar newCalendar(long lMillis)
	{
		GregorianCalendar oCal = new GregorianCalendar(UTC);
		oCal.setTimeInMillis(lMillis);
		return oCal;
	}


	/**
	 * Gets the time in milliseconds since Epoch of the given UTC calendar
	 * fields.
	 * @param nYear four digit year
	 * @param nMonth month, 1 = January
	 * @param nDay day of month
	 * @param nHour hour of day
	 * @return time in milliseconds since Epoch
	 */
	public static long toMillis(int nYear, int nMonth, int nDay, int nHour)
	{
		GregorianCalendar oCal = new GregorianCalendar(UTC);
		oCal.clear();
		oCal.set(nYear, nMonth - 1, nDay, nHour, 0, 0);
		return oCal.getTimeInMillis();
	}


	/**
	 * Converts the given time to a Modified Julian Date using the Julian Day
	 * algorithm for the Gregorian calendar. January and February are treated
	 * as the 13th and 14th month of the previous year.
	 *
	 * @param lMillis time in milliseconds since Epoch
	 * @return Modified Julian Date, fractional part is the time of day
	 */
	public static double toMjd(long lMillis)
	{
		GregorianCalendar oCal = newCalendar(lMillis);
		int nYear = oCal.get(Calendar.YEAR);
		int nMonth = oCal.get(Calendar.MONTH) + 1;
		int nDay = oCal.get(Calendar.DAY_OF_MONTH);
		if (nMonth <= 2)
		{
			--nYear;
			nMonth += 12;
		}

		int nA = Math.floorDiv(nYear, 100);
		int nB = 2 - nA + Math.floorDiv(nA, 4);
		// JD = X - 1524.5 at midnight so MJD = X - 2401525
		long lX = (long)(365.25 * (nYear + 4716)) + (long)(30.6001 * (nMonth + 1)) + nDay + nB;
		double dFrac = Math.floorMod(lMillis, DAY) / (double)DAY;
		return (lX - 2401525L) + dFrac;
	}


	/**
	 * Converts the given Modified Julian Date to a time in milliseconds since
	 * Epoch. The calendar date is recovered with the Fliegel and Van Flandern
	 * algorithm and the time of day is rounded to the nearest millisecond.
	 *
	 * @param dMjd Modified Julian Date
	 * @return time in milliseconds since Epoch
	 */
	public static long fromMjd(double dMjd)
	{
		long lDay = (long)Math.floor(dMjd);
		long lOfDay = Math.round((dMjd - lDay) * DAY);
		if (lOfDay >= DAY)
		{
			++lDay;
			lOfDay -= DAY;
		}

		long lL = lDay + 2400001L + 68569L; // julian day number of the date
		long lN = (4 * lL) / 146097;
		lL = lL - (146097 * lN + 3) / 4;
		long lI = (4000 * (lL + 1)) / 1461001;
		lL = lL - (1461 * lI) / 4 + 31;
		long lJ = (80 * lL) / 2447;
		int nDay = (int)(lL - (2447 * lJ) / 80);
		lL = lJ / 11;
		int nMonth = (int)(lJ + 2 - 12 * lL);
		int nYear = (int)(100 * (lN - 49) + lI + lL);

		return toMillis(nYear, nMonth, nDay, 0) + lOfDay;
	}


	/**
	 * Gets the integer day of the Modified Julian Date of the given time, used
	 * as the key for daily buckets.
	 * @param lMillis time in milliseconds since Epoch
	 * @return floor of the Modified Julian Date
	 */
	public static int toMjdDay(long lMillis)
	{
		return (int)Math.floor(toMjd(lMillis));
	}


	public static int getYear(long lMillis)
	{
		return newCalendar(lMillis).get(Calendar.YEAR);
	}


	/**
	 * @param lMillis time in milliseconds since Epoch
	 * @return month of the year, 1 = January
	 */
	public static int getMonth(long lMillis)
	{
		return newCalendar(lMillis).get(Calendar.MONTH) + 1;
	}


	public static int getHour(long lMillis)
	{
		return newCalendar(lMillis).get(Calendar.HOUR_OF_DAY);
	}


	/**
	 * Determines if the given time is at a synoptic hour, 00, 06, 12 or 18 UTC
	 * @param lMillis time in milliseconds since Epoch
	 * @return true if the hour of day is a multiple of 6
	 */
	public static boolean isSynoptic(long lMillis)
	{
		return getHour(lMillis) % 6 == 0;
	}


	public static boolean isLeapYear(int nYear)
	{
		return new GregorianCalendar(UTC).isLeapYear(nYear);
	}


	/**
	 * Parses a BDeck timestamp in the format yyyyMMddHH as a UTC time
	 * @param sTime timestamp to parse
	 * @return time in milliseconds since Epoch
	 * @throws ParseException if the timestamp is malformed
	 */
	public static long parseBDeckTime(String sTime)
		throws ParseException
	{
		SimpleDateFormat oSdf = new SimpleDateFormat(BDECK_FORMAT);
		oSdf.setTimeZone(UTC);
		oSdf.setLenient(false);
		return oSdf.parse(sTime).getTime();
	}


	/**
	 * Formats the given time with {@link #DISPLAY_FORMAT} in UTC
	 * @param lMillis time in milliseconds since Epoch
	 * @return formatted time
	 */
	public static String format(long lMillis)
	{
		SimpleDateFormat oSdf = new SimpleDateFormat(DISPLAY_FORMAT);
		oSdf.setTimeZone(UTC);
		return oSdf.format(lMillis);
	}
}
