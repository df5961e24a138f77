package tcclim.system;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Buffered FilterInputStream that reads delimited text one line at a time.
 * Leading whitespace of each column is dropped, trailing whitespace is kept
 * and removed by {@link #parseString(int)}. Each call to {@link #readLine()}
 * consumes exactly one physical line, which lets callers treat the reader as
 * a forward-only cursor over the lines of a file.
 * <p>
 * Each byte becomes one character, so the input is decoded as ISO-8859-1.
 * Multi-byte UTF-8 sequences, such as accented storm names, come through as
 * one character per byte.
 * </p>
 * @author aaron.cherney
 */
public class CsvReader extends FilterInputStream
{
	/**
	 * Default 16k buffer size
	 */
	protected static final int BUFFER_SIZE = 16384;


	/**
	 * Default number of columns to allocate memory for
	 */
	protected static final int DEFAULT_COLS = 40;


	/**
	 * State flag used to indicate the default state or that a delimiter was
	 * just read
	 */
	protected static final int WHITESPACE = 0;


	/**
	 * State flag used to indicate reading a column has started
	 */
	protected static final int STARTCOL = 1;


	/**
	 * Byte buffer filled from the wrapped stream
	 */
	private final byte[] m_yBuf = new byte[BUFFER_SIZE];


	/**
	 * Number of valid bytes in {@link #m_yBuf}
	 */
	private int m_nLimit;


	/**
	 * Current position in {@link #m_yBuf}
	 */
	private int m_nPos;


	/**
	 * Stores the column count for the current line
	 */
	protected int m_nCol;


	/**
	 * Stores the index in {@link #m_sBuf} that each column ends at
	 */
	protected int[] m_nColEnds;


	/**
	 * Characters of the current line with the delimiters removed
	 */
	protected StringBuilder m_sBuf = new StringBuilder(256);


	/**
	 * Number of lines consumed so far
	 */
	protected int m_nLineNumber;

	protected final char m_cDelimiter;


	/**
	 * Constructs a CsvReader for the given InputStream that splits columns on
	 * the given delimiter
	 *
	 * @param oInputStream InputStream of delimited text
	 * @param cDelimiter column delimiter
	 */
	public CsvReader(InputStream oInputStream, char cDelimiter)
	{
		super(oInputStream);
		m_nColEnds = new int[DEFAULT_COLS];
		m_cDelimiter = cDelimiter;
	}


	/**
	 * Constructs a comma delimited CsvReader for the given InputStream
	 *
	 * @param oInputStream InputStream of comma delimited text
	 */
	public CsvReader(InputStream oInputStream)
	{
		this(oInputStream, ',');
	}


	@Override
	public int read()
		throws IOException
	{
		if (m_nPos >= m_nLimit) // check for empty buffer
		{
			if ((m_nLimit = in.read(m_yBuf, 0, m_yBuf.length)) <= 0)
				return -1; // no bytes to read and/or read failed

			m_nPos = 0; // reset buffer read position
		}
		return ((int)m_yBuf[m_nPos++]) & 0xff;
	}


	/**
	 * Reads the next line of the stream into {@link #m_sBuf}
	 *
	 * @return the number of columns of the line, 0 at the end of the stream
	 * @throws IOException
	 */
	public int readLine()
		throws IOException
	{
		m_nCol = 0; // reset column index
		m_sBuf.setLength(0); // reset line buffer
		int nState = WHITESPACE;
		boolean bGo = true;
		boolean bRead = false;
		int nChar;
		while (bGo && (nChar = read()) >= 0)
		{
			bRead = true;
			if (nChar == m_cDelimiter)
			{
				addCol();
				nState = WHITESPACE;
			}
			else if (nChar == '\n') // end of a line acts as the end of a column as well
			{
				addCol();
				bGo = false;
			}
			else if (nChar >= ' ') // control characters, including carriage returns, are never stored
			{
				if (nState == STARTCOL || nChar > ' ')
				{
					nState = STARTCOL;
					m_sBuf.append((char)nChar);
				}
			}
		}

		if (bGo && bRead) // missing final newline
			addCol();

		if (bRead)
			++m_nLineNumber;

		return m_nCol;
	}


	/**
	 * Grows the column array if needed and stores the current index in
	 * {@link #m_nColEnds}
	 */
	private void addCol()
	{
		if (m_nCol == m_nColEnds.length) // extend column end array
		{
			int[] nColEnds = new int[m_nCol * 2];
			System.arraycopy(m_nColEnds, 0, nColEnds, 0, m_nCol);
			m_nColEnds = nColEnds;
		}
		m_nColEnds[m_nCol++] = m_sBuf.length();
	}


	/**
	 * Gets the 1-based number of the current line
	 * @return line number
	 */
	public int getLineNumber()
	{
		return m_nLineNumber;
	}


	/**
	 * Determines if the given column of the current line contains nothing but
	 * whitespace or does not exist.
	 *
	 * @param nCol column index to check
	 * @return true if the column has no contents, otherwise false
	 */
	public boolean isNull(int nCol)
	{
		return nCol >= m_nCol || parseString(nCol).isEmpty();
	}


	/**
	 * Parses the given column of the current line as a String with its
	 * trailing whitespace removed
	 *
	 * @param nCol column index to parse
	 * @return the trimmed column, or an empty String if the column doesn't exist
	 */
	public String parseString(int nCol)
	{
		if (nCol >= m_nCol)
			return "";

		int nStart = nCol == 0 ? 0 : m_nColEnds[nCol - 1];
		int nEnd = m_nColEnds[nCol];
		while (nEnd > nStart && m_sBuf.charAt(nEnd - 1) <= ' ')
			--nEnd;

		return m_sBuf.substring(nStart, nEnd);
	}


	/**
	 * Parses the given column of the current line as an integer. Malformed or
	 * missing columns do not throw, the default value is returned instead.
	 *
	 * @param nCol column index to parse
	 * @param nDefault value returned when the column cannot be parsed
	 * @return the parsed integer or the default value
	 */
	public int parseInt(int nCol, int nDefault)
	{
		return Text.parseInt(parseString(nCol), nDefault);
	}
}
