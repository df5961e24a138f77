package tcclim.collect;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reader for one BDeck file on disk. The file must be opened with
 * {@link #open()} before it is read.
 * @author aaron.cherney
 */
public class BDeckFile implements Closeable
{
	private static final Logger LOGGER = LogManager.getLogger(BDeckFile.class);

	private final Path m_oPath;

	private InputStream m_oIn;

	private BDeckData m_oData;

	private boolean m_bFullyRead = false;


	public BDeckFile(Path oPath)
	{
		m_oPath = oPath;
	}


	/**
	 * Opens the file for reading. Does nothing if it is already open.
	 * @throws IOException
	 */
	public void open()
		throws IOException
	{
		if (m_oIn == null)
			m_oIn = Files.newInputStream(m_oPath);
	}


	public boolean isOpen()
	{
		return m_oIn != null;
	}


	/**
	 * Reads every record of the file. Once the file has been fully read the
	 * same data is returned until {@link #clear()} is called.
	 *
	 * @param oOptions read filters
	 * @return the records and metadata of the file
	 * @throws IllegalStateException if the file has not been opened
	 * @throws IOException
	 */
	public BDeckData readAll(ReadOptions oOptions)
		throws IOException
	{
		if (m_oIn == null)
			throw new IllegalStateException(String.format("%s has not been opened", m_oPath));

		if (!m_bFullyRead)
		{
			LOGGER.debug(String.format("Reading %s with %s", m_oPath, oOptions));
			m_oData = BDeckParser.parse(m_oIn, oOptions);
			m_bFullyRead = true;
		}
		return m_oData;
	}


	/**
	 * Moves back to the start of the file so it can be read again.
	 * @throws IOException
	 */
	public void reset()
		throws IOException
	{
		if (m_oIn != null)
		{
			m_oIn.close();
			m_oIn = Files.newInputStream(m_oPath);
		}
	}


	/**
	 * Discards the data already read and moves back to the start of the file.
	 * @throws IOException
	 */
	public void clear()
		throws IOException
	{
		m_oData = null;
		m_bFullyRead = false;
		reset();
	}


	@Override
	public void close()
		throws IOException
	{
		if (m_oIn != null)
		{
			m_oIn.close();
			m_oIn = null;
		}
	}


	public boolean isFullyRead()
	{
		return m_bFullyRead;
	}


	/**
	 * @return the data read so far, null before {@link #readAll(tcclim.collect.ReadOptions)}
	 */
	public BDeckData getData()
	{
		return m_oData;
	}
}
