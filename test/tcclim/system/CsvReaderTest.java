package tcclim.system;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvReaderTest
{
	private static CsvReader reader(String sText)
	{
		return new CsvReader(new ByteArrayInputStream(sText.getBytes(StandardCharsets.UTF_8)));
	}


	@Test
	void splitsAndTrimsColumns()
		throws Exception
	{
		try (CsvReader oCsv = reader("WP, 01,  2025010100 ,, BEST\r\n"))
		{
			assertEquals(5, oCsv.readLine());
			assertEquals("WP", oCsv.parseString(0));
			assertEquals(1, oCsv.parseInt(1, -1));
			assertEquals("2025010100", oCsv.parseString(2));
			assertTrue(oCsv.isNull(3));
			assertFalse(oCsv.isNull(4));
			assertEquals("BEST", oCsv.parseString(4));
			assertEquals(0, oCsv.readLine());
		}
	}


	@Test
	void missingColumnsAndBadNumbers()
		throws Exception
	{
		try (CsvReader oCsv = reader("a, x1\n"))
		{
			oCsv.readLine();
			assertEquals(-999, oCsv.parseInt(1, -999));
			assertEquals("", oCsv.parseString(5));
			assertTrue(oCsv.isNull(5));
			assertEquals(-999, oCsv.parseInt(5, -999));
		}
	}


	@Test
	void lastLineWithoutNewline()
		throws Exception
	{
		try (CsvReader oCsv = reader("1,2\n3,4,5"))
		{
			assertEquals(2, oCsv.readLine());
			assertEquals(1, oCsv.getLineNumber());
			assertEquals(3, oCsv.readLine());
			assertEquals(5, oCsv.parseInt(2, 0));
			assertEquals(2, oCsv.getLineNumber());
			assertEquals(0, oCsv.readLine());
			assertEquals(2, oCsv.getLineNumber());
		}
	}


	@Test
	void bytesDecodeAsLatin1()
		throws Exception
	{
		try (CsvReader oCsv = reader("EP, 05, JOS\u00c9\n"))
		{
			assertEquals(3, oCsv.readLine());
			assertEquals("JOS\u00c3\u0089", oCsv.parseString(2));
			assertEquals("JOS\u00c9", new String(oCsv.parseString(2).getBytes(StandardCharsets.ISO_8859_1), StandardCharsets.UTF_8));
		}
	}
}
