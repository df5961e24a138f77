package tcclim.system;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Layered JSON configuration. The defaults packaged on the classpath in
 * {@link #DEFAULT_RESOURCE} are loaded first, then the file named by the
 * {@link #OVERRIDE_PROPERTY} system property overwrites any keys it defines.
 * Any configuration can name further files to overlay with the
 * {@link #EXTRA_CONFIGS} array.
 * <p>
 * This is a singleton class whose instance can be retrieved by the
 * {@link Config#getInstance()} method.
 * </p>
 * @author aaron.cherney
 */
public class Config
{
	private static final Logger LOGGER = LogManager.getLogger(Config.class);


	/**
	 * Classpath resource containing the default configuration
	 */
	public static final String DEFAULT_RESOURCE = "/tcclim.json";


	/**
	 * System property that can name a configuration file on disk
	 */
	public static final String OVERRIDE_PROPERTY = "tcclim.config";


	/**
	 * Key of the formal advisory only read option
	 */
	public static final String FORMAL_ADVISORY = "formaladvisory";


	/**
	 * Key of the tropical nature only read option
	 */
	public static final String TROPICAL_NATURE = "tropicalnature";


	/**
	 * Key of the buffer, in degrees, applied to polygons when selecting track
	 * points
	 */
	public static final String BBOX_TOL = "bboxtol";


	/**
	 * Key of the array of further configuration files to overlay
	 */
	public static final String EXTRA_CONFIGS = "extraconfigs";


	private static final Config g_oInstance = new Config();


	/**
	 * Merged configuration values
	 */
	private final JSONObject m_oConfig;


	/**
	 * Loads the default and override configurations.
	 */
	private Config()
	{
		m_oConfig = new JSONObject();
		try (InputStream oIn = Config.class.getResourceAsStream(DEFAULT_RESOURCE))
		{
			if (oIn != null)
				overwrite(m_oConfig, read(oIn));
			else
				LOGGER.warn(String.format("Default configuration %s not found", DEFAULT_RESOURCE));
		}
		catch (IOException oEx)
		{
			LOGGER.error(String.format("Failed to load configuration %s", DEFAULT_RESOURCE), oEx);
		}

		String sOverride = System.getProperty(OVERRIDE_PROPERTY);
		if (sOverride != null)
		{
			try
			{
				load(m_oConfig, Paths.get(sOverride));
			}
			catch (IOException oEx)
			{
				LOGGER.error(String.format("Failed to load configuration %s", sOverride), oEx);
			}
		}
	}


	/**
	 * Creates a configuration from the given values, used when a caller
	 * wants settings independent of the system configuration.
	 * @param oConfig configuration values
	 */
	public Config(JSONObject oConfig)
	{
		m_oConfig = new JSONObject(oConfig.toString());
	}


	/**
	 * Gets the singleton instance of Config
	 * @return the singleton instance
	 */
	public static Config getInstance()
	{
		return g_oInstance;
	}


	/**
	 * Reads the given configuration file, and any files it lists in
	 * "extraconfigs", overwriting the keys of the given object.
	 *
	 * @param oConfigObj configuration to overwrite
	 * @param oFile configuration file
	 * @throws IOException
	 */
	public static void load(JSONObject oConfigObj, Path oFile)
		throws IOException
	{
		ArrayList<Path> oLoaded = new ArrayList();
		load(oConfigObj, oFile, oLoaded);
	}


	private static void load(JSONObject oConfigObj, Path oFile, ArrayList<Path> oLoaded)
		throws IOException
	{
		Path oNormal = oFile.toAbsolutePath().normalize();
		if (oLoaded.contains(oNormal)) // configuration files can reference each other
			return;
		oLoaded.add(oNormal);

		if (!Files.exists(oFile))
		{
			LOGGER.warn(String.format("Configuration %s does not exist", oFile));
			return;
		}

		JSONObject oOverWrite;
		try (InputStream oIn = Files.newInputStream(oFile))
		{
			oOverWrite = read(oIn);
		}
		overwrite(oConfigObj, oOverWrite);

		for (String sExtra : getExtraConfigs(oOverWrite))
		{
			Path oExtra = Paths.get(sExtra);
			if (!oExtra.isAbsolute() && oFile.getParent() != null)
				oExtra = oFile.getParent().resolve(oExtra);
			load(oConfigObj, oExtra, oLoaded);
		}
	}


	/**
	 * @return the paths listed in the "extraconfigs" array, empty if there is
	 * no such array
	 */
	private static String[] getExtraConfigs(JSONObject oConfigObj)
	{
		JSONArray oArr = oConfigObj.optJSONArray(EXTRA_CONFIGS);
		if (oArr == null)
			return new String[0];

		String[] sPaths = new String[oArr.length()];
		for (int nIndex = 0; nIndex < sPaths.length; nIndex++)
			sPaths[nIndex] = oArr.getString(nIndex);

		return sPaths;
	}


	private static JSONObject read(InputStream oIn)
		throws IOException
	{
		try (BufferedReader oReader = new BufferedReader(new InputStreamReader(oIn, StandardCharsets.UTF_8)))
		{
			return new JSONObject(new JSONTokener(oReader));
		}
	}


	private static void overwrite(JSONObject oConfigObj, JSONObject oOverWrite)
	{
		for (String sKey : oOverWrite.keySet())
			oConfigObj.put(sKey, oOverWrite.get(sKey));
	}


	public boolean optBoolean(String sKey, boolean bDefault)
	{
		return m_oConfig.optBoolean(sKey, bDefault);
	}


	public double optDouble(String sKey, double dDefault)
	{
		return m_oConfig.optDouble(sKey, dDefault);
	}


	public String optString(String sKey, String sDefault)
	{
		return m_oConfig.optString(sKey, sDefault);
	}


	/**
	 * Gets the buffer in degrees applied to selection polygons
	 * @return polygon buffer, defaults to 0.01 degrees
	 */
	public double getBboxTolerance()
	{
		return optDouble(BBOX_TOL, 0.01);
	}
}
