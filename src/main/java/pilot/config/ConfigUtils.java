package pilot.config;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point to the pilot configuration: merged view of the builtin defaults, the configuration folders, the
 * environment and the system properties. Also the place where the loggers come from.
 *
 * @since Oct 3, 2018
 */
public class ConfigUtils {
	private static Logger logger;

	private static Map<String, ConfigProperties> otherConfigFiles;

	private static ConfigProperties fileConfig;

	private static LoggingConfigurator logging = null;

	static {
		final ConfigManager cfgManager = new ConfigManager();
		cfgManager.registerFallback(new BuiltinConfiguration());
		cfgManager.registerPrimary(new ConfigurationFolders());
		cfgManager.registerPrimary(new SystemConfiguration());

		init(cfgManager);
	}

	/**
	 * Replace the configuration with the content of the given manager. Tests can use it to inject values.
	 *
	 * @param m
	 */
	public static synchronized void init(final ConfigManager m) {
		otherConfigFiles = m.getConfiguration();

		fileConfig = otherConfigFiles.get("config");

		if (fileConfig == null)
			fileConfig = new ConfigProperties();

		if (fileConfig.getb("pilot.configure.logging", true) && otherConfigFiles.containsKey("logging"))
			logging = new LoggingConfigurator(otherConfigFiles.get("logging"));

		logger = ConfigUtils.getLogger(ConfigUtils.class.getCanonicalName());

		if (logger.isLoggable(Level.FINE))
			logger.log(Level.FINE, "Configuration loaded. Own logging configuration: " + (logging != null ? "true" : "false"));
	}

	/**
	 * @return the main configuration ("config")
	 */
	public static final ConfigProperties getConfig() {
		return fileConfig;
	}

	/**
	 * @param key name of the configuration file, e.g. "tiers" or "overrides"
	 * @return the content of that file, never <code>null</code>
	 */
	public static final ConfigProperties getConfiguration(final String key) {
		final ConfigProperties p = otherConfigFiles.get(key.toLowerCase());

		return p != null ? p : new ConfigProperties();
	}

	/**
	 * Push the logging configuration into the JDK LogManager
	 */
	static class LoggingConfigurator {
		/**
		 * Logging configuration content, usually loaded from "logging.properties"
		 */
		final ConfigProperties prop;

		/**
		 * @param p
		 */
		LoggingConfigurator(final ConfigProperties p) {
			prop = p;

			final ByteArrayOutputStream baos = new ByteArrayOutputStream();

			try {
				prop.getProperties().store(baos, "Pilot logging properties");
				LogManager.getLogManager().readConfiguration(new ByteArrayInputStream(baos.toByteArray()));
			}
			catch (final Throwable t) {
				System.err.println("Cannot load the logging configuration into LogManager");
				t.printStackTrace();
			}
		}
	}

	/**
	 * Get the logger for this component
	 *
	 * @param component
	 * @return the logger
	 */
	public static Logger getLogger(final String component) {
		return Logger.getLogger(component);
	}
}
