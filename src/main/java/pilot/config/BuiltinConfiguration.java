package pilot.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Defaults shipped in the jar, under <code>config/&lt;name&gt;.properties</code>
 */
public class BuiltinConfiguration implements ConfigSource {
	/**
	 * Configuration files that the pilot knows about
	 */
	static final String[] KNOWN_FILES = { "config", "logging", "tiers", "overrides" };

	@Override
	public Map<String, ConfigProperties> getConfiguration() {
		final Map<String, ConfigProperties> tmpProperties = new HashMap<>();

		for (final String name : KNOWN_FILES)
			try (InputStream is = BuiltinConfiguration.class.getClassLoader().getResourceAsStream("config/" + name + ".properties")) {
				if (is != null)
					tmpProperties.put(name, new ConfigProperties(is));
			}
			catch (final IOException ioe) {
				// the logging is not configured yet at this point, the root logger is all there is
				Logger.getLogger(BuiltinConfiguration.class.getCanonicalName()).log(Level.WARNING, "Cannot load the builtin " + name + ".properties", ioe);
			}

		return tmpProperties;
	}
}
