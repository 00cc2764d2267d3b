package pilot.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Load the environment and the system properties (command line flags) as if they were
 * defined in a properties file named "config".
 */
public class SystemConfiguration implements ConfigSource {
	@Override
	public Map<String, ConfigProperties> getConfiguration() {
		final Map<String, ConfigProperties> tmp = new HashMap<>();

		final ConfigProperties systemValues = new ConfigProperties(System.getenv());

		for (final Map.Entry<Object, Object> entry : System.getProperties().entrySet())
			systemValues.set(entry.getKey().toString(), entry.getValue().toString());

		tmp.put("config", systemValues);

		return tmp;
	}
}
