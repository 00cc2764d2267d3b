package pilot.config;

import java.util.Map;

/**
 * Get a collection of properties files from arbitrary source.
 *
 * @see ConfigManager
 */
public interface ConfigSource {
	/**
	 * @return collection of properties files from this source, with their names
	 */
	public Map<String, ConfigProperties> getConfiguration();
}
