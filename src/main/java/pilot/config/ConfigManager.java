package pilot.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * ConfigManager handles multiple configuration sources and resolves their priorities.
 * Each configuration source has to implement ConfigSource and has to be registered
 * with registerPrimary() or registerFallback().
 *
 * There are two levels of keys: the configuration file (e.g. "config", "logging", "tiers",
 * "overrides") and the key inside it. Keys defined in files with the same name coming from
 * different sources are unified.
 *
 * Lookups are resolved at read time, so later changes in any source stay visible.
 */
public class ConfigManager implements ConfigSource {
	private Map<String, ConfigProperties> cfgStorage;

	/**
	 * Create a ConfigManager instance without any registered sources.
	 */
	public ConfigManager() {
		cfgStorage = new HashMap<>();
	}

	/**
	 * Register a configuration source with the highest priority, overwriting values
	 * coming from any previously registered sources.
	 *
	 * @param cfgSource
	 *            The new source to be registered.
	 */
	public void registerPrimary(final ConfigSource cfgSource) {
		registerSource(cfgSource, true);
	}

	/**
	 * Register a configuration source with the lowest priority, used only
	 * for keys not found in any of the previously registered sources.
	 *
	 * @param cfgSource
	 *            The new source to be registered.
	 */
	public void registerFallback(final ConfigSource cfgSource) {
		registerSource(cfgSource, false);
	}

	private void registerSource(final ConfigSource cfgSource, final boolean overwrite) {
		final Map<String, ConfigProperties> newConfiguration = cfgSource.getConfiguration();

		for (final Map.Entry<String, ConfigProperties> entry : newConfiguration.entrySet()) {
			final String name = entry.getKey();
			final ConfigProperties oldProp = cfgStorage.get(name);
			final ConfigProperties newProp = entry.getValue();

			cfgStorage.put(name, mergeProperties(oldProp, newProp, overwrite));
		}
	}

	@Override
	public Map<String, ConfigProperties> getConfiguration() {
		return cfgStorage;
	}

	/**
	 * Make the merged configuration read-only.
	 */
	public void makeReadonly() {
		for (final ConfigProperties prop : cfgStorage.values())
			prop.makeReadOnly();

		cfgStorage = Collections.unmodifiableMap(cfgStorage);
	}

	/**
	 * Chain the two sets of values. If both inputs are null, an empty object is created.
	 *
	 * If overwrite is set to false, then parameter a has precedence.
	 * If overwrite is set to true, then parameter b has precedence.
	 *
	 * @param a old (existing) configuration
	 * @param b new configuration
	 * @param overwrite true if the new configuration should have precedence
	 * @return the merged view
	 */
	public static ConfigProperties mergeProperties(final ConfigProperties a, final ConfigProperties b, final boolean overwrite) {
		if (a == null && b == null)
			return new ConfigProperties();

		if (b == null)
			return a;

		if (a == null)
			return b;

		if (a.isChain()) {
			a.addProvider(b, overwrite);
			return a;
		}

		final ConfigProperties tmp = new ConfigProperties();
		tmp.addProvider(a, false);
		tmp.addProvider(b, overwrite);
		return tmp;
	}

	/**
	 * Merge keeping the old configuration (parameter a) in front.
	 *
	 * @see #mergeProperties(ConfigProperties, ConfigProperties, boolean)
	 *
	 * @param a old (existing) configuration
	 * @param b new configuration
	 * @return the merged view
	 */
	public static ConfigProperties mergeProperties(final ConfigProperties a, final ConfigProperties b) {
		return mergeProperties(a, b, false);
	}
}
