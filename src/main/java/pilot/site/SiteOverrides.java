package pilot.site;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import pilot.config.ConfigProperties;
import pilot.config.ConfigUtils;

/**
 * Per-site corrections of the queue data, as <code>SITE.field=value</code> entries of the "overrides" configuration
 *
 * @since Jan 19, 2017
 */
public class SiteOverrides {
	static final Logger logger = ConfigUtils.getLogger(SiteOverrides.class.getCanonicalName());

	private final Map<String, Map<String, String>> overrides;

	/**
	 * @param overrides site name -&gt; (field -&gt; value)
	 */
	public SiteOverrides(final Map<String, Map<String, String>> overrides) {
		final Map<String, Map<String, String>> tmp = new TreeMap<>();

		for (final Map.Entry<String, Map<String, String>> entry : overrides.entrySet())
			tmp.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));

		this.overrides = Collections.unmodifiableMap(tmp);
	}

	/**
	 * @param config the content of the "overrides" configuration
	 * @return the parsed table; keys without a <code>.</code> are ignored
	 */
	public static SiteOverrides fromConfiguration(final ConfigProperties config) {
		final Map<String, Map<String, String>> tmp = new TreeMap<>();

		for (final String key : config.keySet()) {
			final int idx = key.lastIndexOf('.');

			if (idx <= 0 || idx == key.length() - 1) {
				logger.log(Level.WARNING, "Ignoring malformed override key `" + key + "`, expecting SITE.field");
				continue;
			}

			tmp.computeIfAbsent(key.substring(0, idx), k -> new LinkedHashMap<>()).put(key.substring(idx + 1), config.gets(key));
		}

		return new SiteOverrides(tmp);
	}

	/**
	 * @param siteName
	 * @return the fields to override for this site, empty if none
	 */
	public Map<String, String> getOverrides(final String siteName) {
		final Map<String, String> ret = siteName != null ? overrides.get(siteName) : null;

		return ret != null ? ret : Collections.emptyMap();
	}

	/**
	 * @param queueData
	 * @param siteName
	 * @return how many fields were replaced
	 */
	public int apply(final QueueData queueData, final String siteName) {
		final Map<String, String> fields = getOverrides(siteName);

		for (final Map.Entry<String, String> entry : fields.entrySet()) {
			queueData.replace(entry.getKey(), entry.getValue());
			logger.log(Level.INFO, "Site " + siteName + ": overriding " + entry.getKey() + " = " + entry.getValue());
		}

		return fields.size();
	}

	@Override
	public String toString() {
		return overrides.toString();
	}
}
