package pilot.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Key/value configuration content. An instance either holds its own values or chains other instances
 * (providers), looked up in order at read time so that changes in any of them are visible immediately.
 *
 * @since Oct 3, 2018
 */
public class ConfigProperties {
	private final Map<String, String> values = new ConcurrentHashMap<>();

	private final List<ConfigProperties> providers = new CopyOnWriteArrayList<>();

	private volatile boolean readOnly = false;

	/**
	 * Empty set of values
	 */
	public ConfigProperties() {
		// nothing to load
	}

	/**
	 * @param is stream in <code>.properties</code> format
	 * @throws IOException
	 */
	public ConfigProperties(final InputStream is) throws IOException {
		final Properties p = new Properties();
		p.load(is);

		for (final String key : p.stringPropertyNames())
			values.put(key, p.getProperty(key));
	}

	/**
	 * @param initial values to copy, <code>null</code> values are skipped
	 */
	public ConfigProperties(final Map<String, ?> initial) {
		if (initial != null)
			for (final Map.Entry<String, ?> entry : initial.entrySet())
				if (entry.getKey() != null && entry.getValue() != null)
					values.put(entry.getKey(), entry.getValue().toString());
	}

	/**
	 * @param provider another set of values to chain after the existing ones
	 * @param overwrite if <code>true</code> the new provider takes precedence over all the existing ones
	 */
	public void addProvider(final ConfigProperties provider, final boolean overwrite) {
		if (provider == null || provider == this)
			return;

		if (overwrite)
			providers.add(0, provider);
		else
			providers.add(provider);
	}

	/**
	 * @return <code>true</code> if this object only chains other providers
	 */
	boolean isChain() {
		return !providers.isEmpty() && values.isEmpty();
	}

	private String lookup(final String key) {
		final String own = values.get(key);

		if (own != null)
			return own;

		for (final ConfigProperties p : providers) {
			final String s = p.lookup(key);

			if (s != null)
				return s;
		}

		return null;
	}

	/**
	 * @param key
	 * @return <code>true</code> if the key is defined here or in any chained provider
	 */
	public boolean containsKey(final String key) {
		return lookup(key) != null;
	}

	/**
	 * @param key
	 * @return value, or the empty string if missing
	 */
	public String gets(final String key) {
		return gets(key, "");
	}

	/**
	 * @param key
	 * @param defaultValue
	 * @return the trimmed value of the key, or the default if it is not defined
	 */
	public String gets(final String key, final String defaultValue) {
		final String s = lookup(key);

		if (s == null)
			return defaultValue;

		return s.trim();
	}

	/**
	 * @param key
	 * @param defaultValue
	 * @return integer value of the key, default if missing or not a number
	 */
	public int geti(final String key, final int defaultValue) {
		final String s = gets(key, null);

		if (s == null || s.isEmpty())
			return defaultValue;

		try {
			return Integer.parseInt(s);
		}
		catch (@SuppressWarnings("unused") final NumberFormatException nfe) {
			return defaultValue;
		}
	}

	/**
	 * @param key
	 * @param defaultValue
	 * @return long value of the key, default if missing or not a number
	 */
	public long getl(final String key, final long defaultValue) {
		final String s = gets(key, null);

		if (s == null || s.isEmpty())
			return defaultValue;

		try {
			return Long.parseLong(s);
		}
		catch (@SuppressWarnings("unused") final NumberFormatException nfe) {
			return defaultValue;
		}
	}

	/**
	 * @param key
	 * @param defaultValue
	 * @return boolean value of the key (true/yes/1/on), default if missing
	 */
	public boolean getb(final String key, final boolean defaultValue) {
		final String s = gets(key, null);

		if (s == null || s.isEmpty())
			return defaultValue;

		final char c = Character.toLowerCase(s.charAt(0));

		if (c == 't' || c == 'y' || c == '1')
			return true;

		if (c == 'f' || c == 'n' || c == '0')
			return false;

		return s.equalsIgnoreCase("on") ? true : s.equalsIgnoreCase("off") ? false : defaultValue;
	}

	/**
	 * @param key
	 * @param value new value, <code>null</code> to remove the key
	 */
	public void set(final String key, final String value) {
		if (readOnly)
			throw new IllegalStateException("Configuration is read-only, cannot set " + key);

		if (value == null)
			values.remove(key);
		else
			values.put(key, value);
	}

	/**
	 * Prevent further changes through {@link #set(String, String)}
	 */
	public void makeReadOnly() {
		readOnly = true;

		for (final ConfigProperties p : providers)
			p.makeReadOnly();
	}

	/**
	 * @return all the keys visible through this object
	 */
	public Set<String> keySet() {
		final Set<String> ret = new TreeSet<>(values.keySet());

		for (final ConfigProperties p : providers)
			ret.addAll(p.keySet());

		return ret;
	}

	/**
	 * @return a flattened copy as {@link Properties}
	 */
	public Properties getProperties() {
		final Properties p = new Properties();

		for (final String key : keySet())
			p.setProperty(key, lookup(key));

		return p;
	}

	@Override
	public String toString() {
		return getProperties().toString();
	}
}
