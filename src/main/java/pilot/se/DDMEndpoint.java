package pilot.se;

import java.io.Serializable;
import java.util.Map;

/**
 * One storage endpoint (RSE) of the federation
 *
 * @since Mar 3, 2017
 */
public class DDMEndpoint implements Serializable, Comparable<DDMEndpoint> {

	private static final long serialVersionUID = -1417312296541920775L;

	/**
	 * Endpoint name, e.g. CERN-PROD_DATADISK
	 */
	public final String name;

	/**
	 * Site the endpoint belongs to
	 */
	public final String site;

	/**
	 * Cloud the endpoint belongs to
	 */
	public final String cloud;

	/**
	 * Endpoint type, e.g. DATADISK, OS_ES
	 */
	public final String type;

	/**
	 * Space token
	 */
	public final String token;

	/**
	 * <code>true</code> if physical paths are computable from (scope, lfn) alone
	 */
	public final boolean deterministic;

	/**
	 * <code>true</code> for object stores
	 */
	public final boolean objectstore;

	/**
	 * @param name
	 * @param site
	 * @param cloud
	 * @param type
	 * @param token
	 * @param deterministic
	 * @param objectstore
	 */
	public DDMEndpoint(final String name, final String site, final String cloud, final String type, final String token, final boolean deterministic, final boolean objectstore) {
		this.name = name;
		this.site = site;
		this.cloud = cloud;
		this.type = type;
		this.token = token;
		this.deterministic = deterministic;
		this.objectstore = objectstore;
	}

	/**
	 * @param name endpoint name, used when the record has no "name" field
	 * @param m the JSON record of the endpoint
	 * @return the endpoint
	 */
	static DDMEndpoint fromMap(final String name, final Map<?, ?> m) {
		final String type = getString(m, "type");

		final boolean objectstore = getBoolean(m, "is_objectstore", false) || (type != null && type.toUpperCase().startsWith("OS_"));

		final String ownName = getString(m, "name");

		return new DDMEndpoint(ownName != null ? ownName : name, getString(m, "site"), getString(m, "cloud"), type, getString(m, "token"), getBoolean(m, "is_deterministic", true), objectstore);
	}

	private static String getString(final Map<?, ?> m, final String key) {
		final Object o = m.get(key);

		return o != null ? o.toString() : null;
	}

	private static boolean getBoolean(final Map<?, ?> m, final String key, final boolean defaultValue) {
		final Object o = m.get(key);

		if (o == null)
			return defaultValue;

		if (o instanceof Boolean)
			return ((Boolean) o).booleanValue();

		final String s = o.toString().trim().toLowerCase();

		return s.equals("true") || s.equals("1") || s.equals("yes");
	}

	@Override
	public int compareTo(final DDMEndpoint o) {
		return name.compareTo(o.name);
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof DDMEndpoint))
			return false;

		return name.equals(((DDMEndpoint) obj).name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public String toString() {
		return name + (deterministic ? "" : " (non-deterministic)") + (objectstore ? " (objectstore)" : "");
	}
}
