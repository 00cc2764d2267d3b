package pilot.se;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import pilot.config.ConfigUtils;

/**
 * The known storage endpoints, loaded once from the endpoints document and read-only afterwards
 *
 * @since Mar 3, 2017
 */
public class DDMEndpoints {
	static final Logger logger = ConfigUtils.getLogger(DDMEndpoints.class.getCanonicalName());

	private final Map<String, DDMEndpoint> endpoints;

	/**
	 * @param endpoints
	 */
	public DDMEndpoints(final Collection<DDMEndpoint> endpoints) {
		final Map<String, DDMEndpoint> tmp = new TreeMap<>();

		for (final DDMEndpoint e : endpoints)
			tmp.put(e.name, e);

		this.endpoints = Collections.unmodifiableMap(tmp);
	}

	/**
	 * Parse the endpoints document. Both the dictionary form (<code>name -&gt; record</code>) and the list form are accepted.
	 *
	 * @param f
	 * @return the endpoints
	 * @throws IOException
	 */
	public static DDMEndpoints load(final File f) throws IOException {
		try (Reader r = new FileReader(f)) {
			return parse(new JSONParser().parse(r));
		}
		catch (final ParseException pe) {
			throw new IOException("Cannot parse the endpoints document " + f.getAbsolutePath(), pe);
		}
	}

	/**
	 * @param json parsed content
	 * @return the endpoints
	 * @throws IOException if the content is not one of the known layouts
	 */
	static DDMEndpoints parse(final Object json) throws IOException {
		final Map<String, DDMEndpoint> tmp = new TreeMap<>();

		if (json instanceof JSONObject) {
			for (final Object o : ((JSONObject) json).entrySet()) {
				final Map.Entry<?, ?> entry = (Map.Entry<?, ?>) o;

				if (entry.getValue() instanceof Map) {
					final DDMEndpoint e = DDMEndpoint.fromMap(entry.getKey().toString(), (Map<?, ?>) entry.getValue());
					tmp.put(e.name, e);
				}
			}
		}
		else if (json instanceof JSONArray) {
			for (final Object o : (JSONArray) json)
				if (o instanceof Map) {
					final Map<?, ?> m = (Map<?, ?>) o;

					if (m.get("name") == null) {
						logger.log(Level.WARNING, "Skipping endpoint record without a name: " + m);
						continue;
					}

					final DDMEndpoint e = DDMEndpoint.fromMap(m.get("name").toString(), m);
					tmp.put(e.name, e);
				}
		}
		else
			throw new IOException("Unexpected endpoints document layout: " + (json != null ? json.getClass().getSimpleName() : "null"));

		logger.log(Level.FINE, "Loaded " + tmp.size() + " storage endpoints");

		return new DDMEndpoints(tmp.values());
	}

	/**
	 * @param name
	 * @return the endpoint, or <code>null</code> if unknown
	 */
	public DDMEndpoint get(final String name) {
		return name != null ? endpoints.get(name) : null;
	}

	/**
	 * Unknown endpoints are considered deterministic, this is the layout of all the modern storages
	 *
	 * @param name
	 * @return <code>true</code> if the physical path at that endpoint is computable from the logical name
	 */
	public boolean isDeterministic(final String name) {
		final DDMEndpoint e = get(name);

		if (e == null) {
			logger.log(Level.FINE, "Endpoint " + name + " is not known, assuming it is deterministic");
			return true;
		}

		return e.deterministic;
	}

	/**
	 * @param name
	 * @return <code>true</code> if the endpoint is known to be an object store
	 */
	public boolean isObjectstore(final String name) {
		final DDMEndpoint e = get(name);

		return e != null && e.objectstore;
	}

	/**
	 * @return all endpoints, sorted by name
	 */
	public Collection<DDMEndpoint> getAll() {
		return endpoints.values();
	}
}
