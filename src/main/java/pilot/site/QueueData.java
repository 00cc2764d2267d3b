package pilot.site;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringTokenizer;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import pilot.config.ConfigUtils;

/**
 * The configuration record of one queue (the "queuedata"), as a free-text key/value mapping. Consumers only read named
 * fields; the only writers are the path normalization and the post-processing steps.
 *
 * @since Feb 2, 2017
 */
public class QueueData {
	static final Logger logger = ConfigUtils.getLogger(QueueData.class.getCanonicalName());

	/**
	 * Free-text directives (allow_alt_stageout, force_alt_stageout, ...)
	 */
	public static final String CATCHALL = "catchall";

	/**
	 * Storage element(s), comma separated, each optionally prefixed by <code>token:NAME:</code>
	 */
	public static final String SE = "se";

	/**
	 * Destination path(s) for analysis jobs
	 */
	public static final String SEPATH = "sepath";

	/**
	 * Destination path(s) for production jobs
	 */
	public static final String SEPRODPATH = "seprodpath";

	/**
	 * Catalog path for analysis jobs
	 */
	public static final String LFCPATH = "lfcpath";

	/**
	 * Catalog path for production jobs
	 */
	public static final String LFCPRODPATH = "lfcprodpath";

	/**
	 * Queue status (online, offline, test, brokeroff)
	 */
	public static final String STATUS = "status";

	/**
	 * Job recovery flag
	 */
	public static final String RETRY = "retry";

	/**
	 * Storage endpoint(s) of the queue, <code>local</code> for Tier-3 queues
	 */
	public static final String DDM = "ddm";

	/**
	 * Software directory
	 */
	public static final String APPDIR = "appdir";

	/**
	 * Copy tool for stage-out
	 */
	public static final String COPYTOOL = "copytool";

	/**
	 * Copy tool for stage-in
	 */
	public static final String COPYTOOLIN = "copytoolin";

	/**
	 * Container setup, e.g. "singularity:pilot"
	 */
	public static final String CONTAINER_TYPE = "container_type";

	/**
	 * Cloud the queue belongs to
	 */
	public static final String CLOUD = "cloud";

	/**
	 * Site the queue belongs to
	 */
	public static final String PANDA_RESOURCE = "panda_resource";

	private final String queueName;

	private final Map<String, String> fields = new ConcurrentHashMap<>();

	/**
	 * @param queueName
	 * @param initial field values, <code>null</code> values are skipped
	 */
	public QueueData(final String queueName, final Map<String, ?> initial) {
		this.queueName = queueName;

		if (initial != null)
			for (final Map.Entry<String, ?> entry : initial.entrySet())
				if (entry.getKey() != null && entry.getValue() != null)
					fields.put(entry.getKey(), flatten(entry.getValue()));
	}

	private static String flatten(final Object o) {
		if (o instanceof Collection) {
			final StringBuilder sb = new StringBuilder();

			for (final Object item : (Collection<?>) o) {
				if (sb.length() > 0)
					sb.append(',');

				sb.append(item);
			}

			return sb.toString();
		}

		return o.toString();
	}

	/**
	 * @param queueName
	 * @param json the queue's JSON object
	 * @return queue data
	 */
	@SuppressWarnings("unchecked")
	public static QueueData fromJSON(final String queueName, final JSONObject json) {
		return new QueueData(queueName, json);
	}

	/**
	 * Load the queue data from a JSON file. Both a bare record and a map of <code>queue name -&gt; record</code> are accepted.
	 *
	 * @param queueName
	 * @param f
	 * @return queue data
	 * @throws IOException if the file cannot be read or parsed, or the queue is missing from it
	 */
	public static QueueData load(final String queueName, final File f) throws IOException {
		try (Reader r = new FileReader(f)) {
			final Object o = new JSONParser().parse(r);

			if (!(o instanceof JSONObject))
				throw new IOException("Unexpected content in " + f.getAbsolutePath() + ", expecting a JSON object");

			final JSONObject json = (JSONObject) o;

			if (json.get(queueName) instanceof JSONObject)
				return fromJSON(queueName, (JSONObject) json.get(queueName));

			if (json.containsKey(SE) || json.containsKey(CATCHALL) || json.containsKey(DDM))
				return fromJSON(queueName, json);

			throw new IOException("Queue " + queueName + " not found in " + f.getAbsolutePath());
		}
		catch (final ParseException pe) {
			throw new IOException("Cannot parse " + f.getAbsolutePath(), pe);
		}
	}

	/**
	 * @return the queue name
	 */
	public String getQueueName() {
		return queueName;
	}

	/**
	 * @param key
	 * @return the trimmed value, or the empty string if the field is not set
	 */
	public String gets(final String key) {
		final String s = fields.get(key);

		return s != null ? s.trim() : "";
	}

	/**
	 * @param key
	 * @return <code>true</code> if the field is set
	 */
	public boolean has(final String key) {
		return fields.containsKey(key);
	}

	/**
	 * @param key
	 * @return the comma separated field split in its (trimmed, non-empty) tokens
	 */
	public List<String> getList(final String key) {
		final List<String> ret = new ArrayList<>();

		final StringTokenizer st = new StringTokenizer(gets(key), ",");

		while (st.hasMoreTokens()) {
			final String tok = st.nextToken().trim();

			if (!tok.isEmpty())
				ret.add(tok);
		}

		return ret;
	}

	/**
	 * Replace the value of a field
	 *
	 * @param key
	 * @param value new value, <code>null</code> removes the field
	 * @return the previous value
	 */
	public String replace(final String key, final String value) {
		final String old = value != null ? fields.put(key, value) : fields.remove(key);

		if (logger.isLoggable(Level.FINE))
			logger.log(Level.FINE, "Queue " + queueName + ": field " + key + " changed from `" + old + "` to `" + value + "`");

		return old;
	}

	/**
	 * @return a snapshot of all fields
	 */
	public Map<String, String> asMap() {
		return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
	}

	@Override
	public String toString() {
		return queueName + fields;
	}
}
