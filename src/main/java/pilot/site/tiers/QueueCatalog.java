package pilot.site.tiers;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.json.simple.JSONObject;

import pilot.config.ConfigUtils;
import pilot.site.QueueData;

/**
 * The full queue catalog, loaded on first use and kept for the lifetime of the process. Concurrent readers are safe once
 * it is loaded. A failed load is logged and seen as an empty catalog, the next call tries again.
 *
 * @since Nov 17, 2016
 */
public class QueueCatalog {
	static final Logger logger = ConfigUtils.getLogger(QueueCatalog.class.getCanonicalName());

	private final QueueCatalogSource source;

	private volatile Map<String, QueueInfo> queues = null;

	private volatile Map<String, Map<?, ?>> records = null;

	/**
	 * @param source
	 */
	public QueueCatalog(final QueueCatalogSource source) {
		this.source = source;
	}

	/**
	 * @return all queues, by name. Empty if the catalog cannot be loaded.
	 */
	public Map<String, QueueInfo> getQueues() {
		Map<String, QueueInfo> ret = queues;

		if (ret != null)
			return ret;

		synchronized (this) {
			if (queues != null)
				return queues;

			try {
				final JSONObject json = source.load();

				records = raw(json);
				queues = ret = parse(json);

				logger.log(Level.INFO, "Loaded " + ret.size() + " queues from " + source);
			}
			catch (final IOException ioe) {
				logger.log(Level.WARNING, "Could not load the queue catalog from " + source, ioe);
				return Collections.emptyMap();
			}
		}

		return ret;
	}

	private static Map<String, Map<?, ?>> raw(final JSONObject json) {
		final Map<String, Map<?, ?>> tmp = new LinkedHashMap<>();

		for (final Object o : json.entrySet()) {
			final Map.Entry<?, ?> entry = (Map.Entry<?, ?>) o;

			if (entry.getValue() instanceof Map)
				tmp.put(entry.getKey().toString(), (Map<?, ?>) entry.getValue());
		}

		return Collections.unmodifiableMap(tmp);
	}

	private static Map<String, QueueInfo> parse(final JSONObject json) {
		final Map<String, QueueInfo> tmp = new LinkedHashMap<>();

		for (final Object o : json.entrySet()) {
			final Map.Entry<?, ?> entry = (Map.Entry<?, ?>) o;

			if (entry.getValue() instanceof Map)
				tmp.put(entry.getKey().toString(), QueueInfo.fromMap(entry.getKey().toString(), (Map<?, ?>) entry.getValue()));
		}

		return Collections.unmodifiableMap(tmp);
	}

	/**
	 * @param name
	 * @return the queue, or <code>null</code> if unknown
	 */
	public QueueInfo get(final String name) {
		return getQueues().get(name);
	}

	/**
	 * @param name
	 * @return the complete configuration record of the queue, or <code>null</code> if the queue is unknown
	 */
	public QueueData getQueueData(final String name) {
		getQueues();

		final Map<String, Map<?, ?>> r = records;

		if (r == null || name == null)
			return null;

		final Map<?, ?> record = r.get(name);

		if (record == null)
			return null;

		final Map<String, Object> fields = new LinkedHashMap<>();

		for (final Map.Entry<?, ?> entry : record.entrySet())
			fields.put(entry.getKey().toString(), entry.getValue());

		return new QueueData(name, fields);
	}

	/**
	 * Find the queue serving a given site
	 *
	 * @param pandaSiteID
	 * @return queue name, empty string if none found
	 */
	public String getQueueForResource(final String pandaSiteID) {
		if (pandaSiteID == null || pandaSiteID.isEmpty())
			return "";

		for (final QueueInfo q : getQueues().values())
			if (pandaSiteID.equals(q.pandaResource))
				return q.name;

		return "";
	}

	/**
	 * Find the cloud where an endpoint exists, by scanning all queues' endpoint lists
	 *
	 * @param ddm
	 * @return the cloud, empty string if the endpoint is not used by any queue
	 */
	public String getCorrespondingCloud(final String ddm) {
		for (final QueueInfo q : getQueues().values())
			if (q.ddm.contains(ddm) && q.cloud != null) {
				logger.log(Level.FINE, "Found cloud=" + q.cloud + " for ddm=" + ddm + " at queuename=" + q.name);
				return q.cloud;
			}

		return "";
	}
}
