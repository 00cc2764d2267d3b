package pilot.site.tiers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.StringTokenizer;

/**
 * The few attributes of a catalog queue that the failover resolution needs
 */
public class QueueInfo {
	/**
	 * Queue name
	 */
	public final String name;

	/**
	 * Site (PanDA resource) the queue serves
	 */
	public final String pandaResource;

	/**
	 * Cloud of the queue
	 */
	public final String cloud;

	/**
	 * Storage endpoints of the queue
	 */
	public final List<String> ddm;

	/**
	 * @param name
	 * @param pandaResource
	 * @param cloud
	 * @param ddm
	 */
	public QueueInfo(final String name, final String pandaResource, final String cloud, final List<String> ddm) {
		this.name = name;
		this.pandaResource = pandaResource;
		this.cloud = cloud;
		this.ddm = ddm != null ? Collections.unmodifiableList(new ArrayList<>(ddm)) : Collections.emptyList();
	}

	/**
	 * @param name queue name
	 * @param m the catalog record
	 * @return the queue attributes
	 */
	static QueueInfo fromMap(final String name, final Map<?, ?> m) {
		final Object resource = m.get("panda_resource");
		final Object cloud = m.get("cloud");

		return new QueueInfo(name, resource != null ? resource.toString() : null, cloud != null ? cloud.toString() : null, splitEndpoints(m.get("ddm")));
	}

	/**
	 * The endpoint list comes either as a JSON array or as a comma separated string
	 *
	 * @param o
	 * @return the endpoints
	 */
	static List<String> splitEndpoints(final Object o) {
		final List<String> ret = new ArrayList<>();

		if (o instanceof Collection) {
			for (final Object item : (Collection<?>) o)
				if (item != null && !item.toString().trim().isEmpty())
					ret.add(item.toString().trim());
		}
		else if (o != null) {
			final StringTokenizer st = new StringTokenizer(o.toString(), ", ");

			while (st.hasMoreTokens())
				ret.add(st.nextToken());
		}

		return ret;
	}

	@Override
	public String toString() {
		return name + " (resource=" + pandaResource + ", cloud=" + cloud + ", ddm=" + ddm + ")";
	}
}
