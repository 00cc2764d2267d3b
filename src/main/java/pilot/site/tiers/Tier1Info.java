package pilot.site.tiers;

/**
 * Tier-1 of a cloud: the site, and optionally a backup queue
 */
public class Tier1Info {
	/**
	 * Tier-1 site identifier (PanDA resource)
	 */
	public final String site;

	/**
	 * Backup queue name, can be empty
	 */
	public final String backupQueue;

	/**
	 * @param site
	 * @param backupQueue
	 */
	public Tier1Info(final String site, final String backupQueue) {
		if (site == null || site.isEmpty())
			throw new IllegalArgumentException("A Tier-1 needs a site name");

		this.site = site;
		this.backupQueue = backupQueue != null ? backupQueue : "";
	}

	/**
	 * @param name
	 * @return <code>true</code> if the name is either the site or the backup queue
	 */
	public boolean matches(final String name) {
		return name != null && !name.isEmpty() && (site.equals(name) || backupQueue.equals(name));
	}

	@Override
	public String toString() {
		return backupQueue.isEmpty() ? site : site + " / " + backupQueue;
	}
}
