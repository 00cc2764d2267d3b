package pilot.site.tiers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import pilot.config.ConfigProperties;
import pilot.config.ConfigUtils;
import pilot.site.QueueData;

/**
 * Role of sites in the storage federation (Tier-1 / 2 / 3) and resolution of the Tier-1 queue that receives the
 * alternative stage-out of a cloud.
 *
 * @since Nov 17, 2016
 */
public class TierRegistry {
	static final Logger logger = ConfigUtils.getLogger(TierRegistry.class.getCanonicalName());

	/**
	 * Cloud value meaning "any cloud", the storage token has to tell where the data goes
	 */
	public static final String WORLD = "WORLD";

	/**
	 * Prefix of the storage token fragment naming the destination endpoint
	 */
	public static final String DESTINATION_PREFIX = "dst:";

	private static final Map<String, Tier1Info> DEFAULT_TIER1S;

	static {
		final Map<String, Tier1Info> tmp = new LinkedHashMap<>();
		tmp.put("CA", new Tier1Info("TRIUMF", ""));
		tmp.put("CERN", new Tier1Info("CERN-PROD", ""));
		tmp.put("DE", new Tier1Info("FZK-LCG2", ""));
		tmp.put("ES", new Tier1Info("pic", ""));
		tmp.put("FR", new Tier1Info("IN2P3-CC", ""));
		tmp.put("IT", new Tier1Info("INFN-T1", ""));
		tmp.put("ND", new Tier1Info("ARC", ""));
		tmp.put("NL", new Tier1Info("SARA-MATRIX", ""));
		tmp.put("OSG", new Tier1Info("BNL_CVMFS_1", ""));
		tmp.put("RU", new Tier1Info("RRC-KI-T1", ""));
		tmp.put("TW", new Tier1Info("Taiwan-LCG2", ""));
		tmp.put("UK", new Tier1Info("RAL-LCG2", ""));
		tmp.put("US", new Tier1Info("BNL_PROD", "BNL_PROD-condor"));

		DEFAULT_TIER1S = Collections.unmodifiableMap(tmp);
	}

	private final Map<String, Tier1Info> tier1s;

	private final QueueCatalog catalog;

	/**
	 * Registry with the builtin Tier-1 table
	 *
	 * @param catalog
	 */
	public TierRegistry(final QueueCatalog catalog) {
		this(DEFAULT_TIER1S, catalog);
	}

	/**
	 * @param tier1s cloud -&gt; Tier-1
	 * @param catalog full queue catalog
	 */
	public TierRegistry(final Map<String, Tier1Info> tier1s, final QueueCatalog catalog) {
		this.tier1s = Collections.unmodifiableMap(new LinkedHashMap<>(tier1s));
		this.catalog = catalog;
	}

	/**
	 * Build the Tier-1 table from the "tiers" configuration (<code>CLOUD=site[,backup queue]</code>), falling back to the
	 * builtin table when it defines nothing
	 *
	 * @param tiers
	 * @param catalog
	 * @return the registry
	 */
	public static TierRegistry fromConfiguration(final ConfigProperties tiers, final QueueCatalog catalog) {
		final Map<String, Tier1Info> tmp = new LinkedHashMap<>();

		for (final String cloud : tiers.keySet()) {
			final String value = tiers.gets(cloud);

			if (value.isEmpty())
				continue;

			final int idx = value.indexOf(',');

			if (idx < 0)
				tmp.put(cloud, new Tier1Info(value, ""));
			else
				tmp.put(cloud, new Tier1Info(value.substring(0, idx).trim(), value.substring(idx + 1).trim()));
		}

		if (tmp.isEmpty())
			return new TierRegistry(catalog);

		return new TierRegistry(tmp, catalog);
	}

	/**
	 * @return all clouds
	 */
	public Set<String> getCloudList() {
		return tier1s.keySet();
	}

	/**
	 * @param cloud
	 * @return the Tier-1 of the cloud, <code>null</code> if the cloud is unknown
	 */
	public Tier1Info getTier1(final String cloud) {
		return cloud != null ? tier1s.get(cloud) : null;
	}

	/**
	 * @param cloud
	 * @return the Tier-1 site name of the cloud, empty string if the cloud is unknown
	 */
	public String getTier1Name(final String cloud) {
		final Tier1Info t = getTier1(cloud);

		return t != null ? t.site : "";
	}

	/**
	 * Note: the argument is the PanDA site name, not an endpoint name
	 *
	 * @param site
	 * @return <code>true</code> if the site is the Tier-1 (or its backup queue) of any cloud
	 */
	public boolean isTier1(final String site) {
		for (final Tier1Info t : tier1s.values())
			if (t.matches(site))
				return true;

		return false;
	}

	/**
	 * @param queueData the queue to check
	 * @return <code>true</code> if the queue's storage is managed locally
	 */
	public static boolean isTier3(final QueueData queueData) {
		return "local".equals(queueData.gets(QueueData.DDM));
	}

	/**
	 * A site is a Tier-2 when it is neither a Tier-1 nor served by a Tier-3 queue
	 *
	 * @param site
	 * @param queueData the queue running on that site
	 * @return <code>true</code> for Tier-2s
	 */
	public boolean isTier2(final String site, final QueueData queueData) {
		return !(isTier1(site) || isTier3(queueData));
	}

	/**
	 * Find the cloud where an endpoint exists
	 *
	 * @param ddm
	 * @return the cloud, empty string if not found
	 */
	public String getCorrespondingCloud(final String ddm) {
		return catalog.getCorrespondingCloud(ddm);
	}

	/**
	 * Resolve the queue of the Tier-1 of a cloud. For the {@link #WORLD} cloud the storage token has to name the destination
	 * endpoint (e.g. <code>dst:IN2P3-CC_DATADISK</code>), whose cloud is looked up in the catalog first.
	 *
	 * @param cloud
	 * @param storageToken
	 * @return the Tier-1 queue name, or the empty string if there is no failover target (never <code>null</code>)
	 */
	public String resolveTier1Queue(final String cloud, final String storageToken) {
		String realCloud = cloud;

		if (WORLD.equals(cloud)) {
			if (storageToken == null || !storageToken.contains(DESTINATION_PREFIX)) {
				logger.log(Level.WARNING, "No " + DESTINATION_PREFIX + " found in space token string (" + storageToken + "), " + WORLD + " cloud processing will fail");
				return "";
			}

			final String ddm = storageToken.replace(DESTINATION_PREFIX, "").trim();

			realCloud = getCorrespondingCloud(ddm);

			if (realCloud.isEmpty()) {
				logger.log(Level.WARNING, "Endpoint " + ddm + " is not used by any queue in the catalog, cannot determine its cloud");
				return "";
			}
		}

		final Tier1Info t1 = getTier1(realCloud);

		if (t1 == null) {
			logger.log(Level.WARNING, "Cloud " + realCloud + " has no known Tier-1");
			return "";
		}

		final String queue = catalog.getQueueForResource(t1.site);

		if (!queue.isEmpty()) {
			logger.log(Level.INFO, "Cloud " + realCloud + " has Tier-1 queue " + queue);
			return queue;
		}

		if (!t1.backupQueue.isEmpty()) {
			logger.log(Level.INFO, "No catalog queue serves " + t1.site + ", using the backup queue " + t1.backupQueue);
			return t1.backupQueue;
		}

		logger.log(Level.WARNING, "Failed to find a Tier-1 queue name for cloud " + realCloud + " (site " + t1.site + ")");

		return "";
	}
}
