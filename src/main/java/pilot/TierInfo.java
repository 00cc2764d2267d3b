package pilot;

import java.io.File;
import java.io.IOException;

import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import pilot.config.ConfigProperties;
import pilot.config.ConfigUtils;
import pilot.site.tiers.CachedURLSource;
import pilot.site.tiers.FileQueueCatalogSource;
import pilot.site.tiers.QueueCatalog;
import pilot.site.tiers.QueueCatalogSource;
import pilot.site.tiers.TierRegistry;

/**
 * Print the Tier-1 queue of a cloud, as the failover would pick it
 *
 * @since Feb 2, 2017
 */
public class TierInfo {

	/**
	 * @param args
	 * @throws IOException
	 */
	public static void main(final String[] args) throws IOException {
		final OptionParser parser = new OptionParser();
		parser.accepts("cloud", "Cloud to look up").withRequiredArg().defaultsTo("CERN");
		parser.accepts("token", "Space token, dst:ENDPOINT for the WORLD cloud").withRequiredArg();
		parser.accepts("catalog", "Local queue catalog (JSON)").withRequiredArg();
		parser.accepts("url", "Download the queue catalog from this URL").withRequiredArg();
		parser.accepts("cache", "Cache file for the downloaded catalog").withRequiredArg();
		parser.accepts("site", "Also print the tier of this site").withRequiredArg();
		parser.accepts("h", "Print this help");

		final OptionSet options;

		try {
			options = parser.parse(args);
		}
		catch (final OptionException oe) {
			System.err.println(oe.getMessage());
			parser.printHelpOn(System.err);
			System.exit(1);
			return;
		}

		if (options.has("h")) {
			parser.printHelpOn(System.out);
			return;
		}

		final ConfigProperties config = ConfigUtils.getConfig();

		final QueueCatalogSource source;

		if (options.has("catalog"))
			source = new FileQueueCatalogSource(new File((String) options.valueOf("catalog")));
		else {
			final String url = options.has("url") ? (String) options.valueOf("url") : config.gets("queue.catalog.url", "");

			if (url.isEmpty()) {
				System.err.println("Either --catalog or --url (or the queue.catalog.url configuration key) is needed");
				System.exit(1);
				return;
			}

			final String cache = options.has("cache") ? (String) options.valueOf("cache") : config.gets("queue.catalog.cache", "queuedata.all.json");

			source = new CachedURLSource(url, new File(cache), config.geti("queue.catalog.timeout", 60));
		}

		final TierRegistry tiers = TierRegistry.fromConfiguration(ConfigUtils.getConfiguration("tiers"), new QueueCatalog(source));

		final String cloud = (String) options.valueOf("cloud");

		System.out.println("Tier-1 of " + cloud + ": " + tiers.getTier1Name(cloud));
		System.out.println("Tier-1 queue: " + tiers.resolveTier1Queue(cloud, (String) options.valueOf("token")));

		if (options.has("site")) {
			final String site = (String) options.valueOf("site");
			System.out.println(site + " is " + (tiers.isTier1(site) ? "a Tier-1" : "not a Tier-1"));
		}
	}
}
