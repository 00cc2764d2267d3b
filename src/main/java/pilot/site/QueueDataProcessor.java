package pilot.site;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import pilot.config.ConfigUtils;
import pilot.io.PilotErrorCode;
import pilot.io.PilotException;
import pilot.io.TransferFailure;

/**
 * Final corrections of the queue data, once downloaded: per-site overrides, copy tool overrides from the environment,
 * the queue status check and the normalization of the rucio destination paths.
 *
 * @since Jan 19, 2017
 */
public class QueueDataProcessor {
	static final Logger logger = ConfigUtils.getLogger(QueueDataProcessor.class.getCanonicalName());

	private static final String RUCIO = "rucio";

	private final SiteOverrides overrides;

	private final Map<String, String> environment;

	/**
	 * @param overrides
	 * @param environment process environment, for the COPYTOOL / COPYTOOLIN overrides
	 */
	public QueueDataProcessor(final SiteOverrides overrides, final Map<String, String> environment) {
		this.overrides = overrides;
		this.environment = environment;
	}

	/**
	 * Processor with the configured overrides table and the real environment
	 */
	public QueueDataProcessor() {
		this(SiteOverrides.fromConfiguration(ConfigUtils.getConfiguration("overrides")), System.getenv());
	}

	/**
	 * @param queueData modified in place
	 * @param siteName
	 * @param jobRecovery current value of the job recovery flag
	 * @return the job recovery flag, as set by the <code>retry</code> field, or the given value if the field doesn't say
	 * @throws PilotException if the queue is offline
	 */
	public boolean postProcess(final QueueData queueData, final String siteName, final boolean jobRecovery) throws PilotException {
		if (overrides != null)
			overrides.apply(queueData, siteName);

		for (final String field : new String[] { QueueData.COPYTOOL, QueueData.COPYTOOLIN }) {
			final String value = environment.get(field.toUpperCase());

			if (value != null && !value.isEmpty()) {
				logger.log(Level.INFO, "Environment overrides " + field + " to " + value);
				queueData.replace(field, value);
			}
		}

		final String status = queueData.gets(QueueData.STATUS);

		if (!status.isEmpty()) {
			if (status.equalsIgnoreCase("offline")) {
				logger.log(Level.SEVERE, "Site " + siteName + " is currently in " + status.toLowerCase() + " mode - aborting pilot");
				throw new PilotException(TransferFailure.CONFIGURATION_MISSING, PilotErrorCode.ERR_QUEUEDATANOTOK, "Queue " + queueData.getQueueName() + " of site " + siteName + " is offline");
			}

			logger.log(Level.INFO, "Site " + siteName + " is currently in " + status.toLowerCase() + " mode");
		}

		boolean ret = jobRecovery;

		final String retry = queueData.gets(QueueData.RETRY);

		if (retry.equalsIgnoreCase("true")) {
			logger.log(Level.INFO, "Job recovery turned on");
			ret = true;
		}
		else if (retry.equalsIgnoreCase("false")) {
			logger.log(Level.INFO, "Job recovery turned off");
			ret = false;
		}
		else
			logger.log(Level.FINE, "Job recovery variable (retry) not set");

		verifyRucioPath(queueData, QueueData.SEPATH);
		verifyRucioPath(queueData, QueueData.SEPRODPATH);

		return ret;
	}

	/**
	 * Fix the rucio paths of one field of the queue data
	 *
	 * @param queueData
	 * @param field
	 * @return <code>true</code> if the field was changed
	 */
	public static boolean verifyRucioPath(final QueueData queueData, final String field) {
		final String value = queueData.gets(field);

		if (value.isEmpty())
			return false;

		final StringBuilder sb = new StringBuilder();

		boolean first = true;

		// the spacing around the separators is kept as it is
		for (final String entry : value.split(",", -1)) {
			if (!first)
				sb.append(',');

			first = false;

			final String path = entry.trim();

			if (path.isEmpty()) {
				sb.append(entry);
				continue;
			}

			final int start = entry.indexOf(path);

			sb.append(entry, 0, start).append(verifyRucioPath(path)).append(entry.substring(start + path.length()));
		}

		final String fixed = sb.toString();

		if (fixed.equals(value)) {
			if (value.contains(RUCIO))
				logger.log(Level.FINE, "Confirmed correctly formatted rucio " + field);

			return false;
		}

		logger.log(Level.WARNING, "rucio path in " + field + " is not correctly formatted: " + value + ", updated to: " + fixed);
		queueData.replace(field, fixed);

		return true;
	}

	/**
	 * A rucio destination path must end in <code>/rucio</code>, with exactly one slash before and none after
	 *
	 * @param path
	 * @return the corrected path, the same string if nothing needed correcting
	 */
	public static String verifyRucioPath(final String path) {
		if (path == null || !path.contains(RUCIO))
			return path;

		if (path.endsWith("/" + RUCIO))
			return path;

		if (path.endsWith("/" + RUCIO + "/"))
			return path.substring(0, path.length() - 1);

		if (path.endsWith(RUCIO))
			return path.substring(0, path.length() - RUCIO.length()) + "/" + RUCIO;

		if (path.endsWith(RUCIO + "/"))
			return path.substring(0, path.length() - RUCIO.length() - 1) + "/" + RUCIO;

		return path;
	}
}
