package pilot.site;

import java.io.File;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import pilot.config.ConfigUtils;
import pilot.io.PilotErrorCode;
import pilot.io.PilotException;
import pilot.io.TransferFailure;

/**
 * Finds the software directory of a job. The queue's <code>appdir</code> can be encoded by processing type, e.g.
 * <code>/sw/releases|release^/sw/releases|unvalid^/sw/unvalidated/caches</code>, where the first entry is the default.
 *
 * @since Jan 19, 2017
 */
public class AppdirResolver {
	static final Logger logger = ConfigUtils.getLogger(AppdirResolver.class.getCanonicalName());

	/**
	 * Software area of the nightly builds
	 */
	public static final String NIGHTLIES_DIR = "VO_ATLAS_NIGHTLIES_DIR";

	/**
	 * Default software area
	 */
	public static final String SW_DIR = "VO_ATLAS_SW_DIR";

	private static final Pattern ENV_VARIABLE = Pattern.compile("\\$\\{?(\\w+)\\}?");

	private final Map<String, String> environment;

	/**
	 * @param environment
	 */
	public AppdirResolver(final Map<String, String> environment) {
		this.environment = environment;
	}

	/**
	 * Resolver working with the process environment
	 */
	public AppdirResolver() {
		this(System.getenv());
	}

	/**
	 * Expand <code>$VAR</code> and <code>${VAR}</code> references, unknown variables are left as they are
	 *
	 * @param value
	 * @return the expanded value
	 */
	String expand(final String value) {
		final Matcher m = ENV_VARIABLE.matcher(value);

		final StringBuffer sb = new StringBuffer();

		while (m.find()) {
			final String replacement = environment.get(m.group(1));
			m.appendReplacement(sb, Matcher.quoteReplacement(replacement != null ? replacement : m.group()));
		}

		m.appendTail(sb);

		return sb.toString();
	}

	private String getSpecialAppdir(final QueueData queueData, final String variable) {
		final String raw = environment.get(variable);
		final String appdir = raw != null ? expand(raw) : "";

		logger.log(Level.INFO, "Environment has variable $" + variable + " = " + appdir);

		if (appdir.isEmpty()) {
			logger.log(Level.WARNING, "Environment variable not set: " + variable);
			return "";
		}

		queueData.replace(QueueData.APPDIR, appdir);

		return appdir;
	}

	/**
	 * @param appdir the (possibly encoded) value
	 * @param processingType
	 * @return the directory for this processing type, the default entry if none matches
	 */
	static String decode(final String appdir, final String processingType) {
		if (!appdir.contains("|") || !appdir.contains("^"))
			return appdir;

		final String[] entries = appdir.split("\\|");

		for (int i = 1; i < entries.length; i++) {
			final int idx = entries[i].indexOf('^');

			if (idx > 0 && entries[i].substring(0, idx).equals(processingType)) {
				logger.log(Level.INFO, "Matched processingType " + processingType + " to appdir " + entries[i].substring(idx + 1));
				return entries[i].substring(idx + 1);
			}
		}

		logger.log(Level.INFO, "Using default appdir: " + entries[0] + " (processingType = '" + processingType + "')");

		return entries[0];
	}

	/**
	 * Determine the software directory of a job and store it in the queue data
	 *
	 * @param queueData
	 * @param processingType
	 * @param homePackage
	 * @return the software directory
	 * @throws PilotException with {@link PilotErrorCode#ERR_NOSOFTWAREDIR} if the directory doesn't exist or is not set
	 */
	public String extractAppdir(final QueueData queueData, final String processingType, final String homePackage) throws PilotException {
		String type = processingType;

		if (homePackage != null && homePackage.contains("rel_")) {
			logger.log(Level.INFO, "Temporarily modifying processingType from " + processingType + " to nightlies");
			type = "nightlies";

			if (environment.containsKey(NIGHTLIES_DIR)) {
				final String special = getSpecialAppdir(queueData, NIGHTLIES_DIR);

				if (!special.isEmpty())
					return special;
			}
		}

		String appdir = decode(queueData.gets(QueueData.APPDIR), type);

		if (appdir.isEmpty() && environment.get(SW_DIR) != null) {
			appdir = environment.get(SW_DIR);
			logger.log(Level.INFO, "Set site.appdir to " + appdir);
		}

		if (appdir.isEmpty() || !new File(appdir).exists()) {
			final String message = appdir.isEmpty() ? "Software directory (appdir) is not set" : "Software directory does not exist: " + appdir;

			logger.log(Level.SEVERE, message);

			throw new PilotException(TransferFailure.CONFIGURATION_MISSING, PilotErrorCode.ERR_NOSOFTWAREDIR, message);
		}

		logger.log(Level.INFO, "Software directory " + appdir + " exists");

		queueData.replace(QueueData.APPDIR, appdir);

		return appdir;
	}
}
