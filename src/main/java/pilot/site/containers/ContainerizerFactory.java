package pilot.site.containers;

import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import pilot.config.ConfigProperties;
import pilot.config.ConfigUtils;
import pilot.site.QueueData;

/**
 * Picks the command wrapping for a transfer, from the queue's <code>container_type</code> and the platform of the job
 */
public class ContainerizerFactory {
	private static final Logger logger = ConfigUtils.getLogger(ContainerizerFactory.class.getCanonicalName());

	/**
	 * Queue setting that makes the pilot itself run its tools in Singularity
	 */
	public static final String SINGULARITY_PILOT = "singularity:pilot";

	/**
	 * Default location of the platform images
	 */
	public static final String DEFAULT_IMAGE_DIR = "/cvmfs/atlas.cern.ch/repo/images/singularity";

	private static final Pattern PLATFORM = Pattern.compile("^([^-]+)-(slc\\d+|centos\\d+|el\\d+)-");

	private final ConfigProperties config;

	/**
	 * @param config where <code>container.image.dir</code> and the per-platform <code>container.image.&lt;cmtconfig&gt;</code> overrides come from
	 */
	public ContainerizerFactory(final ConfigProperties config) {
		this.config = config;
	}

	/**
	 * Factory with the main configuration
	 */
	public ContainerizerFactory() {
		this(ConfigUtils.getConfig());
	}

	/**
	 * @param cmtconfig platform tag, e.g. <code>x86_64-slc6-gcc49-opt</code>
	 * @return the image for that platform, or <code>null</code> if it cannot be derived from the tag
	 */
	public String getImage(final String cmtconfig) {
		if (cmtconfig == null || cmtconfig.isEmpty())
			return null;

		final String explicit = config.gets("container.image." + cmtconfig);

		if (!explicit.isEmpty())
			return explicit;

		final Matcher m = PLATFORM.matcher(cmtconfig);

		if (!m.find())
			return null;

		return config.gets("container.image.dir", DEFAULT_IMAGE_DIR) + "/" + m.group(1) + "-" + m.group(2) + ".img";
	}

	/**
	 * @param queueData
	 * @param cmtconfig
	 * @param workdir
	 * @return the wrapping to apply, never <code>null</code>
	 */
	public Containerizer getContainerizer(final QueueData queueData, final String cmtconfig, final String workdir) {
		final Containerizer ret;

		final String containerType = queueData != null ? queueData.gets(QueueData.CONTAINER_TYPE) : "";

		if (containerType.contains(SINGULARITY_PILOT)) {
			final String image = getImage(cmtconfig);

			if (image != null)
				ret = new Singularity(image);
			else {
				logger.log(Level.WARNING, "Cannot determine the image of platform `" + cmtconfig + "`, running without container");
				ret = new NoContainer();
			}
		}
		else
			ret = new NoContainer();

		ret.setWorkdir(workdir);

		if (logger.isLoggable(Level.FINE))
			logger.log(Level.FINE, "Using " + ret + " for cmtconfig=" + cmtconfig + ", container_type=" + containerType);

		return ret;
	}
}
