package pilot.failover;

import java.util.logging.Level;
import java.util.logging.Logger;

import pilot.config.ConfigUtils;
import pilot.site.QueueData;

/**
 * Decides whether the output may (or must) go to the alternative, Tier-1, storage when the primary one fails. Production
 * jobs only: user jobs are kept off the Tier-1 storage, and an object store destination is never forced away.
 *
 * @since Nov 17, 2016
 */
public class FailoverPolicy {
	static final Logger logger = ConfigUtils.getLogger(FailoverPolicy.class.getCanonicalName());

	/**
	 * Directive allowing the alternative stage-out
	 */
	public static final String ALLOW_DIRECTIVE = "allow_alt_stageout";

	/**
	 * Directive forcing the alternative stage-out
	 */
	public static final String FORCE_DIRECTIVE = "force_alt_stageout";

	/**
	 * Mode switching the alternative stage-out off
	 */
	public static final String MODE_OFF = "off";

	/**
	 * Mode switching the alternative stage-out on
	 */
	public static final String MODE_ON = "on";

	/**
	 * Mode forcing the alternative stage-out
	 */
	public static final String MODE_FORCE = "force";

	private final QueueData queueData;

	/**
	 * @param queueData queue whose <code>catchall</code> field holds the directives
	 */
	public FailoverPolicy(final QueueData queueData) {
		this.queueData = queueData;
	}

	/**
	 * @param analysisJob
	 * @param requestedMode job level request: "off", "on", "force", or anything else / <code>null</code> to let the queue decide
	 * @return <code>true</code> if the alternative stage-out may be attempted
	 */
	public boolean allowAlternateStageOut(final boolean analysisJob, final String requestedMode) {
		return allowAlternateStageOut(analysisJob, requestedMode, queueData.gets(QueueData.CATCHALL));
	}

	/**
	 * @param analysisJob
	 * @param requestedMode
	 * @param objectstoreDestination <code>true</code> if the primary destination is an object store
	 * @return <code>true</code> if the alternative stage-out has to be used directly
	 */
	public boolean forceAlternateStageOut(final boolean analysisJob, final String requestedMode, final boolean objectstoreDestination) {
		return forceAlternateStageOut(analysisJob, requestedMode, objectstoreDestination, queueData.gets(QueueData.CATCHALL));
	}

	/**
	 * @param analysisJob
	 * @param requestedMode
	 * @param catchall directive text
	 * @return <code>true</code> if the alternative stage-out may be attempted
	 */
	public static boolean allowAlternateStageOut(final boolean analysisJob, final String requestedMode, final String catchall) {
		final boolean status;

		if (MODE_OFF.equals(requestedMode))
			status = false;
		else if (MODE_ON.equals(requestedMode))
			status = true;
		else
			status = catchall != null && catchall.contains(ALLOW_DIRECTIVE) && !analysisJob;

		if (logger.isLoggable(Level.FINE))
			logger.log(Level.FINE, "Alternative stage-out allowed: " + status + " (analysis=" + analysisJob + ", mode=" + requestedMode + ", catchall=" + catchall + ")");

		return status;
	}

	/**
	 * @param analysisJob
	 * @param requestedMode
	 * @param objectstoreDestination
	 * @param catchall directive text
	 * @return <code>true</code> if the alternative stage-out has to be used directly
	 */
	public static boolean forceAlternateStageOut(final boolean analysisJob, final String requestedMode, final boolean objectstoreDestination, final String catchall) {
		boolean status = false;

		if (!objectstoreDestination)
			if (MODE_FORCE.equals(requestedMode))
				status = true;
			else
				status = catchall != null && catchall.contains(FORCE_DIRECTIVE) && !analysisJob;

		if (logger.isLoggable(Level.FINE))
			logger.log(Level.FINE, "Alternative stage-out forced: " + status + " (analysis=" + analysisJob + ", mode=" + requestedMode + ", objectstore=" + objectstoreDestination + ", catchall=" + catchall
					+ ")");

		return status;
	}
}
