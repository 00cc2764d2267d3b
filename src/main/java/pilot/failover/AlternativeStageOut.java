package pilot.failover;

import java.io.File;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import pilot.config.ConfigUtils;
import pilot.io.FileSpec;
import pilot.io.PilotErrorCode;
import pilot.io.PilotException;
import pilot.io.StageResult;
import pilot.io.TransferFailure;
import pilot.io.movers.SiteMover;
import pilot.io.paths.PathResolver;
import pilot.io.paths.ProperPaths;
import pilot.se.DDMEndpoints;
import pilot.site.QueueData;
import pilot.site.tiers.QueueCatalog;
import pilot.site.tiers.TierRegistry;

/**
 * Stage-out with failover: the file goes to the queue's own endpoint, and if that fails (or the queue says so) to the
 * endpoint of the Tier-1 of the cloud. The alternate destination is attempted at most once.
 *
 * @since Mar 8, 2017
 */
public class AlternativeStageOut {
	static final Logger logger = ConfigUtils.getLogger(AlternativeStageOut.class.getCanonicalName());

	private final FailoverPolicy policy;

	private final TierRegistry tiers;

	private final QueueCatalog catalog;

	private final DDMEndpoints endpoints;

	private final PathResolver resolver;

	private final SiteMover mover;

	/**
	 * @param queueData configuration of the current queue
	 * @param tiers
	 * @param catalog where the alternate queue's configuration comes from
	 * @param endpoints can be <code>null</code>, then no endpoint is taken as an object store
	 * @param resolver path resolution for the current queue
	 * @param mover the stage-out mover
	 */
	public AlternativeStageOut(final QueueData queueData, final TierRegistry tiers, final QueueCatalog catalog, final DDMEndpoints endpoints, final PathResolver resolver, final SiteMover mover) {
		this.policy = new FailoverPolicy(queueData);
		this.tiers = tiers;
		this.catalog = catalog;
		this.endpoints = endpoints;
		this.resolver = resolver;
		this.mover = mover;
	}

	/**
	 * @param fspec the file, its ddmendpoint, surl and checksum fields are updated. A failed alternative attempt leaves
	 *            ddmendpoint and surl as they were before it.
	 * @param src local file
	 * @param job
	 * @return where the file went
	 * @throws PilotException the failure of the primary attempt if there is no alternative, or the failure of the alternative attempt
	 */
	public StageResult stageOut(final FileSpec fspec, final File src, final JobContext job) throws PilotException {
		final boolean objectstore = endpoints != null && endpoints.isObjectstore(fspec.ddmendpoint);

		if (policy.forceAlternateStageOut(job.analysisJob, job.alternativeStageOut, objectstore)) {
			logger.log(Level.INFO, "Alternative stage-out is forced for " + fspec);

			final Alternative alt = findAlternative(job);

			if (alt.queueData != null)
				return alternate(fspec, src, job, alt);

			logger.log(Level.WARNING, "Forced alternative stage-out of " + fspec + " is not possible, using the primary endpoint instead");

			try {
				return attempt(fspec, src, job, resolver, false);
			}
			catch (final PilotException pe) {
				throw withoutAlternative(pe, alt);
			}
		}

		try {
			return attempt(fspec, src, job, resolver, false);
		}
		catch (final PilotException pe) {
			if (pe.getFailure().isFatal()) {
				logger.log(Level.WARNING, "Stage-out of " + fspec + " failed with " + pe.getFailure() + ", an alternative endpoint cannot help");
				throw pe;
			}

			if (!policy.allowAlternateStageOut(job.analysisJob, job.alternativeStageOut)) {
				logger.log(Level.INFO, "Stage-out of " + fspec + " failed and alternative stage-out is not allowed");
				throw pe;
			}

			if (tiers.isTier1(job.siteName)) {
				logger.log(Level.INFO, "Stage-out of " + fspec + " failed at the Tier-1 " + job.siteName + ", there is nowhere else to go");
				throw pe;
			}

			final Alternative alt = findAlternative(job);

			if (alt.queueData == null)
				throw withoutAlternative(pe, alt);

			logger.log(Level.WARNING, "Stage-out of " + fspec + " failed, trying the alternative stage-out: " + pe.getMessage());

			return alternate(fspec, src, job, alt);
		}
	}

	private StageResult attempt(final FileSpec fspec, final File src, final JobContext job, final PathResolver r, final boolean alt) throws PilotException {
		final ProperPaths paths = r.resolve(fspec, job.analysisJob, job.token, job.prodSourceLabel, alt);

		if (!paths.isOK())
			throw paths.toException();

		fspec.surl = paths.storageURL;

		return mover.stageOut(src, fspec);
	}

	/**
	 * Tier-1 queue and endpoint to fall back to, or the reason why there is none
	 */
	private static final class Alternative {
		final QueueData queueData;

		final String endpoint;

		final String reason;

		Alternative(final QueueData queueData, final String endpoint, final String reason) {
			this.queueData = queueData;
			this.endpoint = endpoint;
			this.reason = reason;
		}

		static Alternative none(final String reason) {
			logger.log(Level.WARNING, "No alternative stage-out: " + reason);
			return new Alternative(null, null, reason);
		}
	}

	private Alternative findAlternative(final JobContext job) {
		final String queue = tiers.resolveTier1Queue(job.cloud, job.token);

		if (queue.isEmpty())
			return Alternative.none("no Tier-1 queue for cloud " + job.cloud + " (token " + job.token + ")");

		final QueueData altData = catalog.getQueueData(queue);

		if (altData == null)
			return Alternative.none("no configuration for the Tier-1 queue " + queue);

		final List<String> altEndpoints = altData.getList(QueueData.DDM);

		if (altEndpoints.isEmpty())
			return Alternative.none("the Tier-1 queue " + queue + " defines no endpoint");

		return new Alternative(altData, altEndpoints.get(0), null);
	}

	/**
	 * @return the failure to report, with the reason why no alternative could be tried attached to it
	 */
	private static PilotException withoutAlternative(final PilotException failure, final Alternative alt) {
		failure.addSuppressed(new PilotException(TransferFailure.FAILOVER_UNAVAILABLE, PilotErrorCode.ERR_STAGEOUTFAILED, alt.reason));
		return failure;
	}

	private StageResult alternate(final FileSpec fspec, final File src, final JobContext job, final Alternative alt) throws PilotException {
		final String previous = fspec.ddmendpoint;
		final String previousSurl = fspec.surl;

		fspec.ddmendpoint = alt.endpoint;
		fspec.surl = null;

		logger.log(Level.INFO, "Alternative stage-out of " + fspec.getDid() + " to " + fspec.ddmendpoint + " (queue " + alt.queueData.getQueueName() + ") instead of " + previous);

		try {
			return attempt(fspec, src, job, resolver.withAlternate(alt.queueData), true);
		}
		catch (final PilotException pe) {
			logger.log(Level.WARNING, "Alternative stage-out of " + fspec.getDid() + " to " + fspec.ddmendpoint + " failed, restoring " + previous);

			fspec.ddmendpoint = previous;
			fspec.surl = previousSurl;

			throw pe;
		}
	}
}
