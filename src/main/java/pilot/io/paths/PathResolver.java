package pilot.io.paths;

import java.util.logging.Level;
import java.util.logging.Logger;

import pilot.config.ConfigUtils;
import pilot.io.FileSpec;
import pilot.io.PilotErrorCode;
import pilot.io.TransferFailure;
import pilot.site.QueueData;

/**
 * Computes where a file goes in the destination storage: the physical path, the directory in the catalog and the full
 * storage URL. Everything is derived from the queue data, there are no side effects apart from logging.
 *
 * @since Mar 8, 2017
 */
public class PathResolver {
	static final Logger logger = ConfigUtils.getLogger(PathResolver.class.getCanonicalName());

	/**
	 * Tracer error tag of a missing destination path
	 */
	public static final String PUT_DEST_PATH_UNDEF = "PUT_DEST_PATH_UNDEF";

	/**
	 * Tracer error tag of a dataset name that doesn't follow the naming convention
	 */
	public static final String UNKNOWN_DSN_FORMAT = "UNKNOWN_DSN_FORMAT";

	private final QueueData queueData;

	private final QueueData alternateQueueData;

	private final Namespace namespace;

	private final RucioPathBuilder rucioPathBuilder = new RucioPathBuilder(this);

	/**
	 * @param queueData configuration of the current queue
	 * @param alternateQueueData configuration of the alternate (Tier-1) queue, can be <code>null</code>
	 * @param namespace naming convention of the destination
	 */
	public PathResolver(final QueueData queueData, final QueueData alternateQueueData, final Namespace namespace) {
		this.queueData = queueData;
		this.alternateQueueData = alternateQueueData;
		this.namespace = namespace != null ? namespace : Namespace.AUTO;
	}

	/**
	 * @param queueData
	 * @param alternateQueueData
	 * @return a resolver with the naming convention taken from the <code>storage.namespace</code> configuration key
	 */
	public static PathResolver fromConfiguration(final QueueData queueData, final QueueData alternateQueueData) {
		return new PathResolver(queueData, alternateQueueData, Namespace.fromString(ConfigUtils.getConfig().gets("storage.namespace", "auto")));
	}

	/**
	 * @param alternate
	 * @return a resolver for the same queue, with another alternate queue
	 */
	public PathResolver withAlternate(final QueueData alternate) {
		return new PathResolver(queueData, alternate, namespace);
	}

	private QueueData select(final boolean alt) {
		return alt ? alternateQueueData : queueData;
	}

	/**
	 * @param token space token, can be <code>null</code>
	 * @param alt look in the alternate queue data
	 * @return the storage element entry for the token, still carrying its <code>token:</code> prefix. Empty if not defined.
	 */
	public String getProperSE(final String token, final boolean alt) {
		final QueueData qd = select(alt);

		if (qd == null)
			return "";

		return StorageElements.getProperSE(qd, token);
	}

	/**
	 * @param analysisJob
	 * @param token
	 * @param alt
	 * @return destination root for the token, without trailing slash. Empty if not defined.
	 */
	public String getPreDestination(final boolean analysisJob, final String token, final boolean alt) {
		final QueueData qd = select(alt);

		if (qd == null)
			return "";

		String field = QueueData.SEPATH;

		if (!analysisJob && !qd.gets(QueueData.SEPRODPATH).isEmpty())
			field = QueueData.SEPRODPATH;

		String destination = StorageElements.selectByToken(qd.getList(field), token);

		while (destination.endsWith("/"))
			destination = destination.substring(0, destination.length() - 1);

		return destination;
	}

	/**
	 * @param analysisJob
	 * @param alt
	 * @return catalog root directory, without trailing slash
	 */
	public String getCatalogPath(final boolean analysisJob, final boolean alt) {
		final QueueData qd = select(alt);

		if (qd == null)
			return "";

		String path = qd.gets(QueueData.LFCPATH);

		if (!analysisJob && !qd.gets(QueueData.LFCPRODPATH).isEmpty())
			path = qd.gets(QueueData.LFCPRODPATH);

		while (path.endsWith("/"))
			path = path.substring(0, path.length() - 1);

		return path;
	}

	/**
	 * @return the builder of rucio storage URLs working on this resolver's queue data
	 */
	public RucioPathBuilder getRucioPathBuilder() {
		return rucioPathBuilder;
	}

	/**
	 * Resolve the location of an output file
	 *
	 * @param fspec
	 * @param analysisJob
	 * @param token space token, can be <code>null</code>
	 * @param prodSourceLabel job label, for the log messages only
	 * @param alt resolve against the alternate queue
	 * @return the paths, or the reason why they cannot be determined
	 */
	public ProperPaths resolve(final FileSpec fspec, final boolean analysisJob, final String token, final String prodSourceLabel, final boolean alt) {
		final String destination = getPreDestination(analysisJob, token, alt);

		if (destination.isEmpty()) {
			logger.log(Level.WARNING, "put_data destination path in SE not defined for " + fspec + " (" + prodSourceLabel + ", token " + token + ", alt " + alt + ")");
			return ProperPaths.error(PilotErrorCode.ERR_STAGEOUTFAILED, TransferFailure.CONFIGURATION_MISSING, "put_data destination path in SE not defined", PUT_DEST_PATH_UNDEF);
		}

		final Namespace effective = namespace.resolve(destination);

		final ProperPaths ret;

		if (effective == Namespace.RUCIO) {
			final String surl = rucioPathBuilder.getFullPath(fspec.scope, token, fspec.lfn, analysisJob, alt);
			final String physicalPath = destination + "/" + RucioPaths.getPathFromScope(fspec.scope, fspec.lfn);
			final int idx = surl.lastIndexOf('/');

			ret = ProperPaths.ok(physicalPath, idx > 0 ? surl.substring(0, idx) : surl, surl);
		}
		else {
			final String dir;

			try {
				dir = DatasetPaths.getDatasetDirectory(fspec.dataset);
			}
			catch (final IllegalArgumentException iae) {
				logger.log(Level.WARNING, "Cannot derive the directory of " + fspec + " from the dataset name", iae);
				return ProperPaths.error(PilotErrorCode.ERR_STAGEOUTFAILED, TransferFailure.CONFIGURATION_MISSING, iae.getMessage(), UNKNOWN_DSN_FORMAT);
			}

			final String physicalPath = destination + dir + fspec.lfn;
			final String surl = StorageElements.stripToken(getProperSE(token, alt) + physicalPath);

			ret = ProperPaths.ok(physicalPath, getCatalogPath(analysisJob, alt) + dir, surl);
		}

		if (logger.isLoggable(Level.FINE))
			logger.log(Level.FINE, fspec + " (" + prodSourceLabel + "): " + ret);

		return ret;
	}
}
