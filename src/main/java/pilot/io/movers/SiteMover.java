package pilot.io.movers;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import pilot.config.ConfigUtils;
import pilot.io.FileSpec;
import pilot.io.PilotException;
import pilot.io.StageResult;
import pilot.io.TraceReport;
import pilot.io.TransferFailure;
import pilot.site.containers.Containerizer;
import utils.ExitStatus;
import utils.ExternalCalls;

/**
 * Moves files between the worker node and a storage endpoint with one specific set of tools. Implementations keep no
 * state between calls, the same instance can serve concurrent transfers.
 *
 * @since Mar 8, 2017
 */
public abstract class SiteMover {
	static final Logger logger = ConfigUtils.getLogger(SiteMover.class.getCanonicalName());

	/**
	 * Site and tooling
	 */
	protected final MoverEnvironment env;

	/**
	 * @param env
	 */
	protected SiteMover(final MoverEnvironment env) {
		this.env = env;
	}

	/**
	 * @return which mover this is
	 */
	public abstract MoverType getType();

	/**
	 * Copy a file from the storage to the worker node
	 *
	 * @param dst where the file must end up
	 * @param fspec file to get; the size and checksum fields are filled in when known
	 * @param trace job details for the transfer traces, can be <code>null</code>
	 * @return where the file was taken from, or its checksum, depending on the mover
	 * @throws PilotException
	 */
	public abstract StageResult stageIn(File dst, FileSpec fspec, TraceReport trace) throws PilotException;

	/**
	 * Copy a local file to the storage
	 *
	 * @param src the local file
	 * @param fspec file to put
	 * @return where the file was put
	 * @throws PilotException
	 */
	public abstract StageResult stageOut(File src, FileSpec fspec) throws PilotException;

	/**
	 * @param ddmendpoint
	 * @return <code>true</code> if the physical path can be computed from the logical name. Unknown endpoints are taken as deterministic.
	 */
	public boolean isDeterministic(final String ddmendpoint) {
		return env.endpoints == null || env.endpoints.isDeterministic(ddmendpoint);
	}

	/**
	 * Location check of a transfer pinned to an endpoint: a non-deterministic endpoint needs a transfer URL
	 *
	 * @param endpoint the endpoint the transfer is pinned to, <code>null</code> if it is not pinned
	 * @param fspec
	 * @param direction
	 * @return the check, to be run as the first step of the transfer
	 */
	protected TransferStage locationCheck(final String endpoint, final FileSpec fspec, final TwoStageTransfer.Direction direction) {
		return () -> {
			if (endpoint == null)
				return;

			if (endpoint.isEmpty())
				throw new PilotException(TransferFailure.CONFIGURATION_MISSING, direction.getErrorCode(), "No storage endpoint given for " + fspec.getDid());

			if (!isDeterministic(endpoint) && (fspec.turl == null || fspec.turl.isEmpty()))
				throw new PilotException(TransferFailure.UNKNOWN_PHYSICAL_LOCATION, direction.getErrorCode(),
						"Endpoint " + endpoint + " is not deterministic and no transfer URL is known for " + fspec.getDid());
		};
	}

	/**
	 * Run one of the transfer tools, inside the container of the job's platform
	 *
	 * @param command
	 * @param fspec
	 * @param workdir directory bound in the container
	 * @return the outcome, when successful
	 * @throws IOException with the exit code and the complete output of the tool if it failed or ran out of time
	 * @throws InterruptedException
	 */
	protected ExitStatus runCommand(final List<String> command, final FileSpec fspec, final File workdir) throws IOException, InterruptedException {
		final Containerizer cont = env.containers.getContainerizer(env.queueData, fspec.cmtconfig, workdir != null ? workdir.getAbsolutePath() : null);

		final List<String> fullCommand = cont.containerize(command);

		logger.log(Level.INFO, getType() + " command: " + ExitStatus.formatCommand(fullCommand));

		final ExitStatus status = env.runner.run(fullCommand, env.timeoutSeconds, TimeUnit.SECONDS);

		logger.log(Level.INFO, getType() + " output: s=" + status.getExitCode() + " o=" + status.getOutput());

		if (status.isTimedOut())
			throw new IOException("Timed out after " + env.timeoutSeconds + "s: " + status.getOutput());

		if (!status.isSuccess())
			throw new IOException("Exit code " + status.getExitCode() + ": " + status.getOutput());

		return status;
	}

	/**
	 * Log the execution environment: which of the transfer tools are available
	 */
	public void setup() {
		logger.log(Level.INFO, "which rucio: " + ExternalCalls.programExistsInPath("rucio"));
		logger.log(Level.INFO, "which gfal-copy: " + ExternalCalls.programExistsInPath("gfal-copy"));
		logger.log(Level.INFO, "which davix-http: " + ExternalCalls.programExistsInPath("davix-http"));

		if (logger.isLoggable(Level.FINE))
			logger.log(Level.FINE, "environment: " + System.getenv());
	}

	@Override
	public String toString() {
		return getType().toString();
	}
}
