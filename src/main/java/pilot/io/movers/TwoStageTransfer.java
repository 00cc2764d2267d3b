package pilot.io.movers;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import pilot.config.ConfigUtils;
import pilot.io.PilotErrorCode;
import pilot.io.PilotException;
import pilot.io.TransferFailure;

/**
 * One transfer operation: location check, then the external command, then (only if the command failed) the in-process
 * library, exactly once. Instances are not reusable, each stage-in or stage-out call builds its own.
 *
 * @since Apr 4, 2018
 */
public class TwoStageTransfer {
	static final Logger logger = ConfigUtils.getLogger(TwoStageTransfer.class.getCanonicalName());

	/**
	 * Direction of the transfer, decides the error code of the final failure
	 */
	public enum Direction {
		/**
		 * Storage to worker node
		 */
		STAGE_IN("stageIn", PilotErrorCode.ERR_STAGEINFAILED),
		/**
		 * Worker node to storage
		 */
		STAGE_OUT("stageOut", PilotErrorCode.ERR_STAGEOUTFAILED);

		private final String label;

		private final PilotErrorCode errorCode;

		Direction(final String label, final PilotErrorCode errorCode) {
			this.label = label;
			this.errorCode = errorCode;
		}

		/**
		 * @return the code reported when the transfer fails
		 */
		public PilotErrorCode getErrorCode() {
			return errorCode;
		}

		@Override
		public String toString() {
			return label;
		}
	}

	private final Direction direction;

	private final String what;

	private final List<StageState> history = new ArrayList<>();

	private String primaryDiagnostic = null;

	private String fallbackDiagnostic = null;

	private int fallbackInvocations = 0;

	/**
	 * @param direction
	 * @param what description of the file being transferred, for the log messages
	 */
	public TwoStageTransfer(final Direction direction, final String what) {
		this.direction = direction;
		this.what = what;

		history.add(StageState.START);
	}

	private void enter(final StageState state) {
		if (getState().isTerminal())
			throw new IllegalStateException(direction + " of " + what + " already ended in " + getState());

		history.add(state);
	}

	/**
	 * Run the whole sequence
	 *
	 * @param locationCheck verifies that the physical location is known, can be <code>null</code> when no endpoint is pinned
	 * @param primary the external command
	 * @param fallback the library call, can be <code>null</code> if there is none
	 * @throws PilotException the location failure as thrown by the check, or {@link TransferFailure#TRANSFER_FAILED} with the diagnostics of all attempts
	 */
	public void execute(final TransferStage locationCheck, final TransferStage primary, final TransferStage fallback) throws PilotException {
		if (history.size() > 1)
			throw new IllegalStateException(direction + " of " + what + " was already executed");

		enter(StageState.RESOLVE_LOCATION);

		if (locationCheck != null)
			try {
				locationCheck.run();
			}
			catch (final PilotException pe) {
				enter(StageState.FAILED);
				logger.log(Level.WARNING, direction + " of " + what + ": " + pe.getMessage());
				throw pe;
			}
			catch (final IOException | InterruptedException e) {
				enter(StageState.FAILED);
				restoreInterrupt(e);
				logger.log(Level.WARNING, direction + " of " + what + ": cannot resolve the physical location", e);
				throw new PilotException(TransferFailure.UNKNOWN_PHYSICAL_LOCATION, direction.getErrorCode(), "Cannot resolve the physical location of " + what + ": " + e.getMessage(), e);
			}

		enter(StageState.PRIMARY_ATTEMPT);

		IOException primaryFailure = null;

		try {
			primary.run();
			enter(StageState.SUCCESS);
			return;
		}
		catch (final IOException ioe) {
			primaryDiagnostic = ioe.getMessage();
			primaryFailure = ioe;
		}
		catch (final InterruptedException ie) {
			primaryDiagnostic = ie.getMessage();
			enter(StageState.FAILED);
			restoreInterrupt(ie);
			throw new PilotException(TransferFailure.TRANSFER_FAILED, direction.getErrorCode(), direction + " of " + what + " was interrupted", ie);
		}

		if (fallback == null) {
			enter(StageState.FAILED);
			logger.log(Level.WARNING, direction + " failed for " + what + " and there is nothing to fall back to. Error: " + oneLine(primaryDiagnostic));

			// already classified by the primary attempt
			if (primaryFailure instanceof PilotException)
				throw (PilotException) primaryFailure;

			throw new PilotException(TransferFailure.TRANSFER_FAILED, direction.getErrorCode(), direction + " failed: " + primaryDiagnostic, primaryFailure);
		}

		logger.log(Level.WARNING, direction + " with CLI failed for " + what + "! Trying API. Error: " + oneLine(primaryDiagnostic));

		enter(StageState.FALLBACK_ATTEMPT);

		try {
			fallbackInvocations++;
			fallback.run();
		}
		catch (final IOException | InterruptedException e) {
			fallbackDiagnostic = e.getMessage();
			enter(StageState.FAILED);
			restoreInterrupt(e);

			logger.log(Level.WARNING, direction + " with API failed for " + what, e);

			throw new PilotException(TransferFailure.TRANSFER_FAILED, direction.getErrorCode(),
					direction + " failed, CLI: " + primaryDiagnostic + "; API: " + fallbackDiagnostic, e);
		}

		enter(StageState.SUCCESS);

		logger.log(Level.INFO, direction + " of " + what + " succeeded with the API");
	}

	private static void restoreInterrupt(final Exception e) {
		if (e instanceof InterruptedException)
			Thread.currentThread().interrupt();
	}

	private static String oneLine(final String s) {
		return s != null ? s.replace('\n', ' ') : null;
	}

	/**
	 * @return current state
	 */
	public StageState getState() {
		return history.get(history.size() - 1);
	}

	/**
	 * @return all the states this transfer went through, in order
	 */
	public List<StageState> getHistory() {
		return Collections.unmodifiableList(history);
	}

	/**
	 * @return why the command failed, <code>null</code> if it didn't
	 */
	public String getPrimaryDiagnostic() {
		return primaryDiagnostic;
	}

	/**
	 * @return why the library failed, <code>null</code> if it didn't or it was not needed
	 */
	public String getFallbackDiagnostic() {
		return fallbackDiagnostic;
	}

	/**
	 * @return how many times the library was called (0 or 1)
	 */
	public int getFallbackInvocations() {
		return fallbackInvocations;
	}

	@Override
	public String toString() {
		return direction + " of " + what + ": " + history;
	}
}
