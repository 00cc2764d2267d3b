package pilot.io;

import utils.StatusCode;
import utils.StatusType;

/**
 * Error codes reported back to the job dispatcher. These are the public signal, monitoring keys on the numeric values.
 */
public enum PilotErrorCode implements StatusCode {
	/**
	 * Input file could not be staged in
	 */
	ERR_STAGEINFAILED(1099, "Failed to stage-in file", StatusType.TRANSFER_ERROR),

	/**
	 * Setup problem on the worker node
	 */
	ERR_SETUPFAILURE(1110, "Failed during setup", StatusType.CONFIGURATION_ERROR),

	/**
	 * Queue configuration could not be obtained
	 */
	ERR_QUEUEDATA(1116, "Pilot could not download queuedata", StatusType.CONFIGURATION_ERROR),

	/**
	 * Output file could not be staged out
	 */
	ERR_STAGEOUTFAILED(1137, "Failed to stage-out file", StatusType.TRANSFER_ERROR),

	/**
	 * Queue configuration is not usable (e.g. queue is offline)
	 */
	ERR_QUEUEDATANOTOK(1142, "Pilot found non-valid queuedata", StatusType.CONFIGURATION_ERROR),

	/**
	 * Software directory does not exist
	 */
	ERR_NOSOFTWAREDIR(1186, "Software directory does not exist", StatusType.CONFIGURATION_ERROR);

	private final int code;

	private final String description;

	private final StatusType type;

	PilotErrorCode(final int code, final String description, final StatusType type) {
		this.code = code;
		this.description = description;
		this.type = type;
	}

	/**
	 * @return numeric code, as known by the dispatcher
	 */
	public int getCode() {
		return code;
	}

	@Override
	public String getDescription() {
		return description;
	}

	@Override
	public StatusType getType() {
		return type;
	}
}
