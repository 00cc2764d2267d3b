package pilot.io;

import utils.StatusCode;
import utils.StatusType;

/**
 * What actually went wrong in a stage-in / stage-out attempt. Finer grained than {@link PilotErrorCode}, which is what gets reported.
 */
public enum TransferFailure implements StatusCode {
	/**
	 * A required destination path or endpoint mapping is absent from the configuration
	 */
	CONFIGURATION_MISSING("A required destination path or endpoint mapping is absent, fatal for the current attempt", StatusType.CONFIGURATION_ERROR, true),

	/**
	 * Non-deterministic endpoint without a pre-resolved transfer URL
	 */
	UNKNOWN_PHYSICAL_LOCATION("The endpoint is not deterministic and no transfer URL was resolved for the file", StatusType.CONFIGURATION_ERROR, true),

	/**
	 * Both the command line tool and the client library failed
	 */
	TRANSFER_FAILED("The transfer tools failed, the fallback mechanism was attempted before giving up", StatusType.TRANSFER_ERROR, false),

	/**
	 * The downloaded file could not be moved to the requested location
	 */
	RELOCATION_FAILED("The download succeeded but the file could not be moved to its final location", StatusType.INTERNAL_ERROR, true),

	/**
	 * Location metadata could not be retrieved or parsed in time
	 */
	METADATA_LOOKUP_FAILED("Physical location metadata could not be retrieved or parsed within the time limit", StatusType.FILE_INACCESSIBLE, true),

	/**
	 * No alternative queue / endpoint could be determined
	 */
	FAILOVER_UNAVAILABLE("No alternative queue or endpoint could be resolved, there is no alternative to fall back to", StatusType.CONFIGURATION_ERROR, true);

	private final String description;

	private final StatusType type;

	private final boolean fatal;

	TransferFailure(final String description, final StatusType type, final boolean fatal) {
		this.description = description;
		this.type = type;
		this.fatal = fatal;
	}

	@Override
	public String getDescription() {
		return description;
	}

	@Override
	public StatusType getType() {
		return type;
	}

	/**
	 * @return <code>true</code> if retrying the same attempt cannot help
	 */
	public boolean isFatal() {
		return fatal;
	}
}
