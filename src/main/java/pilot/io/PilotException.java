package pilot.io;

import java.io.IOException;

/**
 * Staging failure, carrying both the internal failure kind and the error code reported to the dispatcher
 */
public class PilotException extends IOException {

	private static final long serialVersionUID = 3390417221738917525L;

	private final TransferFailure failure;

	private final PilotErrorCode errorCode;

	/**
	 * @param failure what went wrong
	 * @param errorCode public code
	 * @param reason
	 */
	public PilotException(final TransferFailure failure, final PilotErrorCode errorCode, final String reason) {
		super(reason);
		this.failure = failure;
		this.errorCode = errorCode;
	}

	/**
	 * @param failure what went wrong
	 * @param errorCode public code
	 * @param reason
	 * @param cause
	 */
	public PilotException(final TransferFailure failure, final PilotErrorCode errorCode, final String reason, final Throwable cause) {
		super(reason, cause);
		this.failure = failure;
		this.errorCode = errorCode;
	}

	/**
	 * @return the internal failure kind
	 */
	public TransferFailure getFailure() {
		return failure;
	}

	/**
	 * @return the code to report to the dispatcher
	 */
	public PilotErrorCode getErrorCode() {
		return errorCode;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[" + errorCode + "/" + failure + "]: " + getMessage();
	}
}
