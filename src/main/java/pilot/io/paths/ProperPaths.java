package pilot.io.paths;

import pilot.io.PilotErrorCode;
import pilot.io.PilotException;
import pilot.io.TransferFailure;

/**
 * Outcome of a path resolution: either an error (code, message, tracer error) or the physical path, the catalog
 * directory and the storage URL of the file
 */
public final class ProperPaths {
	/**
	 * Error code, <code>null</code> on success
	 */
	public final PilotErrorCode errorCode;

	/**
	 * Failure kind, <code>null</code> on success
	 */
	public final TransferFailure failure;

	/**
	 * Human readable diagnostic, empty on success
	 */
	public final String errorMessage;

	/**
	 * Short error tag for the transfer traces, empty on success
	 */
	public final String tracerError;

	/**
	 * Physical path of the file inside the storage
	 */
	public final String physicalPath;

	/**
	 * Directory holding the file in the catalog namespace
	 */
	public final String catalogDir;

	/**
	 * Full storage URL
	 */
	public final String storageURL;

	private ProperPaths(final PilotErrorCode errorCode, final TransferFailure failure, final String errorMessage, final String tracerError, final String physicalPath, final String catalogDir,
			final String storageURL) {
		this.errorCode = errorCode;
		this.failure = failure;
		this.errorMessage = errorMessage;
		this.tracerError = tracerError;
		this.physicalPath = physicalPath;
		this.catalogDir = catalogDir;
		this.storageURL = storageURL;
	}

	/**
	 * @param physicalPath
	 * @param catalogDir
	 * @param storageURL
	 * @return successful resolution
	 */
	static ProperPaths ok(final String physicalPath, final String catalogDir, final String storageURL) {
		return new ProperPaths(null, null, "", "", physicalPath, catalogDir, storageURL);
	}

	/**
	 * @param errorCode
	 * @param failure
	 * @param errorMessage
	 * @param tracerError
	 * @return failed resolution
	 */
	static ProperPaths error(final PilotErrorCode errorCode, final TransferFailure failure, final String errorMessage, final String tracerError) {
		return new ProperPaths(errorCode, failure, errorMessage, tracerError, "", "", "");
	}

	/**
	 * @return <code>true</code> if the paths could be resolved
	 */
	public boolean isOK() {
		return errorCode == null;
	}

	/**
	 * @return the error as an exception, to propagate it further
	 */
	public PilotException toException() {
		if (isOK())
			throw new IllegalStateException("Resolution was successful, there is no error to report");

		return new PilotException(failure, errorCode, errorMessage + " (" + tracerError + ")");
	}

	@Override
	public String toString() {
		if (!isOK())
			return errorCode + "/" + tracerError + ": " + errorMessage;

		return "SURL = " + storageURL + ", path = " + physicalPath + ", catalog dir = " + catalogDir;
	}
}
