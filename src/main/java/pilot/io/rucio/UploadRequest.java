package pilot.io.rucio;

import java.io.File;

/**
 * Parameters of one library upload
 */
public class UploadRequest {
	/**
	 * Local file
	 */
	public final File path;

	/**
	 * Destination endpoint
	 */
	public final String rse;

	/**
	 * Scope of the file
	 */
	public final String scope;

	/**
	 * Explicit physical location, for non-deterministic endpoints
	 */
	public String pfn;

	/**
	 * Unique identifier, for files that must be registered with it
	 */
	public String guid;

	/**
	 * Skip the catalog registration
	 */
	public boolean noRegister = true;

	/**
	 * @param path
	 * @param rse
	 * @param scope
	 */
	public UploadRequest(final File path, final String rse, final String scope) {
		this.path = path;
		this.rse = rse;
		this.scope = scope;
	}

	@Override
	public String toString() {
		return scope + ":" + path.getName() + " -> " + rse + (pfn != null ? " (" + pfn + ")" : "") + (guid != null ? ", guid " + guid : "");
	}
}
