package pilot.io;

import java.io.Serializable;

/**
 * One candidate physical location of a file
 */
public class Replica implements Serializable {

	private static final long serialVersionUID = -2601771452063925034L;

	/**
	 * Storage endpoint (RSE) holding the copy
	 */
	public final String endpoint;

	/**
	 * Physical file name at that endpoint, can be <code>null</code>
	 */
	public final String pfn;

	/**
	 * @param endpoint
	 * @param pfn
	 */
	public Replica(final String endpoint, final String pfn) {
		this.endpoint = endpoint;
		this.pfn = pfn;
	}

	@Override
	public String toString() {
		return endpoint + (pfn != null ? " (" + pfn + ")" : "");
	}
}
