package pilot.io;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Descriptor of one file taking part in a transfer. Owned by exactly one in-flight operation, the resolution and
 * transfer steps fill in the location and checksum fields as they go.
 */
public class FileSpec implements Serializable {

	private static final long serialVersionUID = 8211893470183551637L;

	/**
	 * Logical scope
	 */
	public final String scope;

	/**
	 * Logical file name
	 */
	public final String lfn;

	/**
	 * Target (stage-out) or source (stage-in) storage endpoint
	 */
	public String ddmendpoint;

	/**
	 * Candidate physical locations, in order of preference. If not empty, stage-in goes through them and ignores {@link #ddmendpoint}.
	 */
	public final List<Replica> replicas = new ArrayList<>();

	/**
	 * Transfer URL
	 */
	public String turl;

	/**
	 * Storage URL
	 */
	public String surl;

	/**
	 * Physical (local) file name
	 */
	public String pfn;

	/**
	 * Relax the endpoint pinning, any replica will do
	 */
	public boolean allowAllInputRSEs = false;

	/**
	 * Storage identifier, a positive value selects the identifier-addressed upload
	 */
	public Long storageId;

	/**
	 * Unique identifier, registered for ROOT files
	 */
	public String guid;

	/**
	 * Dataset the file belongs to
	 */
	public String dataset;

	/**
	 * Checksum value, filled in after the transfer
	 */
	public String checksum;

	/**
	 * Checksum algorithm
	 */
	public String checksumType;

	/**
	 * Size in bytes
	 */
	public long filesize = -1;

	/**
	 * Execution platform tag, decides the container to run the tools in
	 */
	public String cmtconfig;

	/**
	 * @param scope
	 * @param lfn
	 */
	public FileSpec(final String scope, final String lfn) {
		if (scope == null || scope.isEmpty() || lfn == null || lfn.isEmpty())
			throw new IllegalArgumentException("Both scope and lfn are required, got " + scope + ":" + lfn);

		this.scope = scope;
		this.lfn = lfn;
	}

	/**
	 * @return <code>true</code> if the replica list drives the stage-in
	 */
	public boolean hasReplicas() {
		return !replicas.isEmpty();
	}

	/**
	 * @return the endpoint the file is pinned to: the first replica, or the ddmendpoint when there are no replicas
	 */
	public String getPinnedEndpoint() {
		return hasReplicas() ? replicas.get(0).endpoint : ddmendpoint;
	}

	/**
	 * @return <code>true</code> if the storage id is set and positive
	 */
	public boolean hasStorageId() {
		return storageId != null && storageId.longValue() > 0;
	}

	/**
	 * @return <code>true</code> for the container format whose registration needs a guid
	 */
	public boolean isRootFile() {
		return lfn.contains(".root");
	}


	/**
	 * @return scope:lfn
	 */
	public String getDid() {
		return scope + ":" + lfn;
	}

	@Override
	public String toString() {
		return getDid() + "@" + (hasReplicas() ? replicas.toString() : ddmendpoint);
	}
}
