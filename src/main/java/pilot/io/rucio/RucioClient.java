package pilot.io.rucio;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * In-process access to the data management system. Used when the command line tools are not available or fail.
 */
public interface RucioClient {
	/**
	 * Download a file in <code>{dir}/{scope}/{name}</code>, the same layout as the command line tool produces
	 *
	 * @param scope
	 * @param name
	 * @param rse endpoint to read from, <code>null</code> or empty for any
	 * @param pfn explicit physical location, <code>null</code> to let the endpoint decide
	 * @param dir target directory
	 * @return the downloaded file
	 * @throws IOException
	 */
	File download(String scope, String name, String rse, String pfn, File dir) throws IOException;

	/**
	 * Upload a local file, without registering it in the catalog
	 *
	 * @param request
	 * @throws IOException
	 */
	void upload(UploadRequest request) throws IOException;

	/**
	 * @param scope
	 * @param name
	 * @param scheme only replicas reachable with this protocol, e.g. "davs"
	 * @param rseExpression endpoint(s) to look at
	 * @return the physical replica URLs at the matching endpoints, possibly empty
	 * @throws IOException
	 */
	List<String> listReplicas(String scope, String name, String scheme, String rseExpression) throws IOException;
}
