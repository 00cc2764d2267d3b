package pilot.io.paths;

/**
 * Builds the complete storage URL of a file in a rucio managed destination
 */
public class RucioPathBuilder {
	private final PathResolver resolver;

	/**
	 * @param resolver where the storage element and destination roots come from
	 */
	RucioPathBuilder(final PathResolver resolver) {
		this.resolver = resolver;
	}

	/**
	 * @param scope
	 * @param token
	 * @param filename
	 * @param analysisJob
	 * @param alt use the alternative destination
	 * @return storage element + destination + hashed path
	 */
	public String getFullPath(final String scope, final String token, final String filename, final boolean analysisJob, final boolean alt) {
		final String se = StorageElements.stripToken(resolver.getProperSE(token, alt));
		final String destination = resolver.getPreDestination(analysisJob, token, alt);

		return se + destination + "/" + RucioPaths.getPathFromScope(scope, filename);
	}
}
