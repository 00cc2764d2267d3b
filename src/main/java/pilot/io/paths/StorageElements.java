package pilot.io.paths;

import java.util.List;

import pilot.site.QueueData;

/**
 * Parsing of the storage element ("se") entries of the queue data. An entry can carry the space token it serves:
 * <code>token:ATLASDATADISK:srm://host:8443/srm/managerv2?SFN=</code>
 */
public final class StorageElements {
	private static final String TOKEN_PREFIX = "token:";

	private StorageElements() {
		// static helpers only
	}

	/**
	 * @param fullSE
	 * @return { token (or <code>null</code>), storage element URL }
	 */
	public static String[] extractSE(final String fullSE) {
		if (fullSE == null)
			return new String[] { null, "" };

		final String s = fullSE.trim();

		if (s.startsWith(TOKEN_PREFIX)) {
			final int idx = s.indexOf(':', TOKEN_PREFIX.length());

			if (idx > 0)
				return new String[] { s.substring(TOKEN_PREFIX.length(), idx), s.substring(idx + 1) };
		}

		return new String[] { null, s };
	}

	/**
	 * @param url
	 * @return the URL without a leading <code>token:NAME:</code> part
	 */
	public static String stripToken(final String url) {
		return extractSE(url)[1];
	}

	/**
	 * @param queueData
	 * @param token space token, can be <code>null</code>
	 * @return the entry serving the token, or the first entry, as it appears in the queue data (token prefix included). Empty if none defined.
	 */
	public static String getProperSE(final QueueData queueData, final String token) {
		final List<String> entries = queueData.getList(QueueData.SE);

		if (entries.isEmpty())
			return "";

		if (token != null && !token.isEmpty())
			for (final String entry : entries)
				if (token.equals(extractSE(entry)[0]))
					return entry;

		return entries.get(0);
	}

	/**
	 * @param paths candidate paths
	 * @param token
	 * @return the path that mentions the token (case insensitive), or the first one. Empty if there are no paths.
	 */
	static String selectByToken(final List<String> paths, final String token) {
		if (paths.isEmpty())
			return "";

		if (token != null && !token.isEmpty()) {
			final String lowerToken = token.toLowerCase();

			for (final String path : paths)
				if (path.toLowerCase().contains(lowerToken))
					return path;
		}

		return paths.get(0);
	}
}
