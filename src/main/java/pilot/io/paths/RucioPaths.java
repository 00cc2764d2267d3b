package pilot.io.paths;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic (hash based) layout of a rucio managed storage
 */
public final class RucioPaths {
	/**
	 * Capability root segment of rucio managed paths
	 */
	public static final String RUCIO = "rucio";

	private RucioPaths() {
		// static helpers only
	}

	/**
	 * <code>scope/aa/bb/name</code>, where aabb are the first four hex digits of md5("scope:name"). User and group scopes
	 * become directories (dots are replaced by slashes).
	 *
	 * @param scope
	 * @param name
	 * @return the path of the file relative to the rucio root
	 */
	public static String getPathFromScope(final String scope, final String name) {
		final String hstr = md5(scope + ":" + name);

		final String scopePath = scope.startsWith("user") || scope.startsWith("group") ? scope.replace('.', '/') : scope;

		return scopePath + "/" + hstr.substring(0, 2) + "/" + hstr.substring(2, 4) + "/" + name;
	}

	private static String md5(final String s) {
		try {
			final MessageDigest md = MessageDigest.getInstance("MD5");

			return String.format("%032x", new BigInteger(1, md.digest(s.getBytes(StandardCharsets.UTF_8))));
		}
		catch (final NoSuchAlgorithmException e) {
			throw new IllegalStateException("MD5 is not available in this JVM", e);
		}
	}

	/**
	 * @param path
	 * @return <code>true</code> if the path is under a rucio root
	 */
	public static boolean isRucioPath(final String path) {
		return path != null && path.contains("/" + RUCIO);
	}
}
