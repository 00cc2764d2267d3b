package pilot.security;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

import pilot.config.ConfigUtils;

/**
 * Caches the key pairs for the lifetime of the process. Each pair is retrieved at most once successfully, failures are
 * not cached so that the next request tries again.
 *
 * @since Jan 19, 2017
 */
public class SecurityKeyCache {
	static final Logger logger = ConfigUtils.getLogger(SecurityKeyCache.class.getCanonicalName());

	private final KeyPairSource source;

	private final Map<String, KeyPair> keys = new HashMap<>();

	private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();

	private final ReentrantReadWriteLock.ReadLock readLock = rwLock.readLock();

	private final ReentrantReadWriteLock.WriteLock writeLock = rwLock.writeLock();

	/**
	 * @param source
	 */
	public SecurityKeyCache(final KeyPairSource source) {
		this.source = source;
	}

	/**
	 * @param privateKeyName
	 * @param publicKeyName
	 * @return the key pair, {@link KeyPair#EMPTY} if it cannot be retrieved
	 */
	public KeyPair get(final String privateKeyName, final String publicKeyName) {
		final String keyName = privateKeyName + "_" + publicKeyName;

		readLock.lock();

		try {
			final KeyPair cached = keys.get(keyName);

			if (cached != null)
				return cached;
		}
		finally {
			readLock.unlock();
		}

		writeLock.lock();

		try {
			final KeyPair cached = keys.get(keyName);

			if (cached != null)
				return cached;

			final KeyPair pair;

			try {
				pair = source.getKeyPair(privateKeyName, publicKeyName);
			}
			catch (final IOException ioe) {
				logger.log(Level.WARNING, "Failed to getKeyPair for (" + privateKeyName + ", " + publicKeyName + ")", ioe);
				return KeyPair.EMPTY;
			}

			if (pair == null || !pair.isValid()) {
				logger.log(Level.WARNING, "Failed to get key (" + privateKeyName + ", " + publicKeyName + ") from " + source);
				return KeyPair.EMPTY;
			}

			keys.put(keyName, pair);

			return pair;
		}
		finally {
			writeLock.unlock();
		}
	}

	/**
	 * @return how many pairs are cached
	 */
	public int size() {
		readLock.lock();

		try {
			return keys.size();
		}
		finally {
			readLock.unlock();
		}
	}
}
