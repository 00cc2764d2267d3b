package pilot.site.tiers;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.json.simple.JSONObject;

import pilot.config.ConfigUtils;

/**
 * Queue catalog downloaded once into a local cache file, that is reused afterwards
 */
public class CachedURLSource implements QueueCatalogSource {
	static final Logger logger = ConfigUtils.getLogger(CachedURLSource.class.getCanonicalName());

	private final String url;

	private final FileQueueCatalogSource cache;

	private final int timeoutSeconds;

	/**
	 * @param url where to download from
	 * @param cacheFile where to keep the content
	 * @param timeoutSeconds connect and read timeout
	 */
	public CachedURLSource(final String url, final File cacheFile, final int timeoutSeconds) {
		this.url = url;
		this.cache = new FileQueueCatalogSource(cacheFile);
		this.timeoutSeconds = timeoutSeconds;
	}

	@Override
	public JSONObject load() throws IOException {
		final File f = cache.getFile();

		if (f.isFile() && f.length() > 0)
			logger.log(Level.FINE, "File " + f.getAbsolutePath() + " already downloaded");
		else
			download(f);

		return cache.load();
	}

	private void download(final File target) throws IOException {
		logger.log(Level.INFO, "Downloading " + url + " to " + target.getAbsolutePath());

		final File tmp = new File(target.getAbsolutePath() + ".tmp");

		try {
			final URLConnection conn = new URL(url).openConnection();
			conn.setConnectTimeout(timeoutSeconds * 1000);
			conn.setReadTimeout(timeoutSeconds * 1000);

			try (InputStream is = conn.getInputStream()) {
				Files.copy(is, tmp.toPath(), StandardCopyOption.REPLACE_EXISTING);
			}

			Files.move(tmp.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
		}
		catch (final IOException ioe) {
			logger.log(Level.WARNING, "Failed to download " + url, ioe);

			if (tmp.exists() && !tmp.delete())
				logger.log(Level.WARNING, "Could not delete the partial download " + tmp.getAbsolutePath());

			throw ioe;
		}
	}

	@Override
	public String toString() {
		return url + " (cached in " + cache + ")";
	}
}
