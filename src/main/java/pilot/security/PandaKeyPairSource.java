package pilot.security;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UnsupportedEncodingException;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.net.ssl.HttpsURLConnection;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;

import pilot.config.ConfigProperties;
import pilot.config.ConfigUtils;

/**
 * Retrieves key pairs from the PanDA server's <code>getKeyPair</code> method, authenticating with the client
 * certificate from the configured key store
 *
 * @since Jan 19, 2017
 */
public class PandaKeyPairSource implements KeyPairSource {
	static final Logger logger = ConfigUtils.getLogger(PandaKeyPairSource.class.getCanonicalName());

	/**
	 * Default server method
	 */
	public static final String DEFAULT_URL = "https://pandaserver.cern.ch:25443/server/panda/getKeyPair";

	private final String url;

	private final String keyStore;

	private final char[] keyStorePassword;

	private final int timeout;

	/**
	 * @param url
	 * @param keyStore PKCS12 file with the client certificate, <code>null</code> to connect without one
	 * @param keyStorePassword
	 * @param timeout seconds
	 */
	public PandaKeyPairSource(final String url, final String keyStore, final String keyStorePassword, final int timeout) {
		this.url = url;
		this.keyStore = keyStore;
		this.keyStorePassword = keyStorePassword != null ? keyStorePassword.toCharArray() : new char[0];
		this.timeout = timeout;
	}

	/**
	 * @param config
	 * @return a source configured from the <code>panda.*</code> keys
	 */
	public static PandaKeyPairSource fromConfiguration(final ConfigProperties config) {
		final String ks = config.gets("panda.keystore");

		return new PandaKeyPairSource(config.gets("panda.keypair.url", DEFAULT_URL), ks.isEmpty() ? null : ks, config.gets("panda.keystore.password"), config.geti("panda.timeout", 120));
	}

	private SSLSocketFactory getSocketFactory() throws IOException {
		try (InputStream is = new FileInputStream(keyStore)) {
			final KeyStore store = KeyStore.getInstance("PKCS12");
			store.load(is, keyStorePassword);

			final KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
			kmf.init(store, keyStorePassword);

			final SSLContext context = SSLContext.getInstance("TLS");
			context.init(kmf.getKeyManagers(), null, null);

			return context.getSocketFactory();
		}
		catch (final GeneralSecurityException gse) {
			throw new IOException("Cannot load the client certificate from " + keyStore, gse);
		}
	}

	/**
	 * @param body <code>key=value&amp;key=value</code> reply
	 * @return the decoded fields
	 */
	static Map<String, String> parseReply(final String body) {
		final Map<String, String> ret = new HashMap<>();

		for (final String pair : body.trim().split("&")) {
			final int idx = pair.indexOf('=');

			if (idx <= 0)
				continue;

			try {
				ret.put(URLDecoder.decode(pair.substring(0, idx), "UTF-8"), URLDecoder.decode(pair.substring(idx + 1), "UTF-8"));
			}
			catch (final UnsupportedEncodingException uee) {
				throw new IllegalStateException("UTF-8 is always supported", uee);
			}
		}

		return ret;
	}

	@Override
	public KeyPair getKeyPair(final String privateKeyName, final String publicKeyName) throws IOException {
		final String data = "privateKeyName=" + URLEncoder.encode(privateKeyName, "UTF-8") + "&publicKeyName=" + URLEncoder.encode(publicKeyName, "UTF-8");

		final HttpURLConnection conn = (HttpURLConnection) new URL(url).openConnection();

		if (keyStore != null && conn instanceof HttpsURLConnection)
			((HttpsURLConnection) conn).setSSLSocketFactory(getSocketFactory());

		conn.setRequestMethod("POST");
		conn.setConnectTimeout(timeout * 1000);
		conn.setReadTimeout(timeout * 1000);
		conn.setDoOutput(true);
		conn.setRequestProperty("Content-Type", "application/x-www-form-urlencoded");

		final StringBuilder sb = new StringBuilder();

		try {
			try (OutputStream os = conn.getOutputStream()) {
				os.write(data.getBytes(StandardCharsets.UTF_8));
			}

			if (conn.getResponseCode() != HttpURLConnection.HTTP_OK)
				throw new IOException("PanDA server replied with HTTP " + conn.getResponseCode());

			try (BufferedReader br = new BufferedReader(new InputStreamReader(conn.getInputStream(), StandardCharsets.UTF_8))) {
				String line;

				while ((line = br.readLine()) != null)
					sb.append(line);
			}
		}
		finally {
			conn.disconnect();
		}

		final Map<String, String> reply = parseReply(sb.toString());

		if (!"0".equals(reply.get("StatusCode"))) {
			logger.log(Level.WARNING, "Failed to get key from PanDA server: " + reply.get("StatusCode"));
			throw new IOException("PanDA server returned StatusCode=" + reply.get("StatusCode") + " for (" + privateKeyName + ", " + publicKeyName + ")");
		}

		return new KeyPair(reply.get("publicKey"), reply.get("privateKey"));
	}

	@Override
	public String toString() {
		return url;
	}
}
