package pilot.io.rucio;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UnsupportedEncodingException;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import pilot.config.ConfigProperties;
import pilot.config.ConfigUtils;

/**
 * {@link RucioClient} talking directly to the rucio REST server. Only HTTP based replicas (https, davs) can be
 * transferred in process, everything else is left to the command line tools.
 *
 * @since Apr 4, 2018
 */
public class RucioRestClient implements RucioClient {
	static final Logger logger = ConfigUtils.getLogger(RucioRestClient.class.getCanonicalName());

	/**
	 * Default server
	 */
	public static final String DEFAULT_HOST = "https://rucio-lb-prod.cern.ch";

	private final String host;

	private final String authToken;

	private final int connectTimeout;

	private final int readTimeout;

	/**
	 * @param host server base URL
	 * @param authToken value of the X-Rucio-Auth-Token header, can be <code>null</code>
	 * @param connectTimeout seconds
	 * @param readTimeout seconds
	 */
	public RucioRestClient(final String host, final String authToken, final int connectTimeout, final int readTimeout) {
		this.host = host.endsWith("/") ? host.substring(0, host.length() - 1) : host;
		this.authToken = authToken;
		this.connectTimeout = connectTimeout;
		this.readTimeout = readTimeout;
	}

	/**
	 * Client configured from the <code>rucio.*</code> keys of the main configuration
	 *
	 * @param config
	 * @return the client
	 */
	public static RucioRestClient fromConfiguration(final ConfigProperties config) {
		String token = config.gets("rucio.auth.token");

		final String tokenFile = config.gets("rucio.auth.token.file");

		if (token.isEmpty() && !tokenFile.isEmpty())
			try {
				token = new String(Files.readAllBytes(new File(tokenFile).toPath()), StandardCharsets.UTF_8).trim();
			}
			catch (final IOException ioe) {
				logger.log(Level.WARNING, "Cannot read the rucio token from " + tokenFile, ioe);
			}

		return new RucioRestClient(config.gets("rucio.host", DEFAULT_HOST), token.isEmpty() ? null : token, config.geti("rucio.connect.timeout", 30), config.geti("rucio.read.timeout", 600));
	}

	private HttpURLConnection open(final String url, final String method) throws IOException {
		final HttpURLConnection conn = (HttpURLConnection) new URL(url).openConnection();
		conn.setRequestMethod(method);
		conn.setConnectTimeout(connectTimeout * 1000);
		conn.setReadTimeout(readTimeout * 1000);
		conn.setRequestProperty("User-Agent", "pilot-movers");

		if (authToken != null)
			conn.setRequestProperty("X-Rucio-Auth-Token", authToken);

		return conn;
	}

	private static String encode(final String s) {
		try {
			return URLEncoder.encode(s, "UTF-8");
		}
		catch (final UnsupportedEncodingException uee) {
			throw new IllegalStateException("UTF-8 is always supported", uee);
		}
	}

	private static void checkResponse(final HttpURLConnection conn, final String what) throws IOException {
		final int code = conn.getResponseCode();

		if (code >= 200 && code < 300)
			return;

		final StringBuilder sb = new StringBuilder();

		final InputStream err = conn.getErrorStream();

		if (err != null)
			try (BufferedReader br = new BufferedReader(new InputStreamReader(err, StandardCharsets.UTF_8))) {
				String line;

				while ((line = br.readLine()) != null)
					sb.append(line);
			}

		throw new IOException(what + " failed with HTTP " + code + ": " + sb);
	}

	@Override
	public List<String> listReplicas(final String scope, final String name, final String scheme, final String rseExpression) throws IOException {
		final StringBuilder url = new StringBuilder(host).append("/replicas/").append(encode(scope)).append('/').append(encode(name));

		url.append("?schemes=").append(encode(scheme));

		if (rseExpression != null && !rseExpression.isEmpty())
			url.append("&rse_expression=").append(encode(rseExpression));

		final HttpURLConnection conn = open(url.toString(), "GET");
		conn.setRequestProperty("Accept", "application/x-json-stream");

		final List<String> ret = new ArrayList<>();

		try {
			checkResponse(conn, "Listing replicas of " + scope + ":" + name);

			final JSONParser parser = new JSONParser();

			try (BufferedReader br = new BufferedReader(new InputStreamReader(conn.getInputStream(), StandardCharsets.UTF_8))) {
				String line;

				while ((line = br.readLine()) != null) {
					if (line.trim().isEmpty())
						continue;

					final Object o = parser.parse(line);

					if (!(o instanceof JSONObject))
						continue;

					final Object rses = ((JSONObject) o).get("rses");

					if (rses instanceof Map)
						for (final Map.Entry<?, ?> entry : ((Map<?, ?>) rses).entrySet())
							if ((rseExpression == null || rseExpression.isEmpty() || rseExpression.equals(entry.getKey())) && entry.getValue() instanceof List)
								for (final Object pfn : (List<?>) entry.getValue())
									ret.add(pfn.toString());
				}
			}
			catch (final ParseException pe) {
				throw new IOException("Cannot parse the replica list of " + scope + ":" + name, pe);
			}
		}
		finally {
			conn.disconnect();
		}

		if (logger.isLoggable(Level.FINE))
			logger.log(Level.FINE, "Replicas of " + scope + ":" + name + " at " + rseExpression + ": " + ret);

		return ret;
	}

	private static boolean isHttp(final String url) {
		return url.startsWith("https://") || url.startsWith("http://") || url.startsWith("davs://");
	}

	private static String toHttp(final String url) {
		if (url.startsWith("davs://"))
			return "https://" + url.substring(7);

		return url;
	}

	@Override
	public File download(final String scope, final String name, final String rse, final String pfn, final File dir) throws IOException {
		String source = pfn;

		if (source == null || source.isEmpty()) {
			source = null;

			for (final String candidate : listReplicas(scope, name, "davs", rse))
				if (isHttp(candidate)) {
					source = candidate;
					break;
				}

			if (source == null)
				throw new IOException("No HTTP accessible replica of " + scope + ":" + name + " at `" + rse + "`");
		}
		else if (!isHttp(source))
			throw new IOException("Cannot download " + source + " in process, only HTTP based protocols are supported");

		final File target = new File(new File(dir, scope), name);

		final File parent = target.getParentFile();

		if (!parent.isDirectory() && !parent.mkdirs())
			throw new IOException("Cannot create " + parent.getAbsolutePath());

		logger.log(Level.INFO, "Downloading " + source + " to " + target.getAbsolutePath());

		final HttpURLConnection conn = open(toHttp(source), "GET");

		try {
			checkResponse(conn, "Download of " + source);

			try (InputStream is = conn.getInputStream()) {
				Files.copy(is, target.toPath(), StandardCopyOption.REPLACE_EXISTING);
			}
		}
		finally {
			conn.disconnect();
		}

		return target;
	}

	private String lfn2pfn(final String rse, final String scope, final String name) throws IOException {
		final String did = scope + ":" + name;

		final HttpURLConnection conn = open(host + "/rses/" + encode(rse) + "/lfns2pfns?lfns=" + encode(did) + "&scheme=davs&operation=write", "GET");

		try {
			checkResponse(conn, "Translating " + did + " at " + rse);

			try (BufferedReader br = new BufferedReader(new InputStreamReader(conn.getInputStream(), StandardCharsets.UTF_8))) {
				final Object o = new JSONParser().parse(br);

				if (o instanceof JSONObject && ((JSONObject) o).get(did) != null)
					return ((JSONObject) o).get(did).toString();
			}
			catch (final ParseException pe) {
				throw new IOException("Cannot parse the physical name of " + did + " at " + rse, pe);
			}
		}
		finally {
			conn.disconnect();
		}

		throw new IOException("The server returned no physical name for " + did + " at " + rse);
	}

	@Override
	public void upload(final UploadRequest request) throws IOException {
		if (!request.path.isFile())
			throw new IOException("Local file " + request.path.getAbsolutePath() + " doesn't exist");

		if (!request.noRegister)
			throw new IOException("Registration of uploads is not supported in process");

		final String destination = request.pfn != null && !request.pfn.isEmpty() ? request.pfn : lfn2pfn(request.rse, request.scope, request.path.getName());

		if (!isHttp(destination))
			throw new IOException("Cannot upload to " + destination + " in process, only HTTP based protocols are supported");

		logger.log(Level.INFO, "Uploading " + request + " to " + destination);

		final HttpURLConnection conn = open(toHttp(destination), "PUT");
		conn.setDoOutput(true);
		conn.setFixedLengthStreamingMode(request.path.length());

		try {
			try (OutputStream os = conn.getOutputStream()) {
				Files.copy(request.path.toPath(), os);
			}

			checkResponse(conn, "Upload of " + request);
		}
		finally {
			conn.disconnect();
		}
	}

	@Override
	public String toString() {
		return "RucioRestClient(" + host + ")";
	}
}
