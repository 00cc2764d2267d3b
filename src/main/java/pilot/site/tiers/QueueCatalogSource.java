package pilot.site.tiers;

import java.io.IOException;

import org.json.simple.JSONObject;

/**
 * Where the full queue catalog (<code>queue name -&gt; attributes</code>) comes from
 */
public interface QueueCatalogSource {
	/**
	 * @return the parsed catalog document
	 * @throws IOException if the document cannot be retrieved or parsed
	 */
	JSONObject load() throws IOException;
}
