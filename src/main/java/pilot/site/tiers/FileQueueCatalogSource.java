package pilot.site.tiers;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;

import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * Queue catalog read from a local JSON file
 */
public class FileQueueCatalogSource implements QueueCatalogSource {
	private final File file;

	/**
	 * @param file
	 */
	public FileQueueCatalogSource(final File file) {
		this.file = file;
	}

	/**
	 * @return the file this source reads
	 */
	public File getFile() {
		return file;
	}

	@Override
	public JSONObject load() throws IOException {
		if (!file.isFile())
			throw new IOException("Queue catalog " + file.getAbsolutePath() + " doesn't exist");

		try (Reader r = new FileReader(file)) {
			final Object o = new JSONParser().parse(r);

			if (!(o instanceof JSONObject))
				throw new IOException("Queue catalog " + file.getAbsolutePath() + " is not a JSON object");

			return (JSONObject) o;
		}
		catch (final ParseException pe) {
			throw new IOException("Cannot parse the queue catalog " + file.getAbsolutePath(), pe);
		}
	}

	@Override
	public String toString() {
		return file.getAbsolutePath();
	}
}
