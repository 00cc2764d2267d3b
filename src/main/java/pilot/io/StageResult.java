package pilot.io;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a stage operation reports back. Two shapes exist: the location one (endpoint, storage URL, physical name) and
 * the checksum one (checksum type, checksum, file size). {@link #toMap()} exposes exactly the keys of the shape.
 */
public final class StageResult {
	/**
	 * Shapes of the reply
	 */
	public enum Shape {
		/**
		 * endpoint, storageURL, physicalName
		 */
		LOCATION,
		/**
		 * checksumType, checksum, fileSize
		 */
		CHECKSUM
	}

	private final Shape shape;

	private final Map<String, Object> values;

	private StageResult(final Shape shape, final Map<String, Object> values) {
		this.shape = shape;
		this.values = Collections.unmodifiableMap(values);
	}

	/**
	 * @param endpoint
	 * @param storageURL can be <code>null</code>
	 * @param physicalName
	 * @return location-shaped result
	 */
	public static StageResult location(final String endpoint, final String storageURL, final String physicalName) {
		final Map<String, Object> m = new LinkedHashMap<>();
		m.put("endpoint", endpoint);
		m.put("storageURL", storageURL);
		m.put("physicalName", physicalName);
		return new StageResult(Shape.LOCATION, m);
	}

	/**
	 * @param checksumType
	 * @param checksum
	 * @param fileSize
	 * @return checksum-shaped result
	 */
	public static StageResult checksum(final String checksumType, final String checksum, final long fileSize) {
		final Map<String, Object> m = new LinkedHashMap<>();
		m.put("checksumType", checksumType);
		m.put("checksum", checksum);
		m.put("fileSize", Long.valueOf(fileSize));
		return new StageResult(Shape.CHECKSUM, m);
	}

	/**
	 * @return the shape of this reply
	 */
	public Shape getShape() {
		return shape;
	}

	/**
	 * @param key
	 * @return the value, or <code>null</code> if not part of this shape
	 */
	public Object get(final String key) {
		return values.get(key);
	}

	/**
	 * @return the endpoint of a location reply
	 */
	public String getEndpoint() {
		return (String) values.get("endpoint");
	}

	/**
	 * @return the storage URL of a location reply
	 */
	public String getStorageURL() {
		return (String) values.get("storageURL");
	}

	/**
	 * @return the physical name of a location reply
	 */
	public String getPhysicalName() {
		return (String) values.get("physicalName");
	}

	/**
	 * @return read-only view with exactly the keys of the shape
	 */
	public Map<String, Object> toMap() {
		return values;
	}

	@Override
	public String toString() {
		return shape + values.toString();
	}
}
