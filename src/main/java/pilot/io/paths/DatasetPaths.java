package pilot.io.paths;

import java.util.regex.Pattern;

/**
 * Legacy, dataset name driven layout: files are grouped in directories derived from the fields of the dataset name
 */
public final class DatasetPaths {
	private static final Pattern DATASET_SUFFIX = Pattern.compile("_(tid|sub|dis)\\d+$");

	private DatasetPaths() {
		// static helpers only
	}

	/**
	 * <ul>
	 * <li><code>project.number.name.step.datatype[.tags]</code> -&gt; <code>/project/datatype/dataset/</code></li>
	 * <li><code>user.nickname.anything</code> (and <code>group.</code>) -&gt; <code>/user/nickname/dataset/</code></li>
	 * </ul>
	 * The dataset directory drops the <code>_tid/_sub/_dis</code> suffix.
	 *
	 * @param dsname
	 * @return the directory, with leading and trailing slash
	 * @throws IllegalArgumentException if the name doesn't follow the naming convention
	 */
	public static String getDatasetDirectory(final String dsname) {
		if (dsname == null || dsname.isEmpty())
			throw new IllegalArgumentException("Dataset name is not set");

		final String base = DATASET_SUFFIX.matcher(dsname).replaceFirst("");

		final String[] fields = base.split("\\.");

		if ((fields[0].equals("user") || fields[0].equals("group")) && fields.length >= 3)
			return "/" + fields[0] + "/" + fields[1] + "/" + base + "/";

		if (fields.length < 5)
			throw new IllegalArgumentException("Unknown dataset name format: " + dsname);

		return "/" + fields[0] + "/" + fields[4] + "/" + base + "/";
	}
}
