package pilot.io.paths;

/**
 * Naming convention of the destination storage
 */
public enum Namespace {
	/**
	 * Hash based, content addressed rucio layout
	 */
	RUCIO,
	/**
	 * Directories derived from the dataset name
	 */
	DATASET,
	/**
	 * Rucio when the destination path is under a rucio root, dataset otherwise
	 */
	AUTO;

	/**
	 * @param s configuration value
	 * @return the matching convention, {@link #AUTO} for unknown values
	 */
	public static Namespace fromString(final String s) {
		if (s != null)
			for (final Namespace n : values())
				if (n.name().equalsIgnoreCase(s.trim()))
					return n;

		return AUTO;
	}

	/**
	 * @param destination
	 * @return the effective convention for the given destination
	 */
	public Namespace resolve(final String destination) {
		if (this != AUTO)
			return this;

		return RucioPaths.isRucioPath(destination) ? RUCIO : DATASET;
	}
}
