package pilot.io.movers;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The movers this pilot knows about, by the copy tool name used in the queue configuration
 */
public enum MoverType {
	/**
	 * rucio command line tools, with the rucio client library as fallback
	 */
	RUCIO("rucio", "srm", "gsiftp", "root", "https", "s3", "s3+rucio", "davs") {
		@Override
		SiteMover create(final MoverEnvironment env) {
			return new RucioSiteMover(env);
		}
	},

	/**
	 * Shared POSIX storage: symbolic links to the physical files for stage-in, local moves for stage-out
	 */
	STORM("storm", "file", "srm", "root", "https", "gsiftp") {
		@Override
		SiteMover create(final MoverEnvironment env) {
			return new StormSiteMover(env);
		}
	};

	private final String copyTool;

	private final List<String> schemes;

	MoverType(final String copyTool, final String... schemes) {
		this.copyTool = copyTool;
		this.schemes = Collections.unmodifiableList(Arrays.asList(schemes));
	}

	/**
	 * @param env
	 * @return a new mover of this type
	 */
	abstract SiteMover create(MoverEnvironment env);

	/**
	 * @return name as found in the <code>copytool</code> field
	 */
	public String getCopyTool() {
		return copyTool;
	}

	/**
	 * @return the URL schemes this mover can work with
	 */
	public List<String> getSchemes() {
		return schemes;
	}

	/**
	 * @param scheme
	 * @return <code>true</code> if this mover can handle URLs of this kind
	 */
	public boolean supports(final String scheme) {
		return scheme != null && schemes.contains(scheme.toLowerCase());
	}

	/**
	 * @param name copy tool name
	 * @return the mover type
	 * @throws IllegalArgumentException if no mover has this name
	 */
	public static MoverType fromName(final String name) {
		if (name != null)
			for (final MoverType t : values())
				if (t.copyTool.equalsIgnoreCase(name.trim()))
					return t;

		throw new IllegalArgumentException("Unknown copy tool: `" + name + "`");
	}

	@Override
	public String toString() {
		return copyTool;
	}
}
