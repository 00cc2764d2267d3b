package pilot.site.containers;

import java.util.List;

/**
 * Decorates the transfer tool command lines so that they run in the environment the job was built for
 */
public abstract class Containerizer {
	/**
	 * Working directory, bound inside the container when set
	 */
	String workdir = null;

	/**
	 * Decorating arguments to run the given command under a container. Returns a list for use with ProcessBuilders
	 *
	 * @param cmd tokens of the command to run
	 * @return the command line to execute
	 */
	public abstract List<String> containerize(List<String> cmd);

	/**
	 * @param newWorkdir
	 */
	public void setWorkdir(final String newWorkdir) {
		workdir = newWorkdir;
	}

	/**
	 * @return working directory
	 */
	public String getWorkdir() {
		return workdir;
	}

	/**
	 * @return Class name of the container wrapping code
	 */
	public String getContainerizerName() {
		return this.getClass().getSimpleName();
	}

	@Override
	public String toString() {
		return getContainerizerName() + (workdir != null ? "@" + workdir : "");
	}
}
