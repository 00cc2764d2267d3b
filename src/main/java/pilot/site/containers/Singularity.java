package pilot.site.containers;

import java.util.ArrayList;
import java.util.List;

import utils.ExitStatus;

/**
 * Runs the commands inside a Singularity image, with CVMFS and the working directory bound in
 */
public class Singularity extends Containerizer {

	private final String containerImgPath;

	/**
	 * @param containerImgPath image to run the commands in
	 */
	public Singularity(final String containerImgPath) {
		this.containerImgPath = containerImgPath;
	}

	/**
	 * @return the image path
	 */
	public String getContainerImgPath() {
		return containerImgPath;
	}

	@Override
	public List<String> containerize(final List<String> cmd) {
		final List<String> singularityCmd = new ArrayList<>();
		singularityCmd.add("singularity");
		singularityCmd.add("exec");
		singularityCmd.add("-B");

		if (workdir != null) {
			singularityCmd.add("/cvmfs:/cvmfs," + workdir + ":" + workdir);
			singularityCmd.add("--pwd");
			singularityCmd.add(workdir);
		}
		else
			singularityCmd.add("/cvmfs:/cvmfs");

		singularityCmd.add(containerImgPath);
		singularityCmd.add("/bin/bash");
		singularityCmd.add("-c");
		singularityCmd.add(ExitStatus.formatCommand(cmd));

		return singularityCmd;
	}

	@Override
	public String toString() {
		return super.toString() + " (" + containerImgPath + ")";
	}
}
