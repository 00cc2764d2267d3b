package pilot.failover;

/**
 * What the stage-out needs to know about the job and where it runs
 */
public class JobContext {
	/**
	 * User analysis job, as opposed to a production one
	 */
	public boolean analysisJob = false;

	/**
	 * Alternative stage-out mode requested by the job ("on", "off", "force"), <code>null</code> to let the queue decide
	 */
	public String alternativeStageOut = null;

	/**
	 * PanDA site name
	 */
	public String siteName;

	/**
	 * Cloud of the job, possibly {@link pilot.site.tiers.TierRegistry#WORLD}
	 */
	public String cloud;

	/**
	 * Space token of the output, <code>dst:ENDPOINT</code> for jobs in the WORLD cloud
	 */
	public String token;

	/**
	 * Job label (managed, user, test, ...)
	 */
	public String prodSourceLabel;

	@Override
	public String toString() {
		return "JobContext(site=" + siteName + ", cloud=" + cloud + ", token=" + token + ", analysis=" + analysisJob + ", label=" + prodSourceLabel + ", altmode=" + alternativeStageOut + ")";
	}
}
