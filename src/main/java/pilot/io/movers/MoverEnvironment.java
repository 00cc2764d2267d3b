package pilot.io.movers;

import java.io.File;

import pilot.config.ConfigProperties;
import pilot.io.rucio.RucioClient;
import pilot.se.DDMEndpoints;
import pilot.site.QueueData;
import pilot.site.containers.ContainerizerFactory;

/**
 * Everything a mover needs to know about the site it runs on. Shared, read-only, by all movers of a job.
 */
public class MoverEnvironment {
	/**
	 * Configuration of the current queue
	 */
	public final QueueData queueData;

	/**
	 * Known storage endpoints
	 */
	public final DDMEndpoints endpoints;

	/**
	 * Library used when the command line tools fail
	 */
	public final RucioClient rucio;

	/**
	 * Command wrapping
	 */
	public final ContainerizerFactory containers;

	/**
	 * How the external tools are executed
	 */
	public final CommandRunner runner;

	/**
	 * Wall clock budget of one transfer command, in seconds
	 */
	public final long timeoutSeconds;

	/**
	 * Budget of the storm metadata lookup, in seconds
	 */
	public final long metadataTimeoutSeconds;

	/**
	 * Where the storm mover leaves the output files
	 */
	public final File stormOutputDir;

	/**
	 * CA certificates directory for the HTTP metadata lookups
	 */
	public final String caPath;

	/**
	 * @param queueData
	 * @param endpoints
	 * @param rucio
	 * @param runner
	 * @param config source of the <code>mover.*</code> and <code>storm.*</code> settings
	 */
	public MoverEnvironment(final QueueData queueData, final DDMEndpoints endpoints, final RucioClient rucio, final CommandRunner runner, final ConfigProperties config) {
		this.queueData = queueData;
		this.endpoints = endpoints;
		this.rucio = rucio;
		this.runner = runner != null ? runner : CommandRunner.PROCESS;
		this.containers = new ContainerizerFactory(config);
		this.timeoutSeconds = config.getl("mover.timeout", 3600);
		this.metadataTimeoutSeconds = config.getl("storm.metadata.timeout", 10);
		this.stormOutputDir = new File(config.gets("storm.output.dir", System.getProperty("user.dir")));
		this.caPath = config.gets("storm.capath", "/cvmfs/atlas.cern.ch/repo/ATLASLocalRootBase/etc/grid-security-emi/certificates");
	}
}
