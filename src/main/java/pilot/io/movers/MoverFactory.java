package pilot.io.movers;

import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import pilot.config.ConfigUtils;
import pilot.site.QueueData;

/**
 * One mover instance of each type, selected by the copy tool configured for the queue
 *
 * @since Mar 8, 2017
 */
public class MoverFactory {
	static final Logger logger = ConfigUtils.getLogger(MoverFactory.class.getCanonicalName());

	private final Map<MoverType, SiteMover> movers = new EnumMap<>(MoverType.class);

	private final MoverEnvironment env;

	/**
	 * @param env
	 */
	public MoverFactory(final MoverEnvironment env) {
		this.env = env;

		for (final MoverType t : MoverType.values())
			movers.put(t, t.create(env));
	}

	/**
	 * @param type
	 * @return the mover of this type
	 */
	public SiteMover get(final MoverType type) {
		return movers.get(type);
	}

	/**
	 * @param copyTool
	 * @return the mover with this name
	 * @throws IllegalArgumentException if the name is unknown
	 */
	public SiteMover forName(final String copyTool) {
		return get(MoverType.fromName(copyTool));
	}

	/**
	 * @return the mover for output files, from the <code>copytool</code> field of the queue
	 * @throws IllegalArgumentException if the queue doesn't define a known copy tool
	 */
	public SiteMover getStageOutMover() {
		final SiteMover ret = forName(env.queueData.gets(QueueData.COPYTOOL));

		logger.log(Level.FINE, "Stage-out mover for " + env.queueData.getQueueName() + ": " + ret);

		return ret;
	}

	/**
	 * @return the mover for input files, from <code>copytoolin</code>, or <code>copytool</code> if that is not set
	 * @throws IllegalArgumentException if the queue doesn't define a known copy tool
	 */
	public SiteMover getStageInMover() {
		final String copyToolIn = env.queueData.gets(QueueData.COPYTOOLIN);

		final SiteMover ret = forName(copyToolIn.isEmpty() ? env.queueData.gets(QueueData.COPYTOOL) : copyToolIn);

		logger.log(Level.FINE, "Stage-in mover for " + env.queueData.getQueueName() + ": " + ret);

		return ret;
	}
}
