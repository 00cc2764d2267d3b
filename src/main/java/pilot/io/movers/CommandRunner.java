package pilot.io.movers;

import java.util.List;
import java.util.concurrent.TimeUnit;

import utils.ExitStatus;
import utils.ProcessWithTimeout;

/**
 * Executes the external transfer tools
 */
@FunctionalInterface
public interface CommandRunner {
	/**
	 * Run the commands as child processes
	 */
	CommandRunner PROCESS = ProcessWithTimeout::run;

	/**
	 * @param command
	 * @param timeout
	 * @param unit
	 * @return exit code and merged output of the command
	 * @throws InterruptedException
	 */
	ExitStatus run(List<String> command, long timeout, TimeUnit unit) throws InterruptedException;
}
