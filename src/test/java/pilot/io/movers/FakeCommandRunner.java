package pilot.io.movers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import utils.ExitStatus;

/**
 * Records the commands instead of running them, and replies with a scripted outcome
 */
public class FakeCommandRunner implements CommandRunner {
	private final List<List<String>> commands = Collections.synchronizedList(new ArrayList<>());

	private final Function<List<String>, ExitStatus> reply;

	/**
	 * @param reply outcome of each command
	 */
	public FakeCommandRunner(final Function<List<String>, ExitStatus> reply) {
		this.reply = reply;
	}

	/**
	 * @param exitCode
	 * @param output
	 * @return a runner answering every command with the same exit code and output
	 */
	public static FakeCommandRunner always(final int exitCode, final String output) {
		return new FakeCommandRunner(cmd -> new ExitStatus(cmd, exitCode, output, 1));
	}

	@Override
	public ExitStatus run(final List<String> command, final long timeout, final TimeUnit unit) {
		commands.add(new ArrayList<>(command));
		return reply.apply(command);
	}

	/**
	 * @return everything that was run, in order
	 */
	public List<List<String>> getCommands() {
		return commands;
	}

	/**
	 * @return the last command
	 */
	public List<String> getLastCommand() {
		return commands.get(commands.size() - 1);
	}
}
