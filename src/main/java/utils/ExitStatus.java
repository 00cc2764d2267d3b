package utils;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one external command: the command line, the exit code and the merged stdout/stderr, verbatim
 *
 * @since Jun 12, 2018
 */
public final class ExitStatus {
	/**
	 * Exit code reported when the command had to be killed for exceeding its time budget
	 */
	public static final int TIMED_OUT = -1;

	/**
	 * Exit code reported when the command could not be started at all
	 */
	public static final int CANNOT_START = -2;

	private final List<String> command;

	private final int exitCode;

	private final String output;

	private final long durationMillis;

	/**
	 * @param command full command line that was executed
	 * @param exitCode process exit code, negative for timeouts or start failures
	 * @param output merged stdout and stderr
	 * @param durationMillis wall clock time spent
	 */
	public ExitStatus(final List<String> command, final int exitCode, final String output, final long durationMillis) {
		this.command = command != null ? Collections.unmodifiableList(command) : Collections.emptyList();
		this.exitCode = exitCode;
		this.output = output != null ? output : "";
		this.durationMillis = durationMillis;
	}

	/**
	 * @return the executed command line
	 */
	public List<String> getCommand() {
		return command;
	}

	/**
	 * @return exit code of the process
	 */
	public int getExitCode() {
		return exitCode;
	}

	/**
	 * @return combined stdout and stderr, as the tool wrote them
	 */
	public String getOutput() {
		return output;
	}

	/**
	 * @return how long the execution took, in milliseconds
	 */
	public long getDurationMillis() {
		return durationMillis;
	}

	/**
	 * @return <code>true</code> if the command exited with code 0
	 */
	public boolean isSuccess() {
		return exitCode == 0;
	}

	/**
	 * @return <code>true</code> if the process was killed by the timeout
	 */
	public boolean isTimedOut() {
		return exitCode == TIMED_OUT;
	}

	/**
	 * @return the command in a shell-pasteable form
	 */
	public String getFormattedCommand() {
		return formatCommand(command);
	}

	/**
	 * Quote the tokens that need it so that the command can be pasted in a shell
	 *
	 * @param cmd
	 * @return the shell-formatted command line
	 */
	public static String formatCommand(final List<String> cmd) {
		final StringBuilder sb = new StringBuilder();

		if (cmd == null)
			return "";

		boolean first = true;

		for (String cmdToken : cmd) {
			if (!first)
				sb.append(' ');

			if (cmdToken.contains(" ") || cmdToken.contains("\n") || cmdToken.contains("\t") || cmdToken.contains("'"))
				cmdToken = "'" + cmdToken.replace("'", "'\\''") + "'";

			sb.append(cmdToken);
			first = false;
		}

		return sb.toString();
	}

	@Override
	public String toString() {
		return "exit code " + exitCode + " after " + durationMillis + "ms of `" + getFormattedCommand() + "`: " + output.replace('\n', ' ').trim();
	}
}
