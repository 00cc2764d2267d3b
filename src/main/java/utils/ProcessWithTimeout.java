package utils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import pilot.config.ConfigUtils;

/**
 * Run an external process with a bounded wall clock budget, collecting its (merged) output
 *
 * @since Jun 12, 2018
 */
public class ProcessWithTimeout {
	private static final Logger logger = ConfigUtils.getLogger(ProcessWithTimeout.class.getCanonicalName());

	private final Process process;

	private final List<String> command;

	private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

	private final Thread reader;

	private final long startTime = System.currentTimeMillis();

	private boolean timedOut = false;

	private int exitValue = Integer.MIN_VALUE;

	/**
	 * @param process started process
	 * @param builder the builder that started it, for the command line
	 */
	public ProcessWithTimeout(final Process process, final ProcessBuilder builder) {
		this.process = process;
		this.command = builder.command();

		final InputStream is = process.getInputStream();

		reader = new Thread(() -> {
			final byte[] buff = new byte[8192];

			int cnt;

			try {
				while ((cnt = is.read(buff)) > 0)
					synchronized (stdout) {
						stdout.write(buff, 0, cnt);
					}
			}
			catch (final IOException ioe) {
				logger.log(Level.FINE, "Output of " + command + " could not be read any more", ioe);
			}
		}, "ProcessWithTimeout reader");

		reader.setDaemon(true);
		reader.start();
	}

	/**
	 * Wait for the process to finish, killing it when the budget is exceeded
	 *
	 * @param timeout
	 * @param unit
	 * @return <code>true</code> if the process exited on its own within the time limit
	 * @throws InterruptedException
	 */
	public boolean waitFor(final long timeout, final TimeUnit unit) throws InterruptedException {
		if (process.waitFor(timeout, unit)) {
			exitValue = process.exitValue();
			reader.join(TimeUnit.SECONDS.toMillis(5));
			return true;
		}

		timedOut = true;

		logger.log(Level.WARNING, "Killing `" + ExitStatus.formatCommand(command) + "` after " + timeout + " " + unit.toString().toLowerCase());

		process.destroyForcibly();
		process.waitFor(10, TimeUnit.SECONDS);
		reader.join(TimeUnit.SECONDS.toMillis(5));

		exitValue = ExitStatus.TIMED_OUT;

		return false;
	}

	/**
	 * @return <code>true</code> if the process was killed
	 */
	public boolean isTimedOut() {
		return timedOut;
	}

	/**
	 * @return exit code, {@link ExitStatus#TIMED_OUT} if killed
	 */
	public int exitValue() {
		return exitValue;
	}

	/**
	 * @return what the process has printed so far
	 */
	public String getStdout() {
		synchronized (stdout) {
			return new String(stdout.toByteArray(), StandardCharsets.UTF_8);
		}
	}

	/**
	 * @return the complete outcome of the execution
	 */
	public ExitStatus getExitStatus() {
		return new ExitStatus(command, exitValue, getStdout(), System.currentTimeMillis() - startTime);
	}

	/**
	 * Convenience method to run a command to completion or until the timeout
	 *
	 * @param command
	 * @param timeout
	 * @param unit
	 * @return the outcome, never <code>null</code>. Start failures are reported with {@link ExitStatus#CANNOT_START}
	 * @throws InterruptedException
	 */
	public static ExitStatus run(final List<String> command, final long timeout, final TimeUnit unit) throws InterruptedException {
		final ProcessBuilder pBuilder = new ProcessBuilder(command);
		pBuilder.redirectErrorStream(true);

		final Process p;

		try {
			p = pBuilder.start();
		}
		catch (final IOException ioe) {
			logger.log(Level.WARNING, "Cannot start `" + ExitStatus.formatCommand(command) + "`", ioe);
			return new ExitStatus(command, ExitStatus.CANNOT_START, ioe.getMessage(), 0);
		}

		final ProcessWithTimeout ptimeout = new ProcessWithTimeout(p, pBuilder);

		try {
			ptimeout.waitFor(timeout, unit);
		}
		catch (final InterruptedException ie) {
			p.destroyForcibly();
			throw ie;
		}

		return ptimeout.getExitStatus();
	}
}
