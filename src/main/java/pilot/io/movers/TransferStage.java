package pilot.io.movers;

import java.io.IOException;

/**
 * One way of moving the data
 */
@FunctionalInterface
public interface TransferStage {
	/**
	 * @throws IOException if the attempt failed, the message is the diagnostic to report
	 * @throws InterruptedException
	 */
	void run() throws IOException, InterruptedException;
}
