package pilot.io.movers;

/**
 * Steps of a stage-in or stage-out operation
 */
public enum StageState {
	/**
	 * Nothing done yet
	 */
	START,
	/**
	 * Checking that the physical location of the file is known
	 */
	RESOLVE_LOCATION,
	/**
	 * Running the external command
	 */
	PRIMARY_ATTEMPT,
	/**
	 * Running the in-process library, after the command failed
	 */
	FALLBACK_ATTEMPT,
	/**
	 * Terminal, the file was transferred
	 */
	SUCCESS,
	/**
	 * Terminal, all attempts failed
	 */
	FAILED;

	/**
	 * @return <code>true</code> for the states that end an operation
	 */
	public boolean isTerminal() {
		return this == SUCCESS || this == FAILED;
	}
}
