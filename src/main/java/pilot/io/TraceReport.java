package pilot.io;

import java.util.ArrayList;
import java.util.List;

/**
 * Job details forwarded to the transfer tool, ending up in the data management traces
 */
public class TraceReport {
	/**
	 * Application id
	 */
	public String appid;

	/**
	 * Dataset name
	 */
	public String dataset;

	/**
	 * Dataset scope
	 */
	public String scope;

	/**
	 * Event type suffix, appended to "get_sm"
	 */
	public String eventType;

	/**
	 * PanDA queue
	 */
	public String pq;

	/**
	 * Task id
	 */
	public String taskid;

	/**
	 * User DN
	 */
	public String usrdn;

	/**
	 * @return command line options for <code>rucio download</code>, only for the fields that are set
	 */
	public List<String> toDownloadOptions() {
		final List<String> ret = new ArrayList<>();

		addOption(ret, "--trace_appid", appid);
		addOption(ret, "--trace_dataset", dataset);
		addOption(ret, "--trace_datasetscope", scope);

		if (eventType != null && !eventType.isEmpty())
			addOption(ret, "--trace_eventtype", "get_sm" + eventType);

		addOption(ret, "--trace_pq", pq);
		addOption(ret, "--trace_taskid", taskid);
		addOption(ret, "--trace_usrdn", usrdn);

		return ret;
	}

	private static void addOption(final List<String> options, final String key, final String value) {
		if (value == null)
			return;

		options.add(key);
		options.add(value);
	}
}
