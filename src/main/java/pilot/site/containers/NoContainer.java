package pilot.site.containers;

import java.util.ArrayList;
import java.util.List;

/**
 * Commands run directly on the worker node
 */
public class NoContainer extends Containerizer {

	@Override
	public List<String> containerize(final List<String> cmd) {
		return new ArrayList<>(cmd);
	}
}
