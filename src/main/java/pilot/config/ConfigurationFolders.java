package pilot.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Configuration files found in $HOME/.pilot/config or in the folder given by the PilotConfig java parameter
 */
class ConfigurationFolders implements ConfigSource {
	private final List<String> folders;

	/**
	 * Default folders
	 */
	ConfigurationFolders() {
		this(Arrays.asList(System.getProperty("user.home") + File.separator + ".pilot" + File.separator + "config", System.getProperty("PilotConfig", "config")));
	}

	/**
	 * @param folders to look into, later ones overriding the earlier
	 */
	ConfigurationFolders(final List<String> folders) {
		this.folders = folders;
	}

	@Override
	public Map<String, ConfigProperties> getConfiguration() {
		final Map<String, ConfigProperties> tmp = new HashMap<>();

		for (final String path : folders) {
			final File f = new File(path);

			if (!f.exists() || !f.isDirectory() || !f.canRead())
				continue;

			final File[] list = f.listFiles();

			if (list == null)
				continue;

			for (final File sub : list)
				if (sub.isFile() && sub.canRead() && sub.getName().endsWith(".properties")) {
					String sName = sub.getName();
					sName = sName.substring(0, sName.lastIndexOf('.')).toLowerCase();

					try (InputStream is = new FileInputStream(sub)) {
						tmp.put(sName, ConfigManager.mergeProperties(tmp.get(sName), new ConfigProperties(is), true));
					}
					catch (final IOException ioe) {
						Logger.getLogger(ConfigurationFolders.class.getCanonicalName()).log(Level.WARNING, "Cannot read " + sub.getAbsolutePath(), ioe);
					}
				}
		}

		return tmp;
	}
}
