package utils;

import java.io.File;

/**
 * Locating the external tools the movers shell out to
 *
 * @since Oct 7, 2011
 */
public class ExternalCalls {

	/**
	 * @param program
	 * @return the full path to the program in env[PATH], or <code>null</code> if it could not be located anywhere
	 */
	public static String programExistsInPath(final String program) {
		final String path = System.getenv("PATH");

		if (path == null || path.isEmpty())
			return null;

		return programExistsInFolders(program, path.split(File.pathSeparator));
	}

	/**
	 * Try to locate an executable in a collection of folders
	 *
	 * @param program
	 *            executable to search for
	 * @param folders
	 *            paths to try
	 * @return the first executable found in the given folders
	 */
	public static String programExistsInFolders(final String program, final String... folders) {
		if (folders == null || folders.length == 0)
			return null;

		for (final String folder : folders) {
			if (folder == null || folder.isEmpty())
				continue;

			final File dir = new File(folder);

			if (dir.exists() && dir.canRead()) {
				final File test = new File(dir, program);

				if (test.exists() && test.isFile() && test.canExecute())
					return test.getAbsolutePath();
			}
		}

		return null;
	}
}
