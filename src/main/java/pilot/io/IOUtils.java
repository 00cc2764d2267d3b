package pilot.io;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.Adler32;

/**
 * Local file helpers
 */
public class IOUtils {

	/**
	 * Checksum algorithm used for staged files
	 */
	public static final String ADLER32 = "adler32";

	/**
	 * @param f
	 * @return the adler32 checksum of the file, as 8 lowercase hex digits
	 * @throws IOException
	 */
	public static String getAdler32(final File f) throws IOException {
		if (f == null || !f.isFile() || !f.canRead())
			throw new IOException("Cannot read from this file: " + f);

		final Adler32 adler = new Adler32();

		try (InputStream is = new FileInputStream(f)) {
			final byte[] buff = new byte[65536];

			int cnt;

			while ((cnt = is.read(buff)) > 0)
				adler.update(buff, 0, cnt);
		}

		return String.format("%08x", Long.valueOf(adler.getValue()));
	}
}
