package pilot.io.rucio;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import pilot.config.ConfigProperties;

class RucioRestClientTests {
	@TempDir
	Path dir;

	@Test
	void testOnlyHttpDownloads() {
		final RucioRestClient client = new RucioRestClient("https://rucio.invalid", "token", 1, 1);

		final IOException ioe = Assertions.assertThrows(IOException.class, () -> client.download("data17", "file1.root", "SITE_A", "root://eos.site-a.org//eos/data17/file1.root", dir.toFile()));

		Assertions.assertTrue(ioe.getMessage().contains("only HTTP"), ioe.getMessage());
		Assertions.assertFalse(dir.resolve("data17").toFile().exists());
	}

	@Test
	void testConfiguration() {
		final RucioRestClient client = RucioRestClient.fromConfiguration(new ConfigProperties(Collections.singletonMap("rucio.host", "https://rucio.example.org")));

		Assertions.assertTrue(client.toString().contains("https://rucio.example.org"), client.toString());
	}

	@Test
	void testUploadRequest() {
		final UploadRequest request = new UploadRequest(dir.resolve("file1.root").toFile(), "SITE_A_DATADISK", "data17");

		Assertions.assertTrue(request.noRegister);
		Assertions.assertNull(request.guid);
		Assertions.assertNull(request.pfn);
	}
}
