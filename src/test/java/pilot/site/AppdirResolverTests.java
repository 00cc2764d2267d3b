package pilot.site;

import java.io.File;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import pilot.io.PilotErrorCode;
import pilot.io.PilotException;

class AppdirResolverTests {
	@TempDir
	Path sw;

	private static QueueData queue(final String appdir) {
		return new QueueData("SITE_A", appdir != null ? Collections.singletonMap(QueueData.APPDIR, appdir) : Collections.<String, String> emptyMap());
	}

	@Test
	void testDecode() {
		final String encoded = "/sw/releases|release^/sw/releases|unvalid^/sw/unvalidated/caches";

		Assertions.assertEquals("/sw/unvalidated/caches", AppdirResolver.decode(encoded, "unvalid"));
		Assertions.assertEquals("/sw/releases", AppdirResolver.decode(encoded, "reprocessing"));
		Assertions.assertEquals("/sw/releases", AppdirResolver.decode(encoded, null));
		Assertions.assertEquals("/sw/plain", AppdirResolver.decode("/sw/plain", "unvalid"));
	}

	@Test
	void testExpand() {
		final Map<String, String> env = new HashMap<>();
		env.put("CVMFS", "/cvmfs/atlas.cern.ch");

		final AppdirResolver r = new AppdirResolver(env);

		Assertions.assertEquals("/cvmfs/atlas.cern.ch/repo/sw", r.expand("$CVMFS/repo/sw"));
		Assertions.assertEquals("/cvmfs/atlas.cern.ch/repo/sw", r.expand("${CVMFS}/repo/sw"));
		Assertions.assertEquals("$UNKNOWN/repo/sw", r.expand("$UNKNOWN/repo/sw"));
	}

	@Test
	void testExistingAppdir() throws PilotException {
		final File unvalid = sw.resolve("unvalid").toFile();
		Assertions.assertTrue(unvalid.mkdir());

		final QueueData qd = queue(sw + "|unvalid^" + unvalid.getAbsolutePath());

		final String appdir = new AppdirResolver(Collections.<String, String> emptyMap()).extractAppdir(qd, "unvalid", "AtlasProduction/21.0.1");

		Assertions.assertEquals(unvalid.getAbsolutePath(), appdir);
		Assertions.assertEquals(unvalid.getAbsolutePath(), qd.gets(QueueData.APPDIR));
	}

	@Test
	void testSoftwareDirFromEnvironment() throws PilotException {
		final QueueData qd = queue(null);

		final String appdir = new AppdirResolver(Collections.singletonMap(AppdirResolver.SW_DIR, sw.toString())).extractAppdir(qd, "managed", null);

		Assertions.assertEquals(sw.toString(), appdir);
		Assertions.assertEquals(sw.toString(), qd.gets(QueueData.APPDIR));
	}

	@Test
	void testNightlies() throws PilotException {
		final Map<String, String> env = new HashMap<>();
		env.put(AppdirResolver.NIGHTLIES_DIR, "${CVMFS}/nightlies");
		env.put("CVMFS", "/cvmfs/atlas-nightlies.cern.ch/repo/sw");

		final QueueData qd = queue(sw.toString());

		final String appdir = new AppdirResolver(env).extractAppdir(qd, "managed", "AtlasProduction/rel_3");

		Assertions.assertEquals("/cvmfs/atlas-nightlies.cern.ch/repo/sw/nightlies", appdir);
		Assertions.assertEquals(appdir, qd.gets(QueueData.APPDIR));
	}

	@Test
	void testNightliesWithoutVariable() throws PilotException {
		final File nightlies = sw.resolve("nightlies").toFile();
		Assertions.assertTrue(nightlies.mkdir());

		final QueueData qd = queue(sw + "|nightlies^" + nightlies.getAbsolutePath());

		Assertions.assertEquals(nightlies.getAbsolutePath(), new AppdirResolver(Collections.<String, String> emptyMap()).extractAppdir(qd, "managed", "AtlasOffline/rel_1"));
	}

	@Test
	void testMissingAppdir() {
		final AppdirResolver r = new AppdirResolver(Collections.<String, String> emptyMap());

		PilotException pe = Assertions.assertThrows(PilotException.class, () -> r.extractAppdir(queue(null), "managed", null));
		Assertions.assertEquals(PilotErrorCode.ERR_NOSOFTWAREDIR, pe.getErrorCode());

		pe = Assertions.assertThrows(PilotException.class, () -> r.extractAppdir(queue(sw.resolve("does-not-exist").toString()), "managed", null));
		Assertions.assertEquals(PilotErrorCode.ERR_NOSOFTWAREDIR, pe.getErrorCode());
	}
}
