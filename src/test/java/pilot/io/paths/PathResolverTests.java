package pilot.io.paths;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import pilot.io.FileSpec;
import pilot.io.PilotErrorCode;
import pilot.io.PilotException;
import pilot.io.TransferFailure;
import pilot.site.QueueData;

class PathResolverTests {

	private static final String DATASET = "data17_13TeV.00327342.physics_Main.merge.AOD.f838_m1824_tid12345";

	private static final String DATASET_DIR = "/data17_13TeV/AOD/data17_13TeV.00327342.physics_Main.merge.AOD.f838_m1824/";

	static QueueData rucioQueue() {
		final Map<String, String> fields = new HashMap<>();
		fields.put(QueueData.SE, "token:ATLASDATADISK:srm://srm.site-a.org:8443/srm/managerv2?SFN=,token:ATLASSCRATCHDISK:srm://scratch.site-a.org:8443/srm/managerv2?SFN=");
		fields.put(QueueData.SEPATH, "/pnfs/site-a.org/atlasdatadisk/rucio/,/pnfs/site-a.org/atlasscratchdisk/rucio");
		fields.put(QueueData.LFCPATH, "/grid/atlas");
		return new QueueData("SITE_A", fields);
	}

	static QueueData datasetQueue() {
		final Map<String, String> fields = new HashMap<>();
		fields.put(QueueData.SE, "srm://se.site-b.org");
		fields.put(QueueData.SEPATH, "/dpm/site-b.org/home/atlas/atlasdatadisk/");
		fields.put(QueueData.SEPRODPATH, "/dpm/site-b.org/home/atlas/atlasproddisk");
		fields.put(QueueData.LFCPATH, "/grid/atlas/users");
		fields.put(QueueData.LFCPRODPATH, "/grid/atlas/dq2/");
		return new QueueData("SITE_B", fields);
	}

	@Test
	void testRucioLayout() {
		final PathResolver r = new PathResolver(rucioQueue(), null, Namespace.RUCIO);

		final FileSpec fspec = new FileSpec("data17", "file1.root");

		final ProperPaths paths = r.resolve(fspec, false, "ATLASDATADISK", "managed", false);

		Assertions.assertTrue(paths.isOK(), paths.toString());
		Assertions.assertEquals("/pnfs/site-a.org/atlasdatadisk/rucio/data17/36/83/file1.root", paths.physicalPath);
		Assertions.assertEquals("srm://srm.site-a.org:8443/srm/managerv2?SFN=/pnfs/site-a.org/atlasdatadisk/rucio/data17/36/83/file1.root", paths.storageURL);
		Assertions.assertTrue(paths.storageURL.endsWith("data17/36/83/file1.root"));
		Assertions.assertTrue(paths.storageURL.startsWith(paths.catalogDir));
		Assertions.assertEquals("srm://srm.site-a.org:8443/srm/managerv2?SFN=/pnfs/site-a.org/atlasdatadisk/rucio/data17/36/83", paths.catalogDir);
	}

	@Test
	void testRucioLayoutAutoDetected() {
		final PathResolver r = new PathResolver(rucioQueue(), null, Namespace.AUTO);

		final ProperPaths paths = r.resolve(new FileSpec("data17", "file1.root"), false, null, "managed", false);

		Assertions.assertTrue(paths.storageURL.endsWith("/rucio/data17/36/83/file1.root"), paths.storageURL);
	}

	@Test
	void testTokenSelection() {
		final PathResolver r = new PathResolver(rucioQueue(), null, Namespace.RUCIO);

		Assertions.assertEquals("token:ATLASSCRATCHDISK:srm://scratch.site-a.org:8443/srm/managerv2?SFN=", r.getProperSE("ATLASSCRATCHDISK", false));
		Assertions.assertEquals("/pnfs/site-a.org/atlasscratchdisk/rucio", r.getPreDestination(true, "ATLASSCRATCHDISK", false));

		// unknown tokens get the first entry
		Assertions.assertEquals("/pnfs/site-a.org/atlasdatadisk/rucio", r.getPreDestination(true, "ATLASGROUPDISK", false));

		final ProperPaths paths = r.resolve(new FileSpec("data17", "file1.root"), true, "ATLASSCRATCHDISK", "user", false);

		Assertions.assertEquals("srm://scratch.site-a.org:8443/srm/managerv2?SFN=/pnfs/site-a.org/atlasscratchdisk/rucio/data17/36/83/file1.root", paths.storageURL);
	}

	@Test
	void testUserScope() {
		Assertions.assertEquals("user/jdoe/20/48/file1.root", RucioPaths.getPathFromScope("user.jdoe", "file1.root"));
		Assertions.assertEquals("data17/36/83/file1.root", RucioPaths.getPathFromScope("data17", "file1.root"));
	}

	@Test
	void testDatasetLayoutProduction() {
		final PathResolver r = new PathResolver(datasetQueue(), null, Namespace.AUTO);

		final FileSpec fspec = new FileSpec("data17_13TeV", "AOD.pool.root.1");
		fspec.dataset = DATASET;

		final ProperPaths paths = r.resolve(fspec, false, null, "managed", false);

		Assertions.assertTrue(paths.isOK(), paths.toString());
		Assertions.assertEquals("/dpm/site-b.org/home/atlas/atlasproddisk" + DATASET_DIR + "AOD.pool.root.1", paths.physicalPath);
		Assertions.assertEquals("srm://se.site-b.org/dpm/site-b.org/home/atlas/atlasproddisk" + DATASET_DIR + "AOD.pool.root.1", paths.storageURL);
		Assertions.assertEquals("/grid/atlas/dq2" + DATASET_DIR, paths.catalogDir);
	}

	@Test
	void testDatasetLayoutAnalysis() {
		final PathResolver r = new PathResolver(datasetQueue(), null, Namespace.DATASET);

		final FileSpec fspec = new FileSpec("user.jdoe", "hist.root");
		fspec.dataset = "user.jdoe.mytest_sub0123";

		final ProperPaths paths = r.resolve(fspec, true, null, "user", false);

		Assertions.assertEquals("/dpm/site-b.org/home/atlas/atlasdatadisk/user/jdoe/user.jdoe.mytest/hist.root", paths.physicalPath);
		Assertions.assertEquals("/grid/atlas/users/user/jdoe/user.jdoe.mytest/", paths.catalogDir);
	}

	@Test
	void testUnknownDatasetFormat() {
		final PathResolver r = new PathResolver(datasetQueue(), null, Namespace.DATASET);

		final FileSpec fspec = new FileSpec("mc16", "file1.root");
		fspec.dataset = "mc16.bad";

		final ProperPaths paths = r.resolve(fspec, false, null, "managed", false);

		Assertions.assertFalse(paths.isOK());
		Assertions.assertEquals(PathResolver.UNKNOWN_DSN_FORMAT, paths.tracerError);
		Assertions.assertEquals(PilotErrorCode.ERR_STAGEOUTFAILED, paths.errorCode);
	}

	@Test
	void testMissingDestination() {
		final PathResolver r = new PathResolver(new QueueData("EMPTY", new HashMap<String, String>()), null, Namespace.AUTO);

		final ProperPaths paths = r.resolve(new FileSpec("data17", "file1.root"), false, null, "managed", false);

		Assertions.assertFalse(paths.isOK());
		Assertions.assertEquals(PathResolver.PUT_DEST_PATH_UNDEF, paths.tracerError);
		Assertions.assertEquals("put_data destination path in SE not defined", paths.errorMessage);
		Assertions.assertEquals("", paths.storageURL);

		final PilotException pe = paths.toException();

		Assertions.assertEquals(TransferFailure.CONFIGURATION_MISSING, pe.getFailure());
		Assertions.assertEquals(PilotErrorCode.ERR_STAGEOUTFAILED, pe.getErrorCode());
	}

	@Test
	void testAlternate() {
		final PathResolver r = new PathResolver(datasetQueue(), null, Namespace.AUTO);

		// no alternate queue known
		Assertions.assertFalse(r.resolve(new FileSpec("data17", "file1.root"), false, null, "managed", true).isOK());

		final ProperPaths paths = r.withAlternate(rucioQueue()).resolve(new FileSpec("data17", "file1.root"), false, "ATLASDATADISK", "managed", true);

		Assertions.assertTrue(paths.isOK(), paths.toString());
		Assertions.assertTrue(paths.storageURL.startsWith("srm://srm.site-a.org"), paths.storageURL);
	}

	@Test
	void testNamespaceFromString() {
		Assertions.assertEquals(Namespace.RUCIO, Namespace.fromString(" Rucio"));
		Assertions.assertEquals(Namespace.AUTO, Namespace.fromString("whatever"));
		Assertions.assertEquals(Namespace.DATASET, Namespace.AUTO.resolve("/dpm/site-b.org/home/atlas"));
		Assertions.assertEquals(Namespace.DATASET, Namespace.DATASET.resolve("/dpm/site-b.org/home/atlas/rucio"));
	}
}
