package pilot.io.movers;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import pilot.config.ConfigProperties;
import pilot.io.FileSpec;
import pilot.io.PilotErrorCode;
import pilot.io.PilotException;
import pilot.io.Replica;
import pilot.io.StageResult;
import pilot.io.TraceReport;
import pilot.io.TransferFailure;
import pilot.se.DDMEndpoint;
import pilot.se.DDMEndpoints;
import pilot.site.QueueData;
import utils.ExitStatus;

class RucioSiteMoverTests {
	@TempDir
	Path workdir;

	private static final DDMEndpoints ENDPOINTS = new DDMEndpoints(Arrays.asList(new DDMEndpoint("SITE_A", "SITE", "CERN", "DATADISK", "ATLASDATADISK", true, false),
			new DDMEndpoint("SITE_ND", "SITE", "CERN", "DATADISK", "ATLASDATADISK", false, false)));

	private static RucioSiteMover mover(final FakeRucioClient rucio, final CommandRunner runner) {
		final QueueData qd = new QueueData("SITE_QUEUE", Collections.singletonMap(QueueData.COPYTOOL, "rucio"));

		return new RucioSiteMover(new MoverEnvironment(qd, ENDPOINTS, rucio, runner, new ConfigProperties()));
	}

	/**
	 * @return a runner that behaves like a successful download, leaving the file in {dir}/{scope}/{lfn}
	 */
	private static FakeCommandRunner downloadingRunner(final String content) {
		return new FakeCommandRunner(cmd -> {
			final int idx = cmd.indexOf("--dir");
			final String[] did = cmd.get(cmd.size() - 1).split(":");
			final File target = new File(new File(cmd.get(idx + 1), did[0]), did[1]);

			try {
				Files.createDirectories(target.getParentFile().toPath());
				Files.write(target.toPath(), content.getBytes(StandardCharsets.UTF_8));
			}
			catch (final IOException ioe) {
				throw new UncheckedIOException(ioe);
			}

			return new ExitStatus(cmd, 0, "Files downloaded", 1);
		});
	}

	@Test
	void testAllowAllInputRSEsNeverPins() {
		final RucioSiteMover m = mover(new FakeRucioClient(), FakeCommandRunner.always(0, ""));

		final FileSpec withReplicas = new FileSpec("data17", "file1.root");
		withReplicas.replicas.add(new Replica("SITE_A", "root://a/file1.root"));
		withReplicas.allowAllInputRSEs = true;

		final FileSpec nonDeterministic = new FileSpec("data17", "file2.root");
		nonDeterministic.ddmendpoint = "SITE_ND";
		nonDeterministic.turl = "srm://nd/file2.root";
		nonDeterministic.allowAllInputRSEs = true;

		for (final FileSpec fspec : Arrays.asList(withReplicas, nonDeterministic)) {
			final List<String> cmd = m.getDownloadCommand(workdir.toFile(), fspec, null);

			Assertions.assertFalse(cmd.contains("--rse"), cmd.toString());
			Assertions.assertFalse(cmd.contains("--pfn"), cmd.toString());
			Assertions.assertEquals(fspec.getDid(), cmd.get(cmd.size() - 1));
		}
	}

	@Test
	void testDownloadCommandPinsFirstReplica() {
		final RucioSiteMover m = mover(new FakeRucioClient(), FakeCommandRunner.always(0, ""));

		final FileSpec fspec = new FileSpec("data17", "file1.root");
		fspec.ddmendpoint = "IGNORED";
		fspec.replicas.add(new Replica("SITE_B", "root://b/file1.root"));
		fspec.replicas.add(new Replica("SITE_A", "root://a/file1.root"));

		final TraceReport trace = new TraceReport();
		trace.pq = "SITE_QUEUE";
		trace.eventType = "_a";

		Assertions.assertEquals(Arrays.asList("rucio", "-v", "download", "--trace_eventtype", "get_sm_a", "--trace_pq", "SITE_QUEUE", "--dir", "/job", "--rse", "SITE_B", "data17:file1.root"),
				m.getDownloadCommand(new File("/job"), fspec, trace));
	}

	@Test
	void testDownloadCommandNonDeterministicEndpoint() {
		final RucioSiteMover m = mover(new FakeRucioClient(), FakeCommandRunner.always(0, ""));

		final FileSpec fspec = new FileSpec("data17", "file1.root");
		fspec.ddmendpoint = "SITE_ND";
		fspec.turl = "srm://nd/path/file1.root";

		Assertions.assertEquals(Arrays.asList("rucio", "-v", "download", "--dir", "/job", "--rse", "SITE_ND", "--pfn", "srm://nd/path/file1.root", "data17:file1.root"),
				m.getDownloadCommand(new File("/job"), fspec, null));
	}

	@Test
	void testNonDeterministicWithoutTurlFails() {
		final FakeCommandRunner runner = FakeCommandRunner.always(0, "");
		final FakeRucioClient rucio = new FakeRucioClient();

		final FileSpec fspec = new FileSpec("data17", "file1.root");
		fspec.ddmendpoint = "SITE_ND";

		final PilotException pe = Assertions.assertThrows(PilotException.class, () -> mover(rucio, runner).stageIn(workdir.resolve("file1.root").toFile(), fspec, null));

		Assertions.assertEquals(TransferFailure.UNKNOWN_PHYSICAL_LOCATION, pe.getFailure());
		Assertions.assertEquals(PilotErrorCode.ERR_STAGEINFAILED, pe.getErrorCode());
		Assertions.assertTrue(runner.getCommands().isEmpty());
		Assertions.assertTrue(rucio.downloads.isEmpty());
	}

	@Test
	void testNonDeterministicWithTurlSucceeds() throws Exception {
		final FileSpec fspec = new FileSpec("data17", "file1.root");
		fspec.ddmendpoint = "SITE_ND";
		fspec.turl = "srm://nd/path/file1.root";

		final File dst = workdir.resolve("file1.root").toFile();

		final StageResult result = mover(new FakeRucioClient(), downloadingRunner("abc")).stageIn(dst, fspec, null);

		Assertions.assertEquals("SITE_ND", result.getEndpoint());
		Assertions.assertTrue(dst.isFile());
	}

	@Test
	void testStageInWithCommand() throws Exception {
		final FakeRucioClient rucio = new FakeRucioClient();
		final FakeCommandRunner runner = downloadingRunner("abc");

		final FileSpec fspec = new FileSpec("data17", "file1.root");
		fspec.ddmendpoint = "SITE_A";

		final File dst = workdir.resolve("file1.root").toFile();

		final StageResult result = mover(rucio, runner).stageIn(dst, fspec, null);

		Assertions.assertEquals(1, runner.getCommands().size());
		Assertions.assertTrue(rucio.downloads.isEmpty());

		Assertions.assertTrue(dst.isFile());
		Assertions.assertFalse(workdir.resolve("data17").resolve("file1.root").toFile().exists());

		Assertions.assertEquals(3, fspec.filesize);
		Assertions.assertEquals("024d0127", fspec.checksum);
		Assertions.assertEquals("adler32", fspec.checksumType);

		Assertions.assertEquals(StageResult.Shape.LOCATION, result.getShape());
		Assertions.assertEquals("SITE_A", result.getEndpoint());
		Assertions.assertNull(result.getStorageURL());
		Assertions.assertEquals("file1.root", result.getPhysicalName());
		Assertions.assertEquals(3, result.toMap().size());
	}

	@Test
	void testFallbackInvokedExactlyOnce() throws Exception {
		final FakeRucioClient rucio = new FakeRucioClient();
		rucio.content = "abc";

		final FakeCommandRunner runner = FakeCommandRunner.always(1, "rucio: command failed");

		final FileSpec fspec = new FileSpec("data17", "file1.root");
		fspec.replicas.add(new Replica("SITE_A", "root://a/file1.root"));

		final File dst = workdir.resolve("file1.root").toFile();

		final StageResult result = mover(rucio, runner).stageIn(dst, fspec, null);

		Assertions.assertEquals(1, runner.getCommands().size());
		Assertions.assertEquals(Collections.singletonList("data17:file1.root@SITE_A null"), rucio.downloads);

		Assertions.assertTrue(dst.isFile());
		Assertions.assertEquals(3, fspec.filesize);
		Assertions.assertEquals("SITE_A", result.getEndpoint());
	}

	@Test
	void testBothAttemptsFail() {
		final FakeRucioClient rucio = new FakeRucioClient();
		rucio.failWith = "library says no";

		final FakeCommandRunner runner = FakeCommandRunner.always(1, "command says no");

		final FileSpec fspec = new FileSpec("data17", "file1.root");
		fspec.ddmendpoint = "SITE_A";

		final PilotException pe = Assertions.assertThrows(PilotException.class, () -> mover(rucio, runner).stageIn(workdir.resolve("file1.root").toFile(), fspec, null));

		Assertions.assertEquals(TransferFailure.TRANSFER_FAILED, pe.getFailure());
		Assertions.assertEquals(PilotErrorCode.ERR_STAGEINFAILED, pe.getErrorCode());
		Assertions.assertTrue(pe.getMessage().contains("command says no"), pe.getMessage());
		Assertions.assertTrue(pe.getMessage().contains("library says no"), pe.getMessage());
		Assertions.assertEquals(1, rucio.downloads.size());
	}

	@Test
	void testRelocationFailure() {
		// the command claims success but leaves nothing behind
		final FakeCommandRunner runner = FakeCommandRunner.always(0, "");

		final FileSpec fspec = new FileSpec("data17", "file1.root");
		fspec.ddmendpoint = "SITE_A";

		final PilotException pe = Assertions.assertThrows(PilotException.class, () -> mover(new FakeRucioClient(), runner).stageIn(workdir.resolve("file1.root").toFile(), fspec, null));

		Assertions.assertEquals(TransferFailure.RELOCATION_FAILED, pe.getFailure());
		Assertions.assertEquals(PilotErrorCode.ERR_STAGEOUTFAILED, pe.getErrorCode());
	}

	@Test
	void testUploadCommands() {
		final RucioSiteMover m = mover(new FakeRucioClient(), FakeCommandRunner.always(0, ""));

		final File src = workdir.resolve("file1.root").toFile();

		final FileSpec root = new FileSpec("data17", "file1.root");
		root.ddmendpoint = "SITE_A";
		root.guid = "5F3C2A1E-0000-0000-0000-000000000001";

		Assertions.assertEquals(
				Arrays.asList("rucio", "-v", "upload", "--guid", "5F3C2A1E-0000-0000-0000-000000000001", "--no-register", "--rse", "SITE_A", "--scope", "data17", src.getAbsolutePath()),
				m.getUploadCommand(root, src));

		final FileSpec log = new FileSpec("data17", "job.log.tgz");
		log.ddmendpoint = "SITE_A";
		log.pfn = "/job/job.log.tgz";

		Assertions.assertEquals(Arrays.asList("rucio", "-v", "upload", "--no-register", "--rse", "SITE_A", "--scope", "data17", new File("/job/job.log.tgz").getAbsolutePath()),
				m.getUploadCommand(log, RucioSiteMover.getUploadSource(log, src)));

		final FileSpec byId = new FileSpec("data17", "file1.root");
		byId.ddmendpoint = "SITE_ND";
		byId.storageId = Long.valueOf(42);
		byId.turl = "srm://nd/path/file1.root";
		byId.guid = "ignored";

		Assertions.assertEquals(Arrays.asList("rucio", "-v", "upload", "--no-register", "--rse", "SITE_ND", "--scope", "data17", "--pfn", "srm://nd/path/file1.root", src.getAbsolutePath()),
				m.getUploadCommand(byId, src));
	}

	@Test
	void testStageOutFallback() throws Exception {
		final FakeRucioClient rucio = new FakeRucioClient();
		final FakeCommandRunner runner = FakeCommandRunner.always(ExitStatus.TIMED_OUT, "");

		final File src = workdir.resolve("file1.root").toFile();
		Files.write(src.toPath(), "abc".getBytes(StandardCharsets.UTF_8));

		final FileSpec fspec = new FileSpec("data17", "file1.root");
		fspec.ddmendpoint = "SITE_A";
		fspec.guid = "GUID";
		fspec.surl = "srm://a/rucio/data17/aa/bb/file1.root";

		final StageResult result = mover(rucio, runner).stageOut(src, fspec);

		Assertions.assertEquals(1, rucio.uploads.size());
		Assertions.assertEquals("GUID", rucio.uploads.get(0).guid);
		Assertions.assertEquals("SITE_A", rucio.uploads.get(0).rse);
		Assertions.assertEquals(src, rucio.uploads.get(0).path);

		Assertions.assertEquals("SITE_A", result.getEndpoint());
		Assertions.assertEquals("srm://a/rucio/data17/aa/bb/file1.root", result.getStorageURL());
		Assertions.assertEquals("file1.root", result.getPhysicalName());
	}

	@Test
	void testStageOutCommandAndLibraryUploadTheSameFile() throws Exception {
		final FakeRucioClient rucio = new FakeRucioClient();
		final FakeCommandRunner runner = FakeCommandRunner.always(1, "ERROR: file not found");

		final Path jobdir = Files.createDirectories(workdir.resolve("job"));
		final File src = jobdir.resolve("file1.root").toFile();
		Files.write(src.toPath(), "abc".getBytes(StandardCharsets.UTF_8));

		final FileSpec fspec = new FileSpec("data17", "file1.root");
		fspec.ddmendpoint = "SITE_A";
		fspec.guid = "GUID";

		mover(rucio, runner).stageOut(src, fspec);

		final List<String> cmd = runner.getLastCommand();
		final File uploadedByCommand = new File(cmd.get(cmd.size() - 1));

		Assertions.assertTrue(uploadedByCommand.isAbsolute(), cmd.toString());
		Assertions.assertEquals(src.getAbsoluteFile(), uploadedByCommand);
		Assertions.assertTrue(uploadedByCommand.exists());

		Assertions.assertEquals(1, rucio.uploads.size());
		Assertions.assertEquals(uploadedByCommand, rucio.uploads.get(0).path.getAbsoluteFile());
	}

	@Test
	void testStageOutWithoutEndpoint() {
		final FileSpec fspec = new FileSpec("data17", "file1.root");

		final PilotException pe = Assertions.assertThrows(PilotException.class,
				() -> mover(new FakeRucioClient(), FakeCommandRunner.always(0, "")).stageOut(workdir.resolve("file1.root").toFile(), fspec));

		Assertions.assertEquals(TransferFailure.CONFIGURATION_MISSING, pe.getFailure());
		Assertions.assertEquals(PilotErrorCode.ERR_STAGEOUTFAILED, pe.getErrorCode());
	}
}
