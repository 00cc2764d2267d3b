package pilot.io.movers;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

import pilot.io.FileSpec;
import pilot.io.IOUtils;
import pilot.io.PilotErrorCode;
import pilot.io.PilotException;
import pilot.io.StageResult;
import pilot.io.TraceReport;
import pilot.io.TransferFailure;
import pilot.io.rucio.UploadRequest;

/**
 * Stage-in with <code>rucio download</code>, stage-out with <code>rucio upload</code>. When the command fails the same
 * operation is tried once more with the client library.
 *
 * @since Mar 8, 2017
 */
public class RucioSiteMover extends SiteMover {

	/**
	 * @param env
	 */
	RucioSiteMover(final MoverEnvironment env) {
		super(env);
	}

	@Override
	public MoverType getType() {
		return MoverType.RUCIO;
	}

	/**
	 * @param fspec
	 * @return the endpoint to pin the download to, <code>null</code> if any replica will do
	 */
	static String getDownloadEndpoint(final FileSpec fspec) {
		if (fspec.allowAllInputRSEs)
			return null;

		return fspec.getPinnedEndpoint();
	}

	/**
	 * @param fspec
	 * @return the explicit physical name to download, only for a non-deterministic ddmendpoint
	 */
	private String getDownloadPFN(final FileSpec fspec) {
		if (fspec.allowAllInputRSEs || fspec.hasReplicas() || isDeterministic(fspec.ddmendpoint))
			return null;

		return fspec.turl;
	}

	/**
	 * @param dir
	 * @param fspec
	 * @param trace
	 * @return <code>rucio -v download [trace options] --dir DIR [--rse RSE] [--pfn TURL] scope:lfn</code>
	 */
	List<String> getDownloadCommand(final File dir, final FileSpec fspec, final TraceReport trace) {
		final List<String> cmd = new ArrayList<>();

		cmd.add("rucio");
		cmd.add("-v");
		cmd.add("download");

		if (trace != null)
			cmd.addAll(trace.toDownloadOptions());

		cmd.add("--dir");
		cmd.add(dir.getPath());

		final String rse = getDownloadEndpoint(fspec);

		if (rse != null) {
			cmd.add("--rse");
			cmd.add(rse);
		}

		final String pfn = getDownloadPFN(fspec);

		if (pfn != null) {
			cmd.add("--pfn");
			cmd.add(pfn);
		}

		cmd.add(fspec.getDid());

		return cmd;
	}

	/**
	 * @param fspec
	 * @param src local file produced by the job
	 * @return the file to upload: the FileSpec's pfn when set, the source file otherwise
	 */
	static File getUploadSource(final FileSpec fspec, final File src) {
		return fspec.pfn != null && !fspec.pfn.isEmpty() ? new File(fspec.pfn) : src;
	}

	/**
	 * @param fspec
	 * @param local file to upload, passed as an absolute path since the tool does not run in its directory
	 * @return the upload command, in the identifier-addressed form when the file has a storage id
	 */
	List<String> getUploadCommand(final FileSpec fspec, final File local) {
		final List<String> cmd = new ArrayList<>();

		cmd.add("rucio");
		cmd.add("-v");
		cmd.add("upload");

		if (!fspec.hasStorageId() && fspec.isRootFile())
			if (fspec.guid != null) {
				cmd.add("--guid");
				cmd.add(fspec.guid);
			}
			else
				logger.log(Level.WARNING, fspec.getDid() + " is a ROOT file but has no guid to register it with");

		cmd.add("--no-register");
		cmd.add("--rse");
		cmd.add(fspec.ddmendpoint);
		cmd.add("--scope");
		cmd.add(fspec.scope);

		if (fspec.hasStorageId() && !isDeterministic(fspec.ddmendpoint)) {
			cmd.add("--pfn");
			cmd.add(fspec.turl);
		}

		cmd.add(local.getAbsolutePath());

		return cmd;
	}

	@Override
	public StageResult stageIn(final File dst, final FileSpec fspec, final TraceReport trace) throws PilotException {
		final File dir = dst.getAbsoluteFile().getParentFile();

		final List<String> cmd = getDownloadCommand(dir, fspec, trace);

		final String rse = getDownloadEndpoint(fspec);
		final String pfn = getDownloadPFN(fspec);

		final TwoStageTransfer transfer = new TwoStageTransfer(TwoStageTransfer.Direction.STAGE_IN, fspec.getDid());

		transfer.execute(locationCheck(rse, fspec, TwoStageTransfer.Direction.STAGE_IN), () -> runCommand(cmd, fspec, dir), () -> env.rucio.download(fspec.scope, fspec.lfn, rse, pfn, dir));

		relocate(new File(new File(dir, fspec.scope), fspec.lfn), dst.getAbsoluteFile());

		fspec.filesize = dst.length();

		try {
			fspec.checksum = IOUtils.getAdler32(dst);
			fspec.checksumType = IOUtils.ADLER32;
		}
		catch (final IOException ioe) {
			logger.log(Level.WARNING, "Cannot checksum the staged file " + dst.getAbsolutePath(), ioe);
			throw new PilotException(TransferFailure.TRANSFER_FAILED, PilotErrorCode.ERR_STAGEINFAILED, "Cannot read back the staged file " + dst.getAbsolutePath() + ": " + ioe.getMessage(), ioe);
		}

		logger.log(Level.INFO, "stageIn of " + fspec.getDid() + " done: " + fspec.filesize + " bytes, " + fspec.checksumType + ":" + fspec.checksum);

		return StageResult.location(fspec.getPinnedEndpoint(), null, fspec.lfn);
	}

	/**
	 * Move the file from the namespaced location the tools download to, to the requested one
	 *
	 * @param downloaded
	 * @param dst
	 * @throws PilotException with {@link TransferFailure#RELOCATION_FAILED}, reported as a stage-out failure
	 */
	static void relocate(final File downloaded, final File dst) throws PilotException {
		if (downloaded.equals(dst))
			return;

		logger.log(Level.INFO, "stageIn: moving " + downloaded.getAbsolutePath() + " to " + dst.getAbsolutePath());

		try {
			Files.move(downloaded.toPath(), dst.toPath(), StandardCopyOption.REPLACE_EXISTING);
		}
		catch (final IOException ioe) {
			logger.log(Level.WARNING, "Could not move the downloaded file to its destination", ioe);
			throw new PilotException(TransferFailure.RELOCATION_FAILED, PilotErrorCode.ERR_STAGEOUTFAILED,
					"stageIn failed -- could not move downloaded file " + downloaded.getAbsolutePath() + " to destination " + dst.getAbsolutePath() + ": " + ioe.getMessage(), ioe);
		}
	}

	@Override
	public StageResult stageOut(final File src, final FileSpec fspec) throws PilotException {
		final File workdir = src.getAbsoluteFile().getParentFile();

		final TwoStageTransfer transfer = new TwoStageTransfer(TwoStageTransfer.Direction.STAGE_OUT, fspec.getDid());

		final String rse = fspec.ddmendpoint != null ? fspec.ddmendpoint : "";

		final File local = getUploadSource(fspec, src);

		transfer.execute(locationCheck(rse, fspec, TwoStageTransfer.Direction.STAGE_OUT), () -> runCommand(getUploadCommand(fspec, local), fspec, workdir), () -> {
			final UploadRequest request = new UploadRequest(local, rse, fspec.scope);

			if (fspec.hasStorageId()) {
				if (!isDeterministic(rse))
					request.pfn = fspec.turl;
			}
			else if (fspec.isRootFile())
				request.guid = fspec.guid;

			env.rucio.upload(request);
		});

		return StageResult.location(fspec.ddmendpoint, fspec.surl, fspec.lfn);
	}
}
