package pilot.io.movers;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import pilot.io.FileSpec;
import pilot.io.PilotErrorCode;
import pilot.io.PilotException;
import pilot.io.StageResult;
import pilot.io.TraceReport;
import pilot.io.TransferFailure;
import utils.ExitStatus;

/**
 * Mover for sites where the storage is mounted on the worker nodes. The physical file behind a replica is found from
 * the WebDAV etag of its HTTP URL and linked in the job directory; outputs are moved to the shared output directory.
 *
 * @since Feb 27, 2017
 */
public class StormSiteMover extends SiteMover {

	/**
	 * Separator after which the HTTP URLs returned by the catalog carry a suffix to drop
	 */
	static final String SURL_SUFFIX_SEPARATOR = "_-";

	/**
	 * @param env
	 */
	StormSiteMover(final MoverEnvironment env) {
		super(env);
	}

	@Override
	public MoverType getType() {
		return MoverType.STORM;
	}

	/**
	 * @param replica HTTP replica URL as returned by the catalog
	 * @return the URL up to the first <code>_-</code>
	 */
	static String cleanReplicaURL(final String replica) {
		final int idx = replica.indexOf(SURL_SUFFIX_SEPARATOR);

		return idx >= 0 ? replica.substring(0, idx) : replica;
	}

	/**
	 * Extract the physical path from a PROPFIND reply. The etag is <code>"/path/to/lfn_timestamp"</code>, and since the
	 * name can contain underscores the cut is made right after the (unique) logical file name.
	 *
	 * @param xml
	 * @param lfn
	 * @return physical path of the file
	 * @throws IOException if the reply cannot be parsed or has no etag
	 */
	static String parseEtag(final String xml, final String lfn) throws IOException {
		final Document doc;

		try {
			final DocumentBuilder builder = DocumentBuilderFactory.newInstance().newDocumentBuilder();
			doc = builder.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
		}
		catch (final ParserConfigurationException | SAXException e) {
			throw new IOException("Cannot parse the PROPFIND reply: " + e.getMessage(), e);
		}

		final NodeList etags = doc.getElementsByTagName("d:getetag");

		if (etags.getLength() == 0 || etags.item(0).getTextContent() == null)
			throw new IOException("No d:getetag in the PROPFIND reply");

		final String etag = etags.item(0).getTextContent().replace("\"", "").trim();

		final int idx = etag.indexOf(lfn);

		final String target = (idx >= 0 ? etag.substring(0, idx) : etag) + lfn;

		logger.log(Level.FINE, "Symlink before: " + etag + ", after: " + target);

		return target;
	}

	/**
	 * @param httpSurl
	 * @return the PROPFIND command
	 */
	List<String> getPropfindCommand(final String httpSurl) {
		final List<String> cmd = new ArrayList<>();

		cmd.add("davix-http");
		cmd.add("--capath");
		cmd.add(env.caPath);

		final String proxy = System.getenv("X509_USER_PROXY");

		if (proxy != null && !proxy.isEmpty()) {
			cmd.add("--cert");
			cmd.add(proxy);
		}

		cmd.add("-X");
		cmd.add("PROPFIND");
		cmd.add(httpSurl);

		return cmd;
	}

	private String lookupTarget(final FileSpec fspec) throws PilotException {
		final List<String> replicas;

		try {
			replicas = env.rucio.listReplicas(fspec.scope, fspec.lfn, "davs", fspec.ddmendpoint);
		}
		catch (final IOException ioe) {
			logger.log(Level.WARNING, "Cannot list the davs replicas of " + fspec, ioe);
			throw new PilotException(TransferFailure.METADATA_LOOKUP_FAILED, PilotErrorCode.ERR_STAGEINFAILED, "Cannot list the davs replicas of " + fspec + ": " + ioe.getMessage(), ioe);
		}

		if (replicas.isEmpty()) {
			logger.log(Level.WARNING, "No davs replica of " + fspec);
			throw new PilotException(TransferFailure.METADATA_LOOKUP_FAILED, PilotErrorCode.ERR_STAGEINFAILED, "No davs replica of " + fspec.getDid() + " at " + fspec.ddmendpoint);
		}

		final String httpSurl = cleanReplicaURL(replicas.get(0));

		logger.log(Level.INFO, "http_surl: " + httpSurl);

		final ExitStatus status;

		try {
			status = env.runner.run(getPropfindCommand(httpSurl), env.metadataTimeoutSeconds, TimeUnit.SECONDS);
		}
		catch (final InterruptedException ie) {
			Thread.currentThread().interrupt();
			throw new PilotException(TransferFailure.METADATA_LOOKUP_FAILED, PilotErrorCode.ERR_STAGEINFAILED, "Interrupted while retrieving the WebDAV ETag of " + httpSurl, ie);
		}

		if (status.isTimedOut() || status.getExitCode() == ExitStatus.CANNOT_START) {
			logger.log(Level.WARNING, "FATAL: could not retrieve STORM WebDAV ETag: " + status);
			throw new PilotException(TransferFailure.METADATA_LOOKUP_FAILED, PilotErrorCode.ERR_STAGEINFAILED, "Could not retrieve STORM WebDAV ETag: " + status.getOutput());
		}

		try {
			return parseEtag(status.getOutput(), fspec.lfn);
		}
		catch (final IOException ioe) {
			logger.log(Level.WARNING, "FATAL: could not parse STORM WebDAV ETag from: " + status.getOutput(), ioe);
			throw new PilotException(TransferFailure.METADATA_LOOKUP_FAILED, PilotErrorCode.ERR_STAGEINFAILED, "Could not retrieve STORM WebDAV ETag: " + ioe.getMessage(), ioe);
		}
	}

	@Override
	public StageResult stageIn(final File dst, final FileSpec fspec, final TraceReport trace) throws PilotException {
		final TwoStageTransfer transfer = new TwoStageTransfer(TwoStageTransfer.Direction.STAGE_IN, fspec.getDid());

		transfer.execute(null, () -> {
			final String target = lookupTarget(fspec);

			logger.log(Level.INFO, "Making symlink from " + target + " to " + dst.getAbsolutePath());

			try {
				Files.createSymbolicLink(dst.toPath(), Paths.get(target));
			}
			catch (final IOException | UnsupportedOperationException e) {
				logger.log(Level.WARNING, "FATAL: could not create symlink", e);
				throw new PilotException(TransferFailure.TRANSFER_FAILED, PilotErrorCode.ERR_STAGEINFAILED, "Could not create symlink: " + e.getMessage(), e);
			}
		}, null);

		logger.log(Level.INFO, "Symlink creation successful");

		return StageResult.checksum(fspec.checksumType, fspec.checksum, fspec.filesize);
	}

	@Override
	public StageResult stageOut(final File src, final FileSpec fspec) throws PilotException {
		final File dest = new File(env.stormOutputDir, fspec.lfn);

		final TwoStageTransfer transfer = new TwoStageTransfer(TwoStageTransfer.Direction.STAGE_OUT, fspec.getDid());

		transfer.execute(null, () -> {
			logger.log(Level.INFO, "Moving " + src.getAbsolutePath() + " to " + dest.getAbsolutePath());

			try {
				Files.move(src.toPath(), dest.toPath(), StandardCopyOption.REPLACE_EXISTING);
			}
			catch (final IOException ioe) {
				logger.log(Level.WARNING, "FATAL: could not move outputfile", ioe);
				throw new PilotException(TransferFailure.TRANSFER_FAILED, PilotErrorCode.ERR_STAGEOUTFAILED, "Could not move outputfile: " + ioe.getMessage(), ioe);
			}
		}, null);

		logger.log(Level.INFO, "Move successful");

		return StageResult.location(fspec.ddmendpoint, fspec.surl != null ? fspec.surl : dest.getAbsolutePath(), fspec.lfn);
	}
}
