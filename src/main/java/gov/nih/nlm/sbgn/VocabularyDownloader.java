package gov.nih.nlm.sbgn;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Downloads the ontology files, and the HGNC complete set used for grounding,
 * comparing ontology versions to manage updates.
 */
public class VocabularyDownloader {

	private static final Logger LOGGER = LogManager.getLogger(VocabularyDownloader.class);

	// Assign PURLs of the vocabularies used to ground compartments, phenotypes,
	// and chemicals
	static final List<String> VOCABULARY_PURLS = List.of("http://purl.obolibrary.org/obo/go.owl",
			"http://www.ebi.ac.uk/efo/efo.owl", "http://purl.obolibrary.org/obo/chebi/chebi_lite.owl");
	// Assign URL of the tab separated HGNC complete set, which carries no version
	static final String HGNC_COMPLETE_SET_URL = "https://storage.googleapis.com/public-download-files/hgnc/tsv/tsv/"
			+ "hgnc_complete_set.txt";
	// Assign location of ontology files
	private static final Path usrDir = Paths.get(System.getProperty("user.dir"));
	private static final Path oboDir = usrDir.resolve("data/obo");
	// Assign OWL namespace
	private static final String OWL_NS = "http://www.w3.org/2002/07/owl#";
	// Assign pattern for extracting YYYY-MM-DD dates
	private static final Pattern DATE_PATTERN = Pattern.compile("(\\d{4}-\\d{2}-\\d{2})");

	/**
	 * Parse the ontology XML file to find its version as a YYYY-MM-DD date
	 * string. First tries owl:versionInfo, then falls back to extracting a date
	 * from owl:versionIRI.
	 *
	 * @param owlFilePath Path to ontology XML file
	 * @return Version string in YYYY-MM-DD format, or null if not found
	 */
	public static String findOwlVersion(Path owlFilePath) {
		LOGGER.info("Parsing {}", owlFilePath);
		Document doc = SbgnXmlReader.parseXmlFile(owlFilePath.toFile());

		// Try owl:versionInfo first
		Element versionInfoElement = (Element) doc.getElementsByTagNameNS(OWL_NS, "versionInfo").item(0);
		if (versionInfoElement != null) {
			Matcher matcher = DATE_PATTERN.matcher(versionInfoElement.getTextContent().trim());
			if (matcher.find()) {
				return matcher.group(1);
			}
		}

		// Fall back to owl:versionIRI
		Element versionIRIElement = (Element) doc.getElementsByTagNameNS(OWL_NS, "versionIRI").item(0);
		if (versionIRIElement != null) {
			Matcher matcher = DATE_PATTERN.matcher(versionIRIElement.getAttributeNS(SbgnXmlReader.RDF_NS, "resource"));
			if (matcher.find()) {
				return matcher.group(1);
			}
		}

		LOGGER.warn("Could not get version for {}", owlFilePath);
		return null;
	}

	/**
	 * Replace the current copy of a vocabulary with a new download if the new
	 * version is newer, archiving the current copy. Otherwise remove the new
	 * download.
	 *
	 * @param newFile     Path to the new download
	 * @param curFile     Path to the current copy, which may not exist
	 * @param downloadDir Path to directory containing downloaded files
	 * @throws IOException if an I/O error occurs
	 */
	public static void replaceIfNewer(Path newFile, Path curFile, Path downloadDir) throws IOException {
		if (!Files.exists(curFile)) {
			LOGGER.info("Renaming {} to {}", newFile, curFile);
			Files.move(newFile, curFile);
			return;
		}
		String versionNew = findOwlVersion(newFile);
		String versionCur = findOwlVersion(curFile);
		LOGGER.info("Found new version {}, and current version {}", versionNew, versionCur);
		if (versionNew != null && versionCur != null && versionNew.compareTo(versionCur) > 0) {
			String fileName = curFile.getFileName().toString();
			String stem = fileName.substring(0, fileName.lastIndexOf('.'));
			String suffix = fileName.substring(fileName.lastIndexOf('.'));
			Path archiveDir = downloadDir.resolve(".archive");
			Files.createDirectories(archiveDir);
			Path oldFile = archiveDir.resolve(stem + "-" + versionCur + suffix);

			LOGGER.info("Renaming {} to {}", curFile, oldFile);
			Files.move(curFile, oldFile);

			LOGGER.info("Renaming {} to {}", newFile, curFile);
			Files.move(newFile, curFile);
		} else {
			LOGGER.info("New version is not newer than current version, removing {}", newFile);
			Files.delete(newFile);
		}
	}

	/**
	 * Download each specified URL, and keep the newer of the new and current
	 * download.
	 *
	 * @param urls        List of URLs to download
	 * @param downloadDir Path to directory containing downloaded files
	 * @throws IOException          if an I/O error occurs
	 * @throws InterruptedException if the download is interrupted
	 */
	public static void updateDownloads(List<String> urls, Path downloadDir) throws IOException, InterruptedException {
		HttpClient client = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build();
		Files.createDirectories(downloadDir);
		for (String url : urls) {
			String fileName = getFileName(url);
			Path newFile = download(client, url, downloadDir.resolve(getNewFileName(fileName)));
			replaceIfNewer(newFile, downloadDir.resolve(fileName), downloadDir);
		}
	}

	/**
	 * Download the HGNC complete set, replacing any current copy, since the file
	 * carries no version.
	 *
	 * @param url         URL of the HGNC complete set
	 * @param downloadDir Path to directory containing downloaded files
	 * @return Path to the current copy
	 * @throws IOException          if an I/O error occurs
	 * @throws InterruptedException if the download is interrupted
	 */
	public static Path updateHgncCompleteSet(String url, Path downloadDir) throws IOException, InterruptedException {
		HttpClient client = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build();
		Files.createDirectories(downloadDir);
		String fileName = getFileName(url);
		Path newFile = download(client, url, downloadDir.resolve(getNewFileName(fileName)));
		Path curFile = downloadDir.resolve(fileName);
		LOGGER.info("Renaming {} to {}", newFile, curFile);
		return Files.move(newFile, curFile, StandardCopyOption.REPLACE_EXISTING);
	}

	/**
	 * Get the file name of a URL path.
	 *
	 * @param url URL
	 * @return Last segment of the URL path
	 */
	static String getFileName(String url) {
		String path = URI.create(url).getPath();
		return path.substring(path.lastIndexOf('/') + 1);
	}

	// Name the temporary file receiving a download
	static String getNewFileName(String fileName) {
		int dot = fileName.lastIndexOf('.');
		if (dot < 0) {
			return fileName + "-new";
		}
		return fileName.substring(0, dot) + "-new" + fileName.substring(dot);
	}

	private static Path download(HttpClient client, String url, Path target) throws IOException, InterruptedException {
		LOGGER.info("Getting {}", url);
		HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url)).build();
		HttpResponse<Path> response = client.send(request, HttpResponse.BodyHandlers.ofFile(target));
		if (response.statusCode() != 200) {
			Files.deleteIfExists(response.body());
			throw new IOException("Could not get " + url + ": status " + response.statusCode());
		}
		return response.body();
	}

	/**
	 * Download the vocabularies used for grounding.
	 *
	 * @param args Optional download directory
	 */
	public static void main(String[] args) {
		Path downloadDir = args.length > 0 ? Paths.get(args[0]) : oboDir;
		try {
			updateDownloads(VOCABULARY_PURLS, downloadDir);
			updateHgncCompleteSet(HGNC_COMPLETE_SET_URL, downloadDir);
		} catch (IOException | InterruptedException e) {
			throw new RuntimeException(e);
		}
	}
}
