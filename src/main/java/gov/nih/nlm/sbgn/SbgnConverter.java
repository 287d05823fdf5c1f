package gov.nih.nlm.sbgn;

import static gov.nih.nlm.sbgn.PathUtilities.listFilesMatchingPattern;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Converts each SBGN-ML file in the data/sbgn directory into a JSON graph
 * description in the results directory.
 */
public class SbgnConverter {

	private static final Logger LOGGER = LogManager.getLogger(SbgnConverter.class);

	// Assign default locations of map, ontology, and result files
	private static final Path usrDir = Paths.get(System.getProperty("user.dir"));
	static final Path sbgnDir = usrDir.resolve("data/sbgn");
	static final Path oboDir = usrDir.resolve("data/obo");
	static final Path resultsDir = usrDir.resolve("results");

	static final String SBGN_PATTERN = ".*\\.sbgn";
	static final String OWL_PATTERN = ".*\\.owl";

	/**
	 * Create a grounding service using the ontology files in a directory, if it
	 * exists, and the bundled name tables.
	 *
	 * @param owlDir Directory containing ontology files
	 * @return Grounding service
	 */
	public static OntologyGroundingService createGroundingService(Path owlDir) {
		List<Path> owlFiles = List.of();
		if (owlDir.toFile().isDirectory()) {
			try {
				owlFiles = listFilesMatchingPattern(owlDir.toString(), OWL_PATTERN);
			} catch (IOException e) {
				throw new RuntimeException(e);
			}
		} else {
			LOGGER.warn("No ontology directory {}, grounding with bundled tables only", owlDir);
		}
		return OntologyGroundingService.createGroundingService(owlFiles);
	}

	/**
	 * Parse SBGN-ML files. A file which cannot be converted is logged, and
	 * skipped.
	 *
	 * @param sbgnFiles Paths to SBGN-ML files
	 * @param parser    Parser with which to convert the files
	 * @return Graph descriptions by map name, in file order
	 */
	public static Map<String, SbgnMapResult> parseSbgnFiles(List<Path> sbgnFiles, SbgnMapParser parser) {
		Map<String, SbgnMapResult> results = new LinkedHashMap<>();
		for (Path sbgnFile : sbgnFiles) {
			try {
				results.put(PathUtilities.getMapName(sbgnFile), parser.parseSbgnFile(sbgnFile));
			} catch (SbgnFormatException e) {
				LOGGER.error("Skipping {}: {}", sbgnFile.getFileName(), e.getMessage());
			}
		}
		return results;
	}

	/**
	 * Convert SBGN-ML files, and write a JSON file named after each map.
	 *
	 * @param sbgnFiles Paths to SBGN-ML files
	 * @param parser    Parser with which to convert the files
	 * @param outputDir Directory in which to write the JSON files
	 * @return Paths of the JSON files written
	 */
	public static List<Path> convertSbgnFiles(List<Path> sbgnFiles, SbgnMapParser parser, Path outputDir) {
		try {
			FileUtils.forceMkdir(outputDir.toFile());
		} catch (IOException e) {
			throw new RuntimeException(e);
		}
		Map<String, SbgnMapResult> results = parseSbgnFiles(sbgnFiles, parser);
		for (Map.Entry<String, SbgnMapResult> entry : results.entrySet()) {
			Path jsonFile = outputDir.resolve(entry.getKey() + ".json");
			LOGGER.info("Writing {}", jsonFile);
			SbgnResultWriter.writeResult(entry.getValue(), jsonFile);
		}
		return results.keySet().stream().map(mapName -> outputDir.resolve(mapName + ".json")).toList();
	}

	/**
	 * Convert each SBGN-ML file in a directory into a JSON graph description.
	 *
	 * @param args Optional SBGN-ML directory, output directory, and ontology
	 *             directory
	 */
	public static void main(String[] args) {
		Path inputDir = args.length > 0 ? Paths.get(args[0]) : sbgnDir;
		Path outputDir = args.length > 1 ? Paths.get(args[1]) : resultsDir;
		Path owlDir = args.length > 2 ? Paths.get(args[2]) : oboDir;
		List<Path> sbgnFiles;
		try {
			sbgnFiles = listFilesMatchingPattern(inputDir.toString(), SBGN_PATTERN);
		} catch (IOException e) {
			throw new RuntimeException(e);
		}
		if (sbgnFiles.isEmpty()) {
			LOGGER.warn("No SBGN-ML files found matching the pattern {} in {}", SBGN_PATTERN, inputDir);
			return;
		}
		OntologyGroundingService groundingService = createGroundingService(owlDir);
		LOGGER.info("Grounding in vocabularies {}", new TreeSet<>(groundingService.getPrefixes()));
		SbgnMapParser parser = new SbgnMapParser(groundingService);
		List<Path> jsonFiles = convertSbgnFiles(sbgnFiles, parser, outputDir);
		LOGGER.info("Converted {} of {} files", jsonFiles.size(), sbgnFiles.size());
	}
}
