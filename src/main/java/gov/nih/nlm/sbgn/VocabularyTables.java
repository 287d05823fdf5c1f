package gov.nih.nlm.sbgn;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Provides read-only name to identifier tables for the HGNC and ChEBI
 * vocabularies, loaded once. The HGNC table is built from the downloaded HGNC
 * complete set in data/obo when present, otherwise from a bundled snapshot.
 */
public class VocabularyTables {

	private static final Logger LOGGER = LogManager.getLogger(VocabularyTables.class);

	static final String HGNC_RESOURCE = "/vocabulary/hgnc_name_to_id.tsv";
	static final String CHEBI_RESOURCE = "/vocabulary/chebi_name_to_id.tsv";

	// Assign location of the downloaded HGNC complete set
	static final Path HGNC_COMPLETE_SET = Paths.get(System.getProperty("user.dir"))
			.resolve("data/obo/hgnc_complete_set.txt");

	// Assign HGNC complete set columns
	static final String HGNC_ID_COLUMN = "hgnc_id";
	static final String HGNC_SYMBOL_COLUMN = "symbol";

	private static final Map<String, String> hgncNameToId = loadHgncNameToId(HGNC_COMPLETE_SET);
	private static final Map<String, String> chebiNameToId = loadNameToId(CHEBI_RESOURCE);

	/**
	 * @return HGNC identifiers by approved gene symbol
	 */
	public static Map<String, String> hgncNameToId() {
		return hgncNameToId;
	}

	/**
	 * @return ChEBI identifiers by name
	 */
	public static Map<String, String> chebiNameToId() {
		return chebiNameToId;
	}

	/**
	 * Load the HGNC table from the complete set, if the file exists, otherwise
	 * from the bundled snapshot.
	 *
	 * @param hgncCompleteSet Path to the HGNC complete set
	 * @return Unmodifiable table
	 */
	static Map<String, String> loadHgncNameToId(Path hgncCompleteSet) {
		if (Files.isRegularFile(hgncCompleteSet)) {
			return loadHgncCompleteSet(hgncCompleteSet);
		}
		LOGGER.warn("No HGNC complete set at {}, using the bundled snapshot", hgncCompleteSet);
		return loadNameToId(HGNC_RESOURCE);
	}

	/**
	 * Load approved symbols, and identifiers from the tab separated HGNC complete
	 * set, as downloaded by {@link VocabularyDownloader}. The "HGNC:" prefix is
	 * removed from identifiers.
	 *
	 * @param hgncCompleteSet Path to the HGNC complete set
	 * @return Unmodifiable table of identifiers by approved symbol
	 */
	static Map<String, String> loadHgncCompleteSet(Path hgncCompleteSet) {
		Map<String, String> nameToId = new HashMap<>();
		try (BufferedReader reader = Files.newBufferedReader(hgncCompleteSet, StandardCharsets.UTF_8)) {
			String header = reader.readLine();
			if (header == null) {
				throw new RuntimeException("Empty HGNC complete set " + hgncCompleteSet);
			}
			List<String> columns = Arrays.asList(header.split("\t", -1));
			int idIndex = columns.indexOf(HGNC_ID_COLUMN);
			int symbolIndex = columns.indexOf(HGNC_SYMBOL_COLUMN);
			if (idIndex < 0 || symbolIndex < 0) {
				throw new RuntimeException("HGNC complete set " + hgncCompleteSet + " has no " + HGNC_ID_COLUMN
						+ ", or " + HGNC_SYMBOL_COLUMN + " column");
			}
			String line;
			while ((line = reader.readLine()) != null) {
				if (line.isBlank()) {
					continue;
				}
				String[] tokens = line.split("\t", -1);
				if (tokens.length <= Math.max(idIndex, symbolIndex)) {
					LOGGER.warn("Skipping short line in {}: {}", hgncCompleteSet, line);
					continue;
				}
				String identifier = tokens[idIndex].strip();
				if (identifier.startsWith("HGNC:")) {
					identifier = identifier.substring("HGNC:".length());
				}
				nameToId.put(tokens[symbolIndex].strip(), identifier);
			}
		} catch (IOException e) {
			throw new RuntimeException(e);
		}
		LOGGER.info("Loaded {} HGNC symbols from {}", nameToId.size(), hgncCompleteSet);
		return Collections.unmodifiableMap(nameToId);
	}

	/**
	 * Load a name to identifier table from a classpath resource containing one
	 * "name TAB identifier" pair per line. Blank lines, and lines starting with
	 * "#" are skipped.
	 *
	 * @param resource Classpath resource name
	 * @return Unmodifiable table
	 */
	static Map<String, String> loadNameToId(String resource) {
		Map<String, String> nameToId = new HashMap<>();
		try (InputStream inputStream = VocabularyTables.class.getResourceAsStream(resource)) {
			if (inputStream == null) {
				throw new RuntimeException("Could not find vocabulary resource " + resource);
			}
			BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
			String line;
			while ((line = reader.readLine()) != null) {
				if (line.isBlank() || line.startsWith("#")) {
					continue;
				}
				String[] tokens = line.split("\t");
				if (tokens.length < 2) {
					throw new RuntimeException("Malformed line in " + resource + ": " + line);
				}
				nameToId.put(tokens[0].strip(), tokens[1].strip());
			}
		} catch (IOException e) {
			throw new RuntimeException(e);
		}
		return Collections.unmodifiableMap(nameToId);
	}
}
