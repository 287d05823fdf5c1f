package gov.nih.nlm.sbgn;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Collects common methods for handling paths.
 */
public class PathUtilities {

	// Assign pattern for matching to SBGN-ML file name extensions
	private static final Pattern sbgnExtensionPattern = Pattern.compile("(\\.xml)?\\.sbgn$");

	/**
	 * List files in a directory matching a pattern, sorted by name.
	 *
	 * @param directoryPath Directory containing the files
	 * @param filePattern   Pattern for matching to files
	 * @return List of matching files
	 * @throws IOException On read
	 */
	public static List<Path> listFilesMatchingPattern(String directoryPath, String filePattern) throws IOException {
		Pattern pattern = Pattern.compile(filePattern);
		try (var filesStream = Files.list(Paths.get(directoryPath))) {
			return filesStream.filter(Files::isRegularFile)
					.filter(path -> pattern.matcher(path.getFileName().toString()).matches()).sorted()
					.collect(Collectors.toList());
		}
	}

	/**
	 * Get the name of a map from the name of its SBGN-ML file, by removing a
	 * ".sbgn", or ".xml.sbgn" extension.
	 *
	 * @param sbgnFile Path to SBGN-ML file
	 * @return Map name
	 */
	public static String getMapName(Path sbgnFile) {
		return sbgnExtensionPattern.matcher(sbgnFile.getFileName().toString()).replaceFirst("");
	}
}
