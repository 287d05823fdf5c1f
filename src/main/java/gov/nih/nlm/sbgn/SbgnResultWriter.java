package gov.nih.nlm.sbgn;

import java.io.IOException;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Serializes map graph descriptions to indented JSON.
 */
public class SbgnResultWriter {

	private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
	private static final ObjectWriter writer = mapper.writer();

	/**
	 * Serialize a graph description to a JSON string.
	 *
	 * @param result Graph description
	 * @return JSON
	 */
	static String toJson(SbgnMapResult result) {
		try {
			return writer.writeValueAsString(result);
		} catch (JsonProcessingException e) {
			throw new RuntimeException(e);
		}
	}

	/**
	 * Write a graph description to a JSON file.
	 *
	 * @param result   Graph description
	 * @param jsonFile Path to the file to write
	 */
	public static void writeResult(SbgnMapResult result, Path jsonFile) {
		try {
			writer.writeValue(jsonFile.toFile(), result);
		} catch (IOException e) {
			throw new RuntimeException(e);
		}
	}

	/**
	 * @return Mapper used for serialization, for reading results back
	 */
	public static ObjectMapper getMapper() {
		return mapper;
	}
}
