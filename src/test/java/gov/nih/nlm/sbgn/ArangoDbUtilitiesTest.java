package gov.nih.nlm.sbgn;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import com.arangodb.ArangoDatabase;
import com.arangodb.ArangoGraph;

class ArangoDbUtilitiesTest {

	static String arangoDbHost = "localhost";
	static String arangoDbPort = "8529";
	static String arangoDbUser = "root";
	static String arangoDbPassword = System.getenv("ARANGO_DB_PASSWORD");

	static String databaseName = "sbgn-test-database";
	static String graphName = "graph";
	static String fromVertexName = "from_vertex";
	static String toVertexName = "to_vertex";
	static String edgeName = fromVertexName + "-" + toVertexName;

	ArangoDbUtilities arangoDbUtilities;

	// Connect to a running ArangoDB instance
	ArangoDbUtilities connect() {
		Map<String, String> env = new HashMap<>();
		env.put("ARANGO_DB_HOST", arangoDbHost);
		env.put("ARANGO_DB_PORT", arangoDbPort);
		env.put("ARANGO_DB_USER", arangoDbUser);
		env.put("ARANGO_DB_PASSWORD", arangoDbPassword);
		arangoDbUtilities = new ArangoDbUtilities(env);
		return arangoDbUtilities;
	}

	@AfterEach
	void tearDown() {
		if (arangoDbUtilities != null) {
			arangoDbUtilities.deleteDatabase(databaseName);
			arangoDbUtilities.arangoDB.shutdown();
		}
	}

	@Test
	void constructor_missingHost() {
		assertThrows(RuntimeException.class, () -> new ArangoDbUtilities(Map.of("ARANGO_DB_PORT", "8529")));
	}

	@Test
	void getEdgeCollectionName() {
		assertEquals("entity-process",
				ArangoDbUtilities.getEdgeCollectionName(SbgnGraphLoader.ENTITY, SbgnGraphLoader.PROCESS));
	}

	@Test
	@EnabledIfEnvironmentVariable(named = "ARANGO_DB_PASSWORD", matches = ".+")
	void createOrGetDatabase() {
		connect();
		assertFalse(arangoDbUtilities.arangoDB.db(databaseName).exists());
		arangoDbUtilities.createOrGetDatabase(databaseName);
		assertTrue(arangoDbUtilities.arangoDB.db(databaseName).exists());
	}

	@Test
	@EnabledIfEnvironmentVariable(named = "ARANGO_DB_PASSWORD", matches = ".+")
	void deleteDatabase() {
		connect();
		arangoDbUtilities.createOrGetDatabase(databaseName);
		assertTrue(arangoDbUtilities.arangoDB.db(databaseName).exists());
		arangoDbUtilities.deleteDatabase(databaseName);
		assertFalse(arangoDbUtilities.arangoDB.db(databaseName).exists());
	}

	@Test
	@EnabledIfEnvironmentVariable(named = "ARANGO_DB_PASSWORD", matches = ".+")
	void createOrGetGraph() {
		connect();
		ArangoDatabase db = arangoDbUtilities.createOrGetDatabase(databaseName);
		assertFalse(db.graph(graphName).exists());
		arangoDbUtilities.createOrGetGraph(db, graphName);
		assertTrue(db.graph(graphName).exists());
	}

	@Test
	@EnabledIfEnvironmentVariable(named = "ARANGO_DB_PASSWORD", matches = ".+")
	void deleteGraph() {
		connect();
		ArangoDatabase db = arangoDbUtilities.createOrGetDatabase(databaseName);
		arangoDbUtilities.createOrGetGraph(db, graphName);
		assertTrue(db.graph(graphName).exists());
		arangoDbUtilities.deleteGraph(db, graphName);
		assertFalse(db.graph(graphName).exists());
	}

	@Test
	@EnabledIfEnvironmentVariable(named = "ARANGO_DB_PASSWORD", matches = ".+")
	void createOrGetVertexCollection() {
		connect();
		ArangoDatabase db = arangoDbUtilities.createOrGetDatabase(databaseName);
		ArangoGraph graph = arangoDbUtilities.createOrGetGraph(db, graphName);
		assertFalse(graph.db().collection(fromVertexName).exists());
		arangoDbUtilities.createOrGetVertexCollection(graph, fromVertexName);
		assertTrue(graph.db().collection(fromVertexName).exists());
	}

	@Test
	@EnabledIfEnvironmentVariable(named = "ARANGO_DB_PASSWORD", matches = ".+")
	void createOrGetEdgeCollection() {
		connect();
		ArangoDatabase db = arangoDbUtilities.createOrGetDatabase(databaseName);
		ArangoGraph graph = arangoDbUtilities.createOrGetGraph(db, graphName);
		arangoDbUtilities.createOrGetVertexCollection(graph, fromVertexName);
		arangoDbUtilities.createOrGetVertexCollection(graph, toVertexName);
		assertFalse(graph.db().collection(edgeName).exists());
		arangoDbUtilities.createOrGetEdgeCollection(graph, fromVertexName, toVertexName);
		assertTrue(graph.db().collection(edgeName).exists());
	}

	@Test
	@EnabledIfEnvironmentVariable(named = "ARANGO_DB_PASSWORD", matches = ".+")
	void insertDocuments() {
		connect();
		SbgnMapParser parser = new SbgnMapParser(RecordingGroundingService.forPampSignaling());
		SbgnMapResult result = parser.parseSbgnFile(Paths.get(System.getProperty("user.dir"))
				.resolve("src/test/data/sbgn/pamp_signaling.xml.sbgn"));
		SbgnGraphLoader.GraphDocuments documents = new SbgnGraphLoader.GraphDocuments();
		SbgnGraphLoader.constructDocuments("pamp_signaling", result, documents);

		ArangoDatabase db = arangoDbUtilities.createOrGetDatabase(databaseName);
		ArangoGraph graph = arangoDbUtilities.createOrGetGraph(db, graphName);
		SbgnGraphLoader.insertDocuments(arangoDbUtilities, graph, documents);
		// Inserting again updates the same documents
		SbgnGraphLoader.insertDocuments(arangoDbUtilities, graph, documents);

		assertEquals(7L, db.collection(SbgnGraphLoader.ENTITY).count().getCount());
		assertEquals(3L, db.collection(SbgnGraphLoader.PROCESS).count().getCount());
	}
}
