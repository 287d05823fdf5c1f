package gov.nih.nlm.sbgn;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.arangodb.ArangoDB;
import com.arangodb.ArangoDatabase;
import com.arangodb.ArangoEdgeCollection;
import com.arangodb.ArangoGraph;
import com.arangodb.ArangoVertexCollection;
import com.arangodb.entity.EdgeDefinition;

/**
 * Provides utilities for managing the named ArangoDB databases, graphs, vertex
 * collections, and edge collections into which map graph descriptions are
 * loaded.
 */
public class ArangoDbUtilities {

	private static final Logger LOGGER = LogManager.getLogger(ArangoDbUtilities.class);

	/**
	 * An ArangoDB instance
	 */
	public final ArangoDB arangoDB;

	/**
	 * Build the ArangoDB instance specified in the system environment.
	 */
	public ArangoDbUtilities() {
		this(System.getenv());
	}

	/**
	 * Build the ArangoDB instance specified by ARANGO_DB_HOST, ARANGO_DB_PORT,
	 * ARANGO_DB_USER, and ARANGO_DB_PASSWORD.
	 *
	 * @param env Connection settings
	 */
	public ArangoDbUtilities(Map<String, String> env) {
		String host = env.get("ARANGO_DB_HOST");
		String port = env.get("ARANGO_DB_PORT");
		if (host == null || port == null) {
			throw new RuntimeException("ARANGO_DB_HOST and ARANGO_DB_PORT must be set");
		}
		arangoDB = new ArangoDB.Builder().host(host, Integer.parseInt(port)).user(env.get("ARANGO_DB_USER"))
				.password(env.get("ARANGO_DB_PASSWORD")).build();
	}

	/**
	 * Create or get a named database.
	 *
	 * @param databaseName Name of the database to create or get
	 * @return Named database
	 */
	public ArangoDatabase createOrGetDatabase(String databaseName) {
		if (!arangoDB.db(databaseName).exists()) {
			LOGGER.info("Creating database: {}", databaseName);
			if (!arangoDB.createDatabase(databaseName)) {
				throw new RuntimeException("Could not create database: " + databaseName);
			}
		}
		return arangoDB.db(databaseName);
	}

	/**
	 * Delete a named database.
	 *
	 * @param databaseName Name of the database to delete
	 */
	public void deleteDatabase(String databaseName) {
		if (arangoDB.db(databaseName).exists()) {
			LOGGER.info("Deleting database: {}", databaseName);
			if (!arangoDB.db(databaseName).drop()) {
				throw new RuntimeException("Could not delete database: " + databaseName);
			}
		}
	}

	/**
	 * Create or get a named graph.
	 *
	 * @param db        Database in which to create or get the graph
	 * @param graphName Name of the graph to create or get
	 * @return Named graph
	 */
	public ArangoGraph createOrGetGraph(ArangoDatabase db, String graphName) {
		if (!db.graph(graphName).exists()) {
			LOGGER.info("Creating graph: {}", graphName);
			Collection<EdgeDefinition> edgeDefinitions = new ArrayList<>();
			db.createGraph(graphName, edgeDefinitions);
		}
		return db.graph(graphName);
	}

	/**
	 * Delete a named graph.
	 *
	 * @param db        Database in which to delete the graph
	 * @param graphName Name of the graph to delete
	 */
	public void deleteGraph(ArangoDatabase db, String graphName) {
		if (db.graph(graphName).exists()) {
			LOGGER.info("Deleting graph: {}", graphName);
			db.graph(graphName).drop();
		}
	}

	/**
	 * Create or get a named vertex collection.
	 *
	 * @param graph      Graph in which to create or get the vertex collection
	 * @param vertexName Name of the vertex collection to create or get
	 * @return Named vertex collection
	 */
	public ArangoVertexCollection createOrGetVertexCollection(ArangoGraph graph, String vertexName) {
		if (!graph.db().collection(vertexName).exists()) {
			LOGGER.info("Creating vertex collection: {}", vertexName);
			graph.addVertexCollection(vertexName);
		}
		return graph.vertexCollection(vertexName);
	}

	/**
	 * Create, or get a named edge collection from and to the named vertices.
	 *
	 * @param graph          Graph in which to create, or get the edge collection
	 * @param fromVertexName Name of the vertex collection from which the edge
	 *                       originates
	 * @param toVertexName   Name of the vertex collection to which the edge
	 *                       terminates
	 * @return Named edge collection
	 */
	public ArangoEdgeCollection createOrGetEdgeCollection(ArangoGraph graph, String fromVertexName,
			String toVertexName) {
		String collectionName = getEdgeCollectionName(fromVertexName, toVertexName);
		if (!graph.db().collection(collectionName).exists()) {
			LOGGER.info("Creating edge collection: {}", collectionName);
			EdgeDefinition edgeDefinition = new EdgeDefinition().collection(collectionName).from(fromVertexName)
					.to(toVertexName);
			graph.addEdgeDefinition(edgeDefinition);
		}
		return graph.edgeCollection(collectionName);
	}

	/**
	 * Name the edge collection from and to the named vertices.
	 *
	 * @param fromVertexName Name of the vertex collection from which the edge
	 *                       originates
	 * @param toVertexName   Name of the vertex collection to which the edge
	 *                       terminates
	 * @return Edge collection name
	 */
	public static String getEdgeCollectionName(String fromVertexName, String toVertexName) {
		return fromVertexName + "-" + toVertexName;
	}
}
