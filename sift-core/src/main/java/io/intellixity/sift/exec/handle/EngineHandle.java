package io.intellixity.sift.exec.handle;

/**
 * Resolved runtime handle for a backend.\n
 *
 * Example:\n
 * - JDBC: client() is javax.sql.DataSource, namespace() is schema\n
 * - Mongo: client() is MongoClient, namespace() is database\n
 * - in-memory: client() is the row store, namespace() is its name\n
 */
public interface EngineHandle<TClient> {
  /** Unique identifier for this handle (useful for logging/caching). */
  String id();

  /** Native client/handle used by an engine (DataSource, MongoClient, etc.). */
  TClient client();

  /** Namespace (schema/database) for this handle; may be null. */
  String namespace();
}
