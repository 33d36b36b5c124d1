/**
 * Databases known to the server and the registry that enumerates them.
 *
 * @see io.docstore.database.DatabaseRegistry
 */
package io.docstore.database;
