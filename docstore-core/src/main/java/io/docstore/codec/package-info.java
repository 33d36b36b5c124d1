/**
 * Custom type handling for database-specific value types.
 *
 * @see io.docstore.codec.CustomTypeHandler
 */
package io.docstore.codec;
