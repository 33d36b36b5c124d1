/**
 * Collection name resolution.
 */
package io.docstore.resolver;
