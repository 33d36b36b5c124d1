/**
 * Micrometer metrics for the database init/upgrade sweep.
 */
package io.docstore.micrometer;
