/**
 * Spring Boot auto-configuration that validates the {@code database.upgrade} options at startup,
 * runs the init/upgrade sweep when the context starts and shuts the application down after an
 * upgrade run.
 *
 * <p>Applications provide the {@link io.docstore.spi.WriteAheadLog} and the
 * {@link io.docstore.sandbox.MaintenanceProcedure}; everything else has a default.
 */
package io.docstore.spring.boot;
