/**
 * Flyway configuration for the access store schema.
 *
 * <ul>
 *   <li>{@link com.thorbis.database.migration.AccessStoreProperties} binds {@code
 *       thorbis.access-store.*}
 *   <li>{@link com.thorbis.database.migration.AccessSchemaMigrationConfig} creates the Flyway bean
 *       that migrates it on startup
 * </ul>
 */
package com.thorbis.database.migration;
