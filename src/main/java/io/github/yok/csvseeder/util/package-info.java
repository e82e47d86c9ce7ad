/**
 * Utility package for CsvSeeder.
 *
 * <p>
 * Provides the message sink for user-facing seeding messages and the fail-fast error handler used
 * by the command-line entry point.
 * </p>
 */
package io.github.yok.csvseeder.util;
