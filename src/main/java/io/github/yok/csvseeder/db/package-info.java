/**
 * Database access package.
 *
 * <p>
 * JDBC metadata lookup of the destination table and DBUnit based truncation and chunk inserts.
 * </p>
 */
package io.github.yok.csvseeder.db;
