/**
 * Core seeding workflow package.
 *
 * <p>
 * Resolves the CSV header into column specs, transforms each row into a record, buffers records
 * into chunks and writes them through a {@link io.github.yok.csvseeder.db.TableWriter}.
 * {@link io.github.yok.csvseeder.core.SeedRunner} sequences one run;
 * {@link io.github.yok.csvseeder.core.SeedExecutor} runs every configured seed.
 * </p>
 *
 * <p>
 * File access, table lookup and writes are delegated to the {@code parser} and {@code db}
 * packages through interfaces.
 * </p>
 */
package io.github.yok.csvseeder.core;
