/**
 * CsvSeeder application package.
 *
 * <p>
 * Holds the Spring Boot entry point, which binds the seed definitions from
 * {@code application.yml} and runs them through {@link io.github.yok.csvseeder.core.SeedExecutor}.
 * </p>
 */
package io.github.yok.csvseeder;
