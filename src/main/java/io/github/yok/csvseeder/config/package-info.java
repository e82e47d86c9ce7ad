/**
 * Configuration package.
 *
 * <p>
 * Spring Boot {@code @ConfigurationProperties} beans for the connection, the data path, DBUnit and
 * the seed definitions, plus the immutable {@link io.github.yok.csvseeder.config.SeedConfig} a
 * single run consumes.
 * </p>
 */
package io.github.yok.csvseeder.config;
