/**
 * Delimited file reading, backed by Apache Commons CSV.
 */
package io.github.yok.csvseeder.parser;
