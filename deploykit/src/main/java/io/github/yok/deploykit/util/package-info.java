/**
 * Shared helpers: JDBC driver loading, log masking and fatal error reporting.
 */
package io.github.yok.deploykit.util;
