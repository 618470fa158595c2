/**
 * Resolution of {@code env:} and {@code file:} credential references.
 */
package io.github.yok.deploykit.credential;
