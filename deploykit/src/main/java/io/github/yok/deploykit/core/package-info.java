/**
 * Sequential task execution and run records.
 */
package io.github.yok.deploykit.core;
