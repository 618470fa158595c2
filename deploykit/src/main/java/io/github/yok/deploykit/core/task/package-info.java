/**
 * Built-in task implementations.
 */
package io.github.yok.deploykit.core.task;
