/**
 * Wiring of one deployment process: configuration to broker and runner, exit codes and shutdown
 * handling.
 */
package io.github.yok.deploykit.service;
