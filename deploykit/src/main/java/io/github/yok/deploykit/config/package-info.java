/**
 * Configuration model package for DeployKit.
 *
 * <p>
 * Holds the classes bound from {@code deploykit.broker} and {@code deploykit.runner} in
 * {@code application.yml}, and the validator that turns connection entries into descriptors.
 * </p>
 */
package io.github.yok.deploykit.config;
