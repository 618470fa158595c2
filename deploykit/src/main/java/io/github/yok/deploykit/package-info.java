/**
 * Root package of DeployKit.
 *
 * <p>
 * Provides a library and command-line runner that deploys data workloads against relational
 * warehouses: connections are established by a broker, a task sequence runs against them, and the
 * outcome becomes the process exit status.
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.deploykit.config}: configuration models and validation</li>
 * <li>{@code io.github.yok.deploykit.credential}: secret reference resolution</li>
 * <li>{@code io.github.yok.deploykit.db}: connection broker, descriptors and leases</li>
 * <li>{@code io.github.yok.deploykit.core}: task runner and run records</li>
 * <li>{@code io.github.yok.deploykit.service}: process entrypoint wiring and shutdown</li>
 * </ul>
 */
package io.github.yok.deploykit;
