/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.voxbank.config.ThreadPoolConfig} - generation executor with
 *       MDC propagation</li>
 *   <li>{@link com.phillippitts.voxbank.config.WordBankConfig} - file-system word bank</li>
 *   <li>{@link com.phillippitts.voxbank.config.GenerationConfig} - HTTP synthesis provider,
 *       concurrency guard and concurrent generator</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code vox.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.orchestration} - pipeline wiring</li>
 *   <li>{@code config.logging} - MDC filter</li>
 * </ul>
 */
package com.phillippitts.voxbank.config;
