/**
 * Business logic of the word bank pipeline.
 *
 * <p>Sub-packages by stage:
 * <ul>
 *   <li>{@code service.tokenize} - text to word and pause tokens</li>
 *   <li>{@code service.cache} - persistent per-scope word bank, archives</li>
 *   <li>{@code service.generation} - bounded concurrent synthesis of missing words</li>
 *   <li>{@code service.audio} - PCM format, concatenation, WAV output</li>
 *   <li>{@code service.filter} - optional public-address effects</li>
 *   <li>{@code service.orchestration} - request pipeline and progress</li>
 * </ul>
 */
package com.phillippitts.voxbank.service;
