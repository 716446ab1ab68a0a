/**
 * Request pipeline: tokenize, resolve from the word bank, generate misses, concatenate,
 * filter. {@link com.phillippitts.voxbank.service.orchestration.PipelineTracker} enforces
 * forward-only stage transitions and reports them to the caller.
 */
package com.phillippitts.voxbank.service.orchestration;
