/**
 * Immutable domain model of the announcement pipeline: tokens, cache keys, clips,
 * per-word generation outcomes, filter selection and request/result types.
 */
package com.phillippitts.voxbank.domain;
