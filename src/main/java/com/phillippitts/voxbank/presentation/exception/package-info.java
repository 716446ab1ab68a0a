/**
 * Maps domain exceptions to HTTP responses.
 */
package com.phillippitts.voxbank.presentation.exception;
