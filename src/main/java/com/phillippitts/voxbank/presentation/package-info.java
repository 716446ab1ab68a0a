/**
 * HTTP layer: controllers, request/response bodies and exception mapping.
 */
package com.phillippitts.voxbank.presentation;
