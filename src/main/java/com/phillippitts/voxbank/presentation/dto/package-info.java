/**
 * Request and response bodies of the REST surface. Conversion to domain types happens
 * here so controllers stay thin.
 */
package com.phillippitts.voxbank.presentation.dto;
