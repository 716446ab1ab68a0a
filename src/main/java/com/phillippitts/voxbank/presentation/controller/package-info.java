/**
 * REST controllers under {@code /api/vox/{scopeId}}.
 */
package com.phillippitts.voxbank.presentation.controller;
