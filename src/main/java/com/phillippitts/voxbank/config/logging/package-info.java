/**
 * Logging infrastructure: the servlet filter that seeds the Log4j2 ThreadContext with
 * request and scope ids.
 */
package com.phillippitts.voxbank.config.logging;
