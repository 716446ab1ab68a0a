/**
 * Splits announcement text into normalized word tokens and punctuation pauses, and
 * validates words against the word bank alphabet.
 */
package com.phillippitts.voxbank.service.tokenize;
