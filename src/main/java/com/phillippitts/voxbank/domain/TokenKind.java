package com.phillippitts.voxbank.domain;

/**
 * Kind of a tokenized element: a spoken word or an explicit pause.
 */
public enum TokenKind {
    WORD,
    PAUSE
}
