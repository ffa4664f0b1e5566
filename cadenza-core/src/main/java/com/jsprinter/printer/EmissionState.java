package com.jsprinter.printer;

/**
 * State of a piece of output that may be written at most once per print session.
 */
enum EmissionState {
    NOT_EMITTED,
    EMITTED
}
