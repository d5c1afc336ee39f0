package io.eventrelay.events.dispatcher;

/**
 * Outcome of one delivery, handed from the response path to the dispatch loop.
 *
 * @param offset sequence of the event the response was for
 */
record AckNack(boolean isNack, long offset) {
}
