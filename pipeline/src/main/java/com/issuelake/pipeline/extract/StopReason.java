package com.issuelake.pipeline.extract;

/**
 * Why a record stream ended cleanly. Failures are thrown, never reported here.
 */
public enum StopReason {
    /** The API refused to page further (GitHub answers 422 past its pagination window). */
    PAGINATION_LIMIT,
    /** A page came back with no entries. */
    EMPTY_PAGE,
    /** The source had nothing left to read. */
    EXHAUSTED
}
