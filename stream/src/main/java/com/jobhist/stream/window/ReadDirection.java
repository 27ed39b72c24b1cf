package com.jobhist.stream.window;

/**
 * Order in which records are produced.
 */
public enum ReadDirection {
    /** Oldest first: files oldest to newest, each file top to bottom. */
    FORWARD,
    /** Newest first: files newest to oldest, each file bottom to top. */
    REVERSE
}
