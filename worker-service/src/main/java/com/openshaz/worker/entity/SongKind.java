package com.openshaz.worker.entity;

/**
 * Which feature table a song lives in.
 */
public enum SongKind {
    OPENSOURCE, // reference set, ranked against by similarity jobs
    QUERY // songs users searched with, kept so a repeat query skips extraction
}
