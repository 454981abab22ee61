package com.ragsync.ingest;

public enum DuplicatePolicy {
    LAST_WINS,
    FIRST_WINS
}
