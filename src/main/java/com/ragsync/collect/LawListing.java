package com.ragsync.collect;

public record LawListing(String lawId, String title, String lawNo) {
}
