package dev.jobwatch.model;

import java.util.List;

/**
 * One page of filtered matches.
 */
public record SearchPage(int count, int page, int totalPages, List<JobListing> data) {
}
