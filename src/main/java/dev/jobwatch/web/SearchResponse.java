package dev.jobwatch.web;

import dev.jobwatch.model.JobListing;
import dev.jobwatch.model.SearchPage;

import java.util.List;

public record SearchResponse(boolean success, int count, int page, int totalPages, List<JobListing> data) {

    public static SearchResponse of(SearchPage page) {
        return new SearchResponse(true, page.count(), page.page(), page.totalPages(), page.data());
    }
}
