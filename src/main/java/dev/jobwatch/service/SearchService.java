package dev.jobwatch.service;

import dev.jobwatch.config.SearchConfig;
import dev.jobwatch.metrics.PipelineMetrics;
import dev.jobwatch.model.JobListing;
import dev.jobwatch.model.KeywordSet;
import dev.jobwatch.model.SearchPage;
import dev.jobwatch.util.LenientNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * On-demand search: one pipeline run, then a page of the matches.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchService {

    private final PipelineService pipelineService;
    private final SearchConfig searchConfig;
    private final PipelineMetrics metrics;

    /**
     * @param page  requested page, parsed leniently; falls back to the configured default
     * @param limit page size, parsed leniently; falls back to the configured default
     */
    public Mono<SearchPage> search(KeywordSet keywords, String page, String limit) {
        int pageNumber = LenientNumbers.positiveIntOrDefault(page, searchConfig.getDefaultPage());
        int pageSize = LenientNumbers.positiveIntOrDefault(limit, searchConfig.getDefaultLimit());

        log.info("Searching for keywords: {}", keywords);
        metrics.recordRun(PipelineMetrics.TRIGGER_SEARCH);

        return pipelineService.findMatches(keywords)
                .map(matches -> paginate(matches, pageNumber, pageSize));
    }

    /**
     * Slice {@code [(page-1)*limit, page*limit)} clipped to the list; empty past the end.
     */
    public static SearchPage paginate(List<JobListing> matches, int page, int limit) {
        int count = matches.size();
        int totalPages = (int) Math.ceil((double) count / limit);

        long startIndex = (long) (page - 1) * limit;
        long endIndex = Math.min(startIndex + limit, count);
        List<JobListing> data = startIndex >= count
                ? List.of()
                : List.copyOf(matches.subList((int) startIndex, (int) endIndex));

        return new SearchPage(count, page, totalPages, data);
    }
}
