package dev.jobwatch.web;

import dev.jobwatch.model.KeywordSet;
import dev.jobwatch.model.ScheduleSpec;
import dev.jobwatch.model.ScheduleStatus;
import dev.jobwatch.scheduler.JobScheduler;
import dev.jobwatch.service.SearchService;
import dev.jobwatch.service.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class JobController {

    private final SearchService searchService;
    private final JobScheduler jobScheduler;

    @PostMapping("/search")
    public Mono<SearchResponse> search(
            @RequestBody(required = false) SearchRequest request,
            @RequestParam(name = "page", required = false) String page,
            @RequestParam(name = "limit", required = false) String limit) {

        KeywordSet keywords = KeywordSet.of(request == null ? null : request.keywords());
        if (keywords.isEmpty()) {
            return Mono.error(new ValidationException("Keywords are required"));
        }
        return searchService.search(keywords, page, limit).map(SearchResponse::of);
    }

    @PostMapping("/start-job")
    public MessageResponse startJob(@RequestBody(required = false) StartJobRequest request) {
        if (request == null || isBlank(request.interval()) || isBlank(request.phoneNo())) {
            throw new ValidationException("Missing required fields");
        }
        KeywordSet keywords = KeywordSet.of(request.keywords());
        if (keywords.isEmpty()) {
            throw new ValidationException("Missing required fields");
        }

        jobScheduler.start(new ScheduleSpec(keywords, request.phoneNo().trim(), request.interval()));
        return new MessageResponse(true, "Scheduler started");
    }

    @PostMapping("/stop-job")
    public MessageResponse stopJob() {
        if (jobScheduler.stop()) {
            return new MessageResponse(true, "Scheduler stopped");
        }
        return new MessageResponse(false, "No active scheduler");
    }

    @GetMapping("/job-status")
    public ScheduleStatus jobStatus() {
        return jobScheduler.status();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
