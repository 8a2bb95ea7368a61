package dev.jobwatch.notify;

import dev.jobwatch.model.JobListing;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Delivery sink for matched listings. One call per pipeline run that found matches.
 */
public interface Notifier {

    /**
     * Name of the delivery channel (e.g. "console", "email").
     */
    String getChannel();

    /**
     * Deliver the full match list of one run.
     *
     * @return Mono<Boolean> with the sink's own view of success; callers only log it
     */
    Mono<Boolean> deliver(String recipient, List<JobListing> matches);
}
