package dev.jobwatch.web;

import java.util.List;

/**
 * Body of {@code POST /api/start-job}. {@code phoneNo} is the notification recipient.
 */
public record StartJobRequest(List<String> keywords, String interval, String phoneNo) {
}
