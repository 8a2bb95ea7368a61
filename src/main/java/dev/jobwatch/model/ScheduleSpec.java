package dev.jobwatch.model;

/**
 * What a recurring watch looks for, who hears about it and how often it runs.
 *
 * @param keywords  keywords matched against post name and department
 * @param recipient notification recipient, e.g. a phone number
 * @param interval  raw interval text such as {@code "2 hours"}
 */
public record ScheduleSpec(KeywordSet keywords, String recipient, String interval) {
}
