package dev.jobwatch.web;

import java.util.List;

public record SearchRequest(List<String> keywords) {
}
