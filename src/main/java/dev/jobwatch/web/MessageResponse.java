package dev.jobwatch.web;

public record MessageResponse(boolean success, String message) {
}
