package dev.jobwatch.notify;

import dev.jobwatch.model.JobListing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Simulated WhatsApp delivery that writes the message to the application log.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "notifier.channel", havingValue = "console", matchIfMissing = true)
public class WhatsappConsoleNotifier implements Notifier {

    private static final String RULE = "--------------------------------------------------";

    @Override
    public String getChannel() {
        return "console";
    }

    @Override
    public Mono<Boolean> deliver(String recipient, List<JobListing> matches) {
        return Mono.fromCallable(() -> {
            log.info("\n{}", formatMessage(recipient, matches));
            return true;
        });
    }

    String formatMessage(String recipient, List<JobListing> matches) {
        StringBuilder message = new StringBuilder()
                .append("[WHATSAPP SIMULATION] Sending message to ").append(recipient).append(":\n")
                .append(RULE).append('\n')
                .append("Found ").append(matches.size()).append(" new jobs matching your criteria:\n\n");

        for (int i = 0; i < matches.size(); i++) {
            JobListing job = matches.get(i);
            message.append(i + 1).append(". ").append(job.getPostName())
                    .append(" (").append(job.getDepartment()).append(")")
                    .append(" - Closing: ").append(job.getClosingDate()).append('\n')
                    .append("   Link: ").append(job.getDetailLink()).append('\n');
        }
        return message.append(RULE).toString();
    }
}
