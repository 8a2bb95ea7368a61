package dev.jobwatch.notify;

import dev.jobwatch.model.JobListing;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Sends the matches as an HTML digest. The recipient is used as the e-mail address.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notifier.channel", havingValue = "email")
public class EmailNotifier implements Notifier {

    static final String TEMPLATE = "email/job-digest";

    private final JavaMailSender mailSender;
    private final TemplateEngine templateEngine;
    private final Clock clock;

    @Value("${spring.mail.username}")
    private String fromEmail;

    @Override
    public String getChannel() {
        return "email";
    }

    @Override
    @SuppressWarnings("null")
    public Mono<Boolean> deliver(String recipient, List<JobListing> matches) {
        return Mono.fromCallable(() -> {
            try {
                MimeMessage message = mailSender.createMimeMessage();
                MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");

                String today = LocalDate.now(clock).format(DateTimeFormatter.ofPattern("yyyy-MM-dd"));
                String subject = String.format("Job Watch: %d matching listings - %s", matches.size(), today);

                helper.setFrom(fromEmail);
                helper.setTo(recipient);
                helper.setSubject(subject);
                helper.setText(generateEmailContent(matches), true);

                mailSender.send(message);
                log.info("Email sent successfully to {}", recipient);
                return true;

            } catch (MessagingException | MailException e) {
                log.error("Failed to send email: {}", e.getMessage(), e);
                return false;
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private String generateEmailContent(List<JobListing> matches) {
        Context context = new Context(Locale.getDefault());
        context.setVariable("jobs", matches);
        context.setVariable("jobCount", matches.size());
        context.setVariable("date", LocalDate.now(clock).format(DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH)));
        return templateEngine.process(TEMPLATE, context);
    }
}
