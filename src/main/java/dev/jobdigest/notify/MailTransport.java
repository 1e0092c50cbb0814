package dev.jobdigest.notify;

import dev.jobdigest.config.NotifierProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Locale;

/**
 * Sends each notification as an HTML email rendered from the {@code email/notification} template.
 * Email cannot be edited after sending, so progress messages are not supported.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notifier.transport", havingValue = "mail")
public class MailTransport implements ChatTransport {

    private final JavaMailSender mailSender;
    private final TemplateEngine templateEngine;
    private final NotifierProperties properties;

    @Override
    public String getName() {
        return "mail";
    }

    @Override
    public Mono<String> send(String text) {
        return Mono.<String>fromCallable(() -> {
                    MimeMessage message = mailSender.createMimeMessage();
                    MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
                    helper.setFrom(properties.getMail().getFrom());
                    helper.setTo(properties.getMail().getTo());
                    helper.setSubject(properties.getMail().getSubjectPrefix() + ": " + subjectOf(text));
                    helper.setText(render(text), true);

                    mailSender.send(message);
                    log.info("Notification mailed to {}", properties.getMail().getTo());
                    return null;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(MessagingException.class,
                        e -> new IllegalStateException("Failed to build notification email", e));
    }

    @Override
    public Mono<Void> edit(String handle, String text) {
        return Mono.error(new UnsupportedOperationException("Mail messages cannot be edited"));
    }

    @Override
    public boolean supportsEdit() {
        return false;
    }

    String render(String text) {
        Context context = new Context(Locale.getDefault());
        context.setVariable("subject", subjectOf(text));
        context.setVariable("lines", text.split("\n"));
        return templateEngine.process("email/notification", context);
    }

    /**
     * First non-blank line with markdown emphasis removed.
     */
    static String subjectOf(String text) {
        for (String line : text.split("\n")) {
            String cleaned = line.replace("*", "").replace("_", "").trim();
            if (!cleaned.isEmpty()) {
                return cleaned.length() > 120 ? cleaned.substring(0, 120) : cleaned;
            }
        }
        return "Notification";
    }
}
