package jump.email.watch.service;

import jump.email.watch.model.CanonicalMessage;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Keeps automated and system mail away from triage. Messages missing a sender, subject or
 * body are treated the same way.
 */
@Component
public class AutomatedSenderFilter {
    private static final List<Pattern> SENDER_PATTERNS = List.of(
        Pattern.compile("noreply", Pattern.CASE_INSENSITIVE),
        Pattern.compile("no-reply", Pattern.CASE_INSENSITIVE),
        Pattern.compile("donotreply", Pattern.CASE_INSENSITIVE),
        Pattern.compile("notification", Pattern.CASE_INSENSITIVE),
        Pattern.compile("automated", Pattern.CASE_INSENSITIVE),
        Pattern.compile("system", Pattern.CASE_INSENSITIVE),
        Pattern.compile("support@.*\\.com", Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> SUBJECT_PATTERNS = List.of(
        Pattern.compile("unsubscribe", Pattern.CASE_INSENSITIVE),
        Pattern.compile("newsletter", Pattern.CASE_INSENSITIVE),
        Pattern.compile("subscription", Pattern.CASE_INSENSITIVE),
        Pattern.compile("automated", Pattern.CASE_INSENSITIVE),
        Pattern.compile("system notification", Pattern.CASE_INSENSITIVE)
    );

    public boolean shouldSkip(CanonicalMessage message) {
        if (isBlank(message.getFrom()) || isBlank(message.getSubject()) || isBlank(message.getBody())) {
            return true;
        }
        return isAutomated(message.getFrom(), message.getSubject());
    }

    public boolean isAutomated(String from, String subject) {
        return matchesAny(SENDER_PATTERNS, from) || matchesAny(SUBJECT_PATTERNS, subject);
    }

    private static boolean matchesAny(List<Pattern> patterns, String value) {
        if (value == null) {
            return false;
        }
        return patterns.stream().anyMatch(pattern -> pattern.matcher(value).find());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
