package dev.taskgate.webhook;

import dev.taskgate.config.WebhookProperties;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Shared trigger signals: the mention token ("@agent &lt;instruction&gt;") and the label allow-list.
 * Provider-specific default triggers stay in the handlers.
 */
@Component
public class TriggerPolicy {

    private final String mentionToken;
    private final Pattern mentionPattern;
    private final Set<String> triggerLabels;

    public TriggerPolicy(WebhookProperties properties) {
        this.mentionToken = properties.mentionToken();
        // First match only: the instruction runs to the end of the line
        this.mentionPattern = Pattern.compile(
                Pattern.quote(properties.mentionToken()) + "\\s+(.+?)(?:\\n|$)", Pattern.CASE_INSENSITIVE);
        this.triggerLabels = properties.triggerLabels().stream()
                .map(l -> l.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public String mentionToken() {
        return mentionToken;
    }

    /**
     * Returns the instruction following the first mention found, scanning texts in order.
     */
    public Optional<String> extractInstruction(String... texts) {
        for (String text : texts) {
            if (text == null || text.isEmpty()) continue;
            Matcher m = mentionPattern.matcher(text);
            if (m.find()) {
                String instruction = m.group(1).strip();
                if (!instruction.isEmpty()) return Optional.of(instruction);
            }
        }
        return Optional.empty();
    }

    public boolean hasMention(String... texts) {
        return extractInstruction(texts).isPresent();
    }

    /**
     * @param labelsCsv comma-separated labels as stored in event metadata
     */
    public boolean hasTriggerLabel(String labelsCsv) {
        if (labelsCsv == null || labelsCsv.isBlank()) return false;
        return Arrays.stream(labelsCsv.split(","))
                .map(l -> l.trim().toLowerCase(Locale.ROOT))
                .anyMatch(triggerLabels::contains);
    }
}
