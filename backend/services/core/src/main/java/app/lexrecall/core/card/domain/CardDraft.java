package app.lexrecall.core.card.domain;

import java.util.Set;

/**
 * Raw card payload produced by import and authoring tools. Nothing here is trusted until
 * {@code CardDraftValidator} has mapped it onto the closed enumerations.
 */
public record CardDraft(
        String subject,
        String topic,
        String conceptName,
        String question,
        String answer,
        Integer difficulty,
        Set<String> tags
) {
}
