package app.lexrecall.core.card.domain;

public record CardFilter(
        Subject subject,
        Topic topic,
        boolean includeArchived
) {
    public static final CardFilter ACTIVE = new CardFilter(null, null, false);

    public static CardFilter subject(Subject subject) {
        return new CardFilter(subject, null, false);
    }

    public boolean matches(Card card) {
        if (!includeArchived && card.archived()) return false;
        if (subject != null && card.subject() != subject) return false;
        return topic == null || card.topic() == topic;
    }
}
