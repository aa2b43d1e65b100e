package app.lexrecall.core.review.domain;

import app.lexrecall.core.card.domain.Subject;

public record SubjectStatistics(
        Subject subject,
        long cards,
        long due,
        long newCards,
        long mastered,
        double accuracy7Day
) {
}
