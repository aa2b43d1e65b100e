package app.lexrecall.core.review.domain;

import java.time.LocalDate;

public record ForecastDay(LocalDate date, long dueCount) {
}
