package app.lexrecall.core.review.controller;

import app.lexrecall.core.card.domain.Subject;
import app.lexrecall.core.review.domain.ForecastDay;
import app.lexrecall.core.review.domain.StudyStatistics;
import app.lexrecall.core.review.domain.TopicStats;
import app.lexrecall.core.review.service.StudyStatisticsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/stats")
public class StatsController {

    private final StudyStatisticsService statisticsService;

    public StatsController(StudyStatisticsService statisticsService) {
        this.statisticsService = statisticsService;
    }

    @GetMapping
    public StudyStatistics getStatistics() {
        return statisticsService.getStatistics();
    }

    @GetMapping("/topics/{subject}")
    public List<TopicStats> getTopicStats(@PathVariable String subject) {
        return statisticsService.getTopicStats(Subject.fromCode(subject));
    }

    // GET /stats/weak-topics?subject=contracts&threshold=0.7
    @GetMapping("/weak-topics")
    public List<TopicStats> getWeakTopics(@RequestParam String subject,
                                          @RequestParam(required = false) Double threshold) {
        double t = threshold == null ? StudyStatisticsService.DEFAULT_WEAK_THRESHOLD : threshold;
        return statisticsService.identifyWeakTopics(Subject.fromCode(subject), t);
    }

    @GetMapping("/forecast")
    public List<ForecastDay> getForecast(@RequestParam(required = false) Integer days) {
        return statisticsService.forecast(days == null ? StudyStatisticsService.DEFAULT_FORECAST_DAYS : days);
    }
}
