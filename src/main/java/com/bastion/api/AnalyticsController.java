package com.bastion.api;

import com.bastion.analytics.EventAnalyticsService;
import com.bastion.analytics.RollupQueryRepository;
import com.bastion.analytics.RollupUpdater;
import com.bastion.domain.AttackPath;
import com.bastion.domain.DailyActionCount;
import com.bastion.domain.Summary;
import com.bastion.domain.TopIp;
import com.bastion.domain.TopRule;
import com.bastion.domain.TrendBucket;
import com.bastion.domain.TrendSeries;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Rollup views, range-scoped summary and trends, and rollup maintenance.
 * Range parameters (start_time, end_time) are epoch milliseconds.
 */
@RestController
@RequestMapping("/api")
public class AnalyticsController {

    static final int MAX_LIMIT = 500;
    private static final int DEFAULT_TREND_DAYS = 7;
    private static final long DEFAULT_SUMMARY_MILLIS = Duration.ofHours(24).toMillis();
    private static final long DEFAULT_TREND_MILLIS = Duration.ofDays(DEFAULT_TREND_DAYS).toMillis();

    private final RollupQueryRepository queryRepository;
    private final RollupUpdater rollupUpdater;
    private final EventAnalyticsService analyticsService;

    public AnalyticsController(RollupQueryRepository queryRepository, RollupUpdater rollupUpdater,
                               EventAnalyticsService analyticsService) {
        this.queryRepository = queryRepository;
        this.rollupUpdater = rollupUpdater;
        this.analyticsService = analyticsService;
    }

    /**
     * Overview of a time range, by default the last 24 hours
     */
    @GetMapping("/summary")
    public Summary summary(
            @RequestParam(name = "start_time", required = false) Long startTime,
            @RequestParam(name = "end_time", required = false) Long endTime) {
        long end = endTime != null ? endTime : System.currentTimeMillis();
        long start = startTime != null ? startTime : end - DEFAULT_SUMMARY_MILLIS;
        return analyticsService.summary(start, end);
    }

    /**
     * Minute, hour or day buckets over a time range, by default hourly over the last 7 days
     */
    @GetMapping("/trends")
    public TrendSeries trends(
            @RequestParam(name = "start_time", required = false) Long startTime,
            @RequestParam(name = "end_time", required = false) Long endTime,
            @RequestParam(defaultValue = "hour") String bucket) {
        long end = endTime != null ? endTime : System.currentTimeMillis();
        long start = startTime != null ? startTime : end - DEFAULT_TREND_MILLIS;
        return analyticsService.trends(start, end, TrendBucket.fromValue(bucket));
    }

    @GetMapping("/top/rules")
    public List<TopRule> topRules(@RequestParam(defaultValue = "20") int limit) {
        return queryRepository.topRules(checkLimit(limit));
    }

    @GetMapping("/top/ips")
    public List<TopIp> topIps(@RequestParam(defaultValue = "20") int limit) {
        return queryRepository.topIps(checkLimit(limit));
    }

    @GetMapping("/top/paths")
    public List<AttackPath> topPaths(@RequestParam(defaultValue = "20") int limit) {
        return queryRepository.topPaths(checkLimit(limit));
    }

    /**
     * Daily action counts between two UTC dates (yyyy-MM-dd, inclusive).
     * Defaults to the last seven days.
     */
    @GetMapping("/trends/daily")
    public List<DailyActionCount> dailyTrend(
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end) {
        LocalDate endDate = end != null ? LocalDate.parse(end) : LocalDate.now(ZoneOffset.UTC);
        LocalDate startDate = start != null ? LocalDate.parse(start) : endDate.minusDays(DEFAULT_TREND_DAYS - 1);
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("start must not be after end");
        }
        return queryRepository.dailyActions(startDate.toString(), endDate.toString());
    }

    @PostMapping("/rollups/rebuild")
    public Map<String, Object> rebuild() {
        rollupUpdater.rebuildAll();
        return Map.of("rebuilt", true);
    }

    private static int checkLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return limit;
    }
}
