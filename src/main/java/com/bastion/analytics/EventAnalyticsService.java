package com.bastion.analytics;

import com.bastion.domain.EventPage;
import com.bastion.domain.EventQuery;
import com.bastion.domain.Summary;
import com.bastion.domain.TimeSeriesPoint;
import com.bastion.domain.TopRule;
import com.bastion.domain.TrendBucket;
import com.bastion.domain.TrendSeries;
import com.bastion.domain.WafAction;
import com.bastion.domain.WafEvent;
import com.bastion.storage.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary, trend and explorer views computed from the event table
 */
@Service
public class EventAnalyticsService {
    private static final Logger logger = LoggerFactory.getLogger(EventAnalyticsService.class);

    static final int SUMMARY_TOP_LIMIT = 10;
    static final int SUMMARY_COUNTRY_LIMIT = 20;

    /**
     * Upper bound on the number of points in one trend series
     */
    static final int MAX_TREND_POINTS = 10_000;

    private final EventAnalyticsRepository analyticsRepository;
    private final EventRepository eventRepository;
    private final Clock clock;

    @Autowired
    public EventAnalyticsService(EventAnalyticsRepository analyticsRepository, EventRepository eventRepository) {
        this(analyticsRepository, eventRepository, Clock.systemUTC());
    }

    EventAnalyticsService(EventAnalyticsRepository analyticsRepository, EventRepository eventRepository, Clock clock) {
        this.analyticsRepository = analyticsRepository;
        this.eventRepository = eventRepository;
        this.clock = clock;
    }

    /**
     * Overview of the events in [startTime, endTime] with an hourly series.
     *
     * Blocked percentage counts both blocked and challenged events.
     */
    public Summary summary(long startTime, long endTime) {
        checkRange(startTime, endTime);

        long total = analyticsRepository.countEvents(startTime, endTime);
        Map<WafAction, Long> byAction = analyticsRepository.countByAction(startTime, endTime);

        Map<String, Long> breakdown = new LinkedHashMap<>();
        byAction.forEach((action, count) -> breakdown.put(action.getValue(), count));

        long blocked = byAction.getOrDefault(WafAction.BLOCK, 0L) + byAction.getOrDefault(WafAction.CHALLENGE, 0L);
        double blockedPercentage = total > 0 ? blocked * 100.0 / total : 0.0;

        long now = clock.millis();
        long startOfToday = LocalDate.now(clock).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        List<TopRule> topToday = analyticsRepository.topRules(startOfToday, Math.max(now, startOfToday), 1);

        logger.debug("Summary for [{}, {}]: {} events", startTime, endTime, total);
        return Summary.builder()
            .range(startTime, endTime)
            .totalEvents(total)
            .uniqueIps(analyticsRepository.countUniqueIps(startTime, endTime))
            .blockedPercentage(blockedPercentage)
            .topRuleToday(topToday.isEmpty() ? null : topToday.get(0))
            .actionsBreakdown(breakdown)
            .topRules(analyticsRepository.topRules(startTime, endTime, SUMMARY_TOP_LIMIT))
            .topHosts(analyticsRepository.topHosts(startTime, endTime, SUMMARY_TOP_LIMIT))
            .topPaths(analyticsRepository.topPaths(startTime, endTime, SUMMARY_TOP_LIMIT))
            .geoDistribution(analyticsRepository.countByCountry(startTime, endTime, SUMMARY_COUNTRY_LIMIT))
            .timeSeries(analyticsRepository.bucketCounts(startTime, endTime, TrendBucket.HOUR.getSizeMillis()))
            .build();
    }

    /**
     * Bucketed per-action counts over [startTime, endTime]. Every bucket from
     * the one holding startTime to the one holding endTime is present, empty
     * buckets with zero counts.
     *
     * @throws IllegalArgumentException if the range is inverted or needs more
     *         than {@value #MAX_TREND_POINTS} buckets
     */
    public TrendSeries trends(long startTime, long endTime, TrendBucket bucket) {
        checkRange(startTime, endTime);

        long first = bucket.floor(startTime);
        long last = bucket.floor(endTime);
        long points = (last - first) / bucket.getSizeMillis() + 1;
        if (points > MAX_TREND_POINTS) {
            throw new IllegalArgumentException(String.format(
                "Range needs %d %s buckets, at most %d are allowed", points, bucket, MAX_TREND_POINTS));
        }

        Map<Long, TimeSeriesPoint> found = new LinkedHashMap<>();
        for (TimeSeriesPoint point : analyticsRepository.bucketCounts(startTime, endTime, bucket.getSizeMillis())) {
            found.put(point.getTimestamp(), point);
        }

        List<TimeSeriesPoint> series = new ArrayList<>((int) points);
        for (long ts = first; ts <= last; ts += bucket.getSizeMillis()) {
            TimeSeriesPoint point = found.get(ts);
            series.add(point != null ? point : new TimeSeriesPoint(ts));
        }
        return new TrendSeries(bucket, startTime, endTime, series);
    }

    public EventPage events(EventQuery query) {
        List<WafEvent> events = eventRepository.search(query);
        long total = eventRepository.countMatching(query);
        return new EventPage(events, total, query.getLimit());
    }

    private static void checkRange(long startTime, long endTime) {
        if (startTime > endTime) {
            throw new IllegalArgumentException("start_time must not be after end_time");
        }
    }
}
