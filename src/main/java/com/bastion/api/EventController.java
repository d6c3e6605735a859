package com.bastion.api;

import com.bastion.analytics.EventAnalyticsService;
import com.bastion.domain.EventPage;
import com.bastion.domain.EventQuery;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Event explorer: filtered browsing of the newest stored events
 */
@RestController
@RequestMapping("/api/events")
public class EventController {

    private final EventAnalyticsService analyticsService;

    public EventController(EventAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping
    public EventPage events(
            @RequestParam(name = "start_time", required = false) Long startTime,
            @RequestParam(name = "end_time", required = false) Long endTime,
            @RequestParam(required = false) String action,
            @RequestParam(name = "rule_id", required = false) String ruleId,
            @RequestParam(required = false) String host,
            @RequestParam(name = "src_country", required = false) String srcCountry,
            @RequestParam(required = false) String colo,
            @RequestParam(required = false) String method,
            @RequestParam(required = false) Integer status,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "" + EventQuery.DEFAULT_LIMIT) int limit) {
        EventQuery query = EventQuery.builder()
            .startTime(startTime)
            .endTime(endTime)
            .action(action)
            .ruleId(ruleId)
            .host(host)
            .srcCountry(srcCountry)
            .colo(colo)
            .method(method)
            .status(status)
            .search(search)
            .limit(limit)
            .build();
        return analyticsService.events(query);
    }
}
