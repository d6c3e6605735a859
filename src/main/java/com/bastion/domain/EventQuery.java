package com.bastion.domain;

/**
 * Filter criteria for browsing stored events, newest first, up to a limit.
 *
 * Every criterion is optional; absent criteria do not restrict the result.
 * The free-text search matches path, user agent and host as substrings.
 */
public class EventQuery {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 1000;

    private final Long startTime;
    private final Long endTime;
    private final WafAction action;
    private final String ruleId;
    private final String host;
    private final String srcCountry;
    private final String colo;
    private final String method;
    private final Integer status;
    private final String search;
    private final int limit;

    private EventQuery(Builder builder) {
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.action = builder.action;
        this.ruleId = blankToNull(builder.ruleId);
        this.host = blankToNull(builder.host);
        this.srcCountry = blankToNull(builder.srcCountry);
        this.colo = blankToNull(builder.colo);
        this.method = blankToNull(builder.method);
        this.status = builder.status;
        this.search = blankToNull(builder.search);
        this.limit = builder.limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static class Builder {
        private Long startTime;
        private Long endTime;
        private WafAction action;
        private String ruleId;
        private String host;
        private String srcCountry;
        private String colo;
        private String method;
        private Integer status;
        private String search;
        private int limit = DEFAULT_LIMIT;

        public Builder startTime(Long startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Long endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder action(WafAction action) {
            this.action = action;
            return this;
        }

        /**
         * Set the action filter from its stored name
         *
         * @throws IllegalArgumentException if the name is not a canonical action
         */
        public Builder action(String action) {
            if (action == null || action.isBlank()) {
                this.action = null;
                return this;
            }
            WafAction parsed = WafAction.fromValue(action.trim());
            if (!parsed.getValue().equalsIgnoreCase(action.trim())) {
                throw new IllegalArgumentException("Unknown action: " + action);
            }
            this.action = parsed;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder srcCountry(String srcCountry) {
            this.srcCountry = srcCountry;
            return this;
        }

        public Builder colo(String colo) {
            this.colo = colo;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder status(Integer status) {
            this.status = status;
            return this;
        }

        public Builder search(String search) {
            this.search = search;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        /**
         * @throws IllegalArgumentException for a limit outside 1..{@value #MAX_LIMIT}
         *         or a start after the end
         */
        public EventQuery build() {
            if (limit < 1 || limit > MAX_LIMIT) {
                throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
            }
            if (startTime != null && endTime != null && startTime > endTime) {
                throw new IllegalArgumentException("start_time must not be after end_time");
            }
            return new EventQuery(this);
        }
    }

    public Long getStartTime() {
        return startTime;
    }

    public Long getEndTime() {
        return endTime;
    }

    public WafAction getAction() {
        return action;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getHost() {
        return host;
    }

    public String getSrcCountry() {
        return srcCountry;
    }

    public String getColo() {
        return colo;
    }

    public String getMethod() {
        return method;
    }

    public Integer getStatus() {
        return status;
    }

    public String getSearch() {
        return search;
    }

    public int getLimit() {
        return limit;
    }
}
