package com.bastion.analytics;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Identifies rollup buckets touched by a set of events.
 *
 * Used to refresh exactly those buckets after the underlying events changed.
 */
public final class RollupKeys {

    private static final RollupKeys EMPTY = new RollupKeys(Set.of(), Set.of(), Set.of(), Set.of());

    private final Set<DailyKey> dailyKeys;
    private final Set<String> ruleIds;
    private final Set<String> srcIps;
    private final Set<PathKey> pathKeys;

    public RollupKeys(Set<DailyKey> dailyKeys, Set<String> ruleIds, Set<String> srcIps, Set<PathKey> pathKeys) {
        this.dailyKeys = Collections.unmodifiableSet(new LinkedHashSet<>(dailyKeys));
        this.ruleIds = Collections.unmodifiableSet(new LinkedHashSet<>(ruleIds));
        this.srcIps = Collections.unmodifiableSet(new LinkedHashSet<>(srcIps));
        this.pathKeys = Collections.unmodifiableSet(new LinkedHashSet<>(pathKeys));
    }

    public static RollupKeys empty() {
        return EMPTY;
    }

    public RollupKeys union(RollupKeys other) {
        return new RollupKeys(
            merge(dailyKeys, other.dailyKeys),
            merge(ruleIds, other.ruleIds),
            merge(srcIps, other.srcIps),
            merge(pathKeys, other.pathKeys));
    }

    private static <T> Set<T> merge(Set<T> left, Set<T> right) {
        Set<T> merged = new LinkedHashSet<>(left);
        merged.addAll(right);
        return merged;
    }

    public Set<DailyKey> getDailyKeys() {
        return dailyKeys;
    }

    public Set<String> getRuleIds() {
        return ruleIds;
    }

    public Set<String> getSrcIps() {
        return srcIps;
    }

    public Set<PathKey> getPathKeys() {
        return pathKeys;
    }

    public boolean isEmpty() {
        return dailyKeys.isEmpty() && ruleIds.isEmpty() && srcIps.isEmpty() && pathKeys.isEmpty();
    }

    public int size() {
        return dailyKeys.size() + ruleIds.size() + srcIps.size() + pathKeys.size();
    }

    @Override
    public String toString() {
        return "RollupKeys{days=" + dailyKeys.size() + ", rules=" + ruleIds.size()
            + ", ips=" + srcIps.size() + ", paths=" + pathKeys.size() + "}";
    }

    /**
     * A (UTC date, action) bucket of the daily action rollup
     */
    public static final class DailyKey {
        private final String date;
        private final String action;

        public DailyKey(String date, String action) {
            this.date = Objects.requireNonNull(date, "date");
            this.action = Objects.requireNonNull(action, "action");
        }

        public String getDate() {
            return date;
        }

        public String getAction() {
            return action;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            DailyKey that = (DailyKey) o;
            return date.equals(that.date) && action.equals(that.action);
        }

        @Override
        public int hashCode() {
            return Objects.hash(date, action);
        }

        @Override
        public String toString() {
            return date + "/" + action;
        }
    }

    /**
     * A (path, method, status) bucket of the path rollup. Method and status may be null.
     */
    public static final class PathKey {
        private final String path;
        private final String method;
        private final Integer status;

        public PathKey(String path, String method, Integer status) {
            this.path = Objects.requireNonNull(path, "path");
            this.method = method;
            this.status = status;
        }

        public String getPath() {
            return path;
        }

        public String getMethod() {
            return method;
        }

        public Integer getStatus() {
            return status;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            PathKey that = (PathKey) o;
            return path.equals(that.path) && Objects.equals(method, that.method) && Objects.equals(status, that.status);
        }

        @Override
        public int hashCode() {
            return Objects.hash(path, method, status);
        }

        @Override
        public String toString() {
            return method + " " + path + " " + status;
        }
    }
}
