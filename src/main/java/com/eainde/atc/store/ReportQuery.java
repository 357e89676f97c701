package com.eainde.atc.store;

import com.eainde.atc.model.AnalysisReport;
import com.eainde.atc.model.PriorityLevel;

/**
 * Report listing filter. Null filters match everything.
 *
 * @param priorityLevel     only reports with this priority
 * @param requiresAttention only reports whose attention flag equals this value
 * @param limit             page size, 1 to {@value #MAX_LIMIT}
 * @param skip              reports to skip, newest first
 */
public record ReportQuery(PriorityLevel priorityLevel, Boolean requiresAttention, int limit, int skip) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    public ReportQuery {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ", was " + limit);
        }
        if (skip < 0) {
            throw new IllegalArgumentException("skip must be >= 0, was " + skip);
        }
    }

    public static ReportQuery all() {
        return new ReportQuery(null, null, DEFAULT_LIMIT, 0);
    }

    public boolean matches(AnalysisReport report) {
        return (priorityLevel == null || priorityLevel == report.priorityLevel())
                && (requiresAttention == null || requiresAttention == report.requiresAttention());
    }
}
