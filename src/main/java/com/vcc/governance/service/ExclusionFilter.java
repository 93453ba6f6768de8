package com.vcc.governance.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a path bypasses governance entirely (health checks, static assets, debug).
 * Pure: a path is excluded when any pattern is found in it, so patterns anchor with ^ and $ as needed.
 */
public class ExclusionFilter {
    private static final Logger log = LoggerFactory.getLogger(ExclusionFilter.class);

    private final List<Pattern> patterns;

    public ExclusionFilter(List<Pattern> patterns) {
        this.patterns = List.copyOf(patterns);
        log.info("ExclusionFilter initialized with {} patterns", this.patterns.size());
    }

    public boolean isExcluded(String path) {
        if (path == null) {
            return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(path).find()) {
                return true;
            }
        }
        return false;
    }
}
