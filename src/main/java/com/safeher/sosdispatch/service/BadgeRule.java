package com.safeher.sosdispatch.service;

import com.safeher.sosdispatch.entity.Volunteer;

/**
 * Badge thresholds. A badge is awarded the first time {@link #isEarnedBy} holds and never revoked.
 */
public enum BadgeRule {

    FIRST_RESPONDER("First Responder", "1 response") {
        @Override
        public boolean isEarnedBy(Volunteer v) {
            return v.getTotalResponses() >= 1;
        }

        @Override
        public double progress(Volunteer v) {
            return ratio(v.getTotalResponses(), 1);
        }
    },
    ASSISTS_10("10 Assists", "10 successful assists") {
        @Override
        public boolean isEarnedBy(Volunteer v) {
            return v.getSuccessfulAssists() >= 10;
        }

        @Override
        public double progress(Volunteer v) {
            return ratio(v.getSuccessfulAssists(), 10);
        }
    },
    ASSISTS_25("25 Assists", "25 successful assists") {
        @Override
        public boolean isEarnedBy(Volunteer v) {
            return v.getSuccessfulAssists() >= 25;
        }

        @Override
        public double progress(Volunteer v) {
            return ratio(v.getSuccessfulAssists(), 25);
        }
    },
    ASSISTS_50("50 Assists", "50 successful assists") {
        @Override
        public boolean isEarnedBy(Volunteer v) {
            return v.getSuccessfulAssists() >= 50;
        }

        @Override
        public double progress(Volunteer v) {
            return ratio(v.getSuccessfulAssists(), 50);
        }
    },
    ASSISTS_100("100 Assists", "100 successful assists") {
        @Override
        public boolean isEarnedBy(Volunteer v) {
            return v.getSuccessfulAssists() >= 100;
        }

        @Override
        public double progress(Volunteer v) {
            return ratio(v.getSuccessfulAssists(), 100);
        }
    },
    /** Average response under 3 minutes over at least 5 responses */
    QUICK_RESPONDER("Quick Responder", "Avg response < 3 min over 5+ responses") {
        @Override
        public boolean isEarnedBy(Volunteer v) {
            return v.getAvgResponseTimeSeconds() < 180 && v.getTotalResponses() >= 5;
        }

        @Override
        public double progress(Volunteer v) {
            return ratio(v.getTotalResponses(), 5);
        }
    };

    private final String badgeName;
    private final String requirement;

    BadgeRule(String badgeName, String requirement) {
        this.badgeName = badgeName;
        this.requirement = requirement;
    }

    public String getBadgeName() {
        return badgeName;
    }

    public String getRequirement() {
        return requirement;
    }

    public abstract boolean isEarnedBy(Volunteer volunteer);

    /** 0–100 */
    public abstract double progress(Volunteer volunteer);

    private static double ratio(int value, int required) {
        return Math.min(100.0, value * 100.0 / required);
    }
}
