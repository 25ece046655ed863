package com.rabs.backend.global.config;

import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "rabs.loom")
public class LoomProperties {

    /**
     * Window size used when no loom settings row exists yet.
     */
    private int defaultWindowWeeks = 4;

    private int minWindowWeeks = 1;

    private int maxWindowWeeks = 16;

    /**
     * Participants covered by one support worker when no settings row exists yet.
     */
    private int defaultParticipantsPerSupportWorker = 5;

    /**
     * Zone that decides the calendar date of "today" and anchors program times of day.
     */
    private ZoneId timeZone = ZoneId.of("Australia/Sydney");

    private final Roll roll = new Roll();

    public int getDefaultWindowWeeks() {
        return defaultWindowWeeks;
    }

    public void setDefaultWindowWeeks(int defaultWindowWeeks) {
        this.defaultWindowWeeks = defaultWindowWeeks;
    }

    public int getMinWindowWeeks() {
        return minWindowWeeks;
    }

    public void setMinWindowWeeks(int minWindowWeeks) {
        this.minWindowWeeks = minWindowWeeks;
    }

    public int getMaxWindowWeeks() {
        return maxWindowWeeks;
    }

    public void setMaxWindowWeeks(int maxWindowWeeks) {
        this.maxWindowWeeks = maxWindowWeeks;
    }

    public int getDefaultParticipantsPerSupportWorker() {
        return defaultParticipantsPerSupportWorker;
    }

    public void setDefaultParticipantsPerSupportWorker(int defaultParticipantsPerSupportWorker) {
        this.defaultParticipantsPerSupportWorker = defaultParticipantsPerSupportWorker;
    }

    public ZoneId getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(ZoneId timeZone) {
        this.timeZone = timeZone;
    }

    public Roll getRoll() {
        return roll;
    }

    public static class Roll {

        /**
         * Nightly window roll. Off unless explicitly enabled.
         */
        private boolean enabled = false;

        private String cron = "0 5 0 * * *";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }
    }
}
