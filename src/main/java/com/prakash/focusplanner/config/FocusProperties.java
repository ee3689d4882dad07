package com.prakash.focusplanner.config;

import com.prakash.focusplanner.model.Timeframe;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

/**
 * Application settings bound from the <strong>focus</strong> property prefix.
 *
 * Example configuration in <code>application.properties</code>:
 * <pre>
 * focus.capacity.primary.daily=3
 * focus.capacity.overflow.daily=20
 * focus.user.header=X-User-Id
 * focus.events.source=focus
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "focus")
public class FocusProperties {

    private final Capacity capacity = new Capacity();
    private final User user = new User();
    private final Events events = new Events();

    public Capacity getCapacity() {
        return capacity;
    }

    public User getUser() {
        return user;
    }

    public Events getEvents() {
        return events;
    }

    /**
     * Per-timeframe section caps. A timeframe missing from a map falls back to the section's built-in limit.
     */
    public static class Capacity {

        private Map<Timeframe, Integer> primary = new EnumMap<>(Timeframe.class);
        private Map<Timeframe, Integer> overflow = new EnumMap<>(Timeframe.class);

        public Map<Timeframe, Integer> getPrimary() {
            return primary;
        }

        public void setPrimary(Map<Timeframe, Integer> primary) {
            this.primary = primary;
        }

        public Map<Timeframe, Integer> getOverflow() {
            return overflow;
        }

        public void setOverflow(Map<Timeframe, Integer> overflow) {
            this.overflow = overflow;
        }
    }

    public static class User {

        /**
         * Request header carrying the signed-in user's id.
         */
        private String header = "X-User-Id";

        /**
         * User to act as when no header is present. Empty means anonymous requests are rejected.
         */
        private String defaultId;

        public String getHeader() {
            return header;
        }

        public void setHeader(String header) {
            this.header = header;
        }

        public String getDefaultId() {
            return defaultId;
        }

        public void setDefaultId(String defaultId) {
            this.defaultId = defaultId;
        }
    }

    public static class Events {

        /**
         * Source stamped on completion events published by this process.
         */
        private String source = "focus";

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }
    }
}
