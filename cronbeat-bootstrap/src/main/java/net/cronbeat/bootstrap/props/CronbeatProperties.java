package net.cronbeat.bootstrap.props;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties("cronbeat")
public class CronbeatProperties {
    /** jdbc | memory */
    private Store store = Store.JDBC;
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();
    private Catalog catalog = new Catalog();

    public enum Store { JDBC, MEMORY }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private String name = "default";
        private Duration initialDelay = Duration.ZERO;
        private Duration idleDelay = Duration.ofSeconds(1);
        private Duration nextDelay = Duration.ZERO;
        private Duration tickDelay = Duration.ZERO;
        // 비어 있으면 모든 kind 처리
        private List<String> kinds = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getIdleDelay() {
            return idleDelay;
        }

        public void setIdleDelay(Duration idleDelay) {
            this.idleDelay = idleDelay;
        }

        public Duration getNextDelay() {
            return nextDelay;
        }

        public void setNextDelay(Duration nextDelay) {
            this.nextDelay = nextDelay;
        }

        public Duration getTickDelay() {
            return tickDelay;
        }

        public void setTickDelay(Duration tickDelay) {
            this.tickDelay = tickDelay;
        }

        public List<String> getKinds() {
            return kinds;
        }

        public void setKinds(List<String> kinds) {
            this.kinds = kinds;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<JobDef> jobs = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<JobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<JobDef> jobs) {
            this.jobs = jobs;
        }
    }

    public static class JobDef {
        private String name;
        private String kind;
        private String payload;
        // 비어 있으면 1회성 잡
        private String interval;
        private Boolean enabled;
        // ISO-8601 (offset 없으면 cronbeat.zone 기준)
        private String startAt;
        private String stopAt;
        private boolean removeExpired;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getKind() {
            return kind;
        }

        public void setKind(String kind) {
            this.kind = kind;
        }

        public String getPayload() {
            return payload;
        }

        public void setPayload(String payload) {
            this.payload = payload;
        }

        public String getInterval() {
            return interval;
        }

        public void setInterval(String interval) {
            this.interval = interval;
        }

        public Boolean getEnabled() {
            return enabled;
        }

        public void setEnabled(Boolean enabled) {
            this.enabled = enabled;
        }

        public String getStartAt() {
            return startAt;
        }

        public void setStartAt(String startAt) {
            this.startAt = startAt;
        }

        public String getStopAt() {
            return stopAt;
        }

        public void setStopAt(String stopAt) {
            this.stopAt = stopAt;
        }

        public boolean isRemoveExpired() {
            return removeExpired;
        }

        public void setRemoveExpired(boolean removeExpired) {
            this.removeExpired = removeExpired;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", kind='" + kind + '\'' +
                    ", interval='" + interval + '\'' +
                    ", enabled=" + enabled +
                    ", startAt='" + startAt + '\'' +
                    ", stopAt='" + stopAt + '\'' +
                    ", removeExpired=" + removeExpired +
                    '}';
        }
    }
}
