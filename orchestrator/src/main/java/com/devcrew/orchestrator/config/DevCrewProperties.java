package com.devcrew.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed view of the {@code devcrew.*} settings in application.yml.
 *
 * <pre>
 * devcrew:
 *   run:
 *     default-steps: 10      # steps taken by run() without an explicit count
 *     max-steps: 100         # upper bound for a single run(steps) call
 *   persistence:
 *     store: jpa             # jpa | memory
 *   autorun:
 *     enabled: false         # step the loaded workflow in the background
 *     delay-ms: 2000
 * </pre>
 */
@ConfigurationProperties(prefix = "devcrew")
public class DevCrewProperties {

    private Run run = new Run();
    private Persistence persistence = new Persistence();
    private Autorun autorun = new Autorun();

    public Run getRun() { return run; }
    public void setRun(Run run) { this.run = run; }

    public Persistence getPersistence() { return persistence; }
    public void setPersistence(Persistence persistence) { this.persistence = persistence; }

    public Autorun getAutorun() { return autorun; }
    public void setAutorun(Autorun autorun) { this.autorun = autorun; }

    public static class Run {
        private int defaultSteps = 10;
        private int maxSteps = 100;

        public int getDefaultSteps() { return defaultSteps; }
        public void setDefaultSteps(int defaultSteps) { this.defaultSteps = defaultSteps; }

        public int getMaxSteps() { return maxSteps; }
        public void setMaxSteps(int maxSteps) { this.maxSteps = maxSteps; }
    }

    public static class Persistence {
        private String store = "jpa";

        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }
    }

    public static class Autorun {
        private boolean enabled = false;
        private long delayMs = 2000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getDelayMs() { return delayMs; }
        public void setDelayMs(long delayMs) { this.delayMs = delayMs; }
    }
}
