package de.bsommerfeld.wsbg.archive.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mode of the archive downloader. {@link #TEST} swaps the real
 * Arctic Shift client for an offline generator so a full run can be
 * exercised without network access; output files are still written.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the mode from the {@code app.mode} system property, then the
     * {@code APP_MODE} environment variable. Unset or unknown values fall back
     * to {@link #PROD}.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty("app.mode");
        if (mode == null || mode.isBlank()) {
            mode = System.getenv("APP_MODE");
        }
        return parse(mode);
    }

    /**
     * Like {@link #get()}, but an explicit {@code --test} flag on the command
     * line wins over both property and environment.
     */
    public static ApplicationMode resolve(boolean testFlag) {
        return testFlag ? TEST : get();
    }

    static ApplicationMode parse(String mode) {
        if (mode == null || mode.isBlank()) {
            return PROD;
        }
        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', falling back to PROD", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
