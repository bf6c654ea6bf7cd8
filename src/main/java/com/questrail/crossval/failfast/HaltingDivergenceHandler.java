package com.questrail.crossval.failfast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production {@link DivergenceHandler}: logs the report and halts the JVM.
 *
 * <p>{@link Runtime#halt(int)} is used rather than {@link System#exit(int)} so
 * no shutdown hook can run simulation code past the divergence. The status is
 * {@value #EXIT_STATUS}, the status of a process killed by {@code SIGABRT}.</p>
 */
public final class HaltingDivergenceHandler implements DivergenceHandler
{
    private static final Logger log = LoggerFactory.getLogger(HaltingDivergenceHandler.class);

    public static final int EXIT_STATUS = 134;

    public static final HaltingDivergenceHandler INSTANCE = new HaltingDivergenceHandler();

    private HaltingDivergenceHandler() {}

    @Override
    public void onDivergence(DivergenceReport report) {
        log.error("Divergence detected by {} at sync point {}: {}; aborting",
                report.origin(), report.syncPoint(), report.detail());
        Runtime.getRuntime().halt(EXIT_STATUS);
    }
}
