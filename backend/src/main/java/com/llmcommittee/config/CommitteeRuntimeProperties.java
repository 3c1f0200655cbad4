package com.llmcommittee.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Committee runtime feature flags and dispatch defaults.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "committee")
public class CommitteeRuntimeProperties {

    /**
     * Serve backend calls from the deterministic mock client instead of the live API.
     */
    private boolean mockProvider = true;

    private Dispatch dispatch = new Dispatch();
    private Stream stream = new Stream();

    @Getter
    @Setter
    public static class Dispatch {
        private int minCommitteeSize = 2;
        private int maxCommitteeSize = 8;
        private String threadNamePrefix = "committee-dispatch-";
    }

    @Getter
    @Setter
    public static class Stream {
        /**
         * Lifetime of one SSE connection; the run is cancelled when it elapses.
         */
        private long emitterTimeoutMs = 600_000;
    }
}
