package com.llmcommittee.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Judging pipeline settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "committee.judge")
public class CommitteeJudgeProperties {

    private String defaultJudge = "anthropic/claude-sonnet-4";
    private String defaultSynthesizer = "anthropic/claude-sonnet-4";
    private int timeoutSeconds = 90;

    /**
     * Extra wait past the judge timeout before an unfinished judge is abandoned.
     */
    private long barrierGraceMillis = 5_000;

    /**
     * Lifetime of one HTTP judging request; judging is cancelled when it elapses.
     */
    private long requestTimeoutMs = 300_000;
    private int maxListEntries = 3;
    private int maxQuotedReasons = 2;
}
