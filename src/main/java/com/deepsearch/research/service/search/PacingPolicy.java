package com.deepsearch.research.service.search;

import com.deepsearch.research.config.DeepSearchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Politeness delays between outbound calls.
 * Every pause is a non-blocking {@link Mono#delay} so it only suspends the calling pipeline.
 */
@Component
@Slf4j
public class PacingPolicy {

    private final Duration betweenTerms;
    private final Duration betweenDorks;
    private final Duration betweenChunks;
    private final Duration betweenBatches;

    public PacingPolicy(DeepSearchProperties properties) {
        this(properties.getPacing());
    }

    private PacingPolicy(DeepSearchProperties.Pacing pacing) {
        this.betweenTerms = pacing.getBetweenTerms();
        this.betweenDorks = pacing.getBetweenDorks();
        this.betweenChunks = pacing.getBetweenChunks();
        this.betweenBatches = pacing.getBetweenBatches();

        if (!betweenTerms.isZero() && betweenDorks.compareTo(betweenTerms) <= 0) {
            throw new IllegalStateException(String.format(
                    "deepsearch.pacing.between-dorks (%s) must be larger than between-terms (%s)",
                    betweenDorks, betweenTerms));
        }
    }

    /**
     * Policy without any delay
     */
    public static PacingPolicy none() {
        DeepSearchProperties.Pacing pacing = new DeepSearchProperties.Pacing();
        pacing.setBetweenTerms(Duration.ZERO);
        pacing.setBetweenDorks(Duration.ZERO);
        pacing.setBetweenChunks(Duration.ZERO);
        pacing.setBetweenBatches(Duration.ZERO);
        return new PacingPolicy(pacing);
    }

    public Mono<Void> beforeNextTerm() {
        return pause(betweenTerms);
    }

    public Mono<Void> afterDork() {
        return pause(betweenDorks);
    }

    public Mono<Void> betweenChunks() {
        return pause(betweenChunks);
    }

    public Mono<Void> betweenBatches() {
        return pause(betweenBatches);
    }

    private Mono<Void> pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return Mono.empty();
        }
        return Mono.delay(duration).then();
    }
}
