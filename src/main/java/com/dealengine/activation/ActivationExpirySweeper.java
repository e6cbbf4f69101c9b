package com.dealengine.activation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background sweep moving TRIGGERED activations past their window to EXPIRED.
 */
@Component
@ConditionalOnProperty(name = "deal-engine.activation.sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ActivationExpirySweeper {

    private final ActivationService activationService;

    @Scheduled(fixedDelayString = "${deal-engine.activation.sweep.interval:PT1M}",
        initialDelayString = "${deal-engine.activation.sweep.interval:PT1M}")
    public void sweep() {
        log.debug("Running activation expiry sweep");
        activationService.expireDue();
    }
}
