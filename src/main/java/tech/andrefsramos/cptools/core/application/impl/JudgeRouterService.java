package tech.andrefsramos.cptools.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.cptools.core.application.DetectJudgeUseCase;
import tech.andrefsramos.cptools.core.ports.JudgePort;

import java.util.List;
import java.util.Optional;

/*
 * Purpose

 * Resolves the judge responsible for a URL.

 * How it works

 * - Holds the judges in registration order, fixed at start-up.
 * - Returns the first judge whose detect(url) matches; registration order is the tie-break,
 *   so judges doing substring/domain matching must be registered more-specific-first.
 * - "No match" is an empty Optional, never an error: callers report an unsupported platform.
 */
public class JudgeRouterService implements DetectJudgeUseCase {
    private static final Logger log = LoggerFactory.getLogger(JudgeRouterService.class);

    private final List<JudgePort> judges;

    public JudgeRouterService(List<JudgePort> judges) {
        this.judges = judges != null ? List.copyOf(judges) : List.of();
    }

    @Override
    public Optional<JudgePort> detectJudge(String url) {
        if (url == null || url.isBlank()) {
            log.debug("[Router] Blank URL; no judge.");
            return Optional.empty();
        }

        for (JudgePort j : judges) {
            try {
                if (j.detect(url)) {
                    log.debug("[Router] url={} -> {}", url, j.platformName());
                    return Optional.of(j);
                }
            } catch (RuntimeException e) {
                log.warn("[Router] detect() failed on {} for url={}: {}", j.platformName(), url, e.toString());
            }
        }

        log.info("[Router] No judge matches url={} (registered={})", url, judges.size());
        return Optional.empty();
    }

    @Override
    public List<JudgePort> judges() {
        return judges;
    }
}
