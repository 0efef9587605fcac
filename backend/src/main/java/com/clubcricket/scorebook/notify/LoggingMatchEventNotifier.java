package com.clubcricket.scorebook.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingMatchEventNotifier implements MatchEventNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingMatchEventNotifier.class);

    @Override
    public void notify(MatchEvent event) {
        log.info("[Match][{}] matchId={} innings={} {}", event.type(), event.matchId(),
                event.inningsNumber(), event.summary() == null ? "" : event.summary());
    }
}
