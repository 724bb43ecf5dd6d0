package com.airmonitor.ingestion.live.notifier;

import reactor.core.publisher.Flux;

/**
 * Source of change events for committed readings.
 *
 * <p>The stream must stay alive for the lifetime of the service: implementations recover from
 * failures of the underlying subscription themselves and never complete. Duplicated or
 * occasionally lost events are tolerated downstream.
 */
public interface ChangeNotifier {

    Flux<ChangeEvent> changes();
}
