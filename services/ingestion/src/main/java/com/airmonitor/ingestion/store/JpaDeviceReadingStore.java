package com.airmonitor.ingestion.store;

import com.airmonitor.common.dto.reading.DeviceReading;
import com.airmonitor.ingestion.model.DeviceReadingEntity;
import com.airmonitor.ingestion.repository.DeviceReadingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * {@link DeviceReadingStore} on top of the blocking JPA repository.
 * Every call is shifted onto the bounded elastic scheduler so event loop threads never block on JDBC.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaDeviceReadingStore implements DeviceReadingStore {

    private final DeviceReadingRepository repository;

    @Override
    public Mono<DeviceReading> insert(DeviceReading reading) {
        return Mono.fromCallable(() -> repository.save(DeviceReadingEntity.fromReading(reading)))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(saved -> log.debug("Stored reading id={} device={} recordedAt={}",
                        saved.getId(), saved.getDeviceId(), saved.getRecordedAt()))
                .map(DeviceReadingEntity::toReading);
    }

    @Override
    public Mono<StoredReading> latest(String deviceId) {
        return Mono.fromCallable(() -> repository.findFirstByDeviceIdOrderByRecordedAtDescIdDesc(deviceId))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(Mono::justOrEmpty)
                .map(JpaDeviceReadingStore::stored);
    }

    @Override
    public Flux<StoredReading> recent(String deviceId, int limit) {
        return Mono.fromCallable(() ->
                        repository.findByDeviceIdOrderByRecordedAtDescIdDesc(deviceId, PageRequest.of(0, limit)))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapIterable(rows -> rows)
                .map(JpaDeviceReadingStore::stored);
    }

    @Override
    public Flux<StoredReading> recent(int limit) {
        return Mono.fromCallable(() -> repository.findAllByOrderByRecordedAtDescIdDesc(PageRequest.of(0, limit)))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapIterable(rows -> rows)
                .map(JpaDeviceReadingStore::stored);
    }

    private static StoredReading stored(DeviceReadingEntity entity) {
        return new StoredReading(entity.getId(), entity.toReading());
    }
}
