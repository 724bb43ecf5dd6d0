package com.airmonitor.ingestion.repository;

import com.airmonitor.ingestion.model.DeviceReadingEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * All orderings are newest first: recorded_at, then insertion order.
 */
@Repository
public interface DeviceReadingRepository extends JpaRepository<DeviceReadingEntity, Long> {

    Optional<DeviceReadingEntity> findFirstByDeviceIdOrderByRecordedAtDescIdDesc(String deviceId);

    List<DeviceReadingEntity> findByDeviceIdOrderByRecordedAtDescIdDesc(String deviceId, Pageable pageable);

    List<DeviceReadingEntity> findAllByOrderByRecordedAtDescIdDesc(Pageable pageable);

    long countByDeviceId(String deviceId);
}
