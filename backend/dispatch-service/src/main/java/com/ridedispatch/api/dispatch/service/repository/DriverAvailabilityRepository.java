package com.ridedispatch.api.dispatch.service.repository;

import com.ridedispatch.api.dispatch.service.entity.DriverAvailability;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface DriverAvailabilityRepository extends JpaRepository<DriverAvailability, String> {

    @Query("SELECT d FROM DriverAvailability d WHERE d.latitude BETWEEN :minLat AND :maxLat " +
            "AND d.longitude BETWEEN :minLon AND :maxLon")
    List<DriverAvailability> findInBoundingBox(@Param("minLat") double minLat,
                                               @Param("maxLat") double maxLat,
                                               @Param("minLon") double minLon,
                                               @Param("maxLon") double maxLon);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DriverAvailability d WHERE d.driverId = :driverId")
    Optional<DriverAvailability> findByIdForUpdate(@Param("driverId") String driverId);

    List<DriverAvailability> findByOnlineTrueAndLastSeenAtBefore(ZonedDateTime cutoff);

    long countByOnlineTrueAndAvailableTrue();

    @Modifying(flushAutomatically = true)
    @Query("UPDATE DriverAvailability d SET d.available = :available, d.availableSince = :availableSince, " +
            "d.updatedAt = :now WHERE d.driverId = :driverId")
    int updateAvailable(@Param("driverId") String driverId,
                        @Param("available") boolean available,
                        @Param("availableSince") ZonedDateTime availableSince,
                        @Param("now") ZonedDateTime now);
}
