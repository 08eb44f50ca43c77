package com.ridedispatch.api.dispatch.service.repository;

import com.ridedispatch.api.dispatch.service.entity.Ride;
import com.ridedispatch.api.shared.constants.OfferStatus;
import com.ridedispatch.api.shared.constants.RideStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RideRepository extends JpaRepository<Ride, UUID> {

    List<Ride> findByStatus(RideStatus status);

    boolean existsByCustomerIdAndStatusIn(String customerId, Collection<RideStatus> statuses);

    boolean existsByAssignedDriverIdAndStatusIn(String driverId, Collection<RideStatus> statuses);

    long countByAssignedDriverIdAndStatusIn(String driverId, Collection<RideStatus> statuses);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Ride r WHERE r.id = :rideId")
    Optional<Ride> findByIdForUpdate(@Param("rideId") UUID rideId);

    /**
     * Compare-and-set for the accept race. Succeeds (returns 1) only while the ride is
     * searching, the driver holds a pending, unexpired offer for it and the driver is not
     * already holding another ride.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Ride r SET r.status = :assigned, r.assignedDriverId = :driverId, " +
            "r.assignedAt = :now, r.updatedAt = :now, r.version = r.version + 1 " +
            "WHERE r.id = :rideId AND r.status = :searching " +
            "AND EXISTS (SELECT o.id FROM Offer o WHERE o.rideId = :rideId AND o.driverId = :driverId " +
            "AND o.status = :pending AND o.expiresAt > :now) " +
            "AND NOT EXISTS (SELECT h.id FROM Ride h WHERE h.assignedDriverId = :driverId AND h.status IN :holding)")
    int assignIfOfferOpen(@Param("rideId") UUID rideId,
                          @Param("driverId") String driverId,
                          @Param("now") ZonedDateTime now,
                          @Param("searching") RideStatus searching,
                          @Param("assigned") RideStatus assigned,
                          @Param("pending") OfferStatus pending,
                          @Param("holding") Collection<RideStatus> holding);
}
