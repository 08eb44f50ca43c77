package com.ridedispatch.api.dispatch.service.repository;

import com.ridedispatch.api.dispatch.service.entity.Offer;
import com.ridedispatch.api.shared.constants.OfferStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OfferRepository extends JpaRepository<Offer, UUID> {

    List<Offer> findByRideIdOrderByBatchNumberAscCreatedAtAsc(UUID rideId);

    List<Offer> findByRideIdAndStatus(UUID rideId, OfferStatus status);

    Optional<Offer> findByRideIdAndDriverId(UUID rideId, String driverId);

    long countByRideId(UUID rideId);

    @Query("SELECT o.driverId FROM Offer o WHERE o.rideId = :rideId")
    List<String> findDriverIdsByRideId(@Param("rideId") UUID rideId);

    @Query("SELECT COALESCE(MAX(o.batchNumber), 0) FROM Offer o WHERE o.rideId = :rideId")
    int findLatestBatchNumber(@Param("rideId") UUID rideId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Offer o SET o.status = :accepted, o.respondedAt = :now " +
            "WHERE o.rideId = :rideId AND o.driverId = :driverId AND o.status = :pending")
    int markAccepted(@Param("rideId") UUID rideId,
                     @Param("driverId") String driverId,
                     @Param("now") ZonedDateTime now,
                     @Param("pending") OfferStatus pending,
                     @Param("accepted") OfferStatus accepted);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Offer o SET o.status = :target, o.respondedAt = :now " +
            "WHERE o.rideId = :rideId AND o.status = :pending")
    int transitionPending(@Param("rideId") UUID rideId,
                          @Param("now") ZonedDateTime now,
                          @Param("pending") OfferStatus pending,
                          @Param("target") OfferStatus target);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Offer o SET o.status = :expired, o.respondedAt = :now " +
            "WHERE o.rideId = :rideId AND o.batchNumber = :batchNumber AND o.status = :pending")
    int expirePendingInBatch(@Param("rideId") UUID rideId,
                             @Param("batchNumber") int batchNumber,
                             @Param("now") ZonedDateTime now,
                             @Param("pending") OfferStatus pending,
                             @Param("expired") OfferStatus expired);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Offer o SET o.status = :expired, o.respondedAt = :now " +
            "WHERE o.rideId = :rideId AND o.status = :pending AND o.expiresAt <= :now")
    int expireElapsed(@Param("rideId") UUID rideId,
                      @Param("now") ZonedDateTime now,
                      @Param("pending") OfferStatus pending,
                      @Param("expired") OfferStatus expired);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Offer o SET o.status = :rejected, o.rejectionReason = :reason, o.respondedAt = :now " +
            "WHERE o.id = :offerId AND o.driverId = :driverId AND o.status = :pending")
    int rejectIfPending(@Param("offerId") UUID offerId,
                        @Param("driverId") String driverId,
                        @Param("reason") String reason,
                        @Param("now") ZonedDateTime now,
                        @Param("pending") OfferStatus pending,
                        @Param("rejected") OfferStatus rejected);
}
