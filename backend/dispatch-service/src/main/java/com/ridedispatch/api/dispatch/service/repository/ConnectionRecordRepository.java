package com.ridedispatch.api.dispatch.service.repository;

import com.ridedispatch.api.dispatch.service.entity.ConnectionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZonedDateTime;
import java.util.List;

@Repository
public interface ConnectionRecordRepository extends JpaRepository<ConnectionRecord, String> {

    List<ConnectionRecord> findByUserIdAndConnectedTrue(String userId);

    @Transactional
    @Modifying
    @Query("UPDATE ConnectionRecord c SET c.connected = false, c.disconnectedAt = :now WHERE c.connected = true")
    int markAllDisconnected(@Param("now") ZonedDateTime now);
}
