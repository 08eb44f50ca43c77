package com.ridedispatch.api.dispatch.service.matching;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastResult {

    // 0 when nothing was written because the ride is no longer searching
    private int batchNumber;
    private ZonedDateTime expiresAt;
    @Builder.Default
    private List<String> offeredDriverIds = new ArrayList<>();
    @Builder.Default
    private List<String> skippedDriverIds = new ArrayList<>();

    public boolean isRideSettled() {
        return batchNumber == 0;
    }

    public static BroadcastResult rideSettled() {
        return BroadcastResult.builder().batchNumber(0).build();
    }
}
