package com.tickerwolf.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntradaySnapshotRow {
    private String cacheKey;
    private String symbol;
    private LocalDate tradingDate;
    private String payload;
    private OffsetDateTime fetchedAt;
}
