package com.tripsync.pojo.vo;

import lombok.Data;

import java.time.Instant;

/**
 * 行程列表展示用摘要，不携带 itinerary / finance 明细。
 */
@Data
public class TripSummaryVO {
    private String id;
    private String title;
    private String description;
    private Instant startDate;
    private Instant endDate;
    private Instant createdAt;
    private Instant updatedAt;
    private boolean hasItinerary;
    private boolean hasFinance;
}
