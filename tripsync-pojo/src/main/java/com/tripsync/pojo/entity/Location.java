package com.tripsync.pojo.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class Location extends FlexibleEntity {

    private String id;

    private String name;

    /**
     * [纬度, 经度]
     */
    private double[] coordinates;

    private Instant date;

    private Instant endDate;

    private String arrivalTime;

    private String departureTime;

    private Integer duration;

    private String notes;

    private List<String> accommodationIds = new ArrayList<>();

    /**
     * 旧结构：住宿信息直接内嵌在地点上，迁移后应为空
     */
    private String accommodationData;

    private Boolean isAccommodationPublic;

    private List<CostTrackingLink> costTrackingLinks = new ArrayList<>();
}
