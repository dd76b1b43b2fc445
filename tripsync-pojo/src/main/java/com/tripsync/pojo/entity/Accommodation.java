package com.tripsync.pojo.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class Accommodation extends FlexibleEntity {

    private String id;

    private String name;

    /**
     * 所属地点 ID，必须指向同一文档中的 Location
     */
    private String locationId;

    private String accommodationData;

    private Boolean isAccommodationPublic;

    private List<CostTrackingLink> costTrackingLinks = new ArrayList<>();

    /**
     * 迁移时为修复悬空引用而补建的占位住宿，需要人工确认
     */
    private Boolean needsReview;

    private Instant createdAt;

    private Instant updatedAt;
}
