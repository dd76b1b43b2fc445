package com.tripsync.pojo.entity;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 行程聚合文档：一个行程 = 一个 trip-{id}.json 文件。
 * itinerary（行程安排）与 finance（费用）两部分独立编辑，但必须在同一个文件里保持互相引用一致。
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class TripDocument extends FlexibleEntity {

    /**
     * 文档结构版本，只增不减；落盘时必须等于当前版本。
     */
    private Integer schemaVersion;

    private String id;

    private String title;

    private String description;

    private Instant startDate;

    private Instant endDate;

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * 旧版本文件中该段叫 travelData
     */
    @JsonAlias("travelData")
    private Itinerary itinerary;

    private List<Accommodation> accommodations = new ArrayList<>();

    /**
     * 旧版本文件中该段叫 costData
     */
    @JsonAlias("costData")
    private FinanceData finance;

    /**
     * 公开动态，最新在前，有条数上限
     */
    private List<TripUpdate> publicUpdates = new ArrayList<>();
}
