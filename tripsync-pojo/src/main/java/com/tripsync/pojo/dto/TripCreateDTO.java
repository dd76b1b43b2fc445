package com.tripsync.pojo.dto;

import lombok.Data;

import java.time.Instant;

/**
 * 新建行程时的基础信息；id 为空时由服务端生成。
 */
@Data
public class TripCreateDTO {
    private String id;
    private String title;
    private String description;
    private Instant startDate;
    private Instant endDate;
}
