package com.tripsync.pojo.dto;

import com.tripsync.pojo.entity.Accommodation;
import com.tripsync.pojo.entity.JourneyPeriod;
import com.tripsync.pojo.entity.Location;
import com.tripsync.pojo.entity.Route;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * 行程编辑器提交的整段 itinerary。
 *
 * 元数据字段为 null 表示不修改；locations / routes / days 为 null 同样保留原值，
 * 非 null 时整段替换。accommodations 会与已存数据按 ID 合并，防止旧页面覆盖新数据。
 */
@Data
public class ItineraryUpdateDTO {
    private String title;
    private String description;
    private Instant startDate;
    private Instant endDate;
    private List<Location> locations;
    private List<Route> routes;
    private List<JourneyPeriod> days;
    private List<Accommodation> accommodations;
}
