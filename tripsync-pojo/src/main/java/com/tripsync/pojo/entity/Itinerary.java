package com.tripsync.pojo.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class Itinerary extends FlexibleEntity {

    private List<Location> locations = new ArrayList<>();

    private List<Route> routes = new ArrayList<>();

    /**
     * 历史上叫 days，实际内容是按时间段划分的行程
     */
    private List<JourneyPeriod> days = new ArrayList<>();
}
