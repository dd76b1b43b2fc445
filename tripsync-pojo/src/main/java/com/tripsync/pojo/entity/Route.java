package com.tripsync.pojo.entity;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 两地之间的交通段。多段联程时 subRoutes 各自可以挂费用。
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class Route extends FlexibleEntity {

    private String id;

    /**
     * walk / bike / car / bus / train / plane / ferry / boat / metro / other
     */
    @JsonAlias("transportType")
    private String type;

    private String from;

    private String to;

    private double[] fromCoordinates;

    private double[] toCoordinates;

    private List<double[]> routePoints;

    private Double distance;

    private Instant date;

    private String departureTime;

    private String arrivalTime;

    private String privateNotes;

    private List<CostTrackingLink> costTrackingLinks = new ArrayList<>();

    private List<Route> subRoutes;
}
