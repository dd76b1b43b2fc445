package com.tripsync.pojo.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class JourneyPeriod extends FlexibleEntity {

    private String id;

    private Instant date;

    private Instant endDate;

    private String title;

    private List<Location> locations = new ArrayList<>();

    private Route transportation;

    private String customNotes;
}
