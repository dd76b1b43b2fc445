package com.tripsync.pojo.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.Instant;

@Data
@EqualsAndHashCode(callSuper = true)
public class CountryPeriod extends FlexibleEntity {

    private String id;

    private Instant startDate;

    private Instant endDate;

    private String notes;
}
