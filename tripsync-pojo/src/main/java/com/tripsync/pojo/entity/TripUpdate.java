package com.tripsync.pojo.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 一条面向公众的行程变更动态，例如“新增目的地：京都”。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TripUpdate {

    private String id;

    private Instant createdAt;

    private String message;
}
