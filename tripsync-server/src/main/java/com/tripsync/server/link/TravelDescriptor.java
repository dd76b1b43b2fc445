package com.tripsync.server.link;

import com.tripsync.pojo.entity.TravelItemType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 费用所关联的行程条目的展示信息。
 * 按 type 区分三种形态：location / accommodation（额外带所属地点名）/ route（name 为「出发地 → 目的地」）。
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TravelDescriptor {

    private final TravelItemType type;

    private final String id;

    private final String name;

    /**
     * 仅 accommodation 有值
     */
    private final String locationName;

    private final String tripTitle;

    public static TravelDescriptor location(String id, String name, String tripTitle) {
        return new TravelDescriptor(TravelItemType.LOCATION, id, name, null, tripTitle);
    }

    public static TravelDescriptor accommodation(String id, String name, String locationName, String tripTitle) {
        return new TravelDescriptor(TravelItemType.ACCOMMODATION, id, name, locationName, tripTitle);
    }

    public static TravelDescriptor route(String id, String name, String tripTitle) {
        return new TravelDescriptor(TravelItemType.ROUTE, id, name, null, tripTitle);
    }
}
