package com.tripsync.pojo.dto;

import com.tripsync.pojo.entity.TravelItemType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 待关联的行程条目：类型 + ID。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TravelItemRef {

    private TravelItemType type;

    private String id;

    public static TravelItemRef location(String id) {
        return new TravelItemRef(TravelItemType.LOCATION, id);
    }

    public static TravelItemRef accommodation(String id) {
        return new TravelItemRef(TravelItemType.ACCOMMODATION, id);
    }

    public static TravelItemRef route(String id) {
        return new TravelItemRef(TravelItemType.ROUTE, id);
    }
}
