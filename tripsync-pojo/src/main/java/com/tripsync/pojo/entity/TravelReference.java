package com.tripsync.pojo.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 费用一侧的行程关联：type 决定 locationId / accommodationId / routeId 中哪个生效。
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class TravelReference extends FlexibleEntity {

    private TravelItemType type;

    private String locationId;

    private String accommodationId;

    private String routeId;

    private String description;

    public static TravelReference of(TravelItemType type, String itemId, String description) {
        TravelReference ref = new TravelReference();
        ref.setType(type);
        ref.setDescription(description);
        switch (type) {
            case LOCATION -> ref.setLocationId(itemId);
            case ACCOMMODATION -> ref.setAccommodationId(itemId);
            case ROUTE -> ref.setRouteId(itemId);
        }
        return ref;
    }

    /**
     * 按 type 取出被引用条目的 ID；type 缺失时按 accommodation > location > route 推断
     */
    @JsonIgnore
    public String getItemId() {
        TravelItemType t = resolveType();
        if (t == null) {
            return null;
        }
        return switch (t) {
            case LOCATION -> locationId;
            case ACCOMMODATION -> accommodationId;
            case ROUTE -> routeId;
        };
    }

    @JsonIgnore
    public TravelItemType resolveType() {
        if (type != null) {
            return type;
        }
        if (accommodationId != null) {
            return TravelItemType.ACCOMMODATION;
        }
        if (locationId != null) {
            return TravelItemType.LOCATION;
        }
        if (routeId != null) {
            return TravelItemType.ROUTE;
        }
        return null;
    }
}
