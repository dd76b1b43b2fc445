package com.tripsync.server.document;

import com.tripsync.pojo.entity.Accommodation;
import com.tripsync.pojo.entity.CostTrackingLink;
import com.tripsync.pojo.entity.Location;
import com.tripsync.pojo.entity.Route;
import com.tripsync.pojo.entity.TravelItemType;
import com.tripsync.pojo.entity.TravelReference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 可以挂费用关联的行程条目（地点 / 住宿 / 路线及其子路线）的统一视图。
 * 持有对原实体 costTrackingLinks 的读写入口，修改会直接作用到文档上。
 */
public class LinkedItem {

    private final TravelItemType type;
    private final String id;
    private final String name;
    private final Supplier<List<CostTrackingLink>> linksGetter;
    private final Consumer<List<CostTrackingLink>> linksSetter;

    private LinkedItem(TravelItemType type, String id, String name,
                       Supplier<List<CostTrackingLink>> linksGetter,
                       Consumer<List<CostTrackingLink>> linksSetter) {
        this.type = type;
        this.id = id;
        this.name = name;
        this.linksGetter = linksGetter;
        this.linksSetter = linksSetter;
    }

    public static LinkedItem of(Location location) {
        return new LinkedItem(TravelItemType.LOCATION, location.getId(), location.getName(),
                location::getCostTrackingLinks, location::setCostTrackingLinks);
    }

    public static LinkedItem of(Accommodation accommodation) {
        return new LinkedItem(TravelItemType.ACCOMMODATION, accommodation.getId(), accommodation.getName(),
                accommodation::getCostTrackingLinks, accommodation::setCostTrackingLinks);
    }

    public static LinkedItem of(Route route) {
        return new LinkedItem(TravelItemType.ROUTE, route.getId(), routeName(route),
                route::getCostTrackingLinks, route::setCostTrackingLinks);
    }

    public static String routeName(Route route) {
        return route.getFrom() + " → " + route.getTo();
    }

    public TravelItemType getType() {
        return type;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /**
     * 只读遍历用，原列表为 null 时返回空列表且不修改实体。
     */
    public List<CostTrackingLink> getLinks() {
        List<CostTrackingLink> links = linksGetter.get();
        return links == null ? Collections.emptyList() : links;
    }

    /**
     * 需要修改时使用：原列表为 null 会先在实体上建一个空列表。
     */
    public List<CostTrackingLink> mutableLinks() {
        List<CostTrackingLink> links = linksGetter.get();
        if (links == null) {
            links = new ArrayList<>();
            linksSetter.accept(links);
        }
        return links;
    }

    public void replaceLinks(List<CostTrackingLink> links) {
        linksSetter.accept(links);
    }

    public boolean hasLink(String expenseId) {
        for (CostTrackingLink link : getLinks()) {
            if (link != null && Objects.equals(link.getExpenseId(), expenseId)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true 表示确实删掉了至少一条
     */
    public boolean removeLink(String expenseId) {
        List<CostTrackingLink> links = linksGetter.get();
        if (links == null) {
            return false;
        }
        return links.removeIf(link -> link != null && Objects.equals(link.getExpenseId(), expenseId));
    }

    public void addLink(String expenseId, String description) {
        mutableLinks().add(new CostTrackingLink(expenseId, description));
    }

    public boolean isReferencedBy(TravelReference reference) {
        return reference != null
                && reference.resolveType() == type
                && id != null
                && id.equals(reference.getItemId());
    }

    public TravelReference toReference() {
        return TravelReference.of(type, id, name);
    }

    public String describe() {
        return type.getValue() + " " + id;
    }
}
