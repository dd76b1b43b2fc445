package com.tripsync.pojo.entity;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class CategoryMapping extends FlexibleEntity {

    @JsonAlias("ynabCategory")
    private String externalCategory;

    /**
     * country / general / none
     */
    private String mappingType;

    private String countryName;
}
