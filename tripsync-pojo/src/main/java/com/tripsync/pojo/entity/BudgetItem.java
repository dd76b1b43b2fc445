package com.tripsync.pojo.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class BudgetItem extends FlexibleEntity {

    private String id;

    private String country;

    /**
     * 可为空：只登记国家、暂不定预算
     */
    private BigDecimal amount;

    private String currency;

    private String notes;

    private List<CountryPeriod> periods;
}
