package com.tripsync.pojo.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@EqualsAndHashCode(callSuper = true)
public class Expense extends FlexibleEntity {

    private String id;

    private Instant date;

    private BigDecimal amount;

    private String currency;

    private String category;

    private String country;

    private String description;

    private String notes;

    private Boolean isGeneralExpense;

    private ExpenseType expenseType;

    private String originalPlannedId;

    private TravelReference travelReference;

    /**
     * 导入来源：银行流水行的哈希，用于去重
     */
    private String importHash;

    /**
     * 导入来源：外部系统交易 ID
     */
    private String externalTransactionId;
}
