package com.tripsync.pojo.entity;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class FinanceData extends FlexibleEntity {

    private BigDecimal overallBudget;

    private BigDecimal reservedBudget;

    private String currency;

    private List<BudgetItem> countryBudgets = new ArrayList<>();

    private List<Expense> expenses = new ArrayList<>();

    private List<String> customCategories;

    @JsonAlias("ynabImportData")
    private ImportMetadata importMetadata;
}
