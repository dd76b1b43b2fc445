package com.tripsync.pojo.dto;

import com.tripsync.pojo.entity.BudgetItem;
import com.tripsync.pojo.entity.Expense;
import com.tripsync.pojo.entity.ImportMetadata;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * 费用段的局部更新：只有非 null 字段会覆盖已有值，itinerary 不受影响。
 */
@Data
public class FinanceUpdateDTO {
    private BigDecimal overallBudget;
    private BigDecimal reservedBudget;
    private String currency;
    private List<BudgetItem> countryBudgets;
    private List<Expense> expenses;
    private List<String> customCategories;
    private ImportMetadata importMetadata;
}
