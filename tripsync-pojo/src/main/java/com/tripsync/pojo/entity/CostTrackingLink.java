package com.tripsync.pojo.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * 行程条目一侧的费用关联；与 Expense.travelReference 构成双向引用。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class CostTrackingLink extends FlexibleEntity {

    private String expenseId;

    private String description;
}
