package com.tripsync.pojo.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

/**
 * 银行流水导入的配置与历史，由外部导入流程写入，本程序只负责原样保存。
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class ImportMetadata extends FlexibleEntity {

    private List<CategoryMapping> mappings = new ArrayList<>();

    private List<String> importedTransactionHashes = new ArrayList<>();
}
