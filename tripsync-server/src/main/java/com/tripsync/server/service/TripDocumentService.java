package com.tripsync.server.service;

import com.tripsync.pojo.dto.FinanceUpdateDTO;
import com.tripsync.pojo.dto.ItineraryUpdateDTO;
import com.tripsync.pojo.dto.TravelItemRef;
import com.tripsync.pojo.dto.TripCreateDTO;
import com.tripsync.pojo.entity.Accommodation;
import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.pojo.vo.TripSummaryVO;
import com.tripsync.server.backup.BackupRecord;
import com.tripsync.server.link.TripLinkIndex;
import com.tripsync.server.validation.LinkValidationResult;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * 行程文档的对外操作入口，供上层接口调用。
 */
public interface TripDocumentService {

    Optional<TripDocument> loadDocument(String tripId) throws IOException;

    /**
     * 与 loadDocument 相同，但不存在时抛 TripNotFoundException。
     */
    TripDocument getDocument(String tripId) throws IOException;

    void saveDocument(TripDocument doc) throws IOException;

    TripDocument createTrip(TripCreateDTO dto) throws IOException;

    /**
     * 整段替换行程安排，finance 原样保留；行程不存在时新建。
     * 住宿按 ID 与已存数据合并，并根据前后差异生成公开动态。
     */
    TripDocument updateItinerary(String tripId, ItineraryUpdateDTO update) throws IOException;

    /**
     * 局部更新费用段（只覆盖非 null 字段），itinerary 原样保留；行程不存在时新建。
     */
    TripDocument updateFinance(String tripId, FinanceUpdateDTO update) throws IOException;

    LinkValidationResult validateLink(String tripId, String expenseId, TravelItemRef ref) throws IOException;

    /**
     * 校验通过后建立关联（ref 为 null 时解除关联）并保存；不通过抛 LinkValidationException。
     */
    TripDocument linkExpense(String tripId, String expenseId, TravelItemRef ref) throws IOException;

    TripLinkIndex buildLinkIndex(String tripId) throws IOException;

    List<TripSummaryVO> listTrips() throws IOException;

    BackupRecord deleteTrip(String tripId, String reason) throws IOException;

    BackupRecord deleteFinance(String tripId, String reason) throws IOException;

    TripDocument restoreTrip(String backupId, boolean overwrite) throws IOException;

    TripDocument restoreFinance(String backupId, boolean overwrite) throws IOException;

    /**
     * 迁移时补建、尚待人工确认的住宿。
     */
    List<Accommodation> listAccommodationsNeedingReview(String tripId) throws IOException;

    TripDocument confirmAccommodation(String tripId, String accommodationId) throws IOException;
}
