package com.cafepos.activity.service;

import com.cafepos.activity.entity.ActivityLog;
import com.cafepos.activity.repository.ActivityLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes audit rows in their own transaction, independent of the operation being audited.
 */
@Service
@RequiredArgsConstructor
public class ActivityLogService {

    static final int MAX_DETAILS_LENGTH = 1000;

    private final ActivityLogRepository activityLogRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(Long userId, String action, String entityType, Long entityId, String details) {
        activityLogRepository.save(ActivityLog.builder()
                .userId(userId)
                .action(action)
                .entityType(entityType)
                .entityId(entityId)
                .details(truncate(details))
                .build());
    }

    private static String truncate(String details) {
        return details == null || details.length() <= MAX_DETAILS_LENGTH
                ? details
                : details.substring(0, MAX_DETAILS_LENGTH);
    }
}
