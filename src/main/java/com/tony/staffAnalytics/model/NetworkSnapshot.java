package com.tony.staffAnalytics.model;

import com.tony.staffAnalytics.service.RolePromotionMapper;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Entrées immuables d'un run : graphe de co-staff, table de proximité et promotions.
 */
@Value
public class NetworkSnapshot {
    CoStaffGraph graph;
    ClosenessTable closenessTable;
    RolePromotionMapper promotionMapper;
    LocalDateTime builtAt;
}
