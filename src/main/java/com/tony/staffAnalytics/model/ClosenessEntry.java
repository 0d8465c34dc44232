package com.tony.staffAnalytics.model;

import lombok.Value;

@Value
public class ClosenessEntry {
    RoleSide from;
    RoleSide to;
    double closeness;     // [0,1]
    int hierarchyRank;
}
