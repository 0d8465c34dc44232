package com.tony.staffAnalytics.model.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
public class BatchStaffResult {
    private List<String> builtFiles = new ArrayList<>();
    private Map<String, String> failures = new LinkedHashMap<>(); // head coach -> raison
}
