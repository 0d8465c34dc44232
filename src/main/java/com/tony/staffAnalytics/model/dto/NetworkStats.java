package com.tony.staffAnalytics.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
@AllArgsConstructor
public class NetworkStats {
    private int coaches;
    private int relationships;
    private double density;
    private int openPositions;
    private LocalDateTime builtAt;
    private List<ConnectedCoach> mostConnected;

    @Data
    @AllArgsConstructor
    public static class ConnectedCoach {
        private long coachId;
        private String name;
        private int connections;
    }
}
