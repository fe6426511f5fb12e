package com.demo.chatrelay.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackendStatus {
    private boolean available;
    private List<String> models;

    public static BackendStatus unavailable() {
        return new BackendStatus(false, List.of());
    }
}
