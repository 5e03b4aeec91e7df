package com.vtb.refiner.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Группа семантически одинаковых угроз. Живёт только в пределах прогона.
 */
@Data
@Builder
public class Cluster {
    private String clusterId;
    private StrideCategory strideCategory;
    @Builder.Default
    private List<String> memberThreatIds = new ArrayList<>();
    private String representativeId;
}
