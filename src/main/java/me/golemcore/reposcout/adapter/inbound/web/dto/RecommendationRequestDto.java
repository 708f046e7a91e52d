package me.golemcore.reposcout.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.reposcout.domain.model.ProcessingPreset;

import java.util.Map;

/**
 * Body of {@code POST /api/recommendations}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationRequestDto {
    private String intent;
    private Map<String, Double> objectives;
    private String sessionId;
    private Integer parallelism;
    private ProcessingPreset preset;
    private Integer limit;
}
