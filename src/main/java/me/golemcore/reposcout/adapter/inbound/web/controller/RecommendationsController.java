package me.golemcore.reposcout.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.reposcout.adapter.inbound.web.dto.ObjectiveDescriptorDto;
import me.golemcore.reposcout.adapter.inbound.web.dto.RecommendationRequestDto;
import me.golemcore.reposcout.domain.model.ConflictPair;
import me.golemcore.reposcout.domain.model.ObjectiveDefinition;
import me.golemcore.reposcout.domain.model.RecommendationRequest;
import me.golemcore.reposcout.domain.model.RecommendationResult;
import me.golemcore.reposcout.domain.service.RecommendationService;
import me.golemcore.reposcout.objective.ConflictRegistry;
import me.golemcore.reposcout.objective.ObjectiveRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Recommendation endpoints. The pipeline blocks on scoring and store I/O, so
 * it runs on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/recommendations")
@RequiredArgsConstructor
public class RecommendationsController {

    private final RecommendationService recommendationService;
    private final ObjectiveRegistry objectiveRegistry;
    private final ConflictRegistry conflictRegistry;

    @PostMapping
    public Mono<ResponseEntity<RecommendationResult>> recommend(@RequestBody RecommendationRequestDto body) {
        RecommendationRequest request = toRequest(body);
        return Mono.fromCallable(() -> recommendationService.recommend(request))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/sessions/{sessionId}")
    public Mono<ResponseEntity<Void>> closeSession(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> recommendationService.closeSession(sessionId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(closed -> closed
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }

    @GetMapping("/objectives")
    public Mono<ResponseEntity<List<ObjectiveDescriptorDto>>> listObjectives() {
        List<ObjectiveDescriptorDto> objectives = objectiveRegistry.all().stream()
                .map(this::toDescriptor)
                .toList();
        return Mono.just(ResponseEntity.ok(objectives));
    }

    private ObjectiveDescriptorDto toDescriptor(ObjectiveDefinition definition) {
        List<String> conflicts = conflictRegistry.all().stream()
                .filter(pair -> pair.involves(definition.getName()))
                .map(pair -> describeCounterpart(pair, definition.getName()))
                .toList();
        return ObjectiveDescriptorDto.builder()
                .name(definition.getName())
                .dimension(definition.getDimension())
                .direction(definition.getDirection().name().toLowerCase(Locale.ROOT))
                .description(definition.getDescription())
                .conflictsWith(conflicts)
                .build();
    }

    private static String describeCounterpart(ConflictPair pair, String name) {
        String other = pair.getFirst().equals(name) ? pair.getSecond() : pair.getFirst();
        return other + " (" + pair.getSeverity().name().toLowerCase(Locale.ROOT) + ")";
    }

    private static RecommendationRequest toRequest(RecommendationRequestDto body) {
        if (body == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        return RecommendationRequest.builder()
                .intent(body.getIntent())
                .objectiveOverrides(body.getObjectives() != null ? body.getObjectives() : Map.of())
                .sessionId(body.getSessionId())
                .parallelism(body.getParallelism())
                .preset(body.getPreset())
                .limit(body.getLimit())
                .build();
    }
}
