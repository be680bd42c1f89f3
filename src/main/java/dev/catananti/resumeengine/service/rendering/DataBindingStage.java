package dev.catananti.resumeengine.service.rendering;

import com.fasterxml.jackson.databind.JsonNode;
import dev.catananti.resumeengine.dto.DataBindingResult;
import dev.catananti.resumeengine.dto.RenderingError;
import dev.catananti.resumeengine.dto.RenderingWarning;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Delegates to the {@link DataBinder} and turns its findings into pipeline errors and warnings.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataBindingStage implements RenderingStage {

    private final DataBinder dataBinder;

    @Override
    public StageName name() {
        return StageName.DATA_BINDING;
    }

    @Override
    public Mono<Result> execute(RenderingContext context) {
        String stage = name().getKey();
        return dataBinder.bind(context.getTemplate(), context.getResumeData(),
                        context.getOptions().getCustomization())
                .map(binding -> toResult(stage, binding))
                .onErrorResume(error -> {
                    log.error("Data binding failed for template {}: {}", context.getTemplateId(), error.getMessage());
                    RenderingError failure = RenderingError.fatal(stage, "DATA_BINDING_ERROR", "Data binding failed",
                            Map.of("error", String.valueOf(error.getMessage())));
                    return Mono.just(new Result(Map.of(), null, List.of(failure), List.of()));
                });
    }

    private Result toResult(String stage, DataBindingResult binding) {
        List<RenderingError> errors = binding.errors().stream()
                .map(error -> {
                    Map<String, Object> details = new HashMap<>();
                    details.put("field", error.field());
                    details.put("section", error.section());
                    return new RenderingError(stage, error.code(), error.message(), details,
                            !DataBindingResult.REQUIRED_FIELD_MISSING.equals(error.code()));
                })
                .collect(Collectors.toList());
        List<RenderingWarning> warnings = binding.warnings().stream()
                .map(warning -> new RenderingWarning(stage, "DATA_BINDING_WARNING", warning.message(), warning.impact()))
                .collect(Collectors.toList());

        log.debug("Data binding stage completed: {} fields bound, {}% complete",
                binding.metadata().boundFields(), binding.metadata().dataCompleteness());
        return new Result(binding.data(), binding.metadata(), errors, warnings);
    }

    public record Result(Map<String, JsonNode> boundData, DataBindingResult.Metadata metadata,
                         List<RenderingError> errors, List<RenderingWarning> warnings) implements StageResult {

        @Override
        public void applyTo(RenderingContext context) {
            context.setBoundData(boundData);
            context.setBindingMetadata(metadata);
        }
    }
}
