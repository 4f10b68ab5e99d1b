package com.ocadapter.service.impl.fallback;

import com.ocadapter.model.ToolDefinition;
import com.ocadapter.model.UnifiedResponse;
import com.ocadapter.service.impl.dto.DecisionContext;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Without a model decision, treats an information question as a call to the catalog's
 * context/status/query tool with no arguments. Never applies right after a tool has run.
 */
@Component
public class QueryToolHeuristicStage implements DecisionStage {

    private static final List<Pattern> QUERY_PATTERNS = List.of(
            Pattern.compile("是.*嗎"),
            Pattern.compile("現在.*是"),
            Pattern.compile("什麼.*狀態"),
            Pattern.compile("^請問"),
            Pattern.compile("^is\\s", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^are\\s", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bstatus\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bstate\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^what", Pattern.CASE_INSENSITIVE));

    private static final List<String> QUERY_TOOL_MARKERS = List.of("context", "status", "query");

    @Override
    public String name() {
        return "query-tool-heuristic";
    }

    @Override
    public Mono<StageOutcome> attempt(DecisionContext context) {
        if (context.hasToolResult()) {
            return Mono.just(StageOutcome.declined("conversation already ends in a tool result"));
        }
        if (!isQueryRequest(context.userMessage())) {
            return Mono.just(StageOutcome.declined("user message is not an information query"));
        }
        return Mono.just(findQueryTool(context.tools())
                .map(tool -> StageOutcome.produced(UnifiedResponse.toolCall(tool.name(), Map.of())))
                .orElseGet(() -> StageOutcome.declined("no context/status/query tool in catalog")));
    }

    static boolean isQueryRequest(String userMessage) {
        if (userMessage == null || userMessage.isEmpty()) {
            return false;
        }
        return QUERY_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(userMessage).find());
    }

    static Optional<ToolDefinition> findQueryTool(List<ToolDefinition> tools) {
        return tools.stream()
                .filter(tool -> {
                    String name = tool.name().toLowerCase(Locale.ROOT);
                    return QUERY_TOOL_MARKERS.stream().anyMatch(name::contains);
                })
                .findFirst();
    }
}
