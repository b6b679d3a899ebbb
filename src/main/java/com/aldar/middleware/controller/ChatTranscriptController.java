package com.aldar.middleware.controller;

import com.aldar.middleware.config.TranscriptProperties;
import com.aldar.middleware.model.api.ApiResponse;
import com.aldar.middleware.model.api.TranscriptPage;
import com.aldar.middleware.model.api.TranscriptQuery;
import com.aldar.middleware.security.ApiJwtAuthWebFilter;
import com.aldar.middleware.transcript.TranscriptReconciler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/chat")
public class ChatTranscriptController {

    private final TranscriptReconciler transcriptReconciler;
    private final TranscriptProperties properties;

    public ChatTranscriptController(TranscriptReconciler transcriptReconciler, TranscriptProperties properties) {
        this.transcriptReconciler = transcriptReconciler;
        this.properties = properties;
    }

    @GetMapping("/sessions/{sessionId}/messages")
    public Mono<ApiResponse<TranscriptPage>> messages(
            @PathVariable String sessionId,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "before_message_id", required = false) String beforeMessageId,
            @RequestParam(name = "include_system", defaultValue = "false") boolean includeSystem,
            ServerWebExchange exchange
    ) {
        int pageSize = limit == null ? properties.getDefaultLimit() : limit;
        if (pageSize < 1 || pageSize > properties.getMaxLimit()) {
            return Mono.error(new IllegalArgumentException(
                    "limit must be between 1 and " + properties.getMaxLimit()));
        }
        TranscriptQuery query = new TranscriptQuery(
                sessionId,
                ApiJwtAuthWebFilter.currentUserId(exchange),
                pageSize,
                beforeMessageId,
                includeSystem
        );
        return Mono.fromCallable(() -> transcriptReconciler.reconcile(query))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ApiResponse::success);
    }
}
