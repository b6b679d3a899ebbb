package com.aldar.middleware.controller;

import com.aldar.middleware.model.Attachment;
import com.aldar.middleware.model.Feedback;
import com.aldar.middleware.model.LocalMessage;
import com.aldar.middleware.model.MessageRole;
import com.aldar.middleware.model.api.ApiResponse;
import com.aldar.middleware.model.api.AppendMessageRequest;
import com.aldar.middleware.model.api.AppendMessageResponse;
import com.aldar.middleware.model.api.AttachmentRequest;
import com.aldar.middleware.model.api.FeedbackRequest;
import com.aldar.middleware.model.api.LinkMessageRequest;
import com.aldar.middleware.security.ApiJwtAuthWebFilter;
import com.aldar.middleware.store.ChatLedgerStore;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Send-time writes into the local ledger. The transcript read path never calls these.
 */
@RestController
@RequestMapping("/api/chat")
public class ChatLedgerController {

    private static final Logger log = LoggerFactory.getLogger(ChatLedgerController.class);

    private final ChatLedgerStore ledgerStore;

    public ChatLedgerController(ChatLedgerStore ledgerStore) {
        this.ledgerStore = ledgerStore;
    }

    @PostMapping("/sessions/{sessionId}/messages")
    public Mono<ApiResponse<AppendMessageResponse>> appendMessage(
            @PathVariable String sessionId,
            @Valid @RequestBody AppendMessageRequest request,
            ServerWebExchange exchange
    ) {
        MessageRole role = StringUtils.hasText(request.role())
                ? MessageRole.from(request.role())
                .orElseThrow(() -> new IllegalArgumentException("unknown role: " + request.role()))
                : MessageRole.USER;
        LocalMessage message = new LocalMessage(
                request.messageId(),
                sessionId,
                role,
                request.content(),
                null,
                request.agentId(),
                request.metadata()
        );
        String userId = ApiJwtAuthWebFilter.currentUserId(exchange);
        return Mono.fromCallable(() -> ledgerStore.appendMessage(message, userId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(stored -> ApiResponse.success(
                        new AppendMessageResponse(stored.id(), stored.sessionId(), stored.createdAt())));
    }

    @PutMapping("/messages/{messageId}/links")
    public Mono<ApiResponse<Map<String, Boolean>>> linkMessage(
            @PathVariable String messageId,
            @RequestBody LinkMessageRequest request
    ) {
        if (!StringUtils.hasText(request.streamId()) && !StringUtils.hasText(request.runId())) {
            return Mono.error(new IllegalArgumentException("stream_id or run_id is required"));
        }
        return Mono.fromCallable(() -> {
                    boolean linked = false;
                    if (StringUtils.hasText(request.streamId())) {
                        linked = ledgerStore.attachStreamId(messageId, request.streamId());
                    }
                    if (StringUtils.hasText(request.runId())) {
                        linked = ledgerStore.attachRunId(messageId, request.runId()) || linked;
                    }
                    if (!linked) {
                        throw new IllegalArgumentException("message not found: " + messageId);
                    }
                    log.debug("Linked ledger message messageId={}, streamId={}, runId={}",
                            messageId, request.streamId(), request.runId());
                    return Map.of("linked", true);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .map(ApiResponse::success);
    }

    @PostMapping("/messages/{messageId}/attachments")
    public Mono<ApiResponse<Attachment>> addAttachment(
            @PathVariable String messageId,
            @Valid @RequestBody AttachmentRequest request
    ) {
        Attachment attachment = new Attachment(
                request.attachmentId(),
                request.fileName(),
                request.fileSize(),
                request.contentType(),
                request.url()
        );
        return Mono.fromCallable(() -> ledgerStore.addAttachment(messageId, attachment))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ApiResponse::success);
    }

    @PutMapping("/messages/{messageId}/feedback")
    public Mono<ApiResponse<Feedback>> saveFeedback(
            @PathVariable String messageId,
            @Valid @RequestBody FeedbackRequest request,
            ServerWebExchange exchange
    ) {
        String userId = ApiJwtAuthWebFilter.currentUserId(exchange);
        if (!StringUtils.hasText(userId)) {
            return Mono.error(new IllegalArgumentException("feedback requires an authenticated user"));
        }
        return Mono.fromCallable(() -> ledgerStore.saveFeedback(messageId, userId, request.rating(), request.comment()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ApiResponse::success);
    }
}
