package com.aldar.middleware.transcript;

import com.aldar.middleware.model.AgentRef;
import com.aldar.middleware.model.Attachment;
import com.aldar.middleware.model.CanonicalMessage;
import com.aldar.middleware.model.Feedback;
import com.aldar.middleware.model.MemberResponse;
import com.aldar.middleware.model.RunEvent;
import com.aldar.middleware.model.RunRecord;
import com.aldar.middleware.model.RunSummary;
import com.aldar.middleware.transcript.source.AgentDirectory;
import com.aldar.middleware.transcript.source.AttachmentIndex;
import com.aldar.middleware.transcript.source.FeedbackStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Attaches display data the run log does not carry: current agent names, attachments,
 * the caller's feedback and the agents that took part in each run. Lookup failures only
 * cost the affected field.
 */
@Component
public class TranscriptEnricher {

    private static final Logger log = LoggerFactory.getLogger(TranscriptEnricher.class);

    private final AgentDirectory agentDirectory;
    private final AttachmentIndex attachmentIndex;
    private final FeedbackStore feedbackStore;

    public TranscriptEnricher(AgentDirectory agentDirectory, AttachmentIndex attachmentIndex, FeedbackStore feedbackStore) {
        this.agentDirectory = agentDirectory;
        this.attachmentIndex = attachmentIndex;
        this.feedbackStore = feedbackStore;
    }

    public EnrichedTranscript enrich(
            String sessionId,
            String userId,
            List<CanonicalMessage> messages,
            NormalizedRunLog runLog
    ) {
        Map<String, String> names = resolveNames(collectAgentIds(messages, runLog));
        Map<String, Optional<String>> idsByName = new HashMap<>();

        Map<String, List<AgentRef>> agentsByRun = new LinkedHashMap<>();
        for (RunSummary summary : runLog.summaries()) {
            agentsByRun.put(summary.runId(), agentsInvolved(summary.runId(), runLog, names, idsByName));
        }

        List<CanonicalMessage> enriched = new ArrayList<>(messages.size());
        for (CanonicalMessage message : messages) {
            CanonicalMessage current = message;
            if (current.agentId() != null && names.containsKey(current.agentId())) {
                current = current.withAgentName(names.get(current.agentId()));
            }
            if (current.teamId() != null && names.containsKey(current.teamId())) {
                current = current.withTeamName(names.get(current.teamId()));
            }
            current = current.withAttachments(attachments(sessionId, current));
            if (current.isAssistant()) {
                List<AgentRef> agents = current.runId() == null ? null : agentsByRun.get(current.runId());
                if (agents != null) {
                    current = current.withAgentsInvolved(agents);
                }
                Feedback feedback = feedback(current, userId);
                if (feedback != null) {
                    current = current.withFeedback(feedback);
                }
            }
            enriched.add(current);
        }

        List<RunSummary> summaries = new ArrayList<>(runLog.summaries().size());
        for (RunSummary summary : runLog.summaries()) {
            summaries.add(summary
                    .withNames(currentName(names, summary.agentId(), summary.agentName()),
                            currentName(names, summary.teamId(), summary.teamName()))
                    .withAgentsInvolved(agentsByRun.getOrDefault(summary.runId(), List.of())));
        }
        return new EnrichedTranscript(enriched, summaries);
    }

    List<AgentRef> agentsInvolved(
            String runId,
            NormalizedRunLog runLog,
            Map<String, String> names,
            Map<String, Optional<String>> idsByName
    ) {
        RunRecord run = runLog.runsById().get(runId);
        if (run == null) {
            return List.of();
        }
        List<AgentRef> raw = new ArrayList<>();
        List<String> children = runLog.childRunIds(runId);
        boolean delegation = StringUtils.hasText(run.teamId()) || !run.memberResponses().isEmpty() || !children.isEmpty();
        if (delegation) {
            raw.add(new AgentRef(run.agentId(), run.agentName()));
        }
        collectParticipants(run, raw);

        Set<String> visited = new HashSet<>();
        visited.add(runId);
        List<String> pending = new ArrayList<>(children);
        while (!pending.isEmpty()) {
            String childId = pending.remove(0);
            if (!visited.add(childId)) {
                continue;
            }
            RunRecord child = runLog.runsById().get(childId);
            if (child == null) {
                continue;
            }
            raw.add(new AgentRef(child.agentId(), child.agentName()));
            collectParticipants(child, raw);
            pending.addAll(runLog.childRunIds(childId));
        }

        Map<String, AgentRef> unique = new LinkedHashMap<>();
        for (AgentRef ref : raw) {
            AgentRef resolved = resolve(ref, names, idsByName);
            if (resolved == null) {
                continue;
            }
            String key = resolved.agentId() != null
                    ? "id:" + resolved.agentId()
                    : "name:" + resolved.agentName().toLowerCase(Locale.ROOT);
            AgentRef existing = unique.get(key);
            if (existing == null || existing.agentName() == null) {
                unique.put(key, resolved);
            }
        }
        return List.copyOf(unique.values());
    }

    private static void collectParticipants(RunRecord run, List<AgentRef> sink) {
        for (MemberResponse member : run.memberResponses()) {
            String id = StringUtils.hasText(member.agentId()) ? member.agentId() : member.agentPublicId();
            sink.add(new AgentRef(id, member.agentName()));
        }
        for (RunEvent event : run.events()) {
            sink.add(new AgentRef(event.agentId(), event.agentName()));
        }
    }

    private AgentRef resolve(AgentRef ref, Map<String, String> names, Map<String, Optional<String>> idsByName) {
        String id = StringUtils.hasText(ref.agentId()) ? ref.agentId().trim() : null;
        String name = StringUtils.hasText(ref.agentName()) ? ref.agentName().trim() : null;
        if (id == null && name == null) {
            return null;
        }
        if (id != null && names.containsKey(id)) {
            return new AgentRef(id, names.get(id));
        }
        if (name != null) {
            Optional<String> canonical = idsByName.computeIfAbsent(name.toLowerCase(Locale.ROOT), key -> lookupIdByName(name));
            if (canonical.isPresent()) {
                return new AgentRef(canonical.get(), name);
            }
        }
        return new AgentRef(id, name);
    }

    private Optional<String> lookupIdByName(String name) {
        try {
            return agentDirectory.findAgentIdByName(name);
        } catch (RuntimeException ex) {
            log.warn("Agent id lookup by name failed name={}", name, ex);
            return Optional.empty();
        }
    }

    private List<Attachment> attachments(String sessionId, CanonicalMessage message) {
        Map<String, Attachment> merged = new LinkedHashMap<>();
        addAll(merged, message.attachments());
        try {
            if (message.messageId() != null) {
                addAll(merged, attachmentIndex.listAttachments(message.messageId()));
            }
            if (message.localMessageId() != null && !message.localMessageId().equalsIgnoreCase(message.messageId())) {
                addAll(merged, attachmentIndex.listAttachments(message.localMessageId()));
            }
            if (merged.isEmpty() && !message.content().isBlank() && message.role() != null) {
                addAll(merged, attachmentIndex.findByContentSignature(
                        sessionId, message.role().wireName(), ContentText.signature(message.content())));
            }
        } catch (RuntimeException ex) {
            log.warn("Attachment lookup failed sessionId={}, messageId={}", sessionId, message.messageId(), ex);
        }
        return new ArrayList<>(merged.values());
    }

    private static void addAll(Map<String, Attachment> merged, List<Attachment> attachments) {
        if (attachments == null) {
            return;
        }
        for (Attachment attachment : attachments) {
            if (attachment == null) {
                continue;
            }
            String key = attachment.attachmentId() != null ? attachment.attachmentId() : attachment.url();
            if (key != null) {
                merged.putIfAbsent(key.toLowerCase(Locale.ROOT), attachment);
            }
        }
    }

    private Feedback feedback(CanonicalMessage message, String userId) {
        if (!StringUtils.hasText(userId)) {
            return null;
        }
        try {
            Optional<Feedback> found = message.messageId() == null
                    ? Optional.empty()
                    : feedbackStore.getFeedback(message.messageId(), userId);
            if (found.isEmpty() && message.localMessageId() != null) {
                found = feedbackStore.getFeedback(message.localMessageId(), userId);
            }
            return found.orElse(null);
        } catch (RuntimeException ex) {
            log.warn("Feedback lookup failed messageId={}", message.messageId(), ex);
            return null;
        }
    }

    private Map<String, String> resolveNames(Set<String> agentIds) {
        if (agentIds.isEmpty()) {
            return Map.of();
        }
        try {
            Map<String, String> names = agentDirectory.resolveAgentNames(agentIds);
            return names == null ? Map.of() : names;
        } catch (RuntimeException ex) {
            log.warn("Agent name lookup failed, keeping names from the run log count={}", agentIds.size(), ex);
            return Map.of();
        }
    }

    private static Set<String> collectAgentIds(List<CanonicalMessage> messages, NormalizedRunLog runLog) {
        Set<String> ids = new LinkedHashSet<>();
        for (CanonicalMessage message : messages) {
            addId(ids, message.agentId());
            addId(ids, message.teamId());
        }
        for (RunRecord run : runLog.runsById().values()) {
            addId(ids, run.agentId());
            addId(ids, run.teamId());
            run.memberResponses().forEach(member -> {
                addId(ids, member.agentId());
                addId(ids, member.agentPublicId());
            });
            run.events().forEach(event -> addId(ids, event.agentId()));
        }
        return ids;
    }

    private static void addId(Set<String> ids, String id) {
        if (StringUtils.hasText(id)) {
            ids.add(id.trim());
        }
    }

    private static String currentName(Map<String, String> names, String id, String historical) {
        if (id != null && names.containsKey(id)) {
            return names.get(id);
        }
        return historical;
    }
}
