package com.aldar.middleware.transcript;

import com.aldar.middleware.config.TranscriptProperties;
import com.aldar.middleware.model.ActiveStream;
import com.aldar.middleware.model.AgentRef;
import com.aldar.middleware.model.CanonicalMessage;
import com.aldar.middleware.model.LocalMessage;
import com.aldar.middleware.model.MessageRole;
import com.aldar.middleware.model.MessageSource;
import com.aldar.middleware.model.RunRecord;
import com.aldar.middleware.model.RunSummary;
import com.aldar.middleware.model.api.TranscriptPage;
import com.aldar.middleware.model.api.TranscriptQuery;
import com.aldar.middleware.transcript.source.AgentDirectory;
import com.aldar.middleware.transcript.source.AttachmentIndex;
import com.aldar.middleware.transcript.source.RunLogUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static com.aldar.middleware.transcript.TranscriptFixtures.SESSION_ID;
import static com.aldar.middleware.transcript.TranscriptFixtures.T0;
import static com.aldar.middleware.transcript.TranscriptFixtures.USER_ID;
import static com.aldar.middleware.transcript.TranscriptFixtures.childRun;
import static com.aldar.middleware.transcript.TranscriptFixtures.local;
import static com.aldar.middleware.transcript.TranscriptFixtures.run;
import static com.aldar.middleware.transcript.TranscriptFixtures.teamRun;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TranscriptReconcilerTest {

    private final AtomicReference<List<RunRecord>> runs = new AtomicReference<>(List.of());
    private final AtomicReference<RuntimeException> runLogFailure = new AtomicReference<>();
    private final List<LocalMessage> ledger = new ArrayList<>();
    private final AtomicReference<ActiveStream> marker = new AtomicReference<>();

    private TranscriptReconciler reconciler;

    @BeforeEach
    void setUp() {
        AgentDirectory agentDirectory = mock(AgentDirectory.class);
        when(agentDirectory.resolveAgentNames(anyCollection())).thenReturn(Map.of(
                "agent-coordinator", "Coordinator",
                "agent-weather", "Weather"
        ));
        when(agentDirectory.findAgentIdByName(anyString())).thenReturn(Optional.empty());
        AttachmentIndex attachmentIndex = mock(AttachmentIndex.class);
        TranscriptProperties properties = new TranscriptProperties();

        reconciler = new TranscriptReconciler(
                sessionId -> {
                    RuntimeException failure = runLogFailure.get();
                    if (failure != null) {
                        throw failure;
                    }
                    return runs.get();
                },
                (sessionId, userId) -> List.copyOf(ledger),
                sessionId -> Optional.ofNullable(marker.get()),
                new RunLogNormalizer(),
                new LedgerMatcher(properties),
                new MessageDeduplicator(properties),
                new TranscriptEnricher(agentDirectory, attachmentIndex, (messageId, userId) -> Optional.empty()),
                new StreamingOverlay(Clock.fixed(T0.plusSeconds(7_200), ZoneOffset.UTC)),
                new TranscriptPaginator(),
                properties
        );
    }

    @Test
    void simpleRunShouldRenderQuestionAndAnswer() {
        runs.set(List.of(run("run-1", T0, "hi", "hello")));
        ledger.add(local("local-1", MessageRole.USER, "hi", T0.minusSeconds(1)));

        TranscriptPage page = reconciler.reconcile(query(10, null));

        assertThat(page.messages()).extracting(CanonicalMessage::role, CanonicalMessage::content)
                .containsExactly(
                        tuple(MessageRole.USER, "hi"),
                        tuple(MessageRole.ASSISTANT, "hello"));
        assertThat(page.messages().get(0).messageId())
                .isEqualTo(MessageIdentity.assign(SESSION_ID, "run-1", MessageRole.USER, "hi", T0));
        assertThat(page.messages().get(0).localMessageId()).isEqualTo("local-1");
        assertThat(page.hasMore()).isFalse();
        assertThat(page.runLogAvailable()).isTrue();
        assertThat(page.runSummaries()).extracting(RunSummary::messageCount).containsExactly(2);
    }

    @Test
    void missingRunInputShouldBeFilledFromLedger() {
        runs.set(List.of(run("run-1", T0, null, "the answer")));
        ledger.add(local("local-q", MessageRole.USER, "the question", T0.minusSeconds(2)));

        TranscriptPage page = reconciler.reconcile(query(10, null));

        assertThat(page.messages()).extracting(CanonicalMessage::content).containsExactly("the question", "the answer");
        assertThat(page.messages().get(0).messageId()).isEqualTo("local-q");
        assertThat(page.messages().get(0).source()).isEqualTo(MessageSource.LEDGER);
    }

    @Test
    void delegatedRunShouldOnlyShowParentButListChildAgent() {
        runs.set(List.of(
                teamRun("run-parent", T0, "What is the weather?", "It is sunny today"),
                childRun("run-child", "run-parent", T0.plusSeconds(2), "agent-weather", "Weather", "sunny, 25C")
        ));

        TranscriptPage page = reconciler.reconcile(query(10, null));

        assertThat(page.messages()).hasSize(2);
        assertThat(page.messages()).extracting(CanonicalMessage::runId).containsOnly("run-parent");
        assertThat(page.messages().get(1).agentsInvolved()).contains(new AgentRef("agent-weather", "Weather"));
        assertThat(page.runSummaries()).extracting(RunSummary::runId).containsExactly("run-parent", "run-child");
        assertThat(page.runSummaries().get(0).childRunIds()).containsExactly("run-child");
        assertThat(page.runSummaries().get(1).messageCount()).isZero();
    }

    @Test
    void activeStreamShouldMarkPendingTurnAndAddPlaceholder() {
        runs.set(List.of(run("run-1", T0, "hi", "hello")));
        ledger.add(local("local-1", MessageRole.USER, "hi", T0.minusSeconds(1)));
        ledger.add(local("local-2", MessageRole.USER, "tell me more", T0.plusSeconds(60)));
        marker.set(new ActiveStream("stream-1", "streaming", SESSION_ID, "run-2", "user@example.com", null));

        TranscriptPage page = reconciler.reconcile(query(10, null));

        assertThat(page.messages()).hasSize(4);
        CanonicalMessage pending = page.messages().get(2);
        assertThat(pending.content()).isEqualTo("tell me more");
        assertThat(pending.streamId()).isEqualTo("stream-1");
        assertThat(pending.streamStatus()).isEqualTo("streaming");
        CanonicalMessage placeholder = page.messages().get(3);
        assertThat(placeholder.source()).isEqualTo(MessageSource.STREAM_PLACEHOLDER);
        assertThat(placeholder.streamStatus()).isEqualTo("streaming");
        assertThat(placeholder.content()).isEmpty();
    }

    @Test
    void unavailableRunLogShouldServeLedgerOnly() {
        runLogFailure.set(new RunLogUnavailableException(SESSION_ID, "timed out"));
        ledger.add(local("local-1", MessageRole.USER, "hi", T0));
        ledger.add(local("local-2", MessageRole.ASSISTANT, "hello", T0.plusSeconds(4)));

        TranscriptPage page = reconciler.reconcile(query(10, null));

        assertThat(page.runLogAvailable()).isFalse();
        assertThat(page.runSummaries()).isEmpty();
        assertThat(page.messages()).extracting(CanonicalMessage::messageId).containsExactly("local-1", "local-2");
    }

    @Test
    void reconcilingTwiceShouldGiveSameResult() {
        seedConversation();

        TranscriptPage first = reconciler.reconcile(query(20, null));
        TranscriptPage second = reconciler.reconcile(query(20, null));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void everyNonBlankLedgerMessageShouldBeRepresented() {
        seedConversation();

        TranscriptPage page = reconciler.reconcile(query(20, null));

        List<String> contents = page.messages().stream().map(CanonicalMessage::content).toList();
        for (LocalMessage local : ledger) {
            if (local.hasContent()) {
                assertThat(contents).anyMatch(content -> content.contains(local.content().trim()));
            }
        }
    }

    @Test
    void repeatedLedgerTextShouldEachBeRepresented() {
        runs.set(List.of(
                run("run-1", T0, "yes", "Noted."),
                run("run-2", T0.plusSeconds(120), "other", "Understood.")
        ));
        ledger.add(local("local-1", MessageRole.USER, "yes", T0.plusSeconds(1)));
        ledger.add(local("local-2", MessageRole.USER, "yes", T0.plusSeconds(60)));

        TranscriptPage page = reconciler.reconcile(query(20, null));

        assertThat(page.messages()).extracting(CanonicalMessage::localMessageId).contains("local-1", "local-2");
        assertThat(page.messages()).filteredOn(message -> "yes".equals(message.content())).hasSize(2);
    }

    @Test
    void liveMarkerOfFinishedRunShouldNotDuplicateItsReply() {
        runs.set(List.of(run("run-1", T0, "hi", "full answer")));
        ledger.add(local("local-1", MessageRole.USER, "hi", T0.minusSeconds(1)));
        marker.set(new ActiveStream("stream-1", "streaming", SESSION_ID, "run-1", "user@example.com", null));

        TranscriptPage page = reconciler.reconcile(query(10, null));

        assertThat(page.messages()).filteredOn(CanonicalMessage::isAssistant)
                .extracting(CanonicalMessage::runId, CanonicalMessage::content, CanonicalMessage::streamId)
                .containsExactly(tuple("run-1", "full answer", "stream-1"));
        assertThat(page.messages()).noneMatch(message -> message.source() == MessageSource.STREAM_PLACEHOLDER);
    }

    @Test
    void replyContainedInLaterRunsReplyShouldCollapse() {
        runs.set(List.of(
                run("run-1", T0, "first", "A"),
                run("run-2", T0.plusSeconds(60), "second", "A plus more text")
        ));

        TranscriptPage page = reconciler.reconcile(query(10, null));

        assertThat(page.messages()).filteredOn(CanonicalMessage::isAssistant)
                .extracting(CanonicalMessage::content)
                .containsExactly("A plus more text");
        assertThat(page.messages()).extracting(CanonicalMessage::content).contains("first", "second");
    }

    @Test
    void pagesShouldBeMonotonicAndDisjoint() {
        seedConversation();
        List<CanonicalMessage> all = reconciler.reconcile(query(20, null)).messages();

        TranscriptPage newest = reconciler.reconcile(query(3, null));
        TranscriptPage older = reconciler.reconcile(query(3, newest.messages().get(0).messageId()));

        assertThat(newest.hasMore()).isTrue();
        assertThat(older.messages()).doesNotContainAnyElementsOf(newest.messages());
        assertThat(older.messages().get(older.messages().size() - 1).timestamp())
                .isBeforeOrEqualTo(newest.messages().get(0).timestamp());
        assertThat(all.subList(all.size() - 3, all.size())).isEqualTo(newest.messages());
    }

    @Test
    void unknownCursorShouldGiveEmptyPage() {
        seedConversation();

        TranscriptPage page = reconciler.reconcile(query(5, "no-such-message"));

        assertThat(page.messages()).isEmpty();
        assertThat(page.hasMore()).isFalse();
    }

    private void seedConversation() {
        runs.set(List.of(
                run("run-1", T0, "hi", "hello"),
                run("run-2", T0.plusSeconds(60), null, "Here is the summary you asked for."),
                run("run-3", T0.plusSeconds(120), "and the risks?", "Risks are low.")
        ));
        ledger.add(local("local-1", MessageRole.USER, "hi", T0.minusSeconds(1)));
        ledger.add(local("local-2", MessageRole.USER, "summarize the report", T0.plusSeconds(59)));
        ledger.add(local("local-3", MessageRole.USER, "and the risks?", T0.plusSeconds(119), Map.of("client", "web")));
        ledger.add(local("local-4", MessageRole.USER, "thanks!", T0.plusSeconds(300)));
    }

    private static TranscriptQuery query(int limit, String before) {
        return new TranscriptQuery(SESSION_ID, USER_ID, limit, before, false);
    }
}
